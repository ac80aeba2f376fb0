package lrgen;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

import lrgen.parser.lr.ParserType;

import static org.junit.jupiter.api.Assertions.*;

public class ConfigTest {

	@AfterEach
	public void clearProperties(){
		System.clearProperty("lrgen.maxParseSteps");
		System.clearProperty("lrgen.parserType");
		System.clearProperty("lrgen.rejectConflicts");
	}

	@Test
	public void testDefaults(){
		assertEquals(ParserType.LR0, Config.parserType());
		assertEquals(10000, Config.maxParseSteps());
		assertEquals(16, Config.cacheSize());
		assertFalse(Config.rejectConflicts());
	}

	@Test
	public void testSystemProperties(){
		System.setProperty("lrgen.maxParseSteps", " 5 ");
		System.setProperty("lrgen.parserType", "SLR1");
		System.setProperty("lrgen.rejectConflicts", "yes");
		assertEquals(5, Config.maxParseSteps());
		assertEquals(ParserType.SLR1, Config.parserType());
		assertTrue(Config.rejectConflicts());
	}

	@Test
	public void testInvalidNumber(){
		System.setProperty("lrgen.maxParseSteps", "many");
		assertThrows(LRGenException.class, Config::maxParseSteps);
	}
}
