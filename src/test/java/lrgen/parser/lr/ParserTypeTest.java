package lrgen.parser.lr;

import org.junit.jupiter.api.Test;

import lrgen.LRGenException;

import static org.junit.jupiter.api.Assertions.*;

public class ParserTypeTest {

	@Test
	public void testFromName(){
		assertEquals(ParserType.LR0, ParserType.fromName("lr0"));
		assertEquals(ParserType.SLR1, ParserType.fromName("SLR1"));
		assertThrows(LRGenException.class, () -> ParserType.fromName("lalr1"));
	}

	@Test
	public void testDisplayName(){
		assertEquals("LR(0)", ParserType.LR0.toString());
		assertEquals("SLR(1)", ParserType.SLR1.toString());
	}
}
