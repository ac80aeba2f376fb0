package lrgen;

import java.io.ByteArrayOutputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import static org.junit.jupiter.api.Assertions.*;

public class MainTest {

	@TempDir
	Path tmp;

	private Path grammarFile;

	private final ByteArrayOutputStream out = new ByteArrayOutputStream();

	private final ByteArrayOutputStream err = new ByteArrayOutputStream();

	@BeforeEach
	public void writeGrammar() throws Exception {
		grammarFile = tmp.resolve("expressions.grammar");
		Files.write(grammarFile, TestGrammars.EXPRESSIONS.getBytes(StandardCharsets.UTF_8));
	}

	private int run(String... args){
		return Main.run(args, out, err);
	}

	private String out(){
		return new String(out.toByteArray(), StandardCharsets.UTF_8);
	}

	private String err(){
		return new String(err.toByteArray(), StandardCharsets.UTF_8);
	}

	@Test
	public void testGenerate(){
		assertEquals(0, run("generate", grammarFile.toString(), "slr1"));
		assertTrue(out().contains("\"num_states\" : 13"));
		assertTrue(out().contains("\"is_slr1\" : true"));
	}

	@Test
	public void testOutputIsUtf8(){
		assertEquals(0, run("generate", grammarFile.toString(), "lr0"));
		assertTrue(out().contains("E → T + E"));
		assertTrue(out().contains("E → T • + E"));
		assertEquals(0, run("dot", grammarFile.toString()));
		assertTrue(out().contains("T → F * • T"));
	}

	@Test
	public void testGenerateWithDefaultType(){
		assertEquals(0, run("generate", grammarFile.toString()));
		assertTrue(out().contains("\"parser_type\" : \"lr0\""));
		assertTrue(out().contains("\"is_lr0\" : false"));
	}

	@Test
	public void testParse(){
		assertEquals(0, run("parse", grammarFile.toString(), "id + id * id", "slr1"));
		assertTrue(out().contains("\"accepted\" : true"));
	}

	@Test
	public void testRejectedInputIsNoFailure(){
		assertEquals(0, run("parse", grammarFile.toString(), "id +", "slr1"));
		assertTrue(out().contains("\"accepted\" : false"));
	}

	@Test
	public void testDot() throws Exception {
		assertEquals(0, run("dot", grammarFile.toString()));
		assertTrue(out().contains("digraph"));
		Path dotFile = tmp.resolve("automaton.dot");
		assertEquals(0, run("dot", grammarFile.toString(), dotFile.toString()));
		assertTrue(new String(Files.readAllBytes(dotFile), StandardCharsets.UTF_8).contains("state12"));
	}

	@Test
	public void testInvalidGrammar() throws Exception {
		Path invalid = tmp.resolve("invalid.grammar");
		Files.write(invalid, "S a b".getBytes(StandardCharsets.UTF_8));
		assertEquals(1, run("generate", invalid.toString()));
		assertTrue(err().startsWith("Invalid grammar"));
	}

	@Test
	public void testUsage(){
		assertEquals(1, run());
		assertEquals(1, run("generate"));
		assertEquals(1, run("compile", grammarFile.toString()));
		assertEquals(1, run("parse", grammarFile.toString()));
		assertEquals(1, run("generate", grammarFile.toString(), "lalr1"));
		assertEquals(1, run("generate", tmp.resolve("missing").toString()));
		assertTrue(err().contains("Usage"));
	}
}
