package lrgen.grammar;

import java.util.Arrays;
import java.util.Collections;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import static org.junit.jupiter.api.Assertions.*;

public class GrammarParserTest {

	@Test
	public void testAlternatives(){
		Grammar grammar = GrammarParser.parse("E -> E + T | T\nT -> id");
		assertEquals(3, grammar.getProductions().size());
		assertEquals("E → E + T", grammar.getProduction(0).toString());
		assertEquals("E → T", grammar.getProduction(1).toString());
		assertEquals("T → id", grammar.getProduction(2).toString());
	}

	@Test
	public void testCommentsAndBlankLines(){
		Grammar grammar = GrammarParser.parse("# start\n\nS -> a\n   \n  # another comment\nS -> b\n");
		assertEquals(2, grammar.getProductions().size());
		assertEquals(new NonTerminal("S"), grammar.getStart());
	}

	@ParameterizedTest
	@ValueSource(strings = {"S -> ε", "S -> epsilon", "S ->   ε  "})
	public void testEpsilon(String text){
		assertTrue(GrammarParser.parse(text).getProduction(0).isEpsilonProduction());
	}

	@Test
	public void testEpsilonAlternative(){
		Grammar grammar = GrammarParser.parse("A -> a A | ε");
		assertEquals(Collections.emptyList(), grammar.getProduction(1).right);
	}

	@Test
	public void testQuotedSymbols(){
		Grammar grammar = GrammarParser.parse("E -> E '+' T | T\nT -> \"a b\"");
		assertEquals(new Terminal("'+'"), grammar.getProduction(0).right.get(1));
		assertEquals(new Terminal("\"a b\""), grammar.getProduction(2).right.get(0));
	}

	@Test
	public void testQuotedBar(){
		Grammar grammar = GrammarParser.parse("S -> '|' | a");
		assertEquals(2, grammar.getProductions().size());
		assertEquals(new Terminal("'|'"), grammar.getProduction(0).right.get(0));
	}

	@Test
	public void testPrimedSymbols(){
		Grammar grammar = GrammarParser.parse("E -> T E'\nE' -> '+' T E' | ε\nT -> id");
		assertEquals(Arrays.asList(new NonTerminal("T"), new NonTerminal("E'")), grammar.getProduction(0).right);
		assertEquals(new NonTerminal("E'"), grammar.getProduction(1).left);
		assertEquals(Arrays.asList(new Terminal("'+'"), new NonTerminal("T"), new NonTerminal("E'")),
				grammar.getProduction(1).right);
		assertEquals(4, grammar.getProductions().size());
	}

	@ParameterizedTest
	@ValueSource(strings = {"", "  \n ", "S", "S a b", "-> a", "A B -> c", "A ->", "A -> a |", "A -> | a",
			"# only a comment"})
	public void testInvalidGrammars(String text){
		assertThrows(InvalidGrammarException.class, () -> GrammarParser.parse(text));
	}

	@Test
	public void testMissingInput(){
		InvalidGrammarException ex = assertThrows(InvalidGrammarException.class, () -> GrammarParser.parse(null));
		assertEquals("Grammar input is required", ex.getMessage());
	}

	@Test
	public void testSplit(){
		assertEquals(Arrays.asList("a", "'b c'", "d"), GrammarParser.split(" a  'b c'\td ", ' '));
		assertEquals(Arrays.asList("a b", "", "c"), GrammarParser.split("a b||c", '|'));
		assertEquals(Arrays.asList("S'", "x"), GrammarParser.split("S' x", ' '));
		assertEquals(Arrays.asList("a '|' b", "c"), GrammarParser.split("a '|' b | c", '|'));
	}
}
