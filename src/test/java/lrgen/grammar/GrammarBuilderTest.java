package lrgen.grammar;

import java.util.Arrays;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import static org.junit.jupiter.api.Assertions.*;

public class GrammarBuilderTest {

	@Test
	public void testNonTerminalsAreLeftHandSides(){
		Grammar grammar = new GrammarBuilder().add("S", "A", "b").add("A", "a").toGrammar();
		assertEquals(Arrays.asList(new NonTerminal("S"), new NonTerminal("A")),
				Arrays.asList(grammar.getNonTerminals().toArray()));
		assertEquals(Arrays.asList(new Terminal("b"), new Terminal("a")),
				Arrays.asList(grammar.getTerminals().toArray()));
		assertTrue(grammar.getProduction(0).right.get(0).isNonTerminal());
	}

	@Test
	public void testStartSymbolIsFirstLeftHandSide(){
		Grammar grammar = new GrammarBuilder().add("X", "y").add("Y", "X").toGrammar();
		assertEquals(new NonTerminal("X"), grammar.getStart());
		assertEquals(new NonTerminal("Y"), new GrammarBuilder().add("X", "y").add("Y", "X").toGrammar("Y").getStart());
	}

	@Test
	public void testEpsilonProduction(){
		Grammar grammar = new GrammarBuilder().add("S", "a", "S").add("S").toGrammar();
		assertTrue(grammar.getProduction(1).isEpsilonProduction());
		assertEquals("S → ε", grammar.getProduction(1).toString());
	}

	@Test
	public void testUnknownStartSymbol(){
		assertThrows(InvalidGrammarException.class, () -> new GrammarBuilder().add("S", "a").toGrammar("T"));
	}

	@Test
	public void testEmptyBuilder(){
		assertThrows(InvalidGrammarException.class, () -> new GrammarBuilder().toGrammar());
	}

	@ParameterizedTest
	@ValueSource(strings = {"$", "ε", "", " ", " a"})
	public void testInvalidNames(String name){
		assertThrows(InvalidGrammarException.class, () -> new GrammarBuilder().add("S", "a", name));
		assertThrows(InvalidGrammarException.class, () -> new GrammarBuilder().add(name, "a"));
	}
}
