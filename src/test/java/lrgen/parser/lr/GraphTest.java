package lrgen.parser.lr;

import java.util.Arrays;
import java.util.Collections;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import lrgen.grammar.NonTerminal;
import lrgen.grammar.Terminal;

import static lrgen.TestGrammars.*;
import static org.junit.jupiter.api.Assertions.*;

public class GraphTest {

	@ParameterizedTest
	@CsvSource({"RIGHT_RECURSIVE, 6", "PARENTHESES, 7", "EXPRESSIONS, 13", "EPSILON, 5", "REDUCE_REDUCE, 5"})
	public void testNumberOfStates(String grammarName, int states) throws Exception {
		String text = (String)lrgen.TestGrammars.class.getField(grammarName).get(null);
		assertEquals(states, Graph.createFromGrammar(grammar(text)).getStates().size());
	}

	@Test
	public void testStatesInDiscoveryOrder(){
		Graph graph = Graph.createFromGrammar(grammar(RIGHT_RECURSIVE));
		assertEquals(Arrays.asList("S' → • S", "S → • A", "A → • a A", "A → • b"),
				graph.getStartState().itemSet().toStrings());
		assertEquals(Arrays.asList("A → • a A", "A → a • A", "A → • b"), graph.getState(1).itemSet().toStrings());
		assertEquals(Collections.singletonList("A → b •"), graph.getState(2).itemSet().toStrings());
		assertEquals(Collections.singletonList("S' → S •"), graph.getState(3).itemSet().toStrings());
		assertEquals(Collections.singletonList("S → A •"), graph.getState(4).itemSet().toStrings());
		assertEquals(Collections.singletonList("A → a A •"), graph.getState(5).itemSet().toStrings());
	}

	@Test
	public void testTransitions(){
		Graph graph = Graph.createFromGrammar(grammar(RIGHT_RECURSIVE));
		assertEquals(Arrays.asList(
				new Transition(0, new Terminal("a"), 1),
				new Transition(0, new Terminal("b"), 2),
				new Transition(0, new NonTerminal("S"), 3),
				new Transition(0, new NonTerminal("A"), 4),
				new Transition(1, new Terminal("a"), 1),
				new Transition(1, new Terminal("b"), 2),
				new Transition(1, new NonTerminal("A"), 5)), graph.getTransitions());
		assertEquals(1, graph.transition(1, new Terminal("a")).getAsInt());
		assertFalse(graph.transition(2, new Terminal("a")).isPresent());
	}

	@Test
	public void testStatesAreUnique(){
		Graph graph = Graph.createFromGrammar(grammar(EXPRESSIONS));
		for (State state : graph.getStates()){
			for (State other : graph.getStates()){
				if (state != other){
					assertNotEquals(state.itemSet(), other.itemSet());
				}
			}
		}
	}

	@Test
	public void testDeterminism(){
		Graph first = Graph.createFromGrammar(grammar(EXPRESSIONS));
		Graph second = Graph.createFromGrammar(grammar(EXPRESSIONS));
		assertEquals(first.toString(), second.toString());
		assertEquals(first.getTransitions(), second.getTransitions());
		for (ParserType type : ParserType.values()){
			LRParserTable firstTable = first.toParserTable(type);
			LRParserTable secondTable = second.toParserTable(type);
			assertEquals(firstTable.toString(), secondTable.toString());
			assertEquals(firstTable.getConflicts(), secondTable.getConflicts());
		}
		assertEquals(Graph.createFromGrammar(grammar(REDUCE_REDUCE)).toParserTable(ParserType.LR0).getConflicts(),
				Graph.createFromGrammar(grammar(REDUCE_REDUCE)).toParserTable(ParserType.LR0).getConflicts());
	}

	@Test
	public void testAugmentsGrammar(){
		Graph graph = Graph.createFromGrammar(grammar(RIGHT_RECURSIVE));
		assertTrue(graph.getGrammar().isAugmented());
		assertEquals(6, Graph.createFromGrammar(graph.getGrammar()).getStates().size());
	}

	@Test
	public void testGraphviz(){
		String dot = Graph.createFromGrammar(grammar(RIGHT_RECURSIVE)).toGraphvizString();
		assertTrue(dot.contains("digraph"));
		for (int i = 0; i < 6; i++){
			assertTrue(dot.contains("state" + i));
		}
		assertTrue(dot.contains("A → a • A"));
	}
}
