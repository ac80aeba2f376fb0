package lrgen.grammar;

import java.util.Arrays;
import java.util.Collections;
import java.util.HashSet;
import java.util.Set;

import org.junit.jupiter.api.Test;

import static lrgen.TestGrammars.*;
import static org.junit.jupiter.api.Assertions.*;

public class FirstFollowSetsTest {

	@Test
	public void testExpressionGrammar(){
		FirstFollowSets sets = grammar(EXPRESSIONS).getFirstFollowSets();
		for (String name : Arrays.asList("S", "E", "T", "F")){
			assertEquals(terminals("(", "id"), sets.first(new NonTerminal(name)), name);
		}
		assertEquals(terminals("$"), sets.follow(new NonTerminal("S")));
		assertEquals(terminals("$", ")"), sets.follow(new NonTerminal("E")));
		assertEquals(terminals("+", "$", ")"), sets.follow(new NonTerminal("T")));
		assertEquals(terminals("*", "+", "$", ")"), sets.follow(new NonTerminal("F")));
	}

	@Test
	public void testAugmentedGrammar(){
		FirstFollowSets sets = grammar(EXPRESSIONS).augment().getFirstFollowSets();
		assertEquals(terminals("$"), sets.follow(new NonTerminal("S'")));
		assertEquals(terminals("$"), sets.follow(new NonTerminal("S")));
	}

	@Test
	public void testEpsilon(){
		FirstFollowSets sets = grammar(EPSILON).getFirstFollowSets();
		NonTerminal a = new NonTerminal("A");
		assertTrue(sets.isEpsilonable(a));
		assertTrue(sets.isEpsilonable(new NonTerminal("S")));
		assertFalse(sets.isEpsilonable(new Terminal("a")));
		assertEquals(terminals("a", "ε"), sets.first(a));
		assertEquals(terminals("$"), sets.follow(a));
	}

	@Test
	public void testEpsilonSequences(){
		FirstFollowSets sets = grammar("S -> A B c\nA -> a | ε\nB -> b | ε").getFirstFollowSets();
		assertEquals(terminals("a", "b", "c"), sets.first(new NonTerminal("S")));
		assertEquals(terminals("b", "c"), sets.follow(new NonTerminal("A")));
		assertEquals(terminals("c"), sets.follow(new NonTerminal("B")));
		assertEquals(terminals("a", "b", "ε"), sets.firstOfString(Arrays.asList(new NonTerminal("A"), new NonTerminal("B"))));
		assertEquals(terminals("ε"), sets.firstOfString(Collections.emptyList()));
	}

	@Test
	public void testFollowSetsNeverContainEpsilon(){
		FirstFollowSets sets = grammar("S -> A B\nA -> a | ε\nB -> ε").getFirstFollowSets();
		for (Set<Terminal> follow : sets.getFollowSets().values()){
			assertFalse(follow.contains(Terminal.EPSILON));
		}
		assertEquals(terminals("$"), sets.follow(new NonTerminal("A")));
	}

	@Test
	public void testFollowPropagatesThroughCycles(){
		FirstFollowSets sets = grammar("S -> A x\nA -> B\nB -> A | y").getFirstFollowSets();
		assertEquals(terminals("x"), sets.follow(new NonTerminal("A")));
		assertEquals(terminals("x"), sets.follow(new NonTerminal("B")));
	}

	@Test
	public void testToString(){
		assertEquals("S: FIRST = [a, ε], FOLLOW = [$]\nA: FIRST = [a, ε], FOLLOW = [$]",
				grammar(EPSILON).getFirstFollowSets().toString());
	}

	@Test
	public void testTerminals(){
		FirstFollowSets sets = grammar(EXPRESSIONS).getFirstFollowSets();
		assertEquals(terminals("id"), sets.first(new Terminal("id")));
		assertEquals(terminals("$"), sets.first(Terminal.END_MARKER));
	}

	@Test
	public void testUnknownNonTerminal(){
		FirstFollowSets sets = grammar(EXPRESSIONS).getFirstFollowSets();
		assertThrows(IllegalArgumentException.class, () -> sets.first(new NonTerminal("X")));
		assertThrows(IllegalArgumentException.class, () -> sets.follow(new NonTerminal("X")));
	}

	static Set<Terminal> terminals(String... names){
		Set<Terminal> set = new HashSet<>();
		for (String name : names){
			set.add(new Terminal(name));
		}
		return set;
	}
}
