package lrgen;

import lrgen.grammar.Grammar;
import lrgen.grammar.GrammarParser;

/**
 * Grammars used by several tests
 */
public class TestGrammars {

	/** LR(0), 6 states */
	public static final String RIGHT_RECURSIVE = "S -> A\nA -> a A | b";

	/** LR(0), 7 states */
	public static final String PARENTHESES = "S -> A\nA -> ( A ) | a";

	/** SLR(1) but not LR(0), 13 states */
	public static final String EXPRESSIONS = "S -> E\n" +
			"E -> T + E | T\n" +
			"T -> F * T | F\n" +
			"F -> ( E ) | id";

	/** Ambiguous, neither LR(0) nor SLR(1) */
	public static final String AMBIGUOUS = "S -> E\nE -> E + E | E * E | id";

	/** SLR(1) but not LR(0) */
	public static final String EPSILON = "S -> A\nA -> a A | ε";

	/** Reduce/Reduce conflicts for both parser types */
	public static final String REDUCE_REDUCE = "S -> A | B\nA -> x\nB -> x";

	public static Grammar grammar(String text){
		return GrammarParser.parse(text);
	}
}
