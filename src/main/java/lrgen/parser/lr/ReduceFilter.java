package lrgen.parser.lr;

import java.util.List;

import lrgen.grammar.Grammar;
import lrgen.grammar.Production;
import lrgen.grammar.Terminal;

/**
 * Chooses the lookahead terminals on which a complete item <pre>A → α•</pre> is reduced.
 */
@FunctionalInterface
public interface ReduceFilter {

	/**
	 * @param grammar augmented grammar
	 * @param production production of the complete item
	 * @return terminals (possibly including the end marker) in table column order
	 */
	List<Terminal> lookaheads(Grammar grammar, Production production);

	/**
	 * LR(0): reduce on every terminal and the end marker
	 */
	static ReduceFilter allTerminals(){
		return (grammar, production) -> grammar.getTerminalsWithEndMarker();
	}

	/**
	 * SLR(1): reduce only on the terminals in FOLLOW(A)
	 */
	static ReduceFilter followSet(){
		return (grammar, production) -> {
			List<Terminal> terminals = grammar.getTerminalsWithEndMarker();
			terminals.retainAll(grammar.getFirstFollowSets().follow(production.left));
			return terminals;
		};
	}
}
