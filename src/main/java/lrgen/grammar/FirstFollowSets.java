package lrgen.grammar;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import lrgen.util.IterationGuard;

/**
 * FIRST(1) and FOLLOW(1) sets of a grammar.
 *
 * FIRST sets may contain {@link Terminal#EPSILON}, FOLLOW sets never do. The FOLLOW set of the start
 * symbol contains the {@link Terminal#END_MARKER}.
 */
public class FirstFollowSets {

	private static final Logger logger = LoggerFactory.getLogger(FirstFollowSets.class);

	private final Grammar grammar;

	private final Map<Symbol, Set<Terminal>> first = new LinkedHashMap<>();

	private final Map<NonTerminal, Set<Terminal>> follow = new LinkedHashMap<>();

	FirstFollowSets(Grammar grammar) {
		this.grammar = grammar;
		calculateFirstSets();
		calculateFollowSets();
	}

	private long maxIterations(){
		return (long)(grammar.getTerminals().size() + 2) * (grammar.getNonTerminals().size() + 1) + 1;
	}

	/**
	 * FIRST(a) = {a} for every terminal. For every production A → X1 … Xn the FIRST set of X1 (without
	 * ε) is added to FIRST(A), the FIRST set of X2 if X1 can derive ε and so on. ε is added to FIRST(A)
	 * if all Xi can derive ε. Repeated until no set changes.
	 */
	private void calculateFirstSets(){
		for (Terminal terminal : grammar.getTerminals()) {
			first.put(terminal, new LinkedHashSet<>(Collections.singleton(terminal)));
		}
		for (NonTerminal nonTerminal : grammar.getNonTerminals()) {
			first.put(nonTerminal, new LinkedHashSet<>());
		}
		IterationGuard guard = new IterationGuard("FIRST set calculation", maxIterations());
		boolean somethingChanged;
		do {
			guard.next();
			somethingChanged = false;
			for (Production production : grammar.getProductions()){
				Set<Terminal> leftSet = first.get(production.left);
				somethingChanged = leftSet.addAll(firstOfString(production.right)) || somethingChanged;
			}
		} while (somethingChanged);
		logger.debug("FIRST sets reached a fixpoint after {} iterations", guard.getIterations());
	}

	/**
	 * FOLLOW(S) = {$} for the start symbol S. For every production A → αBβ the FIRST set of β (without ε)
	 * is added to FOLLOW(B) and FOLLOW(A) is added too if β can derive ε. Repeated until no set
	 * changes, FOLLOW(A) might grow after it has been added.
	 */
	private void calculateFollowSets(){
		for (NonTerminal nonTerminal : grammar.getNonTerminals()) {
			follow.put(nonTerminal, new LinkedHashSet<>());
		}
		follow.get(grammar.getStart()).add(Terminal.END_MARKER);
		IterationGuard guard = new IterationGuard("FOLLOW set calculation", maxIterations());
		boolean somethingChanged;
		do {
			guard.next();
			somethingChanged = false;
			for (Production production : grammar.getProductions()){
				for (int i = 0; i < production.right.size(); i++){
					Symbol symbol = production.right.get(i);
					if (!(symbol instanceof NonTerminal)){
						continue;
					}
					Set<Terminal> followSet = follow.get(symbol);
					Set<Terminal> firstOfRest = firstOfString(production.right.subList(i + 1, production.right.size()));
					for (Terminal terminal : firstOfRest){
						if (!terminal.isEpsilon()){
							somethingChanged = followSet.add(terminal) || somethingChanged;
						}
					}
					if (firstOfRest.contains(Terminal.EPSILON)){
						somethingChanged = followSet.addAll(follow.get(production.left)) || somethingChanged;
					}
				}
			}
		} while (somethingChanged);
		logger.debug("FOLLOW sets reached a fixpoint after {} iterations", guard.getIterations());
	}

	/**
	 * FIRST set of a sequence of symbols, contains ε if every symbol can derive ε (or the sequence is
	 * empty).
	 */
	public Set<Terminal> firstOfString(List<? extends Symbol> symbols){
		Set<Terminal> set = new LinkedHashSet<>();
		for (Symbol symbol : symbols){
			Set<Terminal> symbolSet = first(symbol);
			for (Terminal terminal : symbolSet){
				if (!terminal.isEpsilon()){
					set.add(terminal);
				}
			}
			if (!symbolSet.contains(Terminal.EPSILON)){
				return set;
			}
		}
		set.add(Terminal.EPSILON);
		return set;
	}

	/**
	 * FIRST set of a single symbol
	 */
	public Set<Terminal> first(Symbol symbol){
		Set<Terminal> set = first.get(symbol);
		if (set == null){
			if (symbol instanceof Terminal){
				return Collections.singleton((Terminal)symbol);
			}
			throw new IllegalArgumentException(String.format("%s isn't a symbol of the grammar", symbol));
		}
		return Collections.unmodifiableSet(set);
	}

	public Set<Terminal> follow(NonTerminal nonTerminal){
		Set<Terminal> set = follow.get(nonTerminal);
		if (set == null){
			throw new IllegalArgumentException(String.format("%s isn't a non terminal of the grammar", nonTerminal));
		}
		return Collections.unmodifiableSet(set);
	}

	/**
	 * Does the symbol derive the empty word?
	 */
	public boolean isEpsilonable(Symbol symbol){
		return first(symbol).contains(Terminal.EPSILON);
	}

	public Map<Symbol, Set<Terminal>> getFirstSets(){
		return Collections.unmodifiableMap(first);
	}

	public Map<NonTerminal, Set<Terminal>> getFollowSets(){
		return Collections.unmodifiableMap(follow);
	}

	@Override
	public String toString() {
		StringBuilder builder = new StringBuilder();
		for (NonTerminal nonTerminal : grammar.getNonTerminals()) {
			if (builder.length() > 0){
				builder.append("\n");
			}
			builder.append(nonTerminal).append(": FIRST = ").append(first.get(nonTerminal))
					.append(", FOLLOW = ").append(follow.get(nonTerminal));
		}
		return builder.toString();
	}
}
