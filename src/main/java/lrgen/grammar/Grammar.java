package lrgen.grammar;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Grammar consisting of terminals, non terminals and productions.
 *
 * Instances are immutable. Use the {@link GrammarBuilder} or the {@link GrammarParser} to build a
 * grammar from symbol names.
 */
public class Grammar {

	private final List<Production> productions;

	private final NonTerminal start;

	/**
	 * Is the start symbol the synthetic one added by {@link #augment()}?
	 */
	private final boolean augmented;

	/**
	 * Terminals in order of their first appearance in the productions (without the end marker)
	 */
	private final Set<Terminal> terminals;

	/**
	 * Non terminals in order of their first definition
	 */
	private final Set<NonTerminal> nonTerminals;

	private final Map<NonTerminal, List<Production>> productionsPerNonTerminal;

	private FirstFollowSets firstFollowSets;

	/**
	 * Create a new grammar.
	 *
	 * @param productions productions, the id of each production has to be its index
	 * @param start start non terminal
	 * @throws InvalidGrammarException if the start symbol has no productions or a symbol on a right hand
	 *                                 side can't be classified
	 */
	public Grammar(List<Production> productions, NonTerminal start) {
		this(productions, start, false);
	}

	private Grammar(List<Production> productions, NonTerminal start, boolean augmented) {
		this.productions = Collections.unmodifiableList(new ArrayList<>(productions));
		this.start = start;
		this.augmented = augmented;
		Map<NonTerminal, List<Production>> perNonTerminal = new LinkedHashMap<>();
		for (int i = 0; i < productions.size(); i++) {
			Production production = productions.get(i);
			if (production.id != i){
				throw new InvalidGrammarException(String.format("Production \"%s\" has id %d but is at index %d",
						production, production.id, i));
			}
			perNonTerminal.computeIfAbsent(production.left, n -> new ArrayList<>()).add(production);
		}
		if (start == null || !perNonTerminal.containsKey(start)){
			throw new InvalidGrammarException(String.format("Start symbol %s has no productions", start));
		}
		Set<String> nonTerminalNames = new HashSet<>();
		for (NonTerminal nonTerminal : perNonTerminal.keySet()) {
			nonTerminalNames.add(nonTerminal.name);
		}
		Set<Terminal> terminals = new LinkedHashSet<>();
		for (Production production : productions){
			for (Symbol symbol : production.right){
				if (symbol instanceof NonTerminal){
					if (!perNonTerminal.containsKey(symbol)){
						throw new InvalidGrammarException(String.format("Undefined non terminal %s in \"%s\"",
								symbol, production));
					}
				} else {
					Terminal terminal = (Terminal)symbol;
					if (terminal.isEndMarker() || terminal.isEpsilon() || nonTerminalNames.contains(terminal.name)){
						throw new InvalidGrammarException(String.format("Symbol %s in \"%s\" is neither a terminal " +
								"nor a non terminal", symbol, production));
					}
					terminals.add(terminal);
				}
			}
		}
		perNonTerminal.replaceAll((n, l) -> Collections.unmodifiableList(l));
		this.productionsPerNonTerminal = Collections.unmodifiableMap(perNonTerminal);
		this.nonTerminals = Collections.unmodifiableSet(new LinkedHashSet<>(perNonTerminal.keySet()));
		this.terminals = Collections.unmodifiableSet(terminals);
	}

	/**
	 * Insert a new start non terminal with a <pre>A' → A</pre> production at index 0 (assuming <pre>A</pre>
	 * is the current start non terminal). The name of the new non terminal is the name of the
	 * start symbol followed by as many primes as needed to make it unique.
	 *
	 * @return augmented grammar, this grammar if it is already augmented
	 */
	public Grammar augment(){
		if (isAugmented()){
			return this;
		}
		Set<String> names = new HashSet<>();
		for (Symbol symbol : getSymbols()) {
			names.add(symbol.name);
		}
		String startName = start.name + "'";
		while (names.contains(startName)) {
			startName += "'";
		}
		NonTerminal newStart = new NonTerminal(startName);
		List<Production> newProductions = new ArrayList<>();
		newProductions.add(new Production(0, newStart, Collections.singletonList(start)));
		for (Production production : productions) {
			newProductions.add(production.withId(production.id + 1));
		}
		return new Grammar(newProductions, newStart, true);
	}

	public boolean isAugmented(){
		return augmented && productions.get(0).left.equals(start);
	}

	/**
	 * Production <pre>S' → S</pre> of an augmented grammar
	 */
	public Production getStartProduction(){
		if (!isAugmented()){
			throw new IllegalStateException("Grammar isn't augmented");
		}
		return productions.get(0);
	}

	public List<Production> getProductions(){
		return productions;
	}

	public Production getProduction(int id){
		return productions.get(id);
	}

	public List<Production> getProductionOfNonTerminal(NonTerminal nonTerminal) {
		return productionsPerNonTerminal.getOrDefault(nonTerminal, Collections.emptyList());
	}

	public NonTerminal getStart(){
		return start;
	}

	public Set<Terminal> getTerminals(){
		return terminals;
	}

	/**
	 * Terminals followed by the end marker, the columns of the ACTION table.
	 */
	public List<Terminal> getTerminalsWithEndMarker(){
		List<Terminal> list = new ArrayList<>(terminals);
		list.add(Terminal.END_MARKER);
		return list;
	}

	public Set<NonTerminal> getNonTerminals(){
		return nonTerminals;
	}

	/**
	 * All symbols of the grammar, terminals first.
	 */
	public List<Symbol> getSymbols(){
		List<Symbol> symbols = new ArrayList<>(terminals);
		symbols.addAll(nonTerminals);
		return symbols;
	}

	/**
	 * Upper bound of the number of LR(0) items of this grammar
	 */
	public int maxItemCount(){
		int count = 0;
		for (Production production : productions) {
			count += production.rightSize() + 1;
		}
		return count;
	}

	/**
	 * FIRST and FOLLOW sets, calculated on the first call.
	 */
	public synchronized FirstFollowSets getFirstFollowSets(){
		if (firstFollowSets == null){
			firstFollowSets = new FirstFollowSets(this);
		}
		return firstFollowSets;
	}

	public String longDescription(){
		StringBuilder builder = new StringBuilder();
		builder.append("Start non terminal: ").append(start).append("\n");
		builder.append("NonTerminals: ").append(nonTerminals).append("\n");
		builder.append("Terminals: ").append(terminals).append("\n");
		builder.append("Productions:");
		for (Production production : productions) {
			builder.append("\n").append(production.id).append(" ").append(production);
		}
		return builder.toString();
	}

	@Override
	public String toString() {
		StringBuilder builder = new StringBuilder();
		for (Production production : productions) {
			if (builder.length() > 0){
				builder.append("\n");
			}
			builder.append(production);
		}
		return builder.toString();
	}
}
