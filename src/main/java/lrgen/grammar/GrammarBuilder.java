package lrgen.grammar;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Allows the simple creation of grammars from symbol names.
 *
 * Every name that appears on the left hand side of a production is a non terminal, every other
 * name on a right hand side is a terminal. The classification is done in {@link #toGrammar(String)}
 * after all productions are known, so productions can use non terminals before they are defined.
 */
public class GrammarBuilder {

	/**
	 * Names that can't be used as symbols
	 */
	private static final List<String> reservedNames = Arrays.asList(Terminal.END_MARKER.name,
			Terminal.EPSILON.name);

	private final List<String[]> productions = new ArrayList<>();

	/**
	 * Adds a new production.
	 *
	 * @param left name of the defining non terminal on the left hand side of the production
	 * @param right names of the right hand side symbols, no names for an ε production
	 */
	public GrammarBuilder add(String left, String... right){
		String[] prod = new String[right.length + 1];
		prod[0] = left;
		System.arraycopy(right, 0, prod, 1, right.length);
		for (String name : prod){
			checkName(name, prod);
		}
		productions.add(prod);
		return this;
	}

	public GrammarBuilder add(String left, List<String> right){
		return add(left, right.toArray(new String[0]));
	}

	private void checkName(String name, String[] prod){
		if (name == null || name.trim().isEmpty() || !name.trim().equals(name)){
			throw new InvalidGrammarException(String.format("Invalid symbol name \"%s\" in production %s",
					name, formatRaw(prod)));
		}
		if (reservedNames.contains(name)){
			throw new InvalidGrammarException(String.format("Reserved symbol %s can't be used in production %s",
					name, formatRaw(prod)));
		}
	}

	private static String formatRaw(String[] prod){
		return prod[0] + " " + Production.ARROW + " " + String.join(" ", Arrays.asList(prod).subList(1, prod.length));
	}

	public boolean isEmpty(){
		return productions.isEmpty();
	}

	/**
	 * Name of the left hand side of the first production
	 */
	public String firstLeftHandSide(){
		if (productions.isEmpty()){
			throw new InvalidGrammarException("Grammar doesn't contain any productions");
		}
		return productions.get(0)[0];
	}

	/**
	 * Build the grammar with the left hand side of the first production as its start symbol.
	 */
	public Grammar toGrammar(){
		return toGrammar(firstLeftHandSide());
	}

	public Grammar toGrammar(String startNonTerminal) {
		if (productions.isEmpty()){
			throw new InvalidGrammarException("Grammar doesn't contain any productions");
		}
		Map<String, NonTerminal> nonTerminals = new LinkedHashMap<>();
		for (String[] prod : productions) {
			nonTerminals.computeIfAbsent(prod[0], NonTerminal::new);
		}
		if (!nonTerminals.containsKey(startNonTerminal)){
			throw new InvalidGrammarException(String.format("Start symbol %s has no productions", startNonTerminal));
		}
		Map<String, Terminal> terminals = new LinkedHashMap<>();
		List<Production> result = new ArrayList<>();
		for (String[] prod : productions) {
			List<Symbol> right = new ArrayList<>();
			for (int i = 1; i < prod.length; i++) {
				NonTerminal nonTerminal = nonTerminals.get(prod[i]);
				if (nonTerminal != null){
					right.add(nonTerminal);
				} else {
					right.add(terminals.computeIfAbsent(prod[i], Terminal::new));
				}
			}
			result.add(new Production(result.size(), nonTerminals.get(prod[0]), right));
		}
		return new Grammar(result, nonTerminals.get(startNonTerminal));
	}
}
