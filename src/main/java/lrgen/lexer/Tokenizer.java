package lrgen.lexer;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

import lrgen.grammar.Terminal;

/**
 * Splits an input string into tokens: at white space and around single character operators
 * (<pre>+ - * / ( ) = , ; : . &amp; | ! &lt; &gt;</pre>). Every token has to be a terminal of the grammar.
 * The end marker isn't part of the result.
 */
public class Tokenizer {

	public static final String OPERATORS = "+-*/()=,;:.&|!<>";

	private final Set<String> terminals = new LinkedHashSet<>();

	public Tokenizer(Iterable<Terminal> terminals) {
		for (Terminal terminal : terminals) {
			if (!terminal.isEndMarker()){
				this.terminals.add(terminal.name);
			}
		}
	}

	/**
	 * @throws LexerError if a token isn't a terminal
	 */
	public List<String> tokenize(String input){
		List<String> tokens = split(input);
		for (int i = 0; i < tokens.size(); i++) {
			if (!terminals.contains(tokens.get(i))){
				throw new LexerError(tokens.get(i), i, terminals);
			}
		}
		return tokens;
	}

	public Set<String> getTerminals() {
		return Collections.unmodifiableSet(terminals);
	}

	/**
	 * Split without checking the tokens.
	 */
	public static List<String> split(String input){
		List<String> tokens = new ArrayList<>();
		if (input == null){
			return tokens;
		}
		for (String part : input.trim().split("\\s+")){
			StringBuilder current = new StringBuilder();
			for (char c : part.toCharArray()){
				if (OPERATORS.indexOf(c) != -1){
					if (current.length() > 0){
						tokens.add(current.toString());
						current.setLength(0);
					}
					tokens.add(String.valueOf(c));
				} else {
					current.append(c);
				}
			}
			if (current.length() > 0){
				tokens.add(current.toString());
			}
		}
		return tokens;
	}
}
