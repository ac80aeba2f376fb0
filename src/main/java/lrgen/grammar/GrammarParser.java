package lrgen.grammar;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

/**
 * Parses the line based grammar notation
 *
 * <pre>
 * # comment
 * S -> E
 * E -> E + T | T
 * T -> T * F | F
 * F -> ( E ) | id
 * L -> a L | ε
 * </pre>
 *
 * Symbols are separated by white space, quoted symbols (<pre>'+'</pre> or <pre>"a b"</pre>) are kept
 * as a single symbol including their quotes. <pre>ε</pre> or <pre>epsilon</pre> denote the empty
 * alternative. The left hand side of the first rule is the start symbol.
 */
public class GrammarParser {

	public static final String ARROW = "->";

	private static final List<String> epsilonNames = Arrays.asList(Production.EPSILON, "epsilon");

	public static Grammar parse(String grammarText){
		return toBuilder(grammarText).toGrammar();
	}

	public static GrammarBuilder toBuilder(String grammarText){
		if (grammarText == null || grammarText.trim().isEmpty()){
			throw new InvalidGrammarException("Grammar input is required");
		}
		GrammarBuilder builder = new GrammarBuilder();
		String[] lines = grammarText.split("\r?\n");
		for (int i = 0; i < lines.length; i++) {
			parseLine(builder, lines[i].trim(), i + 1);
		}
		if (builder.isEmpty()){
			throw new InvalidGrammarException("Grammar doesn't contain any productions");
		}
		return builder;
	}

	private static void parseLine(GrammarBuilder builder, String line, int lineNumber){
		if (line.isEmpty() || line.startsWith("#")){
			return;
		}
		int arrow = line.indexOf(ARROW);
		if (arrow == -1){
			throw new InvalidGrammarException(String.format("Line %d: expected \"%s\" in \"%s\"", lineNumber, ARROW, line));
		}
		String left = line.substring(0, arrow).trim();
		if (left.isEmpty() || split(left, ' ').size() != 1){
			throw new InvalidGrammarException(String.format("Line %d: expected a single non terminal on the left " +
					"hand side of \"%s\"", lineNumber, line));
		}
		String right = line.substring(arrow + ARROW.length()).trim();
		for (String alternative : split(right, '|')){
			List<String> symbols = split(alternative, ' ');
			if (symbols.isEmpty()){
				throw new InvalidGrammarException(String.format("Line %d: empty alternative in \"%s\", use %s " +
						"for the empty word", lineNumber, line, Production.EPSILON));
			}
			if (symbols.size() == 1 && epsilonNames.contains(symbols.get(0))){
				symbols = new ArrayList<>();
			}
			builder.add(left, symbols);
		}
	}

	/**
	 * Split the text at the separator (or any white space if the separator is a blank), parts
	 * in single or double quotes aren't split. A quote only opens a quoted part at the start of
	 * a symbol, primes as in <pre>E'</pre> are ordinary characters.
	 *
	 * @return trimmed parts, empty parts are omitted if the separator is a blank
	 */
	static List<String> split(String text, char separator){
		boolean splitAtWhitespace = separator == ' ';
		List<String> parts = new ArrayList<>();
		StringBuilder current = new StringBuilder();
		char quote = 0;
		for (char c : text.toCharArray()){
			if (quote != 0){
				current.append(c);
				if (c == quote){
					quote = 0;
				}
			} else if ((c == '"' || c == '\'') && atSymbolStart(current)){
				quote = c;
				current.append(c);
			} else if (splitAtWhitespace ? Character.isWhitespace(c) : c == separator){
				addPart(parts, current, splitAtWhitespace);
			} else {
				current.append(c);
			}
		}
		addPart(parts, current, splitAtWhitespace);
		return parts;
	}

	private static boolean atSymbolStart(StringBuilder current){
		return current.length() == 0 || Character.isWhitespace(current.charAt(current.length() - 1));
	}

	private static void addPart(List<String> parts, StringBuilder current, boolean omitEmpty){
		String part = current.toString().trim();
		current.setLength(0);
		if (!part.isEmpty() || !omitEmpty){
			parts.add(part);
		}
	}
}
