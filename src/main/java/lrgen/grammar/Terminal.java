package lrgen.grammar;

/**
 * A terminal symbol, the text of a single token.
 */
public class Terminal extends Symbol {

	/**
	 * Marks the end of the input, never part of a production
	 */
	public static final Terminal END_MARKER = new Terminal("$");

	/**
	 * Stands for the empty word in FIRST sets, never part of a production
	 */
	public static final Terminal EPSILON = new Terminal("ε");

	public Terminal(String name) {
		super(name);
	}

	public boolean isEndMarker(){
		return equals(END_MARKER);
	}

	public boolean isEpsilon(){
		return equals(EPSILON);
	}
}
