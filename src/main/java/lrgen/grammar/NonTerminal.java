package lrgen.grammar;

/**
 * A non terminal symbol. The productions that define it are owned by the {@link Grammar}.
 */
public class NonTerminal extends Symbol {

	public NonTerminal(String name) {
		super(name);
	}
}
