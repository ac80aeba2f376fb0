package lrgen.parser.lr;

import java.util.Collections;
import java.util.List;

import lrgen.grammar.Terminal;

/**
 * A shifted terminal.
 */
public class ASTLeaf extends BaseAST {

	public final Terminal terminal;

	public ASTLeaf(Terminal terminal){
		this.terminal = terminal;
	}

	@Override
	public Terminal symbol() {
		return terminal;
	}

	@Override
	public List<Terminal> getMatchedTerminals() {
		return Collections.singletonList(terminal);
	}

	@Override
	public String toPrettyString(String indent, String incr) {
		return indent + toString();
	}

	@Override
	public String toString() {
		return terminal.name;
	}
}
