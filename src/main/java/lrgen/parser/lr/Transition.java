package lrgen.parser.lr;

import java.util.Objects;

import lrgen.grammar.Symbol;

/**
 * An edge of the LR(0) automaton.
 */
public class Transition {

	public final int from;

	public final Symbol symbol;

	public final int to;

	public Transition(int from, Symbol symbol, int to) {
		this.from = from;
		this.symbol = symbol;
		this.to = to;
	}

	@Override
	public boolean equals(Object obj) {
		if (!(obj instanceof Transition)){
			return false;
		}
		Transition other = (Transition)obj;
		return other.from == from && other.to == to && other.symbol.equals(symbol);
	}

	@Override
	public int hashCode() {
		return Objects.hash(from, symbol, to);
	}

	@Override
	public String toString() {
		return from + " --" + symbol + "--> " + to;
	}
}
