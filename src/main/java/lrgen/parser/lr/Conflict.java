package lrgen.parser.lr;

import java.util.Objects;

import lrgen.grammar.Terminal;
import lrgen.parser.lr.LRParserTable.Action;
import lrgen.parser.lr.LRParserTable.ShiftAction;

/**
 * Two different actions that were derived for the same cell of the ACTION table.
 */
public class Conflict {

	public enum Kind {
		SHIFT_REDUCE("Shift/Reduce"),
		REDUCE_REDUCE("Reduce/Reduce");

		public final String displayName;

		Kind(String displayName) {
			this.displayName = displayName;
		}

		@Override
		public String toString() {
			return displayName;
		}
	}

	public final int state;

	public final Terminal symbol;

	public final Kind kind;

	/**
	 * Action that was inserted first, it stays in the table
	 */
	public final Action kept;

	/**
	 * Action that was rejected
	 */
	public final Action discarded;

	public Conflict(int state, Terminal symbol, Action kept, Action discarded) {
		this.state = state;
		this.symbol = symbol;
		this.kept = kept;
		this.discarded = discarded;
		this.kind = kept instanceof ShiftAction || discarded instanceof ShiftAction ? Kind.SHIFT_REDUCE : Kind.REDUCE_REDUCE;
	}

	/**
	 * The shift action of a Shift/Reduce conflict
	 */
	public Action shiftAction(){
		checkKind(Kind.SHIFT_REDUCE);
		return kept instanceof ShiftAction ? kept : discarded;
	}

	/**
	 * The reduce (or accept) action of a Shift/Reduce conflict
	 */
	public Action reduceAction(){
		checkKind(Kind.SHIFT_REDUCE);
		return kept instanceof ShiftAction ? discarded : kept;
	}

	private void checkKind(Kind expected){
		if (kind != expected){
			throw new IllegalStateException(String.format("%s isn't a %s conflict", this, expected));
		}
	}

	@Override
	public boolean equals(Object obj) {
		if (!(obj instanceof Conflict)){
			return false;
		}
		Conflict other = (Conflict)obj;
		return other.state == state && other.symbol.equals(symbol) && other.kept.equals(kept)
				&& other.discarded.equals(discarded);
	}

	@Override
	public int hashCode() {
		return Objects.hash(state, symbol, kept, discarded);
	}

	@Override
	public String toString() {
		return String.format("%s conflict in state %d at %s: %s (kept) vs %s", kind, state, symbol, kept, discarded);
	}
}
