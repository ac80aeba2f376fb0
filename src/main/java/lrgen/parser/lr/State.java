package lrgen.parser.lr;

import java.util.Collections;
import java.util.SortedSet;

/**
 * A state of the LR(0) automaton: a closed item set with the id it got in discovery order.
 */
public class State implements Comparable<State> {

	public final int id;

	private final ItemSet items;

	State(int id, ItemSet items) {
		this.id = id;
		this.items = items;
	}

	public SortedSet<Item> getItems() {
		return Collections.unmodifiableSortedSet(items);
	}

	ItemSet itemSet(){
		return items;
	}

	@Override
	public String toString() {
		StringBuilder builder = new StringBuilder();
		builder.append("State ").append(id);
		for (Item item : items){
			builder.append("\n- ").append(item);
		}
		return builder.toString();
	}

	@Override
	public int compareTo(State o) {
		return Integer.compare(id, o.id);
	}
}
