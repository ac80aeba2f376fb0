package lrgen.parser.lr;

import lrgen.grammar.NonTerminal;
import lrgen.grammar.Production;
import lrgen.grammar.Symbol;
import lrgen.grammar.Terminal;

/**
 * An LR(0) item: a production with a dot in its right hand side.
 *
 * Two items are equal if their production ids and dot positions are equal, they are ordered by
 * production id and then by dot position.
 */
public class Item implements Comparable<Item> {

	public static final String DOT = "•";

	public final Production production;

	/**
	 * The dot is before the position.th right hand side symbol
	 */
	public final int position;

	public Item(Production production, int position) {
		if (position < 0 || position > production.rightSize()){
			throw new IllegalArgumentException(String.format("Dot position %d is outside of \"%s\"", position, production));
		}
		this.production = production;
		this.position = position;
	}

	/**
	 * Item with the dot at the beginning of the production
	 */
	public Item(Production production){
		this(production, 0);
	}

	public boolean canAdvance(){
		return position < production.rightSize();
	}

	/**
	 * Item with the dot moved over the next symbol.
	 */
	public Item advance(){
		if (!canAdvance()){
			throw new IllegalStateException("Can't advance " + this);
		}
		return new Item(production, position + 1);
	}

	/**
	 * Symbol after the dot or null if the dot is at the end.
	 */
	public Symbol nextSymbol(){
		if (canAdvance()){
			return production.right.get(position);
		}
		return null;
	}

	public boolean inFrontOfTerminal(){
		return nextSymbol() instanceof Terminal;
	}

	public boolean inFrontOfNonTerminal(){
		return nextSymbol() instanceof NonTerminal;
	}

	public boolean inFrontOf(Symbol symbol){
		return canAdvance() && nextSymbol().equals(symbol);
	}

	public boolean atEnd(){
		return !canAdvance();
	}

	@Override
	public boolean equals(Object obj) {
		return obj instanceof Item && ((Item)obj).production.id == production.id && ((Item)obj).position == position;
	}

	@Override
	public int hashCode() {
		return production.id * 31 + position;
	}

	@Override
	public int compareTo(Item o) {
		if (o.production.id != production.id){
			return Integer.compare(production.id, o.production.id);
		}
		return Integer.compare(position, o.position);
	}

	@Override
	public String toString() {
		StringBuilder builder = new StringBuilder();
		builder.append(production.left).append(" ").append(Production.ARROW);
		for (int i = 0; i < production.rightSize(); i++) {
			if (i == position){
				builder.append(" ").append(DOT);
			}
			builder.append(" ").append(production.right.get(i));
		}
		if (atEnd()){
			builder.append(" ").append(DOT);
		}
		return builder.toString();
	}
}
