package lrgen.parser.lr;

import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.TreeSet;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import lrgen.grammar.Grammar;
import lrgen.grammar.NonTerminal;
import lrgen.grammar.Production;
import lrgen.grammar.Symbol;
import lrgen.util.IterationGuard;

/**
 * A set of LR(0) items, iterated in the order of production id and dot position.
 */
public class ItemSet extends TreeSet<Item> {

	private static final Logger logger = LoggerFactory.getLogger(ItemSet.class);

	public ItemSet() {
	}

	public ItemSet(Collection<Item> items) {
		super(items);
	}

	/**
	 * CLOSURE of the passed items.
	 */
	public static ItemSet closure(Grammar grammar, Collection<Item> items){
		ItemSet set = new ItemSet(items);
		set.closure(grammar);
		return set;
	}

	/**
	 * Adds <pre>B → •γ</pre> for every item <pre>A → α•Bβ</pre> in this set and every production
	 * <pre>B → γ</pre> until no item is added in a full pass.
	 *
	 * @return true if an item was added
	 */
	boolean closure(Grammar grammar){
		IterationGuard guard = new IterationGuard("Closure", grammar.maxItemCount() + 1);
		boolean somethingReallyChanged = false;
		boolean somethingChanged;
		do {
			guard.next();
			List<Item> newItems = new ArrayList<>();
			for (Item item : this){
				if (item.inFrontOfNonTerminal()){
					for (Production production : grammar.getProductionOfNonTerminal((NonTerminal)item.nextSymbol())){
						Item newItem = new Item(production);
						if (!contains(newItem)){
							newItems.add(newItem);
						}
					}
				}
			}
			somethingChanged = addAll(newItems);
			somethingReallyChanged = somethingReallyChanged || somethingChanged;
		} while (somethingChanged);
		if (logger.isTraceEnabled()){
			logger.trace("Closure reached a fixpoint after {} passes with {} items", guard.getIterations(), size());
		}
		return somethingReallyChanged;
	}

	/**
	 * GOTO(I, X): the closure of all items of this set with the dot moved over the passed symbol.
	 *
	 * @return closed item set, empty if no item can be advanced over the symbol
	 */
	public ItemSet goTo(Grammar grammar, Symbol symbol){
		List<Item> kernel = new ArrayList<>();
		for (Item item : this){
			if (item.inFrontOf(symbol)){
				kernel.add(item.advance());
			}
		}
		if (kernel.isEmpty()){
			return new ItemSet();
		}
		return closure(grammar, kernel);
	}

	/**
	 * Symbols that directly follow a dot, in item order
	 */
	public Set<Symbol> nextSymbols(){
		Set<Symbol> symbols = new LinkedHashSet<>();
		for (Item item : this){
			if (item.canAdvance()){
				symbols.add(item.nextSymbol());
			}
		}
		return symbols;
	}

	public List<String> toStrings(){
		List<String> strings = new ArrayList<>();
		for (Item item : this){
			strings.add(item.toString());
		}
		return strings;
	}
}
