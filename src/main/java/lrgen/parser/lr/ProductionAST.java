package lrgen.parser.lr;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import lrgen.grammar.NonTerminal;
import lrgen.grammar.Production;
import lrgen.grammar.Terminal;

/**
 * Node created by a reduction, its children are the nodes of the right hand side symbols.
 * Reductions by ε productions create nodes without children.
 */
public class ProductionAST extends BaseAST {

	public final Production production;

	private final List<BaseAST> children;

	public ProductionAST(Production production, List<BaseAST> children) {
		if (children.size() != production.rightSize()){
			throw new IllegalArgumentException(String.format("\"%s\" needs %d children, got %d", production,
					production.rightSize(), children.size()));
		}
		this.production = production;
		this.children = Collections.unmodifiableList(new ArrayList<>(children));
	}

	@Override
	public NonTerminal symbol() {
		return production.left;
	}

	@Override
	public List<BaseAST> children() {
		return children;
	}

	@Override
	public List<Terminal> getMatchedTerminals() {
		List<Terminal> terminals = new ArrayList<>();
		for (BaseAST child : children){
			terminals.addAll(child.getMatchedTerminals());
		}
		return terminals;
	}
}
