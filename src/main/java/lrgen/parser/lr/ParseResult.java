package lrgen.parser.lr;

import java.util.Collections;
import java.util.List;

/**
 * Parse tree and step trace of an accepted input.
 */
public class ParseResult {

	public final ProductionAST tree;

	public final List<Step> steps;

	public ParseResult(ProductionAST tree, List<Step> steps) {
		this.tree = tree;
		this.steps = Collections.unmodifiableList(steps);
	}
}
