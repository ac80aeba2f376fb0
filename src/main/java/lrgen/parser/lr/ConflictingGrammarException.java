package lrgen.parser.lr;

import java.util.List;

import lrgen.LRGenException;

/**
 * Thrown when a table with conflicts is used for parsing although conflicts are rejected.
 */
public class ConflictingGrammarException extends LRGenException {

	public final List<Conflict> conflicts;

	public ConflictingGrammarException(LRParserTable table) {
		super(String.format("Grammar isn't %s, the table has %d conflicts, the first one is: %s",
				table.parserType, table.getConflicts().size(), table.getConflicts().get(0)));
		this.conflicts = table.getConflicts();
	}
}
