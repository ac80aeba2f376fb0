package lrgen.grammar;

import lrgen.LRGenException;

/**
 * Thrown if a grammar is malformed: a missing start symbol, undefined or reserved symbols or
 * grammar text that can't be split into productions.
 */
public class InvalidGrammarException extends LRGenException {

	public InvalidGrammarException(String message) {
		super(message);
	}
}
