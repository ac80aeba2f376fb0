package lrgen.lexer;

import java.util.Collection;

import lrgen.LRGenException;

/**
 * Thrown if the input contains a token that isn't a terminal of the grammar.
 */
public class LexerError extends LRGenException {

	/**
	 * The unknown token
	 */
	public final String token;

	/**
	 * Index of the token in the token list
	 */
	public final int position;

	public LexerError(String token, int position, Collection<String> validTerminals) {
		super(String.format("Unknown token '%s' at position %d, valid terminals: %s", token, position, validTerminals));
		this.token = token;
		this.position = position;
	}
}
