package lrgen.parser.lr;

import java.util.Collections;
import java.util.List;

import lrgen.LRGenException;

/**
 * The input isn't part of the language of the table (as far as the table can tell).
 */
public class ParseRejectedException extends LRGenException {

	public final int state;

	public final String token;

	/**
	 * Index of the token in the input (including the end marker)
	 */
	public final int position;

	public final List<Object> stack;

	/**
	 * All steps up to and including the failed one
	 */
	public final List<Step> steps;

	public ParseRejectedException(String message, int state, String token, int position, List<Object> stack,
	                              List<Step> steps) {
		super(message);
		this.state = state;
		this.token = token;
		this.position = position;
		this.stack = Collections.unmodifiableList(stack);
		this.steps = Collections.unmodifiableList(steps);
	}
}
