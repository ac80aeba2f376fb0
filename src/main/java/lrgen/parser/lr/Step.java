package lrgen.parser.lr;

import java.util.Collections;
import java.util.List;

/**
 * A single step of the parser, recorded with the configuration before the action is applied.
 */
public class Step {

	public static final String ERROR_ACTION = "ERROR";

	/**
	 * 1 based index of the step
	 */
	public final int index;

	/**
	 * Applied action (<pre>s3</pre>, <pre>r2</pre>, <pre>accept</pre>) or {@value #ERROR_ACTION}
	 */
	public final String action;

	public final int state;

	public final String token;

	/**
	 * States (integers) alternating with symbol names, bottom first
	 */
	public final List<Object> stack;

	/**
	 * Remaining input including the current token and the end marker
	 */
	public final List<String> input;

	/**
	 * Description of a successful step, null for failed steps
	 */
	public final String message;

	/**
	 * Applied production of a reduction
	 */
	public final String production;

	/**
	 * Cause of a failed step
	 */
	public final String error;

	Step(int index, String action, int state, String token, List<Object> stack, List<String> input,
	     String message, String production, String error) {
		this.index = index;
		this.action = action;
		this.state = state;
		this.token = token;
		this.stack = Collections.unmodifiableList(stack);
		this.input = Collections.unmodifiableList(input);
		this.message = message;
		this.production = production;
		this.error = error;
	}

	public boolean isError(){
		return error != null;
	}

	@Override
	public String toString() {
		return String.format("%3d  %-8s state %-4d token %-6s stack %s input %s  %s", index, action, state, token,
				stack, input, isError() ? error : message);
	}
}
