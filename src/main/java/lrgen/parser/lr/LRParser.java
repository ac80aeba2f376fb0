package lrgen.parser.lr;

import java.util.ArrayList;
import java.util.List;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import lrgen.Config;
import lrgen.grammar.Production;
import lrgen.grammar.Symbol;
import lrgen.grammar.Terminal;

/**
 * Shift reduce parser driven by an {@link LRParserTable}.
 *
 * The parser holds no state between calls, every call of {@link #parse(List)} works on its own stack.
 */
public class LRParser {

	private static final Logger logger = LoggerFactory.getLogger(LRParser.class);

	private final LRParserTable table;

	private final int maxSteps;

	public LRParser(LRParserTable table){
		this(table, Config.maxParseSteps());
	}

	/**
	 * @param maxSteps number of steps after which the input is rejected
	 */
	public LRParser(LRParserTable table, int maxSteps){
		if (maxSteps < 1){
			throw new IllegalArgumentException("The maximum number of steps has to be positive, got " + maxSteps);
		}
		this.table = table;
		this.maxSteps = maxSteps;
	}

	/**
	 * Parse the tokens, the end marker is appended.
	 *
	 * @param tokens terminal names
	 * @return tree and steps of the accepted input
	 * @throws ParseRejectedException if the table has no action for the current state and token, has
	 *                                no GOTO entry after a reduction or if the input needs too many steps
	 */
	public ParseResult parse(List<String> tokens){
		List<String> input = new ArrayList<>(tokens);
		for (String token : input){
			if (Terminal.END_MARKER.name.equals(token)){
				throw new IllegalArgumentException("Input tokens can't contain the end marker");
			}
		}
		input.add(Terminal.END_MARKER.name);
		List<StackFrame> stack = new ArrayList<>();
		stack.add(new StackFrame(0, null, null));
		List<Step> steps = new ArrayList<>();
		int position = 0;
		while (true){
			int state = stack.get(stack.size() - 1).state;
			String token = input.get(position);
			List<Object> stackSnapshot = snapshot(stack);
			List<String> remainingInput = new ArrayList<>(input.subList(position, input.size()));
			int index = steps.size() + 1;
			if (index > maxSteps){
				String error = String.format("Parser exceeded maximum steps (%d)", maxSteps);
				throw reject(error, new Step(index, Step.ERROR_ACTION, state, token, stackSnapshot, remainingInput,
						null, null, error), steps, position);
			}
			LRParserTable.Action action = table.getAction(state, new Terminal(token));
			if (action == null){
				String error = String.format("No action defined for state %d and token '%s', expected one of %s",
						state, token, table.getExpectedTerminals(state));
				throw reject(error, new Step(index, Step.ERROR_ACTION, state, token, stackSnapshot, remainingInput,
						null, null, error), steps, position);
			}
			if (action instanceof LRParserTable.Accept){
				Step step = new Step(index, action.toString(), state, token, stackSnapshot, remainingInput,
						"Input accepted", null, null);
				log(step);
				steps.add(step);
				return new ParseResult((ProductionAST)stack.get(stack.size() - 1).ast, steps);
			}
			if (action instanceof LRParserTable.ShiftAction){
				int nextState = ((LRParserTable.ShiftAction) action).stateToBeShifted;
				Terminal terminal = new Terminal(token);
				Step step = new Step(index, action.toString(), state, token, stackSnapshot, remainingInput,
						String.format("Shift %s, goto state %d", token, nextState), null, null);
				log(step);
				steps.add(step);
				stack.add(new StackFrame(nextState, terminal, new ASTLeaf(terminal)));
				position++;
				continue;
			}
			Production production = ((LRParserTable.ReduceAction) action).production;
			List<BaseAST> children = new ArrayList<>();
			for (int i = 0; i < production.rightSize(); i++){
				children.add(0, stack.remove(stack.size() - 1).ast);
			}
			int stateAfterPop = stack.get(stack.size() - 1).state;
			Integer nextState = table.getGoto(stateAfterPop, production.left);
			if (nextState == null){
				String error = String.format("No GOTO defined for state %d and non terminal %s", stateAfterPop,
						production.left);
				throw reject(error, new Step(index, action.toString(), state, token, stackSnapshot, remainingInput,
						null, production.toString(), error), steps, position);
			}
			Step step = new Step(index, action.toString(), state, token, stackSnapshot, remainingInput,
					String.format("Reduce %s, goto state %d", production, nextState), production.toString(), null);
			log(step);
			steps.add(step);
			stack.add(new StackFrame(nextState, production.left, new ProductionAST(production, children)));
		}
	}

	private ParseRejectedException reject(String error, Step failedStep, List<Step> steps, int position){
		log(failedStep);
		steps.add(failedStep);
		return new ParseRejectedException(error, failedStep.state, failedStep.token, position, failedStep.stack, steps);
	}

	private void log(Step step){
		if (logger.isDebugEnabled()){
			logger.debug("{}", step);
		}
	}

	private static List<Object> snapshot(List<StackFrame> stack){
		List<Object> snapshot = new ArrayList<>();
		for (StackFrame frame : stack){
			if (frame.symbol != null){
				snapshot.add(frame.symbol.name);
			}
			snapshot.add(frame.state);
		}
		return snapshot;
	}

	public LRParserTable getTable() {
		return table;
	}

	/**
	 * A state with the symbol (and its tree) that led to it, the bottom frame has no symbol.
	 */
	static class StackFrame {
		final int state;
		final Symbol symbol;
		final BaseAST ast;

		StackFrame(int state, Symbol symbol, BaseAST ast){
			this.state = state;
			this.symbol = symbol;
			this.ast = ast;
		}
	}
}
