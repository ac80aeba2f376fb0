package lrgen.report;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

import lrgen.parser.lr.BaseAST;
import lrgen.parser.lr.ParseRejectedException;
import lrgen.parser.lr.ParseResult;
import lrgen.parser.lr.ProductionAST;
import lrgen.parser.lr.Step;

/**
 * Result document of a parse.
 *
 * <pre>
 * {
 *   "accepted": true,
 *   "error": null,
 *   "parse_tree": {"symbol": "S", "production": "S → A", "children": [...]},
 *   "steps": [{"step": 1, "state": 0, "token": "a", "action": "s3", "stack": [0],
 *              "input": ["a", "b", "$"], "message": "Shift a, goto state 3"}, ...]
 * }
 * </pre>
 */
@JsonPropertyOrder({"accepted", "error", "parse_tree", "steps"})
public class ParseReport {

	@JsonPropertyOrder({"symbol", "production", "children"})
	public static class TreeNode {
		@JsonProperty("symbol")
		public final String symbol;

		/**
		 * Production of a reduction, null for leafs
		 */
		@JsonProperty("production")
		public final String production;

		@JsonProperty("children")
		public final List<TreeNode> children = new ArrayList<>();

		TreeNode(BaseAST ast) {
			this.symbol = ast.symbol().name;
			this.production = ast instanceof ProductionAST ? ((ProductionAST) ast).production.toString() : null;
			for (BaseAST child : ast.children()){
				children.add(new TreeNode(child));
			}
		}
	}

	@JsonInclude(JsonInclude.Include.NON_NULL)
	@JsonPropertyOrder({"step", "state", "token", "action", "stack", "input", "message", "production", "error"})
	public static class StepEntry {
		@JsonProperty("step")
		public final int step;
		@JsonProperty("state")
		public final int state;
		@JsonProperty("token")
		public final String token;
		@JsonProperty("action")
		public final String action;
		@JsonProperty("stack")
		public final List<Object> stack;
		@JsonProperty("input")
		public final List<String> input;
		@JsonProperty("message")
		public final String message;
		@JsonProperty("production")
		public final String production;
		@JsonProperty("error")
		public final String error;

		StepEntry(Step step) {
			this.step = step.index;
			this.state = step.state;
			this.token = step.token;
			this.action = step.action;
			this.stack = step.stack;
			this.input = step.input;
			this.message = step.message;
			this.production = step.production;
			this.error = step.error;
		}
	}

	@JsonProperty("accepted")
	public final boolean accepted;

	@JsonProperty("error")
	public final String error;

	@JsonProperty("parse_tree")
	public final TreeNode parseTree;

	@JsonProperty("steps")
	public final List<StepEntry> steps;

	private ParseReport(boolean accepted, String error, TreeNode parseTree, List<Step> steps) {
		this.accepted = accepted;
		this.error = error;
		this.parseTree = parseTree;
		List<StepEntry> entries = new ArrayList<>();
		for (Step step : steps){
			entries.add(new StepEntry(step));
		}
		this.steps = entries;
	}

	public static ParseReport accepted(ParseResult result){
		return new ParseReport(true, null, new TreeNode(result.tree), result.steps);
	}

	public static ParseReport rejected(ParseRejectedException exception){
		return new ParseReport(false, exception.getMessage(), null, exception.steps);
	}

	/**
	 * Rejection before the first step, e.g. because the input contains an unknown token
	 */
	public static ParseReport rejected(String error){
		return new ParseReport(false, error, null, Collections.emptyList());
	}
}
