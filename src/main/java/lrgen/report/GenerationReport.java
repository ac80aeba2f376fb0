package lrgen.report;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;
import java.util.stream.Collectors;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

import lrgen.grammar.FirstFollowSets;
import lrgen.grammar.Grammar;
import lrgen.grammar.NonTerminal;
import lrgen.grammar.Production;
import lrgen.grammar.Symbol;
import lrgen.grammar.Terminal;
import lrgen.parser.lr.Conflict;
import lrgen.parser.lr.LRParserTable;
import lrgen.parser.lr.ParserType;
import lrgen.parser.lr.State;
import lrgen.parser.lr.Transition;

/**
 * Result document of a table generation.
 *
 * <pre>
 * {
 *   "parser_type": "slr1",
 *   "augmented_grammar": ["S' → S", "S → A", ...],
 *   "states": [{"id": 0, "items": ["S' → • S", ...]}, ...],
 *   "action_table": {"0": {"a": "s3", ...}, ...},
 *   "goto_table": {"0": {"A": 2, ...}, ...},
 *   "dfa_transitions": [{"from": 0, "to": 3, "symbol": "a"}, ...],
 *   "terminals": ["a", "b", "$"],
 *   "non_terminals": ["A", "S", "S'"],
 *   "shift_reduce_conflicts": [{"state": 1, "symbol": "+", "shift": "s4", "reduce": "r1"}],
 *   "reduce_reduce_conflicts": [{"state": 2, "symbol": "$", "reduce1": "r1", "reduce2": "r3"}],
 *   "is_lr0": true,
 *   "is_slr1": true,
 *   "num_states": 6,
 *   "first_sets": {...},
 *   "follow_sets": {...}
 * }
 * </pre>
 *
 * <pre>is_slr1</pre>, <pre>first_sets</pre> and <pre>follow_sets</pre> are only part of SLR(1)
 * documents. For SLR(1) documents <pre>is_lr0</pre> equals <pre>is_slr1</pre>.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonPropertyOrder({"parser_type", "augmented_grammar", "states", "action_table", "goto_table", "dfa_transitions",
		"terminals", "non_terminals", "shift_reduce_conflicts", "reduce_reduce_conflicts", "is_lr0", "is_slr1",
		"num_states", "first_sets", "follow_sets"})
public class GenerationReport {

	@JsonPropertyOrder({"id", "items"})
	public static class StateEntry {
		@JsonProperty("id")
		public final int id;
		@JsonProperty("items")
		public final List<String> items;

		StateEntry(State state) {
			this.id = state.id;
			this.items = state.getItems().stream().map(Object::toString).collect(Collectors.toList());
		}
	}

	@JsonPropertyOrder({"from", "to", "symbol"})
	public static class TransitionEntry {
		@JsonProperty("from")
		public final int from;
		@JsonProperty("to")
		public final int to;
		@JsonProperty("symbol")
		public final String symbol;

		TransitionEntry(Transition transition) {
			this.from = transition.from;
			this.to = transition.to;
			this.symbol = transition.symbol.name;
		}
	}

	@JsonPropertyOrder({"state", "symbol", "shift", "reduce"})
	public static class ShiftReduceEntry {
		@JsonProperty("state")
		public final int state;
		@JsonProperty("symbol")
		public final String symbol;
		@JsonProperty("shift")
		public final String shift;
		@JsonProperty("reduce")
		public final String reduce;

		ShiftReduceEntry(Conflict conflict) {
			this.state = conflict.state;
			this.symbol = conflict.symbol.name;
			this.shift = conflict.shiftAction().toString();
			this.reduce = conflict.reduceAction().toString();
		}
	}

	/**
	 * <pre>reduce1</pre> is the action that stays in the table
	 */
	@JsonPropertyOrder({"state", "symbol", "reduce1", "reduce2"})
	public static class ReduceReduceEntry {
		@JsonProperty("state")
		public final int state;
		@JsonProperty("symbol")
		public final String symbol;
		@JsonProperty("reduce1")
		public final String reduce1;
		@JsonProperty("reduce2")
		public final String reduce2;

		ReduceReduceEntry(Conflict conflict) {
			this.state = conflict.state;
			this.symbol = conflict.symbol.name;
			this.reduce1 = conflict.kept.toString();
			this.reduce2 = conflict.discarded.toString();
		}
	}

	@JsonProperty("parser_type")
	public final String parserType;

	@JsonProperty("augmented_grammar")
	public final List<String> augmentedGrammar = new ArrayList<>();

	@JsonProperty("states")
	public final List<StateEntry> states = new ArrayList<>();

	@JsonProperty("action_table")
	public final Map<Integer, Map<String, String>> actionTable = new LinkedHashMap<>();

	@JsonProperty("goto_table")
	public final Map<Integer, Map<String, Integer>> gotoTable = new LinkedHashMap<>();

	@JsonProperty("dfa_transitions")
	public final List<TransitionEntry> dfaTransitions = new ArrayList<>();

	@JsonProperty("terminals")
	public final List<String> terminals;

	@JsonProperty("non_terminals")
	public final List<String> nonTerminals;

	@JsonProperty("shift_reduce_conflicts")
	public final List<ShiftReduceEntry> shiftReduceConflicts;

	@JsonProperty("reduce_reduce_conflicts")
	public final List<ReduceReduceEntry> reduceReduceConflicts;

	@JsonProperty("is_lr0")
	public final boolean isLr0;

	@JsonProperty("is_slr1")
	public final Boolean isSlr1;

	@JsonProperty("num_states")
	public final int numStates;

	@JsonProperty("first_sets")
	public final Map<String, List<String>> firstSets;

	@JsonProperty("follow_sets")
	public final Map<String, List<String>> followSets;

	public GenerationReport(LRParserTable table) {
		Grammar grammar = table.grammar;
		this.parserType = table.parserType.id;
		for (Production production : grammar.getProductions()){
			augmentedGrammar.add(production.toString());
		}
		for (State state : table.graph.getStates()){
			states.add(new StateEntry(state));
			Map<String, String> actions = new LinkedHashMap<>();
			for (Terminal terminal : grammar.getTerminalsWithEndMarker()){
				LRParserTable.Action action = table.getAction(state.id, terminal);
				if (action != null){
					actions.put(terminal.name, action.toString());
				}
			}
			if (!actions.isEmpty()){
				actionTable.put(state.id, actions);
			}
			Map<String, Integer> gotos = new LinkedHashMap<>();
			table.getGotos(state.id).forEach((n, s) -> gotos.put(n.name, s));
			if (!gotos.isEmpty()){
				gotoTable.put(state.id, gotos);
			}
		}
		for (Transition transition : table.graph.getTransitions()){
			dfaTransitions.add(new TransitionEntry(transition));
		}
		this.terminals = grammar.getTerminals().stream().map(t -> t.name).sorted()
				.collect(Collectors.toCollection(ArrayList::new));
		this.terminals.add(Terminal.END_MARKER.name);
		this.nonTerminals = grammar.getNonTerminals().stream().map(n -> n.name).sorted().collect(Collectors.toList());
		this.shiftReduceConflicts = table.getShiftReduceConflicts().stream().map(ShiftReduceEntry::new)
				.collect(Collectors.toList());
		this.reduceReduceConflicts = table.getReduceReduceConflicts().stream().map(ReduceReduceEntry::new)
				.collect(Collectors.toList());
		this.isLr0 = table.isConflictFree();
		this.numStates = table.getStateCount();
		if (table.parserType == ParserType.SLR1){
			FirstFollowSets sets = grammar.getFirstFollowSets();
			this.isSlr1 = table.isConflictFree();
			this.firstSets = new TreeMap<>();
			for (Map.Entry<Symbol, Set<Terminal>> entry : sets.getFirstSets().entrySet()){
				firstSets.put(entry.getKey().name, sortedNames(entry.getValue()));
			}
			this.followSets = new TreeMap<>();
			for (Map.Entry<NonTerminal, Set<Terminal>> entry : sets.getFollowSets().entrySet()){
				followSets.put(entry.getKey().name, sortedNames(entry.getValue()));
			}
		} else {
			this.isSlr1 = null;
			this.firstSets = null;
			this.followSets = null;
		}
	}

	private static List<String> sortedNames(Set<Terminal> terminals){
		return terminals.stream().map(t -> t.name).sorted().collect(Collectors.toList());
	}
}
