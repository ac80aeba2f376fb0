package lrgen.parser.lr;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import lrgen.grammar.Grammar;
import lrgen.grammar.NonTerminal;
import lrgen.grammar.Production;
import lrgen.grammar.Terminal;

/**
 * ACTION and GOTO table of an LR(0) or SLR(1) parser.
 *
 * Each cell holds at most one action. Inserting a different action into an occupied cell keeps the
 * first action and records a {@link Conflict}.
 */
public class LRParserTable {

	private static final Logger logger = LoggerFactory.getLogger(LRParserTable.class);

	public final ParserType parserType;

	public final Graph graph;

	/**
	 * Augmented grammar
	 */
	public final Grammar grammar;

	/**
	 * Mapping of terminal to action for each state.
	 */
	private final List<Map<Terminal, Action>> actionTable = new ArrayList<>();

	/**
	 * Mapping of non terminal to next state (for each state).
	 */
	private final List<Map<NonTerminal, Integer>> gotoTable = new ArrayList<>();

	private final List<Conflict> conflicts = new ArrayList<>();

	LRParserTable(Graph graph, ParserType parserType) {
		this.graph = graph;
		this.grammar = graph.getGrammar();
		this.parserType = parserType;
		for (int i = 0; i < graph.getStates().size(); i++){
			actionTable.add(new LinkedHashMap<>());
			gotoTable.add(new LinkedHashMap<>());
		}
	}

	public static abstract class Action {

		public abstract String name();
	}

	public static class ShiftAction extends Action {

		public final int stateToBeShifted;

		public ShiftAction(int stateToBeShifted) {
			this.stateToBeShifted = stateToBeShifted;
		}

		@Override
		public String toString() {
			return "s" + stateToBeShifted;
		}

		@Override
		public String name() {
			return "shift";
		}

		@Override
		public boolean equals(Object obj) {
			return obj instanceof ShiftAction && ((ShiftAction)obj).stateToBeShifted == stateToBeShifted;
		}

		@Override
		public int hashCode() {
			return stateToBeShifted;
		}
	}

	public static class ReduceAction extends Action {

		public final Production production;

		public ReduceAction(Production production) {
			this.production = production;
		}

		@Override
		public String toString() {
			return "r" + production.id;
		}

		@Override
		public String name() {
			return "reduce";
		}

		@Override
		public boolean equals(Object obj) {
			return obj instanceof ReduceAction && ((ReduceAction)obj).production.id == production.id;
		}

		@Override
		public int hashCode() {
			return -production.id - 1;
		}
	}

	/**
	 * Reduction by the start production at the end of the input
	 */
	public static class Accept extends Action {

		@Override
		public String toString() {
			return "accept";
		}

		@Override
		public String name() {
			return "accept";
		}

		@Override
		public boolean equals(Object obj) {
			return obj instanceof Accept;
		}

		@Override
		public int hashCode() {
			return Integer.MIN_VALUE;
		}
	}

	private void insert(int state, Terminal terminal, Action action){
		Map<Terminal, Action> row = actionTable.get(state);
		Action current = row.get(terminal);
		if (current == null){
			row.put(terminal, action);
		} else if (!current.equals(action)){
			Conflict conflict = new Conflict(state, terminal, current, action);
			logger.debug("{}", conflict);
			conflicts.add(conflict);
		}
	}

	void addShift(int state, Terminal terminal, int newState){
		insert(state, terminal, new ShiftAction(newState));
	}

	void addReduce(int state, Terminal terminal, Production production){
		insert(state, terminal, new ReduceAction(production));
	}

	void addAccept(int state){
		insert(state, Terminal.END_MARKER, new Accept());
	}

	void addGoto(int state, NonTerminal nonTerminal, int newState){
		gotoTable.get(state).put(nonTerminal, newState);
	}

	void logSummary(){
		logger.info("Generated {} table with {} states and {} conflicts", parserType, actionTable.size(), conflicts.size());
	}

	public int getStateCount(){
		return actionTable.size();
	}

	/**
	 * @return action or null if the cell is empty
	 */
	public Action getAction(int state, Terminal terminal){
		return actionTable.get(state).get(terminal);
	}

	/**
	 * @return next state or null if the cell is empty
	 */
	public Integer getGoto(int state, NonTerminal nonTerminal){
		return gotoTable.get(state).get(nonTerminal);
	}

	/**
	 * GOTO entries of the state, in non terminal order
	 */
	public Map<NonTerminal, Integer> getGotos(int state){
		return Collections.unmodifiableMap(gotoTable.get(state));
	}

	/**
	 * Terminals that have an action in the state, the expected tokens
	 */
	public List<Terminal> getExpectedTerminals(int state){
		return grammar.getTerminalsWithEndMarker().stream()
				.filter(actionTable.get(state)::containsKey).collect(Collectors.toList());
	}

	/**
	 * All recorded conflicts in the order they were detected
	 */
	public List<Conflict> getConflicts(){
		return Collections.unmodifiableList(conflicts);
	}

	public List<Conflict> getShiftReduceConflicts(){
		return conflictsOfKind(Conflict.Kind.SHIFT_REDUCE);
	}

	public List<Conflict> getReduceReduceConflicts(){
		return conflictsOfKind(Conflict.Kind.REDUCE_REDUCE);
	}

	private List<Conflict> conflictsOfKind(Conflict.Kind kind){
		return conflicts.stream().filter(c -> c.kind == kind).collect(Collectors.toList());
	}

	/**
	 * Is the grammar LR(0) (or SLR(1) for SLR(1) tables)?
	 */
	public boolean isConflictFree(){
		return conflicts.isEmpty();
	}

	@Override
	public String toString() {
		List<Terminal> terminals = grammar.getTerminalsWithEndMarker();
		StringBuilder builder = new StringBuilder();
		for (int i = 0; i < actionTable.size(); i++){
			if (i != 0){
				builder.append("\n");
			}
			builder.append(String.format("State = %5d: ", i));
			builder.append(" Actions = [");
			Map<Terminal, Action> row = actionTable.get(i);
			boolean first = true;
			for (Terminal terminal : terminals){
				if (row.containsKey(terminal)){
					if (!first){
						builder.append(", ");
					}
					first = false;
					builder.append(terminal).append(" = ").append(row.get(terminal));
				}
			}
			builder.append("] GOTO = ");
			builder.append(gotoTable.get(i));
		}
		return builder.toString();
	}
}
