package lrgen.parser.lr;

import java.io.File;
import java.io.IOException;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Deque;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.OptionalInt;

import guru.nidi.graphviz.attribute.Label;
import guru.nidi.graphviz.attribute.Shape;
import guru.nidi.graphviz.engine.Engine;
import guru.nidi.graphviz.engine.Format;
import guru.nidi.graphviz.engine.Graphviz;
import guru.nidi.graphviz.model.MutableGraph;
import guru.nidi.graphviz.model.MutableNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import lrgen.grammar.Grammar;
import lrgen.grammar.NonTerminal;
import lrgen.grammar.Symbol;
import lrgen.grammar.Terminal;
import lrgen.util.IterationGuard;

import static guru.nidi.graphviz.attribute.Attributes.attr;
import static guru.nidi.graphviz.model.Factory.mutGraph;
import static guru.nidi.graphviz.model.Factory.mutNode;
import static guru.nidi.graphviz.model.Factory.to;

/**
 * The LR(0) automaton of an augmented grammar.
 *
 * States are stored by id, the transitions as an edge list and as an adjacency map per state.
 */
public class Graph {

	private static final Logger logger = LoggerFactory.getLogger(Graph.class);

	private final Grammar grammar;
	private final List<State> states;
	private final List<Transition> transitions;
	private final List<Map<Symbol, Integer>> adjacentStates;

	private Graph(Grammar grammar, List<State> states, List<Transition> transitions,
	              List<Map<Symbol, Integer>> adjacentStates) {
		this.grammar = grammar;
		this.states = Collections.unmodifiableList(states);
		this.transitions = Collections.unmodifiableList(transitions);
		this.adjacentStates = adjacentStates;
	}

	/**
	 * Builds the automaton: state 0 is the closure of <pre>S' → •S</pre>, every other state is a non
	 * empty GOTO of a known state. States are processed in discovery order, the symbols of the grammar
	 * are tried terminals first. GOTO results equal to a known state reuse its id.
	 *
	 * @param grammar grammar, augmented if it isn't already
	 */
	public static Graph createFromGrammar(Grammar grammar){
		Grammar augmented = grammar.augment();
		List<Symbol> symbols = augmented.getSymbols();
		List<State> states = new ArrayList<>();
		List<Transition> transitions = new ArrayList<>();
		List<Map<Symbol, Integer>> adjacentStates = new ArrayList<>();
		Map<ItemSet, State> knownStates = new HashMap<>();

		State startState = new State(0, ItemSet.closure(augmented,
				Collections.singletonList(new Item(augmented.getStartProduction()))));
		states.add(startState);
		adjacentStates.add(new LinkedHashMap<>());
		knownStates.put(startState.itemSet(), startState);

		Deque<State> worklist = new ArrayDeque<>();
		worklist.add(startState);
		IterationGuard guard = new IterationGuard("LR(0) automaton construction",
				(long)augmented.maxItemCount() * (symbols.size() + 1) + 1);
		while (!worklist.isEmpty()){
			guard.next();
			State currentState = worklist.poll();
			for (Symbol symbol : symbols){
				ItemSet next = currentState.itemSet().goTo(augmented, symbol);
				if (next.isEmpty()){
					continue;
				}
				State nextState = knownStates.get(next);
				if (nextState == null){
					nextState = new State(states.size(), next);
					states.add(nextState);
					adjacentStates.add(new LinkedHashMap<>());
					knownStates.put(next, nextState);
					worklist.add(nextState);
				}
				transitions.add(new Transition(currentState.id, symbol, nextState.id));
				adjacentStates.get(currentState.id).put(symbol, nextState.id);
			}
		}
		logger.debug("Built LR(0) automaton with {} states and {} transitions", states.size(), transitions.size());
		return new Graph(augmented, states, transitions, adjacentStates);
	}

	/**
	 * Augmented grammar of the automaton
	 */
	public Grammar getGrammar() {
		return grammar;
	}

	public List<State> getStates() {
		return states;
	}

	public State getState(int id){
		return states.get(id);
	}

	public State getStartState(){
		return states.get(0);
	}

	public List<Transition> getTransitions() {
		return transitions;
	}

	/**
	 * Target of the transition from the state over the symbol, if there is one.
	 */
	public OptionalInt transition(int state, Symbol symbol){
		Integer target = adjacentStates.get(state).get(symbol);
		return target == null ? OptionalInt.empty() : OptionalInt.of(target);
	}

	/**
	 * Builds the ACTION and GOTO tables.
	 *
	 * Cells are filled state by state: first the shift actions of the items in front of terminals,
	 * then accept or the reduce actions of complete items, both in item order. If a cell is already
	 * set to a different action, the first action stays and a conflict is recorded.
	 */
	public LRParserTable toParserTable(ParserType type){
		return toParserTable(type, type.reduceFilter());
	}

	LRParserTable toParserTable(ParserType type, ReduceFilter filter){
		LRParserTable table = new LRParserTable(this, type);
		for (State state : states){
			for (Item item : state.itemSet()){
				if (item.inFrontOfTerminal()){
					Terminal terminal = (Terminal)item.nextSymbol();
					table.addShift(state.id, terminal, transition(state.id, terminal).getAsInt());
				}
			}
			for (Item item : state.itemSet()){
				if (!item.atEnd()){
					continue;
				}
				if (item.production.left.equals(grammar.getStart())){
					table.addAccept(state.id);
				} else {
					for (Terminal terminal : filter.lookaheads(grammar, item.production)){
						table.addReduce(state.id, terminal, item.production);
					}
				}
			}
			for (NonTerminal nonTerminal : grammar.getNonTerminals()){
				OptionalInt target = transition(state.id, nonTerminal);
				if (target.isPresent()){
					table.addGoto(state.id, nonTerminal, target.getAsInt());
				}
			}
		}
		table.logSummary();
		return table;
	}

	@Override
	public String toString() {
		StringBuilder builder = new StringBuilder();
		for (State state : states){
			if (state.id != 0){
				builder.append("\n–––––––\n");
			}
			builder.append(state.toString());
		}
		return builder.toString();
	}

	/**
	 * Graphviz model of the automaton: one box per state that lists its items, one labeled edge per
	 * transition.
	 */
	public MutableGraph toGraphviz(){
		MutableGraph graph = mutGraph("lr0").setDirected(true);
		graph.graphAttrs().add(attr("rankdir", "LR"));
		List<MutableNode> nodes = new ArrayList<>();
		for (State state : states){
			List<String> lines = new ArrayList<>();
			lines.add("State " + state.id);
			lines.addAll(state.itemSet().toStrings());
			nodes.add(mutNode("state" + state.id).add(Shape.RECTANGLE, Label.lines(lines.toArray(new String[0]))));
		}
		for (Transition transition : transitions){
			nodes.get(transition.from).addLink(to(nodes.get(transition.to)).with(Label.of(transition.symbol.name)));
		}
		for (MutableNode node : nodes){
			graph.add(node);
		}
		return graph;
	}

	/**
	 * The automaton in the dot language
	 */
	public String toGraphvizString(){
		return toGraphviz().toString();
	}

	/**
	 * Renders the automaton with graphviz.
	 */
	public void toImage(File file, Format format) throws IOException {
		Graphviz.fromGraph(toGraphviz()).engine(Engine.DOT).render(format).toFile(file);
	}
}
