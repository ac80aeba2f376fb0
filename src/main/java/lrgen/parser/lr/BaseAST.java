package lrgen.parser.lr;

import java.util.ArrayList;
import java.util.List;

import lrgen.grammar.Symbol;
import lrgen.grammar.Terminal;

/**
 * A node of the parse tree
 */
public abstract class BaseAST {

	/**
	 * Grammar symbol the node stands for
	 */
	public abstract Symbol symbol();

	/**
	 * Terminals of the leafs below this node, from left to right
	 */
	public abstract List<Terminal> getMatchedTerminals();

	public List<BaseAST> children(){
		return new ArrayList<>();
	}

	/**
	 * Tokens of the leafs below this node
	 */
	public List<String> getMatchedTokens(){
		List<String> tokens = new ArrayList<>();
		for (Terminal terminal : getMatchedTerminals()){
			tokens.add(terminal.name);
		}
		return tokens;
	}

	public String getMatchedString(){
		return String.join(" ", getMatchedTokens());
	}

	@Override
	public String toString() {
		StringBuilder builder = new StringBuilder();
		builder.append("(").append(type());
		for (BaseAST child : children()){
			builder.append(" ");
			builder.append(child);
		}
		builder.append(")");
		return builder.toString();
	}

	public String toPrettyString(){
		return toPrettyString("", "\t");
	}

	public String toPrettyString(String indent, String incr){
		StringBuilder builder = new StringBuilder();
		builder.append(indent);
		builder.append("(").append(type());
		builder.append("\n");
		List<BaseAST> children = children();
		for (int i = 0; i < children.size(); i++){
			builder.append(children.get(i).toPrettyString(indent + incr, incr)).append("\n");
		}
		if (builder.codePointAt(builder.length() - 1) == '\n') {
			builder.deleteCharAt(builder.length() - 1);
		}
		builder.append(")");
		return builder.toString();
	}

	public String type(){
		return symbol().name;
	}
}
