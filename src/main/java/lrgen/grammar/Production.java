package lrgen.grammar;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * A grammar production with a left and a right hand side.
 */
public class Production {

	public static final String ARROW = "→";

	public static final String EPSILON = "ε";

	/**
	 * Id of the production, its index in the productions of the grammar
	 */
	public final int id;
	/**
	 * Left hand side of the production (the defined non terminal)
	 */
	public final NonTerminal left;
	/**
	 * Right hand side of the production, empty for an ε production
	 */
	public final List<Symbol> right;

	public Production(int id, NonTerminal left, List<? extends Symbol> right) {
		this.id = id;
		this.left = Objects.requireNonNull(left);
		this.right = Collections.unmodifiableList(new ArrayList<>(right));
	}

	/**
	 * Same production with another id
	 */
	public Production withId(int newId){
		return new Production(newId, left, right);
	}

	public boolean isEpsilonProduction(){
		return right.isEmpty();
	}

	/**
	 * Size of the right hand side.
	 */
	public int rightSize(){
		return right.size();
	}

	public String formatRightSide(){
		if (right.isEmpty()){
			return EPSILON;
		}
		StringBuilder builder = new StringBuilder();
		for (int i = 0; i < right.size(); i++) {
			if (i != 0) {
				builder.append(" ");
			}
			builder.append(right.get(i));
		}
		return builder.toString();
	}

	@Override
	public String toString() {
		return left + " " + ARROW + " " + formatRightSide();
	}

	@Override
	public boolean equals(Object obj) {
		if (!(obj instanceof Production)){
			return false;
		}
		Production other = (Production)obj;
		return other.id == id && other.left.equals(left) && other.right.equals(right);
	}

	@Override
	public int hashCode() {
		return Objects.hash(id, left, right);
	}
}
