package lrgen.parser.lr;

import java.util.Locale;

import lrgen.LRGenException;

/**
 * The supported table construction methods. Both share the LR(0) automaton and differ only in
 * their {@link ReduceFilter}.
 */
public enum ParserType {

	LR0("lr0", "LR(0)", ReduceFilter.allTerminals()),
	SLR1("slr1", "SLR(1)", ReduceFilter.followSet());

	/**
	 * Name used on the command line and in reports
	 */
	public final String id;

	public final String displayName;

	private final ReduceFilter reduceFilter;

	ParserType(String id, String displayName, ReduceFilter reduceFilter) {
		this.id = id;
		this.displayName = displayName;
		this.reduceFilter = reduceFilter;
	}

	public ReduceFilter reduceFilter() {
		return reduceFilter;
	}

	/**
	 * @param name "lr0" or "slr1", case insensitive
	 */
	public static ParserType fromName(String name){
		if (name != null){
			String normalized = name.trim().toLowerCase(Locale.ROOT);
			for (ParserType type : values()) {
				if (type.id.equals(normalized)){
					return type;
				}
			}
		}
		throw new LRGenException(String.format("Unknown parser type \"%s\", expected lr0 or slr1", name));
	}

	@Override
	public String toString() {
		return displayName;
	}
}
