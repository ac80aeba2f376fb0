package lrgen.util;

/**
 * Counts the passes of a fixpoint iteration and fails if their number exceeds a bound that a
 * terminating iteration can't reach.
 */
public class IterationGuard {

	private final String name;
	private final long maxIterations;
	private long iterations = 0;

	/**
	 * @param name name of the iteration, used in the error message
	 * @param maxIterations maximum number of passes
	 */
	public IterationGuard(String name, long maxIterations) {
		this.name = name;
		this.maxIterations = maxIterations;
	}

	/**
	 * Register another pass.
	 *
	 * @throws IllegalStateException if the maximum number of passes is exceeded
	 */
	public void next(){
		if (++iterations > maxIterations){
			throw new IllegalStateException(String.format("Internal error: %s didn't reach a fixpoint " +
					"after %d iterations", name, maxIterations));
		}
	}

	public long getIterations() {
		return iterations;
	}
}
