package lrgen;

/**
 * Base class of all exceptions thrown while building or using a parser table.
 */
public class LRGenException extends RuntimeException {

	public LRGenException(String message) {
		super(message);
	}

	public LRGenException(String message, Throwable cause) {
		super(message, cause);
	}
}
