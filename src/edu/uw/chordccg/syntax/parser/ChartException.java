package edu.uw.chordccg.syntax.parser;

/**
 * Thrown when a chart is used or loaded incorrectly.
 */
public class ChartException extends RuntimeException {
	private static final long serialVersionUID = 1L;

	public ChartException(final String message) {
		super(message);
	}

	public ChartException(final String message, final Throwable cause) {
		super(message, cause);
	}
}
