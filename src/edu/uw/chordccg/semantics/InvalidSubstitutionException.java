package edu.uw.chordccg.semantics;

/**
 * Thrown when a variable is substituted inside an abstraction that binds the same variable.
 */
public class InvalidSubstitutionException extends RuntimeException {
	private static final long serialVersionUID = 1L;

	public InvalidSubstitutionException(final String message) {
		super(message);
	}

	public InvalidSubstitutionException(final String message, final InvalidSubstitutionException cause) {
		super(message, cause);
	}
}
