package edu.uw.chordccg.semantics;

/**
 * The kinds of node a logical form is built from. Kinds that change the meaning of function application carry a
 * {@link CustomApplication}.
 */
public enum NodeType {
	VARIABLE(null),
	ABSTRACTION(null),
	APPLICATION(null),
	PREDICATE(CustomApplication.PREDICATE),
	COORDINATE(null),
	// A path through the tonal space.
	LIST(null),
	// Concatenation of paths, collapsed once all its parts are paths.
	LIST_CAT(null),
	// Cadences sharing one resolution.
	COORDINATION(CustomApplication.ONTO_PATH);

	private final CustomApplication customApplication;

	NodeType(final CustomApplication customApplication) {
		this.customApplication = customApplication;
	}

	/**
	 * @return the application behaviour of functors of this kind, or null if they have no special behaviour.
	 */
	public CustomApplication getCustomApplication() {
		return customApplication;
	}
}
