package edu.uw.chordccg.semantics;

/**
 * Predicate literals of the tonal-space semantics.
 */
public enum Predicate {
	LEFTONTO("leftonto"), RIGHTONTO("rightonto"), NOW("now");

	private final String name;

	Predicate(final String name) {
		this.name = name;
	}

	public String getName() {
		return name;
	}

	public static Predicate fromName(final String name) {
		for (final Predicate predicate : values()) {
			if (predicate.name.equals(name)) {
				return predicate;
			}
		}
		throw new IllegalArgumentException("Unknown predicate: " + name);
	}
}
