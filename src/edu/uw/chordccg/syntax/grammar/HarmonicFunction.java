package edu.uw.chordccg.syntax.grammar;

/**
 * Function labels of half-categories: tonic, dominant and subdominant.
 */
public enum HarmonicFunction {
	T, D, S;

	public static HarmonicFunction fromChar(final char label) {
		switch (label) {
		case 'T':
			return T;
		case 'D':
			return D;
		case 'S':
			return S;
		default:
			throw new IllegalArgumentException("Unknown function label: " + label);
		}
	}
}
