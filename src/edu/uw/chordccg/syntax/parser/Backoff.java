package edu.uw.chordccg.syntax.parser;

import java.util.List;

import edu.uw.chordccg.semantics.Semantics;
import edu.uw.chordccg.syntax.tagger.Tagger;

/**
 * Source of analyses for when the chart finds no parse, e.g. a model that guesses a tonal-space path directly from
 * the chords.
 */
public interface Backoff {
	/**
	 * Logical forms for the whole input given to the tagger, best first. May be empty.
	 */
	List<Semantics> getResults(Tagger tagger);
}
