package edu.uw.chordccg.syntax.parser;

import edu.uw.chordccg.syntax.grammar.Grammar;
import edu.uw.chordccg.syntax.tagger.Tagger;

public interface Parser {

	/**
	 * Parses the input of the tagger, asking it for signs as needed.
	 */
	ParseResult parse(Tagger tagger);

	Grammar getGrammar();
}
