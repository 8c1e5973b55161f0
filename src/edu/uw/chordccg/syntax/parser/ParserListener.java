package edu.uw.chordccg.syntax.parser;

import java.util.List;

public interface ParserListener {
	void handleNewInput(final List<String> tokens);

	// Returns whether or not to keep parsing.
	boolean handleChartInsertion(final int start, final int end, final Chart chart);

	void handleSearchCompletion(final ParseResult result, final int chartSize);
}
