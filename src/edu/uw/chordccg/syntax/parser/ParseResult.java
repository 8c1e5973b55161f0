package edu.uw.chordccg.syntax.parser;

import java.util.List;

import com.google.common.collect.ImmutableList;

import edu.uw.chordccg.syntax.grammar.Sign;

/**
 * Outcome of parsing one input: the signs spanning the whole input, and how the search ended.
 */
public class ParseResult {
	private final List<Sign> parses;
	private final Chart chart;
	private final boolean timedOut;
	private final int iterations;
	private final boolean usedBackoff;

	public ParseResult(final List<Sign> parses, final Chart chart, final boolean timedOut, final int iterations,
			final boolean usedBackoff) {
		this.parses = ImmutableList.copyOf(parses);
		this.chart = chart;
		this.timedOut = timedOut;
		this.iterations = iterations;
		this.usedBackoff = usedBackoff;
	}

	public List<Sign> getParses() {
		return parses;
	}

	public boolean isEmpty() {
		return parses.isEmpty();
	}

	public Chart getChart() {
		return chart;
	}

	/**
	 * True if the parse was cut short by the timeout.
	 */
	public boolean isTimedOut() {
		return timedOut;
	}

	/**
	 * Number of times the tagger was asked for signs.
	 */
	public int getIterations() {
		return iterations;
	}

	/**
	 * True if the parses came from the backoff rather than the chart.
	 */
	public boolean isUsedBackoff() {
		return usedBackoff;
	}
}
