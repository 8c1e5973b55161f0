package edu.uw.chordccg.syntax.parser;

import java.util.ArrayList;
import java.util.List;
import java.util.Set;
import java.util.concurrent.TimeUnit;

import com.google.common.base.Stopwatch;

import edu.uw.chordccg.semantics.Semantics;
import edu.uw.chordccg.syntax.grammar.Category;
import edu.uw.chordccg.syntax.grammar.Sign;
import edu.uw.chordccg.syntax.tagger.Tagger;

/**
 * CKY chart parser. The tagger is asked for signs repeatedly, with an increasing offset, and after each round the
 * chart is filled bottom-up, until enough parses have been found or the tagger runs out of signs.
 */
public class ParserCKY extends AbstractParser implements Parser {

	private final int maxIterations;
	private final int minIterations;
	private final int requiredParses;
	private final int timeoutSeconds;
	private final Backoff backoff;

	protected ParserCKY(final Builder builder) {
		super(builder);
		this.maxIterations = builder.getMaxIterations();
		this.minIterations = builder.getMinIterations();
		this.requiredParses = builder.getRequiredParses();
		this.timeoutSeconds = builder.getTimeoutSeconds();
		this.backoff = builder.getBackoff();
	}

	// Why the sweep over the chart stopped early.
	private enum Interruption {
		NONE, TIMEOUT, LISTENER
	}

	@Override
	public ParseResult parse(final Tagger tagger) {
		final int length = tagger.getInputLength();
		final Chart chart = createChart(tagger);
		dumpChart(chart);

		if (timeoutSeconds > 0) {
			System.err.println("Timing out after " + timeoutSeconds + " seconds");
		}
		final Stopwatch stopwatch = Stopwatch.createStarted();

		int offset = 0;
		Interruption interruption = Interruption.NONE;
		while (minIterations == -1 || offset < minIterations || chart.getParses().size() < requiredParses) {
			if (maxIterations > 0 && offset >= maxIterations) {
				System.err.println("Reached maximum number of iterations: continuing to backoff/fail");
				break;
			}
			System.err.println(">>> Parsing iteration: " + (offset + 1));

			final Set<List<Integer>> added = addTaggedSigns(chart, tagger, offset);
			if (added.isEmpty()) {
				System.err.println("No new signs added: ending parse");
				break;
			}
			for (final List<Integer> span : added) {
				if (chart.applyUnaryRules(span.get(0), span.get(1))) {
					notifyInsertion(chart, span.get(0), span.get(1));
				}
			}

			interruption = sweep(chart, length, stopwatch);
			offset++;
			dumpChart(chart);
			if (interruption != Interruption.NONE) {
				break;
			}
		}

		final boolean timedOut = interruption == Interruption.TIMEOUT;
		if (timedOut) {
			System.err.println("Parse timeout (" + timeoutSeconds + " secs) expired: continuing to backoff/fail");
		}

		List<Sign> parses = chart.getParses();
		boolean usedBackoff = false;
		if (parses.isEmpty() && backoff != null) {
			System.err.println("Using backoff model");
			parses = new ArrayList<>();
			for (final Semantics semantics : backoff.getResults(tagger)) {
				parses.add(new Sign(Category.PLACEHOLDER, semantics));
			}
			usedBackoff = !parses.isEmpty();
		} else if (parses.isEmpty()) {
			System.err.println("Parse finished with no results");
		} else {
			System.err.println("Parse finished with " + parses.size() + " results");
		}

		final ParseResult result = new ParseResult(parses, chart, timedOut, offset, usedBackoff);
		notifyCompletion(result);
		return result;
	}

	/**
	 * Fills the chart bottom-up, for every end in turn and then every start from right to left.
	 */
	private Interruption sweep(final Chart chart, final int length, final Stopwatch stopwatch) {
		for (int end = 1; end <= length; end++) {
			if (chart.applyUnaryRules(end - 1, end) && !notifyInsertion(chart, end - 1, end)) {
				return Interruption.LISTENER;
			}

			for (int start = end - 2; start >= 0; start--) {
				for (int middle = start + 1; middle < end; middle++) {
					if (chart.applyBinaryRules(start, middle, end) && !notifyInsertion(chart, start, end)) {
						return Interruption.LISTENER;
					}

					if (timeoutSeconds > 0 && stopwatch.elapsed(TimeUnit.SECONDS) >= timeoutSeconds) {
						return Interruption.TIMEOUT;
					}
				}

				if (chart.applyUnaryRules(start, end) && !notifyInsertion(chart, start, end)) {
					return Interruption.LISTENER;
				}
			}
		}
		return Interruption.NONE;
	}

	public static class Builder extends ParserBuilder<Builder, ParserCKY> {

		public Builder() {
			super();
		}

		@Override
		protected ParserCKY build2() {
			return new ParserCKY(this);
		}
	}
}
