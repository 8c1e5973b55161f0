package edu.uw.chordccg.syntax.parser;

import java.io.File;
import java.util.Arrays;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

import edu.uw.chordccg.syntax.grammar.Grammar;
import edu.uw.chordccg.syntax.tagger.Tagger;
import edu.uw.chordccg.syntax.tagger.Tagger.TaggedSign;

/**
 * Settings and chart handling shared by the chart parsers.
 */
public abstract class AbstractParser {

	protected final Grammar grammar;
	protected final boolean derivations;
	protected final boolean allowComplex;
	protected final File dumpChartFile;
	protected final List<ParserListener> listeners;

	protected AbstractParser(final ParserBuilder<?, ?> builder) {
		this.grammar = builder.getGrammar();
		this.derivations = builder.getDerivations();
		this.allowComplex = builder.getAllowComplex();
		this.dumpChartFile = builder.getDumpChartFile();
		this.listeners = builder.getListeners();
	}

	public Grammar getGrammar() {
		return grammar;
	}

	protected Chart createChart(final Tagger tagger) {
		for (final ParserListener listener : listeners) {
			listener.handleNewInput(tagger.getInputTokens());
		}
		return new Chart(tagger.getInputLength(), grammar, derivations, allowComplex);
	}

	/**
	 * Adds the tagger's signs for the given offset to the chart. Returns the spans that got new signs, or an empty
	 * set if the tagger had nothing new.
	 */
	protected Set<List<Integer>> addTaggedSigns(final Chart chart, final Tagger tagger, final int offset) {
		return addTaggedSigns(chart, tagger.getInputTokens(), tagger.getSigns(offset));
	}

	protected Set<List<Integer>> addTaggedSigns(final Chart chart, final List<String> tokens,
			final List<TaggedSign> signs) {
		final Set<List<Integer>> result = new LinkedHashSet<>();
		for (final TaggedSign tagged : signs) {
			final String word = String.join(" ", tokens.subList(tagged.getStart(), tagged.getEnd()));
			if (chart.addLexicalSigns(Collections.singletonList(tagged.getSign()), tagged.getStart(), tagged.getEnd(),
					word)) {
				result.add(Arrays.asList(tagged.getStart(), tagged.getEnd()));
			}
		}
		return result;
	}

	/**
	 * Tells the listeners that signs were added to a span. Returns false if one of them wants parsing to stop.
	 */
	protected boolean notifyInsertion(final Chart chart, final int start, final int end) {
		boolean keepParsing = true;
		for (final ParserListener listener : listeners) {
			keepParsing = listener.handleChartInsertion(start, end, chart) && keepParsing;
		}
		return keepParsing;
	}

	protected void notifyCompletion(final ParseResult result) {
		for (final ParserListener listener : listeners) {
			listener.handleSearchCompletion(result, result.getChart().size());
		}
	}

	protected void dumpChart(final Chart chart) {
		if (dumpChartFile != null) {
			chart.dump(dumpChartFile);
		}
	}
}
