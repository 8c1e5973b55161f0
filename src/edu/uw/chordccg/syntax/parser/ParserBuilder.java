package edu.uw.chordccg.syntax.parser;

import java.io.File;
import java.util.Collections;
import java.util.List;

import edu.uw.chordccg.syntax.grammar.Grammar;

public abstract class ParserBuilder<T extends ParserBuilder<T, P>, P extends AbstractParser> {

	ParserBuilder() {
	}

	private Grammar grammar = Grammar.STANDARD;
	private int maxIterations = 0;
	private int minIterations = 0;
	private int requiredParses = 1;
	private int timeoutSeconds = 0;
	private boolean derivations = false;
	private boolean allowComplex = false;
	private Backoff backoff;
	private File dumpChartFile;
	private List<ParserListener> listeners = Collections.emptyList();

	public Grammar getGrammar() {
		return grammar;
	}

	/**
	 * Maximum number of times to ask the tagger for signs. 0 means no limit.
	 */
	public int getMaxIterations() {
		return maxIterations;
	}

	/**
	 * Keep asking the tagger for signs at least this many times, even once enough parses have been found. -1 means
	 * keep going until the tagger has nothing left.
	 */
	public int getMinIterations() {
		return minIterations;
	}

	public int getRequiredParses() {
		return requiredParses;
	}

	/**
	 * 0 means no timeout.
	 */
	public int getTimeoutSeconds() {
		return timeoutSeconds;
	}

	public boolean getDerivations() {
		return derivations;
	}

	public boolean getAllowComplex() {
		return allowComplex;
	}

	public Backoff getBackoff() {
		return backoff;
	}

	public File getDumpChartFile() {
		return dumpChartFile;
	}

	public List<ParserListener> getListeners() {
		return listeners;
	}

	public T grammar(final Grammar grammar) {
		this.grammar = grammar;
		return getThis();
	}

	public T maxIterations(final int maxIterations) {
		this.maxIterations = maxIterations;
		return getThis();
	}

	public T minIterations(final int minIterations) {
		this.minIterations = minIterations;
		return getThis();
	}

	public T requiredParses(final int requiredParses) {
		this.requiredParses = requiredParses;
		return getThis();
	}

	public T timeoutSeconds(final int timeoutSeconds) {
		this.timeoutSeconds = timeoutSeconds;
		return getThis();
	}

	public T derivations(final boolean derivations) {
		this.derivations = derivations;
		return getThis();
	}

	public T allowComplex(final boolean allowComplex) {
		this.allowComplex = allowComplex;
		return getThis();
	}

	public T backoff(final Backoff backoff) {
		this.backoff = backoff;
		return getThis();
	}

	public T dumpChart(final File dumpChartFile) {
		this.dumpChartFile = dumpChartFile;
		return getThis();
	}

	public T listeners(final List<ParserListener> listeners) {
		this.listeners = listeners;
		return getThis();
	}

	@SuppressWarnings("unchecked")
	T getThis() {
		return (T) this;
	}

	public P build() {
		if (grammar == null) {
			throw new IllegalStateException("No grammar given");
		}
		if (requiredParses < 1) {
			throw new IllegalArgumentException("Need to look for at least one parse, not " + requiredParses);
		}
		return build2();
	}

	protected abstract P build2();
}
