package edu.uw.chordccg.syntax.parser;

import java.io.File;
import java.io.FileInputStream;
import java.io.FileOutputStream;
import java.io.IOException;
import java.io.ObjectInputStream;
import java.io.ObjectOutputStream;
import java.io.Serializable;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collection;
import java.util.List;

import com.google.common.base.Strings;

import edu.uw.chordccg.syntax.grammar.Category;
import edu.uw.chordccg.syntax.grammar.Combinator;
import edu.uw.chordccg.syntax.grammar.DerivationTrace;
import edu.uw.chordccg.syntax.grammar.Grammar;
import edu.uw.chordccg.syntax.grammar.Sign;

/**
 * Table of the signs found for every span of the input. The cell for a span (start, end) is stored at
 * cells[start][end - start - 1].
 */
public class Chart implements Serializable {
	private static final long serialVersionUID = 1L;

	private final ChartCell[][] cells;
	private final int length;
	private final boolean derivations;
	private final boolean allowComplex;
	// Rules are singletons, so the grammar is not written to dumps.
	private transient Grammar grammar;

	public Chart(final int length, final Grammar grammar, final boolean derivations, final boolean allowComplex) {
		this.length = length;
		this.grammar = grammar;
		this.derivations = derivations;
		this.allowComplex = allowComplex;

		cells = new ChartCell[length][];
		for (int start = 0; start < length; start++) {
			cells[start] = new ChartCell[length - start];
			for (int i = 0; i < cells[start].length; i++) {
				cells[start][i] = new ChartCell(derivations);
			}
		}
	}

	public int getLength() {
		return length;
	}

	public boolean isRecordingDerivations() {
		return derivations;
	}

	public Grammar getGrammar() {
		return grammar;
	}

	public ChartCell getCell(final int start, final int end) {
		if (start < 0 || end > length || start >= end) {
			throw new ChartException("No span (" + start + "," + end + ") in a chart of length " + length);
		}
		return cells[start][end - start - 1];
	}

	public List<Sign> getSigns(final int start, final int end) {
		return getCell(start, end).getSigns();
	}

	public Sign getSign(final int start, final int end, final int index) {
		return getCell(start, end).getSign(index);
	}

	/**
	 * Signs of the cell, in groups that share a category.
	 */
	public List<List<Sign>> getGroupedSigns(final int start, final int end) {
		return getCell(start, end).getGroupedSigns();
	}

	/**
	 * Every pair of a sign from (start, middle) and a sign from (middle, end).
	 */
	public List<Sign[]> getSignPairs(final int start, final int middle, final int end) {
		final List<Sign[]> result = new ArrayList<>();
		for (final Sign first : getSigns(start, middle)) {
			for (final Sign second : getSigns(middle, end)) {
				result.add(new Sign[] { first, second });
			}
		}
		return result;
	}

	/**
	 * Every pair of a category group from (start, middle) and a category group from (middle, end).
	 */
	public List<List<List<Sign>>> getGroupedSignPairs(final int start, final int middle, final int end) {
		final List<List<List<Sign>>> result = new ArrayList<>();
		for (final List<Sign> first : getGroupedSigns(start, middle)) {
			for (final List<Sign> second : getGroupedSigns(middle, end)) {
				result.add(Arrays.asList(first, second));
			}
		}
		return result;
	}

	/**
	 * Adds lexical signs for a word spanning (start, end). Returns true if any were new.
	 */
	public boolean addLexicalSigns(final Collection<Sign> signs, final int start, final int end, final String word) {
		if (derivations) {
			for (final Sign sign : signs) {
				sign.setDerivationTrace(new DerivationTrace(sign, word));
			}
		}
		return getCell(start, end).addAll(signs);
	}

	/**
	 * Signs spanning the whole input. Unless complex categories are allowed, only signs with atomic categories
	 * count as parses.
	 */
	public List<Sign> getParses() {
		return getParses(allowComplex);
	}

	public List<Sign> getParses(final boolean includeComplex) {
		if (length == 0) {
			return new ArrayList<>();
		}
		final List<Sign> result = new ArrayList<>();
		for (final Sign sign : getSigns(0, length)) {
			if (includeComplex || sign.getCategory().isAtomic()) {
				result.add(sign);
			}
		}
		return result;
	}

	/**
	 * Applies every unary rule of the grammar to the signs in (start, end). Returns true if anything was added.
	 */
	public boolean applyUnaryRules(final int start, final int end) {
		boolean added = false;
		for (final Combinator rule : grammar.getUnaryRules()) {
			added = applyUnaryRule(rule, start, end) || added;
		}
		return added;
	}

	public boolean applyUnaryRule(final Combinator rule, final int start, final int end) {
		final ChartCell cell = getCell(start, end);
		final List<Sign> results = new ArrayList<>();
		for (final Sign sign : cell.getSigns()) {
			if (sign.isRuleApplied(rule)) {
				continue;
			}
			final List<Sign> signs = rule.apply(sign);
			if (signs != null) {
				for (final Sign result : signs) {
					recordDerivation(result, rule, sign);
					results.add(result);
				}
			}
			sign.noteRuleApplied(rule);
		}
		return cell.addAll(results);
	}

	/**
	 * Adds to (start, end) everything that the grammar's binary rules derive from pairs of signs in (start, middle)
	 * and (middle, end). Each rule is tried once on the categories of each pair of groups. Where it applies, only the
	 * logical form is built for the individual pairs. Returns true if anything was added.
	 */
	public boolean applyBinaryRules(final int start, final int middle, final int end) {
		final List<Sign> results = new ArrayList<>();
		for (final List<List<Sign>> groups : getGroupedSignPairs(start, middle, end)) {
			for (final Combinator rule : grammar.getBinaryRules()) {
				applyToGroups(rule, groups.get(0), groups.get(1), results);
			}
		}
		return getCell(start, end).addAll(results);
	}

	/**
	 * Applies a single binary rule to all pairs of signs in (start, middle) and (middle, end).
	 */
	public boolean applyBinaryRule(final Combinator rule, final int start, final int middle, final int end) {
		final List<Sign> results = new ArrayList<>();
		for (final List<List<Sign>> groups : getGroupedSignPairs(start, middle, end)) {
			applyToGroups(rule, groups.get(0), groups.get(1), results);
		}
		return getCell(start, end).addAll(results);
	}

	private void applyToGroups(final Combinator rule, final List<Sign> firstGroup, final List<Sign> secondGroup,
			final List<Sign> results) {
		final Category category = rule.applySyntax(Arrays.asList(firstGroup.get(0).getCategory(), secondGroup.get(0)
				.getCategory()));
		if (category == null) {
			return;
		}

		for (final Sign first : firstGroup) {
			for (final Sign second : secondGroup) {
				if (first.isRuleApplied(rule, second)) {
					continue;
				}
				final Sign result = rule.applySemantics(category, Arrays.asList(first, second));
				recordDerivation(result, rule, first, second);
				results.add(result);
				first.noteRuleApplied(rule, second);
			}
		}
	}

	private void recordDerivation(final Sign result, final Combinator rule, final Sign... inputs) {
		if (!derivations) {
			return;
		}
		final List<DerivationTrace> traces = new ArrayList<>(inputs.length);
		for (final Sign input : inputs) {
			traces.add(input.getDerivationTrace());
		}
		result.setDerivationTrace(new DerivationTrace(result, rule, traces));
	}

	/**
	 * Total number of signs in the chart.
	 */
	public int size() {
		int result = 0;
		for (final ChartCell[] row : cells) {
			for (final ChartCell cell : row) {
				result += cell.size();
			}
		}
		return result;
	}

	@Override
	public String toString() {
		final StringBuilder result = new StringBuilder();
		for (int start = 0; start < length; start++) {
			result.append("\nEdges starting at ").append(start).append("\n");
			for (int end = start + 1; end <= length; end++) {
				result.append(" (").append(start).append(",").append(end).append("): ");
				final List<Sign> signs = getSigns(start, end);
				for (int i = 0; i < signs.size(); i++) {
					if (i > 0) {
						result.append(", ");
					}
					result.append("<").append(i).append("> ").append(signs.get(i));
				}
				result.append("\n");
			}
		}
		return result.toString();
	}

	/**
	 * Number of signs in each cell, with a row per start and a column per end.
	 */
	public String getSummary() {
		final StringBuilder result = new StringBuilder("\nF\\T");
		for (int end = 1; end <= length; end++) {
			result.append("\t").append(end);
		}
		result.append("\n\n");
		for (int start = 0; start < length; start++) {
			result.append(start).append("\t").append(Strings.repeat("-\t", start));
			for (int i = 0; i < cells[start].length; i++) {
				if (i > 0) {
					result.append("\t");
				}
				result.append(cells[start][i].size());
			}
			result.append("\n");
		}
		return result.toString();
	}

	/**
	 * Writes the chart, with its signs and derivation traces, to a file.
	 */
	public void dump(final File file) {
		try (ObjectOutputStream out = new ObjectOutputStream(new FileOutputStream(file))) {
			out.writeObject(this);
		} catch (final IOException e) {
			throw new ChartException("Could not write chart to " + file, e);
		}
	}

	/**
	 * Reads a chart written by {@link #dump(File)}. The grammar is not stored, so rules can only be applied to the
	 * loaded chart after setting one.
	 */
	public static Chart load(final File file) {
		try (ObjectInputStream in = new ObjectInputStream(new FileInputStream(file))) {
			return (Chart) in.readObject();
		} catch (final IOException | ClassNotFoundException | ClassCastException e) {
			throw new ChartException("Could not read chart from " + file, e);
		}
	}

	public void setGrammar(final Grammar grammar) {
		this.grammar = grammar;
	}
}
