package edu.uw.chordccg.syntax.parser;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import edu.uw.chordccg.syntax.grammar.Combinator;
import edu.uw.chordccg.syntax.grammar.Sign;
import edu.uw.chordccg.syntax.tagger.Tagger;
import edu.uw.chordccg.syntax.tagger.Tagger.TaggedSign;

/**
 * Follows a given derivation tree instead of searching: the tagger's signs for every offset are added first, then the
 * rule named by each internal node of the tree is applied to the spans of its children, bottom-up and left to right.
 * Used to check that an annotated derivation is possible, and to find what it produces.
 */
public class DirectedParserCKY extends AbstractParser {

	protected DirectedParserCKY(final Builder builder) {
		super(builder);
	}

	public ParseResult parse(final Tagger tagger, final DerivationTree tree) throws DirectedParseException {
		final int length = tagger.getInputLength();
		if (tree.getLength() != length) {
			throw new DirectedParseException("Derivation tree covers " + tree.getLength() + " tokens, but the input has "
					+ length + ".", tree, new ArrayList<String>());
		}

		final Chart chart = createChart(tagger);
		// The tree may use any candidate, so every offset is read before applying rules.
		int offset = 0;
		for (List<TaggedSign> signs = tagger.getSigns(offset); !signs.isEmpty(); signs = tagger.getSigns(offset)) {
			addTaggedSigns(chart, tagger.getInputTokens(), signs);
			offset++;
		}

		fillChart(chart, 0, tree);
		dumpChart(chart);

		final ParseResult result = new ParseResult(chart.getParses(), chart, false, offset, false);
		notifyCompletion(result);
		return result;
	}

	/**
	 * Fills the chart for the subtree starting at the given position, returning the position where it ends.
	 */
	private int fillChart(final Chart chart, final int start, final DerivationTree node) throws DirectedParseException {
		if (node.isLeaf()) {
			return start + 1;
		}

		if (node.getChildren().size() > 2) {
			throw new DirectedParseException("Invalid derivation tree. Nodes may have up to 2 children. This node has "
					+ node.getChildren().size() + ".", node, new ArrayList<String>());
		}

		int end = start;
		int middle = -1;
		for (final DerivationTree child : node.getChildren()) {
			end = fillChart(chart, end, child);
			if (middle == -1) {
				middle = end;
			}
		}

		final Combinator rule = grammar.getRule(node.getRule());
		if (rule == null) {
			throw new DirectedParseException("Tree node specifies a rule '" + node.getRule()
					+ "' which is not defined in the grammar.", node, new ArrayList<String>());
		}
		if (rule.getArity() != node.getChildren().size()) {
			throw new DirectedParseException("Rule " + node.getRule() + " must have " + rule.getArity()
					+ " children.", node, new ArrayList<String>());
		}

		final boolean added;
		final List<String> inputs = new ArrayList<>();
		if (rule.getArity() == 1) {
			inputs.add(describe(chart.getSigns(start, end)));
			// Lexical expansions are already in the chart, so for those the rule only has to apply.
			added = chart.applyUnaryRule(rule, start, end)
					|| (grammar.getLexicalExpansionRules().contains(rule) && appliesToAny(rule, chart.getSigns(start,
							end)));
		} else {
			inputs.add(describe(chart.getSigns(start, middle)));
			inputs.add(describe(chart.getSigns(middle, end)));
			added = chart.applyBinaryRule(rule, start, middle, end);
		}

		if (!added) {
			throw new DirectedParseException("Failed to apply rule " + rule + ". Giving up on parse.", node, inputs);
		}
		notifyInsertion(chart, start, end);
		return end;
	}

	private static boolean appliesToAny(final Combinator rule, final List<Sign> signs) {
		for (final Sign sign : signs) {
			if (rule.applySyntax(Collections.singletonList(sign.getCategory())) != null) {
				return true;
			}
		}
		return false;
	}

	private static String describe(final List<Sign> signs) {
		final List<String> result = new ArrayList<>(signs.size());
		for (final Sign sign : signs) {
			result.add(sign.toString());
		}
		return result.toString();
	}

	public static class Builder extends ParserBuilder<Builder, DirectedParserCKY> {

		public Builder() {
			super();
		}

		@Override
		protected DirectedParserCKY build2() {
			return new DirectedParserCKY(this);
		}
	}
}
