package edu.uw.chordccg.syntax.parser;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import com.google.common.base.Joiner;

import edu.uw.chordccg.util.Util;

/**
 * The skeleton of a derivation: internal nodes name the rule to apply, leaves stand for the input tokens, in order.
 * Written as a bracketed string, e.g. "(appf (compf 0 1) 2)". Leaf labels are only for display.
 */
public class DerivationTree {
	private final String rule;
	private final String leaf;
	private final List<DerivationTree> children;

	private DerivationTree(final String rule, final String leaf, final List<DerivationTree> children) {
		this.rule = rule;
		this.leaf = leaf;
		this.children = children;
	}

	public static DerivationTree leaf(final String label) {
		return new DerivationTree(null, label, Collections.<DerivationTree> emptyList());
	}

	public static DerivationTree node(final String rule, final DerivationTree... children) {
		final List<DerivationTree> list = new ArrayList<>(children.length);
		Collections.addAll(list, children);
		return new DerivationTree(rule, null, Collections.unmodifiableList(list));
	}

	public static DerivationTree valueOf(final String input) {
		final String source = input.trim();
		if (source.isEmpty()) {
			throw new IllegalArgumentException("Empty derivation tree");
		}
		if (!source.startsWith("(")) {
			if (source.contains(" ") || source.contains(")")) {
				throw new IllegalArgumentException("Invalid derivation tree: " + source);
			}
			return leaf(source);
		}

		if (Util.findClosingBracket(source) != source.length() - 1) {
			throw new IllegalArgumentException("Invalid derivation tree: " + source);
		}
		final String contents = source.substring(1, source.length() - 1).trim();
		final int space = Util.findNonNestedChar(contents, " ");
		if (space == -1) {
			throw new IllegalArgumentException("Derivation tree node has no children: " + source);
		}

		final List<DerivationTree> children = new ArrayList<>();
		for (final String child : splitChildren(contents.substring(space + 1))) {
			children.add(valueOf(child));
		}
		return new DerivationTree(contents.substring(0, space), null, Collections.unmodifiableList(children));
	}

	private static List<String> splitChildren(final String input) {
		final List<String> result = new ArrayList<>();
		String rest = input.trim();
		while (!rest.isEmpty()) {
			final int end;
			if (rest.startsWith("(")) {
				end = Util.findClosingBracket(rest) + 1;
			} else {
				final int space = rest.indexOf(' ');
				end = space == -1 ? rest.length() : space;
			}
			result.add(rest.substring(0, end));
			rest = rest.substring(end).trim();
		}
		return result;
	}

	public boolean isLeaf() {
		return rule == null;
	}

	public String getRule() {
		return rule;
	}

	public String getLeaf() {
		return leaf;
	}

	public List<DerivationTree> getChildren() {
		return children;
	}

	/**
	 * Number of input tokens covered by this tree.
	 */
	public int getLength() {
		if (isLeaf()) {
			return 1;
		}
		int result = 0;
		for (final DerivationTree child : children) {
			result += child.getLength();
		}
		return result;
	}

	@Override
	public String toString() {
		if (isLeaf()) {
			return leaf;
		}
		return "(" + rule + " " + Joiner.on(" ").join(children) + ")";
	}
}
