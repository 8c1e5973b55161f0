package edu.uw.chordccg.syntax.parser;

import java.util.List;

import com.google.common.collect.ImmutableList;

/**
 * Thrown when a derivation tree cannot be followed: it is malformed, names an unknown rule, or prescribes a rule
 * that does not apply to the signs in the chart.
 */
public class DirectedParseException extends Exception {
	private static final long serialVersionUID = 1L;

	private final String treeNode;
	private final List<String> inputs;

	public DirectedParseException(final String message, final DerivationTree treeNode, final List<String> inputs) {
		super(message + " Tree: " + treeNode + (inputs.isEmpty() ? "" : ". Inputs: " + inputs));
		this.treeNode = treeNode.toString();
		this.inputs = ImmutableList.copyOf(inputs);
	}

	/**
	 * The node of the derivation tree that could not be followed.
	 */
	public String getTreeNode() {
		return treeNode;
	}

	/**
	 * The candidate signs the rule was tried on.
	 */
	public List<String> getInputs() {
		return inputs;
	}
}
