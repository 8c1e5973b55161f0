package edu.uw.chordccg.syntax.grammar;

import java.io.Serializable;
import java.util.ArrayList;
import java.util.List;

import com.google.common.base.Preconditions;
import com.google.common.base.Strings;
import com.google.common.collect.ImmutableList;

/**
 * How a sign was derived: either it was a lexical sign for a word, or it was produced by one or more rule
 * applications, each to a list of input derivations.
 */
public class DerivationTrace implements Serializable {
	private static final long serialVersionUID = 1L;

	private final Sign result;
	private final String word;
	private final List<RuleApplication> rules = new ArrayList<>();

	public static class RuleApplication implements Serializable {
		private static final long serialVersionUID = 1L;
		private final String rule;
		private final List<DerivationTrace> inputs;

		private RuleApplication(final String rule, final List<DerivationTrace> inputs) {
			this.rule = rule;
			this.inputs = ImmutableList.copyOf(inputs);
		}

		public String getRule() {
			return rule;
		}

		public List<DerivationTrace> getInputs() {
			return inputs;
		}
	}

	/**
	 * Trace for a lexical sign.
	 */
	public DerivationTrace(final Sign result, final String word) {
		this.result = result;
		this.word = word;
	}

	public DerivationTrace(final Sign result, final Combinator rule, final List<DerivationTrace> inputs) {
		this(result, (String) null);
		addRule(rule, inputs);
	}

	public void addRule(final Combinator rule, final List<DerivationTrace> inputs) {
		Preconditions.checkArgument(!inputs.contains(null), "Missing derivation for input of " + rule);
		rules.add(new RuleApplication(rule.getName(), inputs));
	}

	/**
	 * Adds the rule applications of another trace of an equivalent sign.
	 */
	public void addRulesFromTrace(final DerivationTrace other) {
		rules.addAll(other.rules);
	}

	public Sign getResult() {
		return result;
	}

	public boolean isLexical() {
		return word != null;
	}

	public String getWord() {
		return word;
	}

	public List<RuleApplication> getRules() {
		return rules;
	}

	/**
	 * Number of nodes in the derivation forest below this trace.
	 */
	public int getSize() {
		int size = 1;
		for (final RuleApplication rule : rules) {
			for (final DerivationTrace input : rule.inputs) {
				size += input.getSize();
			}
		}
		return size;
	}

	public String toString(final int indent) {
		final StringBuilder result = new StringBuilder();
		toString(result, indent);
		return result.toString();
	}

	private void toString(final StringBuilder output, final int indent) {
		final String padding = Strings.repeat(" ", indent);
		output.append(padding).append(result);
		if (word != null) {
			output.append(" <= \"").append(word).append("\"");
		}
		output.append("\n");
		for (final RuleApplication rule : rules) {
			output.append(padding).append("  from ").append(rule.rule).append("\n");
			for (final DerivationTrace input : rule.inputs) {
				input.toString(output, indent + 4);
			}
		}
	}

	@Override
	public String toString() {
		return toString(0);
	}
}
