package edu.uw.chordccg.syntax.grammar;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableSet;

/**
 * The rules available to the parser. Binary and unary rules are applied in the chart. Lexical expansion rules are
 * applied once to every lexical sign before parsing, to add the signs that those rules derive from it.
 */
public class Grammar {
	private final List<Combinator> binaryRules;
	private final List<Combinator> unaryRules;
	private final List<Combinator> lexicalExpansionRules;
	private final Map<String, Combinator> nameToRule = new HashMap<>();

	public final static Grammar STANDARD = new Grammar(Combinator.STANDARD_BINARY_RULES,
			Collections.<Combinator> emptyList(), Combinator.LEXICAL_EXPANSION_RULES);

	public Grammar(final Collection<Combinator> binaryRules, final Collection<Combinator> unaryRules,
			final Collection<Combinator> lexicalExpansionRules) {
		this.binaryRules = ImmutableList.copyOf(binaryRules);
		this.unaryRules = ImmutableList.copyOf(unaryRules);
		this.lexicalExpansionRules = ImmutableList.copyOf(lexicalExpansionRules);

		for (final Combinator rule : binaryRules) {
			checkArity(rule, 2);
			addName(rule);
		}
		for (final Combinator rule : unaryRules) {
			checkArity(rule, 1);
			addName(rule);
		}
		for (final Combinator rule : lexicalExpansionRules) {
			checkArity(rule, 1);
			addName(rule);
		}
	}

	private static void checkArity(final Combinator rule, final int arity) {
		if (rule.getArity() != arity) {
			throw new IllegalArgumentException("Rule " + rule + " has arity " + rule.getArity() + ", expected "
					+ arity);
		}
	}

	private void addName(final Combinator rule) {
		for (final String name : ImmutableSet.of(rule.getRuleType().getShortName(), rule.getInternalName())) {
			final Combinator existing = nameToRule.put(name, rule);
			if (existing != null) {
				throw new IllegalArgumentException("Two rules with the name " + name + ": " + existing + " and "
						+ rule);
			}
		}
	}

	public List<Combinator> getBinaryRules() {
		return binaryRules;
	}

	public List<Combinator> getUnaryRules() {
		return unaryRules;
	}

	public List<Combinator> getLexicalExpansionRules() {
		return lexicalExpansionRules;
	}

	/**
	 * Looks up a rule by its short name (as used in derivation skeletons, e.g. "appf") or its internal name. Returns
	 * null for unknown names.
	 */
	public Combinator getRule(final String name) {
		return nameToRule.get(name);
	}

	/**
	 * The given lexical signs followed by everything the lexical expansion rules derive from them. Expansions are
	 * not applied to their own results.
	 */
	public List<Sign> expandLexicalSigns(final Collection<Sign> signs) {
		final List<Sign> result = new ArrayList<>(signs);
		for (final Sign sign : signs) {
			for (final Combinator rule : lexicalExpansionRules) {
				final List<Sign> expanded = rule.apply(sign);
				if (expanded != null) {
					for (final Sign newSign : expanded) {
						newSign.setDuration(sign.getDuration());
						result.add(newSign);
					}
				}
			}
		}
		return result;
	}
}
