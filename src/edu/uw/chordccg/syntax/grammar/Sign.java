package edu.uw.chordccg.syntax.grammar;

import java.io.Serializable;
import java.util.Collections;
import java.util.HashMap;
import java.util.HashSet;
import java.util.IdentityHashMap;
import java.util.Map;
import java.util.Set;

import com.google.common.base.Equivalence;
import com.google.common.base.Preconditions;

import edu.uw.chordccg.semantics.LogicParser;
import edu.uw.chordccg.semantics.Semantics;

/**
 * A category paired with its logical form. Neither changes once the sign is built. The sign also keeps some
 * bookkeeping: which rules have been tried on it, its derivation trace and its duration.
 */
public class Sign implements Serializable {
	private static final long serialVersionUID = 1L;

	private final Category category;
	private final Semantics semantics;
	private DerivationTrace derivationTrace;
	private Integer duration;

	// Rule memos only matter while parsing, so they are not written to chart dumps.
	private transient Set<Combinator> unaryApplied;
	private transient Map<Combinator, Set<Sign>> binaryApplied;

	public Sign(final Category category, final Semantics semantics) {
		Preconditions.checkNotNull(category);
		Preconditions.checkNotNull(semantics);
		this.category = category;
		this.semantics = semantics;
	}

	/**
	 * Reads a sign written as "CATEGORY : LOGICAL FORM", e.g. "V^D/{c}I^T : \$x.leftonto($x)".
	 */
	public static Sign valueOf(final String input) {
		final int colon = input.indexOf(':');
		if (colon == -1) {
			throw new IllegalArgumentException("Signs should be of the form \"category : semantics\": " + input);
		}
		return new Sign(Category.valueOf(input.substring(0, colon)), LogicParser.fromString(input
				.substring(colon + 1)));
	}

	public Category getCategory() {
		return category;
	}

	/**
	 * Callers must not modify the result: copy it first.
	 */
	public Semantics getSemantics() {
		return semantics;
	}

	public DerivationTrace getDerivationTrace() {
		return derivationTrace;
	}

	public void setDerivationTrace(final DerivationTrace derivationTrace) {
		this.derivationTrace = derivationTrace;
	}

	public Integer getDuration() {
		return duration;
	}

	public void setDuration(final Integer duration) {
		this.duration = duration;
	}

	/**
	 * Records that a unary rule has been applied to this sign. Returns false if it had been already.
	 */
	public boolean noteRuleApplied(final Combinator rule) {
		if (unaryApplied == null) {
			unaryApplied = new HashSet<>();
		}
		return unaryApplied.add(rule);
	}

	public boolean isRuleApplied(final Combinator rule) {
		return unaryApplied != null && unaryApplied.contains(rule);
	}

	/**
	 * Records that a binary rule has been applied to this sign and the given partner. Returns false if it had been
	 * already. Partners are compared by identity.
	 */
	public boolean noteRuleApplied(final Combinator rule, final Sign partner) {
		if (binaryApplied == null) {
			binaryApplied = new HashMap<>();
		}
		return binaryApplied.computeIfAbsent(rule, r -> Collections.newSetFromMap(new IdentityHashMap<>())).add(
				partner);
	}

	public boolean isRuleApplied(final Combinator rule, final Sign partner) {
		if (binaryApplied == null) {
			return false;
		}
		final Set<Sign> partners = binaryApplied.get(rule);
		return partners != null && partners.contains(partner);
	}

	/**
	 * Signs with the same category and alpha-equivalent logical forms. Chart cells keep one sign per class.
	 */
	public static final Equivalence<Sign> EQUIVALENCE = new Equivalence<Sign>() {
		@Override
		protected boolean doEquivalent(final Sign a, final Sign b) {
			return a.isEquivalentTo(b);
		}

		@Override
		protected int doHash(final Sign sign) {
			return sign.equivalenceHash();
		}
	};

	/**
	 * Same category and alpha-equivalent logical forms.
	 */
	public boolean isEquivalentTo(final Sign other) {
		return category.equals(other.category) && semantics.alphaEquivalent(other.semantics);
	}

	/**
	 * Consistent with {@link #isEquivalentTo(Sign)}.
	 */
	public int equivalenceHash() {
		return 31 * category.hashCode() + semantics.structureHash();
	}

	@Override
	public String toString() {
		return category + " : " + semantics;
	}
}
