package edu.uw.chordccg.syntax.grammar;

import java.util.Arrays;
import java.util.Collection;
import java.util.Collections;
import java.util.List;

import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableList;

import edu.uw.chordccg.semantics.LogicParser;
import edu.uw.chordccg.semantics.Semantics;
import edu.uw.chordccg.syntax.grammar.Category.Slash;

/**
 * A combinatory rule. Applying a rule is split into a syntactic step, which checks the categories and builds the
 * result category, and a semantic step, which builds the result's logical form. Many pairs of signs share the same
 * categories, so the syntactic step can be done once for all of them.
 */
public abstract class Combinator {
	public enum RuleType {
		APPLICATION_FORWARD("appf"), APPLICATION_BACKWARD("appb"), COMPOSITION_FORWARD("compf"), COMPOSITION_BACKWARD(
				"compb"), CROSSED_COMPOSITION_FORWARD("xcompf"), CROSSED_COMPOSITION_BACKWARD("xcompb"), DEVELOPMENT(
				"cont"), COORDINATION("coord"), TONIC_REPETITION("rep"), CADENCE_REPETITION("crep");

		private final String shortName;

		RuleType(final String shortName) {
			this.shortName = shortName;
		}

		/**
		 * Name used for the rule in derivation skeletons.
		 */
		public String getShortName() {
			return shortName;
		}
	}

	private final RuleType ruleType;
	private final String name;
	private final String internalName;
	private final String readableRule;
	private final int arity;

	private Combinator(final RuleType ruleType, final String name, final String internalName,
			final String readableRule, final int arity) {
		this.ruleType = ruleType;
		this.name = name;
		this.internalName = internalName;
		this.readableRule = readableRule;
		this.arity = arity;
	}

	public final static Combinator FORWARD_APPLICATION = new Application(true);
	public final static Combinator BACKWARD_APPLICATION = new Application(false);
	public final static Combinator FORWARD_COMPOSITION = new Composition(true, true);
	public final static Combinator BACKWARD_COMPOSITION = new Composition(false, true);
	public final static Combinator CROSSED_FORWARD_COMPOSITION = new Composition(true, false);
	public final static Combinator CROSSED_BACKWARD_COMPOSITION = new Composition(false, false);
	public final static Combinator DEVELOPMENT = new Development();
	public final static Combinator COORDINATION = new Coordination();
	public final static Combinator TONIC_REPETITION = new TonicRepetition();
	public final static Combinator CADENCE_REPETITION = new CadenceRepetition();

	public final static Collection<Combinator> STANDARD_BINARY_RULES = ImmutableList.of(FORWARD_APPLICATION,
			BACKWARD_APPLICATION, FORWARD_COMPOSITION, BACKWARD_COMPOSITION, CROSSED_FORWARD_COMPOSITION,
			CROSSED_BACKWARD_COMPOSITION, DEVELOPMENT, COORDINATION);

	public final static Collection<Combinator> LEXICAL_EXPANSION_RULES = ImmutableList.of(TONIC_REPETITION,
			CADENCE_REPETITION);

	public RuleType getRuleType() {
		return ruleType;
	}

	/**
	 * Display name, e.g. "&gt;B".
	 */
	public String getName() {
		return name;
	}

	public String getInternalName() {
		return internalName;
	}

	/**
	 * The rule written out, e.g. "X/Y Y =&gt; X".
	 */
	public String getReadableRule() {
		return readableRule;
	}

	public int getArity() {
		return arity;
	}

	/**
	 * Returns the category of the result of applying the rule to signs with these categories, or null if the rule
	 * does not apply.
	 */
	public abstract Category applySyntax(List<Category> categories);

	/**
	 * Logical form of the result, for inputs that have already passed the syntactic step. The inputs are not
	 * modified.
	 */
	public abstract Semantics applySemantics(List<Sign> signs);

	/**
	 * Applies the rule to some signs, returning the new signs, or null if the rule does not apply.
	 */
	public List<Sign> apply(final Sign... signs) {
		return apply(Arrays.asList(signs));
	}

	public List<Sign> apply(final List<Sign> signs) {
		Preconditions.checkArgument(signs.size() == arity, name + " takes " + arity + " arguments");
		final Category result = applySyntax(getCategories(signs));
		if (result == null) {
			return null;
		}
		return Collections.singletonList(applySemantics(result, signs));
	}

	/**
	 * Builds a result sign with a category that has already been computed for inputs with the same categories as
	 * these.
	 */
	public Sign applySemantics(final Category result, final List<Sign> signs) {
		final Sign sign = new Sign(result, applySemantics(signs));
		sign.setDuration(sumDurations(signs));
		return sign;
	}

	private static Integer sumDurations(final List<Sign> signs) {
		int total = 0;
		for (final Sign sign : signs) {
			if (sign.getDuration() == null) {
				return null;
			}
			total += sign.getDuration();
		}
		return total;
	}

	private static List<Category> getCategories(final List<Sign> signs) {
		final Category[] result = new Category[signs.size()];
		for (int i = 0; i < result.length; i++) {
			result[i] = signs.get(i).getCategory();
		}
		return Arrays.asList(result);
	}

	@Override
	public String toString() {
		return name;
	}

	/**
	 * X/Y Y =&gt; X and Y X\Y =&gt; X. The argument must be atomic, and the functor's argument must match the edge of
	 * the argument next to the functor.
	 */
	private static class Application extends Combinator {
		private final boolean forward;

		private Application(final boolean forward) {
			super(forward ? RuleType.APPLICATION_FORWARD : RuleType.APPLICATION_BACKWARD, forward ? ">" : "<",
					forward ? "appf" : "appb", forward ? "X/Y Y => X" : "Y X\\Y => X", 2);
			this.forward = forward;
		}

		@Override
		public Category applySyntax(final List<Category> categories) {
			final Category functor = categories.get(forward ? 0 : 1);
			final Category argument = categories.get(forward ? 1 : 0);
			if (!argument.isAtomic() || !functor.isComplex() || functor.getSlash().isForward() != forward) {
				return null;
			}

			final HalfCategory adjacent = forward ? argument.getFrom() : argument.getTo();
			if (!functor.getArgument().matches(adjacent)) {
				return null;
			}

			return forward ? Category.make(functor.getResult(), argument.getTo()) : Category.make(argument.getFrom(),
					functor.getResult());
		}

		@Override
		public Semantics applySemantics(final List<Sign> signs) {
			final Sign functor = signs.get(forward ? 0 : 1);
			final Sign argument = signs.get(forward ? 1 : 0);
			return Semantics.apply(functor.getSemantics(), argument.getSemantics());
		}
	}

	/**
	 * X/Y Y/Z =&gt; X/Z and Y\Z X\Y =&gt; X\Z, or, crossing, X/Y Y\Z =&gt; X\Z and Y/Z X\Y =&gt; X/Z.
	 */
	private static class Composition extends Combinator {
		private final boolean forward;
		private final boolean harmonic;

		private Composition(final boolean forward, final boolean harmonic) {
			super(ruleType(forward, harmonic), (forward ? ">B" : "<B") + (harmonic ? "" : "x"), (harmonic ? ""
					: "x") + (forward ? "compf" : "compb"), readableRule(forward, harmonic), 2);
			this.forward = forward;
			this.harmonic = harmonic;
		}

		private static RuleType ruleType(final boolean forward, final boolean harmonic) {
			if (harmonic) {
				return forward ? RuleType.COMPOSITION_FORWARD : RuleType.COMPOSITION_BACKWARD;
			}
			return forward ? RuleType.CROSSED_COMPOSITION_FORWARD : RuleType.CROSSED_COMPOSITION_BACKWARD;
		}

		private static String readableRule(final boolean forward, final boolean harmonic) {
			if (harmonic) {
				return forward ? "X/Y Y/Z => X/Z" : "Y\\Z X\\Y => X\\Z";
			}
			return forward ? "X/Y Y\\Z => X\\Z" : "Y/Z X\\Y => X/Z";
		}

		@Override
		public Category applySyntax(final List<Category> categories) {
			final Category first = categories.get(0);
			final Category second = categories.get(1);
			if (first.isAtomic() || second.isAtomic()) {
				return null;
			}

			if (harmonic) {
				if (first.getSlash().isForward() != forward || second.getSlash().isForward() != forward) {
					return null;
				}
			} else if (!first.getSlash().isForward() || second.getSlash().isForward()) {
				return null;
			}

			final HalfCategory middleArgument = forward ? first.getArgument() : second.getArgument();
			final HalfCategory middleResult = forward ? second.getResult() : first.getResult();
			if (!middleArgument.matches(middleResult)) {
				return null;
			}

			final String modality = first.getSlash().getModality().isEmpty() ? second.getSlash().getModality()
					: first.getSlash().getModality();
			final Slash slash = Slash.of(forward == harmonic, modality);
			return forward ? Category.make(first.getResult(), slash, second.getArgument()) : Category.make(
					second.getResult(), slash, first.getArgument());
		}

		@Override
		public Semantics applySemantics(final List<Sign> signs) {
			final Sign f = signs.get(forward ? 0 : 1);
			final Sign g = signs.get(forward ? 1 : 0);
			return Semantics.compose(f.getSemantics(), g.getSemantics());
		}
	}

	/**
	 * A-B C-D =&gt; A-D: two atomic spans develop into one path.
	 */
	private static class Development extends Combinator {
		private Development() {
			super(RuleType.DEVELOPMENT, "<dev>", "dev", "W-X Y-Z =>dev W-Z", 2);
		}

		@Override
		public Category applySyntax(final List<Category> categories) {
			final Category first = categories.get(0);
			final Category second = categories.get(1);
			if (!first.isAtomic() || !second.isAtomic()) {
				return null;
			}
			return Category.make(first.getFrom(), second.getTo());
		}

		@Override
		public Semantics applySemantics(final List<Sign> signs) {
			return Semantics.concatenate(signs.get(0).getSemantics(), signs.get(1).getSemantics());
		}
	}

	/**
	 * X/Y Z/Y =&gt; X/Y: partial cadences share a resolution. Both must have cadence slashes, arguments with the same
	 * root and some function in common, and results with the same functions.
	 */
	private static class Coordination extends Combinator {
		private Coordination() {
			super(RuleType.COORDINATION, "<&>", "coord", "X/Y Z/Y =>& X/Y", 2);
		}

		@Override
		public Category applySyntax(final List<Category> categories) {
			final Category first = categories.get(0);
			final Category second = categories.get(1);
			if (first.isAtomic() || second.isAtomic()) {
				return null;
			}
			if (!first.getSlash().isCadential() || !second.getSlash().isCadential()) {
				return null;
			}

			final HalfCategory firstArgument = first.getArgument();
			final HalfCategory secondArgument = second.getArgument();
			if (firstArgument.getRoot() != secondArgument.getRoot()
					|| Collections.disjoint(firstArgument.getFunctions(), secondArgument.getFunctions())) {
				return null;
			}
			if (!first.getResult().getFunctions().equals(second.getResult().getFunctions())) {
				return null;
			}

			return Category.make(first.getResult(), first.getSlash(), firstArgument.intersect(secondArgument));
		}

		@Override
		public Semantics applySemantics(final List<Sign> signs) {
			return Semantics.coordinate(signs.get(0).getSemantics(), signs.get(1).getSemantics());
		}
	}

	private static abstract class Repetition extends Combinator {
		// Identity, except that the repeated chord's time is given to the argument.
		private final Semantics semantics = LogicParser.fromString("\\$x.now($x)");

		private Repetition(final RuleType ruleType, final String name, final String internalName,
				final String readableRule) {
			super(ruleType, name, internalName, readableRule, 1);
		}

		@Override
		public Semantics applySemantics(final List<Sign> signs) {
			final Semantics result = semantics.copy();
			result.setTime(signs.get(0).getSemantics().getStartTime());
			return result;
		}

		static Category reflexive(final HalfCategory half) {
			return Category.make(half, Slash.FWD, half);
		}
	}

	/**
	 * X^T =&gt; X^T/X^T: a tonic chord can repeat the tonic that follows it.
	 */
	private static class TonicRepetition extends Repetition {
		private TonicRepetition() {
			super(RuleType.TONIC_REPETITION, "<rep>", "rep", "X^T => X^T/X^T");
		}

		@Override
		public Category applySyntax(final List<Category> categories) {
			final Category category = categories.get(0);
			if (!category.isAtomic() || !category.getFrom().equals(category.getTo())) {
				return null;
			}
			return reflexive(category.getFrom());
		}
	}

	/**
	 * X/{c}Y =&gt; X/X: a dominant or subdominant cadence chord can be repeated.
	 */
	private static class CadenceRepetition extends Repetition {
		private CadenceRepetition() {
			super(RuleType.CADENCE_REPETITION, "<crep>", "crep", "X/{c}Y => X/X");
		}

		@Override
		public Category applySyntax(final List<Category> categories) {
			final Category category = categories.get(0);
			if (category.isAtomic() || !category.getSlash().isCadential()) {
				return null;
			}
			final HalfCategory result = category.getResult();
			if (!result.hasSingleFunction()
					|| (result.getFunction() != HarmonicFunction.D && result.getFunction() != HarmonicFunction.S)) {
				return null;
			}
			return reflexive(result);
		}
	}
}
