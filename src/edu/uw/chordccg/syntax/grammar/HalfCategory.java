package edu.uw.chordccg.syntax.grammar;

import java.io.Serializable;
import java.util.Collection;
import java.util.EnumSet;
import java.util.Objects;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.Iterables;
import com.google.common.collect.Sets;

/**
 * One edge of a category: a chord root, as a pitch class relative to the key, and the harmonic functions the chord may
 * have there.
 */
public final class HalfCategory implements Serializable {
	private static final long serialVersionUID = 1L;

	private static final ImmutableList<String> ROMAN_NUMERALS = ImmutableList.of("I", "bII", "II", "bIII", "III", "IV",
			"#IV", "V", "bVI", "VI", "bVII", "VII");
	private static final Pattern ROMAN_NUMERAL = Pattern.compile("([b#]?)(I{1,3}|I?V|VI{0,2})");
	private static final Pattern HALF_CATEGORY = Pattern.compile("\\s*([b#]?[IV]+)\\^([TDS]+)\\s*");

	private final int root;
	// EnumSet is not immutable, so it never leaves this class.
	private final EnumSet<HarmonicFunction> functions;

	public HalfCategory(final int root, final Collection<HarmonicFunction> functions) {
		Preconditions.checkArgument(!functions.isEmpty(), "A half category needs at least one function");
		this.root = Math.floorMod(root, 12);
		this.functions = EnumSet.copyOf(functions);
	}

	public HalfCategory(final int root, final HarmonicFunction function, final HarmonicFunction... functions) {
		this(root, EnumSet.of(function, functions));
	}

	public static HalfCategory valueOf(final String input) {
		final Matcher matcher = HALF_CATEGORY.matcher(input);
		if (!matcher.matches()) {
			throw new IllegalArgumentException("Not a valid half category: " + input);
		}
		final EnumSet<HarmonicFunction> functions = EnumSet.noneOf(HarmonicFunction.class);
		for (final char label : matcher.group(2).toCharArray()) {
			functions.add(HarmonicFunction.fromChar(label));
		}
		return new HalfCategory(rootFromNumeral(matcher.group(1)), functions);
	}

	/**
	 * Pitch class of a roman numeral such as "bVII", relative to I.
	 */
	public static int rootFromNumeral(final String numeral) {
		final Matcher matcher = ROMAN_NUMERAL.matcher(numeral);
		if (!matcher.matches()) {
			throw new IllegalArgumentException("Not a valid roman numeral: " + numeral);
		}
		final int base = ROMAN_NUMERALS.indexOf(matcher.group(2));
		final String accidental = matcher.group(1);
		return Math.floorMod(base + (accidental.equals("b") ? -1 : accidental.equals("#") ? 1 : 0), 12);
	}

	public static String numeralFromRoot(final int root) {
		return ROMAN_NUMERALS.get(Math.floorMod(root, 12));
	}

	public int getRoot() {
		return root;
	}

	public EnumSet<HarmonicFunction> getFunctions() {
		return EnumSet.copyOf(functions);
	}

	public boolean hasSingleFunction() {
		return functions.size() == 1;
	}

	/**
	 * The function of a half category that has only one.
	 */
	public HarmonicFunction getFunction() {
		Preconditions.checkState(hasSingleFunction(), "Ambiguous function: " + this);
		return Iterables.getOnlyElement(functions);
	}

	/**
	 * As the argument of a complex category, whether this accepts other as the adjacent edge of its argument: other
	 * must have the same root and a single function, which is one of ours.
	 */
	public boolean matches(final HalfCategory other) {
		return other.hasSingleFunction() && other.root == root && functions.contains(other.getFunction());
	}

	public HalfCategory withFunctions(final Collection<HarmonicFunction> newFunctions) {
		return new HalfCategory(root, newFunctions);
	}

	/**
	 * Same root, functions restricted to the ones both have.
	 */
	public HalfCategory intersect(final HalfCategory other) {
		return withFunctions(Sets.intersection(functions, other.functions));
	}

	@Override
	public boolean equals(final Object other) {
		if (!(other instanceof HalfCategory)) {
			return false;
		}
		final HalfCategory half = (HalfCategory) other;
		return root == half.root && functions.equals(half.functions);
	}

	@Override
	public int hashCode() {
		return Objects.hash(root, functions);
	}

	@Override
	public String toString() {
		final StringBuilder result = new StringBuilder(numeralFromRoot(root)).append("^");
		for (final HarmonicFunction function : functions) {
			result.append(function);
		}
		return result.toString();
	}
}
