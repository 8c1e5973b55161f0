package edu.uw.chordccg.syntax.grammar;

import java.io.Serializable;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

import com.google.common.base.Preconditions;

/**
 * Syntactic categories. Atomic categories span a piece of the input, from one half category to another. Complex
 * categories take a single half category as argument and yield a half category, so there are no higher-order
 * categories.
 *
 * Categories are immutable. Equal categories are usually, but not always, the same object.
 */
public abstract class Category implements Serializable {

	private static final long serialVersionUID = 1L;
	private final String asString;

	private final static Map<String, Category> cache = new ConcurrentHashMap<>();

	private static final String HALF = "([b#]?[IV]+\\^[TDS]+)";
	private static final Pattern ATOMIC = Pattern.compile(HALF + "(?:-" + HALF + ")?");
	private static final Pattern COMPLEX = Pattern.compile(HALF + "([/\\\\])(?:\\{([a-z]*)\\})?" + HALF);

	private Category(final String asString) {
		this.asString = asString;
	}

	/**
	 * Direction and modality of the slash of a complex category. Cadence categories have modality "c".
	 */
	public static final class Slash implements Serializable {
		private static final long serialVersionUID = 1L;

		public static final String CADENCE = "c";
		public static final Slash FWD = new Slash(true, "");
		public static final Slash BWD = new Slash(false, "");

		private final boolean forward;
		private final String modality;

		private Slash(final boolean forward, final String modality) {
			this.forward = forward;
			this.modality = modality;
		}

		public static Slash of(final boolean forward, final String modality) {
			return new Slash(forward, modality == null ? "" : modality);
		}

		public boolean isForward() {
			return forward;
		}

		public String getModality() {
			return modality;
		}

		public boolean isCadential() {
			return CADENCE.equals(modality);
		}

		@Override
		public boolean equals(final Object other) {
			if (!(other instanceof Slash)) {
				return false;
			}
			final Slash slash = (Slash) other;
			return forward == slash.forward && modality.equals(slash.modality);
		}

		@Override
		public int hashCode() {
			return 31 * Boolean.hashCode(forward) + modality.hashCode();
		}

		@Override
		public String toString() {
			return (forward ? "/" : "\\") + (modality.isEmpty() ? "" : "{" + modality + "}");
		}
	}

	public static Category valueOf(final String input) {
		final String source = input.trim();
		Category result = cache.get(source);
		if (result == null) {
			result = valueOfUncached(source);
			final Category existing = cache.putIfAbsent(result.toString(), result);
			if (existing != null) {
				result = existing;
			}
			cache.putIfAbsent(source, result);
		}
		return result;
	}

	/**
	 * Builds a category from a string: "I^T-V^D" or "I^T" for atomic categories, "I^T/V^D", "I^T\V^D" or
	 * "V^D/{c}I^TD" for complex ones.
	 */
	private static Category valueOfUncached(final String source) {
		final Matcher atomic = ATOMIC.matcher(source);
		if (atomic.matches()) {
			final HalfCategory from = HalfCategory.valueOf(atomic.group(1));
			final HalfCategory to = atomic.group(2) == null ? from : HalfCategory.valueOf(atomic.group(2));
			return new AtomicCategory(from, to);
		}

		final Matcher complex = COMPLEX.matcher(source);
		if (complex.matches()) {
			final Slash slash = Slash.of(complex.group(2).equals("/"), complex.group(3));
			return new ComplexCategory(HalfCategory.valueOf(complex.group(1)), slash,
					HalfCategory.valueOf(complex.group(4)));
		}

		throw new IllegalArgumentException("Unable to parse category: " + source);
	}

	/**
	 * Stands in for the category of a result that did not come from the grammar, such as a backoff result. No rule
	 * applies to it.
	 */
	public static final Category PLACEHOLDER = new PlaceholderCategory();

	public static Category make(final HalfCategory from, final HalfCategory to) {
		return new AtomicCategory(from, to);
	}

	public static Category make(final HalfCategory result, final Slash slash, final HalfCategory argument) {
		return new ComplexCategory(result, slash, argument);
	}

	@Override
	public String toString() {
		return asString;
	}

	@Override
	public boolean equals(final Object other) {
		return this == other || (other instanceof Category && asString.equals(other.toString()));
	}

	@Override
	public int hashCode() {
		return asString.hashCode();
	}

	public abstract boolean isAtomic();

	public final boolean isComplex() {
		return !isAtomic();
	}

	public abstract HalfCategory getFrom();

	public abstract HalfCategory getTo();

	public abstract HalfCategory getResult();

	public abstract HalfCategory getArgument();

	public abstract Slash getSlash();

	private static class AtomicCategory extends Category {
		private static final long serialVersionUID = 1L;
		private final HalfCategory from;
		private final HalfCategory to;

		private AtomicCategory(final HalfCategory from, final HalfCategory to) {
			super(from.equals(to) ? from.toString() : from + "-" + to);
			this.from = from;
			this.to = to;
		}

		@Override
		public boolean isAtomic() {
			return true;
		}

		@Override
		public HalfCategory getFrom() {
			return from;
		}

		@Override
		public HalfCategory getTo() {
			return to;
		}

		@Override
		public HalfCategory getResult() {
			throw new UnsupportedOperationException();
		}

		@Override
		public HalfCategory getArgument() {
			throw new UnsupportedOperationException();
		}

		@Override
		public Slash getSlash() {
			throw new UnsupportedOperationException();
		}
	}

	private static class ComplexCategory extends Category {
		private static final long serialVersionUID = 1L;
		private final HalfCategory result;
		private final Slash slash;
		private final HalfCategory argument;

		private ComplexCategory(final HalfCategory result, final Slash slash, final HalfCategory argument) {
			super(result.toString() + slash + argument);
			Preconditions.checkNotNull(slash);
			this.result = result;
			this.slash = slash;
			this.argument = argument;
		}

		@Override
		public boolean isAtomic() {
			return false;
		}

		@Override
		public HalfCategory getFrom() {
			throw new UnsupportedOperationException();
		}

		@Override
		public HalfCategory getTo() {
			throw new UnsupportedOperationException();
		}

		@Override
		public HalfCategory getResult() {
			return result;
		}

		@Override
		public HalfCategory getArgument() {
			return argument;
		}

		@Override
		public Slash getSlash() {
			return slash;
		}
	}

	private static class PlaceholderCategory extends Category {
		private static final long serialVersionUID = 1L;

		private PlaceholderCategory() {
			super("?");
		}

		@Override
		public boolean isAtomic() {
			return false;
		}

		@Override
		public HalfCategory getFrom() {
			throw new UnsupportedOperationException();
		}

		@Override
		public HalfCategory getTo() {
			throw new UnsupportedOperationException();
		}

		@Override
		public HalfCategory getResult() {
			throw new UnsupportedOperationException();
		}

		@Override
		public HalfCategory getArgument() {
			throw new UnsupportedOperationException();
		}

		@Override
		public Slash getSlash() {
			throw new UnsupportedOperationException();
		}
	}
}
