package edu.uw.chordccg.syntax.tagger;

import java.util.List;

import com.google.common.primitives.Doubles;

import edu.uw.chordccg.syntax.grammar.Sign;

/**
 * Supplies the chart with lexical signs. The parser asks for signs with an increasing offset until the tagger has
 * nothing more to give: each call must only return signs that were not returned for a smaller offset.
 */
public abstract class Tagger {

	/**
	 * A sign proposed for a span of the input, with the tag it came from and its probability.
	 */
	public static class TaggedSign implements Comparable<TaggedSign> {
		private final int start;
		private final int end;
		private final Sign sign;
		private final String tag;
		private final double probability;

		public TaggedSign(final int start, final int end, final Sign sign, final String tag, final double probability) {
			this.start = start;
			this.end = end;
			this.sign = sign;
			this.tag = tag;
			this.probability = probability;
		}

		public int getStart() {
			return start;
		}

		public int getEnd() {
			return end;
		}

		public Sign getSign() {
			return sign;
		}

		public String getTag() {
			return tag;
		}

		public double getProbability() {
			return probability;
		}

		// Highest probability first.
		@Override
		public int compareTo(final TaggedSign o) {
			return Doubles.compare(o.probability, probability);
		}

		@Override
		public String toString() {
			return "(" + start + "," + end + ") " + sign + " [" + tag + "=" + probability + "]";
		}
	}

	/**
	 * Signs for the given offset, highest probability first. An empty list means the tagger is exhausted.
	 */
	public abstract List<TaggedSign> getSigns(int offset);

	public abstract int getInputLength();

	/**
	 * The input tokens, used for derivation traces and output.
	 */
	public abstract List<String> getInputTokens();
}
