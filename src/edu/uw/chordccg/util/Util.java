package edu.uw.chordccg.util;

import com.google.common.primitives.Doubles;

import java.io.BufferedReader;
import java.io.File;
import java.io.FileInputStream;
import java.io.IOException;
import java.io.InputStreamReader;
import java.nio.charset.StandardCharsets;
import java.text.DecimalFormat;
import java.util.ArrayList;
import java.util.List;

public class Util {
	private static final String OPENING_BRACKETS = "([{<";
	private static final String CLOSING_BRACKETS = ")]}>";

	public static File getFile(final String path) {
		return new File(path.replace("~", System.getProperty("user.home")));
	}

	public static List<String> readFile(final File filePath) throws IOException {
		final List<String> result = new ArrayList<>();
		try (BufferedReader in = new BufferedReader(new InputStreamReader(new FileInputStream(filePath),
				StandardCharsets.UTF_8))) {
			String line;
			while ((line = in.readLine()) != null) {
				result.add(line);
			}
		}
		return result;
	}

	private final static DecimalFormat twoDP = new DecimalFormat("0.00");

	public static String twoDP(final double number) {
		return twoDP.format(number);
	}

	/**
	 * Index of the bracket closing the one at startIndex, counting all of (), [], {} and <>.
	 */
	public static int findClosingBracket(final String source, final int startIndex) {
		int openBrackets = 0;
		for (int i = startIndex; i < source.length(); i++) {
			if (OPENING_BRACKETS.indexOf(source.charAt(i)) > -1) {
				openBrackets++;
			} else if (CLOSING_BRACKETS.indexOf(source.charAt(i)) > -1) {
				openBrackets--;
			}

			if (openBrackets == 0) {
				return i;
			}
		}

		throw new IllegalArgumentException("Mismatched brackets in string: " + source);
	}

	public static int findClosingBracket(final String source) {
		return findClosingBracket(source, 0);
	}

	/**
	 * Finds the first index of a needle character in the haystack, that is not nested in brackets.
	 */
	public static int findNonNestedChar(final String haystack, final String needles) {
		int openBrackets = 0;

		for (int i = 0; i < haystack.length(); i++) {
			if (OPENING_BRACKETS.indexOf(haystack.charAt(i)) > -1) {
				openBrackets++;
			} else if (CLOSING_BRACKETS.indexOf(haystack.charAt(i)) > -1) {
				openBrackets--;
			} else if (openBrackets == 0 && needles.indexOf(haystack.charAt(i)) > -1) {
				return i;
			}
		}

		return -1;
	}

	/**
	 * Finds the last index of a needle character in the haystack, that is not nested in brackets.
	 */
	public static int findLastNonNestedChar(final String haystack, final String needles) {
		int openBrackets = 0;

		for (int i = haystack.length() - 1; i >= 0; i--) {
			if (CLOSING_BRACKETS.indexOf(haystack.charAt(i)) > -1) {
				openBrackets++;
			} else if (OPENING_BRACKETS.indexOf(haystack.charAt(i)) > -1) {
				openBrackets--;
			} else if (openBrackets == 0 && needles.indexOf(haystack.charAt(i)) > -1) {
				return i;
			}
		}

		return -1;
	}

	/**
	 * Splits the input on every occurrence of separator that is not nested in brackets.
	 */
	public static List<String> splitNonNested(final String input, final char separator) {
		final List<String> result = new ArrayList<>();
		String rest = input;
		int index = findNonNestedChar(rest, String.valueOf(separator));
		while (index != -1) {
			result.add(rest.substring(0, index).trim());
			rest = rest.substring(index + 1);
			index = findNonNestedChar(rest, String.valueOf(separator));
		}
		result.add(rest.trim());
		return result;
	}

	public static class Scored<T> implements Comparable<Scored<T>> {
		private final T object;
		private final double score;

		@Override
		public int compareTo(final Scored<T> o) {
			return Doubles.compare(o.score, score);
		}

		public Scored(final T object, final double score) {
			super();
			this.object = object;
			this.score = score;
		}

		public T getObject() {
			return object;
		}

		public double getScore() {
			return score;
		}

	}
}
