package edu.uw.chordccg.main;

import java.io.File;
import java.io.IOException;
import java.io.Serializable;
import java.util.ArrayList;
import java.util.Collections;
import java.util.InputMismatchException;
import java.util.List;

import com.google.common.base.Splitter;

import edu.uw.chordccg.syntax.grammar.Sign;
import edu.uw.chordccg.util.Util;
import edu.uw.chordccg.util.Util.Scored;

/**
 * Reads chord sequences tagged with candidate signs. Each line is one sequence, with tokens separated by tabs. A
 * token is the chord, optionally followed by "@" and its duration, then each candidate as "|SIGN=PROBABILITY":
 *
 * C@2|I^T : &lt;0,0&gt;=1.0&lt;TAB&gt;G7|V^D/{c}I^T : \$x.leftonto($x)=0.9|V^D : &lt;1,0&gt;=0.1
 *
 * Empty lines and lines starting with "#" are skipped.
 */
public class InputReader {

	private static final Splitter TOKEN_SPLITTER = Splitter.on('\t').omitEmptyStrings().trimResults();
	private static final Splitter FIELD_SPLITTER = Splitter.on('|').trimResults();

	public static class InputChord implements Serializable {
		private static final long serialVersionUID = 1L;

		private final String chord;
		private final Integer duration;

		public InputChord(final String chord, final Integer duration) {
			this.chord = chord;
			this.duration = duration;
		}

		public String getChord() {
			return chord;
		}

		public Integer getDuration() {
			return duration;
		}

		@Override
		public String toString() {
			return chord + (duration == null ? "" : "@" + duration);
		}
	}

	public static class InputToParser implements Serializable {
		private static final long serialVersionUID = 1L;

		private final List<InputChord> chords;
		private final List<List<Scored<Sign>>> candidates;

		public InputToParser(final List<InputChord> chords, final List<List<Scored<Sign>>> candidates) {
			if (chords.size() != candidates.size()) {
				throw new IllegalArgumentException("Got " + candidates.size() + " candidate lists for "
						+ chords.size() + " chords");
			}
			this.chords = chords;
			this.candidates = candidates;
		}

		public int length() {
			return chords.size();
		}

		public List<InputChord> getChords() {
			return chords;
		}

		/**
		 * Candidate signs for each chord, highest probability first.
		 */
		public List<List<Scored<Sign>>> getCandidates() {
			return candidates;
		}

		public List<String> getTokens() {
			final List<String> result = new ArrayList<>(chords.size());
			for (final InputChord chord : chords) {
				result.add(chord.getChord());
			}
			return result;
		}

		@Override
		public String toString() {
			return String.join(" ", getTokens());
		}
	}

	public List<InputToParser> readFile(final File file) throws IOException {
		return readLines(Util.readFile(file));
	}

	public List<InputToParser> readLines(final List<String> lines) {
		final List<InputToParser> result = new ArrayList<>();
		for (final String line : lines) {
			if (!line.trim().isEmpty() && !line.startsWith("#")) {
				result.add(readInput(line));
			}
		}
		return result;
	}

	public InputToParser readInput(final String line) {
		final List<InputChord> chords = new ArrayList<>();
		final List<List<Scored<Sign>>> candidates = new ArrayList<>();
		for (final String token : TOKEN_SPLITTER.split(line)) {
			final List<String> fields = FIELD_SPLITTER.splitToList(token);
			if (fields.size() < 2) {
				throw new InputMismatchException("Invalid input: expected \"CHORD|SIGN=PROBABILITY\" but was: "
						+ token);
			}

			chords.add(readChord(fields.get(0)));
			final List<Scored<Sign>> tokenCandidates = new ArrayList<>();
			for (final String candidate : fields.subList(1, fields.size())) {
				tokenCandidates.add(readCandidate(candidate));
			}
			Collections.sort(tokenCandidates);
			candidates.add(tokenCandidates);
		}
		return new InputToParser(chords, candidates);
	}

	private static InputChord readChord(final String field) {
		final int at = field.lastIndexOf('@');
		if (at == -1) {
			return new InputChord(field, null);
		}
		try {
			return new InputChord(field.substring(0, at), Integer.valueOf(field.substring(at + 1)));
		} catch (final NumberFormatException e) {
			throw new IllegalArgumentException("Invalid duration in: " + field, e);
		}
	}

	private static Scored<Sign> readCandidate(final String field) {
		final int equals = field.lastIndexOf('=');
		if (equals == -1) {
			throw new InputMismatchException("Invalid candidate, expected \"SIGN=PROBABILITY\": " + field);
		}
		final double probability;
		try {
			probability = Double.parseDouble(field.substring(equals + 1).trim());
		} catch (final NumberFormatException e) {
			throw new IllegalArgumentException("Invalid probability in: " + field, e);
		}
		return new Scored<>(Sign.valueOf(field.substring(0, equals)), probability);
	}
}
