package edu.uw.chordccg.semantics;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

import com.google.common.base.Preconditions;

import edu.uw.chordccg.util.Util;

/**
 * Converts strings to logical forms.
 *
 * Example input: \$x.leftonto(now@3([<0,0>, $x]))+[<1,0>]
 *
 * <ul>
 * <li>&lt;x,y&gt; a point in the tonal space, optionally followed by @time</li>
 * <li>[a, b] a path; A+B concatenation of paths; A &amp; B coordination of cadences</li>
 * <li>$x0 a variable, with the trailing digits as its index</li>
 * <li>leftonto(E), rightonto(E), now@T(E) or now(E) a predicate applied to E</li>
 * <li>\$x.E or \$x,$y.E abstraction; (F A) application</li>
 * </ul>
 *
 * The result is not beta-reduced.
 */
public abstract class LogicParser {

	abstract int fromString2(String input, Semantics target);

	abstract boolean canApply(String input);

	private static final Pattern VARIABLE = Pattern.compile("\\$([a-zA-Z_][a-zA-Z_0-9]*?)([0-9]*)");
	private static final Pattern COORDINATE = Pattern.compile("<\\s*(-?[0-9]+)\\s*,\\s*(-?[0-9]+)\\s*>(?:@([0-9]+))?");
	private static final Pattern PREDICATE = Pattern.compile("(leftonto|rightonto|now)(?:@([0-9]+))?\\(.*",
			Pattern.DOTALL);

	private static LogicParser VARIABLE_PARSER = new LogicParser() {

		@Override
		int fromString2(final String input, final Semantics target) {
			return target.variable(parseVariable(input));
		}

		@Override
		boolean canApply(final String input) {
			return VARIABLE.matcher(input).matches();
		}
	};

	private static Variable parseVariable(final String input) {
		final Matcher matcher = VARIABLE.matcher(input.trim());
		if (!matcher.matches()) {
			throw new IllegalArgumentException("Invalid variable name: " + input);
		}
		final String index = matcher.group(2);
		return new Variable(matcher.group(1), index.isEmpty() ? 0 : Integer.parseInt(index));
	}

	private static LogicParser LAMBDA_PARSER = new LogicParser() {

		@Override
		int fromString2(final String input, final Semantics target) {
			final int dot = input.indexOf('.');
			if (dot == -1) {
				throw new IllegalArgumentException("Lambda abstraction needs a dot: " + input);
			}

			final List<Variable> variables = new ArrayList<>();
			for (final String name : input.substring(1, dot).split(",")) {
				variables.add(parseVariable(name));
			}
			return target.abstraction(variables, parse(input.substring(dot + 1), target));
		}

		@Override
		boolean canApply(final String input) {
			return input.startsWith("\\");
		}
	};

	private static LogicParser COORDINATION_PARSER = new LogicParser() {

		@Override
		int fromString2(final String input, final Semantics target) {
			return target.coordination(parseAll(Util.splitNonNested(input, '&'), target));
		}

		@Override
		boolean canApply(final String input) {
			return Util.findNonNestedChar(input, "&") > -1;
		}
	};

	private static LogicParser LIST_CAT_PARSER = new LogicParser() {

		@Override
		int fromString2(final String input, final Semantics target) {
			return target.listCat(parseAll(Util.splitNonNested(input, '+'), target));
		}

		@Override
		boolean canApply(final String input) {
			return Util.findNonNestedChar(input, "+") > -1;
		}
	};

	/**
	 * Brackets either contain an application, "(F A)", or just group an expression.
	 */
	private static LogicParser BRACKETS_PARSER = new LogicParser() {

		@Override
		int fromString2(final String input, final Semantics target) {
			final String contents = input.substring(1, input.length() - 1).trim();
			final int space = Util.findLastNonNestedChar(contents, " \t");
			if (space == -1 || Util.findNonNestedChar(contents, "&") > -1) {
				return parse(contents, target);
			}

			final int functor = parse(contents.substring(0, space), target);
			return target.application(functor, parse(contents.substring(space + 1), target));
		}

		@Override
		boolean canApply(final String input) {
			return input.startsWith("(") && Util.findClosingBracket(input, 0) == input.length() - 1;
		}
	};

	private static LogicParser LIST_PARSER = new LogicParser() {

		@Override
		int fromString2(final String input, final Semantics target) {
			final String contents = input.substring(1, input.length() - 1).trim();
			if (contents.isEmpty()) {
				return target.list();
			}
			return target.list(parseAll(Util.splitNonNested(contents, ','), target));
		}

		@Override
		boolean canApply(final String input) {
			return input.startsWith("[") && Util.findClosingBracket(input, 0) == input.length() - 1;
		}
	};

	private static LogicParser COORDINATE_PARSER = new LogicParser() {

		@Override
		int fromString2(final String input, final Semantics target) {
			final Matcher matcher = COORDINATE.matcher(input);
			Preconditions.checkState(matcher.matches());
			final EnharmonicCoordinate coordinate = EnharmonicCoordinate.fromHarmonicCoordinate(
					Integer.parseInt(matcher.group(1)), Integer.parseInt(matcher.group(2)));
			final Integer time = matcher.group(3) == null ? null : Integer.valueOf(matcher.group(3));
			return target.coordinate(coordinate, time);
		}

		@Override
		boolean canApply(final String input) {
			return COORDINATE.matcher(input).matches();
		}
	};

	private static LogicParser PREDICATE_PARSER = new LogicParser() {

		@Override
		int fromString2(final String input, final Semantics target) {
			final Matcher matcher = PREDICATE.matcher(input);
			Preconditions.checkState(matcher.matches());
			final Predicate predicate = Predicate.fromName(matcher.group(1));
			final Integer time = matcher.group(2) == null ? null : Integer.valueOf(matcher.group(2));
			final int open = input.indexOf('(');
			final int functor = target.predicate(predicate, time);
			return target.application(functor, parse(input.substring(open + 1, input.length() - 1), target));
		}

		@Override
		boolean canApply(final String input) {
			if (!PREDICATE.matcher(input).matches()) {
				return false;
			}
			return Util.findClosingBracket(input, input.indexOf('(')) == input.length() - 1;
		}
	};

	// This list defines precedence. Coordinations always print in brackets, so a top-level "&" cannot be part of a
	// lambda body.
	private final static List<LogicParser> parsers = Arrays.asList(COORDINATION_PARSER, LAMBDA_PARSER,
			LIST_CAT_PARSER, BRACKETS_PARSER, LIST_PARSER, PREDICATE_PARSER, COORDINATE_PARSER, VARIABLE_PARSER);

	public static Semantics fromString(final String input) {
		final Semantics result = new Semantics();
		result.setRoot(parse(input, result));
		return result;
	}

	private static int[] parseAll(final List<String> inputs, final Semantics target) {
		final int[] result = new int[inputs.size()];
		for (int i = 0; i < result.length; i++) {
			result[i] = parse(inputs.get(i), target);
		}
		return result;
	}

	private static int parse(String input, final Semantics target) {
		input = input.trim();
		for (final LogicParser parser : parsers) {
			if (parser.canApply(input)) {
				return parser.fromString2(input, target);
			}
		}

		throw new IllegalArgumentException("Unable to build logic for string: " + input);
	}
}
