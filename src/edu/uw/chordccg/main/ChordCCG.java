package edu.uw.chordccg.main;

import java.io.BufferedReader;
import java.io.File;
import java.io.IOException;
import java.io.InputStreamReader;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.TimeUnit;

import uk.co.flamingpenguin.jewel.cli.ArgumentValidationException;
import uk.co.flamingpenguin.jewel.cli.CliFactory;
import uk.co.flamingpenguin.jewel.cli.Option;

import com.google.common.base.Stopwatch;

import edu.uw.chordccg.main.InputReader.InputToParser;
import edu.uw.chordccg.syntax.grammar.Grammar;
import edu.uw.chordccg.syntax.grammar.Sign;
import edu.uw.chordccg.syntax.parser.DerivationTree;
import edu.uw.chordccg.syntax.parser.DirectedParseException;
import edu.uw.chordccg.syntax.parser.DirectedParserCKY;
import edu.uw.chordccg.syntax.parser.ParseResult;
import edu.uw.chordccg.syntax.parser.ParserBuilder;
import edu.uw.chordccg.syntax.parser.ParserCKY;
import edu.uw.chordccg.syntax.tagger.PretaggedTagger;
import edu.uw.chordccg.util.Util;

public class ChordCCG {

	/**
	 * Command Line Interface
	 */
	public interface CommandLineArguments {
		@Option(shortName = "f", defaultValue = "", description = "(Optional) Path to the input file of tagged chord sequences. Otherwise, the parser will read from stdin.")
		String getInputFile();

		@Option(shortName = "d", defaultValue = "", description = "(Optional) File of derivation trees, one per input sequence, e.g. \"(appf (compf 0 1) 2)\". If given, each sequence is parsed following its tree.")
		String getDirected();

		@Option(defaultValue = "0", description = "(Optional) Maximum number of times to ask the tagger for signs. 0 (default) means no limit.")
		int getMaxIter();

		@Option(defaultValue = "0", description = "(Optional) Keep asking the tagger for signs at least this many times, even once a parse is found. -1 means until the tagger has no more.")
		int getMinIter();

		@Option(shortName = "p", defaultValue = "1", description = "(Optional) Number of full parses to find before stopping. Defaults to 1.")
		int getParses();

		@Option(shortName = "t", defaultValue = "0", description = "(Optional) Timeout for each sequence, in seconds. 0 (default) means no timeout.")
		int getTimeout();

		@Option(description = "(Optional) Record and print the derivations of each result.")
		boolean getDerivations();

		@Option(description = "(Optional) Count results with complex categories as parses.")
		boolean getAllowComplex();

		@Option(defaultValue = "", description = "(Optional) File to dump the chart to as parsing proceeds.")
		String getDumpChart();

		@Option(helpRequest = true, description = "Display this message", shortName = "h")
		boolean getHelp();
	}

	public static void main(final String[] args) throws IOException {
		try {
			final CommandLineArguments commandLineOptions = CliFactory.parseArguments(CommandLineArguments.class, args);
			final int parsed = run(commandLineOptions, readInput(commandLineOptions), System.out);
			System.err.println("Sequences parsed: " + parsed);
		} catch (final ArgumentValidationException e) {
			System.err.println(e.getMessage());
			System.err.println(CliFactory.createCli(CommandLineArguments.class).getHelpMessage());
		}
	}

	private static List<String> readInput(final CommandLineArguments commandLineOptions) throws IOException {
		if (!commandLineOptions.getInputFile().isEmpty()) {
			return Util.readFile(Util.getFile(commandLineOptions.getInputFile()));
		}

		final List<String> result = new ArrayList<>();
		final BufferedReader in = new BufferedReader(new InputStreamReader(System.in, StandardCharsets.UTF_8));
		String line;
		while ((line = in.readLine()) != null) {
			result.add(line);
		}
		return result;
	}

	/**
	 * Parses every sequence in the input lines, printing the results to out. Returns the number of sequences parsed.
	 */
	public static int run(final CommandLineArguments commandLineOptions, final List<String> inputLines,
			final PrintStream out) throws IOException {
		final List<InputToParser> inputs = new InputReader().readLines(inputLines);
		final List<DerivationTree> trees = readTrees(commandLineOptions);
		if (trees != null && trees.size() != inputs.size()) {
			throw new IllegalArgumentException("Got " + trees.size() + " derivation trees for " + inputs.size()
					+ " input sequences");
		}

		final Grammar grammar = Grammar.STANDARD;
		final ParserCKY parser = configure(new ParserCKY.Builder(), commandLineOptions).build();
		final DirectedParserCKY directedParser = configure(new DirectedParserCKY.Builder(), commandLineOptions)
				.build();

		final Stopwatch timer = Stopwatch.createStarted();
		int id = 0;
		for (final InputToParser input : inputs) {
			id++;
			System.err.println("Parsing sequence " + id + ": " + input);
			out.println("Sequence " + id + ": " + input);

			final PretaggedTagger tagger = new PretaggedTagger(input, grammar);
			final ParseResult result;
			if (trees == null) {
				result = parser.parse(tagger);
			} else {
				try {
					result = directedParser.parse(tagger, trees.get(id - 1));
				} catch (final DirectedParseException e) {
					System.err.println("Directed parse failed: " + e.getMessage());
					out.println("Directed parse failed: " + e.getMessage());
					continue;
				}
			}
			print(result, commandLineOptions.getDerivations(), out);
		}

		System.err.println("Speed: " + Util.twoDP(1000.0 * id / Math.max(1, timer.elapsed(TimeUnit.MILLISECONDS)))
				+ " sequences per second");
		return id;
	}

	private static <T extends ParserBuilder<T, ?>> T configure(final T builder,
			final CommandLineArguments commandLineOptions) {
		final String dumpChart = commandLineOptions.getDumpChart();
		return builder.maxIterations(commandLineOptions.getMaxIter()).minIterations(commandLineOptions.getMinIter())
				.requiredParses(commandLineOptions.getParses()).timeoutSeconds(commandLineOptions.getTimeout())
				.derivations(commandLineOptions.getDerivations()).allowComplex(commandLineOptions.getAllowComplex())
				.dumpChart(dumpChart.isEmpty() ? null : Util.getFile(dumpChart));
	}

	private static List<DerivationTree> readTrees(final CommandLineArguments commandLineOptions) throws IOException {
		if (commandLineOptions.getDirected().isEmpty()) {
			return null;
		}
		final List<DerivationTree> result = new ArrayList<>();
		for (final String line : Util.readFile(new File(commandLineOptions.getDirected()))) {
			if (!line.trim().isEmpty() && !line.startsWith("#")) {
				result.add(DerivationTree.valueOf(line));
			}
		}
		return result;
	}

	private static void print(final ParseResult result, final boolean derivations, final PrintStream out) {
		if (result.isEmpty()) {
			out.println("No parses" + (result.isTimedOut() ? " (timed out)" : ""));
		}
		int i = 0;
		for (final Sign sign : result.getParses()) {
			i++;
			out.println(i + ") " + sign + (result.isUsedBackoff() ? " [backoff]" : ""));
			if (derivations && sign.getDerivationTrace() != null) {
				out.println(sign.getDerivationTrace().toString(4));
			}
		}
		out.println();
	}
}
