package edu.uw.chordccg.syntax.parser;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertSame;
import static org.junit.Assert.assertTrue;

import java.io.File;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;

import org.junit.Rule;
import org.junit.Test;
import org.junit.rules.TemporaryFolder;

import edu.uw.chordccg.main.InputReader;
import edu.uw.chordccg.semantics.LogicParser;
import edu.uw.chordccg.syntax.grammar.Category;
import edu.uw.chordccg.syntax.grammar.Grammar;
import edu.uw.chordccg.syntax.tagger.PretaggedTagger;
import edu.uw.chordccg.syntax.tagger.Tagger;

public class ParserCKYTest {

	@Rule
	public TemporaryFolder folder = new TemporaryFolder();

	// ii-V-I
	static final String CADENCE = "Dm7|II^D/{c}V^D : \\$x.leftonto($x)=1.0\tG7|V^D/{c}I^T : \\$x.leftonto($x)=1.0\t"
			+ "C|I^T : [<0,0>]=1.0";

	// The tonic is only the second choice for the last chord.
	static final String SECOND_CHOICE = "G7|V^D/{c}I^T : \\$x.leftonto($x)=0.9\t"
			+ "C|II^T : [<2,0>]=0.7|I^T : [<0,0>]=0.3";

	static final String NO_PARSE = "G7|V^D/{c}I^T : \\$x.leftonto($x)=1.0\tD|II^T : [<2,0>]=1.0";

	static Tagger tagger(final String line) {
		return new PretaggedTagger(new InputReader().readInput(line), Grammar.STANDARD);
	}

	@Test
	public void testParse() {
		final ParseResult result = new ParserCKY.Builder().build().parse(tagger(CADENCE));
		assertEquals(1, result.getParses().size());
		assertEquals("II^D-I^T : [leftonto(leftonto(<0,0>@2))]", result.getParses().get(0).toString());
		assertEquals(1, result.getIterations());
		assertFalse(result.isTimedOut());
		assertFalse(result.isUsedBackoff());
		assertEquals(3, result.getChart().getLength());
	}

	@Test
	public void testLaterIterations() {
		final ParseResult result = new ParserCKY.Builder().build().parse(tagger(SECOND_CHOICE));
		assertEquals(2, result.getIterations());
		assertEquals(1, result.getParses().size());
		assertEquals(Category.valueOf("V^D-I^T"), result.getParses().get(0).getCategory());
	}

	@Test
	public void testMaxIterations() {
		final ParseResult result = new ParserCKY.Builder().maxIterations(1).build().parse(tagger(SECOND_CHOICE));
		assertEquals(1, result.getIterations());
		assertTrue(result.isEmpty());
	}

	@Test
	public void testRequiredParses() {
		final ParseResult result = new ParserCKY.Builder().requiredParses(2).build().parse(tagger(SECOND_CHOICE));
		// Stops when the tagger has nothing more to give.
		assertEquals(2, result.getIterations());
		assertEquals(1, result.getParses().size());
	}

	@Test
	public void testMinIterations() {
		final ParseResult result = new ParserCKY.Builder().minIterations(-1).build().parse(tagger(CADENCE));
		assertEquals(1, result.getIterations());
		assertEquals(1, result.getParses().size());
	}

	@Test
	public void testNoParse() {
		final ParseResult result = new ParserCKY.Builder().build().parse(tagger(NO_PARSE));
		assertTrue(result.isEmpty());
		assertFalse(result.isUsedBackoff());
		assertTrue(result.getChart().getSigns(0, 2).isEmpty());
	}

	@Test
	public void testBackoff() {
		final Backoff backoff = tagger -> Collections.singletonList(LogicParser.fromString("[<0,0>, <2,0>]"));
		final ParseResult result = new ParserCKY.Builder().backoff(backoff).build().parse(tagger(NO_PARSE));
		assertTrue(result.isUsedBackoff());
		assertEquals(1, result.getParses().size());
		assertSame(Category.PLACEHOLDER, result.getParses().get(0).getCategory());
		assertEquals("[<0,0>, <2,0>]", result.getParses().get(0).getSemantics().toString());
	}

	@Test
	public void testBackoffNotUsedWhenParsed() {
		final Backoff backoff = tagger -> Collections.singletonList(LogicParser.fromString("[<0,0>]"));
		final ParseResult result = new ParserCKY.Builder().backoff(backoff).build().parse(tagger(CADENCE));
		assertFalse(result.isUsedBackoff());
		assertEquals(Category.valueOf("II^D-I^T"), result.getParses().get(0).getCategory());
	}

	@Test
	public void testDerivations() {
		final ParseResult result = new ParserCKY.Builder().derivations(true).build().parse(tagger(CADENCE));
		assertEquals(2, result.getParses().get(0).getDerivationTrace().getRules().size());
	}

	@Test
	public void testAllowComplex() {
		final ParseResult result = new ParserCKY.Builder().allowComplex(true).build().parse(tagger(
				"Dm7|II^D/{c}V^D : \\$x.leftonto($x)=1.0\tG7|V^D/{c}I^T : \\$x.leftonto($x)=1.0"));
		assertTrue(result.getParses().stream().anyMatch(sign -> sign.getCategory().equals(Category.valueOf(
				"II^D/{c}I^T"))));
	}

	@Test
	public void testListener() {
		final CountingListener listener = new CountingListener(true);
		final ParseResult result = new ParserCKY.Builder().listeners(Collections.<ParserListener> singletonList(
				listener)).build().parse(tagger(CADENCE));
		assertEquals(Collections.singletonList(Arrays.asList("Dm7", "G7", "C")), listener.inputs);
		assertTrue(listener.insertions > 0);
		assertEquals(1, listener.completions);
		assertEquals(result.getChart().size(), listener.chartSize);
	}

	@Test
	public void testListenerStopsParse() {
		final CountingListener listener = new CountingListener(false);
		final ParseResult result = new ParserCKY.Builder().listeners(Collections.<ParserListener> singletonList(
				listener)).build().parse(tagger(CADENCE));
		assertEquals(1, listener.insertions);
		assertTrue(result.isEmpty());
		assertTrue(result.getChart().getSigns(0, 3).isEmpty());
		assertFalse(result.getChart().getSigns(0, 2).isEmpty());
	}

	@Test
	public void testTimeoutNotReached() {
		final ParseResult result = new ParserCKY.Builder().timeoutSeconds(60).build().parse(tagger(CADENCE));
		assertFalse(result.isTimedOut());
		assertEquals(1, result.getParses().size());
	}

	@Test
	public void testTimeoutExpires() {
		final ParseResult result = new ParserCKY.Builder().timeoutSeconds(1).listeners(Collections
				.<ParserListener> singletonList(new SlowListener())).build().parse(tagger(CADENCE));
		assertTrue(result.isTimedOut());
		assertTrue(result.isEmpty());
		assertFalse(result.isUsedBackoff());
		// The sweep stopped before the full span was reached.
		assertTrue(result.getChart().getSigns(0, 3).isEmpty());
	}

	@Test
	public void testTimeoutFallsBackToBackoff() {
		final Backoff backoff = tagger -> Collections.singletonList(LogicParser.fromString("[<0,0>]"));
		final ParseResult result = new ParserCKY.Builder().timeoutSeconds(1).backoff(backoff).listeners(Collections
				.<ParserListener> singletonList(new SlowListener())).build().parse(tagger(CADENCE));
		assertTrue(result.isTimedOut());
		assertTrue(result.isUsedBackoff());
		assertEquals(1, result.getParses().size());
		assertSame(Category.PLACEHOLDER, result.getParses().get(0).getCategory());
	}

	@Test
	public void testDumpChart() throws Exception {
		final File file = new File(folder.getRoot(), "chart.ser");
		new ParserCKY.Builder().dumpChart(file).build().parse(tagger(CADENCE));
		assertEquals(1, Chart.load(file).getParses().size());
	}

	@Test(expected = IllegalArgumentException.class)
	public void testInvalidRequiredParses() {
		new ParserCKY.Builder().requiredParses(0).build();
	}

	// Takes longer than a second over its first insertion.
	private static class SlowListener extends CountingListener {
		private boolean slept = false;

		private SlowListener() {
			super(true);
		}

		@Override
		public boolean handleChartInsertion(final int start, final int end, final Chart chart) {
			if (!slept) {
				slept = true;
				try {
					Thread.sleep(1100);
				} catch (final InterruptedException e) {
					Thread.currentThread().interrupt();
				}
			}
			return super.handleChartInsertion(start, end, chart);
		}
	}

	private static class CountingListener implements ParserListener {
		private final boolean keepParsing;
		private final List<List<String>> inputs = new ArrayList<>();
		private int insertions = 0;
		private int completions = 0;
		private int chartSize = -1;

		private CountingListener(final boolean keepParsing) {
			this.keepParsing = keepParsing;
		}

		@Override
		public void handleNewInput(final List<String> tokens) {
			inputs.add(tokens);
		}

		@Override
		public boolean handleChartInsertion(final int start, final int end, final Chart chart) {
			insertions++;
			return keepParsing;
		}

		@Override
		public void handleSearchCompletion(final ParseResult result, final int chartSize) {
			completions++;
			this.chartSize = chartSize;
		}
	}
}
