package edu.uw.chordccg.syntax.parser;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertTrue;
import static org.junit.Assert.fail;

import org.junit.Test;

public class DirectedParserCKYTest {

	private static ParseResult parse(final String input, final String tree) throws DirectedParseException {
		return new DirectedParserCKY.Builder().build().parse(ParserCKYTest.tagger(input), DerivationTree.valueOf(
				tree));
	}

	private static DirectedParseException parseFailure(final String input, final String tree) {
		try {
			parse(input, tree);
			fail();
			return null;
		} catch (final DirectedParseException e) {
			return e;
		}
	}

	@Test
	public void testRightBranching() throws DirectedParseException {
		final ParseResult result = parse(ParserCKYTest.CADENCE, "(appf 0 (appf 1 2))");
		assertEquals(1, result.getParses().size());
		assertEquals("II^D-I^T : [leftonto(leftonto(<0,0>@2))]", result.getParses().get(0).toString());
		// Only the spans of the tree are filled.
		assertTrue(result.getChart().getSigns(0, 2).isEmpty());
	}

	@Test
	public void testComposition() throws DirectedParseException {
		final ParseResult result = parse(ParserCKYTest.CADENCE, "(appf (compf 0 1) 2)");
		assertEquals("II^D-I^T : [leftonto(leftonto(<0,0>@2))]", result.getParses().get(0).toString());
		assertTrue(result.getChart().getSigns(1, 3).isEmpty());
	}

	@Test
	public void testRepetition() throws DirectedParseException {
		final ParseResult result = parse("C|I^T : [<0,0>]=1.0\tC|I^T : [<0,0>]=1.0", "(appf (rep 0) 1)");
		assertEquals(1, result.getParses().size());
		assertEquals("I^T : [<0,0>@0]", result.getParses().get(0).toString());
	}

	@Test
	public void testLowerRankedCandidate() throws DirectedParseException {
		final ParseResult result = parse(ParserCKYTest.SECOND_CHOICE, "(appf 0 1)");
		assertEquals(1, result.getParses().size());
		assertEquals("V^D-I^T : [leftonto(<0,0>@1)]", result.getParses().get(0).toString());
		// Both candidates for the second chord were read.
		assertEquals(2, result.getIterations());
	}

	@Test
	public void testRuleDoesNotApply() {
		final DirectedParseException e = parseFailure(ParserCKYTest.CADENCE, "(appb 0 (appf 1 2))");
		assertEquals(2, e.getInputs().size());
		assertEquals("(appb 0 (appf 1 2))", e.getTreeNode());
	}

	@Test
	public void testUnknownRule() {
		final DirectedParseException e = parseFailure(ParserCKYTest.CADENCE, "(appf (foo 0 1) 2)");
		assertTrue(e.getMessage().contains("'foo'"));
		assertEquals("(foo 0 1)", e.getTreeNode());
	}

	@Test
	public void testTooManyChildren() {
		parseFailure(ParserCKYTest.CADENCE, "(appf 0 1 2)");
	}

	@Test
	public void testWrongArity() {
		final DirectedParseException e = parseFailure(ParserCKYTest.CADENCE, "(appf (rep 0 1) 2)");
		assertTrue(e.getMessage().contains("must have 1 children"));
	}

	@Test
	public void testWrongLength() {
		parseFailure(ParserCKYTest.CADENCE, "(appf 0 1)");
	}
}
