package edu.uw.chordccg.syntax.grammar;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertNull;
import static org.junit.Assert.assertSame;
import static org.junit.Assert.assertTrue;

import java.util.Arrays;
import java.util.Collections;
import java.util.List;

import org.junit.Test;

public class GrammarTest {

	@Test
	public void testGetRule() {
		final Grammar grammar = Grammar.STANDARD;
		assertSame(Combinator.FORWARD_APPLICATION, grammar.getRule("appf"));
		assertSame(Combinator.CROSSED_FORWARD_COMPOSITION, grammar.getRule("xcompf"));
		assertSame(Combinator.DEVELOPMENT, grammar.getRule("cont"));
		assertSame(Combinator.DEVELOPMENT, grammar.getRule("dev"));
		assertSame(Combinator.TONIC_REPETITION, grammar.getRule("rep"));
		assertNull(grammar.getRule("foo"));
	}

	@Test
	public void testStandardGrammar() {
		assertEquals(8, Grammar.STANDARD.getBinaryRules().size());
		assertTrue(Grammar.STANDARD.getUnaryRules().isEmpty());
		assertEquals(2, Grammar.STANDARD.getLexicalExpansionRules().size());
	}

	@Test(expected = IllegalArgumentException.class)
	public void testDuplicateRule() {
		new Grammar(Arrays.asList(Combinator.FORWARD_APPLICATION, Combinator.FORWARD_APPLICATION), Collections
				.<Combinator> emptyList(), Collections.<Combinator> emptyList());
	}

	@Test(expected = IllegalArgumentException.class)
	public void testWrongArity() {
		new Grammar(Collections.singletonList(Combinator.TONIC_REPETITION), Collections.<Combinator> emptyList(),
				Collections.<Combinator> emptyList());
	}

	@Test
	public void testExpandTonic() {
		final Sign tonic = Sign.valueOf("I^T : [<0,0>]");
		tonic.setDuration(2);
		final List<Sign> expanded = Grammar.STANDARD.expandLexicalSigns(Collections.singletonList(tonic));
		assertEquals(2, expanded.size());
		assertSame(tonic, expanded.get(0));
		assertEquals(Category.valueOf("I^T/I^T"), expanded.get(1).getCategory());
		assertEquals(Integer.valueOf(2), expanded.get(1).getDuration());
	}

	@Test
	public void testExpandCadence() {
		final List<Sign> expanded = Grammar.STANDARD.expandLexicalSigns(Arrays.asList(Sign.valueOf(
				"V^D/{c}I^T : \\$x.leftonto($x)"), Sign.valueOf("V^D-I^T : [leftonto(<0,0>)]")));
		assertEquals(3, expanded.size());
		assertEquals(Category.valueOf("V^D/V^D"), expanded.get(2).getCategory());
	}
}
