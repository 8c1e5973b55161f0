package edu.uw.chordccg.syntax.grammar;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertTrue;

import java.util.Arrays;

import org.junit.Test;

public class SignTest {

	@Test
	public void testValueOf() {
		final Sign sign = Sign.valueOf("V^D/{c}I^T : \\$x.leftonto($x)");
		assertEquals(Category.valueOf("V^D/{c}I^T"), sign.getCategory());
		assertEquals("V^D/{c}I^T : \\$x0.leftonto($x0)", sign.toString());
	}

	@Test(expected = IllegalArgumentException.class)
	public void testValueOfWithoutSemantics() {
		Sign.valueOf("I^T");
	}

	@Test
	public void testEquivalence() {
		final Sign sign = Sign.valueOf("V^D/{c}I^T : \\$x.leftonto($x)");
		final Sign renamed = Sign.valueOf("V^D/{c}I^T : \\$y.leftonto($y)");
		assertTrue(sign.isEquivalentTo(renamed));
		assertTrue(Sign.EQUIVALENCE.equivalent(sign, renamed));
		assertEquals(Sign.EQUIVALENCE.hash(sign), Sign.EQUIVALENCE.hash(renamed));

		assertFalse(sign.isEquivalentTo(Sign.valueOf("V^D/{c}I^T : \\$y.rightonto($y)")));
		assertFalse(sign.isEquivalentTo(Sign.valueOf("V^D/I^T : \\$x.leftonto($x)")));
	}

	@Test
	public void testRuleMemos() {
		final Sign first = Sign.valueOf("V^D/{c}I^T : \\$x.leftonto($x)");
		final Sign second = Sign.valueOf("I^T : [<0,0>]");
		final Sign copy = Sign.valueOf("I^T : [<0,0>]");

		assertFalse(first.isRuleApplied(Combinator.FORWARD_APPLICATION, second));
		assertTrue(first.noteRuleApplied(Combinator.FORWARD_APPLICATION, second));
		assertFalse(first.noteRuleApplied(Combinator.FORWARD_APPLICATION, second));
		assertTrue(first.isRuleApplied(Combinator.FORWARD_APPLICATION, second));
		// Partners are told apart by identity.
		assertFalse(first.isRuleApplied(Combinator.FORWARD_APPLICATION, copy));
		assertFalse(first.isRuleApplied(Combinator.BACKWARD_APPLICATION, second));

		assertFalse(first.isRuleApplied(Combinator.CADENCE_REPETITION));
		assertTrue(first.noteRuleApplied(Combinator.CADENCE_REPETITION));
		assertTrue(first.isRuleApplied(Combinator.CADENCE_REPETITION));
	}

	@Test
	public void testDerivationTrace() {
		final Sign dominant = Sign.valueOf("V^D/{c}I^T : \\$x.leftonto($x)");
		dominant.setDerivationTrace(new DerivationTrace(dominant, "G7"));
		final Sign tonic = Sign.valueOf("I^T : [<0,0>]");
		tonic.setDerivationTrace(new DerivationTrace(tonic, "C"));

		final Sign result = Combinator.FORWARD_APPLICATION.apply(dominant, tonic).get(0);
		final DerivationTrace trace = new DerivationTrace(result, Combinator.FORWARD_APPLICATION, Arrays.asList(
				dominant.getDerivationTrace(), tonic.getDerivationTrace()));
		assertFalse(trace.isLexical());
		assertTrue(dominant.getDerivationTrace().isLexical());
		assertEquals("G7", dominant.getDerivationTrace().getWord());
		assertEquals(3, trace.getSize());
		assertEquals(">", trace.getRules().get(0).getRule());

		trace.addRulesFromTrace(new DerivationTrace(result, Combinator.BACKWARD_APPLICATION, Arrays.asList(tonic
				.getDerivationTrace(), dominant.getDerivationTrace())));
		assertEquals(2, trace.getRules().size());
		assertEquals(5, trace.getSize());
		assertTrue(trace.toString().contains("from <"));
		assertTrue(trace.toString().contains("<= \"C\""));
	}
}
