package edu.uw.chordccg.syntax.parser;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertSame;
import static org.junit.Assert.assertTrue;

import java.util.Arrays;
import java.util.Collections;

import org.junit.Test;

import edu.uw.chordccg.syntax.grammar.Category;
import edu.uw.chordccg.syntax.grammar.Combinator;
import edu.uw.chordccg.syntax.grammar.DerivationTrace;
import edu.uw.chordccg.syntax.grammar.Sign;

public class ChartCellTest {

	@Test
	public void testDuplicatesAreNotAdded() {
		final ChartCell cell = new ChartCell(false);
		final Sign sign = Sign.valueOf("V^D/{c}I^T : \\$x.leftonto($x)");
		assertTrue(cell.add(sign));
		assertFalse(cell.add(Sign.valueOf("V^D/{c}I^T : \\$y.leftonto($y)")));
		assertTrue(cell.add(Sign.valueOf("V^D/I^T : \\$y.leftonto($y)")));
		assertEquals(2, cell.size());
		assertSame(sign, cell.getSign(0));
		assertEquals(1, cell.getSigns(Category.valueOf("V^D/{c}I^T")).size());
	}

	@Test
	public void testDuplicatesMergeDerivations() {
		final Sign dominant = Sign.valueOf("V^D/{c}I^T : \\$x.leftonto($x)");
		dominant.setDerivationTrace(new DerivationTrace(dominant, "G7"));
		final Sign tonic = Sign.valueOf("I^T : [<0,0>]");
		tonic.setDerivationTrace(new DerivationTrace(tonic, "C"));
		final Sign first = Sign.valueOf("V^D-I^T : [leftonto(<0,0>)]");
		first.setDerivationTrace(new DerivationTrace(first, Combinator.FORWARD_APPLICATION, Arrays.asList(dominant
				.getDerivationTrace(), tonic.getDerivationTrace())));
		final Sign second = Sign.valueOf("V^D-I^T : [leftonto(<0,0>)]");
		second.setDerivationTrace(new DerivationTrace(second, Combinator.DEVELOPMENT, Arrays.asList(dominant
				.getDerivationTrace(), tonic.getDerivationTrace())));

		final ChartCell cell = new ChartCell(true);
		assertTrue(cell.addAll(Collections.singletonList(first)));
		assertFalse(cell.addAll(Collections.singletonList(second)));
		assertEquals(1, cell.size());
		assertEquals(2, first.getDerivationTrace().getRules().size());
		assertEquals("<dev>", first.getDerivationTrace().getRules().get(1).getRule());
	}

	@Test
	public void testDerivationsNotMergedWhenOff() {
		final Sign first = Sign.valueOf("I^T : [<0,0>]");
		first.setDerivationTrace(new DerivationTrace(first, "C"));
		final Sign second = Sign.valueOf("I^T : [<0,0>]");
		final DerivationTrace trace = new DerivationTrace(second, Combinator.DEVELOPMENT, Arrays.asList(first
				.getDerivationTrace(), first.getDerivationTrace()));
		second.setDerivationTrace(trace);

		final ChartCell cell = new ChartCell(false);
		cell.add(first);
		cell.add(second);
		assertTrue(first.getDerivationTrace().getRules().isEmpty());
	}
}
