package edu.uw.chordccg.semantics;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertNotEquals;

import org.junit.Test;

public class EnharmonicCoordinateTest {

	@Test
	public void testHarmonicCoordinates() {
		for (int x = -6; x <= 6; x++) {
			for (int y = -4; y <= 4; y++) {
				final EnharmonicCoordinate coordinate = EnharmonicCoordinate.fromHarmonicCoordinate(x, y);
				assertEquals(x, coordinate.getHarmonicX());
				assertEquals(y, coordinate.getHarmonicY());
			}
		}
	}

	@Test
	public void testAdd() {
		final EnharmonicCoordinate start = EnharmonicCoordinate.fromHarmonicCoordinate(3, 1);
		assertEquals(EnharmonicCoordinate.fromHarmonicCoordinate(5, 0), start.add(2, -1));
		assertEquals(EnharmonicCoordinate.fromHarmonicCoordinate(-1, 3), start.add(-4, 2));
		assertEquals(start, start.add(0, 0));
	}

	@Test
	public void testBlocks() {
		final EnharmonicCoordinate coordinate = EnharmonicCoordinate.fromHarmonicCoordinate(4, 0);
		assertEquals(0, coordinate.getX());
		assertEquals(1, coordinate.getBlockX());
		// Points four fifths apart are enharmonically different.
		assertNotEquals(EnharmonicCoordinate.ORIGIN, coordinate);
	}

	@Test
	public void testToString() {
		assertEquals("<5,-2>", EnharmonicCoordinate.fromHarmonicCoordinate(5, -2).toString());
		assertEquals("<0,0>", EnharmonicCoordinate.ORIGIN.toString());
	}
}
