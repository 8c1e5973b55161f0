package edu.uw.chordccg.semantics;

import java.io.Serializable;
import java.util.Objects;

/**
 * A point in the tonal space. (x, y) locates the point inside a 4x3 enharmonic block and (blockX, blockY) locates the
 * block in the infinite space.
 */
public final class EnharmonicCoordinate implements Serializable {
	private static final long serialVersionUID = 1L;

	public static final EnharmonicCoordinate ORIGIN = new EnharmonicCoordinate(0, 0, 0, 0);

	private final int x;
	private final int y;
	private final int blockX;
	private final int blockY;

	public EnharmonicCoordinate(final int x, final int y, final int blockX, final int blockY) {
		this.x = Math.floorMod(x, 4);
		this.y = Math.floorMod(y, 3);
		this.blockX = blockX;
		this.blockY = blockY;
	}

	public static EnharmonicCoordinate fromHarmonicCoordinate(final int x, final int y) {
		return ORIGIN.add(x, y);
	}

	/**
	 * Moves this point by a 2D harmonic vector. Moving by 4 in x shifts the block by one and the y offset inside it by
	 * one.
	 */
	public EnharmonicCoordinate add(final int dx, final int dy) {
		final int absX = x + dx;
		final int absY = y + dy;
		final int blockShiftX = Math.floorDiv(absX, 4);
		final int blockShiftY = Math.floorDiv(absY + blockShiftX, 3);
		return new EnharmonicCoordinate(absX, absY + blockShiftX, blockX + blockShiftX, blockY + blockShiftY);
	}

	public int getX() {
		return x;
	}

	public int getY() {
		return y;
	}

	public int getBlockX() {
		return blockX;
	}

	public int getBlockY() {
		return blockY;
	}

	public int getHarmonicX() {
		return 4 * blockX + x;
	}

	public int getHarmonicY() {
		return 3 * blockY - blockX + y;
	}

	@Override
	public boolean equals(final Object other) {
		if (!(other instanceof EnharmonicCoordinate)) {
			return false;
		}
		final EnharmonicCoordinate coordinate = (EnharmonicCoordinate) other;
		return x == coordinate.x && y == coordinate.y && blockX == coordinate.blockX && blockY == coordinate.blockY;
	}

	@Override
	public int hashCode() {
		return Objects.hash(x, y, blockX, blockY);
	}

	@Override
	public String toString() {
		return "<" + getHarmonicX() + "," + getHarmonicY() + ">";
	}
}
