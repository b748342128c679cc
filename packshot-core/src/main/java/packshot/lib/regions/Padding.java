/*-
 * #%L
 * This file is part of PackShot.
 * %%
 * Copyright (C) 2024 PackShot developers
 * %%
 * PackShot is free software: you can redistribute it and/or modify
 * it under the terms of the GNU General Public License as
 * published by the Free Software Foundation, either version 3 of the
 * License, or (at your option) any later version.
 * 
 * PackShot is distributed in the hope that it will be useful,
 * but WITHOUT ANY WARRANTY; without even the implied warranty of
 * MERCHANTABILITY or FITNESS FOR A PARTICULAR PURPOSE.  See the
 * GNU General Public License for more details.
 * 
 * You should have received a copy of the GNU General Public License 
 * along with PackShot.  If not, see <https://www.gnu.org/licenses/>.
 * #L%
 */

package packshot.lib.regions;

/**
 * Padding or margins around a 2D rectangle, in pixels.
 * <p>
 * This is used both for padding added around a crop window and for the margins left between
 * a crop window and the edges of the source image.
 *
 * @author PackShot developers
 */
public class Padding {

	private final int x1, x2, y1, y2;

	/**
	 * Get the padding to the left, in pixels.
	 * @return
	 */
	public int getX1() {
		return x1;
	}

	/**
	 * Get the padding to the right, in pixels.
	 * @return
	 */
	public int getX2() {
		return x2;
	}

	/**
	 * Get the total horizontal padding (sum of x1 and x2).
	 * @return
	 */
	public int getXSum() {
		return x1 + x2;
	}

	/**
	 * Get the padding above, in pixels.
	 * @return
	 */
	public int getY1() {
		return y1;
	}

	/**
	 * Get the padding below, in pixels.
	 * @return
	 */
	public int getY2() {
		return y2;
	}

	/**
	 * Get the total vertical padding (sum of y1 and y2).
	 * @return
	 */
	public int getYSum() {
		return y1 + y2;
	}

	@Override
	public String toString() {
		return String.format(
				"Padding (x=[%d, %d], y=[%d, %d])",
				x1, x2, y1, y2
				);
	}

	/**
	 * Returns true if the padding is identical on all sides (x1 == x2 == y1 == y2).
	 * @return
	 */
	public boolean isSymmetric() {
		return isSymmetricX() && isSymmetricY() && x1 == y1;
	}

	/**
	 * Returns true if the left and right padding are equal.
	 * @return
	 */
	public boolean isSymmetricX() {
		return x1 == x2;
	}

	/**
	 * Returns true if the top and bottom padding are equal.
	 * @return
	 */
	public boolean isSymmetricY() {
		return y1 == y2;
	}

	/**
	 * Returns true if the padding is zero.
	 * @return
	 */
	public boolean isEmpty() {
		return x1 == 0 && isSymmetric();
	}

	/**
	 * Add this padding to another. This padding is unchanged.
	 * @param padding
	 * @return a {@link Padding} where the padding on all sides is the sum of the corresponding padding of both objects.
	 */
	public Padding add(Padding padding) {
		if (isEmpty())
			return padding;
		else if (padding.isEmpty())
			return this;
		return getPadding(
				x1 + padding.x1,
				x2 + padding.x2,
				y1 + padding.y1,
				y2 + padding.y2
				);
	}

	/**
	 * Compare two paddings, and take the smaller padding value on all sides.
	 * @param padding
	 * @return
	 */
	public Padding min(Padding padding) {
		return getPadding(
				Math.min(x1, padding.x1),
				Math.min(x2, padding.x2),
				Math.min(y1, padding.y1),
				Math.min(y2, padding.y2)
				);
	}

	private Padding(int x1, int x2, int y1, int y2) {
		this.x1 = x1;
		this.x2 = x2;
		this.y1 = y1;
		this.y2 = y2;
		if (x1 < 0 || x2 < 0 || y1 < 0 || y2 < 0)
			throw new IllegalArgumentException("Padding must be >= 0! Requested " + toString());
	}

	private static Padding[] symmetric = new Padding[64];

	static {
		for (int i = 0; i < symmetric.length; i++)
			symmetric[i] = new Padding(i, i, i, i);
	}

	/**
	 * Get a padding object with 'pad' pixels on all sides.
	 * @param pad the padding for x1, x2, y1 and y2
	 * @return
	 */
	public static Padding symmetric(int pad) {
		if (pad >= 0 && pad < symmetric.length)
			return symmetric[pad];
		return new Padding(pad, pad, pad, pad);
	}

	/**
	 * Get a padding object 'x' pixels to the left and right, and 'y' pixels above and below.
	 * @param x the padding for x1 and x2
	 * @param y the padding for y1 and y2
	 * @return
	 */
	public static Padding getPadding(int x, int y) {
		return getPadding(x, x, y, y);
	}

	/**
	 * Get an empty padding object (0 on all sides).
	 * @return
	 */
	public static Padding empty() {
		return symmetric[0];
	}

	/**
	 * Get a padding object that may have different padding on each side.
	 * @param x1
	 * @param x2
	 * @param y1
	 * @param y2
	 * @return
	 */
	public static Padding getPadding(int x1, int x2, int y1, int y2) {
		if (x1 == x2 && x1 == y1 && x1 == y2)
			return symmetric(x1);
		return new Padding(x1, x2, y1, y2);
	}

	/**
	 * Get the margins between an outer rectangle and an inner rectangle that it contains.
	 * @param outer
	 * @param inner
	 * @return
	 * @throws IllegalArgumentException if the inner rectangle is not contained in the outer rectangle
	 */
	public static Padding between(Rect outer, Rect inner) {
		if (!outer.contains(inner))
			throw new IllegalArgumentException(inner + " is not contained in " + outer);
		return getPadding(
				inner.getX() - outer.getX(),
				outer.getMaxX() - inner.getMaxX(),
				inner.getY() - outer.getY(),
				outer.getMaxY() - inner.getMaxY()
				);
	}

}
