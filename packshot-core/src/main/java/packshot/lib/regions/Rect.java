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
 * An axis-aligned integer rectangle, used for crop windows, pad targets and collage cells.
 * <p>
 * Coordinates are given in pixels relative to a parent canvas.
 * Width and height are never negative; x and y may be negative only where a rectangle
 * deliberately extends beyond its parent (e.g. padding with expansion allowed).
 *
 * @author PackShot developers
 *
 */
public class Rect {

	private final int x;
	private final int y;
	private final int width;
	private final int height;

	@Override
	public String toString() {
		return "Rect: x=" + x + ", y=" + y + ", w=" + width + ", h=" + height;
	}

	private Rect(final int x, final int y, final int width, final int height) {
		this.x = x;
		this.y = y;
		this.width = width;
		this.height = height;
	}

	/**
	 * Create a rectangle based on its bounding box coordinates.
	 * @param x
	 * @param y
	 * @param width
	 * @param height
	 * @return
	 */
	public static Rect createInstance(final int x, final int y, final int width, final int height) {
		if (width < 0)
			throw new IllegalArgumentException("Width must be >= 0! Requested width = " + width);
		if (height < 0)
			throw new IllegalArgumentException("Height must be >= 0! Requested height = " + height);
		return new Rect(x, y, width, height);
	}

	/**
	 * Create a rectangle at the origin.
	 * @param width
	 * @param height
	 * @return
	 */
	public static Rect createInstance(final int width, final int height) {
		return createInstance(0, 0, width, height);
	}

	/**
	 * Create a rectangle from its inclusive minimum and exclusive maximum coordinates.
	 * @param x1
	 * @param y1
	 * @param x2
	 * @param y2
	 * @return
	 */
	public static Rect fromBounds(final int x1, final int y1, final int x2, final int y2) {
		return createInstance(x1, y1, x2 - x1, y2 - y1);
	}

	/**
	 * Returns true if this rectangle overlaps with another.
	 * Rectangles that only share an edge do not overlap.
	 * @param rect
	 * @return
	 */
	public boolean intersects(final Rect rect) {
		return intersects(rect.x, rect.y, rect.width, rect.height);
	}

	/**
	 * Query if this rectangle intersects with a specified bounding box.
	 * @param x2
	 * @param y2
	 * @param w2
	 * @param h2
	 * @return
	 */
	public boolean intersects(final int x2, final int y2, final int w2, final int h2) {
		if (w2 <= 0 || h2 <= 0 || isEmpty())
			return false;
		return (x2 + w2 > x &&
				y2 + h2 > y &&
				x2 < x + width &&
				y2 < y + height);
	}

	/**
	 * Returns true if another rectangle lies entirely within this one.
	 * @param rect
	 * @return
	 */
	public boolean contains(final Rect rect) {
		return rect.x >= x && rect.y >= y &&
				rect.getMaxX() <= getMaxX() && rect.getMaxY() <= getMaxY();
	}

	/**
	 * Returns true if the pixel with the specified coordinates lies within this rectangle.
	 * @param px
	 * @param py
	 * @return
	 */
	public boolean contains(final int px, final int py) {
		return px >= x && py >= y && px < x + width && py < y + height;
	}

	/**
	 * Get the intersection of this rectangle with another.
	 * @param rect
	 * @return the intersection, which has zero width and height if the rectangles do not overlap
	 */
	public Rect intersection(final Rect rect) {
		int x1 = Math.max(x, rect.x);
		int y1 = Math.max(y, rect.y);
		int x2 = Math.min(getMaxX(), rect.getMaxX());
		int y2 = Math.min(getMaxY(), rect.getMaxY());
		if (x2 <= x1 || y2 <= y1)
			return new Rect(x1, y1, 0, 0);
		return new Rect(x1, y1, x2 - x1, y2 - y1);
	}

	/**
	 * Get a rectangle expanded by the specified padding, which may be larger than any parent canvas.
	 * @param padding
	 * @return
	 */
	public Rect pad(final Padding padding) {
		if (padding.isEmpty())
			return this;
		return createInstance(x - padding.getX1(), y - padding.getY1(), width + padding.getXSum(), height + padding.getYSum());
	}

	/**
	 * Get a rectangle shrunk by the specified padding.
	 * @param padding
	 * @return
	 * @throws IllegalArgumentException if the padding exceeds the size of the rectangle
	 */
	public Rect inset(final Padding padding) {
		if (padding.isEmpty())
			return this;
		return createInstance(x + padding.getX1(), y + padding.getY1(), width - padding.getXSum(), height - padding.getYSum());
	}

	/**
	 * Get a copy of this rectangle translated by the specified amounts.
	 * @param dx
	 * @param dy
	 * @return
	 */
	public Rect translate(final int dx, final int dy) {
		return new Rect(x + dx, y + dy, width, height);
	}

	/**
	 * Get the x coordinate of the top left of the rectangle.
	 * @return
	 */
	public int getX() {
		return x;
	}

	/**
	 * Get the y coordinate of the top left of the rectangle.
	 * @return
	 */
	public int getY() {
		return y;
	}

	/**
	 * Get the rectangle width.
	 * @return
	 */
	public int getWidth() {
		return width;
	}

	/**
	 * Get the rectangle height.
	 * @return
	 */
	public int getHeight() {
		return height;
	}

	/**
	 * Get the x coordinate of the right of the rectangle (exclusive).
	 * @return
	 */
	public int getMaxX() {
		return x + width;
	}

	/**
	 * Get the y coordinate of the bottom of the rectangle (exclusive).
	 * @return
	 */
	public int getMaxY() {
		return y + height;
	}

	/**
	 * Get the number of pixels covered by the rectangle.
	 * @return
	 */
	public long getArea() {
		return (long)width * height;
	}

	/**
	 * Returns true if the width or height is zero.
	 * @return
	 */
	public boolean isEmpty() {
		return width == 0 || height == 0;
	}

	@Override
	public int hashCode() {
		final int prime = 31;
		int result = 1;
		result = prime * result + height;
		result = prime * result + width;
		result = prime * result + x;
		result = prime * result + y;
		return result;
	}

	@Override
	public boolean equals(Object obj) {
		if (this == obj)
			return true;
		if (!(obj instanceof Rect))
			return false;
		Rect other = (Rect) obj;
		return x == other.x && y == other.y && width == other.width && height == other.height;
	}

}
