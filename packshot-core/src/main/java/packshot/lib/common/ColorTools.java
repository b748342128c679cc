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

package packshot.lib.common;

import java.awt.Color;

/**
 * Static functions to help work with RGB(A) colors using packed ints.
 *
 * @author PackShot developers
 *
 */
public final class ColorTools {

	// Suppressed default constructor for non-instantiability
	private ColorTools() {
		throw new AssertionError();
	}

	/**
	 * Packed int representing opaque white.
	 */
	public static final int WHITE = packRGB(255, 255, 255);

	/**
	 * Packed int representing opaque black.
	 */
	public static final int BLACK = packRGB(0, 0, 0);

	/**
	 * Packed int representing a fully transparent pixel.
	 */
	public static final int TRANSPARENT = 0;

	/**
	 * Mask for use when extracting the alpha component from a packed ARGB int value.
	 */
	public static final int MASK_ALPHA = 0xff000000;

	/**
	 * Mask for use when extracting the red component from a packed (A)RGB int value.
	 */
	public static final int MASK_RED = 0xff0000;

	/**
	 * Mask for use when extracting the green component from a packed (A)RGB int value.
	 */
	public static final int MASK_GREEN = 0xff00;

	/**
	 * Mask for use when extracting the blue component from a packed (A)RGB int value.
	 */
	public static final int MASK_BLUE = 0xff;

	/**
	 * Make a packed RGB value from specified input values.
	 * This is equivalent to an ARGB value with alpha set to 255, following Java {@link Color}.
	 * <p>
	 * Input r, g, and b should be in the range 0-255; only the lower 8 bits are used.
	 *
	 * @param r
	 * @param g
	 * @param b
	 * @return packed ARGB value
	 * @see #packClippedRGB(int, int, int)
	 */
	public static int packRGB(int r, int g, int b) {
		return packARGB(255, r, g, b);
	}

	/**
	 * Make a packed RGB value from specified input values, clipping to the range 0-255.
	 *
	 * @param r
	 * @param g
	 * @param b
	 * @return packed ARGB value
	 */
	public static int packClippedRGB(int r, int g, int b) {
		return packRGB(
				do8BitRangeCheck(r),
				do8BitRangeCheck(g),
				do8BitRangeCheck(b)
				);
	}

	/**
	 * Make a packed ARGB value from specified input values.
	 * <p>
	 * Input a, r, g, and b should be in the range 0-255; only the lower 8 bits are used.
	 *
	 * @param a
	 * @param r
	 * @param g
	 * @param b
	 * @return packed ARGB value
	 * @see #packClippedARGB(int, int, int, int)
	 */
	public static int packARGB(int a, int r, int g, int b) {
		return ((a & 0xff)<<24) +
			   ((r & 0xff)<<16) +
			   ((g & 0xff)<<8) +
			    (b & 0xff);
	}

	/**
	 * Make a packed ARGB value from specified input values, clipping to the range 0-255.
	 *
	 * @param a
	 * @param r
	 * @param g
	 * @param b
	 * @return packed ARGB value
	 */
	public static int packClippedARGB(int a, int r, int g, int b) {
		return packARGB(
				do8BitRangeCheck(a),
				do8BitRangeCheck(r),
				do8BitRangeCheck(g),
				do8BitRangeCheck(b)
				);
	}

	/**
	 * Pack an RGB triple given as an array of length 3, as used in settings files.
	 * @param rgb
	 * @return packed opaque ARGB value
	 * @throws IllegalArgumentException if the array does not have length 3
	 */
	public static int packRGB(int[] rgb) {
		if (rgb == null || rgb.length != 3)
			throw new IllegalArgumentException("RGB color must have exactly 3 values!");
		return packClippedRGB(rgb[0], rgb[1], rgb[2]);
	}

	/**
	 * Get the alpha value from a packed ARGB int.
	 * @param argb
	 * @return the alpha value, in the range 0-255
	 */
	public static int alpha(int argb) {
		return (argb >>> 24) & 0xff;
	}

	/**
	 * Get the red value from a packed (A)RGB int.
	 * @param rgb
	 * @return the red value, in the range 0-255
	 */
	public static int red(int rgb) {
		return (rgb & MASK_RED) >> 16;
	}

	/**
	 * Get the green value from a packed (A)RGB int.
	 * @param rgb
	 * @return the green value, in the range 0-255
	 */
	public static int green(int rgb) {
		return (rgb & MASK_GREEN) >> 8;
	}

	/**
	 * Get the blue value from a packed (A)RGB int.
	 * @param rgb
	 * @return the blue value, in the range 0-255
	 */
	public static int blue(int rgb) {
		return rgb & MASK_BLUE;
	}

	/**
	 * Replace the alpha of a packed ARGB value.
	 * @param argb
	 * @param alpha new alpha, clipped to 0-255
	 * @return
	 */
	public static int withAlpha(int argb, int alpha) {
		return (argb & 0x00ffffff) | (do8BitRangeCheck(alpha) << 24);
	}

	/**
	 * Composite a (possibly translucent) ARGB value over an opaque background color.
	 * @param argb the foreground value
	 * @param background the background, alpha is ignored
	 * @return an opaque packed RGB value
	 */
	public static int compositeOver(int argb, int background) {
		int a = alpha(argb);
		if (a == 255)
			return argb;
		if (a == 0)
			return background | MASK_ALPHA;
		double f = a / 255.0;
		return packClippedRGB(
				(int)Math.round(red(argb) * f + red(background) * (1 - f)),
				(int)Math.round(green(argb) * f + green(background) * (1 - f)),
				(int)Math.round(blue(argb) * f + blue(background) * (1 - f))
				);
	}

	/**
	 * Clip an input value to be an integer in the range 0-255 (inclusive).
	 * @param v
	 * @return
	 */
	public static int do8BitRangeCheck(int v) {
		return v < 0 ? 0 : (v > 255 ? 255 : v);
	}

	/**
	 * Clip an input value to be an integer in the range 0-255 (inclusive), rounding to the nearest integer.
	 * @param v
	 * @return
	 */
	public static int do8BitRangeCheck(double v) {
		return v < 0 ? 0 : (v > 255 ? 255 : (int)Math.round(v));
	}

}
