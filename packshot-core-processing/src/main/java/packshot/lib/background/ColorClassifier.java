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

package packshot.lib.background;

import java.awt.image.BufferedImage;
import java.util.Arrays;

import packshot.lib.awt.common.BufferedImageTools;
import packshot.lib.common.ColorTools;

/**
 * Per-pixel and perimeter tests for background-like colors.
 * <p>
 * Pixels are compared with a reference color (normally white) channel by channel.
 * Any transparency is first composited over white, so that fully transparent pixels
 * count as white background.
 *
 * @author PackShot developers
 */
public final class ColorClassifier {

	/**
	 * The conventional background reference color.
	 */
	public static final int WHITE = ColorTools.WHITE;

	/**
	 * Maximum possible summed deviation of a pixel from a reference color (3 channels x 255).
	 */
	public static final int MAX_SUM_DEVIATION = 765;

	// Suppressed default constructor for non-instantiability
	private ColorClassifier() {
		throw new AssertionError();
	}

	/**
	 * Get the distance of a pixel from a reference color, defined as the largest absolute
	 * difference of any single channel.
	 * @param argb packed ARGB pixel
	 * @param reference packed RGB reference color
	 * @return distance in the range 0-255
	 */
	public static int distance(int argb, int reference) {
		int rgb = ColorTools.compositeOver(argb, WHITE);
		int dr = Math.abs(ColorTools.red(rgb) - ColorTools.red(reference));
		int dg = Math.abs(ColorTools.green(rgb) - ColorTools.green(reference));
		int db = Math.abs(ColorTools.blue(rgb) - ColorTools.blue(reference));
		return Math.max(dr, Math.max(dg, db));
	}

	/**
	 * Test whether a pixel is background, i.e. every channel differs from the reference by at most the tolerance.
	 * @param argb packed ARGB pixel
	 * @param reference packed RGB reference color
	 * @param tolerance per-channel tolerance (0-255)
	 * @return
	 */
	public static boolean isBackground(int argb, int reference, int tolerance) {
		return distance(argb, reference) <= tolerance;
	}

	/**
	 * Get a smooth background confidence for a pixel.
	 * This is {@code clamp((tolerance - distance) / tolerance, 0, 1)}; with a tolerance of zero
	 * only an exact match has a confidence of 1.
	 * @param argb packed ARGB pixel
	 * @param reference packed RGB reference color
	 * @param tolerance per-channel tolerance (0-255)
	 * @return confidence in the range 0-1
	 */
	public static float confidence(int argb, int reference, int tolerance) {
		int d = distance(argb, reference);
		if (tolerance <= 0)
			return d == 0 ? 1f : 0f;
		float c = (tolerance - d) / (float)tolerance;
		return c < 0f ? 0f : (c > 1f ? 1f : c);
	}

	/**
	 * Test whether the outer ring of pixels is close to white, using a summed deviation.
	 * <p>
	 * For each border pixel the deviation is {@code (255-r) + (255-g) + (255-b)}; the perimeter is
	 * white if no border pixel exceeds {@code sumThreshold}.
	 * <p>
	 * The threshold applies to each pixel on its own, not to a total over the whole border:
	 * a long border of slightly grey pixels passes even though their deviations add up to far more
	 * than {@code sumThreshold}.
	 * @param img
	 * @param sumThreshold threshold in the range 0-765
	 * @return
	 */
	public static boolean perimeterWhiteness(BufferedImage img, int sumThreshold) {
		int w = img.getWidth();
		int h = img.getHeight();
		int[] pixels = BufferedImageTools.getPixels(img);
		for (int i : perimeterIndices(w, h, 1)) {
			if (sumDeviation(pixels[i]) > sumThreshold)
				return false;
		}
		return true;
	}

	/**
	 * Test whether every channel of every pixel within a margin of the image border is at least {@code 255 - tolerance}.
	 * @param img
	 * @param tolerance per-channel tolerance (0-255)
	 * @param margin number of rows and columns to check on each side; clipped to the image size
	 * @return
	 */
	public static boolean isPerimeterWhite(BufferedImage img, int tolerance, int margin) {
		int w = img.getWidth();
		int h = img.getHeight();
		int[] pixels = BufferedImageTools.getPixels(img);
		for (int i : perimeterIndices(w, h, margin)) {
			if (!isBackground(pixels[i], WHITE, tolerance))
				return false;
		}
		return true;
	}

	/**
	 * Find the darkest pixel on the 1-pixel border of an image, i.e. the one with the smallest sum of red, green and blue.
	 * @param img
	 * @return packed RGB value of the darkest border pixel, after compositing over white
	 */
	public static int darkestPerimeterPixel(BufferedImage img) {
		int[] pixels = BufferedImageTools.getPixels(img);
		int darkest = WHITE;
		int minSum = Integer.MAX_VALUE;
		for (int i : perimeterIndices(img.getWidth(), img.getHeight(), 1)) {
			int rgb = ColorTools.compositeOver(pixels[i], WHITE);
			int sum = ColorTools.red(rgb) + ColorTools.green(rgb) + ColorTools.blue(rgb);
			if (sum < minSum) {
				minSum = sum;
				darkest = rgb;
			}
		}
		return darkest;
	}

	/**
	 * Get the summed deviation of a pixel from white.
	 * @param argb
	 * @return value in the range 0-765
	 */
	public static int sumDeviation(int argb) {
		int rgb = ColorTools.compositeOver(argb, WHITE);
		return MAX_SUM_DEVIATION - ColorTools.red(rgb) - ColorTools.green(rgb) - ColorTools.blue(rgb);
	}

	/**
	 * Get the row-major indices of all pixels within a margin of the border, each listed once.
	 */
	static int[] perimeterIndices(int width, int height, int margin) {
		int m = Math.max(1, margin);
		int mx = Math.min(m, (width + 1) / 2);
		int my = Math.min(m, (height + 1) / 2);
		int count = 0;
		int[] indices = new int[width * height];
		for (int y = 0; y < height; y++) {
			boolean rowInMargin = y < my || y >= height - my;
			for (int x = 0; x < width; x++) {
				if (rowInMargin || x < mx || x >= width - mx)
					indices[count++] = y * width + x;
			}
		}
		return Arrays.copyOf(indices, count);
	}

}
