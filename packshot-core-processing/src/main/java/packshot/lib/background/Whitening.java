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

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import packshot.lib.awt.common.BufferedImageTools;
import packshot.lib.common.ColorTools;

/**
 * Brighten an off-white background to white by per-channel scaling.
 * <p>
 * The darkest pixel on the image border is used as the reference: each channel is multiplied by
 * {@code 255 / reference}, so that the reference becomes white and lighter pixels saturate.
 *
 * @author PackShot developers
 */
public final class Whitening {

	private static final Logger logger = LoggerFactory.getLogger(Whitening.class);

	// Suppressed default constructor for non-instantiability
	private Whitening() {
		throw new AssertionError();
	}

	/**
	 * Returns true if whitening should be applied, i.e. the r+g+b sum of the darkest border pixel
	 * is strictly greater than the cancel threshold.
	 * A threshold of 765 therefore never whitens, and a threshold of 0 whitens unless the border contains black.
	 * @param img
	 * @param cancelThreshold summed brightness threshold, 0-765
	 * @return
	 */
	public static boolean shouldApply(BufferedImage img, int cancelThreshold) {
		return isBrighterThan(ColorClassifier.darkestPerimeterPixel(img), cancelThreshold);
	}

	private static boolean isBrighterThan(int rgb, int cancelThreshold) {
		return ColorTools.red(rgb) + ColorTools.green(rgb) + ColorTools.blue(rgb) > cancelThreshold;
	}

	/**
	 * Apply whitening if the darkest border pixel is brighter than the cancel threshold.
	 * @param img
	 * @param cancelThreshold summed brightness threshold, 0-765
	 * @return a new whitened image, or the input if whitening is not applied
	 */
	public static BufferedImage apply(BufferedImage img, int cancelThreshold) {
		if (img.getWidth() <= 1 || img.getHeight() <= 1) {
			logger.debug("Image too small for whitening: {}x{}", img.getWidth(), img.getHeight());
			return img;
		}
		int darkest = ColorClassifier.darkestPerimeterPixel(img);
		if (!isBrighterThan(darkest, cancelThreshold)) {
			logger.debug("Whitening cancelled: darkest border pixel ({}, {}, {}) is not brighter than threshold {}",
					ColorTools.red(darkest), ColorTools.green(darkest), ColorTools.blue(darkest), cancelThreshold);
			return img;
		}
		return whiten(img, darkest);
	}

	/**
	 * Scale each channel so that the reference color becomes white.
	 * @param img
	 * @param reference packed RGB reference color
	 * @return a new {@code TYPE_INT_ARGB} image
	 */
	public static BufferedImage whiten(BufferedImage img, int reference) {
		int[] lutR = createLut(ColorTools.red(reference));
		int[] lutG = createLut(ColorTools.green(reference));
		int[] lutB = createLut(ColorTools.blue(reference));
		logger.trace("Whitening with reference ({}, {}, {})", ColorTools.red(reference), ColorTools.green(reference), ColorTools.blue(reference));
		int[] pixels = BufferedImageTools.getPixels(img);
		for (int i = 0; i < pixels.length; i++) {
			int v = pixels[i];
			pixels[i] = ColorTools.packARGB(
					ColorTools.alpha(v),
					lutR[ColorTools.red(v)],
					lutG[ColorTools.green(v)],
					lutB[ColorTools.blue(v)]);
		}
		return BufferedImageTools.createArgb(pixels, img.getWidth(), img.getHeight());
	}

	static int[] createLut(int reference) {
		double scale = 255.0 / Math.max(1, reference);
		int[] lut = new int[256];
		for (int i = 0; i < 256; i++)
			lut[i] = ColorTools.do8BitRangeCheck(i * scale);
		return lut;
	}

}
