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

import ij.plugin.filter.RankFilters;
import ij.process.FloatProcessor;

import packshot.lib.analysis.images.SimpleImages;

/**
 * Filters applied to background confidence values, stored as row-major float arrays.
 * <p>
 * Filtering is delegated to ImageJ. Input arrays are never modified.
 *
 * @author PackShot developers
 */
public final class MatteFilters {

	/**
	 * Maximum supported halo reduction level.
	 */
	public static final int MAX_HALO_LEVEL = 5;

	// Suppressed default constructor for non-instantiability
	private MatteFilters() {
		throw new AssertionError();
	}

	/**
	 * Apply halo reduction to a matte.
	 * <p>
	 * The background is eroded with a minimum filter of radius {@code level}, and the result smoothed with a
	 * Gaussian filter with sigma {@code 0.5*level}. A level of 0 returns the input unchanged.
	 * @param matte
	 * @param level halo reduction level, 0-5
	 * @return
	 */
	public static Matte reduceHalo(Matte matte, int level) {
		if (level < 0 || level > MAX_HALO_LEVEL)
			throw new IllegalArgumentException("Halo reduction level must be between 0 and " + MAX_HALO_LEVEL + "! Requested level = " + level);
		if (level == 0)
			return matte;
		int w = matte.getWidth();
		int h = matte.getHeight();
		var fp = new FloatProcessor(w, h, matte.toArray());
		fp = minimum(fp, level);
		fp = gaussian(fp, 0.5 * level);
		float[] values = (float[])fp.getPixels();
		for (int i = 0; i < values.length; i++)
			values[i] = clip(values[i]);
		return new Matte(SimpleImages.createFloatImage(values, w, h));
	}

	/**
	 * Grey-level erosion using ImageJ's circular minimum filter.
	 * A radius of 1 covers the full 3x3 neighborhood.
	 * @param values
	 * @param width
	 * @param height
	 * @param radius filter radius, in pixels
	 * @return a new array
	 */
	public static float[] erodeMin(float[] values, int width, int height, double radius) {
		var fp = new FloatProcessor(width, height, values.clone());
		return (float[])minimum(fp, radius).getPixels();
	}

	/**
	 * Gaussian smoothing with ImageJ, with the result clipped to the range 0-1.
	 * @param values
	 * @param width
	 * @param height
	 * @param sigma
	 * @return a new array
	 */
	public static float[] gaussianFeather(float[] values, int width, int height, double sigma) {
		var fp = new FloatProcessor(width, height, values.clone());
		float[] output = (float[])gaussian(fp, sigma).getPixels();
		for (int i = 0; i < output.length; i++)
			output[i] = clip(output[i]);
		return output;
	}

	private static FloatProcessor minimum(FloatProcessor fp, double radius) {
		var fp2 = (FloatProcessor)fp.duplicate();
		if (radius > 0)
			new RankFilters().rank(fp2, radius, RankFilters.MIN);
		return fp2;
	}

	private static FloatProcessor gaussian(FloatProcessor fp, double sigma) {
		var fp2 = (FloatProcessor)fp.duplicate();
		if (sigma > 0)
			fp2.blurGaussian(sigma);
		return fp2;
	}

	private static float clip(float v) {
		return v < 0f ? 0f : (v > 1f ? 1f : v);
	}

}
