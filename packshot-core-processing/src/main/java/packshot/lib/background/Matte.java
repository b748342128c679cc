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

import packshot.lib.analysis.images.SimpleImage;
import packshot.lib.analysis.images.SimpleImages;
import packshot.lib.analysis.images.SimpleModifiableImage;

/**
 * A per-pixel background confidence map, with values in the range 0-1.
 * <p>
 * A value of 1 means the pixel is certainly background, 0 that it is certainly part of the subject.
 * A matte always has the same dimensions as the image from which it was computed.
 * Instances are immutable.
 *
 * @author PackShot developers
 */
public class Matte implements SimpleImage {

	/**
	 * Confidence at or above which a pixel is treated as background.
	 */
	public static final float BACKGROUND_THRESHOLD = 0.5f;

	/**
	 * Summary of the matte contents.
	 * Anything other than {@link #NORMAL} is a degenerate result that callers should report.
	 */
	public enum Status {
		/**
		 * The matte contains both background and foreground pixels.
		 */
		NORMAL,
		/**
		 * Every pixel is background; the image has no extractable subject.
		 */
		ALL_BACKGROUND,
		/**
		 * No pixel is background.
		 */
		ALL_FOREGROUND;
	}

	private final SimpleModifiableImage values;
	private final Status status;

	Matte(SimpleModifiableImage values) {
		this.values = values;
		long nBackground = SimpleImages.countAbove(values, BACKGROUND_THRESHOLD);
		long n = (long)values.getWidth() * values.getHeight();
		if (nBackground == n)
			status = Status.ALL_BACKGROUND;
		else if (nBackground == 0)
			status = Status.ALL_FOREGROUND;
		else
			status = Status.NORMAL;
	}

	/**
	 * Create a matte from an array of confidence values.
	 * The array is copied; values are clipped to the range 0-1.
	 * @param values row-major confidence values
	 * @param width
	 * @param height
	 * @return
	 */
	public static Matte create(float[] values, int width, int height) {
		float[] copy = values.clone();
		for (int i = 0; i < copy.length; i++)
			copy[i] = copy[i] < 0f ? 0f : (copy[i] > 1f ? 1f : copy[i]);
		return new Matte(SimpleImages.createFloatImage(copy, width, height));
	}

	@Override
	public float getValue(int x, int y) {
		return values.getValue(x, y);
	}

	@Override
	public int getWidth() {
		return values.getWidth();
	}

	@Override
	public int getHeight() {
		return values.getHeight();
	}

	/**
	 * Returns true if the confidence at a pixel is at least {@link #BACKGROUND_THRESHOLD}.
	 * @param x
	 * @param y
	 * @return
	 */
	public boolean isBackground(int x, int y) {
		return values.getValue(x, y) >= BACKGROUND_THRESHOLD;
	}

	/**
	 * Get the status of the matte.
	 * @return
	 */
	public Status getStatus() {
		return status;
	}

	/**
	 * Returns true if the matte is entirely background or entirely foreground.
	 * @return
	 */
	public boolean isDegenerate() {
		return status != Status.NORMAL;
	}

	/**
	 * Count the number of background pixels.
	 * @return
	 */
	public long countBackground() {
		return SimpleImages.countAbove(values, BACKGROUND_THRESHOLD);
	}

	/**
	 * Get a copy of the confidence values, in row-major order.
	 * @return
	 */
	public float[] toArray() {
		return values.getArray(false);
	}

	@Override
	public String toString() {
		return "Matte (" + getWidth() + "x" + getHeight() + ", " + status + ")";
	}

}
