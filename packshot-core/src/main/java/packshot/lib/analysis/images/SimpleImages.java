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

package packshot.lib.analysis.images;

import java.util.Arrays;

/**
 * Create {@link SimpleImage SimpleImage} instances for basic pixel processing.
 * 
 * @author PackShot developers
 *
 */
public class SimpleImages {

	/**
	 * Get the pixel values for the image.
	 * @param image
	 * @param direct if true, return the direct pixel buffer if possible. The caller should <i>not</i> modify this.
	 * @return
	 */
	public static float[] getPixels(SimpleImage image, boolean direct) {
		if (image instanceof SimpleModifiableImage)
			return ((SimpleModifiableImage)image).getArray(direct);
		int n = image.getWidth() * image.getHeight();
		int w = image.getWidth();
		float[] pixels = new float[n];
		for (int i = 0; i < n; i++)
			pixels[i] = image.getValue(i % w, i / w);
		return pixels;
	}

	/**
	 * Create a {@link SimpleImage} backed by an existing float array of pixels.
	 * <p>
	 * Pixels are stored in row-major order.
	 * 
	 * @param data
	 * @param width
	 * @param height
	 * @return
	 */
	public static SimpleModifiableImage createFloatImage(float[] data, int width, int height) {
		if (data.length != width * height)
			throw new IllegalArgumentException("Pixel array length " + data.length + " does not match image size " + width + "x" + height);
		return new FloatArraySimpleImage(data, width, height);
	}

	/**
	 * Create a {@link SimpleImage} backed by a float array of pixels, all initialized to zero.
	 *
	 * @param width
	 * @param height
	 * @return
	 */
	public static SimpleModifiableImage createFloatImage(int width, int height) {
		return new FloatArraySimpleImage(new float[width * height], width, height);
	}

	/**
	 * Create a {@link SimpleImage} with every pixel set to the same value.
	 *
	 * @param width
	 * @param height
	 * @param value
	 * @return
	 */
	public static SimpleModifiableImage createFloatImage(int width, int height, float value) {
		float[] data = new float[width * height];
		Arrays.fill(data, value);
		return new FloatArraySimpleImage(data, width, height);
	}

	/**
	 * Create a modifiable copy of an image.
	 * @param image
	 * @return
	 */
	public static SimpleModifiableImage duplicate(SimpleImage image) {
		return new FloatArraySimpleImage(getPixels(image, false), image.getWidth(), image.getHeight());
	}

	/**
	 * Count the pixels with values &ge; a threshold.
	 * @param image
	 * @param threshold
	 * @return
	 */
	public static long countAbove(SimpleImage image, float threshold) {
		long count = 0;
		for (float v : getPixels(image, true)) {
			if (v >= threshold)
				count++;
		}
		return count;
	}

	/**
	 * Implementation of a SimpleImage backed by an array of floats.
	 * 
	 * @author PackShot developers
	 *
	 */
	static class FloatArraySimpleImage implements SimpleModifiableImage {

		private float[] data;
		private int width;
		private int height;

		FloatArraySimpleImage(float[] data, int width, int height) {
			this.data = data;
			this.width = width;
			this.height = height;
		}

		@Override
		public float getValue(int x, int y) {
			return data[y * width + x];
		}

		@Override
		public void setValue(int x, int y, float val) {
			data[y * width + x] = val;
		}

		@Override
		public int getWidth() {
			return width;
		}

		@Override
		public int getHeight() {
			return height;
		}

		@Override
		public float[] getArray(boolean direct) {
			if (direct)
				return data;
			return data.clone();
		}

	}

}
