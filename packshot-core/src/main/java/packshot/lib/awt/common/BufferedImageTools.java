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

package packshot.lib.awt.common;

import java.awt.AlphaComposite;
import java.awt.Graphics2D;
import java.awt.image.BufferedImage;
import java.util.Arrays;

import ij.process.FloatProcessor;
import ij.process.ImageProcessor;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import packshot.lib.common.ColorTools;
import packshot.lib.common.GeneralTools;
import packshot.lib.regions.Rect;

/**
 * Collection of static methods to help work with {@link BufferedImage BufferedImages}.
 * <p>
 * All pipeline stages work on {@code TYPE_INT_ARGB} images with non-premultiplied alpha.
 * Methods here never modify their input image, but always return a new one.
 *
 * @author PackShot developers
 */
public final class BufferedImageTools {

	private static final Logger logger = LoggerFactory.getLogger(BufferedImageTools.class);

	// Suppressed default constructor for non-instantiability
	private BufferedImageTools() {
		throw new AssertionError();
	}

	/**
	 * Create a new {@code TYPE_INT_ARGB} copy of an image, whatever its input type.
	 * @param img
	 * @return a new image that does not share any data with the input
	 */
	public static BufferedImage toArgb(final BufferedImage img) {
		int w = img.getWidth();
		int h = img.getHeight();
		BufferedImage img2 = new BufferedImage(w, h, BufferedImage.TYPE_INT_ARGB);
		if (img.getType() == BufferedImage.TYPE_INT_ARGB) {
			img2.getRaster().setDataElements(0, 0, w, h, img.getRaster().getDataElements(0, 0, w, h, null));
		} else {
			Graphics2D g2d = img2.createGraphics();
			g2d.setComposite(AlphaComposite.Src);
			g2d.drawImage(img, 0, 0, null);
			g2d.dispose();
		}
		return img2;
	}

	/**
	 * Create a new {@code TYPE_INT_ARGB} image filled with a single value.
	 * @param width
	 * @param height
	 * @param argb
	 * @return
	 */
	public static BufferedImage createArgb(final int width, final int height, final int argb) {
		if (width <= 0 || height <= 0)
			throw new IllegalArgumentException("Image dimensions must be > 0! Requested " + width + "x" + height);
		var img = new BufferedImage(width, height, BufferedImage.TYPE_INT_ARGB);
		if (argb != 0) {
			int[] pixels = new int[width * height];
			Arrays.fill(pixels, argb);
			setPixels(img, pixels);
		}
		return img;
	}

	/**
	 * Get all pixels of an image as packed ARGB values, in row-major order.
	 * @param img
	 * @return
	 */
	public static int[] getPixels(final BufferedImage img) {
		int w = img.getWidth();
		int h = img.getHeight();
		return img.getRGB(0, 0, w, h, null, 0, w);
	}

	/**
	 * Set all pixels of an image from packed ARGB values, in row-major order.
	 * @param img
	 * @param pixels
	 */
	public static void setPixels(final BufferedImage img, final int[] pixels) {
		int w = img.getWidth();
		int h = img.getHeight();
		img.setRGB(0, 0, w, h, pixels, 0, w);
	}

	/**
	 * Create a new image from packed ARGB values.
	 * @param pixels
	 * @param width
	 * @param height
	 * @return
	 */
	public static BufferedImage createArgb(final int[] pixels, final int width, final int height) {
		var img = new BufferedImage(width, height, BufferedImage.TYPE_INT_ARGB);
		setPixels(img, pixels);
		return img;
	}

	/**
	 * Extract a region of an image.
	 * The region may extend beyond the image bounds, in which case the outside area is set to a fill value.
	 * @param img
	 * @param rect the region to extract, in the coordinates of the input image
	 * @param fill packed ARGB value for any pixels outside the input image
	 * @return
	 */
	public static BufferedImage extract(final BufferedImage img, final Rect rect, final int fill) {
		if (rect.isEmpty())
			throw new IllegalArgumentException("Cannot extract an empty region: " + rect);
		var output = createArgb(rect.getWidth(), rect.getHeight(), fill);
		var overlap = rect.intersection(Rect.createInstance(img.getWidth(), img.getHeight()));
		if (!overlap.isEmpty()) {
			int[] pixels = img.getRGB(overlap.getX(), overlap.getY(), overlap.getWidth(), overlap.getHeight(), null, 0, overlap.getWidth());
			output.setRGB(overlap.getX() - rect.getX(), overlap.getY() - rect.getY(), overlap.getWidth(), overlap.getHeight(), pixels, 0, overlap.getWidth());
		}
		return output;
	}

	/**
	 * Composite an image onto an opaque background color, removing any transparency.
	 * @param img
	 * @param background packed RGB background, alpha is ignored
	 * @return an opaque {@code TYPE_INT_RGB} image
	 */
	public static BufferedImage flatten(final BufferedImage img, final int background) {
		int w = img.getWidth();
		int h = img.getHeight();
		int[] pixels = getPixels(img);
		for (int i = 0; i < pixels.length; i++)
			pixels[i] = ColorTools.compositeOver(pixels[i], background);
		var output = new BufferedImage(w, h, BufferedImage.TYPE_INT_RGB);
		output.setRGB(0, 0, w, h, pixels, 0, w);
		return output;
	}

	/**
	 * Resize the image to have the requested width/height.
	 * <p>
	 * Each channel is resized with ImageJ using bilinear interpolation, with area averaging whenever
	 * a dimension shrinks. Color channels are premultiplied by alpha while resizing,
	 * so that fully transparent pixels do not bleed their color.
	 *
	 * @param img input image to be resized
	 * @param finalWidth target output width
	 * @param finalHeight target output height
	 * @return a new resized {@code TYPE_INT_ARGB} image
	 */
	public static BufferedImage resize(final BufferedImage img, final int finalWidth, final int finalHeight) {
		if (finalWidth <= 0 || finalHeight <= 0)
			throw new IllegalArgumentException("Resized image dimensions must be > 0! Requested " + finalWidth + "x" + finalHeight);

		if (img.getWidth() == finalWidth && img.getHeight() == finalHeight)
			return toArgb(img);

		logger.trace("Resizing {} x {} -> {} x {}", img.getWidth(), img.getHeight(), finalWidth, finalHeight);

		double aspectRatio = (double)img.getWidth()/img.getHeight();
		double finalAspectRatio = (double)finalWidth/finalHeight;
		if (!GeneralTools.almostTheSame(aspectRatio, finalAspectRatio, 0.05))
			logger.debug("Substantial difference in aspect ratio for resized image: {}x{} -> {}x{}", img.getWidth(), img.getHeight(), finalWidth, finalHeight);

		int w = img.getWidth();
		int h = img.getHeight();
		int[] input = getPixels(img);
		int n = input.length;
		float[] alpha = new float[n];
		float[] red = new float[n];
		float[] green = new float[n];
		float[] blue = new float[n];
		for (int i = 0; i < n; i++) {
			int v = input[i];
			int a = ColorTools.alpha(v);
			float f = a / 255f;
			alpha[i] = a;
			red[i] = ColorTools.red(v) * f;
			green[i] = ColorTools.green(v) * f;
			blue[i] = ColorTools.blue(v) * f;
		}
		alpha = resize(alpha, w, h, finalWidth, finalHeight);
		red = resize(red, w, h, finalWidth, finalHeight);
		green = resize(green, w, h, finalWidth, finalHeight);
		blue = resize(blue, w, h, finalWidth, finalHeight);

		int[] output = new int[finalWidth * finalHeight];
		for (int i = 0; i < output.length; i++) {
			int a = Math.round(alpha[i]);
			if (a <= 0)
				continue;
			float f = 255f / alpha[i];
			output[i] = ColorTools.packClippedARGB(
					a,
					Math.round(red[i] * f),
					Math.round(green[i] * f),
					Math.round(blue[i] * f));
		}
		return createArgb(output, finalWidth, finalHeight);
	}

	/**
	 * Resize a single channel of float values with ImageJ.
	 * <p>
	 * Interpolation is bilinear; when a dimension shrinks, the values covered by each output pixel are averaged.
	 *
	 * @param values row-major channel values
	 * @param width width of the channel
	 * @param height height of the channel
	 * @param finalWidth target output width
	 * @param finalHeight target output height
	 * @return a new array of length {@code finalWidth * finalHeight}
	 */
	public static float[] resize(final float[] values, final int width, final int height, final int finalWidth, final int finalHeight) {
		if (finalWidth <= 0 || finalHeight <= 0)
			throw new IllegalArgumentException("Resized image dimensions must be > 0! Requested " + finalWidth + "x" + finalHeight);
		if (width == finalWidth && height == finalHeight)
			return values.clone();
		var fp = new FloatProcessor(width, height, values.clone());
		fp.setInterpolationMethod(ImageProcessor.BILINEAR);
		var fp2 = fp.resize(finalWidth, finalHeight, true);
		return (float[])fp2.getPixels();
	}

	/**
	 * Compute the largest size with the same aspect ratio as the input that fits within a bounding box.
	 * Sizes that already fit are returned unchanged; dimensions are rounded and never less than 1.
	 * @param width
	 * @param height
	 * @param maxWidth maximum width, or &le; 0 for no limit
	 * @param maxHeight maximum height, or &le; 0 for no limit
	 * @return an array of length 2 containing the width and height
	 */
	public static int[] fitWithin(final int width, final int height, final int maxWidth, final int maxHeight) {
		double scale = 1.0;
		if (maxWidth > 0 && width > maxWidth)
			scale = Math.min(scale, (double)maxWidth / width);
		if (maxHeight > 0 && height > maxHeight)
			scale = Math.min(scale, (double)maxHeight / height);
		if (scale >= 1.0)
			return new int[] {width, height};
		return new int[] {
				Math.max(1, (int)Math.round(width * scale)),
				Math.max(1, (int)Math.round(height * scale))
		};
	}

}
