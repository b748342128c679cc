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

package packshot.lib.compose;

import java.awt.image.BufferedImage;
import java.util.ArrayList;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import packshot.lib.awt.common.BufferedImageTools;
import packshot.lib.background.Matte;
import packshot.lib.common.ColorTools;
import packshot.lib.regions.Rect;

/**
 * Apply a matte and geometry to an image, then adjust its tone and final size.
 * <p>
 * Steps are applied in the order: matte (as alpha, or as a separate mask), crop, pad, tone,
 * force aspect ratio, maximum dimensions, exact dimensions.
 * The input image is never modified.
 *
 * @author PackShot developers
 */
public class Compositor {

	private static final Logger logger = LoggerFactory.getLogger(Compositor.class);

	/**
	 * Fill value for background areas of a mask.
	 */
	static final int MASK_BACKGROUND = ColorTools.BLACK;

	private final boolean useMask;
	private final int fill;
	private final ToneParams tone;
	private final OutputSizing sizing;

	private Compositor(Builder builder) {
		this.useMask = builder.useMask;
		this.fill = builder.fill;
		this.tone = builder.tone;
		this.sizing = builder.sizing;
	}

	/**
	 * Compose an image.
	 * @param image the source image
	 * @param matte the background matte, or null if the background should not be removed
	 * @param cropRect the crop window, in source coordinates
	 * @param padRect the padded rectangle in source coordinates, or null to use the crop window;
	 *                any area outside the crop window is filled
	 * @return
	 */
	public FinishedImage compose(BufferedImage image, Matte matte, Rect cropRect, Rect padRect) {
		var warnings = new ArrayList<String>();
		int w = image.getWidth();
		int h = image.getHeight();
		if (matte != null && (matte.getWidth() != w || matte.getHeight() != h))
			throw new IllegalArgumentException("Matte size " + matte.getWidth() + "x" + matte.getHeight() + " does not match image size " + w + "x" + h);

		int[] pixels = BufferedImageTools.getPixels(image);
		int[] maskPixels = null;
		if (matte != null) {
			if (matte.isDegenerate())
				warnings.add("Degenerate matte: " + matte.getStatus());
			if (useMask) {
				maskPixels = new int[pixels.length];
				for (int y = 0; y < h; y++) {
					for (int x = 0; x < w; x++) {
						int v = ColorTools.do8BitRangeCheck((1.0 - matte.getValue(x, y)) * 255.0);
						maskPixels[y * w + x] = ColorTools.packRGB(v, v, v);
					}
				}
			} else {
				applyMatte(pixels, matte);
			}
		}

		Rect target = padRect == null ? cropRect : padRect;
		var output = cropAndPad(BufferedImageTools.createArgb(pixels, w, h), cropRect, target, fill);
		var mask = maskPixels == null ? null : cropAndPad(BufferedImageTools.createArgb(maskPixels, w, h), cropRect, target, MASK_BACKGROUND);

		if (!tone.isIdentity())
			output = applyTone(output, tone);

		if (sizing.hasAspectRatio()) {
			output = forceAspectRatio(output, sizing.getAspectRatio(), fill);
			if (mask != null)
				mask = forceAspectRatio(mask, sizing.getAspectRatio(), MASK_BACKGROUND);
		}

		if (sizing.hasMaxDimensions()) {
			int[] size = BufferedImageTools.fitWithin(output.getWidth(), output.getHeight(), sizing.getMaxWidth(), sizing.getMaxHeight());
			if (size[0] != output.getWidth() || size[1] != output.getHeight()) {
				logger.debug("Downscaling {}x{} to {}x{}", output.getWidth(), output.getHeight(), size[0], size[1]);
				output = BufferedImageTools.resize(output, size[0], size[1]);
				if (mask != null)
					mask = BufferedImageTools.resize(mask, size[0], size[1]);
			}
		}

		if (sizing.hasExactDimensions()) {
			output = BufferedImageTools.resize(output, sizing.getExactWidth(), sizing.getExactHeight());
			if (mask != null)
				mask = BufferedImageTools.resize(mask, sizing.getExactWidth(), sizing.getExactHeight());
		}

		return new FinishedImage(output, mask == null ? null : toGray(mask), warnings);
	}

	/**
	 * Get a copy of an image with its alpha multiplied by the foreground confidence of a matte.
	 * @param image
	 * @param matte
	 * @return a new {@code TYPE_INT_ARGB} image
	 */
	public static BufferedImage applyMatte(BufferedImage image, Matte matte) {
		int[] pixels = BufferedImageTools.getPixels(image);
		applyMatte(pixels, matte);
		return BufferedImageTools.createArgb(pixels, image.getWidth(), image.getHeight());
	}

	private static void applyMatte(int[] pixels, Matte matte) {
		int w = matte.getWidth();
		int h = matte.getHeight();
		for (int y = 0; y < h; y++) {
			for (int x = 0; x < w; x++) {
				int i = y * w + x;
				int a = ColorTools.do8BitRangeCheck(ColorTools.alpha(pixels[i]) * (1.0 - matte.getValue(x, y)));
				pixels[i] = ColorTools.withAlpha(pixels[i], a);
			}
		}
	}

	/**
	 * Extract a crop window and place it within a (possibly larger) target rectangle.
	 * Pixels of the target outside the crop window are set to the fill value.
	 * @param img
	 * @param cropRect
	 * @param target
	 * @param fill
	 * @return
	 */
	static BufferedImage cropAndPad(BufferedImage img, Rect cropRect, Rect target, int fill) {
		var cropped = BufferedImageTools.extract(img, cropRect, fill);
		if (target.equals(cropRect))
			return cropped;
		return BufferedImageTools.extract(cropped, target.translate(-cropRect.getX(), -cropRect.getY()), fill);
	}

	/**
	 * Apply brightness and contrast to the color channels of an image.
	 * @param img
	 * @param tone
	 * @return a new image
	 */
	public static BufferedImage applyTone(BufferedImage img, ToneParams tone) {
		int[] lut = tone.createLut();
		int[] pixels = BufferedImageTools.getPixels(img);
		for (int i = 0; i < pixels.length; i++)
			pixels[i] = ToneParams.applyLut(pixels[i], lut);
		return BufferedImageTools.createArgb(pixels, img.getWidth(), img.getHeight());
	}

	/**
	 * Expand the shorter dimension of an image to reach an aspect ratio, centering the content.
	 * @param img
	 * @param aspectRatio width / height
	 * @param fill
	 * @return
	 */
	public static BufferedImage forceAspectRatio(BufferedImage img, double aspectRatio, int fill) {
		int w = img.getWidth();
		int h = img.getHeight();
		int newW = w, newH = h;
		if ((double)w / h < aspectRatio)
			newW = (int)Math.round(h * aspectRatio);
		else
			newH = (int)Math.round(w / aspectRatio);
		if (newW == w && newH == h)
			return img;
		int dx = (newW - w) / 2;
		int dy = (newH - h) / 2;
		return BufferedImageTools.extract(img, Rect.createInstance(-dx, -dy, newW, newH), fill);
	}

	private static BufferedImage toGray(BufferedImage mask) {
		var gray = new BufferedImage(mask.getWidth(), mask.getHeight(), BufferedImage.TYPE_BYTE_GRAY);
		var raster = gray.getRaster();
		int[] pixels = BufferedImageTools.getPixels(mask);
		int w = mask.getWidth();
		for (int i = 0; i < pixels.length; i++)
			raster.setSample(i % w, i / w, 0, ColorTools.red(pixels[i]));
		return gray;
	}

	/**
	 * Create a new builder.
	 * @return
	 */
	public static Builder builder() {
		return new Builder();
	}

	/**
	 * Builder for {@link Compositor}.
	 */
	public static class Builder {

		private boolean useMask = false;
		private int fill = ColorTools.TRANSPARENT;
		private ToneParams tone = ToneParams.identity();
		private OutputSizing sizing = OutputSizing.none();

		private Builder() {}

		/**
		 * Output the matte as a separate mask, rather than as image transparency.
		 * @param useMask
		 * @return this builder
		 */
		public Builder useMask(boolean useMask) {
			this.useMask = useMask;
			return this;
		}

		/**
		 * Packed ARGB value used for padding (default transparent).
		 * @param argb
		 * @return this builder
		 */
		public Builder fill(int argb) {
			this.fill = argb;
			return this;
		}

		/**
		 * Brightness and contrast.
		 * @param tone
		 * @return this builder
		 */
		public Builder tone(ToneParams tone) {
			this.tone = tone == null ? ToneParams.identity() : tone;
			return this;
		}

		/**
		 * Final output sizing.
		 * @param sizing
		 * @return this builder
		 */
		public Builder sizing(OutputSizing sizing) {
			this.sizing = sizing == null ? OutputSizing.none() : sizing;
			return this;
		}

		/**
		 * Build the compositor.
		 * @return
		 */
		public Compositor build() {
			return new Compositor(this);
		}

	}

}
