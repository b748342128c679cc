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

import org.apache.commons.math3.util.Precision;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import packshot.lib.analysis.images.SimpleImages;
import packshot.lib.awt.common.BufferedImageTools;
import packshot.lib.settings.BackgroundCropSettings;
import packshot.lib.settings.RemovalMode;

/**
 * Compute a {@link Matte} separating a subject from a plain background.
 * <p>
 * In {@link RemovalMode#FULL} mode every pixel is classified independently.
 * In {@link RemovalMode#EDGES} mode only background connected to the image border is retained,
 * so that background-colored areas enclosed by the subject are kept.
 * <p>
 * Two-phase processing first computes a coarse matte from a downsampled image, and then refines it at
 * full resolution only within a narrow band around the coarse boundaries.
 * Instances are immutable and may be shared between threads.
 *
 * @author PackShot developers
 */
public class BackgroundMatte {

	private static final Logger logger = LoggerFactory.getLogger(BackgroundMatte.class);

	/**
	 * Number of pixels targeted by the automatic scale factor for the coarse phase.
	 */
	static final double AUTO_SCALE_TARGET_PIXELS = 1_000_000;

	/**
	 * Smallest automatic scale factor.
	 */
	static final double AUTO_SCALE_MIN = 0.125;

	/**
	 * Upsampled coarse values strictly between these limits are always refined.
	 */
	static final float BAND_LOW = 0.02f, BAND_HIGH = 0.98f;

	private final int tolerance;
	private final RemovalMode mode;
	private final int reference;
	private final boolean twoPhase;
	private final double scaleFactor;
	private final int haloLevel;

	private BackgroundMatte(Builder builder) {
		this.tolerance = builder.tolerance;
		this.mode = builder.mode;
		this.reference = builder.reference;
		this.twoPhase = builder.twoPhase;
		this.scaleFactor = builder.scaleFactor;
		this.haloLevel = builder.haloLevel;
	}

	/**
	 * Compute a single-phase matte against a white reference, without halo reduction.
	 * @param img
	 * @param tolerance
	 * @param mode
	 * @return
	 */
	public static Matte computeMatte(BufferedImage img, int tolerance, RemovalMode mode) {
		return builder().tolerance(tolerance).mode(mode).build().computeMatte(img);
	}

	/**
	 * Compute a matte for an image.
	 * @param img
	 * @return
	 */
	public Matte computeMatte(BufferedImage img) {
		int w = img.getWidth();
		int h = img.getHeight();
		int[] pixels = BufferedImageTools.getPixels(img);

		float[] values;
		double scale = twoPhase ? resolveScale(w, h, scaleFactor) : 1.0;
		if (scale < 1.0) {
			logger.debug("Computing two-phase matte for {}x{} image with scale {}", w, h, scale);
			values = computeTwoPhase(img, pixels, scale);
		} else {
			values = computeSingle(pixels, w, h);
		}

		var matte = new Matte(SimpleImages.createFloatImage(values, w, h));
		if (haloLevel > 0)
			matte = MatteFilters.reduceHalo(matte, haloLevel);

		if (matte.isDegenerate())
			logger.warn("Degenerate matte for {}x{} image: {}", w, h, matte.getStatus());
		return matte;
	}

	/**
	 * Get the scale used for the coarse phase of two-phase processing.
	 * <p>
	 * A requested scale of exactly 1.0 means the scale is chosen automatically, to give about
	 * one megapixel for the coarse image (but never below {@value #AUTO_SCALE_MIN}).
	 * The automatic value is rounded to 3 decimal places.
	 * @param width
	 * @param height
	 * @param requested
	 * @return the scale; a value &ge; 1 means only a single full-resolution pass is needed
	 */
	public static double resolveScale(int width, int height, double requested) {
		if (requested != 1.0)
			return requested;
		double s = Math.sqrt(AUTO_SCALE_TARGET_PIXELS / ((double)width * height));
		s = Math.max(AUTO_SCALE_MIN, Math.min(1.0, s));
		return Precision.round(s, 3);
	}

	/**
	 * Get the radius of the refinement band around coarse boundaries, in full-resolution pixels.
	 * @param scale
	 * @return
	 */
	static int bandRadius(double scale) {
		return (int)Math.ceil(2.0 / scale) + 1;
	}

	private float[] computeSingle(int[] pixels, int w, int h) {
		float[] values = computeConfidence(pixels);
		if (mode == RemovalMode.EDGES)
			FloodFill.restrictToConnected(values, w, h, FloodFill.borderSeeds(w, h), null);
		return values;
	}

	private float[] computeConfidence(int[] pixels) {
		float[] values = new float[pixels.length];
		for (int i = 0; i < pixels.length; i++)
			values[i] = ColorClassifier.confidence(pixels[i], reference, tolerance);
		return values;
	}

	private float[] computeTwoPhase(BufferedImage img, int[] pixels, double scale) {
		int w = img.getWidth();
		int h = img.getHeight();
		int cw = Math.max(1, Math.min(w, (int)Math.round(w * scale)));
		int ch = Math.max(1, Math.min(h, (int)Math.round(h * scale)));

		// Phase 1: coarse matte
		var coarseImg = BufferedImageTools.resize(img, cw, ch);
		float[] coarse = computeSingle(BufferedImageTools.getPixels(coarseImg), cw, ch);
		float[] values = BufferedImageTools.resize(coarse, cw, ch, w, h);

		// Phase 2: refine a band around the coarse boundaries
		boolean[] band = computeBand(values, w, h, bandRadius(scale));
		int nBand = 0;
		for (int i = 0; i < values.length; i++) {
			if (band[i]) {
				values[i] = ColorClassifier.confidence(pixels[i], reference, tolerance);
				nBand++;
			}
		}
		logger.trace("Refined {} of {} pixels at full resolution", nBand, values.length);

		if (mode == RemovalMode.EDGES) {
			boolean[] seeds = FloodFill.borderSeeds(w, h);
			for (int i = 0; i < values.length; i++) {
				if (!band[i] && values[i] >= Matte.BACKGROUND_THRESHOLD)
					seeds[i] = true;
			}
			FloodFill.restrictToConnected(values, w, h, seeds, band);
		}
		return values;
	}

	/**
	 * Identify pixels to refine: those within a chessboard distance of the radius from a
	 * transition in the thresholded values, and those with uncertain values.
	 */
	static boolean[] computeBand(float[] values, int w, int h, int radius) {
		int n = values.length;
		boolean[] transition = new boolean[n];
		for (int y = 0; y < h; y++) {
			for (int x = 0; x < w; x++) {
				int i = y * w + x;
				boolean bg = values[i] >= Matte.BACKGROUND_THRESHOLD;
				if ((x < w - 1 && bg != (values[i + 1] >= Matte.BACKGROUND_THRESHOLD)) ||
						(y < h - 1 && bg != (values[i + w] >= Matte.BACKGROUND_THRESHOLD))) {
					transition[i] = true;
					if (x < w - 1 && bg != (values[i + 1] >= Matte.BACKGROUND_THRESHOLD))
						transition[i + 1] = true;
					if (y < h - 1 && bg != (values[i + w] >= Matte.BACKGROUND_THRESHOLD))
						transition[i + w] = true;
				}
			}
		}
		boolean[] band = dilate(transition, w, h, radius);
		for (int i = 0; i < n; i++) {
			if (values[i] > BAND_LOW && values[i] < BAND_HIGH)
				band[i] = true;
		}
		return band;
	}

	private static boolean[] dilate(boolean[] mask, int w, int h, int radius) {
		boolean[] temp = new boolean[mask.length];
		boolean[] output = new boolean[mask.length];
		for (int y = 0; y < h; y++) {
			int last = Integer.MIN_VALUE / 2;
			// Forward and backward sweeps record the distance to the nearest set pixel in the row
			for (int x = 0; x < w; x++) {
				if (mask[y * w + x])
					last = x;
				if (x - last <= radius)
					temp[y * w + x] = true;
			}
			last = Integer.MAX_VALUE / 2;
			for (int x = w - 1; x >= 0; x--) {
				if (mask[y * w + x])
					last = x;
				if (last - x <= radius)
					temp[y * w + x] = true;
			}
		}
		for (int x = 0; x < w; x++) {
			int last = Integer.MIN_VALUE / 2;
			for (int y = 0; y < h; y++) {
				if (temp[y * w + x])
					last = y;
				if (y - last <= radius)
					output[y * w + x] = true;
			}
			last = Integer.MAX_VALUE / 2;
			for (int y = h - 1; y >= 0; y--) {
				if (temp[y * w + x])
					last = y;
				if (last - y <= radius)
					output[y * w + x] = true;
			}
		}
		return output;
	}

	/**
	 * Get the per-channel tolerance.
	 * @return
	 */
	public int getTolerance() {
		return tolerance;
	}

	/**
	 * Get the removal mode.
	 * @return
	 */
	public RemovalMode getMode() {
		return mode;
	}

	/**
	 * Returns true if two-phase processing is requested.
	 * @return
	 */
	public boolean isTwoPhase() {
		return twoPhase;
	}

	/**
	 * Get the halo reduction level.
	 * @return
	 */
	public int getHaloLevel() {
		return haloLevel;
	}

	/**
	 * Create a new builder with default values.
	 * @return
	 */
	public static Builder builder() {
		return new Builder();
	}

	/**
	 * Create a builder initialized from background settings.
	 * @param settings
	 * @return
	 */
	public static Builder builder(BackgroundCropSettings settings) {
		return new Builder()
				.tolerance(settings.getWhiteTolerance())
				.mode(settings.getRemovalMode())
				.twoPhase(settings.isUseTwoPhaseProcessing())
				.scaleFactor(settings.getScaleFactor())
				.haloLevel(settings.getHaloReductionLevel());
	}

	/**
	 * Builder for {@link BackgroundMatte}.
	 */
	public static class Builder {

		private int tolerance = 10;
		private RemovalMode mode = RemovalMode.FULL;
		private int reference = ColorClassifier.WHITE;
		private boolean twoPhase = false;
		private double scaleFactor = 1.0;
		private int haloLevel = 0;

		private Builder() {}

		/**
		 * Per-channel tolerance, 0-255.
		 * @param tolerance
		 * @return this builder
		 */
		public Builder tolerance(int tolerance) {
			if (tolerance < 0 || tolerance > 255)
				throw new IllegalArgumentException("Tolerance must be between 0 and 255! Requested tolerance = " + tolerance);
			this.tolerance = tolerance;
			return this;
		}

		/**
		 * Removal mode.
		 * @param mode
		 * @return this builder
		 */
		public Builder mode(RemovalMode mode) {
			this.mode = mode == null ? RemovalMode.FULL : mode;
			return this;
		}

		/**
		 * Packed RGB reference background color (default white).
		 * @param rgb
		 * @return this builder
		 */
		public Builder reference(int rgb) {
			this.reference = rgb;
			return this;
		}

		/**
		 * Request two-phase processing.
		 * @param twoPhase
		 * @return this builder
		 */
		public Builder twoPhase(boolean twoPhase) {
			this.twoPhase = twoPhase;
			return this;
		}

		/**
		 * Scale for the coarse phase; 1.0 means automatic.
		 * @param scaleFactor
		 * @return this builder
		 */
		public Builder scaleFactor(double scaleFactor) {
			if (!(scaleFactor > 0 && scaleFactor <= 1.0))
				throw new IllegalArgumentException("Scale factor must be > 0 and <= 1! Requested scale factor = " + scaleFactor);
			this.scaleFactor = scaleFactor;
			return this;
		}

		/**
		 * Halo reduction level, 0-5.
		 * @param level
		 * @return this builder
		 */
		public Builder haloLevel(int level) {
			if (level < 0 || level > MatteFilters.MAX_HALO_LEVEL)
				throw new IllegalArgumentException("Halo reduction level must be between 0 and " + MatteFilters.MAX_HALO_LEVEL + "! Requested level = " + level);
			this.haloLevel = level;
			return this;
		}

		/**
		 * Build the matte calculator.
		 * @return
		 */
		public BackgroundMatte build() {
			return new BackgroundMatte(this);
		}

	}

}
