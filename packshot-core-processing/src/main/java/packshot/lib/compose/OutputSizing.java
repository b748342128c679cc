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

import packshot.lib.settings.IndividualModeSettings;

/**
 * Final sizing steps applied after cropping and padding.
 * <p>
 * These are applied in a fixed order: force aspect ratio, then maximum dimensions, then exact dimensions.
 *
 * @author PackShot developers
 */
public class OutputSizing {

	private static final OutputSizing NONE = builder().build();

	private final double aspectWidth, aspectHeight;
	private final int maxWidth, maxHeight;
	private final int exactWidth, exactHeight;

	private OutputSizing(Builder builder) {
		this.aspectWidth = builder.aspectWidth;
		this.aspectHeight = builder.aspectHeight;
		this.maxWidth = builder.maxWidth;
		this.maxHeight = builder.maxHeight;
		this.exactWidth = builder.exactWidth;
		this.exactHeight = builder.exactHeight;
	}

	/**
	 * Sizing that leaves the image dimensions unchanged.
	 * @return
	 */
	public static OutputSizing none() {
		return NONE;
	}

	/**
	 * Create sizing from individual mode settings.
	 * @param settings
	 * @return
	 */
	public static OutputSizing fromSettings(IndividualModeSettings settings) {
		var builder = builder();
		if (settings.isEnableForceAspectRatio()) {
			double[] ratio = settings.getForceAspectRatio();
			builder.forceAspectRatio(ratio[0], ratio[1]);
		}
		if (settings.isEnableMaxDimensions())
			builder.maxDimensions(settings.getMaxOutputWidth(), settings.getMaxOutputHeight());
		if (settings.isEnableExactCanvas())
			builder.exactDimensions(settings.getFinalExactWidth(), settings.getFinalExactHeight());
		return builder.build();
	}

	/**
	 * Returns true if an aspect ratio should be enforced.
	 * @return
	 */
	public boolean hasAspectRatio() {
		return aspectWidth > 0 && aspectHeight > 0;
	}

	/**
	 * Get the requested aspect ratio (width / height), or NaN if none is set.
	 * @return
	 */
	public double getAspectRatio() {
		return hasAspectRatio() ? aspectWidth / aspectHeight : Double.NaN;
	}

	/**
	 * Returns true if maximum dimensions are set.
	 * @return
	 */
	public boolean hasMaxDimensions() {
		return maxWidth > 0 || maxHeight > 0;
	}

	/**
	 * @return
	 */
	public int getMaxWidth() {
		return maxWidth;
	}

	/**
	 * @return
	 */
	public int getMaxHeight() {
		return maxHeight;
	}

	/**
	 * Returns true if exact output dimensions are set.
	 * @return
	 */
	public boolean hasExactDimensions() {
		return exactWidth > 0 && exactHeight > 0;
	}

	/**
	 * @return
	 */
	public int getExactWidth() {
		return exactWidth;
	}

	/**
	 * @return
	 */
	public int getExactHeight() {
		return exactHeight;
	}

	/**
	 * Create a new builder.
	 * @return
	 */
	public static Builder builder() {
		return new Builder();
	}

	/**
	 * Builder for {@link OutputSizing}.
	 */
	public static class Builder {

		private double aspectWidth, aspectHeight;
		private int maxWidth, maxHeight;
		private int exactWidth, exactHeight;

		private Builder() {}

		/**
		 * Expand the canvas to have the specified aspect ratio.
		 * @param width
		 * @param height
		 * @return this builder
		 */
		public Builder forceAspectRatio(double width, double height) {
			if (!(width > 0 && height > 0))
				throw new IllegalArgumentException("Aspect ratio values must be > 0! Requested " + width + ":" + height);
			this.aspectWidth = width;
			this.aspectHeight = height;
			return this;
		}

		/**
		 * Downscale if the image exceeds these dimensions.
		 * @param maxWidth maximum width, or 0 for no limit
		 * @param maxHeight maximum height, or 0 for no limit
		 * @return this builder
		 */
		public Builder maxDimensions(int maxWidth, int maxHeight) {
			if (maxWidth < 0 || maxHeight < 0)
				throw new IllegalArgumentException("Maximum dimensions must be >= 0! Requested " + maxWidth + "x" + maxHeight);
			this.maxWidth = maxWidth;
			this.maxHeight = maxHeight;
			return this;
		}

		/**
		 * Resize to exactly these dimensions.
		 * @param width
		 * @param height
		 * @return this builder
		 */
		public Builder exactDimensions(int width, int height) {
			if (width <= 0 || height <= 0)
				throw new IllegalArgumentException("Exact dimensions must be > 0! Requested " + width + "x" + height);
			this.exactWidth = width;
			this.exactHeight = height;
			return this;
		}

		/**
		 * Build the sizing.
		 * @return
		 */
		public OutputSizing build() {
			return new OutputSizing(this);
		}

	}

}
