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

package packshot.lib.collage;

import java.util.Arrays;

import packshot.lib.settings.CollageModeSettings;

/**
 * Parameters controlling how a collage grid is laid out.
 *
 * @author PackShot developers
 */
public class LayoutSpec {

	static final String KEY_PLACEMENT_RATIOS = "collage_mode.placement_ratios";
	static final String KEY_SPACING = "collage_mode.spacing_percent";
	static final String KEY_MARGINS = "collage_mode.outer_margins_percent";
	static final String KEY_MAX_WIDTH = "collage_mode.max_collage_width";
	static final String KEY_MAX_HEIGHT = "collage_mode.max_collage_height";

	private final int forcedCols;
	private final boolean proportional;
	private final double[] ratios;
	private final double spacingPercent;
	private final double marginPercent;
	private final double aspectWidth, aspectHeight;
	private final int maxWidth, maxHeight;
	private final int exactWidth, exactHeight;

	private LayoutSpec(Builder builder) {
		this.forcedCols = builder.forcedCols;
		this.proportional = builder.proportional;
		this.ratios = builder.ratios.clone();
		this.spacingPercent = builder.spacingPercent;
		this.marginPercent = builder.marginPercent;
		this.aspectWidth = builder.aspectWidth;
		this.aspectHeight = builder.aspectHeight;
		this.maxWidth = builder.maxWidth;
		this.maxHeight = builder.maxHeight;
		this.exactWidth = builder.exactWidth;
		this.exactHeight = builder.exactHeight;
	}

	/**
	 * Create a layout spec from collage settings.
	 * Spacing and margins are zero when disabled.
	 * @param settings
	 * @return
	 */
	public static LayoutSpec fromSettings(CollageModeSettings settings) {
		var builder = builder()
				.forcedCols(settings.getForcedCols())
				.spacingPercent(settings.isEnableSpacing() ? settings.getSpacingPercent() : 0)
				.marginPercent(settings.isEnableOuterMargins() ? settings.getOuterMarginsPercent() : 0)
				.exactDimensions(settings.getFinalCollageExactWidth(), settings.getFinalCollageExactHeight());
		if (settings.isProportionalPlacement())
			builder.proportional(settings.getPlacementRatios());
		double[] aspect = settings.getForceCollageAspectRatio();
		if (aspect.length == 2)
			builder.forceAspectRatio(aspect[0], aspect[1]);
		if (settings.isEnableMaxDimensions())
			builder.maxDimensions(settings.getMaxCollageWidth(), settings.getMaxCollageHeight());
		return builder.build();
	}

	/**
	 * Requested number of columns, or 0 for automatic.
	 * @return
	 */
	public int getForcedCols() {
		return forcedCols;
	}

	/**
	 * Returns true if cell sizes follow the placement ratios.
	 * @return
	 */
	public boolean isProportional() {
		return proportional;
	}

	/**
	 * Get the ratio for the image with the specified index; ratios are repeated cyclically.
	 * @param index
	 * @return
	 */
	public double getRatio(int index) {
		return ratios[index % ratios.length];
	}

	/**
	 * @return spacing between cells, as a percentage of the average cell dimension
	 */
	public double getSpacingPercent() {
		return spacingPercent;
	}

	/**
	 * @return outer margins, as a percentage of the average cell dimension
	 */
	public double getMarginPercent() {
		return marginPercent;
	}

	/**
	 * @return
	 */
	public boolean hasAspectRatio() {
		return aspectWidth > 0 && aspectHeight > 0;
	}

	/**
	 * @return the target aspect ratio (width / height), or NaN if none is set
	 */
	public double getAspectRatio() {
		return hasAspectRatio() ? aspectWidth / aspectHeight : Double.NaN;
	}

	/**
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
	 * Returns true if either exact dimension is set.
	 * @return
	 */
	public boolean hasExactDimensions() {
		return exactWidth > 0 || exactHeight > 0;
	}

	/**
	 * @return exact canvas width, or 0 if not set
	 */
	public int getExactWidth() {
		return exactWidth;
	}

	/**
	 * @return exact canvas height, or 0 if not set
	 */
	public int getExactHeight() {
		return exactHeight;
	}

	@Override
	public String toString() {
		return "LayoutSpec [forcedCols=" + forcedCols + ", proportional=" + proportional + ", ratios=" + Arrays.toString(ratios)
				+ ", spacing=" + spacingPercent + "%, margins=" + marginPercent + "%]";
	}

	/**
	 * Create a new builder.
	 * @return
	 */
	public static Builder builder() {
		return new Builder();
	}

	/**
	 * Builder for {@link LayoutSpec}.
	 */
	public static class Builder {

		private int forcedCols = 0;
		private boolean proportional = false;
		private double[] ratios = {1.0};
		private double spacingPercent = 0;
		private double marginPercent = 0;
		private double aspectWidth, aspectHeight;
		private int maxWidth, maxHeight;
		private int exactWidth, exactHeight;

		private Builder() {}

		/**
		 * @param cols number of columns, or 0 for automatic
		 * @return this builder
		 */
		public Builder forcedCols(int cols) {
			if (cols < 0)
				throw new IllegalArgumentException("Forced columns must be >= 0! Requested columns = " + cols);
			this.forcedCols = cols;
			return this;
		}

		/**
		 * Size cells proportionally, using the specified ratios relative to the tallest image.
		 * @param ratios
		 * @return this builder
		 */
		public Builder proportional(double... ratios) {
			if (ratios == null || ratios.length == 0)
				throw new IllegalArgumentException("At least one placement ratio is required!");
			this.proportional = true;
			this.ratios = ratios.clone();
			return this;
		}

		/**
		 * @param percent
		 * @return this builder
		 */
		public Builder spacingPercent(double percent) {
			if (percent < 0)
				throw new IllegalArgumentException("Spacing must be >= 0! Requested spacing = " + percent);
			this.spacingPercent = percent;
			return this;
		}

		/**
		 * @param percent
		 * @return this builder
		 */
		public Builder marginPercent(double percent) {
			if (percent < 0)
				throw new IllegalArgumentException("Margins must be >= 0! Requested margins = " + percent);
			this.marginPercent = percent;
			return this;
		}

		/**
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
		 * Set exact canvas dimensions. If only one is &gt; 0, the other follows the natural aspect ratio.
		 * @param width
		 * @param height
		 * @return this builder
		 */
		public Builder exactDimensions(int width, int height) {
			if (width < 0 || height < 0)
				throw new IllegalArgumentException("Exact dimensions must be >= 0! Requested " + width + "x" + height);
			this.exactWidth = width;
			this.exactHeight = height;
			return this;
		}

		/**
		 * Build the layout spec.
		 * @return
		 */
		public LayoutSpec build() {
			return new LayoutSpec(this);
		}

	}

}
