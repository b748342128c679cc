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

package packshot.lib.settings;

/**
 * Settings for assembling processed images into a single grid collage.
 */
public class CollageModeSettings {

	private boolean enableCollage = false;
	private String outputFilename = "collage";

	private boolean proportionalPlacement = false;
	private double[] placementRatios = {1.0};
	private int forcedCols = 0;
	private boolean enableSpacing = true;
	private double spacingPercent = 2.0;
	private boolean enableOuterMargins = false;
	private double outerMarginsPercent = 2.0;
	private double[] forceCollageAspectRatio = {};

	private boolean enableMaxDimensions = false;
	private int maxCollageWidth = 1500;
	private int maxCollageHeight = 1500;
	private int finalCollageExactWidth = 0;
	private int finalCollageExactHeight = 0;

	private OutputFormat outputFormat = OutputFormat.JPG;
	private int jpegQuality = 95;
	private int[] jpgBackgroundColor = {255, 255, 255};

	public boolean isEnableCollage() {
		return enableCollage;
	}

	/**
	 * Base name (without extension) of the collage output file.
	 * @return
	 */
	public String getOutputFilename() {
		return outputFilename;
	}

	public boolean isProportionalPlacement() {
		return proportionalPlacement;
	}

	/**
	 * Relative scale of each image when {@link #isProportionalPlacement()} is true.
	 * The list is repeated if there are more images than ratios.
	 * @return
	 */
	public double[] getPlacementRatios() {
		return placementRatios == null ? new double[0] : placementRatios.clone();
	}

	/**
	 * Requested number of columns, or 0 to choose automatically.
	 * @return
	 */
	public int getForcedCols() {
		return forcedCols;
	}

	public boolean isEnableSpacing() {
		return enableSpacing;
	}

	public double getSpacingPercent() {
		return spacingPercent;
	}

	public boolean isEnableOuterMargins() {
		return enableOuterMargins;
	}

	public double getOuterMarginsPercent() {
		return outerMarginsPercent;
	}

	/**
	 * Requested aspect ratio of the whole collage as [width, height], or an empty array for none.
	 * @return
	 */
	public double[] getForceCollageAspectRatio() {
		return forceCollageAspectRatio == null ? new double[0] : forceCollageAspectRatio.clone();
	}

	public boolean isEnableMaxDimensions() {
		return enableMaxDimensions;
	}

	public int getMaxCollageWidth() {
		return maxCollageWidth;
	}

	public int getMaxCollageHeight() {
		return maxCollageHeight;
	}

	/**
	 * Exact collage width, or 0 if not fixed.
	 * @return
	 */
	public int getFinalCollageExactWidth() {
		return finalCollageExactWidth;
	}

	/**
	 * Exact collage height, or 0 if not fixed.
	 * @return
	 */
	public int getFinalCollageExactHeight() {
		return finalCollageExactHeight;
	}

	public OutputFormat getOutputFormat() {
		return outputFormat;
	}

	public int getJpegQuality() {
		return jpegQuality;
	}

	public int[] getJpgBackgroundColor() {
		return jpgBackgroundColor.clone();
	}

	void validate() {
		if (outputFormat == null)
			throw new IllegalArgumentException("Setting 'collage_mode.output_format' must be one of 'jpg' or 'png'");
		if (outputFilename == null || outputFilename.isBlank())
			throw new IllegalArgumentException("Setting 'collage_mode.output_filename' must not be blank");
		SettingsChecks.checkRange("collage_mode.forced_cols", forcedCols, 0, 100);
		SettingsChecks.checkRange("collage_mode.spacing_percent", spacingPercent, 0, 50);
		SettingsChecks.checkRange("collage_mode.outer_margins_percent", outerMarginsPercent, 0, 50);
		SettingsChecks.checkAspectRatio("collage_mode.force_collage_aspect_ratio", forceCollageAspectRatio, true);
		if (proportionalPlacement) {
			if (placementRatios == null || placementRatios.length == 0)
				throw new IllegalArgumentException("Setting 'collage_mode.placement_ratios' must not be empty when proportional placement is enabled");
			for (double r : placementRatios)
				SettingsChecks.checkRange("collage_mode.placement_ratios", r, 0.01, 100);
		}
		if (enableMaxDimensions) {
			SettingsChecks.checkRange("collage_mode.max_collage_width", maxCollageWidth, 1, 50_000);
			SettingsChecks.checkRange("collage_mode.max_collage_height", maxCollageHeight, 1, 50_000);
		}
		SettingsChecks.checkRange("collage_mode.final_collage_exact_width", finalCollageExactWidth, 0, 50_000);
		SettingsChecks.checkRange("collage_mode.final_collage_exact_height", finalCollageExactHeight, 0, 50_000);
		SettingsChecks.checkRange("collage_mode.jpeg_quality", jpegQuality, 1, 100);
		SettingsChecks.checkColor("collage_mode.jpg_background_color", jpgBackgroundColor);
	}

}
