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
 * Settings for writing each processed image as its own output file.
 */
public class IndividualModeSettings {

	private boolean enableRename = false;
	private String articleName = "";
	private boolean deleteOriginals = false;

	private OutputFormat outputFormat = OutputFormat.JPG;
	private int jpegQuality = 95;
	private int[] jpgBackgroundColor = {255, 255, 255};
	private boolean pngTransparentBackground = true;
	private int[] pngBackgroundColor = {255, 255, 255};

	private boolean enableForceAspectRatio = false;
	private double[] forceAspectRatio = {1, 1};
	private boolean enableMaxDimensions = false;
	private int maxOutputWidth = 1500;
	private int maxOutputHeight = 1500;
	private boolean enableExactCanvas = false;
	private int finalExactWidth = 1500;
	private int finalExactHeight = 1500;

	/**
	 * Returns true if outputs should be renamed using {@link #getArticleName()}.
	 * @return
	 */
	public boolean isEnableRename() {
		return enableRename;
	}

	public String getArticleName() {
		return articleName;
	}

	/**
	 * Returns true if source files should be deleted once their output has been written successfully.
	 * @return
	 */
	public boolean isDeleteOriginals() {
		return deleteOriginals;
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

	public boolean isPngTransparentBackground() {
		return pngTransparentBackground;
	}

	public int[] getPngBackgroundColor() {
		return pngBackgroundColor.clone();
	}

	public boolean isEnableForceAspectRatio() {
		return enableForceAspectRatio;
	}

	/**
	 * Target aspect ratio as [width, height].
	 * @return
	 */
	public double[] getForceAspectRatio() {
		return forceAspectRatio.clone();
	}

	public boolean isEnableMaxDimensions() {
		return enableMaxDimensions;
	}

	public int getMaxOutputWidth() {
		return maxOutputWidth;
	}

	public int getMaxOutputHeight() {
		return maxOutputHeight;
	}

	public boolean isEnableExactCanvas() {
		return enableExactCanvas;
	}

	public int getFinalExactWidth() {
		return finalExactWidth;
	}

	public int getFinalExactHeight() {
		return finalExactHeight;
	}

	void validate() {
		if (outputFormat == null)
			throw new IllegalArgumentException("Setting 'individual_mode.output_format' must be one of 'jpg' or 'png'");
		SettingsChecks.checkRange("individual_mode.jpeg_quality", jpegQuality, 1, 100);
		SettingsChecks.checkColor("individual_mode.jpg_background_color", jpgBackgroundColor);
		SettingsChecks.checkColor("individual_mode.png_background_color", pngBackgroundColor);
		if (enableForceAspectRatio)
			SettingsChecks.checkAspectRatio("individual_mode.force_aspect_ratio", forceAspectRatio, false);
		if (enableMaxDimensions) {
			SettingsChecks.checkRange("individual_mode.max_output_width", maxOutputWidth, 1, 50_000);
			SettingsChecks.checkRange("individual_mode.max_output_height", maxOutputHeight, 1, 50_000);
		}
		if (enableExactCanvas) {
			SettingsChecks.checkRange("individual_mode.final_exact_width", finalExactWidth, 1, 50_000);
			SettingsChecks.checkRange("individual_mode.final_exact_height", finalExactHeight, 1, 50_000);
		}
		if (enableRename && (articleName == null || articleName.isBlank()))
			throw new IllegalArgumentException("Setting 'individual_mode.article_name' is required when renaming is enabled");
	}

}
