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
 * Settings for background removal and cropping to the subject.
 */
public class BackgroundCropSettings {

	private boolean enableBgCrop = false;
	private int whiteTolerance = 10;
	private RemovalMode removalMode = RemovalMode.FULL;
	private boolean useTwoPhaseProcessing = false;
	private double scaleFactor = 1.0;
	private int haloReductionLevel = 0;
	private boolean useMaskInsteadOfTransparency = false;

	private boolean enableCrop = true;
	private boolean cropSymmetricAbsolute = false;
	private boolean cropSymmetricAxes = false;
	private double extraCropPercent = 0;

	private boolean checkPerimeter = true;
	private PerimeterMode perimeterMode = PerimeterMode.IF_WHITE;
	private int perimeterTolerance = 10;

	/**
	 * Returns true if background removal (and, optionally, cropping) is enabled.
	 * @return
	 */
	public boolean isEnableBgCrop() {
		return enableBgCrop;
	}

	/**
	 * Maximum per-channel deviation from white for a pixel to be considered background.
	 * @return
	 */
	public int getWhiteTolerance() {
		return whiteTolerance;
	}

	public RemovalMode getRemovalMode() {
		return removalMode;
	}

	public boolean isUseTwoPhaseProcessing() {
		return useTwoPhaseProcessing;
	}

	/**
	 * Scale for the coarse pass of two-phase processing.
	 * A value of exactly 1.0 requests that the scale is chosen automatically from the image size.
	 * @return
	 */
	public double getScaleFactor() {
		return scaleFactor;
	}

	public int getHaloReductionLevel() {
		return haloReductionLevel;
	}

	public boolean isUseMaskInsteadOfTransparency() {
		return useMaskInsteadOfTransparency;
	}

	public boolean isEnableCrop() {
		return enableCrop;
	}

	public boolean isCropSymmetricAbsolute() {
		return cropSymmetricAbsolute;
	}

	public boolean isCropSymmetricAxes() {
		return cropSymmetricAxes;
	}

	public double getExtraCropPercent() {
		return extraCropPercent;
	}

	/**
	 * Returns true if {@link #getPerimeterMode()} should be used to decide whether background removal runs.
	 * If false, it runs unconditionally.
	 * @return
	 */
	public boolean isCheckPerimeter() {
		return checkPerimeter;
	}

	public PerimeterMode getPerimeterMode() {
		return perimeterMode;
	}

	/**
	 * Get the perimeter condition that actually applies, taking {@link #isCheckPerimeter()} into account.
	 * @return
	 */
	public PerimeterMode getEffectivePerimeterMode() {
		return checkPerimeter && perimeterMode != null ? perimeterMode : PerimeterMode.ALWAYS;
	}

	public int getPerimeterTolerance() {
		return perimeterTolerance;
	}

	void validate() {
		SettingsChecks.checkRange("background_crop.white_tolerance", whiteTolerance, 0, 255);
		SettingsChecks.checkRange("background_crop.scale_factor", scaleFactor, 0.05, 1.0);
		SettingsChecks.checkRange("background_crop.halo_reduction_level", haloReductionLevel, 0, 5);
		SettingsChecks.checkRange("background_crop.extra_crop_percent", extraCropPercent, 0, 50);
		SettingsChecks.checkRange("background_crop.perimeter_tolerance", perimeterTolerance, 0, 255);
		if (removalMode == null)
			throw new IllegalArgumentException("Setting 'background_crop.removal_mode' must be one of 'full' or 'edges'");
	}

}
