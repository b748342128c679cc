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
 * All settings that control how a batch of images is finished.
 * <p>
 * Instances are normally read from JSON with {@link SettingsIO}; each section corresponds to a
 * top-level object in the settings file.
 * Default values are those assigned by the section classes, so {@code new FinishingSettings()}
 * gives the default settings.
 *
 * @author PackShot developers
 */
public class FinishingSettings {

	private PreprocessingSettings preprocessing = new PreprocessingSettings();
	private WhiteningSettings whitening = new WhiteningSettings();
	private BackgroundCropSettings backgroundCrop = new BackgroundCropSettings();
	private PaddingSettings padding = new PaddingSettings();
	private ToneSettings brightnessContrast = new ToneSettings();
	private MergeSettings mergeSettings = new MergeSettings();
	private IndividualModeSettings individualMode = new IndividualModeSettings();
	private CollageModeSettings collageMode = new CollageModeSettings();
	private PerformanceSettings performance = new PerformanceSettings();

	/**
	 * Create settings with all default values.
	 * @return
	 */
	public static FinishingSettings createDefault() {
		return new FinishingSettings();
	}

	public PreprocessingSettings getPreprocessing() {
		return preprocessing;
	}

	public WhiteningSettings getWhitening() {
		return whitening;
	}

	public BackgroundCropSettings getBackgroundCrop() {
		return backgroundCrop;
	}

	public PaddingSettings getPadding() {
		return padding;
	}

	public ToneSettings getBrightnessContrast() {
		return brightnessContrast;
	}

	public MergeSettings getMergeSettings() {
		return mergeSettings;
	}

	public IndividualModeSettings getIndividualMode() {
		return individualMode;
	}

	public CollageModeSettings getCollageMode() {
		return collageMode;
	}

	public PerformanceSettings getPerformance() {
		return performance;
	}

	/**
	 * Check that all values are within their permitted ranges.
	 * @return this settings object, for convenience
	 * @throws IllegalArgumentException naming the first invalid setting that was found
	 */
	public FinishingSettings validate() throws IllegalArgumentException {
		if (preprocessing == null || whitening == null || backgroundCrop == null || padding == null ||
				brightnessContrast == null || mergeSettings == null || individualMode == null ||
				collageMode == null || performance == null)
			throw new IllegalArgumentException("Settings sections must not be null");
		preprocessing.validate();
		whitening.validate();
		backgroundCrop.validate();
		padding.validate();
		brightnessContrast.validate();
		mergeSettings.validate();
		individualMode.validate();
		collageMode.validate();
		performance.validate();
		return this;
	}

}
