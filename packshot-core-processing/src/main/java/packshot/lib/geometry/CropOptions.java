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

package packshot.lib.geometry;

import packshot.lib.settings.BackgroundCropSettings;
import packshot.lib.settings.PerimeterMode;

/**
 * Options controlling how a crop window is derived from a matte.
 *
 * @param enabled if false, the full image is always used
 * @param symmetricAbsolute leave equal margins on all four sides
 * @param symmetricAxes leave equal left/right and top/bottom margins
 * @param extraCropPercent additional shrinking of the crop window, as a percentage of its size (0-50)
 * @param perimeterMode whether cropping depends upon the image border being white
 * @param perimeterTolerance per-channel tolerance for the perimeter check
 *
 * @author PackShot developers
 */
public record CropOptions(boolean enabled, boolean symmetricAbsolute, boolean symmetricAxes,
		double extraCropPercent, PerimeterMode perimeterMode, int perimeterTolerance) {

	/**
	 * Validate the options.
	 * @throws IllegalArgumentException if the extra crop is out of range
	 */
	public CropOptions {
		if (!(extraCropPercent >= 0 && extraCropPercent <= 50))
			throw new IllegalArgumentException("Extra crop must be between 0 and 50%! Requested extra crop = " + extraCropPercent);
		if (perimeterMode == null)
			perimeterMode = PerimeterMode.ALWAYS;
	}

	/**
	 * Tight crop to the foreground, with no perimeter check.
	 * @return
	 */
	public static CropOptions tight() {
		return new CropOptions(true, false, false, 0, PerimeterMode.ALWAYS, 0);
	}

	/**
	 * Create crop options from background settings.
	 * @param settings
	 * @return
	 */
	public static CropOptions fromSettings(BackgroundCropSettings settings) {
		return new CropOptions(
				settings.isEnableCrop(),
				settings.isCropSymmetricAbsolute(),
				settings.isCropSymmetricAxes(),
				settings.getExtraCropPercent(),
				settings.getEffectivePerimeterMode(),
				settings.getPerimeterTolerance());
	}

}
