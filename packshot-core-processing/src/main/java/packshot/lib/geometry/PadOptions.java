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

import packshot.lib.settings.PaddingMode;
import packshot.lib.settings.PaddingSettings;

/**
 * Options controlling padding around a crop window.
 *
 * @param mode when padding should be applied
 * @param paddingPercent padding as a percentage of the smaller crop dimension; negative values inset (-50 to 100)
 * @param allowExpansion if false, padding never extends beyond the source image
 * @param perimeterTolerance per-channel tolerance for the perimeter check
 * @param perimeterMargin number of border rows and columns checked
 *
 * @author PackShot developers
 */
public record PadOptions(PaddingMode mode, double paddingPercent, boolean allowExpansion,
		int perimeterTolerance, int perimeterMargin) {

	/**
	 * Validate the options.
	 * @throws IllegalArgumentException if the padding percentage is out of range
	 */
	public PadOptions {
		if (!(paddingPercent >= -50 && paddingPercent <= 100))
			throw new IllegalArgumentException("Padding must be between -50 and 100%! Requested padding = " + paddingPercent);
		if (mode == null)
			mode = PaddingMode.NEVER;
	}

	/**
	 * Unconditional padding.
	 * @param paddingPercent
	 * @param allowExpansion
	 * @return
	 */
	public static PadOptions always(double paddingPercent, boolean allowExpansion) {
		return new PadOptions(PaddingMode.ALWAYS, paddingPercent, allowExpansion, 0, 1);
	}

	/**
	 * Create padding options from settings.
	 * @param settings
	 * @return
	 */
	public static PadOptions fromSettings(PaddingSettings settings) {
		return new PadOptions(
				settings.getMode(),
				settings.getPaddingPercent(),
				settings.isAllowExpansion(),
				settings.getPerimeterCheckTolerance(),
				settings.getPerimeterMargin());
	}

}
