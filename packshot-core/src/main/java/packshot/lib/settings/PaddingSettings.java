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
 * Settings for padding around the (possibly cropped) subject.
 */
public class PaddingSettings {

	private PaddingMode mode = PaddingMode.NEVER;
	private double paddingPercent = 5.0;
	private boolean allowExpansion = false;
	private int perimeterCheckTolerance = 10;
	private int perimeterMargin = 1;

	public PaddingMode getMode() {
		return mode;
	}

	/**
	 * Padding as a percentage of the smaller side of the padded rectangle.
	 * Negative values inset the rectangle instead.
	 * @return
	 */
	public double getPaddingPercent() {
		return paddingPercent;
	}

	/**
	 * Returns true if padding may make the result larger than the source image.
	 * @return
	 */
	public boolean isAllowExpansion() {
		return allowExpansion;
	}

	public int getPerimeterCheckTolerance() {
		return perimeterCheckTolerance;
	}

	/**
	 * Number of rows and columns on each side sampled by the perimeter check.
	 * @return
	 */
	public int getPerimeterMargin() {
		return perimeterMargin;
	}

	void validate() {
		if (mode == null)
			throw new IllegalArgumentException("Setting 'padding.mode' must be one of 'always', 'if_white', 'if_not_white' or 'never'");
		SettingsChecks.checkRange("padding.padding_percent", paddingPercent, -50, 100);
		SettingsChecks.checkRange("padding.perimeter_check_tolerance", perimeterCheckTolerance, 0, 255);
		SettingsChecks.checkRange("padding.perimeter_margin", perimeterMargin, 1, 100);
	}

}
