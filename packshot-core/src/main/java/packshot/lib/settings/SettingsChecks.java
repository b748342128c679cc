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
 * Range checks shared by the settings sections.
 * Each failure names the settings key, so that the message can be matched to the settings file.
 */
class SettingsChecks {

	static void checkRange(String key, double value, double min, double max) {
		if (Double.isNaN(value) || value < min || value > max)
			throw new IllegalArgumentException(String.format("Setting '%s' must be in the range [%s, %s], but was %s", key, fmt(min), fmt(max), fmt(value)));
	}

	static void checkPositive(String key, double value) {
		if (Double.isNaN(value) || value <= 0)
			throw new IllegalArgumentException(String.format("Setting '%s' must be > 0, but was %s", key, fmt(value)));
	}

	static void checkColor(String key, int[] rgb) {
		if (rgb == null || rgb.length != 3)
			throw new IllegalArgumentException(String.format("Setting '%s' must contain 3 values (red, green, blue)", key));
		for (int v : rgb)
			checkRange(key, v, 0, 255);
	}

	/**
	 * Check an aspect ratio given as [width, height].
	 * If {@code allowEmpty} is true, an empty or missing ratio is accepted to mean 'no ratio'.
	 */
	static void checkAspectRatio(String key, double[] ratio, boolean allowEmpty) {
		if (ratio == null || ratio.length == 0) {
			if (allowEmpty)
				return;
			throw new IllegalArgumentException(String.format("Setting '%s' must contain 2 values (width, height)", key));
		}
		if (ratio.length != 2)
			throw new IllegalArgumentException(String.format("Setting '%s' must contain 2 values (width, height)", key));
		checkPositive(key, ratio[0]);
		checkPositive(key, ratio[1]);
	}

	private static String fmt(double value) {
		if (value == Math.rint(value) && !Double.isInfinite(value))
			return Long.toString((long)value);
		return Double.toString(value);
	}

}
