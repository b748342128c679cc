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
 * Brightness and contrast settings.
 */
public class ToneSettings {

	private boolean enableBc = false;
	private double brightnessFactor = 1.0;
	private double contrastFactor = 1.0;

	public boolean isEnableBc() {
		return enableBc;
	}

	public double getBrightnessFactor() {
		return brightnessFactor;
	}

	public double getContrastFactor() {
		return contrastFactor;
	}

	void validate() {
		SettingsChecks.checkRange("brightness_contrast.brightness_factor", brightnessFactor, 0, 5);
		SettingsChecks.checkRange("brightness_contrast.contrast_factor", contrastFactor, 0, 5);
	}

}
