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
 * Settings for whitening an off-white background using the darkest perimeter pixel as reference.
 */
public class WhiteningSettings {

	private boolean enableWhitening = false;
	private int whiteningCancelThreshold = 765;

	public boolean isEnableWhitening() {
		return enableWhitening;
	}

	/**
	 * Brightness threshold (0-765) for the r+g+b sum of the darkest perimeter pixel.
	 * Whitening runs only when that sum is greater than the threshold, so 765 never whitens.
	 * @return
	 */
	public int getWhiteningCancelThreshold() {
		return whiteningCancelThreshold;
	}

	void validate() {
		SettingsChecks.checkRange("whitening.whitening_cancel_threshold", whiteningCancelThreshold, 0, 765);
	}

}
