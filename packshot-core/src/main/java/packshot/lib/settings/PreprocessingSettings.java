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
 * Settings applied before any background processing.
 */
public class PreprocessingSettings {

	private boolean enablePreresize = false;
	private int preresizeWidth = 2500;
	private int preresizeHeight = 2500;

	/**
	 * Returns true if large inputs should be downscaled before processing.
	 * @return
	 */
	public boolean isEnablePreresize() {
		return enablePreresize;
	}

	/**
	 * Maximum input width after pre-resizing.
	 * @return
	 */
	public int getPreresizeWidth() {
		return preresizeWidth;
	}

	/**
	 * Maximum input height after pre-resizing.
	 * @return
	 */
	public int getPreresizeHeight() {
		return preresizeHeight;
	}

	void validate() {
		if (enablePreresize) {
			SettingsChecks.checkRange("preprocessing.preresize_width", preresizeWidth, 1, 50_000);
			SettingsChecks.checkRange("preprocessing.preresize_height", preresizeHeight, 1, 50_000);
		}
	}

}
