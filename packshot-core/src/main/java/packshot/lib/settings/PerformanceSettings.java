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
 * Settings controlling parallel processing.
 */
public class PerformanceSettings {

	private int maxWorkers = 0;

	/**
	 * Maximum number of worker threads, or 0 to use one per available processor.
	 * @return
	 */
	public int getMaxWorkers() {
		return maxWorkers;
	}

	/**
	 * Set the maximum number of worker threads.
	 * @param maxWorkers the number of threads, or 0 for automatic
	 */
	public void setMaxWorkers(int maxWorkers) {
		this.maxWorkers = maxWorkers;
	}

	void validate() {
		SettingsChecks.checkRange("performance.max_workers", maxWorkers, 0, 256);
	}

}
