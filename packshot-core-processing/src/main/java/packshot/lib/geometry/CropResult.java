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

import packshot.lib.regions.Padding;
import packshot.lib.regions.Rect;

/**
 * The crop window resolved for an image, together with the margins left around it.
 *
 * @author PackShot developers
 */
public class CropResult {

	private final Rect rect;
	private final Padding margins;
	private final boolean degenerate;
	private final boolean skipped;

	CropResult(Rect rect, Padding margins, boolean degenerate, boolean skipped) {
		this.rect = rect;
		this.margins = margins;
		this.degenerate = degenerate;
		this.skipped = skipped;
	}

	/**
	 * Get the crop window, in source image coordinates.
	 * @return
	 */
	public Rect getRect() {
		return rect;
	}

	/**
	 * Get the margins between the source image bounds and the crop window.
	 * @return
	 */
	public Padding getMargins() {
		return margins;
	}

	/**
	 * Returns true if no foreground was found, so that the full image is used.
	 * @return
	 */
	public boolean isDegenerate() {
		return degenerate;
	}

	/**
	 * Returns true if cropping was disabled, or cancelled by the perimeter check.
	 * @return
	 */
	public boolean isSkipped() {
		return skipped;
	}

	@Override
	public String toString() {
		return "CropResult [" + rect + ", margins=" + margins + (degenerate ? ", degenerate" : "") + (skipped ? ", skipped" : "") + "]";
	}

}
