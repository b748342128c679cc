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

import com.google.gson.annotations.SerializedName;

/**
 * Anchor positions for placing one image within another.
 * Each places the overlay flush against the corresponding edge(s), and centered along any free axis.
 */
public enum Anchor {

	@SerializedName("center")
	CENTER(0.5, 0.5),

	@SerializedName("top")
	TOP(0.5, 0),

	@SerializedName("bottom")
	BOTTOM(0.5, 1),

	@SerializedName("left")
	LEFT(0, 0.5),

	@SerializedName("right")
	RIGHT(1, 0.5),

	@SerializedName(value = "top_left", alternate = {"top-left"})
	TOP_LEFT(0, 0),

	@SerializedName(value = "top_right", alternate = {"top-right"})
	TOP_RIGHT(1, 0),

	@SerializedName(value = "bottom_left", alternate = {"bottom-left"})
	BOTTOM_LEFT(0, 1),

	@SerializedName(value = "bottom_right", alternate = {"bottom-right"})
	BOTTOM_RIGHT(1, 1);

	private final double fx;
	private final double fy;

	Anchor(double fx, double fy) {
		this.fx = fx;
		this.fy = fy;
	}

	/**
	 * Get the x coordinate at which an overlay should be placed.
	 * @param baseWidth
	 * @param overlayWidth
	 * @return
	 */
	public int getX(int baseWidth, int overlayWidth) {
		return (int)Math.floor((baseWidth - overlayWidth) * fx);
	}

	/**
	 * Get the y coordinate at which an overlay should be placed.
	 * @param baseHeight
	 * @param overlayHeight
	 * @return
	 */
	public int getY(int baseHeight, int overlayHeight) {
		return (int)Math.floor((baseHeight - overlayHeight) * fy);
	}

}
