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
 * Region over which background pixels are removed.
 */
public enum RemovalMode {

	/**
	 * Every pixel is classified independently.
	 */
	@SerializedName("full")
	FULL,

	/**
	 * Only background pixels connected to the image border are removed, so that enclosed
	 * near-white regions of the subject survive.
	 */
	@SerializedName("edges")
	EDGES;

}
