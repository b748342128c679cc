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
 * Condition under which padding is applied.
 */
public enum PaddingMode {

	/**
	 * Always add padding.
	 */
	@SerializedName("always")
	ALWAYS,

	/**
	 * Add padding only if the perimeter is white.
	 */
	@SerializedName("if_white")
	IF_WHITE,

	/**
	 * Add padding only if the perimeter is not white.
	 */
	@SerializedName("if_not_white")
	IF_NOT_WHITE,

	/**
	 * Never add padding.
	 */
	@SerializedName("never")
	NEVER;

}
