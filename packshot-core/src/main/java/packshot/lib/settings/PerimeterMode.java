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

import java.util.function.BooleanSupplier;

import com.google.gson.annotations.SerializedName;

/**
 * Condition on the image perimeter that must hold for an operation to run.
 */
public enum PerimeterMode {

	/**
	 * Run unconditionally.
	 */
	@SerializedName("always")
	ALWAYS,

	/**
	 * Run only if the perimeter is white.
	 */
	@SerializedName("if_white")
	IF_WHITE,

	/**
	 * Run only if the perimeter is not white.
	 */
	@SerializedName("if_not_white")
	IF_NOT_WHITE;

	/**
	 * Query whether an operation gated by this mode should run.
	 * @param perimeterWhite supplies the result of the perimeter check; only evaluated when needed
	 * @return
	 */
	public boolean shouldRun(BooleanSupplier perimeterWhite) {
		return switch (this) {
			case ALWAYS -> true;
			case IF_WHITE -> perimeterWhite.getAsBoolean();
			case IF_NOT_WHITE -> !perimeterWhite.getAsBoolean();
		};
	}

}
