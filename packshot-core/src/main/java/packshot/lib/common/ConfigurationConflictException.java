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

package packshot.lib.common;

/**
 * Exception thrown when settings that are individually valid cannot be satisfied together
 * for a specific input, e.g. when spacing leaves no room for collage cells.
 * <p>
 * This is fatal to the operation that raised it, but not to the rest of a batch.
 * Values are never silently clamped instead.
 * 
 * @author PackShot developers
 */
public class ConfigurationConflictException extends RuntimeException {

	private static final long serialVersionUID = 1L;

	private final String parameter;

	/**
	 * Constructor.
	 * @param parameter name of the setting responsible for the conflict
	 * @param message
	 */
	public ConfigurationConflictException(String parameter, String message) {
		super(message + " (check '" + parameter + "')");
		this.parameter = parameter;
	}

	/**
	 * Get the name of the setting responsible for the conflict.
	 * @return
	 */
	public String getParameter() {
		return parameter;
	}

}
