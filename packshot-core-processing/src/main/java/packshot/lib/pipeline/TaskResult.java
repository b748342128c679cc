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

package packshot.lib.pipeline;

/**
 * Outcome of a {@link BatchTask}: either a value, or the exception that caused the task to fail.
 *
 * @param <T> the result type
 * @param index position of the task in the submitted list
 * @param name task name
 * @param value the result, or null if the task failed or was cancelled
 * @param error the exception thrown by the task, or null if it succeeded or was cancelled
 * @param cancelled true if the task was cancelled before completing
 *
 * @author PackShot developers
 */
public record TaskResult<T>(int index, String name, T value, Throwable error, boolean cancelled) {

	/**
	 * Returns true if the task completed without an exception.
	 * @return
	 */
	public boolean isSuccess() {
		return error == null && !cancelled;
	}

}
