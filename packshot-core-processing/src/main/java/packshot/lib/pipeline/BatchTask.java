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

import java.util.concurrent.Callable;

/**
 * A named unit of work for a {@link BatchRunner}.
 *
 * @param <T> the result type
 * @param name name used for logging, usually the input file name
 * @param callable the work to do
 *
 * @author PackShot developers
 */
public record BatchTask<T>(String name, Callable<T> callable) {

	/**
	 * Create a task with a name.
	 * @param <T>
	 * @param name
	 * @param callable
	 * @return
	 */
	public static <T> BatchTask<T> of(String name, Callable<T> callable) {
		return new BatchTask<>(name, callable);
	}

}
