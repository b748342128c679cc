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

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

import org.junit.jupiter.api.Test;

@SuppressWarnings("javadoc")
public class TestThreadTools {

	@Test
	public void test_resolveParallelism() {
		assertEquals(3, ThreadTools.resolveParallelism(3));
		assertEquals(ThreadTools.getParallelism(), ThreadTools.resolveParallelism(0));
		assertEquals(ThreadTools.getParallelism(), ThreadTools.resolveParallelism(-1));
		assertTrue(ThreadTools.getParallelism() >= 1);
	}

	@Test
	public void test_createThreadFactory() {
		var factory = ThreadTools.createThreadFactory("test-pool-", true);
		var thread = factory.newThread(() -> {});
		assertTrue(thread.isDaemon());
		assertTrue(thread.getName().startsWith("test-pool-"));
	}

}
