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

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.atomic.AtomicInteger;

import org.junit.jupiter.api.Test;

@SuppressWarnings("javadoc")
public class TestBatchRunner {

	@Test
	public void test_runAllKeepsInputOrder() {
		var tasks = new ArrayList<BatchTask<Integer>>();
		for (int i = 0; i < 20; i++) {
			int value = i;
			tasks.add(BatchTask.of("task " + i, () -> {
				Thread.sleep((20 - value) % 5);
				return value * value;
			}));
		}
		try (var runner = new BatchRunner(4)) {
			var results = runner.runAll(tasks, null);
			assertEquals(20, results.size());
			for (int i = 0; i < 20; i++) {
				var result = results.get(i);
				assertEquals(i, result.index());
				assertEquals("task " + i, result.name());
				assertTrue(result.isSuccess());
				assertEquals(i * i, result.value());
			}
		}
	}

	@Test
	public void test_errorsAreRecorded() {
		List<BatchTask<String>> tasks = List.of(
				BatchTask.of("ok", () -> "fine"),
				BatchTask.of("broken", () -> {
					throw new IllegalStateException("Unreadable image");
				}),
				BatchTask.of("also ok", () -> "fine too"));
		try (var runner = new BatchRunner(2)) {
			var results = runner.runAll(tasks, null);
			assertTrue(results.get(0).isSuccess());
			assertTrue(results.get(2).isSuccess());

			var failed = results.get(1);
			assertFalse(failed.isSuccess());
			assertFalse(failed.cancelled());
			assertNull(failed.value());
			assertInstanceOf(IllegalStateException.class, failed.error());
			assertEquals("Unreadable image", failed.error().getMessage());
		}
	}

	@Test
	public void test_progressListener() {
		var tasks = new ArrayList<BatchTask<Integer>>();
		for (int i = 0; i < 7; i++) {
			int value = i;
			tasks.add(BatchTask.of("task " + i, () -> value));
		}
		var completedCounts = Collections.synchronizedList(new ArrayList<Integer>());
		var calls = new AtomicInteger();
		try (var runner = new BatchRunner(3)) {
			runner.runAll(tasks, (completed, total, result) -> {
				calls.incrementAndGet();
				assertEquals(7, total);
				completedCounts.add(completed);
			});
		}
		assertEquals(7, calls.get());
		assertEquals(List.of(1, 2, 3, 4, 5, 6, 7), completedCounts);
	}

	@Test
	public void test_emptyBatch() {
		try (var runner = new BatchRunner(1)) {
			assertTrue(runner.runAll(new ArrayList<BatchTask<Object>>(), null).isEmpty());
		}
	}

	@Test
	public void test_joinGroup() throws Exception {
		try (var runner = new BatchRunner(2)) {
			List<BatchTask<String>> tasks = List.of(
					BatchTask.of("a", () -> "A"),
					BatchTask.of("b", () -> "B"),
					BatchTask.of("c", () -> "C"));
			var values = runner.joinGroup(runner.submitAll(tasks));
			assertEquals(List.of("A", "B", "C"), values);
		}
	}

	@Test
	public void test_joinGroupFailure() {
		try (var runner = new BatchRunner(2)) {
			List<BatchTask<String>> tasks = List.of(
					BatchTask.of("a", () -> "A"),
					BatchTask.of("b", () -> {
						throw new IllegalArgumentException("Bad member");
					}));
			var futures = runner.submitAll(tasks);
			var e = assertThrows(ExecutionException.class, () -> runner.joinGroup(futures));
			assertInstanceOf(IllegalArgumentException.class, e.getCause());
		}
	}

	@Test
	public void test_numThreads() {
		try (var runner = new BatchRunner(3)) {
			assertEquals(3, runner.getNumThreads());
		}
		try (var runner = new BatchRunner(0)) {
			assertTrue(runner.getNumThreads() >= 1);
		}
	}

	@Test
	public void test_cancel() {
		try (var runner = new BatchRunner(1)) {
			assertFalse(runner.isCancelled());
			runner.cancel();
			assertTrue(runner.isCancelled());
		}
	}

}
