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

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CancellationException;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorCompletionService;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.atomic.AtomicInteger;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import packshot.lib.common.ThreadTools;

/**
 * Run finishing tasks on a fixed pool of worker threads.
 * <p>
 * A failure in one task is logged and recorded, but never stops the others.
 * Tasks complete in no particular order; results are always returned in submission order.
 *
 * @author PackShot developers
 */
public class BatchRunner implements AutoCloseable {

	private static final Logger logger = LoggerFactory.getLogger(BatchRunner.class);

	private static final AtomicInteger counter = new AtomicInteger();

	/**
	 * Listener notified as each task completes.
	 */
	@FunctionalInterface
	public interface ProgressListener {

		/**
		 * Called after each task finishes, successfully or not.
		 * @param completed number of tasks finished so far
		 * @param total total number of tasks
		 * @param result the result of the task that just finished
		 */
		void taskCompleted(int completed, int total, TaskResult<?> result);

	}

	private final int numThreads;
	private final ExecutorService pool;
	private final Map<Future<?>, String> pendingTasks = new ConcurrentHashMap<>();

	private volatile boolean cancelled = false;

	/**
	 * Create a batch runner.
	 * @param numThreads the number of threads to use, or &le; 0 to use {@link ThreadTools#getParallelism()}
	 */
	public BatchRunner(int numThreads) {
		this.numThreads = ThreadTools.resolveParallelism(numThreads);
		this.pool = Executors.newFixedThreadPool(this.numThreads,
				ThreadTools.createThreadFactory("batch-runner-" + counter.incrementAndGet() + "-", true));
		logger.debug("New thread pool created with {} threads", this.numThreads);
	}

	/**
	 * Get the number of worker threads.
	 * @return
	 */
	public int getNumThreads() {
		return numThreads;
	}

	/**
	 * Submit a single task.
	 * @param <T>
	 * @param task
	 * @return a future for the task result
	 */
	public <T> Future<T> submit(BatchTask<T> task) {
		Future<T> future = pool.submit(task.callable());
		pendingTasks.put(future, task.name());
		return future;
	}

	/**
	 * Submit tasks as a group.
	 * @param <T>
	 * @param tasks
	 * @return futures in the same order as the tasks
	 */
	public <T> List<Future<T>> submitAll(List<BatchTask<T>> tasks) {
		var futures = new ArrayList<Future<T>>();
		for (var task : tasks)
			futures.add(submit(task));
		return futures;
	}

	/**
	 * Wait for all members of a group.
	 * <p>
	 * If any member fails, the remaining members are cancelled and the exception is rethrown.
	 * Other tasks submitted to the same runner are unaffected.
	 * @param <T>
	 * @param futures
	 * @return the results, in the same order as the futures
	 * @throws ExecutionException if any member failed
	 * @throws InterruptedException if the calling thread is interrupted while waiting
	 */
	public <T> List<T> joinGroup(List<Future<T>> futures) throws ExecutionException, InterruptedException {
		var results = new ArrayList<T>();
		try {
			for (var future : futures)
				results.add(future.get());
			return results;
		} catch (ExecutionException | InterruptedException | CancellationException e) {
			for (var future : futures)
				future.cancel(true);
			if (e instanceof CancellationException)
				throw new ExecutionException("Group member was cancelled", e);
			throw e;
		} finally {
			for (var future : futures)
				pendingTasks.remove(future);
		}
	}

	/**
	 * Run all tasks and wait for them to complete.
	 * @param <T>
	 * @param tasks
	 * @param listener optional listener for progress updates; may be null
	 * @return one result per task, in submission order
	 */
	public <T> List<TaskResult<T>> runAll(List<BatchTask<T>> tasks, ProgressListener listener) {
		if (tasks.isEmpty())
			return Collections.emptyList();

		cancelled = false;
		var service = new ExecutorCompletionService<T>(pool);
		Map<Future<T>, Integer> indices = new ConcurrentHashMap<>();
		for (int i = 0; i < tasks.size(); i++) {
			var task = tasks.get(i);
			Future<T> future = service.submit(task.callable());
			indices.put(future, i);
			pendingTasks.put(future, task.name());
		}

		List<TaskResult<T>> results = new ArrayList<>(Collections.nCopies(tasks.size(), null));
		int completed = 0;
		try {
			while (completed < tasks.size()) {
				Future<T> future = service.take();
				int index = indices.get(future);
				String name = tasks.get(index).name();
				TaskResult<T> result;
				if (future.isCancelled()) {
					result = new TaskResult<>(index, name, null, null, true);
				} else {
					try {
						result = new TaskResult<>(index, name, future.get(), null, false);
					} catch (ExecutionException e) {
						var cause = e.getCause() == null ? e : e.getCause();
						logger.error("Error processing {}: {}", name, cause.getMessage(), cause);
						result = new TaskResult<>(index, name, null, cause, false);
					}
				}
				pendingTasks.remove(future);
				results.set(index, result);
				completed++;
				if (listener != null)
					listener.taskCompleted(completed, tasks.size(), result);
			}
		} catch (InterruptedException e) {
			logger.error("Batch interrupted: {}", e.getMessage(), e);
			cancel();
			Thread.currentThread().interrupt();
		}
		// Fill in anything that never completed
		for (int i = 0; i < results.size(); i++) {
			if (results.get(i) == null)
				results.set(i, new TaskResult<>(i, tasks.get(i).name(), null, null, true));
		}
		return results;
	}

	/**
	 * Cancel all pending tasks.
	 */
	public void cancel() {
		cancelled = true;
		for (var entry : pendingTasks.entrySet()) {
			if (entry.getKey().cancel(true))
				logger.debug("Cancelled {}", entry.getValue());
			pendingTasks.remove(entry.getKey());
		}
	}

	/**
	 * Returns true if {@link #cancel()} was called since the last call to {@link #runAll(List, ProgressListener)}.
	 * @return
	 */
	public boolean isCancelled() {
		return cancelled;
	}

	/**
	 * Shut down the thread pool. Running tasks are allowed to complete.
	 */
	@Override
	public void close() {
		pool.shutdown();
	}

}
