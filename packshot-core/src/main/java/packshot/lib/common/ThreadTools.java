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

import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicInteger;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Create a thread factory that supports adding a prefix to the name and setting daemon status.
 * <p>
 * This helps with debugging, e.g. using visualvm
 *
 * @author PackShot developers
 *
 */
public class ThreadTools {

	private static final Logger logger = LoggerFactory.getLogger(ThreadTools.class);

	private static final String KEY_PARALLELISM = "packshot.parallelism";

	/**
	 * Get the preferred parallelism for batch processing.
	 * This is the number of available processors, unless the system property {@code packshot.parallelism}
	 * is set to a positive integer.
	 * @return
	 */
	public static int getParallelism() {
		String prop = System.getProperty(KEY_PARALLELISM);
		if (prop != null) {
			try {
				int n = Integer.parseInt(prop.strip());
				if (n > 0)
					return n;
			} catch (NumberFormatException e) {
				LogTools.warnOnce(logger, "Invalid value for " + KEY_PARALLELISM + ": " + prop);
			}
		}
		return Math.max(1, Runtime.getRuntime().availableProcessors());
	}

	/**
	 * Resolve a requested number of worker threads.
	 * @param requested the number of threads, or &le; 0 to use {@link #getParallelism()}
	 * @return
	 */
	public static int resolveParallelism(int requested) {
		return requested <= 0 ? getParallelism() : requested;
	}

	/**
	 * Create a named thread factory with a specified priority.
	 *
	 * @param prefix
	 * @param daemon
	 * @param priority
	 * @return
	 */
	public static ThreadFactory createThreadFactory(String prefix, boolean daemon, int priority) {
		return new SimpleThreadFactory(prefix, daemon, priority);
	}

	/**
	 * Create a named thread factory with {@code Thread.NORM_PRIORITY}.
	 *
	 * @param prefix
	 * @param daemon
	 * @return
	 */
	public static ThreadFactory createThreadFactory(String prefix, boolean daemon) {
		return createThreadFactory(prefix, daemon, Thread.NORM_PRIORITY);
	}


	static class SimpleThreadFactory implements ThreadFactory {

		private final AtomicInteger threadNumber = new AtomicInteger(1);
		private String prefix;
		private boolean daemon;
		private int priority;

		SimpleThreadFactory(final String prefix, final boolean daemon, final int priority) {
			this.prefix = prefix;
			this.daemon = daemon;
			this.priority = Math.max(Thread.MIN_PRIORITY, Math.min(Thread.MAX_PRIORITY, priority));
		}

		@Override
		public Thread newThread(Runnable r) {
			String name = prefix + threadNumber.getAndIncrement();
			Thread t = new Thread(r, name);
			t.setDaemon(daemon);
			if (t.getPriority() != priority)
				t.setPriority(priority);
			return t;
		}

	}

}
