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

package packshot.app.logging;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.LoggerContext;

/**
 * Manage logging levels.
 *
 * @author PackShot developers
 */
public class LogManager {

	private static final Logger logger = LoggerFactory.getLogger(LogManager.class);

	/**
	 * Available log levels.
	 */
	public static enum LogLevel {
		/**
		 * Trace logging (an awful lot of messages)
		 */
		TRACE,
		/**
		 * Debug logging (a lot of messages)
		 */
		DEBUG,
		/**
		 * Info logging (default)
		 */
		INFO,
		/**
		 * Warn logging (only if something is moderately important)
		 */
		WARN,
		/**
		 * Error logging (only if something goes recognizably wrong)
		 */
		ERROR,
		/**
		 * All log messages
		 */
		ALL,
		/**
		 * Turn off logging
		 */
		OFF;
	}

	// Suppressed default constructor for non-instantiability
	private LogManager() {
		throw new AssertionError();
	}

	/**
	 * Set the root log level.
	 * @param level
	 */
	public static void setRootLogLevel(LogLevel level) {
		var root = getRootLogger();
		if (root != null)
			root.setLevel(getLevel(level));
		else
			logger.warn("Cannot set log level without logback!");
	}

	/**
	 * Get the root log level, or null if logback is not available.
	 * @return
	 */
	public static LogLevel getRootLogLevel() {
		var root = getRootLogger();
		if (root == null)
			return null;
		return switch (root.getEffectiveLevel().toInt()) {
			case Level.TRACE_INT -> LogLevel.TRACE;
			case Level.DEBUG_INT -> LogLevel.DEBUG;
			case Level.INFO_INT -> LogLevel.INFO;
			case Level.WARN_INT -> LogLevel.WARN;
			case Level.ERROR_INT -> LogLevel.ERROR;
			case Level.ALL_INT -> LogLevel.ALL;
			default -> LogLevel.OFF;
		};
	}

	static Level getLevel(LogLevel logLevel) {
		return switch (logLevel) {
			case TRACE -> Level.TRACE;
			case DEBUG -> Level.DEBUG;
			case INFO -> Level.INFO;
			case WARN -> Level.WARN;
			case ERROR -> Level.ERROR;
			case ALL -> Level.ALL;
			case OFF -> Level.OFF;
		};
	}

	static LoggerContext getLoggerContext() {
		if (LoggerFactory.getILoggerFactory() instanceof LoggerContext context)
			return context;
		return null;
	}

	static ch.qos.logback.classic.Logger getRootLogger() {
		var context = getLoggerContext();
		return context == null ? null : context.getLogger(Logger.ROOT_LOGGER_NAME);
	}

}
