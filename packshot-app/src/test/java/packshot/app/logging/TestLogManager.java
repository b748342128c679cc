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

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNotNull;

import org.junit.jupiter.api.Test;

import ch.qos.logback.classic.Level;
import packshot.app.logging.LogManager.LogLevel;

@SuppressWarnings("javadoc")
public class TestLogManager {

	@Test
	public void test_setRootLogLevel() {
		var previous = LogManager.getRootLogLevel();
		assertNotNull(previous);
		try {
			LogManager.setRootLogLevel(LogLevel.DEBUG);
			assertEquals(LogLevel.DEBUG, LogManager.getRootLogLevel());
			LogManager.setRootLogLevel(LogLevel.ERROR);
			assertEquals(LogLevel.ERROR, LogManager.getRootLogLevel());
		} finally {
			LogManager.setRootLogLevel(previous);
		}
	}

	@Test
	public void test_getLevel() {
		assertEquals(Level.TRACE, LogManager.getLevel(LogLevel.TRACE));
		assertEquals(Level.WARN, LogManager.getLevel(LogLevel.WARN));
		assertEquals(Level.OFF, LogManager.getLevel(LogLevel.OFF));
	}

}
