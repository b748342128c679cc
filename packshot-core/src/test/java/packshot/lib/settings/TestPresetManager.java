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

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Arrays;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

@SuppressWarnings("javadoc")
public class TestPresetManager {

	@Test
	public void test_defaultPreset(@TempDir Path dir) throws IOException {
		var manager = new PresetManager(dir.resolve("presets"));
		assertEquals(Arrays.asList(PresetManager.DEFAULT_PRESET_NAME), manager.list());
		assertTrue(Files.isRegularFile(dir.resolve("presets").resolve("default.json")));
		var settings = manager.load(PresetManager.DEFAULT_PRESET_NAME);
		assertFalse(settings.getBackgroundCrop().isEnableBgCrop());
		assertThrows(IllegalArgumentException.class, () -> manager.delete(PresetManager.DEFAULT_PRESET_NAME));
		assertThrows(IllegalArgumentException.class, () -> manager.rename(PresetManager.DEFAULT_PRESET_NAME, "other"));
	}

	@Test
	public void test_saveLoadList(@TempDir Path dir) throws IOException {
		var manager = new PresetManager(dir);
		var settings = SettingsIO.fromJson("{\"background_crop\": {\"enable_bg_crop\": true, \"white_tolerance\": 25}}");
		assertEquals("shoes 10", manager.save("shoes 10", settings));
		manager.save("shoes 2", FinishingSettings.createDefault());
		manager.save("bags", FinishingSettings.createDefault());

		assertEquals(Arrays.asList("default", "bags", "shoes 2", "shoes 10"), manager.list());
		assertTrue(manager.exists("shoes 10"));
		assertEquals(25, manager.load("shoes 10").getBackgroundCrop().getWhiteTolerance());
		assertThrows(IOException.class, () -> manager.load("missing"));
	}

	@Test
	public void test_sanitizeName() {
		assertEquals("mypreset", PresetManager.sanitizeName("my/preset?"));
		assertEquals("my preset", PresetManager.sanitizeName("my preset"));
		assertEquals("a-b_c", PresetManager.sanitizeName(" a-b_c. "));
		assertThrows(IllegalArgumentException.class, () -> PresetManager.sanitizeName("../"));
		assertThrows(IllegalArgumentException.class, () -> PresetManager.sanitizeName(null));
	}

	@Test
	public void test_renameAndDelete(@TempDir Path dir) throws IOException {
		var manager = new PresetManager(dir);
		manager.save("first", FinishingSettings.createDefault());
		manager.save("second", FinishingSettings.createDefault());

		assertThrows(IOException.class, () -> manager.rename("first", "second"));
		assertEquals("third", manager.rename("first", "third"));
		assertFalse(manager.exists("first"));
		assertTrue(manager.exists("third"));

		assertTrue(manager.delete("third"));
		assertFalse(manager.delete("third"));

		assertEquals(1, manager.deleteAllCustom());
		assertEquals(Arrays.asList("default"), manager.list());
	}

}
