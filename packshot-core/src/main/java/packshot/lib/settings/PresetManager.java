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

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.stream.Collectors;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import packshot.lib.common.GeneralTools;

/**
 * Manage named settings presets, stored as JSON files in a single directory.
 * <p>
 * A preset called {@value #DEFAULT_PRESET_NAME} always exists; it is created on demand with the
 * default settings, and cannot be deleted or renamed.
 *
 * @author PackShot developers
 */
public class PresetManager {

	private static final Logger logger = LoggerFactory.getLogger(PresetManager.class);

	/**
	 * Name of the preset that holds the default settings.
	 */
	public static final String DEFAULT_PRESET_NAME = "default";

	private static final String EXT = ".json";

	private final Path directory;

	/**
	 * Create a preset manager for the specified directory.
	 * The directory is created when it is first needed.
	 * @param directory
	 */
	public PresetManager(Path directory) {
		this.directory = directory;
	}

	/**
	 * Get the directory containing the presets.
	 * @return
	 */
	public Path getDirectory() {
		return directory;
	}

	/**
	 * Convert a preset name to a name that is safe to use as a file name.
	 * Only letters, digits, spaces, underscores and hyphens are retained.
	 * @param name
	 * @return the sanitized name
	 * @throws IllegalArgumentException if nothing remains after sanitizing
	 */
	public static String sanitizeName(String name) {
		if (name == null)
			throw new IllegalArgumentException("Preset name must not be null");
		String safe = name.codePoints()
				.filter(c -> Character.isLetterOrDigit(c) || c == ' ' || c == '_' || c == '-')
				.collect(StringBuilder::new, StringBuilder::appendCodePoint, StringBuilder::append)
				.toString()
				.strip();
		if (safe.isEmpty())
			throw new IllegalArgumentException("Invalid preset name: '" + name + "'");
		return safe;
	}

	/**
	 * Get the names of all available presets, with the default preset first and the rest in natural order.
	 * @return
	 * @throws IOException
	 */
	public List<String> list() throws IOException {
		ensureDefaultPreset();
		List<String> names;
		try (var stream = Files.list(directory)) {
			names = stream
					.filter(p -> Files.isRegularFile(p) && p.getFileName().toString().toLowerCase().endsWith(EXT))
					.map(p -> GeneralTools.getNameWithoutExtension(p.getFileName().toString()))
					.filter(n -> !DEFAULT_PRESET_NAME.equals(n))
					.sorted(GeneralTools.smartStringComparator())
					.collect(Collectors.toCollection(ArrayList::new));
		}
		names.add(0, DEFAULT_PRESET_NAME);
		return names;
	}

	/**
	 * Returns true if a preset with the specified name exists.
	 * @param name
	 * @return
	 */
	public boolean exists(String name) {
		return Files.isRegularFile(getPath(name));
	}

	/**
	 * Save settings as a preset, replacing any existing preset with the same name.
	 * @param name
	 * @param settings
	 * @return the name under which the preset was saved, after sanitizing
	 * @throws IOException
	 */
	public String save(String name, FinishingSettings settings) throws IOException {
		String safe = sanitizeName(name);
		SettingsIO.save(settings, getPath(safe));
		logger.info("Saved preset '{}'", safe);
		return safe;
	}

	/**
	 * Load the settings for a preset.
	 * @param name
	 * @return the validated settings
	 * @throws IOException if the preset does not exist or cannot be read
	 */
	public FinishingSettings load(String name) throws IOException {
		if (DEFAULT_PRESET_NAME.equals(sanitizeName(name)))
			ensureDefaultPreset();
		var path = getPath(name);
		if (!Files.isRegularFile(path))
			throw new IOException("Preset '" + name + "' not found in " + directory);
		return SettingsIO.read(path);
	}

	/**
	 * Delete a preset.
	 * @param name
	 * @return true if the preset existed and was deleted
	 * @throws IOException
	 * @throws IllegalArgumentException if the name refers to the default preset
	 */
	public boolean delete(String name) throws IOException {
		String safe = sanitizeName(name);
		if (DEFAULT_PRESET_NAME.equals(safe))
			throw new IllegalArgumentException("The default preset cannot be deleted");
		boolean deleted = Files.deleteIfExists(getPath(safe));
		if (deleted)
			logger.info("Deleted preset '{}'", safe);
		else
			logger.warn("Preset '{}' not found, nothing deleted", safe);
		return deleted;
	}

	/**
	 * Rename a preset.
	 * @param oldName
	 * @param newName
	 * @return the new name, after sanitizing
	 * @throws IOException if the preset does not exist, or a preset with the new name already exists
	 * @throws IllegalArgumentException if either name refers to the default preset
	 */
	public String rename(String oldName, String newName) throws IOException {
		String safeOld = sanitizeName(oldName);
		String safeNew = sanitizeName(newName);
		if (DEFAULT_PRESET_NAME.equals(safeOld) || DEFAULT_PRESET_NAME.equals(safeNew))
			throw new IllegalArgumentException("The default preset cannot be renamed or replaced");
		var source = getPath(safeOld);
		if (!Files.isRegularFile(source))
			throw new IOException("Preset '" + oldName + "' not found in " + directory);
		var target = getPath(safeNew);
		if (Files.exists(target))
			throw new IOException("Preset '" + safeNew + "' already exists");
		Files.move(source, target);
		logger.info("Renamed preset '{}' to '{}'", safeOld, safeNew);
		return safeNew;
	}

	/**
	 * Delete all presets except the default.
	 * @return the number of presets deleted
	 * @throws IOException
	 */
	public int deleteAllCustom() throws IOException {
		int count = 0;
		for (String name : list()) {
			if (!DEFAULT_PRESET_NAME.equals(name) && delete(name))
				count++;
		}
		logger.info("Deleted {} custom preset(s)", count);
		return count;
	}

	private void ensureDefaultPreset() throws IOException {
		Files.createDirectories(directory);
		var path = getPath(DEFAULT_PRESET_NAME);
		if (!Files.exists(path)) {
			SettingsIO.save(FinishingSettings.createDefault(), path);
			logger.info("Created default preset in {}", directory);
		}
	}

	private Path getPath(String name) {
		return directory.resolve(sanitizeName(name) + EXT);
	}

}
