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
import java.io.Reader;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.google.gson.JsonElement;
import com.google.gson.JsonObject;
import com.google.gson.JsonParseException;
import com.google.gson.JsonParser;

import packshot.lib.io.GsonTools;

/**
 * Read and write {@link FinishingSettings} as JSON.
 * <p>
 * Settings files may be partial: any section or key that is missing takes its default value.
 *
 * @author PackShot developers
 */
public class SettingsIO {

	private static final Logger logger = LoggerFactory.getLogger(SettingsIO.class);

	// Suppressed default constructor for non-instantiability
	private SettingsIO() {
		throw new AssertionError();
	}

	/**
	 * Load settings from a file.
	 * <p>
	 * If the file does not exist, cannot be parsed or contains invalid values, a warning is logged
	 * and the default settings are returned instead.
	 *
	 * @param path
	 * @return validated settings
	 */
	public static FinishingSettings load(Path path) {
		if (path == null || !Files.isRegularFile(path)) {
			logger.warn("Settings file {} not found, using defaults", path);
			return FinishingSettings.createDefault();
		}
		try {
			return read(path);
		} catch (IOException | JsonParseException | IllegalStateException e) {
			logger.warn("Unable to read settings from {}, using defaults: {}", path, e.getMessage());
			logger.debug(e.getMessage(), e);
		} catch (IllegalArgumentException e) {
			logger.warn("Invalid settings in {}, using defaults: {}", path, e.getMessage());
		}
		return FinishingSettings.createDefault();
	}

	/**
	 * Read settings from a file, without falling back to defaults if the file is invalid.
	 * @param path
	 * @return validated settings
	 * @throws IOException if the file cannot be read
	 * @throws JsonParseException if the file does not contain valid JSON
	 * @throws IllegalArgumentException if any setting is outside its permitted range
	 */
	public static FinishingSettings read(Path path) throws IOException {
		try (Reader reader = Files.newBufferedReader(path, StandardCharsets.UTF_8)) {
			JsonElement element = JsonParser.parseReader(reader);
			return fromJson(element);
		}
	}

	/**
	 * Parse settings from a JSON string.
	 * @param json
	 * @return validated settings
	 * @throws JsonParseException if the string is not a JSON object
	 * @throws IllegalArgumentException if any setting is outside its permitted range
	 */
	public static FinishingSettings fromJson(String json) {
		return fromJson(JsonParser.parseString(json));
	}

	private static FinishingSettings fromJson(JsonElement element) {
		if (element == null || !element.isJsonObject())
			throw new JsonParseException("Settings must be a JSON object");
		var gson = GsonTools.getInstance();
		JsonObject defaults = gson.toJsonTree(FinishingSettings.createDefault()).getAsJsonObject();
		JsonObject merged = GsonTools.mergeRecursive(defaults, element.getAsJsonObject());
		return gson.fromJson(merged, FinishingSettings.class).validate();
	}

	/**
	 * Convert settings to a pretty-printed JSON string.
	 * @param settings
	 * @return
	 */
	public static String toJson(FinishingSettings settings) {
		return GsonTools.getInstance(true).toJson(settings);
	}

	/**
	 * Write settings to a file, creating any parent directories.
	 * @param settings
	 * @param path
	 * @throws IOException
	 */
	public static void save(FinishingSettings settings, Path path) throws IOException {
		var parent = path.toAbsolutePath().getParent();
		if (parent != null)
			Files.createDirectories(parent);
		try (Writer writer = Files.newBufferedWriter(path, StandardCharsets.UTF_8)) {
			GsonTools.getInstance(true).toJson(settings, writer);
		}
		logger.debug("Settings written to {}", path);
	}

}
