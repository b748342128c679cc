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

package packshot.lib.io;

import java.util.Map;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.google.gson.FieldNamingPolicy;
import com.google.gson.Gson;
import com.google.gson.GsonBuilder;
import com.google.gson.JsonElement;
import com.google.gson.JsonObject;

/**
 * Helper class providing Gson instances configured for PackShot settings files.
 * <p>
 * Java field names are written in {@code lower_case_with_underscores}, and parsing is lenient
 * so that hand-edited settings files with minor issues (e.g. comments) can still be read.
 *
 * @author PackShot developers
 *
 */
public class GsonTools {

	private static final Logger logger = LoggerFactory.getLogger(GsonTools.class);

	private static GsonBuilder builder = new GsonBuilder()
			.serializeSpecialFloatingPointValues()
			.setFieldNamingPolicy(FieldNamingPolicy.LOWER_CASE_WITH_UNDERSCORES)
			.disableHtmlEscaping()
			.setLenient();

	/**
	 * Access the builder used with {@link #getInstance()}.
	 * <p>
	 * To create a derived builder that inherits from the default but does not change it,
	 * use {@code GsonTools.getInstance().newBuilder()}.
	 *
	 * @return
	 */
	public static GsonBuilder getDefaultBuilder() {
		logger.trace("Requesting GsonBuilder from {}", Thread.currentThread().getStackTrace()[0]);
		return builder;
	}

	/**
	 * Get default Gson instance.
	 * @return
	 */
	public static Gson getInstance() {
		return builder.create();
	}

	/**
	 * Get default Gson, optionally with pretty printing enabled.
	 *
	 * @param pretty if true, write using pretty-printing (i.e. more whitespace for formatting)
	 * @return
	 *
	 * @see #getInstance()
	 */
	public static Gson getInstance(boolean pretty) {
		if (pretty)
			return getInstance().newBuilder().setPrettyPrinting().create();
		return getInstance();
	}

	/**
	 * Merge one JSON object into another, recursively.
	 * <p>
	 * Members of {@code overlay} replace those of {@code base}, except where both are JSON objects;
	 * in that case they are merged in turn. Members of {@code base} that are missing from {@code overlay}
	 * are retained. Neither input is modified.
	 *
	 * @param base
	 * @param overlay
	 * @return a new merged object
	 */
	public static JsonObject mergeRecursive(JsonObject base, JsonObject overlay) {
		JsonObject result = base.deepCopy();
		for (Map.Entry<String, JsonElement> entry : overlay.entrySet()) {
			String key = entry.getKey();
			JsonElement value = entry.getValue();
			JsonElement existing = result.get(key);
			if (existing != null && existing.isJsonObject() && value != null && value.isJsonObject()) {
				result.add(key, mergeRecursive(existing.getAsJsonObject(), value.getAsJsonObject()));
			} else {
				if (existing == null)
					logger.debug("Unknown settings key '{}' will be ignored", key);
				result.add(key, value == null ? null : value.deepCopy());
			}
		}
		return result;
	}

}
