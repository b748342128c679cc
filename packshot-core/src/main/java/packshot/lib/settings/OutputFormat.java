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

import com.google.gson.annotations.SerializedName;

/**
 * Supported output formats for finished images.
 */
public enum OutputFormat {

	/**
	 * JPEG, without transparency.
	 */
	@SerializedName(value = "jpg", alternate = {"jpeg"})
	JPG("jpg", ".jpg", false),

	/**
	 * PNG, optionally with transparency.
	 */
	@SerializedName("png")
	PNG("png", ".png", true);

	private final String formatName;
	private final String extension;
	private final boolean supportsAlpha;

	OutputFormat(String formatName, String extension, boolean supportsAlpha) {
		this.formatName = formatName;
		this.extension = extension;
		this.supportsAlpha = supportsAlpha;
	}

	/**
	 * Get the informal format name, as understood by {@link javax.imageio.ImageIO}.
	 * @return
	 */
	public String getFormatName() {
		return formatName;
	}

	/**
	 * Get the file extension, including the dot.
	 * @return
	 */
	public String getExtension() {
		return extension;
	}

	/**
	 * Returns true if the format can store an alpha channel.
	 * @return
	 */
	public boolean supportsAlpha() {
		return supportsAlpha;
	}

}
