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

package packshot.lib.compose;

import java.awt.image.BufferedImage;

import packshot.lib.awt.common.BufferedImageTools;
import packshot.lib.common.ColorTools;
import packshot.lib.settings.CollageModeSettings;
import packshot.lib.settings.IndividualModeSettings;
import packshot.lib.settings.OutputFormat;

/**
 * Prepare a finished image for encoding in a specific output format.
 * <p>
 * Formats without alpha support are always flattened onto a background color.
 *
 * @param format the output format
 * @param keepTransparency true if transparency should be retained, where the format supports it
 * @param background packed RGB background for flattening
 *
 * @author PackShot developers
 */
public record OutputPreparation(OutputFormat format, boolean keepTransparency, int background) {

	/**
	 * Get the preparation for individual images.
	 * @param settings
	 * @return
	 */
	public static OutputPreparation fromSettings(IndividualModeSettings settings) {
		var format = settings.getOutputFormat();
		if (format == OutputFormat.PNG)
			return new OutputPreparation(format, settings.isPngTransparentBackground(), ColorTools.packRGB(settings.getPngBackgroundColor()));
		return new OutputPreparation(format, false, ColorTools.packRGB(settings.getJpgBackgroundColor()));
	}

	/**
	 * Get the preparation for collages. Collage PNGs keep their transparency.
	 * @param settings
	 * @return
	 */
	public static OutputPreparation fromSettings(CollageModeSettings settings) {
		var format = settings.getOutputFormat();
		return new OutputPreparation(format, format.supportsAlpha(), ColorTools.packRGB(settings.getJpgBackgroundColor()));
	}

	/**
	 * Returns true if the prepared image will have an alpha channel.
	 * @return
	 */
	public boolean retainsAlpha() {
		return keepTransparency && format.supportsAlpha();
	}

	/**
	 * Get the value used to fill new canvas areas before preparation: transparent if alpha is retained,
	 * otherwise the opaque background color.
	 * @return
	 */
	public int getCanvasFill() {
		return retainsAlpha() ? ColorTools.TRANSPARENT : ColorTools.withAlpha(background, 255);
	}

	/**
	 * Prepare an image for writing.
	 * @param img
	 * @return the input image if alpha is retained, otherwise a new opaque image
	 */
	public BufferedImage prepare(BufferedImage img) {
		if (retainsAlpha())
			return img;
		return BufferedImageTools.flatten(img, background);
	}

}
