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

import packshot.lib.common.ColorTools;
import packshot.lib.settings.ToneSettings;

/**
 * Brightness and contrast factors applied to the color channels of an image.
 * <p>
 * Each channel is transformed as {@code clamp(clamp((v - 128) * contrast + 128) * brightness)}; alpha is unchanged.
 *
 * @param brightness brightness factor, 0-5
 * @param contrast contrast factor, 0-5
 *
 * @author PackShot developers
 */
public record ToneParams(double brightness, double contrast) {

	private static final ToneParams IDENTITY = new ToneParams(1.0, 1.0);

	/**
	 * Validate the factors.
	 * @throws IllegalArgumentException if either factor is outside the range 0-5
	 */
	public ToneParams {
		if (!(brightness >= 0 && brightness <= 5))
			throw new IllegalArgumentException("Brightness must be between 0 and 5! Requested brightness = " + brightness);
		if (!(contrast >= 0 && contrast <= 5))
			throw new IllegalArgumentException("Contrast must be between 0 and 5! Requested contrast = " + contrast);
	}

	/**
	 * Tone parameters that leave an image unchanged.
	 * @return
	 */
	public static ToneParams identity() {
		return IDENTITY;
	}

	/**
	 * Get tone parameters from settings; if disabled, this returns {@link #identity()}.
	 * @param settings
	 * @return
	 */
	public static ToneParams fromSettings(ToneSettings settings) {
		if (!settings.isEnableBc())
			return IDENTITY;
		return new ToneParams(settings.getBrightnessFactor(), settings.getContrastFactor());
	}

	/**
	 * Returns true if applying these parameters has no effect.
	 * @return
	 */
	public boolean isIdentity() {
		return brightness == 1.0 && contrast == 1.0;
	}

	/**
	 * Create a lookup table mapping input channel values to output values.
	 * @return an array of length 256
	 */
	public int[] createLut() {
		int[] lut = new int[256];
		for (int i = 0; i < 256; i++) {
			double v = ColorTools.do8BitRangeCheck((i - 128) * contrast + 128);
			lut[i] = ColorTools.do8BitRangeCheck(v * brightness);
		}
		return lut;
	}

	/**
	 * Apply the parameters to a packed ARGB value.
	 * @param argb
	 * @return
	 */
	public int apply(int argb) {
		int[] lut = createLut();
		return applyLut(argb, lut);
	}

	static int applyLut(int argb, int[] lut) {
		return ColorTools.packARGB(
				ColorTools.alpha(argb),
				lut[ColorTools.red(argb)],
				lut[ColorTools.green(argb)],
				lut[ColorTools.blue(argb)]);
	}

}
