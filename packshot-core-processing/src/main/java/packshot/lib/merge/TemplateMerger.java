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

package packshot.lib.merge;

import java.awt.image.BufferedImage;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import packshot.lib.awt.common.BufferedImageTools;
import packshot.lib.common.ColorTools;
import packshot.lib.settings.Anchor;
import packshot.lib.settings.MergeSettings;

/**
 * Overlay a decorative template onto a finished image or collage.
 * <p>
 * The template is resized independently along each axis to a percentage of the base size, positioned
 * using an {@link Anchor}, and alpha-blended with its own alpha multiplied by the opacity.
 * Neither input image is modified.
 *
 * @author PackShot developers
 */
public final class TemplateMerger {

	private static final Logger logger = LoggerFactory.getLogger(TemplateMerger.class);

	// Suppressed default constructor for non-instantiability
	private TemplateMerger() {
		throw new AssertionError();
	}

	/**
	 * Merge using the values in merge settings.
	 * @param base
	 * @param template
	 * @param settings
	 * @return
	 */
	public static BufferedImage merge(BufferedImage base, BufferedImage template, MergeSettings settings) {
		return merge(base, template, settings.getPosition(),
				settings.getTemplateWidthPercent(), settings.getTemplateHeightPercent(),
				settings.getOpacityPercent(), settings.isTemplateOnTop());
	}

	/**
	 * Merge a template on top of a base image.
	 * @param base
	 * @param template
	 * @param anchor
	 * @param widthPercent template width as a percentage of the base width, or 0 to keep the template width
	 * @param heightPercent template height as a percentage of the base height, or 0 to keep the template height
	 * @param opacityPercent 0-100
	 * @return
	 */
	public static BufferedImage merge(BufferedImage base, BufferedImage template, Anchor anchor,
			double widthPercent, double heightPercent, double opacityPercent) {
		return merge(base, template, anchor, widthPercent, heightPercent, opacityPercent, true);
	}

	/**
	 * Merge a template with a base image.
	 * @param base
	 * @param template
	 * @param anchor
	 * @param widthPercent template width as a percentage of the base width, or 0 to keep the template width
	 * @param heightPercent template height as a percentage of the base height, or 0 to keep the template height
	 * @param opacityPercent 0-100
	 * @param templateOnTop if true, the template is drawn over the base; otherwise the base is drawn over the template
	 * @return a new {@code TYPE_INT_ARGB} image with the size of the base
	 */
	public static BufferedImage merge(BufferedImage base, BufferedImage template, Anchor anchor,
			double widthPercent, double heightPercent, double opacityPercent, boolean templateOnTop) {
		if (!(opacityPercent >= 0 && opacityPercent <= 100))
			throw new IllegalArgumentException("Opacity must be between 0 and 100! Requested opacity = " + opacityPercent);
		if (widthPercent < 0 || heightPercent < 0)
			throw new IllegalArgumentException("Template size percentages must be >= 0! Requested " + widthPercent + "% x " + heightPercent + "%");

		int w = base.getWidth();
		int h = base.getHeight();
		int tw = widthPercent > 0 ? Math.max(1, (int)Math.round(w * widthPercent / 100.0)) : template.getWidth();
		int th = heightPercent > 0 ? Math.max(1, (int)Math.round(h * heightPercent / 100.0)) : template.getHeight();
		var resized = BufferedImageTools.resize(template, tw, th);

		int x0 = anchor.getX(w, tw);
		int y0 = anchor.getY(h, th);
		logger.debug("Merging {}x{} template at ({}, {}) with opacity {}%", tw, th, x0, y0, opacityPercent);

		int[] pixels = BufferedImageTools.getPixels(base);
		int[] templatePixels = BufferedImageTools.getPixels(resized);
		double opacity = opacityPercent / 100.0;
		for (int ty = 0; ty < th; ty++) {
			int y = y0 + ty;
			if (y < 0 || y >= h)
				continue;
			for (int tx = 0; tx < tw; tx++) {
				int x = x0 + tx;
				if (x < 0 || x >= w)
					continue;
				int t = templatePixels[ty * tw + tx];
				double a = ColorTools.alpha(t) / 255.0 * opacity;
				if (a == 0)
					continue;
				int i = y * w + x;
				if (templateOnTop) {
					pixels[i] = blend(t, a, pixels[i], ColorTools.alpha(pixels[i]) / 255.0);
				} else {
					int b = pixels[i];
					pixels[i] = blend(b, ColorTools.alpha(b) / 255.0, t, a);
				}
			}
		}
		return BufferedImageTools.createArgb(pixels, w, h);
	}

	/**
	 * Source-over compositing of non-premultiplied colors, with explicit alpha values.
	 */
	static int blend(int upper, double upperAlpha, int lower, double lowerAlpha) {
		double outA = upperAlpha + lowerAlpha * (1 - upperAlpha);
		if (outA <= 0)
			return ColorTools.TRANSPARENT;
		double wl = lowerAlpha * (1 - upperAlpha);
		return ColorTools.packClippedARGB(
				(int)Math.round(outA * 255),
				(int)Math.round((ColorTools.red(upper) * upperAlpha + ColorTools.red(lower) * wl) / outA),
				(int)Math.round((ColorTools.green(upper) * upperAlpha + ColorTools.green(lower) * wl) / outA),
				(int)Math.round((ColorTools.blue(upper) * upperAlpha + ColorTools.blue(lower) * wl) / outA));
	}

}
