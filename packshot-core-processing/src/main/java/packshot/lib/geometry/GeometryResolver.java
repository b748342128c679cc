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

package packshot.lib.geometry;

import java.awt.image.BufferedImage;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import packshot.lib.background.ColorClassifier;
import packshot.lib.background.Matte;
import packshot.lib.regions.Padding;
import packshot.lib.regions.Rect;
import packshot.lib.settings.PerimeterMode;

/**
 * Derive crop and pad rectangles from a matte.
 * <p>
 * Rectangles are always given in the coordinates of the source image.
 * A pad rectangle may extend beyond the source image when expansion is allowed.
 *
 * @author PackShot developers
 */
public final class GeometryResolver {

	private static final Logger logger = LoggerFactory.getLogger(GeometryResolver.class);

	// Suppressed default constructor for non-instantiability
	private GeometryResolver() {
		throw new AssertionError();
	}

	/**
	 * Resolve the crop window for a matte, without any perimeter check.
	 * @param matte
	 * @param options
	 * @return
	 */
	public static CropResult resolveCrop(Matte matte, CropOptions options) {
		return resolveCrop(matte, null, options);
	}

	/**
	 * Resolve the crop window for a matte.
	 * @param matte the matte; pixels with a confidence below {@link Matte#BACKGROUND_THRESHOLD} are foreground
	 * @param source the source image, used for the perimeter check; may be null only if the check is not needed
	 * @param options
	 * @return
	 */
	public static CropResult resolveCrop(Matte matte, BufferedImage source, CropOptions options) {
		int w = matte.getWidth();
		int h = matte.getHeight();
		var full = Rect.createInstance(w, h);

		if (!options.enabled())
			return new CropResult(full, Padding.empty(), false, true);

		if (options.perimeterMode() != PerimeterMode.ALWAYS) {
			if (source == null)
				throw new IllegalArgumentException("A source image is needed for perimeter mode " + options.perimeterMode());
			if (!options.perimeterMode().shouldRun(() -> ColorClassifier.isPerimeterWhite(source, options.perimeterTolerance(), 1))) {
				logger.debug("Crop skipped by perimeter check ({})", options.perimeterMode());
				return new CropResult(full, Padding.empty(), false, true);
			}
		}

		var bbox = foregroundBounds(matte);
		if (bbox.isEmpty()) {
			logger.warn("No foreground found in {}x{} image, the full image will be used", w, h);
			return new CropResult(full, Padding.empty(), true, false);
		}

		int left = bbox.getX();
		int right = w - bbox.getMaxX();
		int top = bbox.getY();
		int bottom = h - bbox.getMaxY();

		Rect rect;
		if (options.symmetricAbsolute()) {
			int m = Math.min(Math.min(left, right), Math.min(top, bottom));
			rect = Rect.fromBounds(m, m, w - m, h - m);
		} else if (options.symmetricAxes()) {
			int mx = Math.min(left, right);
			int my = Math.min(top, bottom);
			rect = Rect.fromBounds(mx, my, w - mx, h - my);
		} else
			rect = bbox;

		if (options.extraCropPercent() > 0)
			rect = shrink(rect, options.extraCropPercent());

		logger.trace("Resolved crop {} for {}x{} image", rect, w, h);
		return new CropResult(rect, Padding.between(full, rect), false, false);
	}

	/**
	 * Resolve the padded rectangle around a crop window.
	 * @param rect the crop window
	 * @param source bounds of the source image
	 * @param options
	 * @param perimeterImage image checked for a white perimeter, if required by the padding mode; may be null otherwise
	 * @return the padded (or inset) rectangle, or the input rectangle if no padding is applied
	 */
	public static Rect resolvePad(Rect rect, Rect source, PadOptions options, BufferedImage perimeterImage) {
		boolean apply = switch (options.mode()) {
			case NEVER -> false;
			case ALWAYS -> true;
			case IF_WHITE -> isPerimeterWhite(perimeterImage, options);
			case IF_NOT_WHITE -> !isPerimeterWhite(perimeterImage, options);
		};
		if (!apply || options.paddingPercent() == 0)
			return rect;

		int pad = (int)Math.round(options.paddingPercent() / 100.0 * Math.min(rect.getWidth(), rect.getHeight()));
		if (pad < 0) {
			int px = Math.min(-pad, (rect.getWidth() - 1) / 2);
			int py = Math.min(-pad, (rect.getHeight() - 1) / 2);
			return rect.inset(Padding.getPadding(px, py));
		}
		if (options.allowExpansion())
			return rect.pad(Padding.symmetric(pad));

		// Cap symmetrically to the space available within the source
		int padX = Math.max(0, Math.min(pad, Math.min(rect.getX() - source.getX(), source.getMaxX() - rect.getMaxX())));
		int padY = Math.max(0, Math.min(pad, Math.min(rect.getY() - source.getY(), source.getMaxY() - rect.getMaxY())));
		if (padX < pad || padY < pad)
			logger.debug("Padding of {} px capped to ({}, {}) px to remain within the source image", pad, padX, padY);
		return rect.pad(Padding.getPadding(padX, padY));
	}

	/**
	 * Get the bounding box of all foreground pixels.
	 * @param matte
	 * @return the bounding box, or an empty rectangle if there is no foreground
	 */
	public static Rect foregroundBounds(Matte matte) {
		int w = matte.getWidth();
		int h = matte.getHeight();
		int minX = w, minY = h, maxX = -1, maxY = -1;
		for (int y = 0; y < h; y++) {
			for (int x = 0; x < w; x++) {
				if (!matte.isBackground(x, y)) {
					if (x < minX)
						minX = x;
					if (x > maxX)
						maxX = x;
					if (y < minY)
						minY = y;
					maxY = y;
				}
			}
		}
		if (maxX < 0)
			return Rect.createInstance(0, 0, 0, 0);
		return Rect.fromBounds(minX, minY, maxX + 1, maxY + 1);
	}

	private static Rect shrink(Rect rect, double percent) {
		int dx = Math.min(rect.getWidth() - 1, (int)Math.round(rect.getWidth() * percent / 100.0));
		int dy = Math.min(rect.getHeight() - 1, (int)Math.round(rect.getHeight() * percent / 100.0));
		return rect.inset(Padding.getPadding(dx / 2, dx - dx / 2, dy / 2, dy - dy / 2));
	}

	private static boolean isPerimeterWhite(BufferedImage img, PadOptions options) {
		if (img == null)
			throw new IllegalArgumentException("An image is needed for padding mode " + options.mode());
		return ColorClassifier.isPerimeterWhite(img, options.perimeterTolerance(), options.perimeterMargin());
	}

}
