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
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Optional;

/**
 * The result of compositing: the finished image, an optional separate mask, and any warnings raised on the way.
 *
 * @author PackShot developers
 */
public class FinishedImage {

	private final BufferedImage image;
	private final BufferedImage mask;
	private final List<String> warnings;

	FinishedImage(BufferedImage image, BufferedImage mask, List<String> warnings) {
		this.image = image;
		this.mask = mask;
		this.warnings = Collections.unmodifiableList(warnings);
	}

	/**
	 * Get the finished image.
	 * @return
	 */
	public BufferedImage getImage() {
		return image;
	}

	/**
	 * Get the grey background mask, if one was requested instead of transparency.
	 * Background is black and foreground white; the mask has the same dimensions as the image.
	 * @return
	 */
	public Optional<BufferedImage> getMask() {
		return Optional.ofNullable(mask);
	}

	/**
	 * Get an unmodifiable list of warnings.
	 * @return
	 */
	public List<String> getWarnings() {
		return warnings;
	}

	/**
	 * Create a copy with a different image, retaining the mask and warnings.
	 * @param image
	 * @return
	 */
	public FinishedImage withImage(BufferedImage image) {
		return new FinishedImage(image, mask, warnings);
	}

	/**
	 * Create a copy with additional warnings, which are listed before the existing warnings.
	 * @param extra
	 * @return
	 */
	public FinishedImage withWarnings(List<String> extra) {
		if (extra.isEmpty())
			return this;
		var combined = new ArrayList<String>(extra);
		combined.addAll(warnings);
		return new FinishedImage(image, mask, combined);
	}

	@Override
	public String toString() {
		return "FinishedImage (" + image.getWidth() + "x" + image.getHeight() + (mask == null ? "" : ", with mask") + ", warnings=" + warnings.size() + ")";
	}

}
