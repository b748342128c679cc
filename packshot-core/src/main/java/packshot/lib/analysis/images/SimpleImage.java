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

package packshot.lib.analysis.images;

/**
 * A minimal interface to define a means to provide access to pixel values from a 2D, 1-channel image.
 * <p>
 * This is used for mattes, masks and other intermediate single-channel results that do not need
 * the overhead of a {@link java.awt.image.BufferedImage}.
 * 
 * @author PackShot developers
 *
 */
public interface SimpleImage {

	/**
	 * Get the value of a single pixel.
	 * @param x x-coordinate of the pixel
	 * @param y y-coordinate of the pixel
	 * @return
	 */
	float getValue(int x, int y);

	/**
	 * Get the image width.
	 * @return
	 */
	int getWidth();

	/**
	 * Get the image height.
	 * @return
	 */
	int getHeight();

}
