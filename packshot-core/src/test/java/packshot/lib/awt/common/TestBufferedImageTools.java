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

package packshot.lib.awt.common;

import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNotSame;
import static org.junit.jupiter.api.Assertions.assertThrows;

import java.awt.image.BufferedImage;
import java.util.Arrays;

import org.junit.jupiter.api.Test;

import packshot.lib.common.ColorTools;
import packshot.lib.regions.Rect;

@SuppressWarnings("javadoc")
public class TestBufferedImageTools {

	@Test
	public void test_toArgb() {
		var rgb = new BufferedImage(4, 3, BufferedImage.TYPE_INT_RGB);
		rgb.setRGB(1, 1, ColorTools.packRGB(10, 20, 30));
		var argb = BufferedImageTools.toArgb(rgb);
		assertEquals(BufferedImage.TYPE_INT_ARGB, argb.getType());
		assertEquals(ColorTools.packRGB(10, 20, 30), argb.getRGB(1, 1));
		assertEquals(255, ColorTools.alpha(argb.getRGB(0, 0)));

		var copy = BufferedImageTools.toArgb(argb);
		assertNotSame(argb, copy);
		copy.setRGB(1, 1, ColorTools.WHITE);
		assertEquals(ColorTools.packRGB(10, 20, 30), argb.getRGB(1, 1));
	}

	@Test
	public void test_extract() {
		int red = ColorTools.packRGB(255, 0, 0);
		var img = BufferedImageTools.createArgb(10, 10, red);
		var region = BufferedImageTools.extract(img, Rect.createInstance(-2, 5, 6, 8), ColorTools.TRANSPARENT);
		assertEquals(6, region.getWidth());
		assertEquals(8, region.getHeight());
		assertEquals(ColorTools.TRANSPARENT, region.getRGB(0, 0));
		assertEquals(red, region.getRGB(2, 0));
		assertEquals(red, region.getRGB(5, 4));
		assertEquals(ColorTools.TRANSPARENT, region.getRGB(5, 5));
		assertThrows(IllegalArgumentException.class, () -> BufferedImageTools.extract(img, Rect.createInstance(0, 0), 0));
	}

	@Test
	public void test_flatten() {
		var img = BufferedImageTools.createArgb(2, 2, ColorTools.TRANSPARENT);
		img.setRGB(0, 0, ColorTools.packRGB(0, 0, 255));
		var flat = BufferedImageTools.flatten(img, ColorTools.packRGB(0, 255, 0));
		assertEquals(BufferedImage.TYPE_INT_RGB, flat.getType());
		assertEquals(ColorTools.packRGB(0, 0, 255), flat.getRGB(0, 0));
		assertEquals(ColorTools.packRGB(0, 255, 0), flat.getRGB(1, 1));
	}

	@Test
	public void test_resize() {
		var img = BufferedImageTools.createArgb(100, 50, ColorTools.packRGB(50, 100, 150));
		var smaller = BufferedImageTools.resize(img, 10, 5);
		assertEquals(10, smaller.getWidth());
		assertEquals(5, smaller.getHeight());
		assertEquals(ColorTools.packRGB(50, 100, 150), smaller.getRGB(3, 2));

		var larger = BufferedImageTools.resize(img, 200, 100);
		assertEquals(200, larger.getWidth());
		assertEquals(ColorTools.packRGB(50, 100, 150), larger.getRGB(100, 50));
		assertThrows(IllegalArgumentException.class, () -> BufferedImageTools.resize(img, 0, 10));
	}

	@Test
	public void test_resizeIgnoresTransparentColor() {
		var img = BufferedImageTools.createArgb(2, 1, ColorTools.TRANSPARENT);
		img.setRGB(0, 0, ColorTools.packRGB(200, 0, 0));
		var avg = BufferedImageTools.resize(img, 1, 1).getRGB(0, 0);
		assertEquals(200, ColorTools.red(avg));
		assertEquals(0, ColorTools.green(avg));
		assertEquals(128, ColorTools.alpha(avg), 1);
	}

	@Test
	public void test_resizeValues() {
		float[] values = new float[6 * 4];
		Arrays.fill(values, 0.4f);
		float[] original = values.clone();

		float[] smaller = BufferedImageTools.resize(values, 6, 4, 3, 2);
		assertEquals(6, smaller.length);
		for (float v : smaller)
			assertEquals(0.4f, v, 1e-5);

		float[] larger = BufferedImageTools.resize(values, 6, 4, 12, 8);
		assertEquals(96, larger.length);
		for (float v : larger)
			assertEquals(0.4f, v, 1e-5);

		assertArrayEquals(original, values);
		assertThrows(IllegalArgumentException.class, () -> BufferedImageTools.resize(values, 6, 4, 0, 2));
	}

	@Test
	public void test_fitWithin() {
		assertArrayEquals(new int[] {100, 50}, BufferedImageTools.fitWithin(100, 50, 0, 0));
		assertArrayEquals(new int[] {100, 50}, BufferedImageTools.fitWithin(100, 50, 200, 200));
		assertArrayEquals(new int[] {50, 25}, BufferedImageTools.fitWithin(100, 50, 50, 200));
		assertArrayEquals(new int[] {40, 20}, BufferedImageTools.fitWithin(100, 50, 50, 20));
		assertArrayEquals(new int[] {10, 1}, BufferedImageTools.fitWithin(1000, 1, 10, 10));
	}

}
