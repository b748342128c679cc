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

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.awt.image.BufferedImage;
import java.util.Arrays;

import org.junit.jupiter.api.Test;

import packshot.lib.awt.common.BufferedImageTools;
import packshot.lib.background.Matte;
import packshot.lib.common.ColorTools;
import packshot.lib.regions.Rect;

@SuppressWarnings("javadoc")
public class TestCompositor {

	private static final int RED = ColorTools.packRGB(200, 20, 20);

	/**
	 * Create a 40x30 white image with a red subject at (10, 5, 20, 10), and the corresponding matte.
	 */
	private static BufferedImage createImage() {
		var img = BufferedImageTools.createArgb(40, 30, ColorTools.WHITE);
		for (int y = 5; y < 15; y++) {
			for (int x = 10; x < 30; x++)
				img.setRGB(x, y, RED);
		}
		return img;
	}

	private static Matte createMatte() {
		float[] values = new float[40 * 30];
		Arrays.fill(values, 1f);
		for (int y = 5; y < 15; y++) {
			for (int x = 10; x < 30; x++)
				values[y * 40 + x] = 0f;
		}
		return Matte.create(values, 40, 30);
	}

	@Test
	public void test_transparentBackground() {
		var compositor = Compositor.builder().build();
		var crop = Rect.createInstance(10, 5, 20, 10);
		var pad = Rect.createInstance(8, 3, 24, 14);
		var finished = compositor.compose(createImage(), createMatte(), crop, pad);
		var img = finished.getImage();
		assertEquals(24, img.getWidth());
		assertEquals(14, img.getHeight());
		assertEquals(RED, img.getRGB(2, 2));
		// Padding is filled, not copied from the source
		assertEquals(ColorTools.TRANSPARENT, img.getRGB(0, 0));
		assertFalse(finished.getMask().isPresent());
		assertTrue(finished.getWarnings().isEmpty());
	}

	@Test
	public void test_matteAppliedToAlpha() {
		var compositor = Compositor.builder().build();
		var full = Rect.createInstance(40, 30);
		var img = compositor.compose(createImage(), createMatte(), full, null).getImage();
		assertEquals(0, ColorTools.alpha(img.getRGB(0, 0)));
		assertEquals(255, ColorTools.alpha(img.getRGB(15, 10)));
	}

	@Test
	public void test_maskMode() {
		var compositor = Compositor.builder().useMask(true).fill(ColorTools.WHITE).build();
		var crop = Rect.createInstance(5, 0, 30, 20);
		var pad = Rect.createInstance(3, -2, 34, 24);
		var finished = compositor.compose(createImage(), createMatte(), crop, pad);

		var img = finished.getImage();
		assertEquals(ColorTools.WHITE, img.getRGB(0, 0));
		assertEquals(255, ColorTools.alpha(img.getRGB(4, 4)));

		var mask = finished.getMask().orElseThrow();
		assertEquals(BufferedImage.TYPE_BYTE_GRAY, mask.getType());
		assertEquals(34, mask.getWidth());
		assertEquals(24, mask.getHeight());
		// Subject is white in the mask, background and padding are black
		assertEquals(255, mask.getRaster().getSample(10, 10, 0));
		assertEquals(0, mask.getRaster().getSample(3, 3, 0));
		assertEquals(0, mask.getRaster().getSample(0, 0, 0));
	}

	@Test
	public void test_degenerateMatteWarning() {
		float[] values = new float[40 * 30];
		Arrays.fill(values, 1f);
		var finished = Compositor.builder().build().compose(createImage(), Matte.create(values, 40, 30), Rect.createInstance(40, 30), null);
		assertEquals(1, finished.getWarnings().size());
	}

	@Test
	public void test_sizeMismatch() {
		var matte = Matte.create(new float[10 * 10], 10, 10);
		assertThrows(IllegalArgumentException.class, () ->
				Compositor.builder().build().compose(createImage(), matte, Rect.createInstance(10, 10), null));
	}

	@Test
	public void test_sizing() {
		var sizing = OutputSizing.builder()
				.forceAspectRatio(1, 1)
				.maxDimensions(10, 10)
				.build();
		var compositor = Compositor.builder().fill(ColorTools.WHITE).sizing(sizing).build();
		var img = compositor.compose(createImage(), null, Rect.createInstance(10, 5, 20, 10), null).getImage();
		assertEquals(10, img.getWidth());
		assertEquals(10, img.getHeight());

		var exact = OutputSizing.builder().forceAspectRatio(4, 3).exactDimensions(80, 60).build();
		var img2 = Compositor.builder().sizing(exact).build().compose(createImage(), null, Rect.createInstance(40, 30), null).getImage();
		assertEquals(80, img2.getWidth());
		assertEquals(60, img2.getHeight());
	}

	@Test
	public void test_forceAspectRatio() {
		var img = BufferedImageTools.createArgb(20, 10, RED);
		var square = Compositor.forceAspectRatio(img, 1.0, ColorTools.WHITE);
		assertEquals(20, square.getWidth());
		assertEquals(20, square.getHeight());
		assertEquals(ColorTools.WHITE, square.getRGB(10, 0));
		assertEquals(RED, square.getRGB(10, 10));
		assertSame(img, Compositor.forceAspectRatio(img, 2.0, ColorTools.WHITE));

		var wide = Compositor.forceAspectRatio(img, 3.0, ColorTools.WHITE);
		assertEquals(30, wide.getWidth());
		assertEquals(10, wide.getHeight());
	}

	@Test
	public void test_tone() {
		var tone = new ToneParams(1.0, 2.0);
		assertFalse(tone.isIdentity());
		assertTrue(ToneParams.identity().isIdentity());
		int[] lut = tone.createLut();
		assertEquals(128, lut[128]);
		assertEquals(255, lut[200]);
		assertEquals(0, lut[50]);

		int bright = new ToneParams(2.0, 1.0).apply(ColorTools.packARGB(100, 10, 60, 200));
		assertEquals(100, ColorTools.alpha(bright));
		assertEquals(20, ColorTools.red(bright));
		assertEquals(120, ColorTools.green(bright));
		assertEquals(255, ColorTools.blue(bright));

		assertThrows(IllegalArgumentException.class, () -> new ToneParams(6, 1));
		assertThrows(IllegalArgumentException.class, () -> new ToneParams(1, -1));
	}

}
