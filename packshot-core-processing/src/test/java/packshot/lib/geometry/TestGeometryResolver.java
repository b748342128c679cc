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

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.Arrays;

import org.junit.jupiter.api.Test;

import packshot.lib.awt.common.BufferedImageTools;
import packshot.lib.background.Matte;
import packshot.lib.common.ColorTools;
import packshot.lib.regions.Rect;
import packshot.lib.settings.PaddingMode;
import packshot.lib.settings.PerimeterMode;

@SuppressWarnings("javadoc")
public class TestGeometryResolver {

	/**
	 * Create a matte that is background everywhere except within a rectangle.
	 */
	static Matte createMatte(int width, int height, Rect foreground) {
		float[] values = new float[width * height];
		Arrays.fill(values, 1f);
		for (int y = foreground.getY(); y < foreground.getMaxY(); y++) {
			for (int x = foreground.getX(); x < foreground.getMaxX(); x++)
				values[y * width + x] = 0f;
		}
		return Matte.create(values, width, height);
	}

	@Test
	public void test_tightCrop() {
		var fg = Rect.createInstance(10, 20, 30, 15);
		var result = GeometryResolver.resolveCrop(createMatte(100, 60, fg), CropOptions.tight());
		assertEquals(fg, result.getRect());
		assertFalse(result.isDegenerate());
		assertFalse(result.isSkipped());
		assertEquals(10, result.getMargins().getX1());
		assertEquals(60, result.getMargins().getX2());
		assertEquals(20, result.getMargins().getY1());
		assertEquals(25, result.getMargins().getY2());
	}

	@Test
	public void test_symmetricAxes() {
		var matte = createMatte(100, 60, Rect.createInstance(10, 20, 30, 15));
		var options = new CropOptions(true, false, true, 0, PerimeterMode.ALWAYS, 0);
		var rect = GeometryResolver.resolveCrop(matte, options).getRect();
		// Left/right margins are both min(10, 60), top/bottom both min(20, 25)
		assertEquals(Rect.fromBounds(10, 20, 90, 40), rect);
		assertEquals(rect.getX(), 100 - rect.getMaxX());
		assertEquals(rect.getY(), 60 - rect.getMaxY());
	}

	@Test
	public void test_symmetricAbsolute() {
		var matte = createMatte(100, 60, Rect.createInstance(10, 20, 30, 15));
		var options = new CropOptions(true, true, false, 0, PerimeterMode.ALWAYS, 0);
		assertEquals(Rect.fromBounds(10, 10, 90, 50), GeometryResolver.resolveCrop(matte, options).getRect());
	}

	@Test
	public void test_extraCrop() {
		var matte = createMatte(200, 200, Rect.createInstance(50, 50, 100, 40));
		var options = new CropOptions(true, false, false, 10, PerimeterMode.ALWAYS, 0);
		var rect = GeometryResolver.resolveCrop(matte, options).getRect();
		assertEquals(Rect.createInstance(55, 52, 90, 36), rect);
		assertThrows(IllegalArgumentException.class, () -> new CropOptions(true, false, false, 60, null, 0));
	}

	@Test
	public void test_emptyForegroundIsDegenerate() {
		float[] values = new float[50 * 30];
		Arrays.fill(values, 1f);
		var result = GeometryResolver.resolveCrop(Matte.create(values, 50, 30), CropOptions.tight());
		assertTrue(result.isDegenerate());
		assertEquals(Rect.createInstance(50, 30), result.getRect());
		assertTrue(result.getMargins().isEmpty());
	}

	@Test
	public void test_cropDisabled() {
		var matte = createMatte(40, 40, Rect.createInstance(10, 10, 5, 5));
		var result = GeometryResolver.resolveCrop(matte, new CropOptions(false, false, false, 0, null, 0));
		assertTrue(result.isSkipped());
		assertEquals(Rect.createInstance(40, 40), result.getRect());
	}

	@Test
	public void test_cropPerimeterGate() {
		var matte = createMatte(40, 40, Rect.createInstance(10, 10, 5, 5));
		var white = BufferedImageTools.createArgb(40, 40, ColorTools.WHITE);
		var grey = BufferedImageTools.createArgb(40, 40, ColorTools.packRGB(128, 128, 128));
		var options = new CropOptions(true, false, false, 0, PerimeterMode.IF_WHITE, 10);

		assertFalse(GeometryResolver.resolveCrop(matte, white, options).isSkipped());
		assertTrue(GeometryResolver.resolveCrop(matte, grey, options).isSkipped());
		assertThrows(IllegalArgumentException.class, () -> GeometryResolver.resolveCrop(matte, options));
	}

	@Test
	public void test_padWithoutExpansion() {
		var source = Rect.createInstance(100, 100);
		var rect = Rect.createInstance(5, 30, 50, 40);
		var padded = GeometryResolver.resolvePad(rect, source, PadOptions.always(20, false), null);
		// Padding of 8 px is capped to 5 px horizontally, to stay within the source
		assertEquals(Rect.createInstance(0, 22, 60, 56), padded);
		assertTrue(source.contains(padded));
	}

	@Test
	public void test_padWithExpansion() {
		var source = Rect.createInstance(100, 100);
		var rect = Rect.createInstance(5, 30, 50, 40);
		var padded = GeometryResolver.resolvePad(rect, source, PadOptions.always(20, true), null);
		assertEquals(Rect.createInstance(-3, 22, 66, 56), padded);
	}

	@Test
	public void test_negativePadding() {
		var source = Rect.createInstance(100, 100);
		var rect = Rect.createInstance(10, 10, 40, 20);
		var inset = GeometryResolver.resolvePad(rect, source, PadOptions.always(-25, false), null);
		assertEquals(Rect.createInstance(15, 15, 30, 10), inset);

		var tiny = Rect.createInstance(0, 0, 3, 3);
		var insetTiny = GeometryResolver.resolvePad(tiny, source, PadOptions.always(-50, false), null);
		assertTrue(insetTiny.getWidth() >= 1 && insetTiny.getHeight() >= 1);
	}

	@Test
	public void test_padModes() {
		var source = Rect.createInstance(100, 100);
		var rect = Rect.createInstance(20, 20, 60, 60);
		var white = BufferedImageTools.createArgb(60, 60, ColorTools.WHITE);
		var dark = BufferedImageTools.createArgb(60, 60, ColorTools.BLACK);

		var never = new PadOptions(PaddingMode.NEVER, 10, false, 10, 1);
		assertSame(rect, GeometryResolver.resolvePad(rect, source, never, white));

		var ifWhite = new PadOptions(PaddingMode.IF_WHITE, 10, false, 10, 1);
		assertEquals(Rect.createInstance(14, 14, 72, 72), GeometryResolver.resolvePad(rect, source, ifWhite, white));
		assertSame(rect, GeometryResolver.resolvePad(rect, source, ifWhite, dark));

		var ifNotWhite = new PadOptions(PaddingMode.IF_NOT_WHITE, 10, false, 10, 1);
		assertSame(rect, GeometryResolver.resolvePad(rect, source, ifNotWhite, white));
		assertEquals(Rect.createInstance(14, 14, 72, 72), GeometryResolver.resolvePad(rect, source, ifNotWhite, dark));

		assertThrows(IllegalArgumentException.class, () -> GeometryResolver.resolvePad(rect, source, ifWhite, null));
	}

}
