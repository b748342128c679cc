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

package packshot.lib.common;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

import org.junit.jupiter.api.Test;

@SuppressWarnings("javadoc")
public class TestColorTools {

	@Test
	public void test_packRGB() {
		assertEquals(Integer.parseUnsignedInt("ffffffff", 16), ColorTools.packRGB(255, 255, 255));
		assertEquals(Integer.parseUnsignedInt("ff000000", 16), ColorTools.packRGB(0, 0, 0));
		assertEquals(Integer.parseUnsignedInt("ff010203", 16), ColorTools.packRGB(1, 2, 3));

		// Only the lower 8 bits are used
		assertEquals(Integer.parseUnsignedInt("ff000000", 16), ColorTools.packRGB(256, 256, 256));
		assertEquals(Integer.parseUnsignedInt("ffffffff", 16), ColorTools.packRGB(511, 511, 511));
	}

	@Test
	public void test_packClippedRGB() {
		assertEquals(Integer.parseUnsignedInt("ffffffff", 16), ColorTools.packClippedRGB(256, 300, 1000));
		assertEquals(Integer.parseUnsignedInt("ff000000", 16), ColorTools.packClippedRGB(-1, -10, -256));
		assertEquals(Integer.parseUnsignedInt("ff01ff00", 16), ColorTools.packClippedRGB(1, 256, -1));
	}

	@Test
	public void test_packRGBArray() {
		assertEquals(ColorTools.packRGB(10, 20, 30), ColorTools.packRGB(new int[] {10, 20, 30}));
		assertThrowsIAE(new int[] {10, 20});
		assertThrowsIAE(null);
	}

	private static void assertThrowsIAE(int[] rgb) {
		assertThrows(IllegalArgumentException.class, () -> ColorTools.packRGB(rgb));
	}

	@Test
	public void test_channels() {
		int argb = ColorTools.packARGB(128, 10, 20, 30);
		assertEquals(128, ColorTools.alpha(argb));
		assertEquals(10, ColorTools.red(argb));
		assertEquals(20, ColorTools.green(argb));
		assertEquals(30, ColorTools.blue(argb));
		assertEquals(255, ColorTools.alpha(ColorTools.withAlpha(argb, 300)));
		assertEquals(0, ColorTools.alpha(ColorTools.withAlpha(argb, 0)));
		assertEquals(10, ColorTools.red(ColorTools.withAlpha(argb, 0)));
	}

	@Test
	public void test_compositeOver() {
		int red = ColorTools.packRGB(255, 0, 0);
		assertEquals(red, ColorTools.compositeOver(red, ColorTools.WHITE));
		assertEquals(ColorTools.WHITE, ColorTools.compositeOver(ColorTools.TRANSPARENT, ColorTools.WHITE));
		int half = ColorTools.compositeOver(ColorTools.packARGB(128, 0, 0, 0), ColorTools.WHITE);
		assertEquals(255, ColorTools.alpha(half));
		assertEquals(127, ColorTools.red(half), 1);
		assertEquals(ColorTools.red(half), ColorTools.blue(half));
	}

	@Test
	public void test_do8BitRangeCheck() {
		assertEquals(0, ColorTools.do8BitRangeCheck(-5));
		assertEquals(255, ColorTools.do8BitRangeCheck(1000));
		assertEquals(100, ColorTools.do8BitRangeCheck(100));
		assertEquals(101, ColorTools.do8BitRangeCheck(100.6));
		assertEquals(0, ColorTools.do8BitRangeCheck(-0.2));
	}

}
