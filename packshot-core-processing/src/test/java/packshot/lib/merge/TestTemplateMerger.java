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

import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

import org.junit.jupiter.api.Test;

import packshot.lib.awt.common.BufferedImageTools;
import packshot.lib.common.ColorTools;
import packshot.lib.settings.Anchor;
import packshot.lib.settings.SettingsIO;

@SuppressWarnings("javadoc")
public class TestTemplateMerger {

	private static final int RED = ColorTools.packRGB(255, 0, 0);
	private static final int BLUE = ColorTools.packRGB(0, 0, 255);

	@Test
	public void test_zeroOpacityUnchanged() {
		var base = BufferedImageTools.createArgb(20, 20, RED);
		var template = BufferedImageTools.createArgb(20, 20, BLUE);
		var merged = TemplateMerger.merge(base, template, Anchor.CENTER, 0, 0, 0);
		assertArrayEquals(BufferedImageTools.getPixels(base), BufferedImageTools.getPixels(merged));
	}

	@Test
	public void test_fullOpacityReplaces() {
		var base = BufferedImageTools.createArgb(20, 20, RED);
		var template = BufferedImageTools.createArgb(20, 20, BLUE);
		var merged = TemplateMerger.merge(base, template, Anchor.CENTER, 100, 100, 100);
		for (int v : BufferedImageTools.getPixels(merged))
			assertEquals(BLUE, v);
	}

	@Test
	public void test_halfOpacity() {
		var base = BufferedImageTools.createArgb(4, 4, RED);
		var template = BufferedImageTools.createArgb(4, 4, BLUE);
		int v = TemplateMerger.merge(base, template, Anchor.CENTER, 0, 0, 50).getRGB(1, 1);
		assertEquals(255, ColorTools.alpha(v));
		assertEquals(128, ColorTools.red(v), 1);
		assertEquals(128, ColorTools.blue(v), 1);
	}

	@Test
	public void test_anchorAndSize() {
		var base = BufferedImageTools.createArgb(100, 50, RED);
		var template = BufferedImageTools.createArgb(7, 3, BLUE);
		var merged = TemplateMerger.merge(base, template, Anchor.BOTTOM_RIGHT, 20, 20, 100);
		// Template resized to 20x10 and placed in the bottom right corner
		assertEquals(BLUE, merged.getRGB(80, 40));
		assertEquals(BLUE, merged.getRGB(99, 49));
		assertEquals(RED, merged.getRGB(79, 40));
		assertEquals(RED, merged.getRGB(80, 39));

		var natural = TemplateMerger.merge(base, template, Anchor.TOP_LEFT, 0, 0, 100);
		assertEquals(BLUE, natural.getRGB(6, 2));
		assertEquals(RED, natural.getRGB(7, 2));
	}

	@Test
	public void test_transparentTemplatePixels() {
		var base = BufferedImageTools.createArgb(10, 10, RED);
		var template = BufferedImageTools.createArgb(10, 10, ColorTools.TRANSPARENT);
		template.setRGB(5, 5, BLUE);
		var merged = TemplateMerger.merge(base, template, Anchor.CENTER, 0, 0, 100);
		assertEquals(RED, merged.getRGB(0, 0));
		assertEquals(BLUE, merged.getRGB(5, 5));
	}

	@Test
	public void test_templateBelow() {
		var base = BufferedImageTools.createArgb(10, 10, ColorTools.TRANSPARENT);
		base.setRGB(2, 2, RED);
		var template = BufferedImageTools.createArgb(10, 10, BLUE);
		var merged = TemplateMerger.merge(base, template, Anchor.CENTER, 0, 0, 100, false);
		assertEquals(RED, merged.getRGB(2, 2));
		assertEquals(BLUE, merged.getRGB(0, 0));
	}

	@Test
	public void test_fromSettings() {
		var settings = SettingsIO.fromJson("{\"merge_settings\": {\"position\": \"top_left\", \"opacity_percent\": 100, \"template_width_percent\": 50}}");
		var base = BufferedImageTools.createArgb(40, 40, RED);
		var template = BufferedImageTools.createArgb(10, 10, BLUE);
		var merged = TemplateMerger.merge(base, template, settings.getMergeSettings());
		assertEquals(BLUE, merged.getRGB(19, 9));
		assertEquals(RED, merged.getRGB(20, 9));
		assertEquals(RED, merged.getRGB(0, 10));
	}

	@Test
	public void test_invalid() {
		var base = BufferedImageTools.createArgb(10, 10, RED);
		assertThrows(IllegalArgumentException.class, () -> TemplateMerger.merge(base, base, Anchor.CENTER, 0, 0, 101));
		assertThrows(IllegalArgumentException.class, () -> TemplateMerger.merge(base, base, Anchor.CENTER, -1, 0, 50));
	}

}
