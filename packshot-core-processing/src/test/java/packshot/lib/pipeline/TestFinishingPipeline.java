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

package packshot.lib.pipeline;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.awt.image.BufferedImage;
import java.util.List;

import org.junit.jupiter.api.Test;

import packshot.lib.awt.common.BufferedImageTools;
import packshot.lib.common.ColorTools;
import packshot.lib.common.ConfigurationConflictException;
import packshot.lib.settings.FinishingSettings;
import packshot.lib.settings.SettingsIO;

@SuppressWarnings("javadoc")
public class TestFinishingPipeline {

	private static final int SUBJECT = ColorTools.packRGB(30, 60, 90);

	private static BufferedImage createProductShot() {
		var img = BufferedImageTools.createArgb(100, 80, ColorTools.WHITE);
		for (int y = 10; y < 50; y++) {
			for (int x = 20; x < 60; x++)
				img.setRGB(x, y, SUBJECT);
		}
		return img;
	}

	private static FinishingSettings settings(String json) {
		return SettingsIO.fromJson(json);
	}

	@Test
	public void test_defaultsPassThrough() {
		var pipeline = new FinishingPipeline(FinishingSettings.createDefault(), null);
		var finished = pipeline.process(createProductShot());
		var output = finished.getImage();
		assertEquals(100, output.getWidth());
		assertEquals(80, output.getHeight());
		// Default output format is jpg
		assertEquals(BufferedImage.TYPE_INT_RGB, output.getType());
		assertFalse(finished.getMask().isPresent());
		assertTrue(finished.getWarnings().isEmpty());
	}

	@Test
	public void test_backgroundRemovalAndCrop() {
		var pipeline = new FinishingPipeline(settings(
				"{\"background_crop\": {\"enable_bg_crop\": true}, "
				+ "\"individual_mode\": {\"output_format\": \"png\"}}"), null);
		var output = pipeline.process(createProductShot()).getImage();
		assertEquals(40, output.getWidth());
		assertEquals(40, output.getHeight());
		assertEquals(ColorTools.withAlpha(SUBJECT, 255), output.getRGB(0, 0));
		assertEquals(ColorTools.withAlpha(SUBJECT, 255), output.getRGB(39, 39));
	}

	@Test
	public void test_removalWithoutCropKeepsTransparency() {
		var pipeline = new FinishingPipeline(settings(
				"{\"background_crop\": {\"enable_bg_crop\": true, \"enable_crop\": false}, "
				+ "\"individual_mode\": {\"output_format\": \"png\", \"png_transparent_background\": true}}"), null);
		var output = pipeline.process(createProductShot()).getImage();
		assertEquals(100, output.getWidth());
		assertEquals(80, output.getHeight());
		assertEquals(0, ColorTools.alpha(output.getRGB(0, 0)));
		assertEquals(255, ColorTools.alpha(output.getRGB(30, 30)));
	}

	@Test
	public void test_jpgFlattensRemovedBackground() {
		var pipeline = new FinishingPipeline(settings(
				"{\"background_crop\": {\"enable_bg_crop\": true, \"enable_crop\": false}, "
				+ "\"individual_mode\": {\"output_format\": \"jpg\", \"jpg_background_color\": [0, 255, 0]}}"), null);
		var output = pipeline.process(createProductShot()).getImage();
		assertEquals(BufferedImage.TYPE_INT_RGB, output.getType());
		assertEquals(ColorTools.packRGB(0, 255, 0), output.getRGB(0, 0) & 0xFFFFFF);
		assertEquals(SUBJECT, output.getRGB(30, 30) & 0xFFFFFF);
	}

	@Test
	public void test_perimeterCheckSkipsRemoval() {
		var img = BufferedImageTools.createArgb(30, 20, SUBJECT);
		var pipeline = new FinishingPipeline(settings(
				"{\"background_crop\": {\"enable_bg_crop\": true, \"check_perimeter\": true, \"perimeter_mode\": \"if_white\"}, "
				+ "\"individual_mode\": {\"output_format\": \"png\"}}"), null);
		var finished = pipeline.process(img);
		assertEquals(30, finished.getImage().getWidth());
		assertEquals(20, finished.getImage().getHeight());
		assertEquals(255, ColorTools.alpha(finished.getImage().getRGB(0, 0)));
	}

	@Test
	public void test_emptyForegroundWarns() {
		var img = BufferedImageTools.createArgb(30, 20, ColorTools.WHITE);
		var pipeline = new FinishingPipeline(settings(
				"{\"background_crop\": {\"enable_bg_crop\": true}, "
				+ "\"individual_mode\": {\"output_format\": \"png\"}}"), null);
		var finished = pipeline.process(img);
		assertEquals(30, finished.getImage().getWidth());
		assertEquals(20, finished.getImage().getHeight());
		assertFalse(finished.getWarnings().isEmpty());
	}

	@Test
	public void test_paddingAfterCrop() {
		var pipeline = new FinishingPipeline(settings(
				"{\"background_crop\": {\"enable_bg_crop\": true}, "
				+ "\"padding\": {\"mode\": \"always\", \"padding_percent\": 10, \"allow_expansion\": true}, "
				+ "\"individual_mode\": {\"output_format\": \"png\", \"png_transparent_background\": false, \"png_background_color\": [255, 255, 255]}}"), null);
		var output = pipeline.process(createProductShot()).getImage();
		assertTrue(output.getWidth() > 40);
		assertTrue(output.getHeight() > 40);
		assertEquals(ColorTools.WHITE, output.getRGB(0, 0));
		int cx = output.getWidth() / 2;
		int cy = output.getHeight() / 2;
		assertEquals(ColorTools.withAlpha(SUBJECT, 255), output.getRGB(cx, cy));
	}

	@Test
	public void test_maskMode() {
		var pipeline = new FinishingPipeline(settings(
				"{\"background_crop\": {\"enable_bg_crop\": true, \"enable_crop\": false, \"use_mask_instead_of_transparency\": true}, "
				+ "\"individual_mode\": {\"output_format\": \"png\"}}"), null);
		var finished = pipeline.process(createProductShot());
		var output = finished.getImage();
		// The image itself is left opaque
		assertEquals(255, ColorTools.alpha(output.getRGB(0, 0)));
		assertEquals(ColorTools.WHITE, output.getRGB(0, 0));

		assertTrue(finished.getMask().isPresent());
		var mask = finished.getMask().get();
		assertEquals(BufferedImage.TYPE_BYTE_GRAY, mask.getType());
		assertEquals(100, mask.getWidth());
		assertEquals(80, mask.getHeight());
		assertEquals(0, mask.getRaster().getSample(0, 0, 0));
		assertEquals(255, mask.getRaster().getSample(30, 30, 0));
	}

	@Test
	public void test_preresize() {
		var pipeline = new FinishingPipeline(settings(
				"{\"preprocessing\": {\"enable_preresize\": true, \"preresize_width\": 50, \"preresize_height\": 50}, "
				+ "\"individual_mode\": {\"output_format\": \"png\"}}"), null);
		var output = pipeline.process(createProductShot()).getImage();
		assertEquals(50, output.getWidth());
		assertEquals(40, output.getHeight());
	}

	@Test
	public void test_maxDimensions() {
		var pipeline = new FinishingPipeline(settings(
				"{\"individual_mode\": {\"enable_max_dimensions\": true, \"max_output_width\": 25, \"max_output_height\": 25}}"), null);
		var output = pipeline.process(createProductShot()).getImage();
		assertEquals(25, output.getWidth());
		assertEquals(20, output.getHeight());
	}

	@Test
	public void test_mergeRequiresTemplate() {
		var s = settings("{\"merge_settings\": {\"enable_merge\": true, \"template_path\": \"missing.png\"}}");
		var e = assertThrows(ConfigurationConflictException.class, () -> new FinishingPipeline(s, null));
		assertEquals("merge_settings.template_path", e.getParameter());
	}

	@Test
	public void test_mergeApplied() {
		var template = BufferedImageTools.createArgb(10, 10, ColorTools.packRGB(255, 0, 0));
		var pipeline = new FinishingPipeline(settings(
				"{\"merge_settings\": {\"enable_merge\": true, \"position\": \"top_left\"}, "
				+ "\"individual_mode\": {\"output_format\": \"png\"}}"), template);
		var output = pipeline.process(createProductShot()).getImage();
		assertEquals(ColorTools.packRGB(255, 0, 0), output.getRGB(5, 5));
		assertEquals(ColorTools.WHITE, output.getRGB(15, 5));
	}

	@Test
	public void test_collage() {
		var pipeline = new FinishingPipeline(settings(
				"{\"background_crop\": {\"enable_bg_crop\": true}, "
				+ "\"individual_mode\": {\"output_format\": \"png\"}, "
				+ "\"collage_mode\": {\"enable_collage\": true, \"output_format\": \"jpg\"}}"), null);
		var first = pipeline.processForCollage(createProductShot());
		var second = pipeline.processForCollage(createProductShot());
		// Members keep transparency and skip individual sizing
		assertEquals(40, first.getWidth());
		assertEquals(40, first.getHeight());
		assertTrue(first.getColorModel().hasAlpha());

		var collage = pipeline.createCollage(List.of(first, second));
		assertNotNull(collage);
		assertEquals(BufferedImage.TYPE_INT_RGB, collage.getType());
		assertTrue(collage.getWidth() > collage.getHeight());

		boolean foundSubject = false;
		for (int y = 0; y < collage.getHeight() && !foundSubject; y++) {
			for (int x = 0; x < collage.getWidth(); x++) {
				if ((collage.getRGB(x, y) & 0xFFFFFF) == SUBJECT) {
					foundSubject = true;
					break;
				}
			}
		}
		assertTrue(foundSubject);
	}

}
