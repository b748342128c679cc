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

import java.awt.image.BufferedImage;
import java.util.ArrayList;
import java.util.List;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import packshot.lib.awt.common.BufferedImageTools;
import packshot.lib.background.BackgroundMatte;
import packshot.lib.background.ColorClassifier;
import packshot.lib.background.Matte;
import packshot.lib.background.Whitening;
import packshot.lib.collage.CollageRenderer;
import packshot.lib.collage.LayoutSpec;
import packshot.lib.common.ColorTools;
import packshot.lib.common.ConfigurationConflictException;
import packshot.lib.compose.Compositor;
import packshot.lib.compose.FinishedImage;
import packshot.lib.compose.OutputPreparation;
import packshot.lib.compose.OutputSizing;
import packshot.lib.compose.ToneParams;
import packshot.lib.geometry.CropOptions;
import packshot.lib.geometry.GeometryResolver;
import packshot.lib.geometry.PadOptions;
import packshot.lib.merge.TemplateMerger;
import packshot.lib.regions.Rect;
import packshot.lib.settings.FinishingSettings;
import packshot.lib.settings.PaddingMode;
import packshot.lib.settings.PerimeterMode;

/**
 * The full sequence of finishing steps for individual images and collages.
 * <p>
 * Each image is processed in the order: pre-resize, whitening, perimeter check, background matte,
 * crop, pad, composition (tone and output sizing), template merge, output preparation.
 * Collage members skip the individual output sizing, merge and preparation; these are instead
 * applied to the collage as a whole.
 * <p>
 * A pipeline holds no mutable state, and can be used from multiple threads.
 *
 * @author PackShot developers
 */
public class FinishingPipeline {

	private static final Logger logger = LoggerFactory.getLogger(FinishingPipeline.class);

	private final FinishingSettings settings;
	private final BufferedImage template;
	private final BackgroundMatte matteCalculator;
	private final OutputPreparation individualOutput;
	private final OutputPreparation collageOutput;

	/**
	 * Create a pipeline.
	 * @param settings the settings; these are validated
	 * @param template template image for merging, or null if merging is disabled
	 * @throws IllegalArgumentException if the settings are invalid
	 * @throws ConfigurationConflictException if merging is enabled without a template
	 */
	public FinishingPipeline(FinishingSettings settings, BufferedImage template) {
		this.settings = settings.validate();
		if (settings.getMergeSettings().isEnableMerge() && template == null)
			throw new ConfigurationConflictException("merge_settings.template_path", "Template merge is enabled, but no template image is available");
		this.template = template;
		this.matteCalculator = BackgroundMatte.builder(settings.getBackgroundCrop()).build();
		this.individualOutput = OutputPreparation.fromSettings(settings.getIndividualMode());
		this.collageOutput = OutputPreparation.fromSettings(settings.getCollageMode());
	}

	/**
	 * Get the settings used by this pipeline.
	 * @return
	 */
	public FinishingSettings getSettings() {
		return settings;
	}

	/**
	 * Get the output preparation used for individual images.
	 * @return
	 */
	public OutputPreparation getIndividualOutput() {
		return individualOutput;
	}

	/**
	 * Get the output preparation used for collages.
	 * @return
	 */
	public OutputPreparation getCollageOutput() {
		return collageOutput;
	}

	/**
	 * Process an image in individual mode.
	 * @param img
	 * @return the finished image, ready to be written in the individual output format
	 */
	public FinishedImage process(BufferedImage img) {
		var individual = settings.getIndividualMode();
		boolean useMask = settings.getBackgroundCrop().isUseMaskInsteadOfTransparency();
		int fill = useMask ? ColorTools.withAlpha(individualOutput.background(), 255) : individualOutput.getCanvasFill();
		var compositor = Compositor.builder()
				.useMask(useMask)
				.fill(fill)
				.tone(ToneParams.fromSettings(settings.getBrightnessContrast()))
				.sizing(OutputSizing.fromSettings(individual))
				.build();
		var finished = finish(img, compositor);
		var output = finished.getImage();
		if (settings.getMergeSettings().isEnableMerge())
			output = TemplateMerger.merge(output, template, settings.getMergeSettings());
		return finished.withImage(individualOutput.prepare(output));
	}

	/**
	 * Process an image for inclusion in a collage.
	 * @param img
	 * @return a {@code TYPE_INT_ARGB} image, with transparent padding
	 */
	public BufferedImage processForCollage(BufferedImage img) {
		var compositor = Compositor.builder()
				.fill(ColorTools.TRANSPARENT)
				.tone(ToneParams.fromSettings(settings.getBrightnessContrast()))
				.build();
		return finish(img, compositor).getImage();
	}

	/**
	 * Create a collage from images that have already been processed with {@link #processForCollage(BufferedImage)}.
	 * @param members
	 * @return the collage, ready to be written in the collage output format
	 */
	public BufferedImage createCollage(List<BufferedImage> members) {
		var spec = LayoutSpec.fromSettings(settings.getCollageMode());
		var collage = CollageRenderer.render(members, spec, collageOutput.getCanvasFill());
		if (settings.getMergeSettings().isEnableMerge())
			collage = TemplateMerger.merge(collage, template, settings.getMergeSettings());
		return collageOutput.prepare(collage);
	}

	private FinishedImage finish(BufferedImage img, Compositor compositor) {
		var warnings = new ArrayList<String>();
		var work = preprocess(img);
		var full = Rect.createInstance(work.getWidth(), work.getHeight());

		Matte matte = null;
		Rect crop = full;
		var bg = settings.getBackgroundCrop();
		if (bg.isEnableBgCrop()) {
			var perimeterMode = bg.getEffectivePerimeterMode();
			if (perimeterMode.shouldRun(() -> ColorClassifier.isPerimeterWhite(work, bg.getPerimeterTolerance(), 1))) {
				matte = matteCalculator.computeMatte(work);
				var options = CropOptions.fromSettings(bg);
				options = new CropOptions(options.enabled(), options.symmetricAbsolute(), options.symmetricAxes(),
						options.extraCropPercent(), PerimeterMode.ALWAYS, options.perimeterTolerance());
				var cropResult = GeometryResolver.resolveCrop(matte, options);
				if (cropResult.isDegenerate())
					warnings.add("No foreground found, the full image is used");
				crop = cropResult.getRect();
			} else {
				logger.info("Background removal skipped by perimeter check (mode: {})", perimeterMode);
			}
		}

		var padOptions = PadOptions.fromSettings(settings.getPadding());
		BufferedImage perimeterImage = null;
		if (padOptions.mode() == PaddingMode.IF_WHITE || padOptions.mode() == PaddingMode.IF_NOT_WHITE) {
			var matted = matte == null ? work : Compositor.applyMatte(work, matte);
			perimeterImage = BufferedImageTools.extract(matted, crop, ColorTools.TRANSPARENT);
		}
		var padRect = GeometryResolver.resolvePad(crop, full, padOptions, perimeterImage);

		return compositor.compose(work, matte, crop, padRect).withWarnings(warnings);
	}

	private BufferedImage preprocess(BufferedImage img) {
		var work = BufferedImageTools.toArgb(img);
		var preprocessing = settings.getPreprocessing();
		if (preprocessing.isEnablePreresize()) {
			int[] size = BufferedImageTools.fitWithin(work.getWidth(), work.getHeight(),
					preprocessing.getPreresizeWidth(), preprocessing.getPreresizeHeight());
			if (size[0] != work.getWidth() || size[1] != work.getHeight()) {
				logger.debug("Pre-resizing {}x{} to {}x{}", work.getWidth(), work.getHeight(), size[0], size[1]);
				work = BufferedImageTools.resize(work, size[0], size[1]);
			}
		}
		var whitening = settings.getWhitening();
		if (whitening.isEnableWhitening())
			work = Whitening.apply(work, whitening.getWhiteningCancelThreshold());
		return work;
	}

}
