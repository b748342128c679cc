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

package packshot.lib.collage;

import java.awt.AlphaComposite;
import java.awt.Dimension;
import java.awt.Graphics2D;
import java.awt.image.BufferedImage;
import java.util.List;
import java.util.stream.Collectors;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import packshot.lib.awt.common.BufferedImageTools;
import packshot.lib.common.ResourceMismatchException;

/**
 * Draw images onto a collage canvas according to a {@link PlacementPlan}.
 *
 * @author PackShot developers
 */
public final class CollageRenderer {

	private static final Logger logger = LoggerFactory.getLogger(CollageRenderer.class);

	// Suppressed default constructor for non-instantiability
	private CollageRenderer() {
		throw new AssertionError();
	}

	/**
	 * Lay out and render a collage in a single step.
	 * @param images
	 * @param spec
	 * @param background packed ARGB value for the canvas
	 * @return
	 */
	public static BufferedImage render(List<BufferedImage> images, LayoutSpec spec, int background) {
		var sizes = images.stream()
				.map(img -> new Dimension(img.getWidth(), img.getHeight()))
				.collect(Collectors.toList());
		return render(images, CollageLayoutSolver.solve(sizes, spec), background);
	}

	/**
	 * Render a collage.
	 * Each image is resized to its content rectangle, and drawn over the background.
	 * @param images images in the same order used to compute the plan
	 * @param plan
	 * @param background packed ARGB value for the canvas
	 * @return a new {@code TYPE_INT_ARGB} image
	 * @throws ResourceMismatchException if the number of images does not match the plan
	 */
	public static BufferedImage render(List<BufferedImage> images, PlacementPlan plan, int background) {
		if (images.size() != plan.size())
			throw new ResourceMismatchException("Collage plan has " + plan.size() + " placements, but " + images.size() + " images were provided");
		var canvas = BufferedImageTools.createArgb(plan.getCanvasWidth(), plan.getCanvasHeight(), background);
		Graphics2D g2d = canvas.createGraphics();
		try {
			g2d.setComposite(AlphaComposite.SrcOver);
			for (var placement : plan.getPlacements()) {
				var content = placement.content();
				if (content.isEmpty()) {
					logger.warn("Image {} has no space in the collage and will be skipped", placement.index());
					continue;
				}
				var img = images.get(placement.index());
				if (img.getWidth() != content.getWidth() || img.getHeight() != content.getHeight())
					img = BufferedImageTools.resize(img, content.getWidth(), content.getHeight());
				g2d.drawImage(img, content.getX(), content.getY(), null);
			}
		} finally {
			g2d.dispose();
		}
		return canvas;
	}

}
