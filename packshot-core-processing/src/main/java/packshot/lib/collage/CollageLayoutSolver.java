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

import java.awt.Dimension;
import java.util.ArrayList;
import java.util.List;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import packshot.lib.common.ConfigurationConflictException;
import packshot.lib.common.ResourceMismatchException;
import packshot.lib.regions.Rect;

/**
 * Lay out images of varying sizes in a grid.
 * <p>
 * Images are placed in row-major order, so that image {@code i} is in row {@code i / cols} and
 * column {@code i % cols}. Column widths are the largest cell width in each column, and row heights the
 * largest cell height in each row.
 *
 * @author PackShot developers
 */
public final class CollageLayoutSolver {

	private static final Logger logger = LoggerFactory.getLogger(CollageLayoutSolver.class);

	// Suppressed default constructor for non-instantiability
	private CollageLayoutSolver() {
		throw new AssertionError();
	}

	/**
	 * Get the number of columns used for a number of images.
	 * @param n
	 * @param forcedCols requested number of columns, or 0 for automatic
	 * @return
	 */
	public static int computeCols(int n, int forcedCols) {
		if (forcedCols > 0)
			return Math.min(forcedCols, n);
		return (int)Math.ceil(Math.sqrt(n));
	}

	/**
	 * Solve the layout for images with the specified sizes.
	 * @param sizes natural image sizes, in input order
	 * @param spec
	 * @return
	 * @throws ResourceMismatchException if there are no images
	 * @throws ConfigurationConflictException if the settings leave no space for a cell
	 */
	public static PlacementPlan solve(List<Dimension> sizes, LayoutSpec spec) {
		int n = sizes.size();
		if (n == 0)
			throw new ResourceMismatchException("Cannot create a collage without any images");

		int cols = computeCols(n, spec.getForcedCols());
		int rows = (n + cols - 1) / cols;

		int maxW = 0, maxH = 0;
		for (var size : sizes) {
			if (size.width <= 0 || size.height <= 0)
				throw new IllegalArgumentException("Image sizes must be > 0! Requested " + size.width + "x" + size.height);
			maxW = Math.max(maxW, size.width);
			maxH = Math.max(maxH, size.height);
		}

		var layout = new Layout(n, cols, rows);
		int[] cellW = new int[n];
		int[] cellH = new int[n];
		double sumCell = 0;
		for (int i = 0; i < n; i++) {
			var size = sizes.get(i);
			if (spec.isProportional()) {
				cellH[i] = (int)Math.round(maxH * spec.getRatio(i));
				cellW[i] = (int)Math.round(cellH[i] * (double)size.width / size.height);
				if (cellW[i] <= 0 || cellH[i] <= 0)
					throw new ConfigurationConflictException(LayoutSpec.KEY_PLACEMENT_RATIOS,
							"Image " + i + " has a cell size of " + cellW[i] + "x" + cellH[i]);
				layout.contentW[i] = cellW[i];
				layout.contentH[i] = cellH[i];
			} else {
				cellW[i] = maxW;
				cellH[i] = maxH;
				layout.contentW[i] = size.width;
				layout.contentH[i] = size.height;
			}
			sumCell += (cellW[i] + cellH[i]) / 2.0;
			int r = i / cols;
			int c = i % cols;
			layout.colW[c] = Math.max(layout.colW[c], cellW[i]);
			layout.rowH[r] = Math.max(layout.rowH[r], cellH[i]);
		}

		double avgCell = sumCell / n;
		int spacing = (int)Math.round(spec.getSpacingPercent() / 100.0 * avgCell);
		int margin = (int)Math.round(spec.getMarginPercent() / 100.0 * avgCell);
		layout.arrange(spacing, margin);

		if (spec.hasExactDimensions()) {
			int exactW = spec.getExactWidth();
			int exactH = spec.getExactHeight();
			if (exactW <= 0)
				exactW = Math.max(1, (int)Math.round(exactH * (double)layout.width / layout.height));
			else if (exactH <= 0)
				exactH = Math.max(1, (int)Math.round(exactW * (double)layout.height / layout.width));
			if (spec.hasAspectRatio() || spec.hasMaxDimensions())
				logger.debug("Exact collage dimensions {}x{} override aspect ratio and maximum dimensions", exactW, exactH);
			layout = layout.toExact(exactW, exactH, spec);
		} else {
			if (spec.hasAspectRatio())
				layout.forceAspectRatio(spec.getAspectRatio());
			if (spec.hasMaxDimensions()) {
				double scale = 1.0;
				if (spec.getMaxWidth() > 0)
					scale = Math.min(scale, (double)spec.getMaxWidth() / layout.width);
				if (spec.getMaxHeight() > 0)
					scale = Math.min(scale, (double)spec.getMaxHeight() / layout.height);
				if (scale < 1.0)
					layout.scale(scale);
			}
		}

		var plan = layout.toPlan();
		logger.debug("Collage layout: {}", plan);
		return plan;
	}


	/**
	 * Mutable grid description, using column/row arrays shared by all images in the same column/row.
	 */
	private static class Layout {

		private final int n, cols, rows;
		private final int[] colX, colW, rowY, rowH;
		// Content offsets are relative to the slot
		private final int[] contentX, contentY, contentW, contentH;
		private int width, height;
		private int spacing, margin;

		Layout(int n, int cols, int rows) {
			this.n = n;
			this.cols = cols;
			this.rows = rows;
			colX = new int[cols];
			colW = new int[cols];
			rowY = new int[rows];
			rowH = new int[rows];
			contentX = new int[n];
			contentY = new int[n];
			contentW = new int[n];
			contentH = new int[n];
		}

		void arrange(int spacing, int margin) {
			this.spacing = spacing;
			this.margin = margin;
			int x = margin;
			for (int c = 0; c < cols; c++) {
				colX[c] = x;
				x += colW[c] + spacing;
			}
			width = x - spacing + margin;
			int y = margin;
			for (int r = 0; r < rows; r++) {
				rowY[r] = y;
				y += rowH[r] + spacing;
			}
			height = y - spacing + margin;
			for (int i = 0; i < n; i++) {
				contentX[i] = (colW[i % cols] - contentW[i]) / 2;
				contentY[i] = (rowH[i / cols] - contentH[i]) / 2;
			}
		}

		void forceAspectRatio(double aspectRatio) {
			if ((double)width / height < aspectRatio) {
				int newWidth = (int)Math.round(height * aspectRatio);
				int lead = (newWidth - width) / 2;
				for (int c = 0; c < cols; c++)
					colX[c] += lead;
				width = newWidth;
			} else {
				int newHeight = (int)Math.round(width / aspectRatio);
				int lead = (newHeight - height) / 2;
				for (int r = 0; r < rows; r++)
					rowY[r] += lead;
				height = newHeight;
			}
		}

		void scale(double scale) {
			for (int i = 0; i < n; i++) {
				int c = i % cols;
				int r = i / cols;
				int x1 = scaled(colX[c] + contentX[i], scale) - scaled(colX[c], scale);
				int x2 = scaled(colX[c] + contentX[i] + contentW[i], scale) - scaled(colX[c], scale);
				int y1 = scaled(rowY[r] + contentY[i], scale) - scaled(rowY[r], scale);
				int y2 = scaled(rowY[r] + contentY[i] + contentH[i], scale) - scaled(rowY[r], scale);
				contentX[i] = x1;
				contentW[i] = x2 - x1;
				contentY[i] = y1;
				contentH[i] = y2 - y1;
			}
			for (int c = 0; c < cols; c++) {
				int x2 = scaled(colX[c] + colW[c], scale);
				colX[c] = scaled(colX[c], scale);
				colW[c] = x2 - colX[c];
				if (colW[c] <= 0)
					throw new ConfigurationConflictException(LayoutSpec.KEY_MAX_WIDTH, "Column " + c + " has no width after downscaling by " + scale);
			}
			for (int r = 0; r < rows; r++) {
				int y2 = scaled(rowY[r] + rowH[r], scale);
				rowY[r] = scaled(rowY[r], scale);
				rowH[r] = y2 - rowY[r];
				if (rowH[r] <= 0)
					throw new ConfigurationConflictException(LayoutSpec.KEY_MAX_HEIGHT, "Row " + r + " has no height after downscaling by " + scale);
			}
			width = Math.max(1, scaled(width, scale));
			height = Math.max(1, scaled(height, scale));
			spacing = scaled(spacing, scale);
			margin = scaled(margin, scale);
			keepContentVisible();
		}

		/**
		 * Ensure every content rectangle is at least 1x1 and lies inside its cell,
		 * so that rounding never drops a thin image from the collage.
		 */
		void keepContentVisible() {
			for (int i = 0; i < n; i++) {
				int cellW = colW[i % cols];
				int cellH = rowH[i / cols];
				contentW[i] = Math.max(1, Math.min(contentW[i], cellW));
				contentH[i] = Math.max(1, Math.min(contentH[i], cellH));
				contentX[i] = Math.max(0, Math.min(contentX[i], cellW - contentW[i]));
				contentY[i] = Math.max(0, Math.min(contentY[i], cellH - contentH[i]));
			}
		}

		Layout toExact(int exactW, int exactH, LayoutSpec spec) {
			double base = Math.min((double)exactW / cols, (double)exactH / rows);
			int sp = (int)Math.round(spec.getSpacingPercent() / 100.0 * base);
			int m = (int)Math.round(spec.getMarginPercent() / 100.0 * base);
			String key = spec.getSpacingPercent() > 0 ? LayoutSpec.KEY_SPACING : LayoutSpec.KEY_MARGINS;
			int availW = exactW - 2 * m - (cols - 1) * sp;
			int availH = exactH - 2 * m - (rows - 1) * sp;
			if (availW < cols || availH < rows)
				throw new ConfigurationConflictException(key,
						"No space remains for " + cols + "x" + rows + " cells in a " + exactW + "x" + exactH + " collage");

			var exact = new Layout(n, cols, rows);
			exact.spacing = sp;
			exact.margin = m;
			exact.width = exactW;
			exact.height = exactH;
			distribute(colW, availW, exact.colW, key);
			distribute(rowH, availH, exact.rowH, key);
			for (int c = 0; c < cols; c++)
				exact.colX[c] = c == 0 ? m : exact.colX[c - 1] + exact.colW[c - 1] + sp;
			for (int r = 0; r < rows; r++)
				exact.rowY[r] = r == 0 ? m : exact.rowY[r - 1] + exact.rowH[r - 1] + sp;
			for (int i = 0; i < n; i++) {
				int c = i % cols;
				int r = i / cols;
				double sx = (double)exact.colW[c] / colW[c];
				double sy = (double)exact.rowH[r] / rowH[r];
				exact.contentX[i] = (int)Math.round(contentX[i] * sx);
				exact.contentW[i] = (int)Math.round((contentX[i] + contentW[i]) * sx) - exact.contentX[i];
				exact.contentY[i] = (int)Math.round(contentY[i] * sy);
				exact.contentH[i] = (int)Math.round((contentY[i] + contentH[i]) * sy) - exact.contentY[i];
			}
			exact.keepContentVisible();
			return exact;
		}

		PlacementPlan toPlan() {
			var placements = new ArrayList<PlacementPlan.Placement>();
			for (int i = 0; i < n; i++) {
				int c = i % cols;
				int r = i / cols;
				var cell = Rect.createInstance(colX[c], rowY[r], colW[c], rowH[r]);
				var content = Rect.createInstance(colX[c] + contentX[i], rowY[r] + contentY[i], contentW[i], contentH[i]);
				placements.add(new PlacementPlan.Placement(i, r, c, cell, content));
			}
			long sumW = 0, sumH = 0;
			for (int w : colW)
				sumW += w;
			for (int h : rowH)
				sumH += h;
			return new PlacementPlan(width, height, cols, rows, spacing, margin, sumW * sumH, placements);
		}

		/**
		 * Split a total length between slots in proportion to their current sizes, using cumulative rounding.
		 */
		private static void distribute(int[] sizes, int total, int[] output, String key) {
			long sum = 0;
			for (int s : sizes)
				sum += s;
			long cumulative = 0;
			int previousEdge = 0;
			for (int k = 0; k < sizes.length; k++) {
				cumulative += sizes[k];
				int edge = (int)Math.round((double)total * cumulative / sum);
				output[k] = edge - previousEdge;
				if (output[k] <= 0)
					throw new ConfigurationConflictException(key, "A cell has no space remaining in the collage");
				previousEdge = edge;
			}
		}

		private static int scaled(int value, double scale) {
			return (int)Math.round(value * scale);
		}

	}

}
