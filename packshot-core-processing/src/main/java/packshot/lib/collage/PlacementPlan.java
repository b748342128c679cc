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

import java.util.Collections;
import java.util.List;

import packshot.lib.regions.Rect;

/**
 * The result of laying out a collage: a canvas size and one placement per image, in input order.
 * <p>
 * Cells are the grid slots assigned to each image; cells never overlap.
 * The content rectangle of each placement is where the image itself is drawn, and always lies within its cell.
 *
 * @author PackShot developers
 */
public class PlacementPlan {

	/**
	 * Placement of a single image.
	 *
	 * @param index index of the image in the input list
	 * @param row grid row
	 * @param col grid column
	 * @param cell the grid slot
	 * @param content the area where the image is drawn
	 */
	public record Placement(int index, int row, int col, Rect cell, Rect content) {}

	private final int canvasWidth;
	private final int canvasHeight;
	private final int cols;
	private final int rows;
	private final int spacing;
	private final int margin;
	private final long gridArea;
	private final List<Placement> placements;

	PlacementPlan(int canvasWidth, int canvasHeight, int cols, int rows, int spacing, int margin, long gridArea, List<Placement> placements) {
		this.canvasWidth = canvasWidth;
		this.canvasHeight = canvasHeight;
		this.cols = cols;
		this.rows = rows;
		this.spacing = spacing;
		this.margin = margin;
		this.gridArea = gridArea;
		this.placements = Collections.unmodifiableList(placements);
	}

	/**
	 * @return
	 */
	public int getCanvasWidth() {
		return canvasWidth;
	}

	/**
	 * @return
	 */
	public int getCanvasHeight() {
		return canvasHeight;
	}

	/**
	 * @return number of grid columns
	 */
	public int getCols() {
		return cols;
	}

	/**
	 * @return number of grid rows
	 */
	public int getRows() {
		return rows;
	}

	/**
	 * @return spacing between adjacent cells, in pixels (approximate if the plan was rescaled)
	 */
	public int getSpacing() {
		return spacing;
	}

	/**
	 * @return outer margin, in pixels (approximate if the plan was rescaled)
	 */
	public int getMargin() {
		return margin;
	}

	/**
	 * Get all placements, ordered by image index.
	 * @return
	 */
	public List<Placement> getPlacements() {
		return placements;
	}

	/**
	 * Get the placement for an image.
	 * @param index
	 * @return
	 */
	public Placement getPlacement(int index) {
		return placements.get(index);
	}

	/**
	 * @return number of placed images
	 */
	public int size() {
		return placements.size();
	}

	/**
	 * Get the total area of all occupied cells.
	 * @return
	 */
	public long getCellArea() {
		return placements.stream().mapToLong(p -> p.cell().getArea()).sum();
	}

	/**
	 * Get the area of grid slots with no image, which occurs when the last row is incomplete.
	 * @return
	 */
	public long getUnusedCellArea() {
		return gridArea - getCellArea();
	}

	/**
	 * Get the area of the canvas outside all grid slots, i.e. spacing, margins and any aspect ratio fill.
	 * @return
	 */
	public long getGutterArea() {
		return (long)canvasWidth * canvasHeight - gridArea;
	}

	@Override
	public String toString() {
		return "PlacementPlan (" + canvasWidth + "x" + canvasHeight + ", " + cols + " cols x " + rows + " rows, " + placements.size() + " images)";
	}

}
