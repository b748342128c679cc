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

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.awt.Dimension;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import packshot.lib.common.ConfigurationConflictException;
import packshot.lib.common.ResourceMismatchException;
import packshot.lib.regions.Rect;

@SuppressWarnings("javadoc")
public class TestCollageLayoutSolver {

	private static List<Dimension> uniform(int n, int width, int height) {
		var sizes = new ArrayList<Dimension>();
		for (int i = 0; i < n; i++)
			sizes.add(new Dimension(width, height));
		return sizes;
	}

	private static List<Dimension> mixed() {
		return List.of(
				new Dimension(120, 80),
				new Dimension(60, 100),
				new Dimension(200, 150),
				new Dimension(90, 90),
				new Dimension(30, 160));
	}

	private static void checkPlan(PlacementPlan plan) {
		var canvas = Rect.createInstance(plan.getCanvasWidth(), plan.getCanvasHeight());
		var placements = plan.getPlacements();
		for (int i = 0; i < placements.size(); i++) {
			var p = placements.get(i);
			assertTrue(canvas.contains(p.cell()), "Cell outside canvas: " + p);
			assertTrue(p.cell().contains(p.content()), "Content outside cell: " + p);
			for (int j = i + 1; j < placements.size(); j++)
				assertFalse(p.cell().intersects(placements.get(j).cell()), "Overlapping cells: " + p + ", " + placements.get(j));
		}
		assertEquals((long)plan.getCanvasWidth() * plan.getCanvasHeight(),
				plan.getCellArea() + plan.getUnusedCellArea() + plan.getGutterArea());
		assertTrue(plan.getUnusedCellArea() >= 0);
		assertTrue(plan.getGutterArea() >= 0);
	}

	@ParameterizedTest
	@CsvSource({
		"1, 0, 1",
		"4, 0, 2",
		"5, 0, 3",
		"16, 0, 4",
		"17, 0, 5",
		"3, 5, 3",
		"8, 4, 4"
	})
	public void test_computeCols(int n, int forcedCols, int expected) {
		assertEquals(expected, CollageLayoutSolver.computeCols(n, forcedCols));
	}

	@Test
	public void test_grid2x2() {
		var plan = CollageLayoutSolver.solve(uniform(4, 100, 80), LayoutSpec.builder().build());
		assertEquals(2, plan.getCols());
		assertEquals(2, plan.getRows());
		assertEquals(200, plan.getCanvasWidth());
		assertEquals(160, plan.getCanvasHeight());
		assertEquals(Rect.createInstance(100, 80, 100, 80), plan.getPlacement(3).cell());
		assertEquals(0, plan.getGutterArea());
		checkPlan(plan);
	}

	@Test
	public void test_forcedColumns() {
		var plan = CollageLayoutSolver.solve(uniform(4, 100, 80), LayoutSpec.builder().forcedCols(4).build());
		assertEquals(4, plan.getCols());
		assertEquals(1, plan.getRows());
		assertEquals(400, plan.getCanvasWidth());
		assertEquals(80, plan.getCanvasHeight());
		checkPlan(plan);
	}

	@Test
	public void test_spacingAndMargins() {
		var spec = LayoutSpec.builder().spacingPercent(10).marginPercent(5).build();
		var plan = CollageLayoutSolver.solve(uniform(4, 100, 100), spec);
		assertEquals(10, plan.getSpacing());
		assertEquals(5, plan.getMargin());
		assertEquals(5 + 100 + 10 + 100 + 5, plan.getCanvasWidth());
		assertEquals(Rect.createInstance(115, 115, 100, 100), plan.getPlacement(3).cell());
		checkPlan(plan);
	}

	@Test
	public void test_mixedSizesCentered() {
		var plan = CollageLayoutSolver.solve(mixed(), LayoutSpec.builder().spacingPercent(5).build());
		assertEquals(3, plan.getCols());
		assertEquals(2, plan.getRows());
		// Incomplete last row leaves an unused slot
		assertTrue(plan.getUnusedCellArea() > 0);
		var p = plan.getPlacement(1);
		assertEquals(60, p.content().getWidth());
		assertEquals(100, p.content().getHeight());
		assertEquals(p.cell().getX() + (p.cell().getWidth() - 60) / 2, p.content().getX());
		checkPlan(plan);
	}

	@Test
	public void test_aspectRatio() {
		var spec = LayoutSpec.builder().forceAspectRatio(16, 9).spacingPercent(3).build();
		var plan = CollageLayoutSolver.solve(mixed(), spec);
		assertEquals(16.0 / 9.0 * plan.getCanvasHeight(), plan.getCanvasWidth(), 1.0);
		checkPlan(plan);

		var tall = CollageLayoutSolver.solve(uniform(2, 100, 100), LayoutSpec.builder().forcedCols(2).forceAspectRatio(1, 2).build());
		assertEquals(200, tall.getCanvasWidth());
		assertEquals(400, tall.getCanvasHeight());
		assertEquals(150, tall.getPlacement(0).cell().getY());
		checkPlan(tall);
	}

	@Test
	public void test_maxDimensions() {
		var spec = LayoutSpec.builder().maxDimensions(500, 0).spacingPercent(2).build();
		var plan = CollageLayoutSolver.solve(uniform(4, 1000, 800), spec);
		assertTrue(plan.getCanvasWidth() <= 500);
		assertTrue(plan.getCanvasWidth() >= 499);
		checkPlan(plan);
	}

	@Test
	public void test_thinImageKeepsContentAfterDownscaling() {
		var sizes = List.of(new Dimension(1000, 1000), new Dimension(1, 1000));
		var plan = CollageLayoutSolver.solve(sizes, LayoutSpec.builder().maxDimensions(100, 0).build());
		assertEquals(100, plan.getCanvasWidth());
		assertEquals(50, plan.getCanvasHeight());
		for (var p : plan.getPlacements()) {
			assertTrue(p.content().getWidth() >= 1, "Empty content: " + p);
			assertTrue(p.content().getHeight() >= 1, "Empty content: " + p);
		}
		var thin = plan.getPlacement(1).content();
		assertEquals(1, thin.getWidth());
		assertEquals(50, thin.getHeight());
		checkPlan(plan);

		var exact = CollageLayoutSolver.solve(sizes, LayoutSpec.builder().exactDimensions(60, 30).build());
		assertEquals(1, exact.getPlacement(1).content().getWidth());
		checkPlan(exact);
	}

	@Test
	public void test_exactDimensions() {
		var spec = LayoutSpec.builder()
				.exactDimensions(400, 300)
				.forceAspectRatio(1, 1)
				.maxDimensions(100, 100)
				.spacingPercent(2)
				.build();
		var plan = CollageLayoutSolver.solve(mixed(), spec);
		assertEquals(400, plan.getCanvasWidth());
		assertEquals(300, plan.getCanvasHeight());
		checkPlan(plan);

		var widthOnly = CollageLayoutSolver.solve(uniform(4, 100, 50), LayoutSpec.builder().exactDimensions(400, 0).build());
		assertEquals(400, widthOnly.getCanvasWidth());
		assertEquals(200, widthOnly.getCanvasHeight());
		checkPlan(widthOnly);
	}

	@Test
	public void test_exactDimensionsConflict() {
		var spec = LayoutSpec.builder().exactDimensions(4, 4).spacingPercent(50).build();
		var e = assertThrows(ConfigurationConflictException.class, () -> CollageLayoutSolver.solve(uniform(16, 100, 100), spec));
		assertEquals(LayoutSpec.KEY_SPACING, e.getParameter());

		var marginSpec = LayoutSpec.builder().exactDimensions(4, 4).marginPercent(50).build();
		var e2 = assertThrows(ConfigurationConflictException.class, () -> CollageLayoutSolver.solve(uniform(16, 100, 100), marginSpec));
		assertEquals(LayoutSpec.KEY_MARGINS, e2.getParameter());
	}

	@Test
	public void test_proportional() {
		var spec = LayoutSpec.builder().forcedCols(2).proportional(1.0, 0.5).build();
		var plan = CollageLayoutSolver.solve(uniform(2, 100, 100), spec);
		assertEquals(100, plan.getPlacement(0).content().getHeight());
		assertEquals(50, plan.getPlacement(1).content().getHeight());
		assertEquals(50, plan.getPlacement(1).content().getWidth());
		checkPlan(plan);
	}

	@Test
	public void test_invalidInput() {
		assertThrows(ResourceMismatchException.class, () -> CollageLayoutSolver.solve(Collections.emptyList(), LayoutSpec.builder().build()));
		assertThrows(IllegalArgumentException.class, () -> CollageLayoutSolver.solve(List.of(new Dimension(0, 10)), LayoutSpec.builder().build()));
		var tinyRatio = LayoutSpec.builder().proportional(0.001).build();
		var e = assertThrows(ConfigurationConflictException.class, () -> CollageLayoutSolver.solve(uniform(2, 100, 100), tinyRatio));
		assertEquals(LayoutSpec.KEY_PLACEMENT_RATIOS, e.getParameter());
	}

}
