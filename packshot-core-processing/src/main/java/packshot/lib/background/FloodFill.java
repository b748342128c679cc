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

package packshot.lib.background;

/**
 * 4-connected flood fill over a background confidence map.
 * <p>
 * Uses a primitive int queue of pixel indices rather than point objects.
 *
 * @author PackShot developers
 */
class FloodFill {

	/**
	 * Find all background pixels connected to a seed through other background pixels.
	 * @param values row-major confidence values
	 * @param width
	 * @param height
	 * @param threshold confidence at or above which a pixel is background
	 * @param seeds flags for pixels permitted to start the fill; these must also be background to be used
	 * @return flags for all reached pixels
	 */
	static boolean[] fill(float[] values, int width, int height, float threshold, boolean[] seeds) {
		int n = width * height;
		boolean[] reached = new boolean[n];
		IntDequeue queue = new IntDequeue(Math.max(16, 2 * (width + height)));
		for (int i = 0; i < n; i++) {
			if (seeds[i] && values[i] >= threshold) {
				reached[i] = true;
				queue.add(i);
			}
		}
		while (!queue.isEmpty()) {
			int i = queue.remove();
			int x = i % width;
			int y = i / width;
			if (x > 0)
				visit(i - 1, values, threshold, reached, queue);
			if (x < width - 1)
				visit(i + 1, values, threshold, reached, queue);
			if (y > 0)
				visit(i - width, values, threshold, reached, queue);
			if (y < height - 1)
				visit(i + width, values, threshold, reached, queue);
		}
		return reached;
	}

	/**
	 * Create seed flags for every pixel on the 1-pixel image border.
	 * @param width
	 * @param height
	 * @return
	 */
	static boolean[] borderSeeds(int width, int height) {
		boolean[] seeds = new boolean[width * height];
		for (int i : ColorClassifier.perimeterIndices(width, height, 1))
			seeds[i] = true;
		return seeds;
	}

	/**
	 * Keep only background connected to a seed.
	 * Pixels not reached by the fill are set to zero; reached pixels keep their confidence.
	 * @param values row-major confidence values, modified in-place
	 * @param width
	 * @param height
	 * @param seeds flags for pixels permitted to start the fill
	 * @param restrictTo optional flags for the pixels that may be changed; if null, any pixel may be changed
	 */
	static void restrictToConnected(float[] values, int width, int height, boolean[] seeds, boolean[] restrictTo) {
		boolean[] reached = fill(values, width, height, Matte.BACKGROUND_THRESHOLD, seeds);
		for (int i = 0; i < values.length; i++) {
			if (!reached[i] && (restrictTo == null || restrictTo[i]))
				values[i] = 0f;
		}
	}

	private static void visit(int i, float[] values, float threshold, boolean[] reached, IntDequeue queue) {
		if (!reached[i] && values[i] >= threshold) {
			reached[i] = true;
			queue.add(i);
		}
	}


	/**
	 * Minimal growable FIFO queue of ints.
	 */
	static class IntDequeue {

		private int[] array;
		private int head = 0; // Points to location of first element in queue
		private int tail = 0; // Points to location of *next* insert
		private static final int MIN_EXPANSION = 1024;

		IntDequeue(int capacity) {
			array = new int[capacity];
		}

		boolean isEmpty() {
			return tail == head;
		}

		/**
		 * Performs no check that the output will be valid (caller should use isEmpty first to check this)
		 * @return
		 */
		int remove() {
			head++;
			return array[head-1];
		}

		void add(int val) {
			if (tail < array.length) {
				array[tail++] = val;
				return;
			}
			// Shift everything back if that frees up enough space
			if (head > array.length / 2) {
				System.arraycopy(array, head, array, 0, tail - head);
				tail -= head;
				head = 0;
				array[tail++] = val;
				return;
			}
			int[] array2 = new int[Math.max(array.length * 2, MIN_EXPANSION)];
			System.arraycopy(array, head, array2, 0, tail - head);
			tail -= head;
			head = 0;
			array = array2;
			array[tail++] = val;
		}

	}

}
