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
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.io.File;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Optional;

import org.junit.jupiter.api.Test;

@SuppressWarnings("javadoc")
public class TestGeneralTools {

	@Test
	public void test_getExtension() {
		assertEquals(Optional.of(".jpg"), GeneralTools.getExtension("image.JPG"));
		assertEquals(Optional.of(".png"), GeneralTools.getExtension(new File("dir", "a.b.png")));
		assertEquals(Optional.empty(), GeneralTools.getExtension("noext"));
		assertEquals(Optional.empty(), GeneralTools.getExtension("trailing."));
	}

	@Test
	public void test_getNameWithoutExtension() {
		assertEquals("image", GeneralTools.getNameWithoutExtension("image.jpg"));
		assertEquals("a.b", GeneralTools.getNameWithoutExtension(new File("a.b.tif")));
		assertEquals("noext", GeneralTools.getNameWithoutExtension("noext"));
	}

	@Test
	public void test_stripInvalidFilenameChars() {
		assertEquals("abc", GeneralTools.stripInvalidFilenameChars("a/b:c"));
		assertEquals("shoes red", GeneralTools.stripInvalidFilenameChars("shoes*? red"));
	}

	@Test
	public void test_blankString() {
		assertTrue(GeneralTools.blankString(null, false));
		assertTrue(GeneralTools.blankString("", false));
		assertFalse(GeneralTools.blankString("  ", false));
		assertTrue(GeneralTools.blankString("  ", true));
	}

	@Test
	public void test_clipValue() {
		assertEquals(5, GeneralTools.clipValue(10, 0, 5));
		assertEquals(0, GeneralTools.clipValue(-10, 0, 5));
		assertEquals(2.5, GeneralTools.clipValue(2.5, 0.0, 5.0));
		assertTrue(GeneralTools.almostTheSame(1.0, 1.0001, 0.001));
		assertFalse(GeneralTools.almostTheSame(1.0, 1.1, 0.001));
	}

	@Test
	public void test_smartStringSort() {
		List<String> names = new ArrayList<>(Arrays.asList("img10.jpg", "img2.jpg", "img1.jpg", "a.jpg"));
		GeneralTools.smartStringSort(names, s -> s);
		assertEquals(Arrays.asList("a.jpg", "img1.jpg", "img2.jpg", "img10.jpg"), names);

		List<String> sorted = new ArrayList<>(Arrays.asList("b20", "b3", "b100"));
		sorted.sort(GeneralTools.smartStringComparator());
		assertEquals(Arrays.asList("b3", "b20", "b100"), sorted);
	}

}
