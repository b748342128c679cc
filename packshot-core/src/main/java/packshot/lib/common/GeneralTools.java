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

import java.io.File;
import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.function.Function;
import java.util.regex.Pattern;
import java.util.stream.Collectors;

import org.apache.commons.math3.util.Precision;

/**
 * Collection of generally useful static methods.
 *
 * @author PackShot developers
 *
 */
public final class GeneralTools {

	// Suppressed default constructor for non-instantiability
	private GeneralTools() {
		throw new AssertionError();
	}

	/**
	 * Get extension from a file. The dot is included as the first character, and the extension
	 * is returned in lower case.
	 * @param file
	 * @return
	 * @see #getNameWithoutExtension(File)
	 */
	public static Optional<String> getExtension(File file) {
		Objects.requireNonNull(file);
		return getExtension(file.getName());
	}

	/**
	 * Get extension from a filename. Some implementation notes:
	 * <ul>
	 * <li>This is 'the final dot and beyond'.</li>
	 * <li>The dot is included as the first character.</li>
	 * <li>If a dot is the final character then no extension is returned.</li>
	 * <li>The extension is returned in lower case.</li>
	 * </ul>
	 * @param name
	 * @return
	 * @see #getExtension(File)
	 */
	public static Optional<String> getExtension(String name) {
		Objects.requireNonNull(name);
		String ext = null;
		int ind = name.lastIndexOf(".");
		if (ind >= 0) {
			ext = name.substring(ind);
			// Check we only have letters
			if (!ext.matches(".\\w*"))
				ext = null;
		}
		return ext == null || ext.equals(".") ? Optional.empty() : Optional.of(ext.toLowerCase());
	}

	/**
	 * Get the file name with extension removed.
	 * @param file
	 * @return
	 */
	public static String getNameWithoutExtension(File file) {
		return getNameWithoutExtension(file.getName());
	}

	/**
	 * Get the file name with extension removed.
	 * @param name
	 * @return
	 */
	public static String getNameWithoutExtension(String name) {
		var ext = getExtension(name).orElse(null);
		return ext == null ? name : name.substring(0, name.length() - ext.length());
	}

	/**
	 * Strip characters that would make a String invalid as a filename.
	 * <p>
	 * Note that the test is not platform-dependent, and may be stricter than absolutely necessary.
	 * @param name
	 * @return the (possibly-shortened) filename without invalid characters
	 */
	public static String stripInvalidFilenameChars(String name) {
		return name.replaceAll("[\\\\/:\"*?<>|\\n\\r]+", "");
	}

	/**
	 * Check if a string is blank, i.e. it is null or its length is 0.
	 * @param s
	 * @param trim If true, any string will be trimmed before its length checked.
	 * @return True if the string is null or empty.
	 */
	public static boolean blankString(final String s, final boolean trim) {
		return s == null || (trim ? s.trim().length() == 0 : s.length() == 0);
	}

	/**
	 * Clip a value to be within a specific range.
	 *
	 * @param value
	 * @param min
	 * @param max
	 * @return
	 */
	public static int clipValue(final int value, final int min, final int max) {
		return value < min ? min : (value > max ? max : value);
	}

	/**
	 * Clip a value to be within a specific range.
	 *
	 * @param value
	 * @param min
	 * @param max
	 * @return
	 */
	public static double clipValue(final double value, final double min, final double max) {
		return value < min ? min : (value > max ? max : value);
	}

	/**
	 * Test if two doubles are approximately equal, within a specified relative tolerance.
	 *
	 * @param n1
	 * @param n2
	 * @param tolerance
	 * @return
	 */
	public static boolean almostTheSame(double n1, double n2, double tolerance) {
		return Precision.equalsWithRelativeTolerance(n1, n2, tolerance);
	}

	/**
	 * Smart-sort a collection after extracting a String representation of each element.
	 * This differs from a 'normal' sort by splitting the String into lists of numeric and non-numeric parts,
	 * and comparing corresponding elements separately.
	 * <p>
	 * For example, applying a simple sort to the list {@code ["a1", "a2", "a10"]} will result in
	 * {@code ["a1", "a10", "a2]}. Smart-sorting would leave the list unchanged.
	 * @param <T>
	 * @param collection collection to be sorted (results are retained in-place)
	 * @param extractor function used to convert each element of the collection to a String representation
	 */
	public static <T> void smartStringSort(Collection<T> collection, Function<T, String> extractor) {
		var list = collection.stream()
				.map(c -> new StringPartsSorter<>(c, extractor.apply(c)))
				.sorted()
				.map(s -> s.obj)
				.collect(Collectors.toList());
		collection.clear();
		collection.addAll(list);
	}

	/**
	 * Comparator for smart String sorting.
	 * @return a String comparator that parses integers from within the String so they may be compared by value
	 * @see #smartStringSort(Collection, Function)
	 */
	public static Comparator<String> smartStringComparator() {
		return (String s1, String s2) -> new StringPartsSorter<>(s1, s1).compareTo(new StringPartsSorter<>(s2, s2));
	}

	/**
	 * Helper class for smart-sorting.
	 * @param <T>
	 */
	private static class StringPartsSorter<T> implements Comparable<StringPartsSorter<T>> {

		private static final Pattern PATTERN = Pattern.compile("(\\d+)");

		private T obj;
		private List<Object> parts;

		StringPartsSorter(T obj, String s) {
			this.obj = obj;
			if (s == null)
				s = Objects.toString(obj);
			// Break the string into numeric & non-numeric parts
			var matcher = PATTERN.matcher(s);
			parts = new ArrayList<>();
			int next = 0;
			while (matcher.find()) {
				int s1 = matcher.start();
				if (s1 > next) {
					parts.add(s.substring(next, s1));
				}
				parts.add(new BigDecimal(matcher.group()));
				next = matcher.end();
			}
			if (next < s.length())
				parts.add(s.substring(next));
		}

		@Override
		public int compareTo(StringPartsSorter<T> s2) {
			int n = Math.min(parts.size(), s2.parts.size());
			for (int i = 0; i < n; i++) {
				var p1 = parts.get(i);
				var p2 = s2.parts.get(i);
				int comp = 0;
				if (p1 instanceof BigDecimal && p2 instanceof BigDecimal) {
					comp = ((BigDecimal)p1).compareTo((BigDecimal)p2);
				} else {
					comp = p1.toString().compareToIgnoreCase(p2.toString());
				}
				if (comp != 0)
					return comp;
			}
			return Integer.compare(parts.size(), s2.parts.size());
		}

		@Override
		public String toString() {
			return "[" + parts.stream().map(p -> p.toString()).collect(Collectors.joining(", ")) + "]";
		}

	}

}
