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

package packshot.app.io;

import java.awt.image.BufferedImage;
import java.io.File;
import java.io.FileFilter;
import java.io.IOException;
import java.nio.file.Files;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import javax.imageio.IIOImage;
import javax.imageio.ImageIO;
import javax.imageio.ImageWriteParam;
import javax.imageio.stream.FileImageOutputStream;

import org.apache.commons.io.FileUtils;
import org.apache.commons.io.IOCase;
import org.apache.commons.io.filefilter.DirectoryFileFilter;
import org.apache.commons.io.filefilter.FileFileFilter;
import org.apache.commons.io.filefilter.FileFilterUtils;
import org.apache.commons.io.filefilter.SuffixFileFilter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import packshot.lib.common.GeneralTools;
import packshot.lib.settings.IndividualModeSettings;
import packshot.lib.settings.OutputFormat;

/**
 * Reading, writing and naming image files.
 *
 * @author PackShot developers
 */
public final class ImageFiles {

	private static final Logger logger = LoggerFactory.getLogger(ImageFiles.class);

	/**
	 * File extensions recognized as input images (case-insensitive).
	 */
	public static final List<String> IMAGE_EXTENSIONS = Collections.unmodifiableList(
			Arrays.asList(".jpg", ".jpeg", ".png", ".bmp", ".gif", ".tif", ".tiff"));

	private static final FileFilter IMAGE_FILTER = FileFilterUtils.and(
			FileFileFilter.INSTANCE,
			new SuffixFileFilter(IMAGE_EXTENSIONS.toArray(String[]::new), IOCase.INSENSITIVE));

	// Suppressed default constructor for non-instantiability
	private ImageFiles() {
		throw new AssertionError();
	}

	/**
	 * List the image files directly inside a directory, in natural order (so that "a2" comes before "a10").
	 * @param dir
	 * @return
	 * @throws IOException if the directory cannot be read
	 */
	public static List<File> listImages(File dir) throws IOException {
		if (!dir.isDirectory())
			throw new IOException(dir + " is not a directory");
		File[] files = dir.listFiles(IMAGE_FILTER);
		if (files == null)
			throw new IOException("Unable to list files in " + dir);
		var list = new ArrayList<>(Arrays.asList(files));
		GeneralTools.smartStringSort(list, File::getName);
		return list;
	}

	/**
	 * Find groups of images for collages.
	 * <p>
	 * Each immediate subdirectory containing images is a group, named after the subdirectory.
	 * If there are no such subdirectories, all images in the directory form a single group with an empty name.
	 * @param dir
	 * @return groups in natural order of their names
	 * @throws IOException
	 */
	public static Map<String, List<File>> listGroups(File dir) throws IOException {
		if (!dir.isDirectory())
			throw new IOException(dir + " is not a directory");
		File[] subdirs = dir.listFiles((FileFilter)DirectoryFileFilter.INSTANCE);
		var dirs = new ArrayList<File>(subdirs == null ? Collections.emptyList() : Arrays.asList(subdirs));
		GeneralTools.smartStringSort(dirs, File::getName);
		var groups = new LinkedHashMap<String, List<File>>();
		for (var subdir : dirs) {
			var images = listImages(subdir);
			if (!images.isEmpty())
				groups.put(subdir.getName(), images);
		}
		if (groups.isEmpty()) {
			var images = listImages(dir);
			if (!images.isEmpty())
				groups.put("", images);
		}
		return groups;
	}

	/**
	 * Read an image.
	 * @param file
	 * @return
	 * @throws IOException if the file cannot be read or decoded
	 */
	public static BufferedImage read(File file) throws IOException {
		var img = ImageIO.read(file);
		if (img == null)
			throw new IOException("Unsupported image format: " + file);
		if (img.getWidth() <= 0 || img.getHeight() <= 0)
			throw new IOException("Image has no pixels: " + file);
		return img;
	}

	/**
	 * Write an image, creating the parent directory if needed.
	 * @param img the image; for JPEG output this should not have an alpha channel
	 * @param file
	 * @param format
	 * @param jpegQuality JPEG quality (1-100), ignored for PNG
	 * @throws IOException
	 */
	public static void write(BufferedImage img, File file, OutputFormat format, int jpegQuality) throws IOException {
		var parent = file.getAbsoluteFile().getParentFile();
		if (parent != null)
			FileUtils.forceMkdir(parent);
		if (format == OutputFormat.JPG) {
			var writers = ImageIO.getImageWritersByFormatName("jpeg");
			if (!writers.hasNext())
				throw new IOException("No JPEG writer available");
			var writer = writers.next();
			var param = writer.getDefaultWriteParam();
			param.setCompressionMode(ImageWriteParam.MODE_EXPLICIT);
			param.setCompressionQuality(Math.max(1, Math.min(100, jpegQuality)) / 100f);
			Files.deleteIfExists(file.toPath());
			try (var stream = new FileImageOutputStream(file)) {
				writer.setOutput(stream);
				writer.write(null, new IIOImage(img, null, null), param);
			} finally {
				writer.dispose();
			}
		} else {
			if (!ImageIO.write(img, format.getFormatName(), file))
				throw new IOException("No writer available for " + format.getFormatName());
		}
		logger.debug("Written {}", file);
	}

	/**
	 * Get the output file name for an individual image.
	 * @param source the input file
	 * @param index 0-based index of the input file in the sorted list
	 * @param settings
	 * @return
	 */
	public static String getOutputName(File source, int index, IndividualModeSettings settings) {
		String ext = settings.getOutputFormat().getExtension();
		String article = settings.getArticleName();
		if (settings.isEnableRename() && !GeneralTools.blankString(article, true))
			return GeneralTools.stripInvalidFilenameChars(article.strip()) + "_" + (index + 1) + ext;
		return GeneralTools.getNameWithoutExtension(source) + ext;
	}

	/**
	 * Get the name of the mask file written alongside an output file.
	 * @param outputName
	 * @return
	 */
	public static String getMaskName(String outputName) {
		return GeneralTools.getNameWithoutExtension(outputName) + "_mask" + OutputFormat.PNG.getExtension();
	}

	/**
	 * Delete an original input file, unless it is the same file as the output.
	 * @param source
	 * @param output
	 * @return true if the file was deleted
	 * @throws IOException
	 */
	public static boolean deleteOriginal(File source, File output) throws IOException {
		if (source.getCanonicalFile().equals(output.getCanonicalFile())) {
			logger.debug("Original {} was overwritten by the output, nothing to delete", source);
			return false;
		}
		FileUtils.delete(source);
		logger.debug("Deleted original {}", source);
		return true;
	}

}
