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

package packshot.app;

import java.awt.image.BufferedImage;
import java.io.File;
import java.io.IOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.concurrent.Callable;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Future;

import org.apache.commons.io.FileUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;
import packshot.app.io.ImageFiles;
import packshot.lib.common.ConfigurationConflictException;
import packshot.lib.common.GeneralTools;
import packshot.lib.common.LogTools;
import packshot.lib.pipeline.BatchRunner;
import packshot.lib.pipeline.BatchTask;
import packshot.lib.pipeline.FinishingPipeline;
import packshot.lib.settings.FinishingSettings;
import packshot.lib.settings.OutputFormat;
import packshot.lib.settings.PresetManager;
import packshot.lib.settings.SettingsIO;

/**
 * Command to finish all images in a folder, either individually or as collages.
 * <p>
 * Returns 0 if every image (or collage) was written, 1 if the command could not start, and
 * 2 if some images failed.
 *
 * @author PackShot developers
 */
@Command(name = "process", description = "Finish all images in a folder, individually or as collages.", sortOptions = false)
public class ProcessCommand implements Callable<Integer> {

	private static final Logger logger = LoggerFactory.getLogger(ProcessCommand.class);

	/**
	 * Exit code used when some images could not be processed.
	 */
	public static final int EXIT_PARTIAL_FAILURE = 2;

	@Parameters(index = "0", paramLabel = "input", description = "Folder containing the input images.")
	private File inputDir;

	@Parameters(index = "1", paramLabel = "output", description = "Folder where the finished images will be written.")
	private File outputDir;

	@Option(names = {"-s", "--settings"}, paramLabel = "file", description = "Settings file (JSON). Missing keys take their default values.")
	private File settingsFile;

	@Option(names = {"-p", "--preset"}, paramLabel = "name", description = "Name of a saved preset to use instead of a settings file.")
	private String presetName;

	@Option(names = {"--presets-dir"}, paramLabel = "dir", description = "Folder containing presets (default: ${DEFAULT-VALUE}).",
			defaultValue = "${sys:user.home}/.packshot/presets")
	private File presetsDir;

	@Option(names = {"-c", "--collage"}, description = "Create collages, even if collage mode is disabled in the settings.")
	private boolean collage;

	@Option(names = {"-w", "--workers"}, paramLabel = "n", description = "Number of worker threads (default: from settings, or the number of processors).")
	private Integer workers;

	@Option(names = {"-h", "--help"}, usageHelp = true, description = "Show this help message and exit.")
	private boolean usageHelpRequested;

	@Override
	public Integer call() {
		long startTime = System.currentTimeMillis();
		LogTools.resetLoggedMessages();

		if (settingsFile != null && presetName != null) {
			logger.error("Either a settings file or a preset may be specified, but not both!");
			return 1;
		}
		if (inputDir == null || !inputDir.isDirectory()) {
			logger.error("Input folder {} does not exist", inputDir);
			return 1;
		}

		FinishingPipeline pipeline;
		try {
			var settings = loadSettings();
			if (workers != null)
				settings.getPerformance().setMaxWorkers(workers);
			pipeline = new FinishingPipeline(settings, loadTemplate(settings));
			FileUtils.forceMkdir(outputDir);
		} catch (IOException | IllegalArgumentException | ConfigurationConflictException e) {
			logger.error(e.getLocalizedMessage(), e);
			return 1;
		}

		int failures;
		try (var runner = new BatchRunner(pipeline.getSettings().getPerformance().getMaxWorkers())) {
			if (collage || pipeline.getSettings().getCollageMode().isEnableCollage())
				failures = runCollages(pipeline, runner);
			else
				failures = runIndividual(pipeline, runner);
		} catch (IOException e) {
			logger.error("Unable to read input folder: {}", e.getLocalizedMessage(), e);
			return 1;
		}

		long duration = System.currentTimeMillis() - startTime;
		logger.info(String.format("Processing completed in %.1f seconds", duration/1000.0));
		return failures == 0 ? 0 : EXIT_PARTIAL_FAILURE;
	}

	private FinishingSettings loadSettings() throws IOException {
		if (settingsFile != null) {
			logger.info("Reading settings from {}", settingsFile);
			return SettingsIO.read(settingsFile.toPath());
		}
		if (presetName != null) {
			logger.info("Using preset '{}'", presetName);
			return new PresetManager(presetsDir.toPath()).load(presetName);
		}
		return FinishingSettings.createDefault();
	}

	private static BufferedImage loadTemplate(FinishingSettings settings) throws IOException {
		var merge = settings.getMergeSettings();
		if (!merge.isEnableMerge())
			return null;
		var path = Path.of(merge.getTemplatePath());
		logger.info("Reading template from {}", path);
		return ImageFiles.read(path.toFile());
	}

	private int runIndividual(FinishingPipeline pipeline, BatchRunner runner) throws IOException {
		var files = ImageFiles.listImages(inputDir);
		if (files.isEmpty()) {
			logger.warn("No images found in {}", inputDir);
			return 0;
		}
		logger.info("Processing {} image(s) with {} worker(s)", files.size(), runner.getNumThreads());

		var individual = pipeline.getSettings().getIndividualMode();
		var tasks = new ArrayList<BatchTask<File>>();
		for (int i = 0; i < files.size(); i++) {
			var file = files.get(i);
			var output = new File(outputDir, ImageFiles.getOutputName(file, i, individual));
			tasks.add(BatchTask.of(file.getName(), () -> {
				var finished = pipeline.process(ImageFiles.read(file));
				ImageFiles.write(finished.getImage(), output, individual.getOutputFormat(), individual.getJpegQuality());
				if (finished.getMask().isPresent()) {
					var maskFile = new File(outputDir, ImageFiles.getMaskName(output.getName()));
					ImageFiles.write(finished.getMask().get(), maskFile, OutputFormat.PNG, 100);
				}
				if (individual.isDeleteOriginals())
					ImageFiles.deleteOriginal(file, output);
				return output;
			}));
		}

		var results = runner.runAll(tasks, (completed, total, result) -> {
			if (result.isSuccess())
				logger.info("[{}/{}] {} -> {}", completed, total, result.name(), ((File)result.value()).getName());
			else
				logger.warn("[{}/{}] {} failed", completed, total, result.name());
		});
		int failures = (int)results.stream().filter(r -> !r.isSuccess()).count();
		if (failures > 0)
			logger.warn("{} of {} image(s) could not be processed", failures, files.size());
		return failures;
	}

	private int runCollages(FinishingPipeline pipeline, BatchRunner runner) throws IOException {
		var groups = ImageFiles.listGroups(inputDir);
		if (groups.isEmpty()) {
			logger.warn("No images found for collages in {}", inputDir);
			return 0;
		}
		var collageSettings = pipeline.getSettings().getCollageMode();

		// Submit all members first, so that groups are processed in parallel
		var submitted = new LinkedHashMap<String, List<Future<BufferedImage>>>();
		for (var entry : groups.entrySet()) {
			var tasks = new ArrayList<BatchTask<BufferedImage>>();
			for (var file : entry.getValue())
				tasks.add(BatchTask.of(file.getName(), () -> pipeline.processForCollage(ImageFiles.read(file))));
			submitted.put(entry.getKey(), runner.submitAll(tasks));
		}

		int failures = 0;
		for (var entry : submitted.entrySet()) {
			String group = entry.getKey();
			String name = getCollageName(collageSettings.getOutputFilename(), group);
			var output = new File(outputDir, name + collageSettings.getOutputFormat().getExtension());
			try {
				var members = runner.joinGroup(entry.getValue());
				var image = pipeline.createCollage(members);
				ImageFiles.write(image, output, collageSettings.getOutputFormat(), collageSettings.getJpegQuality());
				logger.info("Collage of {} image(s) written to {}", members.size(), output);
			} catch (ExecutionException e) {
				var cause = e.getCause() == null ? e : e.getCause();
				logger.error("Collage {} failed: {}", name, cause.getLocalizedMessage(), cause);
				failures++;
			} catch (IOException | RuntimeException e) {
				logger.error("Collage {} failed: {}", name, e.getLocalizedMessage(), e);
				failures++;
			} catch (InterruptedException e) {
				logger.error("Interrupted while waiting for collage {}", name, e);
				runner.cancel();
				Thread.currentThread().interrupt();
				return failures + 1;
			}
		}
		return failures;
	}

	/**
	 * Get the base name for a collage file.
	 * @param outputFilename the configured collage file name
	 * @param group the group name, or an empty string if all images form a single group
	 * @return
	 */
	static String getCollageName(String outputFilename, String group) {
		if (group == null || group.isEmpty())
			return outputFilename;
		return outputFilename + "_" + GeneralTools.stripInvalidFilenameChars(group);
	}

}
