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

import java.io.File;
import java.io.IOException;
import java.util.concurrent.Callable;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import picocli.CommandLine.Command;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;
import picocli.CommandLine.Spec;
import packshot.lib.settings.PresetManager;
import packshot.lib.settings.SettingsIO;

/**
 * Command to manage saved settings presets.
 *
 * @author PackShot developers
 */
@Command(name = "presets", description = "List, save, delete and rename settings presets.", sortOptions = false)
public class PresetsCommand implements Callable<Integer> {

	private static final Logger logger = LoggerFactory.getLogger(PresetsCommand.class);

	@Spec
	private CommandSpec spec;

	@Option(names = {"--presets-dir"}, paramLabel = "dir", description = "Folder containing presets (default: ${DEFAULT-VALUE}).",
			defaultValue = "${sys:user.home}/.packshot/presets")
	private File presetsDir;

	@Option(names = {"-h", "--help"}, usageHelp = true, description = "Show this help message and exit.")
	private boolean usageHelpRequested;

	@Override
	public Integer call() {
		return list();
	}

	private PresetManager getManager() {
		return new PresetManager(presetsDir.toPath());
	}

	@Command(name = "list", description = "List all presets.")
	int list() {
		try {
			var out = spec.commandLine().getOut();
			for (var name : getManager().list())
				out.println(name);
			out.flush();
			return 0;
		} catch (IOException e) {
			logger.error("Unable to list presets: {}", e.getLocalizedMessage(), e);
			return 1;
		}
	}

	@Command(name = "show", description = "Print the settings of a preset as JSON.")
	int show(@Parameters(paramLabel = "name", description = "Preset name.") String name) {
		try {
			var out = spec.commandLine().getOut();
			out.println(SettingsIO.toJson(getManager().load(name)));
			out.flush();
			return 0;
		} catch (IOException e) {
			logger.error(e.getLocalizedMessage(), e);
			return 1;
		}
	}

	@Command(name = "save", description = "Save a settings file as a preset, replacing any preset with the same name.")
	int save(@Parameters(paramLabel = "name", description = "Preset name.") String name,
			@Parameters(paramLabel = "settings", description = "Settings file (JSON).") File settingsFile) {
		try {
			var settings = SettingsIO.read(settingsFile.toPath());
			String saved = getManager().save(name, settings);
			spec.commandLine().getOut().println(saved);
			spec.commandLine().getOut().flush();
			return 0;
		} catch (IOException | IllegalArgumentException e) {
			logger.error(e.getLocalizedMessage(), e);
			return 1;
		}
	}

	@Command(name = "delete", description = "Delete a preset. The default preset cannot be deleted.")
	int delete(@Parameters(paramLabel = "name", description = "Preset name.") String name) {
		try {
			return getManager().delete(name) ? 0 : 1;
		} catch (IOException | IllegalArgumentException e) {
			logger.error(e.getLocalizedMessage(), e);
			return 1;
		}
	}

	@Command(name = "rename", description = "Rename a preset. The default preset cannot be renamed.")
	int rename(@Parameters(paramLabel = "old", description = "Current preset name.") String oldName,
			@Parameters(paramLabel = "new", description = "New preset name.") String newName) {
		try {
			getManager().rename(oldName, newName);
			return 0;
		} catch (IOException | IllegalArgumentException e) {
			logger.error(e.getLocalizedMessage(), e);
			return 1;
		}
	}

	@Command(name = "clear", description = "Delete all presets except the default.")
	int clear() {
		try {
			int n = getManager().deleteAllCustom();
			spec.commandLine().getOut().println("Deleted " + n + " preset(s)");
			spec.commandLine().getOut().flush();
			return 0;
		} catch (IOException e) {
			logger.error(e.getLocalizedMessage(), e);
			return 1;
		}
	}

}
