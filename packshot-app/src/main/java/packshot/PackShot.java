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

package packshot;

import java.util.ArrayList;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.HelpCommand;
import picocli.CommandLine.IVersionProvider;
import picocli.CommandLine.Option;
import picocli.CommandLine.ParseResult;
import packshot.app.PresetsCommand;
import packshot.app.ProcessCommand;
import packshot.app.logging.LogManager;
import packshot.app.logging.LogManager.LogLevel;

/**
 * Main PackShot launcher.
 *
 * @author PackShot developers
 */
@Command(name = "packshot", subcommands = {HelpCommand.class, ProcessCommand.class, PresetsCommand.class},
	description = "Batch finishing of product photographs.",
	mixinStandardHelpOptions = true, versionProvider = PackShot.VersionProvider.class)
public class PackShot {

	private static final Logger logger = LoggerFactory.getLogger(PackShot.class);

	@Option(names = {"-l", "--log"}, description = {"Log level (default = INFO).", "Options: ${COMPLETION-CANDIDATES}"} )
	private LogLevel logLevel = LogLevel.INFO;

	/**
	 * Main method to launch PackShot.
	 *
	 * @param args
	 */
	public static void main(String[] args) {
		int exitCode = run(args);
		if (exitCode != 0)
			logger.warn("Calling System.exit with exit code {}", exitCode);
		System.exit(exitCode);
	}

	/**
	 * Parse the arguments and run the requested subcommand.
	 * @param args
	 * @return the exit code
	 */
	public static int run(String... args) {
		PackShot packshot = new PackShot();
		CommandLine cmd = createCommandLine(packshot);
		ParseResult pr;
		try {
			pr = cmd.parseArgs(args);
		} catch (Exception e) {
			logger.error("An error has occurred, please type -h to display help message.\n" + e.getLocalizedMessage());
			return 1;
		}

		// Catch -h/--help and -V/--version
		if (cmd.isUsageHelpRequested()) {
			cmd.usage(cmd.getOut());
			return 0;
		} else if (cmd.isVersionHelpRequested()) {
			cmd.printVersionHelp(cmd.getOut());
			return 0;
		}

		if (packshot.logLevel != null)
			LogManager.setRootLogLevel(packshot.logLevel);

		if (!pr.hasSubcommand()) {
			cmd.usage(cmd.getOut());
			return 0;
		}
		// Parse again and execute the subcommand
		return createCommandLine(new PackShot()).execute(args);
	}

	static CommandLine createCommandLine(PackShot packshot) {
		CommandLine cmd = new CommandLine(packshot);
		cmd.setCaseInsensitiveEnumValuesAllowed(true);
		cmd.setExpandAtFiles(false);
		cmd.setExitCodeExceptionMapper(t -> 1);
		return cmd;
	}


	static class VersionProvider implements IVersionProvider {

		@Override
		public String[] getVersion() throws Exception {
			var version = PackShot.class.getPackage().getImplementationVersion();
			var strings = new ArrayList<String>();
			if (version != null)
				strings.add("PackShot v" + version);
			strings.add("Java " + System.getProperty("java.version"));
			return strings.toArray(String[]::new);
		}

	}

}
