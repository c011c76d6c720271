package py2coffee;

import picocli.CommandLine;
import py2coffee.config.TranspilerConfig;

import java.io.IOException;
import java.io.PrintWriter;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.concurrent.Callable;
import java.util.stream.Collectors;

@CommandLine.Command(
		name = "py2coffee",
		description = "Translates Python 3 source files to CoffeeScript",
		version = "1.0",
		mixinStandardHelpOptions = true)
public final class Main implements Callable<Integer> {
	/** Level of every py2coffee logger created after it is set. */
	static final String LOG_LEVEL_PROPERTY = "org.slf4j.simpleLogger.log.py2coffee";

	@CommandLine.Option(
			names = {"-c", "--config"},
			description = "Configuration file (.properties)")
	private Path config;

	@CommandLine.Option(
			names = {"-d", "--dir"},
			description = "Output directory")
	private Path dir;

	@CommandLine.Option(
			names = {"-o", "--overwrite"},
			description = "Overwrite existing .coffee files")
	private boolean overwrite;

	@CommandLine.Option(
			names = {"-v", "--verbose"},
			description = "Verbose logging")
	private boolean verbose;

	@CommandLine.Option(
			names = {"-s", "--strict"},
			description = "Fail on operators without a CoffeeScript spelling")
	private boolean strict;

	@CommandLine.Option(
			names = {"-j", "--jobs"},
			description = "Worker threads")
	private Integer jobs;

	@CommandLine.Option(
			names = "--no-timestamp",
			description = "Omit the generation header")
	private boolean noTimestamp;

	@CommandLine.Parameters(description = "Python files to translate")
	private List<Path> files;

	@CommandLine.Spec
	private CommandLine.Model.CommandSpec spec;

	public static void main(String[] args) {
		int exitCode = new CommandLine(new Main()).execute(args);
		System.exit(exitCode);
	}

	@Override
	public Integer call() throws Exception {
		PrintWriter out = spec.commandLine().getOut();
		PrintWriter err = spec.commandLine().getErr();
		if (verbose) {
			enableDebugLogging();
		}

		TranspilerConfig settings;
		try {
			settings = config == null ? TranspilerConfig.defaults() : TranspilerConfig.load(config);
		} catch (IOException | IllegalArgumentException ex) {
			err.println("Error: cannot read configuration " + config + ": " + ex.getMessage());
			return 1;
		}

		if (dir != null) {
			if (!Files.isDirectory(dir)) {
				err.println("Error: output directory not found: " + dir);
				return 1;
			}
			settings = settings.withOutputDirectory(dir.toAbsolutePath().normalize());
		}
		if (files != null && !files.isEmpty()) {
			settings = settings.withFiles(files.stream()
					.map(p -> p.toAbsolutePath().normalize())
					.collect(Collectors.toList()));
		}
		settings = settings
				.withOverwrite(settings.overwrite() || overwrite)
				.withStrictOperators(settings.strictOperators() || strict)
				.withTimestamp(settings.timestamp() && !noTimestamp)
				.withVerbose(settings.verbose() || verbose);
		if (settings.verbose()) {
			enableDebugLogging();
		}
		if (jobs != null) {
			if (jobs < 1) {
				err.println("Error: --jobs must be at least 1");
				return 1;
			}
			settings = settings.withJobs(jobs);
		}

		if (settings.files().isEmpty()) {
			out.println("no input files");
			return 0;
		}
		List<TranspileResult> results = new ProjectTranspiler(settings).transpileFiles(settings.files());
		boolean failed = false;
		for (TranspileResult result : results) {
			if (result.status() == TranspileResult.Status.WRITTEN) {
				out.println("wrote: " + result.output());
			} else if (result.failed()) {
				failed = true;
				err.println("failed: " + result.input() + ": " + result.error().getMessage());
			} else {
				out.println("skipped: " + result.input() + " (" + result.status() + ")");
			}
		}
		out.println("done");
		return failed ? 1 : 0;
	}

	private static void enableDebugLogging() {
		System.setProperty(LOG_LEVEL_PROPERTY, "debug");
	}
}
