package py2coffee.config;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Properties;

/**
 * Settings of one batch run.
 *
 * Loaded from a {@code .properties} file and then overridden by command-line
 * options. Paths are absolute once loaded.
 *
 * @param files           input files, already expanded
 * @param outputDirectory directory the {@code .coffee} files go to, or null
 *                        when the configured one does not exist
 * @param overwrite       replace existing output files
 * @param strictOperators fail on operators without a CoffeeScript spelling
 * @param timestamp       prepend a generation header to each output file
 * @param jobs            worker threads
 * @param verbose         report every file written
 */
public record TranspilerConfig(
		List<Path> files,
		Path outputDirectory,
		boolean overwrite,
		boolean strictOperators,
		boolean timestamp,
		int jobs,
		boolean verbose) {
	private static final Logger LOG = LoggerFactory.getLogger(TranspilerConfig.class);

	public static final String FILES = "files";
	public static final String OUTPUT_DIRECTORY = "output_directory";
	public static final String OVERWRITE = "overwrite";
	public static final String STRICT_OPERATORS = "strict_operators";
	public static final String TIMESTAMP = "timestamp";
	public static final String JOBS = "jobs";
	public static final String VERBOSE = "verbose";

	public TranspilerConfig {
		files = List.copyOf(files);
		if (jobs < 1) {
			throw new IllegalArgumentException("jobs must be at least 1, got " + jobs);
		}
	}

	public static TranspilerConfig defaults() {
		return new TranspilerConfig(List.of(), Path.of(".").toAbsolutePath().normalize(), false, false, true,
				Runtime.getRuntime().availableProcessors(), false);
	}

	/**
	 * Loads {@code configFile}. Keys that are absent keep their default.
	 */
	public static TranspilerConfig load(Path configFile) throws IOException {
		Properties props = new Properties();
		try (var reader = Files.newBufferedReader(configFile)) {
			props.load(reader);
		}
		Path base = configFile.toAbsolutePath().getParent();
		return fromProperties(props, base);
	}

	static TranspilerConfig fromProperties(Properties props, Path base) throws IOException {
		TranspilerConfig defaults = defaults();

		List<Path> files = defaults.files();
		String patterns = props.getProperty(FILES);
		if (patterns != null) {
			files = FileGlobs.expand(FileGlobs.split(patterns), base);
		}

		Path outputDirectory = defaults.outputDirectory();
		String dir = props.getProperty(OUTPUT_DIRECTORY);
		if (dir != null && !dir.isBlank()) {
			outputDirectory = resolve(dir.strip(), base);
			if (!Files.isDirectory(outputDirectory)) {
				LOG.error("output directory not found: {}", outputDirectory);
				outputDirectory = null;
			}
		}

		return new TranspilerConfig(
				files,
				outputDirectory,
				flag(props, OVERWRITE, defaults.overwrite()),
				flag(props, STRICT_OPERATORS, defaults.strictOperators()),
				flag(props, TIMESTAMP, defaults.timestamp()),
				Integer.parseInt(props.getProperty(JOBS, String.valueOf(defaults.jobs())).strip()),
				flag(props, VERBOSE, defaults.verbose()));
	}

	private static boolean flag(Properties props, String key, boolean fallback) {
		String value = props.getProperty(key);
		return value == null ? fallback : Boolean.parseBoolean(value.strip());
	}

	/**
	 * Resolves {@code path} against {@code base}, expanding a leading {@code ~}.
	 */
	static Path resolve(String path, Path base) {
		if (path.equals("~") || path.startsWith("~/")) {
			path = System.getProperty("user.home") + path.substring(1);
		}
		return base.resolve(path).toAbsolutePath().normalize();
	}

	public TranspilerConfig withFiles(List<Path> files) {
		return new TranspilerConfig(files, outputDirectory, overwrite, strictOperators, timestamp, jobs, verbose);
	}

	public TranspilerConfig withOutputDirectory(Path outputDirectory) {
		return new TranspilerConfig(files, outputDirectory, overwrite, strictOperators, timestamp, jobs, verbose);
	}

	public TranspilerConfig withOverwrite(boolean overwrite) {
		return new TranspilerConfig(files, outputDirectory, overwrite, strictOperators, timestamp, jobs, verbose);
	}

	public TranspilerConfig withStrictOperators(boolean strictOperators) {
		return new TranspilerConfig(files, outputDirectory, overwrite, strictOperators, timestamp, jobs, verbose);
	}

	public TranspilerConfig withTimestamp(boolean timestamp) {
		return new TranspilerConfig(files, outputDirectory, overwrite, strictOperators, timestamp, jobs, verbose);
	}

	public TranspilerConfig withJobs(int jobs) {
		return new TranspilerConfig(files, outputDirectory, overwrite, strictOperators, timestamp, jobs, verbose);
	}

	public TranspilerConfig withVerbose(boolean verbose) {
		return new TranspilerConfig(files, outputDirectory, overwrite, strictOperators, timestamp, jobs, verbose);
	}
}
