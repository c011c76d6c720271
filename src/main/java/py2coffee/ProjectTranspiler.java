package py2coffee;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import py2coffee.config.TranspilerConfig;
import py2coffee.diagnostics.Diagnostics;
import py2coffee.print.PrinterOptions;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;

/**
 * Translates a list of Python files, each into its own {@code .coffee} file
 * in the configured output directory.
 */
public final class ProjectTranspiler {
	private static final Logger LOG = LoggerFactory.getLogger(ProjectTranspiler.class);

	static final String SOURCE_EXTENSION = ".py";
	static final String TARGET_EXTENSION = ".coffee";

	private static final DateTimeFormatter HEADER_TIME = DateTimeFormatter.ofPattern("EEE dd MMM yyyy 'at' HH:mm:ss",
			Locale.ENGLISH);

	private final TranspilerConfig config;
	private final Transpiler transpiler;
	private final Clock clock;

	public ProjectTranspiler(TranspilerConfig config) {
		this(config, Diagnostics.logging(), Clock.systemDefaultZone());
	}

	public ProjectTranspiler(TranspilerConfig config, Diagnostics diagnostics, Clock clock) {
		this.config = config;
		this.transpiler = new Transpiler(new PrinterOptions(config.strictOperators()), diagnostics);
		this.clock = clock;
	}

	/**
	 * Translates {@code inputs} on {@code jobs} worker threads. Results come
	 * back in input order; a failing file does not stop the others.
	 */
	public List<TranspileResult> transpileFiles(List<Path> inputs) throws InterruptedException {
		ExecutorService pool = Executors.newFixedThreadPool(config.jobs());
		try {
			List<Future<TranspileResult>> futures = new ArrayList<>();
			for (Path input : inputs) {
				futures.add(pool.submit(() -> transpileOne(input)));
			}
			List<TranspileResult> results = new ArrayList<>();
			for (int i = 0; i < futures.size(); i++) {
				results.add(await(inputs.get(i), futures.get(i)));
			}
			return results;
		} finally {
			pool.shutdownNow();
		}
	}

	private static TranspileResult await(Path input, Future<TranspileResult> future) throws InterruptedException {
		try {
			return future.get();
		} catch (ExecutionException ex) {
			Throwable cause = ex.getCause();
			LOG.error("{}: unexpected failure", input, cause);
			Exception error = cause instanceof Exception ? (Exception) cause : ex;
			return new TranspileResult(input, null, TranspileResult.Status.FAILED, error);
		}
	}

	TranspileResult transpileOne(Path input) {
		String fileName = input.getFileName().toString();
		if (!fileName.endsWith(SOURCE_EXTENSION)) {
			LOG.info("not a .py file: {}", input);
			return TranspileResult.skipped(input, null, TranspileResult.Status.SKIPPED_NOT_PYTHON);
		}
		if (!Files.isRegularFile(input)) {
			LOG.warn("file not found: {}", input);
			return TranspileResult.skipped(input, null, TranspileResult.Status.SKIPPED_MISSING);
		}
		Path outputDirectory = config.outputDirectory();
		if (outputDirectory == null || !Files.isDirectory(outputDirectory)) {
			LOG.warn("output directory not found: {}", outputDirectory);
			return TranspileResult.skipped(input, null, TranspileResult.Status.SKIPPED_NO_OUTPUT_DIR);
		}

		Path output = outputDirectory.resolve(outputName(fileName));
		if (Files.exists(output) && !config.overwrite()) {
			LOG.info("file exists: {}", output);
			return TranspileResult.skipped(input, output, TranspileResult.Status.SKIPPED_EXISTS);
		}

		try {
			String source = Files.readString(input, StandardCharsets.UTF_8);
			String text = header() + transpiler.transpile(source);
			Files.writeString(output, text, StandardCharsets.UTF_8);
			LOG.debug("wrote {}", output);
			return new TranspileResult(input, output, TranspileResult.Status.WRITTEN, null);
		} catch (IOException | TranspileException ex) {
			LOG.error("{}: {}", input, ex.getMessage());
			return new TranspileResult(input, output, TranspileResult.Status.FAILED, ex);
		}
	}

	static String outputName(String fileName) {
		return fileName.substring(0, fileName.length() - SOURCE_EXTENSION.length()) + TARGET_EXTENSION;
	}

	private String header() {
		if (!config.timestamp()) {
			return "";
		}
		return "# py2coffee: " + HEADER_TIME.format(LocalDateTime.now(clock)) + "\n";
	}
}
