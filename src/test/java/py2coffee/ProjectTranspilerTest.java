package py2coffee;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import py2coffee.config.TranspilerConfig;

import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;

public class ProjectTranspilerTest {
	private static final Clock CLOCK = Clock.fixed(Instant.parse("2026-10-17T12:00:00Z"), ZoneOffset.UTC);

	private static TranspilerConfig config(Path out) {
		return TranspilerConfig.defaults()
				.withOutputDirectory(out)
				.withTimestamp(false)
				.withJobs(2);
	}

	private static ProjectTranspiler transpiler(TranspilerConfig config) {
		return new ProjectTranspiler(config, d -> {
		}, CLOCK);
	}

	@Test
	void transpilesEachFileSeparately(@TempDir Path dir) throws Exception {
		Path out = Files.createDirectory(dir.resolve("out"));
		Path a = Files.writeString(dir.resolve("a.py"), "x = 1\n");
		Path b = Files.writeString(dir.resolve("b.py"), "def f():\n    pass\n");

		List<TranspileResult> results = transpiler(config(out)).transpileFiles(List.of(a, b));

		assertEquals(TranspileResult.Status.WRITTEN, results.get(0).status());
		assertEquals(TranspileResult.Status.WRITTEN, results.get(1).status());
		assertEquals("x=1\n", Files.readString(out.resolve("a.coffee")));
		assertEquals("f = ->\n    pass\n", Files.readString(out.resolve("b.coffee")));
	}

	@Test
	void reportsSkippedInputs(@TempDir Path dir) throws Exception {
		Path out = Files.createDirectory(dir.resolve("out"));
		Path text = Files.writeString(dir.resolve("notes.txt"), "x\n");
		Path missing = dir.resolve("missing.py");
		Path existing = Files.writeString(dir.resolve("kept.py"), "x = 1\n");
		Files.writeString(out.resolve("kept.coffee"), "old\n");

		List<TranspileResult> results = transpiler(config(out)).transpileFiles(List.of(text, missing, existing));

		assertEquals(TranspileResult.Status.SKIPPED_NOT_PYTHON, results.get(0).status());
		assertEquals(TranspileResult.Status.SKIPPED_MISSING, results.get(1).status());
		assertEquals(TranspileResult.Status.SKIPPED_EXISTS, results.get(2).status());
		assertEquals("old\n", Files.readString(out.resolve("kept.coffee")));
	}

	@Test
	void overwriteReplacesExistingOutput(@TempDir Path dir) throws Exception {
		Path out = Files.createDirectory(dir.resolve("out"));
		Path input = Files.writeString(dir.resolve("kept.py"), "x = 1\n");
		Files.writeString(out.resolve("kept.coffee"), "old\n");

		List<TranspileResult> results = transpiler(config(out).withOverwrite(true)).transpileFiles(List.of(input));

		assertEquals(TranspileResult.Status.WRITTEN, results.get(0).status());
		assertEquals("x=1\n", Files.readString(out.resolve("kept.coffee")));
	}

	@Test
	void missingOutputDirectorySkipsEveryFile(@TempDir Path dir) throws Exception {
		Path input = Files.writeString(dir.resolve("a.py"), "x = 1\n");

		List<TranspileResult> results = transpiler(config(null)).transpileFiles(List.of(input));

		assertEquals(TranspileResult.Status.SKIPPED_NO_OUTPUT_DIR, results.get(0).status());
		assertNull(results.get(0).output());
	}

	@Test
	void failureInOneFileDoesNotStopTheOthers(@TempDir Path dir) throws Exception {
		Path out = Files.createDirectory(dir.resolve("out"));
		Path broken = Files.writeString(dir.resolve("broken.py"), "def (:\n");
		Path good = Files.writeString(dir.resolve("good.py"), "y = 2\n");

		List<TranspileResult> results = transpiler(config(out)).transpileFiles(List.of(broken, good));

		assertTrue(results.get(0).failed());
		assertInstanceOf(TranspileException.class, results.get(0).error());
		assertTrue(Files.notExists(out.resolve("broken.coffee")));
		assertEquals(TranspileResult.Status.WRITTEN, results.get(1).status());
	}

	@Test
	void prependsTimestampHeader(@TempDir Path dir) throws Exception {
		Path out = Files.createDirectory(dir.resolve("out"));
		Path input = Files.writeString(dir.resolve("a.py"), "x = 1\n");

		transpiler(config(out).withTimestamp(true)).transpileFiles(List.of(input));

		assertEquals("# py2coffee: Sat 17 Oct 2026 at 12:00:00\nx=1\n", Files.readString(out.resolve("a.coffee")));
	}
}
