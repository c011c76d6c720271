package py2coffee;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import picocli.CommandLine;

import java.io.PrintWriter;
import java.io.StringWriter;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

public class MainTest {
	private final StringWriter out = new StringWriter();
	private final StringWriter err = new StringWriter();

	private int run(String... args) {
		CommandLine cmd = new CommandLine(new Main());
		cmd.setOut(new PrintWriter(out));
		cmd.setErr(new PrintWriter(err));
		return cmd.execute(args);
	}

	@AfterEach
	void resetLogLevel() {
		System.clearProperty(Main.LOG_LEVEL_PROPERTY);
	}

	@Test
	void reportsWhenThereIsNothingToDo() {
		assertEquals(0, run());
		assertTrue(out.toString().contains("no input files"));
	}

	@Test
	void rejectsMissingOutputDirectory(@TempDir Path dir) throws Exception {
		Path input = Files.writeString(dir.resolve("a.py"), "x = 1\n");

		assertEquals(1, run("-d", dir.resolve("nowhere").toString(), input.toString()));
		assertTrue(err.toString().contains("output directory not found"));
	}

	@Test
	void writesOneCoffeeFilePerInput(@TempDir Path dir) throws Exception {
		Path outDir = Files.createDirectory(dir.resolve("out"));
		Path input = Files.writeString(dir.resolve("a.py"), "x = 1\n");

		assertEquals(0, run("--no-timestamp", "-d", outDir.toString(), input.toString()));

		assertEquals("x=1\n", Files.readString(outDir.resolve("a.coffee")));
		assertTrue(out.toString().contains("wrote: "));
		assertTrue(out.toString().contains("done"));
	}

	@Test
	void readsInputsFromConfigFile(@TempDir Path dir) throws Exception {
		Files.createDirectory(dir.resolve("out"));
		Files.writeString(dir.resolve("a.py"), "y = 2\n");
		Path config = Files.writeString(dir.resolve("py2coffee.properties"),
				"files = *.py\noutput_directory = out\ntimestamp = false\n");

		assertEquals(0, run("-c", config.toString()));

		assertEquals("y=2\n", Files.readString(dir.resolve("out").resolve("a.coffee")));
	}

	@Test
	void failedFileSetsExitCode(@TempDir Path dir) throws Exception {
		Path outDir = Files.createDirectory(dir.resolve("out"));
		Path broken = Files.writeString(dir.resolve("broken.py"), "def (:\n");
		Path good = Files.writeString(dir.resolve("good.py"), "x = 1\n");

		assertEquals(1, run("-d", outDir.toString(), broken.toString(), good.toString()));

		assertTrue(Files.exists(outDir.resolve("good.coffee")));
		assertTrue(err.toString().contains("failed: "));
	}

	@Test
	void strictFlagTurnsUnknownOperatorIntoFailure(@TempDir Path dir) throws Exception {
		Path outDir = Files.createDirectory(dir.resolve("out"));
		Path input = Files.writeString(dir.resolve("m.py"), "x = a @ b\n");

		assertEquals(1, run("-s", "-d", outDir.toString(), input.toString()));
	}

	@Test
	void missingConfiguredOutputDirectorySkipsEveryFile(@TempDir Path dir) throws Exception {
		Files.writeString(dir.resolve("a.py"), "x = 1\n");
		Path config = Files.writeString(dir.resolve("py2coffee.properties"),
				"files = a.py\noutput_directory = nowhere\n");

		assertEquals(0, run("-c", config.toString()));

		assertTrue(out.toString().contains("SKIPPED_NO_OUTPUT_DIR"), out.toString());
		assertTrue(out.toString().contains("done"));
		assertFalse(Files.exists(dir.resolve("a.coffee")));
	}

	@Test
	void verboseSettingRaisesTheLogLevel(@TempDir Path dir) throws Exception {
		Path config = Files.writeString(dir.resolve("py2coffee.properties"), "verbose = true\n");

		assertEquals(0, run("-c", config.toString()));

		assertEquals("debug", System.getProperty(Main.LOG_LEVEL_PROPERTY));
	}

	@Test
	void malformedPatternIsAConfigurationError(@TempDir Path dir) throws Exception {
		Files.createDirectory(dir.resolve("src"));
		Path config = Files.writeString(dir.resolve("py2coffee.properties"), "files = src/[a.py\n");

		assertEquals(1, run("-c", config.toString()));

		assertTrue(err.toString().contains("cannot read configuration"), err.toString());
	}
}
