package py2coffee.config;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;

public class FileGlobsTest {
	@Test
	void splitsOnCommasAndNewlines() {
		assertEquals(List.of("a.py", "b/*.py", "c.py"), FileGlobs.split("a.py, b/*.py\n\n  c.py,"));
	}

	@Test
	void expandsPatternsBelowTheirFixedPrefix(@TempDir Path dir) throws Exception {
		Path pkg = Files.createDirectories(dir.resolve("pkg").resolve("sub"));
		Path top = Files.writeString(dir.resolve("pkg").resolve("top.py"), "");
		Path deep = Files.writeString(pkg.resolve("deep.py"), "");
		Path plain = Files.writeString(dir.resolve("plain.py"), "");

		List<Path> files = FileGlobs.expand(List.of("plain.py", "pkg/**/*.py", "pkg/*.py", "gone.py"), dir);

		assertEquals(List.of(plain, deep, top), files);
	}
}
