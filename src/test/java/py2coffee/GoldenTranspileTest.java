package py2coffee;

import org.junit.jupiter.api.Test;

import java.nio.file.Files;
import java.nio.file.Path;

import static org.junit.jupiter.api.Assertions.assertEquals;

public class GoldenTranspileTest {
	@Test
	void transpilesSamplePythonToExpectedCoffeeScript() throws Exception {
		Path pythonSourcePath = Path.of("src", "test", "resources", "golden", "Sample.py");
		Path expectedCoffeePath = Path.of("src", "test", "resources", "golden", "Sample.coffee");

		String pythonSource = Files.readString(pythonSourcePath);
		String expected = Files.readString(expectedCoffeePath);
		String actual = new Transpiler().transpile(pythonSource);

		assertEquals(normalize(expected), normalize(actual));
	}

	private static String normalize(String s) {
		String normalized = s.replace("\r\n", "\n");
		if (!normalized.endsWith("\n")) {
			normalized += "\n";
		}
		return normalized;
	}
}
