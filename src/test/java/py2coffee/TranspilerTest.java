package py2coffee;

import org.junit.jupiter.api.Test;
import py2coffee.diagnostics.Diagnostic;
import py2coffee.parse.py.PySyntaxException;
import py2coffee.print.PrinterOptions;
import py2coffee.print.UnknownOperatorException;

import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

public class TranspilerTest {
	@Test
	void emptySourceGivesEmptyOutput() {
		assertEquals("", new Transpiler().transpile(""));
	}

	@Test
	void keepsTrailingCommentsOutOfOutput() {
		assertEquals("x=1\n", new Transpiler().transpile("x = 1  # trailing\n"));
	}

	@Test
	void fatalErrorsShareOneBaseType() {
		assertThrows(TranspileException.class, () -> new Transpiler().transpile("def (:\n"));
		assertThrows(PySyntaxException.class, () -> new Transpiler().transpile("x = 'open\n"));

		Transpiler strict = new Transpiler(new PrinterOptions(true), d -> {
		});
		assertThrows(UnknownOperatorException.class, () -> strict.transpile("a @= b\n"));
	}

	@Test
	void forwardsDiagnosticsToTheGivenSink() {
		List<Diagnostic> diagnostics = new ArrayList<>();

		String out = new Transpiler(PrinterOptions.DEFAULT, diagnostics::add).transpile("a @= b\n");

		assertEquals("a<MAT_MULT>=b\n", out);
		assertEquals(Diagnostic.Kind.UNKNOWN_OPERATOR, diagnostics.get(0).kind());
		assertEquals(1, diagnostics.get(0).line());
	}
}
