package py2coffee.sync;

import org.junit.jupiter.api.Test;
import py2coffee.ast.py.PyAssign;
import py2coffee.ast.py.PyModule;
import py2coffee.ast.py.PyStr;
import py2coffee.diagnostics.Diagnostic;
import py2coffee.parse.py.PyLexer;
import py2coffee.parse.py.PyParser;
import py2coffee.parse.py.PyToken;

import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

public class TokenSyncTest {
	private final List<Diagnostic> diagnostics = new ArrayList<>();

	private TokenSync sync(String source) {
		List<PyToken> tokens = new PyLexer().lex(source);
		return new TokenSync(source, tokens, diagnostics::add);
	}

	@Test
	void leadingLinesAreHandedOutOnce() {
		String source = "# a\n\nx = 1\n# b\ny = 2\n";
		PyModule module = new PyParser().parse(source);
		TokenSync sync = sync(source);

		assertEquals(List.of("# a\n", "\n"), sync.leadingLines(module.body().get(0)));
		assertEquals(List.of(), sync.leadingLines(module.body().get(0)));
		assertEquals(List.of("# b\n"), sync.leadingLines(module.body().get(1)));
		assertEquals(5, sync.cursor());
	}

	@Test
	void cursorNeverMovesBack() {
		String source = "x = 1\n# c\ny = 2\n";
		PyModule module = new PyParser().parse(source);
		TokenSync sync = sync(source);

		sync.leadingLines(module.body().get(1));
		assertEquals(List.of(), sync.leadingLines(module.body().get(0)));
		assertEquals(3, sync.cursor());
	}

	@Test
	void nodeWithoutRowGetsNothing() {
		String source = "# c\nx = 1\n";
		TokenSync sync = sync(source);

		assertEquals(List.of(), sync.leadingLines(new PyModule(List.of())));
		assertEquals(1, sync.cursor());
	}

	@Test
	void recoversExactSpellingOfAdjacentLiterals() {
		String source = "a = r'\\n' 'x'\n";
		PyAssign assign = (PyAssign) new PyParser().parse(source).body().get(0);
		TokenSync sync = sync(source);

		assertEquals("r'\\n' 'x'", sync.recoverLiteralSpelling((PyStr) assign.value()));
		assertTrue(diagnostics.isEmpty());
	}

	@Test
	void fallsBackToValueWhenRowRunsOutOfStrings() {
		String source = "a = 'x'\n";
		PyStr str = (PyStr) ((PyAssign) new PyParser().parse(source).body().get(0)).value();
		TokenSync sync = sync(source);

		assertEquals("'x'", sync.recoverLiteralSpelling(str));
		assertEquals("x", sync.recoverLiteralSpelling(str));
		assertEquals(1, diagnostics.size());
		assertEquals(Diagnostic.Kind.STRING_UNDERFLOW, diagnostics.get(0).kind());
		assertEquals(1, diagnostics.get(0).line());
	}

	@Test
	void rawLineSpanFollowsContinuations() {
		String source = "x = 1 + \\\n    2\n";
		PyModule module = new PyParser().parse(source);
		TokenSync sync = sync(source);

		assertEquals("x = 1 + \\", sync.rawLineSpan(module.body().get(0), false));
		assertEquals("x = 1 +     2", sync.rawLineSpan(module.body().get(0), true));
		assertEquals("<no line> for PyModule", sync.rawLineSpan(module, true));
	}

	@Test
	void remainingLinesReachTheEndOfFile() {
		String source = "x = 1\n# end\n\n";
		PyModule module = new PyParser().parse(source);
		TokenSync sync = sync(source);

		assertEquals(List.of(), sync.leadingLines(module.body().get(0)));
		assertEquals(List.of("# end\n", "\n"), sync.remainingLines());
		assertEquals(List.of(), sync.remainingLines());
	}
}
