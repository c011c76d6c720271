package py2coffee;

import py2coffee.ast.py.PyModule;
import py2coffee.diagnostics.Diagnostics;
import py2coffee.parse.py.PyLexer;
import py2coffee.parse.py.PyParser;
import py2coffee.parse.py.PyToken;
import py2coffee.print.CoffeeScriptPrinter;
import py2coffee.print.PrinterOptions;
import py2coffee.sync.TokenSync;

import java.util.List;

/**
 * Public entrypoint for Python -> CoffeeScript translation of one source text.
 *
 * Each call lexes and parses once and builds its own synchronizer and
 * printer, so an instance may be shared between threads.
 */
public final class Transpiler {
	private final PrinterOptions options;
	private final Diagnostics diagnostics;

	public Transpiler() {
		this(PrinterOptions.DEFAULT, Diagnostics.logging());
	}

	public Transpiler(PrinterOptions options, Diagnostics diagnostics) {
		this.options = options;
		this.diagnostics = diagnostics;
	}

	public String transpile(String pythonSource) {
		List<PyToken> tokens = new PyLexer().lex(pythonSource);
		PyModule module = new PyParser().parse(tokens);
		TokenSync sync = new TokenSync(pythonSource, tokens, diagnostics);
		return new CoffeeScriptPrinter(options, diagnostics).print(module, sync);
	}
}
