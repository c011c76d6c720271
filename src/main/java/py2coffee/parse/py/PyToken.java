package py2coffee.parse.py;

import py2coffee.ast.SourceSpan;

/**
 * One lexical unit.
 *
 * {@code text} is the token as written. {@code line} is the raw physical line
 * the token sits on, line terminator included; for a string spanning several
 * rows it is all of those rows.
 */
public record PyToken(PyTokenType type, String text, String line, SourceSpan span) {
	public boolean is(PyTokenType type, String text) {
		return this.type == type && this.text.equals(text);
	}

	public boolean isOp(String text) {
		return is(PyTokenType.OP, text);
	}

	public boolean isName(String text) {
		return is(PyTokenType.NAME, text);
	}

	public int startRow() {
		return span.startRow();
	}

	public int endRow() {
		return span.endRow();
	}
}
