package py2coffee.sync;

import py2coffee.ast.py.PyNode;
import py2coffee.ast.py.PyStr;
import py2coffee.diagnostics.Diagnostic;
import py2coffee.diagnostics.Diagnostics;
import py2coffee.parse.py.PyToken;

import java.util.ArrayList;
import java.util.List;

/**
 * Feeds the printer the source details the parse tree drops: comment and
 * blank lines in front of statements, and the exact spelling of string
 * literals.
 *
 * Both lookups consume what they return, so one instance serves exactly one
 * depth-first walk of one file. Nodes must be asked about in source order.
 */
public final class TokenSync {
	private final TokenLineIndex index;
	private final Diagnostics diagnostics;

	// first row not yet attributed as leading context
	private int cursor = 1;

	public TokenSync(String source, List<PyToken> tokens) {
		this(source, tokens, Diagnostics.logging());
	}

	public TokenSync(String source, List<PyToken> tokens, Diagnostics diagnostics) {
		this.index = new TokenLineIndex(source, tokens);
		this.diagnostics = diagnostics;
	}

	/**
	 * Returns the comment and blank lines between the previous call and the row
	 * of {@code node}, each ending in a newline. A node without a row gets an
	 * empty list. Asking about a row at or before one already covered returns
	 * nothing; the cursor never moves back.
	 */
	public List<String> leadingLines(PyNode node) {
		int row = node.line();
		if (row <= 0) {
			return List.of();
		}
		List<String> leading = linesBefore(row);
		cursor = Math.max(cursor, row);
		return leading;
	}

	/**
	 * Returns the comment and blank lines from the cursor to the end of the
	 * file, as {@link #leadingLines(PyNode)} would for a node after the last
	 * row. Called once the last statement is printed.
	 */
	public List<String> remainingLines() {
		int end = index.lineCount() + 1;
		List<String> trailing = linesBefore(end);
		cursor = Math.max(cursor, end);
		return trailing;
	}

	private List<String> linesBefore(int row) {
		List<String> lines = new ArrayList<>();
		int last = Math.min(row, index.lineCount() + 1);
		for (int r = cursor; r < last; r++) {
			String line = index.ignoredLine(r);
			if (line != null) {
				lines.add(line);
			}
		}
		return lines;
	}

	public String leadingString(PyNode node) {
		return String.join("", leadingLines(node));
	}

	/**
	 * Returns the source spelling of a string literal, quotes, prefix and
	 * escapes included. Adjacent literals ({@code "a" "b"}) come back joined by
	 * a space. When a row has no string token left, the decoded value stored on
	 * the node is returned instead and a diagnostic is reported.
	 */
	public String recoverLiteralSpelling(PyStr node) {
		List<String> parts = new ArrayList<>();
		for (int row : node.tokenLines()) {
			PyToken token = index.pollString(row);
			if (token == null) {
				diagnostics.report(Diagnostic.Kind.STRING_UNDERFLOW, row,
						"no string token left for literal " + truncate(node.value(), 40));
				return node.value();
			}
			parts.add(token.text());
		}
		return String.join(" ", parts);
	}

	/**
	 * Returns the source line of {@code node}. With {@code followContinuations},
	 * rows ending in a backslash are joined with the rows that follow them.
	 * Meant for diagnostics only.
	 */
	public String rawLineSpan(PyNode node, boolean followContinuations) {
		int row = node.line();
		if (row <= 0 || row > index.lineCount()) {
			return "<no line> for " + node.getClass().getSimpleName();
		}
		if (!followContinuations) {
			return index.line(row);
		}
		StringBuilder out = new StringBuilder();
		for (int r = row; r <= index.lineCount(); r++) {
			String line = index.line(r);
			if (!line.endsWith("\\")) {
				out.append(line);
				break;
			}
			out.append(line, 0, line.length() - 1);
		}
		return out.toString();
	}

	/**
	 * First row not yet handed out by {@link #leadingLines(PyNode)}.
	 */
	public int cursor() {
		return cursor;
	}

	private static String truncate(String s, int n) {
		return s.length() <= n ? s : s.substring(0, n - 3) + "...";
	}
}
