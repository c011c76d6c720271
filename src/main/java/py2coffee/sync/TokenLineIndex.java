package py2coffee.sync;

import py2coffee.parse.py.PyLexer;
import py2coffee.parse.py.PyToken;
import py2coffee.parse.py.PyTokenType;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;

/**
 * Tokens of one source file partitioned by physical row.
 *
 * A token is bucketed on its starting row, except a string token, which is
 * bucketed on its ending row. Rows are 1-based; there is one bucket per source
 * row plus a final one for the end-of-file tokens.
 */
public final class TokenLineIndex {
	private static final String BLANK_LINE = "\n";

	private final List<String> lines;
	private final List<List<PyToken>> buckets;
	private final PyToken[] comments;
	private final List<Deque<PyToken>> strings;

	public TokenLineIndex(String source, List<PyToken> tokens) {
		this.lines = new ArrayList<>();
		for (String line : PyLexer.splitLines(source)) {
			lines.add(line.stripTrailing());
		}

		int bucketCount = lines.size() + 1;
		this.buckets = new ArrayList<>(bucketCount);
		this.strings = new ArrayList<>(bucketCount);
		for (int i = 0; i < bucketCount; i++) {
			buckets.add(new ArrayList<>());
			strings.add(new ArrayDeque<>());
		}

		for (PyToken token : tokens) {
			int row = bucketRow(token);
			if (row < 1 || row > bucketCount) {
				throw new TokenSyncException("token " + token.type() + " on row " + row + " is outside the "
						+ lines.size() + " source lines");
			}
			buckets.get(row - 1).add(token);
			if (token.type() == PyTokenType.STRING) {
				strings.get(row - 1).add(token);
			}
		}

		this.comments = new PyToken[bucketCount];
		for (int i = 0; i < bucketCount; i++) {
			for (PyToken token : buckets.get(i)) {
				if (token.type() != PyTokenType.COMMENT) {
					// anything filed before a comment makes it trailing, including
					// a multi-line string that closes on this row
					break;
				}
				if (!isLineComment(token)) {
					continue;
				}
				if (comments[i] != null) {
					throw new TokenSyncException("row " + (i + 1) + " holds more than one full-line comment");
				}
				comments[i] = token;
			}
		}
	}

	/**
	 * Row a token is filed under: the ending row for strings, the starting row
	 * otherwise.
	 */
	public static int bucketRow(PyToken token) {
		return token.type() == PyTokenType.STRING ? token.endRow() : token.startRow();
	}

	public int lineCount() {
		return lines.size();
	}

	/**
	 * The physical line at {@code row} without trailing whitespace.
	 */
	public String line(int row) {
		return lines.get(row - 1);
	}

	public List<PyToken> tokensOn(int row) {
		return List.copyOf(buckets.get(row - 1));
	}

	/**
	 * The full-line comment on {@code row}, or null.
	 */
	public PyToken commentOn(int row) {
		return comments[row - 1];
	}

	public boolean isBlank(int row) {
		List<PyToken> bucket = buckets.get(row - 1);
		return bucket.size() == 1 && bucket.get(0).type() == PyTokenType.NL;
	}

	/**
	 * The text a comment or blank row contributes as leading context, ending in
	 * a newline, or null for any other row.
	 */
	public String ignoredLine(int row) {
		PyToken comment = commentOn(row);
		if (comment != null) {
			return comment.line().stripTrailing() + "\n";
		}
		return isBlank(row) ? BLANK_LINE : null;
	}

	/**
	 * Removes and returns the leftmost string token not yet consumed on
	 * {@code row}, or null when none is left.
	 */
	public PyToken pollString(int row) {
		if (row < 1 || row > strings.size()) {
			return null;
		}
		return strings.get(row - 1).poll();
	}

	private static boolean isLineComment(PyToken token) {
		return token.type() == PyTokenType.COMMENT && token.line().stripLeading().startsWith("#");
	}
}
