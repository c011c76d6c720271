package py2coffee.parse.py;

import py2coffee.ast.SourceSpan;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Tokenizer for Python 3 source.
 *
 * Follows the standard {@code tokenize} contract: comments, blank lines and
 * line breaks inside brackets come out as COMMENT/NL tokens rather than being
 * skipped, so later passes can recover them. Rows are 1-based, columns 0-based.
 */
public final class PyLexer {
	private static final String DIGITS = "[0-9](?:_?[0-9])*";
	private static final String EXPONENT = "[eE][-+]?" + DIGITS;
	private static final String POINT_FLOAT = "(?:" + DIGITS + "\\.(?:" + DIGITS + ")?|\\." + DIGITS + ")(?:"
			+ EXPONENT + ")?";
	private static final String FLOAT = "(?:" + POINT_FLOAT + "|" + DIGITS + EXPONENT + ")";
	private static final String IMAGINARY = "(?:" + FLOAT + "|" + DIGITS + ")[jJ]";
	private static final String INTEGER = "(?:0[xX](?:_?[0-9a-fA-F])+|0[bB](?:_?[01])+|0[oO](?:_?[0-7])+|"
			+ DIGITS + ")";
	private static final Pattern NUMBER = Pattern.compile(IMAGINARY + "|" + FLOAT + "|" + INTEGER);

	private static final Set<String> STRING_PREFIXES = Set.of("r", "u", "b", "f", "br", "rb", "fr", "rf");

	private static final Set<String> THREE_CHAR_OPS = Set.of("**=", "//=", ">>=", "<<=", "...");
	private static final Set<String> TWO_CHAR_OPS = Set.of(
			"!=", "%=", "&=", "**", "*=", "+=", "-=", "->", "//", "/=", ":=", "<<", "<=", "==", ">=", ">>",
			"@=", "^=", "|=");
	private static final String ONE_CHAR_OPS = "()[]{}:,;.+-*/|&<>=%~^@";

	private static final int TAB_SIZE = 8;

	public List<PyToken> lex(String source) {
		return new Scanner(splitLines(source)).run();
	}

	/**
	 * Splits {@code source} into physical lines, each keeping its terminator.
	 */
	public static List<String> splitLines(String source) {
		List<String> lines = new ArrayList<>();
		int start = 0;
		int i = 0;
		while (i < source.length()) {
			char c = source.charAt(i);
			if (c == '\n') {
				lines.add(source.substring(start, i + 1));
				start = ++i;
				continue;
			}
			if (c == '\r') {
				int end = (i + 1 < source.length() && source.charAt(i + 1) == '\n') ? i + 2 : i + 1;
				lines.add(source.substring(start, end));
				start = i = end;
				continue;
			}
			i++;
		}
		if (start < source.length()) {
			lines.add(source.substring(start));
		}
		return lines;
	}

	private static final class Scanner {
		private final List<String> lines;
		private final List<PyToken> tokens = new ArrayList<>();
		private final Deque<Integer> indents = new ArrayDeque<>();
		private int depth;
		private boolean continued;

		// an unfinished string carried over from a previous row
		private StringBuilder pendingText;
		private StringBuilder pendingLine;
		private String pendingQuote;
		private int pendingRow;
		private int pendingCol;

		Scanner(List<String> lines) {
			this.lines = lines;
			indents.push(0);
		}

		List<PyToken> run() {
			for (int r = 0; r < lines.size(); r++) {
				scanLine(lines.get(r), r + 1);
			}
			finish();
			return tokens;
		}

		private void scanLine(String line, int row) {
			int pos = 0;
			int max = line.length();

			if (pendingText != null) {
				int end = findStringEnd(line, 0, pendingQuote);
				if (end == UNTERMINATED) {
					throw new PySyntaxException("unterminated string literal", pendingRow, pendingCol);
				}
				pendingText.append(line, 0, end < 0 ? max : end);
				pendingLine.append(line);
				if (end < 0) {
					return;
				}
				add(PyTokenType.STRING, pendingText.toString(), pendingLine.toString(), pendingRow, pendingCol, row,
						end);
				pendingText = null;
				pendingLine = null;
				pos = end;
			} else if (depth == 0 && !continued) {
				int column = 0;
				while (pos < max) {
					char c = line.charAt(pos);
					if (c == ' ') {
						column++;
					} else if (c == '\t') {
						column = (column / TAB_SIZE + 1) * TAB_SIZE;
					} else if (c == '\f') {
						column = 0;
					} else {
						break;
					}
					pos++;
				}

				if (pos == max || isLineBreak(line.charAt(pos)) || line.charAt(pos) == '#') {
					scanBlankOrCommentLine(line, row, pos);
					return;
				}

				if (column > indents.peek()) {
					indents.push(column);
					add(PyTokenType.INDENT, line.substring(0, pos), line, row, 0, row, pos);
				}
				while (column < indents.peek()) {
					indents.pop();
					if (column > indents.peek()) {
						throw new PySyntaxException("unindent does not match any outer indentation level", row, pos);
					}
					add(PyTokenType.DEDENT, "", line, row, pos, row, pos);
				}
			} else {
				continued = false;
			}

			scanTokens(line, row, pos);
		}

		private void scanBlankOrCommentLine(String line, int row, int pos) {
			int contentEnd = contentEnd(line);
			if (pos < contentEnd && line.charAt(pos) == '#') {
				add(PyTokenType.COMMENT, line.substring(pos, contentEnd), line, row, pos, row, contentEnd);
				pos = contentEnd;
			}
			add(PyTokenType.NL, line.substring(pos), line, row, pos, row, line.length());
		}

		private void scanTokens(String line, int row, int pos) {
			int max = line.length();
			while (pos < max) {
				char c = line.charAt(pos);

				if (c == ' ' || c == '\t' || c == '\f') {
					pos++;
					continue;
				}

				if (c == '#') {
					int end = contentEnd(line);
					add(PyTokenType.COMMENT, line.substring(pos, end), line, row, pos, row, end);
					pos = end;
					continue;
				}

				if (isLineBreak(c)) {
					PyTokenType type = depth > 0 ? PyTokenType.NL : PyTokenType.NEWLINE;
					add(type, line.substring(pos), line, row, pos, row, max);
					return;
				}

				if (c == '\\') {
					if (pos + 1 < max && isLineBreak(line.charAt(pos + 1))) {
						continued = true;
						return;
					}
					throw new PySyntaxException("unexpected character after line continuation character", row, pos);
				}

				if (Character.isDigit(c) || (c == '.' && pos + 1 < max && Character.isDigit(line.charAt(pos + 1)))) {
					Matcher m = NUMBER.matcher(line).region(pos, max);
					if (!m.lookingAt()) {
						throw new PySyntaxException("invalid number literal", row, pos);
					}
					add(PyTokenType.NUMBER, m.group(), line, row, pos, row, m.end());
					pos = m.end();
					continue;
				}

				if (Character.isLetter(c) || c == '_') {
					int start = pos;
					pos++;
					while (pos < max && (Character.isLetterOrDigit(line.charAt(pos)) || line.charAt(pos) == '_')) {
						pos++;
					}
					if (pos < max && isQuote(line.charAt(pos))
							&& STRING_PREFIXES.contains(line.substring(start, pos).toLowerCase())) {
						pos = scanString(line, row, start, pos);
						continue;
					}
					add(PyTokenType.NAME, line.substring(start, pos), line, row, start, row, pos);
					continue;
				}

				if (isQuote(c)) {
					pos = scanString(line, row, pos, pos);
					continue;
				}

				String op = matchOperator(line, pos);
				if (op == null) {
					throw new PySyntaxException("unexpected character '" + c + "'", row, pos);
				}
				if (op.length() == 1 && "([{".indexOf(c) >= 0) {
					depth++;
				} else if (op.length() == 1 && ")]}".indexOf(c) >= 0) {
					depth = Math.max(0, depth - 1);
				}
				add(PyTokenType.OP, op, line, row, pos, row, pos + op.length());
				pos += op.length();
			}
		}

		/**
		 * Scans a string whose prefix starts at {@code start} and whose opening
		 * quote sits at {@code quotePos}. Returns the position after the token, or
		 * the end of the row when the string continues on the next one.
		 */
		private int scanString(String line, int row, int start, int quotePos) {
			char q = line.charAt(quotePos);
			String triple = String.valueOf(q).repeat(3);
			String quote = line.startsWith(triple, quotePos) ? triple : String.valueOf(q);
			int end = findStringEnd(line, quotePos + quote.length(), quote);
			if (end == UNTERMINATED) {
				throw new PySyntaxException("unterminated string literal", row, start);
			}
			if (end < 0) {
				pendingText = new StringBuilder(line.substring(start));
				pendingLine = new StringBuilder(line);
				pendingQuote = quote;
				pendingRow = row;
				pendingCol = start;
				return line.length();
			}
			add(PyTokenType.STRING, line.substring(start, end), line, row, start, row, end);
			return end;
		}

		private void finish() {
			int lastRow = lines.size();
			if (pendingText != null) {
				throw new PySyntaxException("EOF in multi-line string", pendingRow, pendingCol);
			}
			if (depth > 0 || continued) {
				throw new PySyntaxException("EOF in multi-line statement", lastRow, 0);
			}
			if (!tokens.isEmpty()) {
				PyToken last = tokens.get(tokens.size() - 1);
				if (last.type() != PyTokenType.NEWLINE && last.type() != PyTokenType.NL) {
					String line = lines.get(lastRow - 1);
					add(PyTokenType.NEWLINE, "", line, lastRow, line.length(), lastRow, line.length() + 1);
				}
			}
			int eofRow = lastRow + 1;
			while (indents.peek() > 0) {
				indents.pop();
				add(PyTokenType.DEDENT, "", "", eofRow, 0, eofRow, 0);
			}
			add(PyTokenType.ENDMARKER, "", "", eofRow, 0, eofRow, 0);
		}

		private void add(PyTokenType type, String text, String line, int startRow, int startCol, int endRow,
				int endCol) {
			tokens.add(new PyToken(type, text, line, new SourceSpan(startRow, startCol, endRow, endCol)));
		}
	}

	private static final int NOT_FOUND = -1;
	private static final int UNTERMINATED = -2;

	/**
	 * Finds the end of a string body that started before {@code from}. Returns
	 * the index after the closing quote, {@link #NOT_FOUND} when the string runs
	 * on into the next row, or {@link #UNTERMINATED} when a single-quoted string
	 * hits an unescaped line break.
	 */
	private static int findStringEnd(String line, int from, String quote) {
		boolean triple = quote.length() == 3;
		int i = from;
		while (i < line.length()) {
			char c = line.charAt(i);
			if (c == '\\') {
				if (line.startsWith("\r\n", i + 1)) {
					i += 3;
				} else {
					i += 2;
				}
				continue;
			}
			if (line.startsWith(quote, i)) {
				return i + quote.length();
			}
			if (!triple && isLineBreak(c)) {
				return UNTERMINATED;
			}
			i++;
		}
		return NOT_FOUND;
	}

	private static String matchOperator(String line, int pos) {
		if (pos + 3 <= line.length() && THREE_CHAR_OPS.contains(line.substring(pos, pos + 3))) {
			return line.substring(pos, pos + 3);
		}
		if (pos + 2 <= line.length() && TWO_CHAR_OPS.contains(line.substring(pos, pos + 2))) {
			return line.substring(pos, pos + 2);
		}
		char c = line.charAt(pos);
		return ONE_CHAR_OPS.indexOf(c) >= 0 ? String.valueOf(c) : null;
	}

	private static int contentEnd(String line) {
		int end = line.length();
		while (end > 0 && isLineBreak(line.charAt(end - 1))) {
			end--;
		}
		return end;
	}

	private static boolean isLineBreak(char c) {
		return c == '\n' || c == '\r';
	}

	private static boolean isQuote(char c) {
		return c == '"' || c == '\'';
	}
}
