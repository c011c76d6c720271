package py2coffee.parse.py;

/**
 * Decodes the value of a Python string token.
 *
 * The decoded value is only a fallback: output normally reuses the token's
 * exact spelling.
 */
public final class StringLiterals {
	private StringLiterals() {
	}

	public static String decode(String token) {
		int prefixEnd = 0;
		while (prefixEnd < token.length() && token.charAt(prefixEnd) != '"' && token.charAt(prefixEnd) != '\'') {
			prefixEnd++;
		}
		String prefix = token.substring(0, prefixEnd).toLowerCase();
		String rest = token.substring(prefixEnd);
		int quoteLength = (rest.startsWith("\"\"\"") || rest.startsWith("'''")) ? 3 : 1;
		if (rest.length() < 2 * quoteLength) {
			return rest;
		}
		String body = rest.substring(quoteLength, rest.length() - quoteLength);
		if (prefix.contains("r")) {
			return body;
		}
		return unescape(body, prefix.contains("b"));
	}

	private static String unescape(String body, boolean bytes) {
		StringBuilder out = new StringBuilder(body.length());
		int i = 0;
		while (i < body.length()) {
			char c = body.charAt(i);
			if (c != '\\' || i + 1 >= body.length()) {
				out.append(c);
				i++;
				continue;
			}
			char e = body.charAt(i + 1);
			i += 2;
			switch (e) {
				case '\n':
					break;
				case '\r':
					if (i < body.length() && body.charAt(i) == '\n') {
						i++;
					}
					break;
				case '\\':
				case '\'':
				case '"':
					out.append(e);
					break;
				case 'a':
					out.append('\u0007');
					break;
				case 'b':
					out.append('\b');
					break;
				case 'f':
					out.append('\f');
					break;
				case 'n':
					out.append('\n');
					break;
				case 'r':
					out.append('\r');
					break;
				case 't':
					out.append('\t');
					break;
				case 'v':
					out.append('\u000b');
					break;
				case 'x':
					i = appendCodePoint(out, body, i, 2, "\\x");
					break;
				case 'u':
					i = bytes ? appendVerbatim(out, "\\u", i) : appendCodePoint(out, body, i, 4, "\\u");
					break;
				case 'U':
					i = bytes ? appendVerbatim(out, "\\U", i) : appendCodePoint(out, body, i, 8, "\\U");
					break;
				default:
					if (e >= '0' && e <= '7') {
						int end = i;
						while (end < body.length() && end < i + 2 && body.charAt(end) >= '0' && body.charAt(end) <= '7') {
							end++;
						}
						out.appendCodePoint(Integer.parseInt(body.substring(i - 1, end), 8));
						i = end;
					} else {
						out.append('\\').append(e);
					}
					break;
			}
		}
		return out.toString();
	}

	private static int appendCodePoint(StringBuilder out, String body, int start, int digits, String escape) {
		int end = start + digits;
		if (end > body.length()) {
			out.append(escape);
			return start;
		}
		try {
			out.appendCodePoint(Integer.parseInt(body.substring(start, end), 16));
			return end;
		} catch (IllegalArgumentException ex) {
			out.append(escape);
			return start;
		}
	}

	private static int appendVerbatim(StringBuilder out, String escape, int next) {
		out.append(escape);
		return next;
	}
}
