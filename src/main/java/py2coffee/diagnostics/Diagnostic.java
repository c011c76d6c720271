package py2coffee.diagnostics;

/**
 * A recoverable problem found while translating. Output for the rest of the
 * file is still produced.
 *
 * @param kind    what degraded
 * @param line    1-based source row, or 0 when unknown
 * @param message human-readable detail
 */
public record Diagnostic(Kind kind, int line, String message) {
	public enum Kind {
		/** No string token left on the row of a string literal; the decoded value was used. */
		STRING_UNDERFLOW,
		/** A dict display whose key and value counts differ; rendered as {@code {}}. */
		DICT_MISMATCH,
		/** An operator without a table entry; rendered as a placeholder tag. */
		UNKNOWN_OPERATOR
	}

	@Override
	public String toString() {
		return (line > 0 ? "line " + line + ": " : "") + kind + ": " + message;
	}
}
