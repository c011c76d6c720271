package py2coffee.parse.py;

/**
 * Token kinds of the Python tokenizer.
 */
public enum PyTokenType {
	NAME,
	NUMBER,
	STRING,
	OP,
	COMMENT,
	/** Non-logical line break: blank line, comment-only line, or a break inside brackets. */
	NL,
	/** End of a logical line. */
	NEWLINE,
	INDENT,
	DEDENT,
	ENDMARKER
}
