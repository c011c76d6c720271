package py2coffee.sync;

import py2coffee.TranspileException;

/**
 * The token stream does not agree with the source text it was lexed from.
 */
public class TokenSyncException extends TranspileException {
	public TokenSyncException(String message) {
		super(message);
	}
}
