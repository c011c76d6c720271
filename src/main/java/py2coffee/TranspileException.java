package py2coffee;

/**
 * Fatal error while translating one source file. Aborts that file only.
 */
public class TranspileException extends RuntimeException {
	public TranspileException(String message) {
		super(message);
	}

	public TranspileException(String message, Throwable cause) {
		super(message, cause);
	}
}
