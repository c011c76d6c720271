package py2coffee.diagnostics;

/**
 * Receives the diagnostics of one translation.
 */
@FunctionalInterface
public interface Diagnostics {
	void report(Diagnostic diagnostic);

	default void report(Diagnostic.Kind kind, int line, String message) {
		report(new Diagnostic(kind, line, message));
	}

	/**
	 * Diagnostics written to the log at WARN level.
	 */
	static Diagnostics logging() {
		return LoggingDiagnostics.INSTANCE;
	}
}
