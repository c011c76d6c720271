package py2coffee.diagnostics;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

final class LoggingDiagnostics implements Diagnostics {
	static final LoggingDiagnostics INSTANCE = new LoggingDiagnostics();

	private static final Logger LOG = LoggerFactory.getLogger(LoggingDiagnostics.class);

	private LoggingDiagnostics() {
	}

	@Override
	public void report(Diagnostic diagnostic) {
		LOG.warn("{}", diagnostic);
	}
}
