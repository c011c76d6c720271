package py2coffee;

import java.nio.file.Path;

/**
 * Outcome for one input file of a {@link ProjectTranspiler} run.
 *
 * @param input  the file as given
 * @param output the target file, or null when none was computed
 * @param status what happened
 * @param error  the failure for {@link Status#FAILED}, else null
 */
public record TranspileResult(Path input, Path output, Status status, Exception error) {
	public enum Status {
		WRITTEN,
		SKIPPED_NOT_PYTHON,
		SKIPPED_MISSING,
		SKIPPED_NO_OUTPUT_DIR,
		SKIPPED_EXISTS,
		FAILED
	}

	static TranspileResult skipped(Path input, Path output, Status status) {
		return new TranspileResult(input, output, status, null);
	}

	public boolean failed() {
		return status == Status.FAILED;
	}
}
