package py2coffee.parse.py;

import py2coffee.TranspileException;

/**
 * Exception thrown when Python source cannot be tokenized or parsed.
 */
public class PySyntaxException extends TranspileException {
	private final int row;
	private final int col;

	public PySyntaxException(String message, int row, int col) {
		super(message + " at line " + row + ", column " + col);
		this.row = row;
		this.col = col;
	}

	public int row() {
		return row;
	}

	public int col() {
		return col;
	}
}
