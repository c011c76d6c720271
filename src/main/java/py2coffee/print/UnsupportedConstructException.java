package py2coffee.print;

import py2coffee.TranspileException;
import py2coffee.ast.py.PyNode;

/**
 * A node kind reached the printer for which no CoffeeScript rule exists.
 */
public class UnsupportedConstructException extends TranspileException {
	private final transient PyNode node;

	public UnsupportedConstructException(String construct, PyNode node) {
		super("Unsupported construct: " + construct + (node.line() > 0 ? " at line " + node.line() : ""));
		this.node = node;
	}

	public PyNode node() {
		return node;
	}
}
