package py2coffee.ast.py;

/**
 * Node of a parsed Python module. Trees are immutable and own their children.
 */
public sealed interface PyNode permits PyModule, PyStmt, PyExpr, PyArguments, PyArg, PyKeyword, PyAlias,
		PyWithItem, PyComprehension, PyExceptHandler {
	/**
	 * 1-based source row of the node, or {@link #NO_LINE} when the node has none.
	 */
	int line();

	<R, C> R accept(PyVisitor<R, C> visitor, C context);

	int NO_LINE = 0;
}
