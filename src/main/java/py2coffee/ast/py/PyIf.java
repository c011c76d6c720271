package py2coffee.ast.py;

import java.util.List;

/**
 * `elif` arrives as a single nested {@link PyIf} in {@code orelse}.
 */
public record PyIf(PyExpr test, List<PyStmt> body, List<PyStmt> orelse, int line) implements PyStmt {
	@Override
	public <R, C> R accept(PyVisitor<R, C> visitor, C context) {
		return visitor.visitIf(this, context);
	}
}
