package py2coffee.ast.py;

import java.util.List;

/**
 * {@code a = b = value}: one target per {@code =}.
 */
public record PyAssign(List<PyExpr> targets, PyExpr value, int line) implements PyStmt {
	@Override
	public <R, C> R accept(PyVisitor<R, C> visitor, C context) {
		return visitor.visitAssign(this, context);
	}
}
