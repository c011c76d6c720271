package py2coffee.ast.py;

import java.util.List;

public record PyFor(PyExpr target, PyExpr iter, List<PyStmt> body, List<PyStmt> orelse, boolean isAsync, int line) implements PyStmt {
	@Override
	public <R, C> R accept(PyVisitor<R, C> visitor, C context) {
		return visitor.visitFor(this, context);
	}
}
