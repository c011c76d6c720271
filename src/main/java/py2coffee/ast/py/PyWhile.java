package py2coffee.ast.py;

import java.util.List;

public record PyWhile(PyExpr test, List<PyStmt> body, List<PyStmt> orelse, int line) implements PyStmt {
	@Override
	public <R, C> R accept(PyVisitor<R, C> visitor, C context) {
		return visitor.visitWhile(this, context);
	}
}
