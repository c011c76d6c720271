package py2coffee.ast.py;

import java.util.List;

public record PyDelete(List<PyExpr> targets, int line) implements PyStmt {
	@Override
	public <R, C> R accept(PyVisitor<R, C> visitor, C context) {
		return visitor.visitDelete(this, context);
	}
}
