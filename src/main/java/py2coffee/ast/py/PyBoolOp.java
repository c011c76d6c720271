package py2coffee.ast.py;

import java.util.List;

public record PyBoolOp(PyOperator op, List<PyExpr> values, int line) implements PyExpr {
	@Override
	public <R, C> R accept(PyVisitor<R, C> visitor, C context) {
		return visitor.visitBoolOp(this, context);
	}
}
