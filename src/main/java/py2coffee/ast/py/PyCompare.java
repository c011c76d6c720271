package py2coffee.ast.py;

import java.util.List;

public record PyCompare(PyExpr left, List<PyOperator> ops, List<PyExpr> comparators, int line) implements PyExpr {
	@Override
	public <R, C> R accept(PyVisitor<R, C> visitor, C context) {
		return visitor.visitCompare(this, context);
	}
}
