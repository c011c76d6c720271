package py2coffee.ast.py;

import java.util.List;

public record PyTuple(List<PyExpr> elts, int line) implements PyExpr {
	@Override
	public <R, C> R accept(PyVisitor<R, C> visitor, C context) {
		return visitor.visitTuple(this, context);
	}
}
