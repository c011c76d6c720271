package py2coffee.ast.py;

import java.util.List;

public record PyList(List<PyExpr> elts, int line) implements PyExpr {
	@Override
	public <R, C> R accept(PyVisitor<R, C> visitor, C context) {
		return visitor.visitList(this, context);
	}
}
