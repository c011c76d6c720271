package py2coffee.ast.py;

import java.util.List;

public record PyListComp(PyExpr elt, List<PyComprehension> generators, int line) implements PyExpr {
	@Override
	public <R, C> R accept(PyVisitor<R, C> visitor, C context) {
		return visitor.visitListComp(this, context);
	}
}
