package py2coffee.ast.py;

import java.util.List;

public record PyDictComp(PyExpr key, PyExpr value, List<PyComprehension> generators, int line) implements PyExpr {
	@Override
	public <R, C> R accept(PyVisitor<R, C> visitor, C context) {
		return visitor.visitDictComp(this, context);
	}
}
