package py2coffee.ast.py;

import java.util.List;

/**
 * Dict display. A null key marks a {@code **mapping} entry whose mapping is the value at the same index.
 */
public record PyDict(List<PyExpr> keys, List<PyExpr> values, int line) implements PyExpr {
	@Override
	public <R, C> R accept(PyVisitor<R, C> visitor, C context) {
		return visitor.visitDict(this, context);
	}
}
