package py2coffee.ast.py;

import java.util.List;

/**
 * One {@code for target in iter [if ...]} clause of a comprehension.
 */
public record PyComprehension(PyExpr target, PyExpr iter, List<PyExpr> ifs, boolean isAsync, int line) implements PyNode {
	@Override
	public <R, C> R accept(PyVisitor<R, C> visitor, C context) {
		return visitor.visitComprehension(this, context);
	}
}
