package py2coffee.ast.py;

/**
 * Slice inside a subscript; absent bounds are null.
 */
public record PySlice(PyExpr lower, PyExpr upper, PyExpr step, int line) implements PyExpr {
	@Override
	public <R, C> R accept(PyVisitor<R, C> visitor, C context) {
		return visitor.visitSlice(this, context);
	}
}
