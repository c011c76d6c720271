package py2coffee.ast.py;

public record PyBinOp(PyExpr left, PyOperator op, PyExpr right, int line) implements PyExpr {
	@Override
	public <R, C> R accept(PyVisitor<R, C> visitor, C context) {
		return visitor.visitBinOp(this, context);
	}
}
