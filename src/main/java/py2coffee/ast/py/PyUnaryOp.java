package py2coffee.ast.py;

public record PyUnaryOp(PyOperator op, PyExpr operand, int line) implements PyExpr {
	@Override
	public <R, C> R accept(PyVisitor<R, C> visitor, C context) {
		return visitor.visitUnaryOp(this, context);
	}
}
