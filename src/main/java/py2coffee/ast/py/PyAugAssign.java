package py2coffee.ast.py;

public record PyAugAssign(PyExpr target, PyOperator op, PyExpr value, int line) implements PyStmt {
	@Override
	public <R, C> R accept(PyVisitor<R, C> visitor, C context) {
		return visitor.visitAugAssign(this, context);
	}
}
