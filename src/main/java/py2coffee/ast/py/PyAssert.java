package py2coffee.ast.py;

public record PyAssert(PyExpr test, PyExpr msg, int line) implements PyStmt {
	@Override
	public <R, C> R accept(PyVisitor<R, C> visitor, C context) {
		return visitor.visitAssert(this, context);
	}
}
