package py2coffee.ast.py;

public record PyIfExp(PyExpr test, PyExpr body, PyExpr orelse, int line) implements PyExpr {
	@Override
	public <R, C> R accept(PyVisitor<R, C> visitor, C context) {
		return visitor.visitIfExp(this, context);
	}
}
