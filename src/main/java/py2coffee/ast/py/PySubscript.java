package py2coffee.ast.py;

public record PySubscript(PyExpr value, PyExpr slice, int line) implements PyExpr {
	@Override
	public <R, C> R accept(PyVisitor<R, C> visitor, C context) {
		return visitor.visitSubscript(this, context);
	}
}
