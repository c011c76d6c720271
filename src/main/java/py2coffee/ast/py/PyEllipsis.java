package py2coffee.ast.py;

public record PyEllipsis(int line) implements PyExpr {
	@Override
	public <R, C> R accept(PyVisitor<R, C> visitor, C context) {
		return visitor.visitEllipsis(this, context);
	}
}
