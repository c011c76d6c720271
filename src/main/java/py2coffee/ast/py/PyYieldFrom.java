package py2coffee.ast.py;

public record PyYieldFrom(PyExpr value, int line) implements PyExpr {
	@Override
	public <R, C> R accept(PyVisitor<R, C> visitor, C context) {
		return visitor.visitYieldFrom(this, context);
	}
}
