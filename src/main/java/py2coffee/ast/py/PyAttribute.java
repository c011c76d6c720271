package py2coffee.ast.py;

public record PyAttribute(PyExpr value, String attr, int line) implements PyExpr {
	@Override
	public <R, C> R accept(PyVisitor<R, C> visitor, C context) {
		return visitor.visitAttribute(this, context);
	}
}
