package py2coffee.ast.py;

public record PyName(String id, int line) implements PyExpr {
	@Override
	public <R, C> R accept(PyVisitor<R, C> visitor, C context) {
		return visitor.visitName(this, context);
	}
}
