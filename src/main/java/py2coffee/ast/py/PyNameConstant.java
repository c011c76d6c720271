package py2coffee.ast.py;

public record PyNameConstant(Kind kind, int line) implements PyExpr {

	public enum Kind {
		TRUE, FALSE, NONE
	}

	@Override
	public <R, C> R accept(PyVisitor<R, C> visitor, C context) {
		return visitor.visitNameConstant(this, context);
	}
}
