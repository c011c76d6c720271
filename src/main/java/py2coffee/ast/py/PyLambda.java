package py2coffee.ast.py;

public record PyLambda(PyArguments args, PyExpr body, int line) implements PyExpr {
	@Override
	public <R, C> R accept(PyVisitor<R, C> visitor, C context) {
		return visitor.visitLambda(this, context);
	}
}
