package py2coffee.ast.py;

public record PyArg(String name, PyExpr annotation, int line) implements PyNode {
	@Override
	public <R, C> R accept(PyVisitor<R, C> visitor, C context) {
		return visitor.visitArg(this, context);
	}
}
