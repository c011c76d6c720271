package py2coffee.ast.py;

public record PyWithItem(PyExpr contextExpr, PyExpr optionalVars, int line) implements PyNode {
	@Override
	public <R, C> R accept(PyVisitor<R, C> visitor, C context) {
		return visitor.visitWithItem(this, context);
	}
}
