package py2coffee.ast.py;

public record PyReturn(PyExpr value, int line) implements PyStmt {
	@Override
	public <R, C> R accept(PyVisitor<R, C> visitor, C context) {
		return visitor.visitReturn(this, context);
	}
}
