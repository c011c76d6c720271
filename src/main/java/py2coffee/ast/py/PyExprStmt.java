package py2coffee.ast.py;

public record PyExprStmt(PyExpr value, int line) implements PyStmt {
	@Override
	public <R, C> R accept(PyVisitor<R, C> visitor, C context) {
		return visitor.visitExprStmt(this, context);
	}
}
