package py2coffee.ast.py;

public record PyRaise(PyExpr exc, PyExpr cause, int line) implements PyStmt {
	@Override
	public <R, C> R accept(PyVisitor<R, C> visitor, C context) {
		return visitor.visitRaise(this, context);
	}
}
