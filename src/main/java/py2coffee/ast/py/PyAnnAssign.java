package py2coffee.ast.py;

/**
 * {@code target: annotation [= value]}; value may be null.
 */
public record PyAnnAssign(PyExpr target, PyExpr annotation, PyExpr value, int line) implements PyStmt {
	@Override
	public <R, C> R accept(PyVisitor<R, C> visitor, C context) {
		return visitor.visitAnnAssign(this, context);
	}
}
