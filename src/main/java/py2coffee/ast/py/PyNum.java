package py2coffee.ast.py;

/**
 * Numeric literal, kept as its source text.
 */
public record PyNum(String text, int line) implements PyExpr {
	@Override
	public <R, C> R accept(PyVisitor<R, C> visitor, C context) {
		return visitor.visitNum(this, context);
	}
}
