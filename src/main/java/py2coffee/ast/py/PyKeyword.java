package py2coffee.ast.py;

/**
 * Keyword argument {@code arg=value}; {@code arg} is null for {@code **value}.
 */
public record PyKeyword(String arg, PyExpr value, int line) implements PyNode {
	@Override
	public <R, C> R accept(PyVisitor<R, C> visitor, C context) {
		return visitor.visitKeyword(this, context);
	}
}
