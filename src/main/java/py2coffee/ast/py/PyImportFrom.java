package py2coffee.ast.py;

import java.util.List;

/**
 * {@code level} counts the leading dots of a relative import; {@code module} is null for {@code from . import x}.
 */
public record PyImportFrom(String module, List<PyAlias> names, int level, int line) implements PyStmt {
	@Override
	public <R, C> R accept(PyVisitor<R, C> visitor, C context) {
		return visitor.visitImportFrom(this, context);
	}
}
