package py2coffee.ast.py;

import java.util.List;

public record PyWith(List<PyWithItem> items, List<PyStmt> body, boolean isAsync, int line) implements PyStmt {
	@Override
	public <R, C> R accept(PyVisitor<R, C> visitor, C context) {
		return visitor.visitWith(this, context);
	}
}
