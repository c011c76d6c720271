package py2coffee.ast.py;

import java.util.List;

public record PyGlobal(List<String> names, int line) implements PyStmt {
	@Override
	public <R, C> R accept(PyVisitor<R, C> visitor, C context) {
		return visitor.visitGlobal(this, context);
	}
}
