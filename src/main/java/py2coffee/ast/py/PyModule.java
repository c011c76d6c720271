package py2coffee.ast.py;

import java.util.List;

public record PyModule(List<PyStmt> body) implements PyNode {
	@Override
	public int line() {
		return NO_LINE;
	}

	@Override
	public <R, C> R accept(PyVisitor<R, C> visitor, C context) {
		return visitor.visitModule(this, context);
	}
}
