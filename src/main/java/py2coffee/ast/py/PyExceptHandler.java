package py2coffee.ast.py;

import java.util.List;

public record PyExceptHandler(PyExpr type, String name, List<PyStmt> body, int line) implements PyNode {
	@Override
	public <R, C> R accept(PyVisitor<R, C> visitor, C context) {
		return visitor.visitExceptHandler(this, context);
	}
}
