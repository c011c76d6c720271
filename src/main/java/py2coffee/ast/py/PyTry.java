package py2coffee.ast.py;

import java.util.List;

public record PyTry(List<PyStmt> body, List<PyExceptHandler> handlers, List<PyStmt> orelse, List<PyStmt> finalbody, int line) implements PyStmt {
	@Override
	public <R, C> R accept(PyVisitor<R, C> visitor, C context) {
		return visitor.visitTry(this, context);
	}
}
