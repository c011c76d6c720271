package py2coffee.ast.py;

import java.util.List;

/**
 * `def` or `async def`; {@code returns} is the return annotation or null.
 */
public record PyFunctionDef(String name, PyArguments args, List<PyStmt> body, List<PyExpr> decorators, PyExpr returns, boolean isAsync, int line) implements PyStmt {
	@Override
	public <R, C> R accept(PyVisitor<R, C> visitor, C context) {
		return visitor.visitFunctionDef(this, context);
	}
}
