package py2coffee.ast.py;

import java.util.List;

/**
 * A class statement. {@code arguments} holds the bases and keywords such as
 * {@code metaclass=M} in source order.
 */
public record PyClassDef(String name, List<PyNode> arguments, List<PyStmt> body, List<PyExpr> decorators, int line) implements PyStmt {
	public List<PyExpr> bases() {
		return PyCall.positional(arguments);
	}

	public List<PyKeyword> keywords() {
		return PyCall.keywords(arguments);
	}

	@Override
	public <R, C> R accept(PyVisitor<R, C> visitor, C context) {
		return visitor.visitClassDef(this, context);
	}
}
