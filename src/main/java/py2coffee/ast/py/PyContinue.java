package py2coffee.ast.py;

public record PyContinue(int line) implements PyStmt {
	@Override
	public <R, C> R accept(PyVisitor<R, C> visitor, C context) {
		return visitor.visitContinue(this, context);
	}
}
