package py2coffee.ast.py;

public record PyPass(int line) implements PyStmt {
	@Override
	public <R, C> R accept(PyVisitor<R, C> visitor, C context) {
		return visitor.visitPass(this, context);
	}
}
