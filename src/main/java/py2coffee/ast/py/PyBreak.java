package py2coffee.ast.py;

public record PyBreak(int line) implements PyStmt {
	@Override
	public <R, C> R accept(PyVisitor<R, C> visitor, C context) {
		return visitor.visitBreak(this, context);
	}
}
