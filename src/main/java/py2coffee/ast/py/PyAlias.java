package py2coffee.ast.py;

public record PyAlias(String name, String asname, int line) implements PyNode {
	@Override
	public <R, C> R accept(PyVisitor<R, C> visitor, C context) {
		return visitor.visitAlias(this, context);
	}
}
