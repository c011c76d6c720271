package py2coffee.ast.py;

import java.util.List;
import java.util.stream.Collectors;

/**
 * A call. {@code arguments} holds the positional, starred and keyword
 * arguments in source order; {@link #args()} and {@link #keywords()} split
 * them the way Python's {@code ast} does.
 */
public record PyCall(PyExpr func, List<PyNode> arguments, int line) implements PyExpr {
	public List<PyExpr> args() {
		return positional(arguments);
	}

	public List<PyKeyword> keywords() {
		return keywords(arguments);
	}

	static List<PyExpr> positional(List<PyNode> arguments) {
		return arguments.stream()
				.filter(a -> a instanceof PyExpr)
				.map(a -> (PyExpr) a)
				.collect(Collectors.toList());
	}

	static List<PyKeyword> keywords(List<PyNode> arguments) {
		return arguments.stream()
				.filter(a -> a instanceof PyKeyword)
				.map(a -> (PyKeyword) a)
				.collect(Collectors.toList());
	}

	@Override
	public <R, C> R accept(PyVisitor<R, C> visitor, C context) {
		return visitor.visitCall(this, context);
	}
}
