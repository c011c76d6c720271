package py2coffee.ast.py;

import java.util.List;

/**
 * Parameter list of a {@code def} or {@code lambda}.
 *
 * {@code defaults} pair with the last entries of {@code args}. {@code kwDefaults}
 * runs parallel to {@code kwonlyargs} and holds null where a keyword-only
 * parameter has no default. Positional-only parameters are folded into
 * {@code args}.
 */
public record PyArguments(List<PyArg> args, PyArg vararg, List<PyArg> kwonlyargs, List<PyExpr> kwDefaults,
		PyArg kwarg, List<PyExpr> defaults) implements PyNode {
	@Override
	public int line() {
		return NO_LINE;
	}

	@Override
	public <R, C> R accept(PyVisitor<R, C> visitor, C context) {
		return visitor.visitArguments(this, context);
	}
}
