package py2coffee.ast.py;

import java.util.List;

/**
 * String literal (plain, bytes or f-string).
 *
 * {@code value} is the decoded text. {@code tokenLines} holds, for each adjacent
 * source token of an implicit concatenation, the row that token is bucketed on
 * (the token's ending row).
 */
public record PyStr(String value, List<Integer> tokenLines, int line) implements PyExpr {

	/**
	 * Creates a literal made of a single string token ending on {@code line}.
	 */
	public PyStr(String value, int line) {
		this(value, List.of(line), line);
	}

	@Override
	public <R, C> R accept(PyVisitor<R, C> visitor, C context) {
		return visitor.visitStr(this, context);
	}
}
