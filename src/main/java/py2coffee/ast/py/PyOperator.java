package py2coffee.ast.py;

public enum PyOperator {
	// binary
	ADD(Category.BINARY, "+"),
	SUB(Category.BINARY, "-"),
	MULT(Category.BINARY, "*"),
	MAT_MULT(Category.BINARY, "@"),
	DIV(Category.BINARY, "/"),
	FLOOR_DIV(Category.BINARY, "//"),
	MOD(Category.BINARY, "%"),
	POW(Category.BINARY, "**"),
	LSHIFT(Category.BINARY, "<<"),
	RSHIFT(Category.BINARY, ">>"),
	BIT_OR(Category.BINARY, "|"),
	BIT_XOR(Category.BINARY, "^"),
	BIT_AND(Category.BINARY, "&"),

	// boolean
	AND(Category.BOOLEAN, "and"),
	OR(Category.BOOLEAN, "or"),

	// unary
	INVERT(Category.UNARY, "~"),
	NOT(Category.UNARY, "not"),
	UADD(Category.UNARY, "+"),
	USUB(Category.UNARY, "-"),

	// comparison
	EQ(Category.COMPARISON, "=="),
	NOT_EQ(Category.COMPARISON, "!="),
	LT(Category.COMPARISON, "<"),
	LT_E(Category.COMPARISON, "<="),
	GT(Category.COMPARISON, ">"),
	GT_E(Category.COMPARISON, ">="),
	IS(Category.COMPARISON, "is"),
	IS_NOT(Category.COMPARISON, "is not"),
	IN(Category.COMPARISON, "in"),
	NOT_IN(Category.COMPARISON, "not in");

	public enum Category {
		BINARY, BOOLEAN, UNARY, COMPARISON
	}

	private final Category category;
	private final String pythonSpelling;

	PyOperator(Category category, String pythonSpelling) {
		this.category = category;
		this.pythonSpelling = pythonSpelling;
	}

	public Category category() {
		return category;
	}

	/**
	 * The operator as written in Python source.
	 */
	public String pythonSpelling() {
		return pythonSpelling;
	}

	/**
	 * Finds the binary operator written as {@code symbol}, or null. Augmented
	 * assignments pass the symbol without its trailing {@code =}.
	 */
	public static PyOperator binary(String symbol) {
		for (PyOperator op : values()) {
			if (op.category == Category.BINARY && op.pythonSpelling.equals(symbol)) {
				return op;
			}
		}
		return null;
	}

	/**
	 * Finds the comparison operator written as {@code symbol}, or null.
	 */
	public static PyOperator comparison(String symbol) {
		for (PyOperator op : values()) {
			if (op.category == Category.COMPARISON && op.pythonSpelling.equals(symbol)) {
				return op;
			}
		}
		return null;
	}
}
