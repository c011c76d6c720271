package py2coffee.print;

import py2coffee.ast.py.PyOperator;

import java.util.EnumMap;
import java.util.Map;

/**
 * CoffeeScript spelling of each Python operator. Boolean and word operators
 * carry their own surrounding spaces.
 */
final class OperatorTable {
	private static final Map<PyOperator, String> SPELLINGS = new EnumMap<>(PyOperator.class);

	static {
		// binary
		SPELLINGS.put(PyOperator.ADD, "+");
		SPELLINGS.put(PyOperator.SUB, "-");
		SPELLINGS.put(PyOperator.MULT, "*");
		SPELLINGS.put(PyOperator.DIV, "/");
		SPELLINGS.put(PyOperator.FLOOR_DIV, "//");
		SPELLINGS.put(PyOperator.MOD, "%");
		SPELLINGS.put(PyOperator.POW, "**");
		SPELLINGS.put(PyOperator.LSHIFT, "<<");
		SPELLINGS.put(PyOperator.RSHIFT, ">>");
		SPELLINGS.put(PyOperator.BIT_OR, "|");
		SPELLINGS.put(PyOperator.BIT_XOR, "^");
		SPELLINGS.put(PyOperator.BIT_AND, "&");
		// boolean
		SPELLINGS.put(PyOperator.AND, " and ");
		SPELLINGS.put(PyOperator.OR, " or ");
		// unary
		SPELLINGS.put(PyOperator.INVERT, "~");
		SPELLINGS.put(PyOperator.NOT, "not ");
		SPELLINGS.put(PyOperator.UADD, "+");
		SPELLINGS.put(PyOperator.USUB, "-");
		// comparison
		SPELLINGS.put(PyOperator.EQ, "==");
		SPELLINGS.put(PyOperator.NOT_EQ, "!=");
		SPELLINGS.put(PyOperator.LT, "<");
		SPELLINGS.put(PyOperator.LT_E, "<=");
		SPELLINGS.put(PyOperator.GT, ">");
		SPELLINGS.put(PyOperator.GT_E, ">=");
		SPELLINGS.put(PyOperator.IS, " is ");
		SPELLINGS.put(PyOperator.IS_NOT, " is not ");
		SPELLINGS.put(PyOperator.IN, " in ");
		SPELLINGS.put(PyOperator.NOT_IN, " not in ");
	}

	private OperatorTable() {
	}

	/**
	 * The spelling of {@code op}, or null when the table has none.
	 */
	static String spelling(PyOperator op) {
		return SPELLINGS.get(op);
	}

	static String placeholder(PyOperator op) {
		return "<" + op.name() + ">";
	}
}
