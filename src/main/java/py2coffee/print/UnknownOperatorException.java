package py2coffee.print;

import py2coffee.TranspileException;
import py2coffee.ast.py.PyOperator;

/**
 * Raised in strict mode when an operator has no entry in the operator table.
 */
public class UnknownOperatorException extends TranspileException {
	private final PyOperator operator;

	public UnknownOperatorException(PyOperator operator) {
		super("No CoffeeScript spelling for operator " + operator);
		this.operator = operator;
	}

	public PyOperator operator() {
		return operator;
	}
}
