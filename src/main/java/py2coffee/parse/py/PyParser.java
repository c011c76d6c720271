package py2coffee.parse.py;

import py2coffee.ast.py.PyAlias;
import py2coffee.ast.py.PyAnnAssign;
import py2coffee.ast.py.PyArg;
import py2coffee.ast.py.PyArguments;
import py2coffee.ast.py.PyAssert;
import py2coffee.ast.py.PyAssign;
import py2coffee.ast.py.PyAttribute;
import py2coffee.ast.py.PyAugAssign;
import py2coffee.ast.py.PyAwait;
import py2coffee.ast.py.PyBinOp;
import py2coffee.ast.py.PyBoolOp;
import py2coffee.ast.py.PyBreak;
import py2coffee.ast.py.PyCall;
import py2coffee.ast.py.PyClassDef;
import py2coffee.ast.py.PyCompare;
import py2coffee.ast.py.PyComprehension;
import py2coffee.ast.py.PyContinue;
import py2coffee.ast.py.PyDelete;
import py2coffee.ast.py.PyDict;
import py2coffee.ast.py.PyDictComp;
import py2coffee.ast.py.PyEllipsis;
import py2coffee.ast.py.PyExceptHandler;
import py2coffee.ast.py.PyExpr;
import py2coffee.ast.py.PyExprStmt;
import py2coffee.ast.py.PyFor;
import py2coffee.ast.py.PyFunctionDef;
import py2coffee.ast.py.PyGeneratorExp;
import py2coffee.ast.py.PyGlobal;
import py2coffee.ast.py.PyIf;
import py2coffee.ast.py.PyIfExp;
import py2coffee.ast.py.PyImport;
import py2coffee.ast.py.PyImportFrom;
import py2coffee.ast.py.PyKeyword;
import py2coffee.ast.py.PyLambda;
import py2coffee.ast.py.PyList;
import py2coffee.ast.py.PyListComp;
import py2coffee.ast.py.PyModule;
import py2coffee.ast.py.PyName;
import py2coffee.ast.py.PyNameConstant;
import py2coffee.ast.py.PyNamedExpr;
import py2coffee.ast.py.PyNode;
import py2coffee.ast.py.PyNonlocal;
import py2coffee.ast.py.PyNum;
import py2coffee.ast.py.PyOperator;
import py2coffee.ast.py.PyPass;
import py2coffee.ast.py.PyRaise;
import py2coffee.ast.py.PyReturn;
import py2coffee.ast.py.PySet;
import py2coffee.ast.py.PySetComp;
import py2coffee.ast.py.PySlice;
import py2coffee.ast.py.PyStarred;
import py2coffee.ast.py.PyStmt;
import py2coffee.ast.py.PyStr;
import py2coffee.ast.py.PySubscript;
import py2coffee.ast.py.PyTry;
import py2coffee.ast.py.PyTuple;
import py2coffee.ast.py.PyUnaryOp;
import py2coffee.ast.py.PyWhile;
import py2coffee.ast.py.PyWith;
import py2coffee.ast.py.PyWithItem;
import py2coffee.ast.py.PyYield;
import py2coffee.ast.py.PyYieldFrom;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * Recursive-descent parser for Python 3 (everything but {@code match}).
 *
 * Works on the significant tokens only: COMMENT and NL tokens are dropped
 * before parsing and recovered later from the full token list.
 */
public final class PyParser {
	private static final Set<String> KEYWORDS = Set.of(
			"False", "None", "True", "and", "as", "assert", "async", "await", "break", "class", "continue", "def",
			"del", "elif", "else", "except", "finally", "for", "from", "global", "if", "import", "in", "is",
			"lambda", "nonlocal", "not", "or", "pass", "raise", "return", "try", "while", "with", "yield");

	private static final Set<String> EXPRESSION_KEYWORDS = Set.of("not", "lambda", "await", "None", "True", "False");

	private static final Set<String> EXPRESSION_START_OPS = Set.of("(", "[", "{", "-", "+", "~", "...", "*");

	private static final Set<String> AUGMENTED_OPS = Set.of(
			"+=", "-=", "*=", "@=", "/=", "%=", "&=", "|=", "^=", "<<=", ">>=", "**=", "//=");

	private static final Map<String, PyOperator> UNARY_OPS = Map.of(
			"+", PyOperator.UADD,
			"-", PyOperator.USUB,
			"~", PyOperator.INVERT);

	public PyModule parse(String source) {
		return parse(new PyLexer().lex(source));
	}

	public PyModule parse(List<PyToken> tokens) {
		List<PyToken> significant = tokens.stream()
				.filter(t -> t.type() != PyTokenType.COMMENT && t.type() != PyTokenType.NL)
				.collect(Collectors.toList());
		Cursor c = new Cursor(significant);

		List<PyStmt> body = new ArrayList<>();
		while (!c.isAtEnd()) {
			if (c.peekIs(PyTokenType.NEWLINE)) {
				c.next();
				continue;
			}
			body.addAll(parseStatement(c));
		}
		return new PyModule(body);
	}

	// statements

	private List<PyStmt> parseStatement(Cursor c) {
		PyToken t = c.peek();
		if (t.isOp("@")) {
			return List.of(parseDecorated(c));
		}
		if (t.type() == PyTokenType.NAME) {
			switch (t.text()) {
				case "if":
					return List.of(parseIf(c));
				case "while":
					return List.of(parseWhile(c));
				case "for":
					return List.of(parseFor(c, false, t.startRow()));
				case "try":
					return List.of(parseTry(c));
				case "with":
					return List.of(parseWith(c, false, t.startRow()));
				case "def":
					return List.of(parseFunctionDef(c, List.of(), false, t.startRow()));
				case "class":
					return List.of(parseClassDef(c, List.of()));
				case "async":
					return List.of(parseAsync(c, List.of()));
				default:
					break;
			}
		}
		return parseSimpleStatements(c);
	}

	private List<PyStmt> parseSimpleStatements(Cursor c) {
		List<PyStmt> stmts = new ArrayList<>();
		stmts.add(parseSmallStatement(c));
		while (c.peekIsOp(";")) {
			c.next();
			if (c.peekIs(PyTokenType.NEWLINE) || c.isAtEnd()) {
				break;
			}
			stmts.add(parseSmallStatement(c));
		}
		c.expectNewline();
		return stmts;
	}

	private PyStmt parseSmallStatement(Cursor c) {
		PyToken t = c.peek();
		int row = t.startRow();
		if (t.type() == PyTokenType.NAME) {
			switch (t.text()) {
				case "pass":
					c.next();
					return new PyPass(row);
				case "break":
					c.next();
					return new PyBreak(row);
				case "continue":
					c.next();
					return new PyContinue(row);
				case "return": {
					c.next();
					PyExpr value = atStatementEnd(c) ? null : parseTestListStarExpr(c);
					return new PyReturn(value, row);
				}
				case "raise": {
					c.next();
					PyExpr exc = null;
					PyExpr cause = null;
					if (!atStatementEnd(c)) {
						exc = parseTest(c);
						if (c.peekIsName("from")) {
							c.next();
							cause = parseTest(c);
						}
					}
					return new PyRaise(exc, cause, row);
				}
				case "global":
					c.next();
					return new PyGlobal(parseNameList(c), row);
				case "nonlocal":
					c.next();
					return new PyNonlocal(parseNameList(c), row);
				case "del":
					c.next();
					return new PyDelete(parseExprItems(c), row);
				case "assert": {
					c.next();
					PyExpr test = parseTest(c);
					PyExpr msg = null;
					if (c.peekIsOp(",")) {
						c.next();
						msg = parseTest(c);
					}
					return new PyAssert(test, msg, row);
				}
				case "import":
					return parseImport(c);
				case "from":
					return parseImportFrom(c);
				default:
					break;
			}
		}
		return parseExprStatement(c);
	}

	private PyStmt parseExprStatement(Cursor c) {
		int row = c.peek().startRow();
		PyExpr first = parseYieldOrTestList(c);

		if (c.peekIsOp(":")) {
			c.next();
			PyExpr annotation = parseTest(c);
			PyExpr value = null;
			if (c.peekIsOp("=")) {
				c.next();
				value = parseYieldOrTestList(c);
			}
			return new PyAnnAssign(first, annotation, value, row);
		}

		PyToken t = c.peek();
		if (t.type() == PyTokenType.OP && AUGMENTED_OPS.contains(t.text())) {
			c.next();
			PyOperator op = PyOperator.binary(t.text().substring(0, t.text().length() - 1));
			return new PyAugAssign(first, op, parseYieldOrTestList(c), row);
		}

		if (c.peekIsOp("=")) {
			List<PyExpr> targets = new ArrayList<>();
			targets.add(first);
			while (c.peekIsOp("=")) {
				c.next();
				targets.add(parseYieldOrTestList(c));
			}
			PyExpr value = targets.remove(targets.size() - 1);
			return new PyAssign(targets, value, row);
		}

		return new PyExprStmt(first, row);
	}

	private PyStmt parseImport(Cursor c) {
		int row = c.expectName("import").startRow();
		List<PyAlias> names = new ArrayList<>();
		while (true) {
			PyToken start = c.peek();
			String name = parseDottedName(c);
			names.add(new PyAlias(name, parseAsName(c), start.startRow()));
			if (!c.peekIsOp(",")) {
				break;
			}
			c.next();
		}
		return new PyImport(names, row);
	}

	private PyStmt parseImportFrom(Cursor c) {
		int row = c.expectName("from").startRow();
		int level = 0;
		while (c.peekIsOp(".") || c.peekIsOp("...")) {
			level += c.next().text().length();
		}
		String module = null;
		if (!c.peekIsName("import")) {
			module = parseDottedName(c);
		}
		c.expectName("import");

		List<PyAlias> names = new ArrayList<>();
		if (c.peekIsOp("*")) {
			names.add(new PyAlias("*", null, c.next().startRow()));
			return new PyImportFrom(module, names, level, row);
		}

		boolean parenthesized = c.peekIsOp("(");
		if (parenthesized) {
			c.next();
		}
		while (true) {
			PyToken name = c.expect(PyTokenType.NAME, "imported name");
			names.add(new PyAlias(name.text(), parseAsName(c), name.startRow()));
			if (!c.peekIsOp(",")) {
				break;
			}
			c.next();
			if (parenthesized && c.peekIsOp(")")) {
				break;
			}
		}
		if (parenthesized) {
			c.expectOp(")");
		}
		return new PyImportFrom(module, names, level, row);
	}

	private String parseAsName(Cursor c) {
		if (!c.peekIsName("as")) {
			return null;
		}
		c.next();
		return c.expect(PyTokenType.NAME, "alias").text();
	}

	private String parseDottedName(Cursor c) {
		StringBuilder name = new StringBuilder(c.expect(PyTokenType.NAME, "module name").text());
		while (c.peekIsOp(".")) {
			c.next();
			name.append('.').append(c.expect(PyTokenType.NAME, "module name").text());
		}
		return name.toString();
	}

	private List<String> parseNameList(Cursor c) {
		List<String> names = new ArrayList<>();
		names.add(c.expect(PyTokenType.NAME, "name").text());
		while (c.peekIsOp(",")) {
			c.next();
			names.add(c.expect(PyTokenType.NAME, "name").text());
		}
		return names;
	}

	private PyStmt parseIf(Cursor c) {
		PyToken keyword = c.next(); // 'if' or 'elif'
		PyExpr test = parseNamedExprTest(c);
		c.expectOp(":");
		List<PyStmt> body = parseSuite(c);

		List<PyStmt> orelse = List.of();
		if (c.peekIsName("elif")) {
			orelse = List.of(parseIf(c));
		} else if (c.peekIsName("else")) {
			c.next();
			c.expectOp(":");
			orelse = parseSuite(c);
		}
		return new PyIf(test, body, orelse, keyword.startRow());
	}

	private PyStmt parseWhile(Cursor c) {
		int row = c.expectName("while").startRow();
		PyExpr test = parseNamedExprTest(c);
		c.expectOp(":");
		List<PyStmt> body = parseSuite(c);
		return new PyWhile(test, body, parseElse(c), row);
	}

	private PyStmt parseFor(Cursor c, boolean isAsync, int row) {
		c.expectName("for");
		PyExpr target = parseExprList(c);
		c.expectName("in");
		PyExpr iter = parseTestListStarExpr(c);
		c.expectOp(":");
		List<PyStmt> body = parseSuite(c);
		return new PyFor(target, iter, body, parseElse(c), isAsync, row);
	}

	private List<PyStmt> parseElse(Cursor c) {
		if (!c.peekIsName("else")) {
			return List.of();
		}
		c.next();
		c.expectOp(":");
		return parseSuite(c);
	}

	private PyStmt parseTry(Cursor c) {
		PyToken start = c.expectName("try");
		c.expectOp(":");
		List<PyStmt> body = parseSuite(c);

		List<PyExceptHandler> handlers = new ArrayList<>();
		while (c.peekIsName("except")) {
			int row = c.next().startRow();
			PyExpr type = null;
			String name = null;
			if (!c.peekIsOp(":")) {
				type = parseTest(c);
				if (c.peekIsName("as")) {
					c.next();
					name = c.expect(PyTokenType.NAME, "exception name").text();
				}
			}
			c.expectOp(":");
			handlers.add(new PyExceptHandler(type, name, parseSuite(c), row));
		}

		List<PyStmt> orelse = handlers.isEmpty() ? List.of() : parseElse(c);

		List<PyStmt> finalbody = List.of();
		if (c.peekIsName("finally")) {
			c.next();
			c.expectOp(":");
			finalbody = parseSuite(c);
		}

		if (handlers.isEmpty() && finalbody.isEmpty()) {
			throw c.error("expected 'except' or 'finally' block", c.peek());
		}
		return new PyTry(body, handlers, orelse, finalbody, start.startRow());
	}

	private PyStmt parseWith(Cursor c, boolean isAsync, int row) {
		c.expectName("with");
		List<PyWithItem> items = new ArrayList<>();
		while (true) {
			PyExpr context = parseTest(c);
			PyExpr vars = null;
			if (c.peekIsName("as")) {
				c.next();
				vars = parseBitOr(c);
			}
			items.add(new PyWithItem(context, vars, context.line()));
			if (!c.peekIsOp(",")) {
				break;
			}
			c.next();
		}
		c.expectOp(":");
		return new PyWith(items, parseSuite(c), isAsync, row);
	}

	private PyStmt parseDecorated(Cursor c) {
		List<PyExpr> decorators = new ArrayList<>();
		while (c.peekIsOp("@")) {
			c.next();
			decorators.add(parseNamedExprTest(c));
			c.expectNewline();
		}
		PyToken t = c.peek();
		if (t.isName("def")) {
			return parseFunctionDef(c, decorators, false, t.startRow());
		}
		if (t.isName("class")) {
			return parseClassDef(c, decorators);
		}
		if (t.isName("async")) {
			return parseAsync(c, decorators);
		}
		throw c.error("expected 'def' or 'class' after decorator", t);
	}

	private PyStmt parseAsync(Cursor c, List<PyExpr> decorators) {
		int row = c.expectName("async").startRow();
		PyToken t = c.peek();
		if (t.isName("def")) {
			return parseFunctionDef(c, decorators, true, row);
		}
		if (!decorators.isEmpty()) {
			throw c.error("expected 'def' after decorator", t);
		}
		if (t.isName("for")) {
			return parseFor(c, true, row);
		}
		if (t.isName("with")) {
			return parseWith(c, true, row);
		}
		throw c.error("expected 'def', 'for' or 'with' after 'async'", t);
	}

	private PyStmt parseFunctionDef(Cursor c, List<PyExpr> decorators, boolean isAsync, int row) {
		c.expectName("def");
		String name = c.expect(PyTokenType.NAME, "function name").text();
		c.expectOp("(");
		PyArguments args = parseParameters(c, ")", true);
		c.expectOp(")");
		PyExpr returns = null;
		if (c.peekIsOp("->")) {
			c.next();
			returns = parseTest(c);
		}
		c.expectOp(":");
		List<PyStmt> body = parseSuite(c);
		return new PyFunctionDef(name, args, body, decorators, returns, isAsync, row);
	}

	private PyStmt parseClassDef(Cursor c, List<PyExpr> decorators) {
		int row = c.expectName("class").startRow();
		String name = c.expect(PyTokenType.NAME, "class name").text();
		List<PyNode> arguments = new ArrayList<>();
		if (c.peekIsOp("(")) {
			parseCallArguments(c, arguments);
		}
		c.expectOp(":");
		List<PyStmt> body = parseSuite(c);
		return new PyClassDef(name, arguments, body, decorators, row);
	}

	private List<PyStmt> parseSuite(Cursor c) {
		if (!c.peekIs(PyTokenType.NEWLINE)) {
			return parseSimpleStatements(c);
		}
		c.next();
		c.expect(PyTokenType.INDENT, "indented block");
		List<PyStmt> stmts = new ArrayList<>();
		while (!c.peekIs(PyTokenType.DEDENT) && !c.isAtEnd()) {
			if (c.peekIs(PyTokenType.NEWLINE)) {
				c.next();
				continue;
			}
			stmts.addAll(parseStatement(c));
		}
		c.expect(PyTokenType.DEDENT, "dedent");
		return stmts;
	}

	private PyArguments parseParameters(Cursor c, String closer, boolean annotations) {
		List<PyArg> args = new ArrayList<>();
		List<PyExpr> defaults = new ArrayList<>();
		List<PyArg> kwonlyargs = new ArrayList<>();
		List<PyExpr> kwDefaults = new ArrayList<>();
		PyArg vararg = null;
		PyArg kwarg = null;
		boolean keywordOnly = false;

		while (!c.peekIsOp(closer)) {
			if (c.peekIsOp("/")) {
				c.next();
			} else if (c.peekIsOp("*")) {
				c.next();
				keywordOnly = true;
				if (c.peekIs(PyTokenType.NAME)) {
					vararg = parseParameter(c, annotations);
				}
			} else if (c.peekIsOp("**")) {
				c.next();
				kwarg = parseParameter(c, annotations);
			} else {
				PyToken start = c.peek();
				PyArg arg = parseParameter(c, annotations);
				PyExpr defaultValue = null;
				if (c.peekIsOp("=")) {
					c.next();
					defaultValue = parseTest(c);
				}
				if (keywordOnly) {
					kwonlyargs.add(arg);
					kwDefaults.add(defaultValue);
				} else if (defaultValue != null) {
					args.add(arg);
					defaults.add(defaultValue);
				} else if (!defaults.isEmpty()) {
					throw c.error("non-default argument follows default argument", start);
				} else {
					args.add(arg);
				}
			}
			if (!c.peekIsOp(",")) {
				break;
			}
			c.next();
		}
		return new PyArguments(args, vararg, kwonlyargs, kwDefaults, kwarg, defaults);
	}

	private PyArg parseParameter(Cursor c, boolean annotations) {
		PyToken name = c.expect(PyTokenType.NAME, "parameter name");
		PyExpr annotation = null;
		if (annotations && c.peekIsOp(":")) {
			c.next();
			annotation = parseTest(c);
		}
		return new PyArg(name.text(), annotation, name.startRow());
	}

	// expressions

	private PyExpr parseYieldOrTestList(Cursor c) {
		if (c.peekIsName("yield")) {
			return parseYield(c);
		}
		return parseTestListStarExpr(c);
	}

	private PyExpr parseYield(Cursor c) {
		int row = c.expectName("yield").startRow();
		if (c.peekIsName("from")) {
			c.next();
			return new PyYieldFrom(parseTest(c), row);
		}
		if (!startsExpression(c.peek())) {
			return new PyYield(null, row);
		}
		return new PyYield(parseTestListStarExpr(c), row);
	}

	/**
	 * Comma-separated tests or starred expressions; a bare comma list becomes a
	 * tuple.
	 */
	private PyExpr parseTestListStarExpr(Cursor c) {
		return parseSequence(c, this::parseTestOrStar);
	}

	/**
	 * Assignment-target list as used by {@code for} and comprehensions.
	 */
	private PyExpr parseExprList(Cursor c) {
		return parseSequence(c, this::parseExprOrStar);
	}

	private PyExpr parseSequence(Cursor c, Function<Cursor, PyExpr> item) {
		PyExpr first = item.apply(c);
		if (!c.peekIsOp(",")) {
			return first;
		}
		List<PyExpr> elts = new ArrayList<>();
		elts.add(first);
		while (c.peekIsOp(",")) {
			c.next();
			if (!startsExpression(c.peek())) {
				break;
			}
			elts.add(item.apply(c));
		}
		return new PyTuple(elts, first.line());
	}

	private List<PyExpr> parseExprItems(Cursor c) {
		List<PyExpr> items = new ArrayList<>();
		items.add(parseExprOrStar(c));
		while (c.peekIsOp(",")) {
			c.next();
			if (!startsExpression(c.peek())) {
				break;
			}
			items.add(parseExprOrStar(c));
		}
		return items;
	}

	private PyExpr parseTestOrStar(Cursor c) {
		if (c.peekIsOp("*")) {
			int row = c.next().startRow();
			return new PyStarred(parseBitOr(c), row);
		}
		return parseTest(c);
	}

	private PyExpr parseExprOrStar(Cursor c) {
		if (c.peekIsOp("*")) {
			int row = c.next().startRow();
			return new PyStarred(parseBitOr(c), row);
		}
		return parseBitOr(c);
	}

	private PyExpr parseNamedExprOrStar(Cursor c) {
		if (c.peekIsOp("*")) {
			int row = c.next().startRow();
			return new PyStarred(parseBitOr(c), row);
		}
		return parseNamedExprTest(c);
	}

	private PyExpr parseNamedExprTest(Cursor c) {
		PyExpr target = parseTest(c);
		if (c.peekIsOp(":=")) {
			c.next();
			return new PyNamedExpr(target, parseTest(c), target.line());
		}
		return target;
	}

	private PyExpr parseTest(Cursor c) {
		if (c.peekIsName("lambda")) {
			return parseLambda(c);
		}
		PyExpr body = parseOrTest(c);
		if (c.peekIsName("if")) {
			c.next();
			PyExpr test = parseOrTest(c);
			c.expectName("else");
			PyExpr orelse = parseTest(c);
			return new PyIfExp(test, body, orelse, body.line());
		}
		return body;
	}

	private PyExpr parseLambda(Cursor c) {
		int row = c.expectName("lambda").startRow();
		PyArguments args = parseParameters(c, ":", false);
		c.expectOp(":");
		return new PyLambda(args, parseTest(c), row);
	}

	private PyExpr parseOrTest(Cursor c) {
		return parseBoolOp(c, "or", PyOperator.OR, this::parseAndTest);
	}

	private PyExpr parseAndTest(Cursor c) {
		return parseBoolOp(c, "and", PyOperator.AND, this::parseNotTest);
	}

	private PyExpr parseBoolOp(Cursor c, String keyword, PyOperator op, Function<Cursor, PyExpr> operand) {
		PyExpr first = operand.apply(c);
		if (!c.peekIsName(keyword)) {
			return first;
		}
		List<PyExpr> values = new ArrayList<>();
		values.add(first);
		while (c.peekIsName(keyword)) {
			c.next();
			values.add(operand.apply(c));
		}
		return new PyBoolOp(op, values, first.line());
	}

	private PyExpr parseNotTest(Cursor c) {
		if (c.peekIsName("not")) {
			int row = c.next().startRow();
			return new PyUnaryOp(PyOperator.NOT, parseNotTest(c), row);
		}
		return parseComparison(c);
	}

	private PyExpr parseComparison(Cursor c) {
		PyExpr left = parseBitOr(c);
		List<PyOperator> ops = new ArrayList<>();
		List<PyExpr> comparators = new ArrayList<>();
		PyOperator op;
		while ((op = parseComparisonOperator(c)) != null) {
			ops.add(op);
			comparators.add(parseBitOr(c));
		}
		if (ops.isEmpty()) {
			return left;
		}
		return new PyCompare(left, ops, comparators, left.line());
	}

	private PyOperator parseComparisonOperator(Cursor c) {
		PyToken t = c.peek();
		if (t.type() == PyTokenType.OP) {
			PyOperator op = PyOperator.comparison(t.text());
			if (op != null) {
				c.next();
			}
			return op;
		}
		if (t.isName("in")) {
			c.next();
			return PyOperator.IN;
		}
		if (t.isName("not") && c.peek(1).isName("in")) {
			c.next();
			c.next();
			return PyOperator.NOT_IN;
		}
		if (t.isName("is")) {
			c.next();
			if (c.peekIsName("not")) {
				c.next();
				return PyOperator.IS_NOT;
			}
			return PyOperator.IS;
		}
		return null;
	}

	private PyExpr parseBitOr(Cursor c) {
		return parseBinary(c, Set.of("|"), this::parseBitXor);
	}

	private PyExpr parseBitXor(Cursor c) {
		return parseBinary(c, Set.of("^"), this::parseBitAnd);
	}

	private PyExpr parseBitAnd(Cursor c) {
		return parseBinary(c, Set.of("&"), this::parseShift);
	}

	private PyExpr parseShift(Cursor c) {
		return parseBinary(c, Set.of("<<", ">>"), this::parseArith);
	}

	private PyExpr parseArith(Cursor c) {
		return parseBinary(c, Set.of("+", "-"), this::parseTerm);
	}

	private PyExpr parseTerm(Cursor c) {
		return parseBinary(c, Set.of("*", "@", "/", "%", "//"), this::parseFactor);
	}

	private PyExpr parseBinary(Cursor c, Set<String> symbols, Function<Cursor, PyExpr> operand) {
		PyExpr left = operand.apply(c);
		while (c.peek().type() == PyTokenType.OP && symbols.contains(c.peek().text())) {
			PyOperator op = PyOperator.binary(c.next().text());
			PyExpr right = operand.apply(c);
			left = new PyBinOp(left, op, right, left.line());
		}
		return left;
	}

	private PyExpr parseFactor(Cursor c) {
		PyToken t = c.peek();
		if (t.type() == PyTokenType.OP && UNARY_OPS.containsKey(t.text())) {
			c.next();
			return new PyUnaryOp(UNARY_OPS.get(t.text()), parseFactor(c), t.startRow());
		}
		return parsePower(c);
	}

	private PyExpr parsePower(Cursor c) {
		PyExpr base = parseAwaitPrimary(c);
		if (c.peekIsOp("**")) {
			c.next();
			return new PyBinOp(base, PyOperator.POW, parseFactor(c), base.line());
		}
		return base;
	}

	private PyExpr parseAwaitPrimary(Cursor c) {
		if (c.peekIsName("await")) {
			int row = c.next().startRow();
			return new PyAwait(parsePrimary(c), row);
		}
		return parsePrimary(c);
	}

	private PyExpr parsePrimary(Cursor c) {
		PyExpr e = parseAtom(c);
		while (true) {
			if (c.peekIsOp("(")) {
				List<PyNode> arguments = new ArrayList<>();
				parseCallArguments(c, arguments);
				e = new PyCall(e, arguments, e.line());
			} else if (c.peekIsOp("[")) {
				c.next();
				PyExpr slice = parseSubscriptList(c);
				c.expectOp("]");
				e = new PySubscript(e, slice, e.line());
			} else if (c.peekIsOp(".")) {
				c.next();
				e = new PyAttribute(e, c.expect(PyTokenType.NAME, "attribute name").text(), e.line());
			} else {
				return e;
			}
		}
	}

	private void parseCallArguments(Cursor c, List<PyNode> arguments) {
		c.expectOp("(");
		while (!c.peekIsOp(")")) {
			PyToken t = c.peek();
			if (t.isOp("*")) {
				c.next();
				arguments.add(new PyStarred(parseTest(c), t.startRow()));
			} else if (t.isOp("**")) {
				c.next();
				arguments.add(new PyKeyword(null, parseTest(c), t.startRow()));
			} else if (t.type() == PyTokenType.NAME && c.peek(1).isOp("=")) {
				c.next();
				c.next();
				arguments.add(new PyKeyword(t.text(), parseTest(c), t.startRow()));
			} else {
				PyExpr arg = parseNamedExprTest(c);
				if (isCompFor(c)) {
					arg = new PyGeneratorExp(arg, parseCompFor(c), arg.line());
				}
				arguments.add(arg);
			}
			if (!c.peekIsOp(",")) {
				break;
			}
			c.next();
		}
		c.expectOp(")");
	}

	private PyExpr parseSubscriptList(Cursor c) {
		PyExpr first = parseSubscript(c);
		if (!c.peekIsOp(",")) {
			return first;
		}
		List<PyExpr> items = new ArrayList<>();
		items.add(first);
		while (c.peekIsOp(",")) {
			c.next();
			if (c.peekIsOp("]")) {
				break;
			}
			items.add(parseSubscript(c));
		}
		return new PyTuple(items, first.line());
	}

	private PyExpr parseSubscript(Cursor c) {
		int row = c.peek().startRow();
		PyExpr lower = null;
		if (!c.peekIsOp(":")) {
			lower = parseNamedExprTest(c);
			if (!c.peekIsOp(":")) {
				return lower;
			}
		}
		c.expectOp(":");
		PyExpr upper = null;
		if (!endsSlicePart(c)) {
			upper = parseTest(c);
		}
		PyExpr step = null;
		if (c.peekIsOp(":")) {
			c.next();
			if (!endsSlicePart(c)) {
				step = parseTest(c);
			}
		}
		return new PySlice(lower, upper, step, row);
	}

	private static boolean endsSlicePart(Cursor c) {
		return c.peekIsOp(":") || c.peekIsOp("]") || c.peekIsOp(",");
	}

	private PyExpr parseAtom(Cursor c) {
		PyToken t = c.peek();
		int row = t.startRow();

		switch (t.type()) {
			case NUMBER:
				c.next();
				return new PyNum(t.text(), row);
			case STRING:
				return parseStrings(c);
			case NAME:
				return parseNameAtom(c);
			case OP:
				break;
			default:
				throw c.error("invalid syntax", t);
		}

		switch (t.text()) {
			case "(":
				return parseParenthesized(c);
			case "[":
				return parseListDisplay(c);
			case "{":
				return parseDictOrSetDisplay(c);
			case "...":
				c.next();
				return new PyEllipsis(row);
			default:
				throw c.error("invalid syntax", t);
		}
	}

	private PyExpr parseNameAtom(Cursor c) {
		PyToken t = c.next();
		switch (t.text()) {
			case "None":
				return new PyNameConstant(PyNameConstant.Kind.NONE, t.startRow());
			case "True":
				return new PyNameConstant(PyNameConstant.Kind.TRUE, t.startRow());
			case "False":
				return new PyNameConstant(PyNameConstant.Kind.FALSE, t.startRow());
			default:
				if (KEYWORDS.contains(t.text())) {
					throw c.error("invalid syntax", t);
				}
				return new PyName(t.text(), t.startRow());
		}
	}

	private PyExpr parseStrings(Cursor c) {
		PyToken first = c.peek();
		StringBuilder value = new StringBuilder();
		List<Integer> tokenLines = new ArrayList<>();
		while (c.peekIs(PyTokenType.STRING)) {
			PyToken t = c.next();
			value.append(StringLiterals.decode(t.text()));
			tokenLines.add(t.endRow());
		}
		return new PyStr(value.toString(), tokenLines, first.startRow());
	}

	private PyExpr parseParenthesized(Cursor c) {
		int row = c.expectOp("(").startRow();
		if (c.peekIsOp(")")) {
			c.next();
			return new PyTuple(List.of(), row);
		}
		if (c.peekIsName("yield")) {
			PyExpr y = parseYield(c);
			c.expectOp(")");
			return y;
		}
		PyExpr first = parseNamedExprOrStar(c);
		if (isCompFor(c)) {
			List<PyComprehension> generators = parseCompFor(c);
			c.expectOp(")");
			return new PyGeneratorExp(first, generators, row);
		}
		if (!c.peekIsOp(",")) {
			c.expectOp(")");
			return first;
		}
		List<PyExpr> elts = parseRestOfDisplay(c, first, ")");
		return new PyTuple(elts, row);
	}

	private PyExpr parseListDisplay(Cursor c) {
		int row = c.expectOp("[").startRow();
		if (c.peekIsOp("]")) {
			c.next();
			return new PyList(List.of(), row);
		}
		PyExpr first = parseNamedExprOrStar(c);
		if (isCompFor(c)) {
			List<PyComprehension> generators = parseCompFor(c);
			c.expectOp("]");
			return new PyListComp(first, generators, row);
		}
		return new PyList(parseRestOfDisplay(c, first, "]"), row);
	}

	private PyExpr parseDictOrSetDisplay(Cursor c) {
		int row = c.expectOp("{").startRow();
		if (c.peekIsOp("}")) {
			c.next();
			return new PyDict(List.of(), List.of(), row);
		}

		List<PyExpr> keys = new ArrayList<>();
		List<PyExpr> values = new ArrayList<>();
		if (c.peekIsOp("**")) {
			c.next();
			keys.add(null);
			values.add(parseBitOr(c));
			return parseRestOfDict(c, keys, values, row);
		}

		PyExpr first = parseNamedExprOrStar(c);
		if (c.peekIsOp(":")) {
			c.next();
			PyExpr value = parseTest(c);
			if (isCompFor(c)) {
				List<PyComprehension> generators = parseCompFor(c);
				c.expectOp("}");
				return new PyDictComp(first, value, generators, row);
			}
			keys.add(first);
			values.add(value);
			return parseRestOfDict(c, keys, values, row);
		}

		if (isCompFor(c)) {
			List<PyComprehension> generators = parseCompFor(c);
			c.expectOp("}");
			return new PySetComp(first, generators, row);
		}
		return new PySet(parseRestOfDisplay(c, first, "}"), row);
	}

	private PyExpr parseRestOfDict(Cursor c, List<PyExpr> keys, List<PyExpr> values, int row) {
		while (c.peekIsOp(",")) {
			c.next();
			if (c.peekIsOp("}")) {
				break;
			}
			if (c.peekIsOp("**")) {
				c.next();
				keys.add(null);
				values.add(parseBitOr(c));
				continue;
			}
			keys.add(parseTest(c));
			c.expectOp(":");
			values.add(parseTest(c));
		}
		c.expectOp("}");
		return new PyDict(keys, values, row);
	}

	private List<PyExpr> parseRestOfDisplay(Cursor c, PyExpr first, String closer) {
		List<PyExpr> elts = new ArrayList<>();
		elts.add(first);
		while (c.peekIsOp(",")) {
			c.next();
			if (c.peekIsOp(closer)) {
				break;
			}
			elts.add(parseNamedExprOrStar(c));
		}
		c.expectOp(closer);
		return elts;
	}

	private static boolean isCompFor(Cursor c) {
		return c.peekIsName("for") || (c.peekIsName("async") && c.peek(1).isName("for"));
	}

	private List<PyComprehension> parseCompFor(Cursor c) {
		List<PyComprehension> generators = new ArrayList<>();
		while (isCompFor(c)) {
			int row = c.peek().startRow();
			boolean isAsync = false;
			if (c.peekIsName("async")) {
				c.next();
				isAsync = true;
			}
			c.expectName("for");
			PyExpr target = parseExprList(c);
			c.expectName("in");
			PyExpr iter = parseOrTest(c);
			List<PyExpr> ifs = new ArrayList<>();
			while (c.peekIsName("if")) {
				c.next();
				ifs.add(parseOrTest(c));
			}
			generators.add(new PyComprehension(target, iter, ifs, isAsync, row));
		}
		return generators;
	}

	private static boolean atStatementEnd(Cursor c) {
		return c.peekIs(PyTokenType.NEWLINE) || c.peekIsOp(";") || c.isAtEnd();
	}

	private static boolean startsExpression(PyToken t) {
		switch (t.type()) {
			case NUMBER:
			case STRING:
				return true;
			case NAME:
				return !KEYWORDS.contains(t.text()) || EXPRESSION_KEYWORDS.contains(t.text());
			case OP:
				return EXPRESSION_START_OPS.contains(t.text());
			default:
				return false;
		}
	}

	private static final class Cursor {
		private final List<PyToken> tokens;
		private int pos;

		Cursor(List<PyToken> tokens) {
			this.tokens = tokens;
			this.pos = 0;
		}

		boolean isAtEnd() {
			return peek().type() == PyTokenType.ENDMARKER;
		}

		PyToken peek() {
			return peek(0);
		}

		PyToken peek(int ahead) {
			return tokens.get(Math.min(pos + ahead, tokens.size() - 1));
		}

		PyToken next() {
			PyToken t = peek();
			if (pos < tokens.size() - 1) {
				pos++;
			}
			return t;
		}

		boolean peekIs(PyTokenType type) {
			return peek().type() == type;
		}

		boolean peekIsName(String text) {
			return peek().isName(text);
		}

		boolean peekIsOp(String text) {
			return peek().isOp(text);
		}

		PyToken expectName(String text) {
			PyToken t = next();
			if (!t.isName(text)) {
				throw error("expected '" + text + "' but got " + describe(t), t);
			}
			return t;
		}

		PyToken expectOp(String text) {
			PyToken t = next();
			if (!t.isOp(text)) {
				throw error("expected '" + text + "' but got " + describe(t), t);
			}
			return t;
		}

		void expectNewline() {
			if (isAtEnd()) {
				return;
			}
			expect(PyTokenType.NEWLINE, "end of line");
		}

		PyToken expect(PyTokenType type, String what) {
			PyToken t = next();
			if (t.type() != type) {
				throw error("expected " + what + " but got " + describe(t), t);
			}
			return t;
		}

		PySyntaxException error(String message, PyToken at) {
			return new PySyntaxException(message, at.startRow(), at.span().startCol());
		}

		private static String describe(PyToken t) {
			return t.text().isBlank() ? t.type().toString() : t.type() + "(" + t.text().strip() + ")";
		}
	}
}
