package py2coffee.print;

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
import py2coffee.ast.py.PyVisitor;
import py2coffee.ast.py.PyWhile;
import py2coffee.ast.py.PyWith;
import py2coffee.ast.py.PyWithItem;
import py2coffee.ast.py.PyYield;
import py2coffee.ast.py.PyYieldFrom;
import py2coffee.diagnostics.Diagnostic;
import py2coffee.diagnostics.Diagnostics;
import py2coffee.sync.TokenSync;

import java.util.ArrayList;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Prints a Python module as CoffeeScript.
 *
 * A depth-first walk with one rule per node kind. Statements pull their
 * leading comment and blank lines, and string literals their source
 * spelling, from the {@link TokenSync} carried in the {@link PrintContext}.
 */
public final class CoffeeScriptPrinter implements PyVisitor<String, PrintContext> {
	/** Receiver parameter name of Python methods. */
	static final String RECEIVER_NAME = "self";

	/** CoffeeScript spelling of the receiver. */
	static final String RECEIVER_MARKER = "@";

	/** Rendering of an absent child node. */
	static final String NIL = "null";

	/** Stands in for a comprehension clause that rendered to nothing. */
	static final String MISSING_CLAUSE = "<**None**>";

	private final PrinterOptions options;
	private final Diagnostics diagnostics;

	public CoffeeScriptPrinter() {
		this(PrinterOptions.DEFAULT, Diagnostics.logging());
	}

	public CoffeeScriptPrinter(PrinterOptions options, Diagnostics diagnostics) {
		this.options = options;
		this.diagnostics = diagnostics;
	}

	public String print(PyModule module, TokenSync sync) {
		return visit(module, PrintContext.root(sync));
	}

	String visit(PyNode node, PrintContext ctx) {
		if (node == null) {
			return NIL;
		}
		return node.accept(this, ctx);
	}

	/**
	 * Walks a subtree that has no CoffeeScript rendering, so the string
	 * literals inside it still take their tokens off the row queues.
	 */
	private void skip(PyNode node, PrintContext ctx) {
		if (node != null) {
			visit(node, ctx);
		}
	}

	private String visitAll(List<? extends PyNode> nodes, String separator, PrintContext ctx) {
		return nodes.stream()
				.map(n -> visit(n, ctx))
				.collect(Collectors.joining(separator));
	}

	private String block(List<PyStmt> body, PrintContext ctx) {
		StringBuilder out = new StringBuilder();
		for (PyStmt stmt : body) {
			out.append(visit(stmt, ctx));
		}
		return out.toString();
	}

	/**
	 * Leading lines of {@code node}, then {@code text} indented, then a newline.
	 */
	private String line(PyNode node, String text, PrintContext ctx) {
		return ctx.sync().leadingString(node) + ctx.indent(text) + "\n";
	}

	private String operator(PyOperator op, int line) {
		String spelling = OperatorTable.spelling(op);
		if (spelling != null) {
			return spelling;
		}
		if (options.strictOperators()) {
			throw new UnknownOperatorException(op);
		}
		diagnostics.report(Diagnostic.Kind.UNKNOWN_OPERATOR, line, "no spelling for " + op);
		return OperatorTable.placeholder(op);
	}

	// contexts

	@Override
	public String visitModule(PyModule node, PrintContext ctx) {
		return block(node.body(), ctx) + String.join("", ctx.sync().remainingLines());
	}

	@Override
	public String visitClassDef(PyClassDef node, PrintContext ctx) {
		StringBuilder out = new StringBuilder();
		out.append(decorators(node.decorators(), ctx));
		out.append(ctx.sync().leadingString(node));

		List<String> bases = new ArrayList<>();
		for (PyNode argument : node.arguments()) {
			if (argument instanceof PyKeyword) {
				skip(argument, ctx);
			} else {
				bases.add(visit(argument, ctx));
			}
		}
		String declaration = "class " + node.name();
		if (!bases.isEmpty()) {
			declaration += " extends " + String.join(", ", bases);
		}
		out.append(ctx.indent(declaration)).append("\n");
		out.append(block(node.body(), ctx.enclosedBy(node.name()).nested()));
		return out.toString();
	}

	@Override
	public String visitFunctionDef(PyFunctionDef node, PrintContext ctx) {
		if (node.isAsync()) {
			throw new UnsupportedConstructException("async def " + node.name(), node);
		}
		StringBuilder out = new StringBuilder();
		out.append(decorators(node.decorators(), ctx));
		out.append(ctx.sync().leadingString(node));

		PyArguments args = node.args();
		boolean elideReceiver = ctx.inType()
				&& !args.args().isEmpty()
				&& RECEIVER_NAME.equals(args.args().get(0).name());
		List<String> params = parameters(args, elideReceiver, ctx);
		skip(node.returns(), ctx);

		String separator = ctx.inType() ? ": " : " = ";
		String paramClause = params.isEmpty() ? "" : "(" + String.join(", ", params) + ") ";
		out.append(ctx.indent(node.name() + separator + paramClause + "->")).append("\n");
		out.append(block(node.body(), ctx.nested()));
		return out.toString();
	}

	private String decorators(List<PyExpr> decorators, PrintContext ctx) {
		StringBuilder out = new StringBuilder();
		for (PyExpr decorator : decorators) {
			out.append(line(decorator, "@" + visit(decorator, ctx), ctx));
		}
		return out.toString();
	}

	/**
	 * Renders a parameter list. Defaults pair with the trailing positional
	 * parameters; the variadic markers follow.
	 */
	private List<String> parameters(PyArguments args, boolean elideReceiver, PrintContext ctx) {
		List<String> out = new ArrayList<>();
		List<PyArg> positional = args.args();
		List<PyExpr> defaults = args.defaults();
		int plain = Math.max(0, positional.size() - defaults.size());

		for (int i = 0; i < positional.size(); i++) {
			String name = parameter(positional.get(i), ctx);
			if (i == 0 && elideReceiver) {
				continue;
			}
			if (i < plain) {
				out.add(name);
			} else {
				out.add(name + "=" + visit(defaults.get(i - plain), ctx));
			}
		}

		if (args.vararg() != null) {
			out.add("*" + parameter(args.vararg(), ctx));
		}
		for (int i = 0; i < args.kwonlyargs().size(); i++) {
			String name = parameter(args.kwonlyargs().get(i), ctx);
			PyExpr defaultValue = i < args.kwDefaults().size() ? args.kwDefaults().get(i) : null;
			out.add(defaultValue == null ? name : name + "=" + visit(defaultValue, ctx));
		}
		if (args.kwarg() != null) {
			out.add("**" + parameter(args.kwarg(), ctx));
		}
		return out;
	}

	/**
	 * The parameter name. Its annotation is dropped, but walked first since
	 * it precedes any default in the source.
	 */
	private String parameter(PyArg arg, PrintContext ctx) {
		skip(arg.annotation(), ctx);
		return visit(arg, ctx);
	}

	@Override
	public String visitArguments(PyArguments node, PrintContext ctx) {
		return String.join(", ", parameters(node, false, ctx));
	}

	@Override
	public String visitArg(PyArg node, PrintContext ctx) {
		return node.name();
	}

	@Override
	public String visitLambda(PyLambda node, PrintContext ctx) {
		List<String> params = parameters(node.args(), false, ctx);
		String paramClause = params.isEmpty() ? "" : "(" + String.join(", ", params) + ") ";
		return paramClause + "-> " + visit(node.body(), ctx);
	}

	// statements

	@Override
	public String visitReturn(PyReturn node, PrintContext ctx) {
		if (node.value() == null) {
			return line(node, "return", ctx);
		}
		return line(node, "return " + visit(node.value(), ctx).strip(), ctx);
	}

	@Override
	public String visitDelete(PyDelete node, PrintContext ctx) {
		return line(node, "del " + visitAll(node.targets(), ",", ctx), ctx);
	}

	@Override
	public String visitAssign(PyAssign node, PrintContext ctx) {
		String targets = visitAll(node.targets(), "=", ctx);
		return line(node, targets + "=" + visit(node.value(), ctx), ctx);
	}

	@Override
	public String visitAugAssign(PyAugAssign node, PrintContext ctx) {
		String target = visit(node.target(), ctx);
		String op = operator(node.op(), node.line());
		return line(node, target + op + "=" + visit(node.value(), ctx), ctx);
	}

	@Override
	public String visitAnnAssign(PyAnnAssign node, PrintContext ctx) {
		String target = visit(node.target(), ctx);
		if (node.value() == null) {
			return line(node, "pass # " + target + ": " + visit(node.annotation(), ctx), ctx);
		}
		skip(node.annotation(), ctx);
		return line(node, target + "=" + visit(node.value(), ctx), ctx);
	}

	@Override
	public String visitFor(PyFor node, PrintContext ctx) {
		if (node.isAsync()) {
			throw new UnsupportedConstructException("async for", node);
		}
		String header = "for " + visit(node.target(), ctx) + " in " + visit(node.iter(), ctx) + ":";
		return line(node, header, ctx)
				+ block(node.body(), ctx.nested())
				+ elseBlock(node.orelse(), ctx);
	}

	@Override
	public String visitWhile(PyWhile node, PrintContext ctx) {
		return line(node, "while " + visit(node.test(), ctx) + ":", ctx)
				+ block(node.body(), ctx.nested())
				+ elseBlock(node.orelse(), ctx);
	}

	@Override
	public String visitIf(PyIf node, PrintContext ctx) {
		return line(node, "if " + visit(node.test(), ctx) + ":", ctx)
				+ block(node.body(), ctx.nested())
				+ elseBlock(node.orelse(), ctx);
	}

	private String elseBlock(List<PyStmt> orelse, PrintContext ctx) {
		if (orelse.isEmpty()) {
			return "";
		}
		return ctx.indent("else:") + "\n" + block(orelse, ctx.nested());
	}

	@Override
	public String visitWith(PyWith node, PrintContext ctx) {
		if (node.isAsync()) {
			throw new UnsupportedConstructException("async with", node);
		}
		String items = visitAll(node.items(), ", ", ctx);
		return line(node, "with " + items + ":", ctx) + block(node.body(), ctx.nested());
	}

	@Override
	public String visitWithItem(PyWithItem node, PrintContext ctx) {
		String context = visit(node.contextExpr(), ctx);
		if (node.optionalVars() == null) {
			return context;
		}
		return context + " as " + visit(node.optionalVars(), ctx);
	}

	@Override
	public String visitRaise(PyRaise node, PrintContext ctx) {
		if (node.exc() == null) {
			return line(node, "raise", ctx);
		}
		String s = "raise " + visit(node.exc(), ctx);
		if (node.cause() != null) {
			s += " from " + visit(node.cause(), ctx);
		}
		return line(node, s, ctx);
	}

	@Override
	public String visitTry(PyTry node, PrintContext ctx) {
		StringBuilder out = new StringBuilder();
		out.append(line(node, "try:", ctx));
		out.append(block(node.body(), ctx.nested()));
		for (PyExceptHandler handler : node.handlers()) {
			out.append(visit(handler, ctx));
		}
		out.append(elseBlock(node.orelse(), ctx));
		if (!node.finalbody().isEmpty()) {
			out.append(ctx.indent("finally:")).append("\n");
			out.append(block(node.finalbody(), ctx.nested()));
		}
		return out.toString();
	}

	@Override
	public String visitExceptHandler(PyExceptHandler node, PrintContext ctx) {
		String s = "except";
		if (node.type() != null) {
			s += " " + visit(node.type(), ctx);
		}
		if (node.name() != null) {
			s += " as " + node.name();
		}
		return line(node, s + ":", ctx) + block(node.body(), ctx.nested());
	}

	@Override
	public String visitAssert(PyAssert node, PrintContext ctx) {
		String s = "assert " + visit(node.test(), ctx);
		if (node.msg() != null) {
			s += ", " + visit(node.msg(), ctx);
		}
		return line(node, s, ctx);
	}

	@Override
	public String visitImport(PyImport node, PrintContext ctx) {
		return line(node, "pass # import " + visitAll(node.names(), ",", ctx), ctx);
	}

	@Override
	public String visitImportFrom(PyImportFrom node, PrintContext ctx) {
		String module = ".".repeat(node.level()) + (node.module() == null ? "" : node.module());
		return line(node, "pass # from " + module + " import " + visitAll(node.names(), ",", ctx), ctx);
	}

	@Override
	public String visitAlias(PyAlias node, PrintContext ctx) {
		return node.asname() == null ? node.name() : node.name() + " as " + node.asname();
	}

	@Override
	public String visitGlobal(PyGlobal node, PrintContext ctx) {
		return line(node, "global " + String.join(",", node.names()), ctx);
	}

	@Override
	public String visitNonlocal(PyNonlocal node, PrintContext ctx) {
		return line(node, "nonlocal " + String.join(",", node.names()), ctx);
	}

	@Override
	public String visitExprStmt(PyExprStmt node, PrintContext ctx) {
		return line(node, visit(node.value(), ctx), ctx);
	}

	@Override
	public String visitPass(PyPass node, PrintContext ctx) {
		return line(node, "pass", ctx);
	}

	@Override
	public String visitBreak(PyBreak node, PrintContext ctx) {
		return line(node, "break", ctx);
	}

	@Override
	public String visitContinue(PyContinue node, PrintContext ctx) {
		return line(node, "continue", ctx);
	}

	// operators

	@Override
	public String visitBoolOp(PyBoolOp node, PrintContext ctx) {
		return visitAll(node.values(), operator(node.op(), node.line()), ctx);
	}

	@Override
	public String visitBinOp(PyBinOp node, PrintContext ctx) {
		return visit(node.left(), ctx) + operator(node.op(), node.line()) + visit(node.right(), ctx);
	}

	@Override
	public String visitUnaryOp(PyUnaryOp node, PrintContext ctx) {
		return operator(node.op(), node.line()) + visit(node.operand(), ctx);
	}

	@Override
	public String visitCompare(PyCompare node, PrintContext ctx) {
		StringBuilder out = new StringBuilder(visit(node.left(), ctx));
		int n = Math.min(node.ops().size(), node.comparators().size());
		for (int i = 0; i < n; i++) {
			out.append(operator(node.ops().get(i), node.line()));
			out.append(visit(node.comparators().get(i), ctx));
		}
		return out.toString();
	}

	@Override
	public String visitIfExp(PyIfExp node, PrintContext ctx) {
		return visit(node.body(), ctx) + " if " + visit(node.test(), ctx) + " else " + visit(node.orelse(), ctx);
	}

	@Override
	public String visitNamedExpr(PyNamedExpr node, PrintContext ctx) {
		return "(" + visit(node.target(), ctx) + " = " + visit(node.value(), ctx) + ")";
	}

	// operands

	@Override
	public String visitAttribute(PyAttribute node, PrintContext ctx) {
		String value = visit(node.value(), ctx);
		return RECEIVER_MARKER.equals(value) ? value + node.attr() : value + "." + node.attr();
	}

	@Override
	public String visitCall(PyCall node, PrintContext ctx) {
		String func = visit(node.func(), ctx);
		// visited in source order, printed positional first
		List<String> args = new ArrayList<>();
		List<String> keywords = new ArrayList<>();
		for (PyNode argument : node.arguments()) {
			if (argument instanceof PyKeyword) {
				keywords.add(visit(argument, ctx));
			} else {
				args.add(visit(argument, ctx));
			}
		}
		args.addAll(keywords);
		return func + "(" + String.join(",", args) + ")";
	}

	@Override
	public String visitKeyword(PyKeyword node, PrintContext ctx) {
		String value = visit(node.value(), ctx);
		return node.arg() == null ? "**" + value : node.arg() + "=" + value;
	}

	@Override
	public String visitStarred(PyStarred node, PrintContext ctx) {
		return "*" + visit(node.value(), ctx);
	}

	@Override
	public String visitSubscript(PySubscript node, PrintContext ctx) {
		return visit(node.value(), ctx) + "[" + visit(node.slice(), ctx) + "]";
	}

	@Override
	public String visitSlice(PySlice node, PrintContext ctx) {
		String lower = node.lower() == null ? "" : visit(node.lower(), ctx);
		String upper = node.upper() == null ? "" : visit(node.upper(), ctx);
		if (node.step() == null) {
			return lower + ":" + upper;
		}
		return lower + ":" + upper + ":" + visit(node.step(), ctx);
	}

	@Override
	public String visitName(PyName node, PrintContext ctx) {
		return RECEIVER_NAME.equals(node.id()) ? RECEIVER_MARKER : node.id();
	}

	@Override
	public String visitNameConstant(PyNameConstant node, PrintContext ctx) {
		switch (node.kind()) {
			case TRUE:
				return "true";
			case FALSE:
				return "false";
			default:
				return NIL;
		}
	}

	@Override
	public String visitNum(PyNum node, PrintContext ctx) {
		return NumberLiterals.canonical(node.text());
	}

	@Override
	public String visitStr(PyStr node, PrintContext ctx) {
		return ctx.sync().recoverLiteralSpelling(node);
	}

	@Override
	public String visitEllipsis(PyEllipsis node, PrintContext ctx) {
		return "...";
	}

	@Override
	public String visitAwait(PyAwait node, PrintContext ctx) {
		throw new UnsupportedConstructException("await", node);
	}

	@Override
	public String visitYield(PyYield node, PrintContext ctx) {
		return node.value() == null ? "yield" : "yield " + visit(node.value(), ctx);
	}

	@Override
	public String visitYieldFrom(PyYieldFrom node, PrintContext ctx) {
		return "yield from " + visit(node.value(), ctx);
	}

	// collections

	@Override
	public String visitList(PyList node, PrintContext ctx) {
		return "[" + visitAll(node.elts(), ",", ctx) + "]";
	}

	@Override
	public String visitTuple(PyTuple node, PrintContext ctx) {
		if (node.elts().size() == 1) {
			return "(" + visit(node.elts().get(0), ctx) + ",)";
		}
		return "(" + visitAll(node.elts(), ", ", ctx) + ")";
	}

	@Override
	public String visitSet(PySet node, PrintContext ctx) {
		return "{" + visitAll(node.elts(), ", ", ctx) + "}";
	}

	@Override
	public String visitDict(PyDict node, PrintContext ctx) {
		if (node.keys().size() != node.values().size()) {
			diagnostics.report(Diagnostic.Kind.DICT_MISMATCH, node.line(),
					node.keys().size() + " keys but " + node.values().size() + " values");
			return "{}";
		}
		List<String> items = new ArrayList<>();
		for (int i = 0; i < node.keys().size(); i++) {
			PyExpr key = node.keys().get(i);
			String value = visit(node.values().get(i), ctx);
			items.add(key == null ? "**" + value : visit(key, ctx) + ":" + value);
		}
		return "{" + String.join(", ", items) + "}";
	}

	@Override
	public String visitListComp(PyListComp node, PrintContext ctx) {
		return visit(node.elt(), ctx) + " for " + clauses(node.generators(), ctx);
	}

	@Override
	public String visitGeneratorExp(PyGeneratorExp node, PrintContext ctx) {
		return "(" + visit(node.elt(), ctx) + " for " + clauses(node.generators(), ctx) + ")";
	}

	@Override
	public String visitSetComp(PySetComp node, PrintContext ctx) {
		return "{" + visit(node.elt(), ctx) + " for " + clauses(node.generators(), ctx) + "}";
	}

	@Override
	public String visitDictComp(PyDictComp node, PrintContext ctx) {
		String item = visit(node.key(), ctx) + ":" + visit(node.value(), ctx);
		return "{" + item + " for " + clauses(node.generators(), ctx) + "}";
	}

	/**
	 * One segment per generator. A missing or empty clause keeps its slot as
	 * {@link #MISSING_CLAUSE}.
	 */
	private String clauses(List<PyComprehension> generators, PrintContext ctx) {
		List<String> segments = new ArrayList<>();
		for (PyComprehension generator : generators) {
			String segment = generator == null ? "" : visit(generator, ctx);
			segments.add(segment.isEmpty() ? MISSING_CLAUSE : segment);
		}
		return String.join(" for ", segments);
	}

	@Override
	public String visitComprehension(PyComprehension node, PrintContext ctx) {
		if (node.isAsync()) {
			throw new UnsupportedConstructException("async comprehension", node);
		}
		StringBuilder out = new StringBuilder();
		out.append(visit(node.target(), ctx)).append(" in ").append(visit(node.iter(), ctx));
		for (PyExpr filter : node.ifs()) {
			out.append(" if ").append(visit(filter, ctx));
		}
		return out.toString();
	}
}
