package py2coffee.ast.py;

/**
 * One method per node kind, so a visitor that compiles handles every construct
 * the parser can produce.
 *
 * @param <R> result type
 * @param <C> traversal context threaded through the walk
 */
public interface PyVisitor<R, C> {
	R visitModule(PyModule node, C context);

	R visitFunctionDef(PyFunctionDef node, C context);

	R visitClassDef(PyClassDef node, C context);

	R visitReturn(PyReturn node, C context);

	R visitDelete(PyDelete node, C context);

	R visitAssign(PyAssign node, C context);

	R visitAugAssign(PyAugAssign node, C context);

	R visitAnnAssign(PyAnnAssign node, C context);

	R visitFor(PyFor node, C context);

	R visitWhile(PyWhile node, C context);

	R visitIf(PyIf node, C context);

	R visitWith(PyWith node, C context);

	R visitRaise(PyRaise node, C context);

	R visitTry(PyTry node, C context);

	R visitAssert(PyAssert node, C context);

	R visitImport(PyImport node, C context);

	R visitImportFrom(PyImportFrom node, C context);

	R visitGlobal(PyGlobal node, C context);

	R visitNonlocal(PyNonlocal node, C context);

	R visitExprStmt(PyExprStmt node, C context);

	R visitPass(PyPass node, C context);

	R visitBreak(PyBreak node, C context);

	R visitContinue(PyContinue node, C context);

	R visitBoolOp(PyBoolOp node, C context);

	R visitNamedExpr(PyNamedExpr node, C context);

	R visitBinOp(PyBinOp node, C context);

	R visitUnaryOp(PyUnaryOp node, C context);

	R visitLambda(PyLambda node, C context);

	R visitIfExp(PyIfExp node, C context);

	R visitDict(PyDict node, C context);

	R visitSet(PySet node, C context);

	R visitListComp(PyListComp node, C context);

	R visitSetComp(PySetComp node, C context);

	R visitDictComp(PyDictComp node, C context);

	R visitGeneratorExp(PyGeneratorExp node, C context);

	R visitAwait(PyAwait node, C context);

	R visitYield(PyYield node, C context);

	R visitYieldFrom(PyYieldFrom node, C context);

	R visitCompare(PyCompare node, C context);

	R visitCall(PyCall node, C context);

	R visitNum(PyNum node, C context);

	R visitStr(PyStr node, C context);

	R visitNameConstant(PyNameConstant node, C context);

	R visitEllipsis(PyEllipsis node, C context);

	R visitAttribute(PyAttribute node, C context);

	R visitSubscript(PySubscript node, C context);

	R visitStarred(PyStarred node, C context);

	R visitName(PyName node, C context);

	R visitList(PyList node, C context);

	R visitTuple(PyTuple node, C context);

	R visitSlice(PySlice node, C context);

	R visitArguments(PyArguments node, C context);

	R visitArg(PyArg node, C context);

	R visitKeyword(PyKeyword node, C context);

	R visitAlias(PyAlias node, C context);

	R visitWithItem(PyWithItem node, C context);

	R visitComprehension(PyComprehension node, C context);

	R visitExceptHandler(PyExceptHandler node, C context);
}
