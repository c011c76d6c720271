package py2coffee.ast.py;

public sealed interface PyExpr extends PyNode permits PyBoolOp, PyNamedExpr, PyBinOp, PyUnaryOp, PyLambda,
		PyIfExp, PyDict, PySet, PyListComp, PySetComp,
		PyDictComp, PyGeneratorExp, PyAwait, PyYield, PyYieldFrom,
		PyCompare, PyCall, PyNum, PyStr, PyNameConstant,
		PyEllipsis, PyAttribute, PySubscript, PyStarred, PyName,
		PyList, PyTuple, PySlice {
}
