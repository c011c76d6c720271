package py2coffee.ast.py;

public sealed interface PyStmt extends PyNode permits PyFunctionDef, PyClassDef, PyReturn, PyDelete, PyAssign,
		PyAugAssign, PyAnnAssign, PyFor, PyWhile, PyIf,
		PyWith, PyRaise, PyTry, PyAssert, PyImport,
		PyImportFrom, PyGlobal, PyNonlocal, PyExprStmt, PyPass,
		PyBreak, PyContinue {
}
