package py2coffee.print;

import org.junit.jupiter.api.Test;
import py2coffee.ast.py.PyDict;
import py2coffee.ast.py.PyExprStmt;
import py2coffee.ast.py.PyModule;
import py2coffee.ast.py.PyName;
import py2coffee.ast.py.PyOperator;
import py2coffee.diagnostics.Diagnostic;
import py2coffee.parse.py.PyLexer;
import py2coffee.parse.py.PyParser;
import py2coffee.parse.py.PyToken;
import py2coffee.sync.TokenSync;

import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

public class CoffeeScriptPrinterTest {
	private final List<Diagnostic> diagnostics = new ArrayList<>();

	private String print(String source) {
		return print(source, PrinterOptions.DEFAULT);
	}

	private String print(String source, PrinterOptions options) {
		List<PyToken> tokens = new PyLexer().lex(source);
		PyModule module = new PyParser().parse(tokens);
		TokenSync sync = new TokenSync(source, tokens, diagnostics::add);
		return new CoffeeScriptPrinter(options, diagnostics::add).print(module, sync);
	}

	@Test
	void pairsDefaultsWithTrailingParameters() {
		assertEquals("f = (a, b=1, *c, d, e=2, **g) ->\n    pass\n",
				print("def f(a, b=1, *c, d, e=2, **g):\n    pass\n"));
	}

	@Test
	void omitsEmptyParameterClause() {
		assertEquals("f = ->\n    return\n", print("def f():\n    return\n"));
	}

	@Test
	void dropsAnnotations() {
		assertEquals("f = (a, b=1) ->\n    pass\n", print("def f(a: int, b: str = 1) -> None:\n    pass\n"));
	}

	@Test
	void printsClassWithBasesAndReceiverlessMethods() {
		String source = "class A(B, C):\n" +
				"    def m(self, x):\n" +
				"        return self.x + x\n";

		assertEquals("class A extends B, C\n" +
				"    m: (x) ->\n" +
				"        return @x+x\n", print(source));
	}

	@Test
	void methodBodyIsOneLevelDeeperThanItsDeclaration() {
		assertEquals("class A\n    foo: (x=1) ->\n        pass\n",
				print("class A:\n    def foo(self, x=1): pass\n"));
	}

	@Test
	void keepsFirstParameterWhenItIsNotTheReceiver() {
		assertEquals("class A\n    m: (x) ->\n        pass\n", print("class A:\n    def m(x):\n        pass\n"));
	}

	@Test
	void nestedClassesIndentTheirMembers() {
		String source = "class A:\n" +
				"    class B:\n" +
				"        def m(self):\n" +
				"            pass\n";

		assertEquals("class A\n" +
				"    class B\n" +
				"        m: ->\n" +
				"            pass\n", print(source));
	}

	@Test
	void commentsBetweenDecoratorsStayInPlace() {
		String source = "@a\n" +
				"# note\n" +
				"@b(1)\n" +
				"def f():\n" +
				"    pass\n";

		assertEquals("@a\n# note\n@b(1)\nf = ->\n    pass\n", print(source));
	}

	@Test
	void printsDictWithUnpacking() {
		assertEquals("d={'a':1, **m}\n", print("d = {'a': 1, **m}\n"));
	}

	@Test
	void commentInsideDictMovesToNextStatement() {
		String source = "d = {\n" +
				"    # c\n" +
				"    'a': 1,\n" +
				"}\n" +
				"x = 2\n";

		assertEquals("d={'a':1}\n    # c\nx=2\n", print(source));
	}

	@Test
	void mismatchedDictPrintsEmptyBraces() {
		String source = "d\n";
		List<PyToken> tokens = new PyLexer().lex(source);
		PyDict dict = new PyDict(List.of(new PyName("k", 1)), List.of(), 1);
		PyModule module = new PyModule(List.of(new PyExprStmt(dict, 1)));

		String out = new CoffeeScriptPrinter(PrinterOptions.DEFAULT, diagnostics::add)
				.print(module, new TokenSync(source, tokens, diagnostics::add));

		assertEquals("{}\n", out);
		assertEquals(1, diagnostics.size());
		assertEquals(Diagnostic.Kind.DICT_MISMATCH, diagnostics.get(0).kind());
	}

	@Test
	void importsBecomeCommentedPasses() {
		assertEquals("pass # import a,b as c\npass # from ..m import x,y\n",
				print("import a, b as c\nfrom ..m import x, y\n"));
	}

	@Test
	void printsBooleanUnaryAndComparisonOperators() {
		assertEquals("y=not a and b or c is not null\n", print("y = not a and b or c is not None\n"));
	}

	@Test
	void printsPlaceholderForOperatorWithoutSpelling() {
		assertEquals("x=a<MAT_MULT>b\n", print("x = a @ b\n"));
		assertEquals(1, diagnostics.size());
		assertEquals(Diagnostic.Kind.UNKNOWN_OPERATOR, diagnostics.get(0).kind());
	}

	@Test
	void strictModeRejectsOperatorWithoutSpelling() {
		var ex = assertThrows(UnknownOperatorException.class,
				() -> print("x = a @ b\n", new PrinterOptions(true)));

		assertEquals(PyOperator.MAT_MULT, ex.operator());
	}

	@Test
	void asyncConstructsAreUnsupported() {
		assertThrows(UnsupportedConstructException.class, () -> print("async def f():\n    pass\n"));
		assertThrows(UnsupportedConstructException.class, () -> print("def f():\n    await g()\n"));
		assertThrows(UnsupportedConstructException.class, () -> print("def f():\n    async for x in y:\n        pass\n"));
	}

	@Test
	void printsLambdaConditionalAndSlices() {
		assertEquals("f=(x, y=2) -> x[1:2] if y else x[::2]\n",
				print("f = lambda x, y=2: x[1:2] if y else x[::2]\n"));
	}

	@Test
	void printsComprehensions() {
		assertEquals("a={k:v for (k, v) in d.items() if v}\n", print("a = {k: v for k, v in d.items() if v}\n"));
		assertEquals("s=sum((x for row in m for x in row if x if x>1))\n",
				print("s = sum(x for row in m for x in row if x if x > 1)\n"));
		assertEquals("b=x for x in y\n", print("b = [x for x in y]\n"));
	}

	@Test
	void printsCollections() {
		assertEquals("t=((1, 2), [3,4], {5})\n", print("t = (1, 2), [3, 4], {5}\n"));
		assertEquals("x=(true, false)\n", print("x = True, False\n"));
	}

	@Test
	void printsCallArguments() {
		assertEquals("f(a,*x,k=1,**y)\n", print("f(a, *x, k=1, **y)\n"));
	}

	@Test
	void printsLoopsWithElse() {
		assertEquals("for i in xs:\n    continue\nelse:\n    pass\n",
				print("for i in xs:\n    continue\nelse:\n    pass\n"));
		assertEquals("while x:\n    break\n", print("while x:\n    break\n"));
	}

	@Test
	void printsWithAndTry() {
		assertEquals("with open(p) as f, g:\n    del f\n", print("with open(p) as f, g:\n    del f\n"));

		String source = "try:\n" +
				"    a()\n" +
				"except E as e:\n" +
				"    raise X() from e\n" +
				"finally:\n" +
				"    b = 1\n";
		assertEquals("try:\n" +
				"    a()\n" +
				"except E as e:\n" +
				"    raise X() from e\n" +
				"finally:\n" +
				"    b=1\n", print(source));
	}

	@Test
	void printsAssignmentForms() {
		assertEquals("x=1\npass # y: int\nz+=1\na=b=c\n", print("x: int = 1\ny: int\nz += 1\na = b = c\n"));
	}

	@Test
	void printsScopeAndAssertStatements() {
		assertEquals("f = ->\n    global a,b\n    assert a, 'm'\n",
				print("def f():\n    global a, b\n    assert a, 'm'\n"));
	}

	@Test
	void canonicalizesNumbers() {
		assertEquals("n=31+1000+1e+16+0.5\n", print("n = 0x1F + 1_000 + 1e16 + .5\n"));
	}

	@Test
	void printsWalrusAndGenerators() {
		assertEquals("if (n = 10)>5:\n    pass\n", print("if (n := 10) > 5:\n    pass\n"));
		assertEquals("g = ->\n    yield 1\n    yield from h()\n",
				print("def g():\n    yield 1\n    yield from h()\n"));
	}

	@Test
	void keepsMultiLineDocstringSpelling() {
		assertEquals("f = ->\n    \"\"\"a\n    b\"\"\"\n", print("def f():\n    \"\"\"a\n    b\"\"\"\n"));
	}

	@Test
	void emitsEveryFullLineCommentExactlyOnce() {
		String source = "# one\n" +
				"class A:\n" +
				"    # two\n" +
				"    def m(self):\n" +
				"        # three\n" +
				"        x = 1\n" +
				"        # four\n" +
				"        return x\n" +
				"# five\n" +
				"y = 2\n";

		String out = print(source);

		for (String comment : List.of("# one", "# two", "# three", "# four", "# five")) {
			assertEquals(out.indexOf(comment), out.lastIndexOf(comment), comment);
			assertTrue(out.contains(comment), comment);
		}
		assertTrue(out.indexOf("# four") < out.indexOf("return x"));
	}

	@Test
	void stringsInsideDroppedAnnotationsKeepLaterStringsAligned() {
		assertEquals("x='v'\n", print("x: 'int' = 'v'\n"));
		assertEquals("f = (a, b='v') ->\n    pass\n", print("def f(a: 'T', b='v'):\n    pass\n"));
		assertEquals("g = ->\n    return 's'\n", print("def g() -> 'R':\n    return 's'\n"));
		assertEquals("class C extends B\n    s='y'\n", print("class C(B, metaclass=M('x')):\n    s = 'y'\n"));
		assertTrue(diagnostics.isEmpty(), diagnostics.toString());
	}

	@Test
	void callArgumentsTakeTheirStringsInSourceOrder() {
		assertEquals("f(*['b'],k='a')\n", print("f(k='a', *['b'])\n"));
		assertTrue(diagnostics.isEmpty(), diagnostics.toString());
	}

	@Test
	void keepsCommentsAfterTheLastStatement() {
		assertEquals("x=1\n# end\n", print("x = 1\n# end\n"));
		assertEquals("# only comment\n", print("# only comment"));
	}

	@Test
	void commentInsideMultiLineStringIsNotRepeated() {
		assertEquals("x='''a\n# b'''\ny=2\n", print("x = '''a\n# b'''  # c\ny = 2\n"));
	}

	@Test
	void singleElementTupleKeepsItsComma() {
		assertEquals("t=(1,)\n", print("t = 1,\n"));
		assertEquals("t=((1,), 2)\n", print("t = (1,), 2\n"));
	}
}
