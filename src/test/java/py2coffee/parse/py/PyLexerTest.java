package py2coffee.parse.py;

import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

public class PyLexerTest {
	private static String types(List<PyToken> tokens) {
		return tokens.stream()
				.map(t -> t.type().name())
				.collect(Collectors.joining("|"));
	}

	@Test
	void keepsCommentsAndBlankLinesAsTokens() {
		String input = "x = 'a'  # c\n" +
				"\n" +
				"# note\n" +
				"y = (1,\n" +
				" 2)\n";

		var tokens = new PyLexer().lex(input);

		assertEquals(
				"NAME|OP|STRING|COMMENT|NEWLINE|NL|COMMENT|NL|NAME|OP|OP|NUMBER|OP|NL|NUMBER|OP|NEWLINE|ENDMARKER",
				types(tokens));
	}

	@Test
	void tracksIndentation() {
		var tokens = new PyLexer().lex("if x:\n    y\nz\n");

		assertEquals("NAME|NAME|OP|NEWLINE|INDENT|NAME|NEWLINE|DEDENT|NAME|NEWLINE|ENDMARKER", types(tokens));
	}

	@Test
	void closesOpenBlocksAfterTheLastLine() {
		var tokens = new PyLexer().lex("if x:\n    y\n");

		PyToken dedent = tokens.get(tokens.size() - 2);
		PyToken end = tokens.get(tokens.size() - 1);
		assertEquals(PyTokenType.DEDENT, dedent.type());
		assertEquals(3, dedent.startRow());
		assertEquals(PyTokenType.ENDMARKER, end.type());
		assertEquals(3, end.startRow());
	}

	@Test
	void addsNewlineWhenSourceDoesNotEndWithOne() {
		var tokens = new PyLexer().lex("x = 1");

		assertEquals("NAME|OP|NUMBER|NEWLINE|ENDMARKER", types(tokens));
		assertEquals("", tokens.get(3).text());
	}

	@Test
	void multiLineStringSpansRows() {
		var tokens = new PyLexer().lex("s = '''a\nb'''\n");

		PyToken string = tokens.get(2);
		assertEquals(PyTokenType.STRING, string.type());
		assertEquals("'''a\nb'''", string.text());
		assertEquals(1, string.startRow());
		assertEquals(2, string.endRow());
	}

	@Test
	void readsPrefixedStringsAndOperators() {
		var tokens = new PyLexer().lex("x **= rb'\\d' // 2\n");
		String lexemes = tokens.stream()
				.filter(t -> t.type() != PyTokenType.NEWLINE && t.type() != PyTokenType.ENDMARKER)
				.map(PyToken::text)
				.collect(Collectors.joining("|"));

		assertEquals("x|**=|rb'\\d'|//|2", lexemes);
	}

	@Test
	void joinsBackslashContinuedLines() {
		var tokens = new PyLexer().lex("x = 1 + \\\n    2\n");

		assertEquals("NAME|OP|NUMBER|OP|NUMBER|NEWLINE|ENDMARKER", types(tokens));
	}

	@Test
	void rejectsUnterminatedString() {
		var ex = assertThrows(PySyntaxException.class, () -> new PyLexer().lex("s = 'abc\n"));

		assertEquals(1, ex.row());
	}

	@Test
	void rejectsEofInsideBrackets() {
		assertThrows(PySyntaxException.class, () -> new PyLexer().lex("x = (1,\n"));
	}

	@Test
	void splitLinesKeepsTerminators() {
		assertEquals(List.of("a\n", "b\r\n", "c"), PyLexer.splitLines("a\nb\r\nc"));
	}
}
