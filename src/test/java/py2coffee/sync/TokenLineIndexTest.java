package py2coffee.sync;

import org.junit.jupiter.api.Test;
import py2coffee.ast.SourceSpan;
import py2coffee.parse.py.PyLexer;
import py2coffee.parse.py.PyToken;
import py2coffee.parse.py.PyTokenType;

import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

public class TokenLineIndexTest {
	private static TokenLineIndex index(String source) {
		return new TokenLineIndex(source, new PyLexer().lex(source));
	}

	@Test
	void filesMultiLineStringUnderItsLastRow() {
		TokenLineIndex index = index("s = '''a\nb'''\n");

		assertNull(index.pollString(1));
		assertEquals("'''a\nb'''", index.pollString(2).text());
		assertNull(index.pollString(2));
	}

	@Test
	void stringsOnARowComeOutLeftToRight() {
		TokenLineIndex index = index("f('a', \"b\")\n");

		assertEquals("'a'", index.pollString(1).text());
		assertEquals("\"b\"", index.pollString(1).text());
	}

	@Test
	void distinguishesCommentAndBlankRows() {
		TokenLineIndex index = index("x = 1  # trail\n\n    # c\ny = 2\n");

		assertNull(index.commentOn(1));
		assertNull(index.ignoredLine(1));
		assertTrue(index.isBlank(2));
		assertEquals("\n", index.ignoredLine(2));
		assertFalse(index.isBlank(3));
		assertEquals("    # c\n", index.ignoredLine(3));
		assertNull(index.ignoredLine(4));
		assertEquals(4, index.lineCount());
	}

	@Test
	void endOfFileTokensGetTheirOwnBucket() {
		TokenLineIndex index = index("if x:\n    y\n");

		List<PyToken> last = index.tokensOn(3);
		assertEquals(PyTokenType.DEDENT, last.get(0).type());
		assertEquals(PyTokenType.ENDMARKER, last.get(1).type());
	}

	@Test
	void rejectsTwoFullLineCommentsOnOneRow() {
		List<PyToken> tokens = List.of(
				new PyToken(PyTokenType.COMMENT, "# a", "# a", new SourceSpan(1, 0, 1, 3)),
				new PyToken(PyTokenType.COMMENT, "# b", "# a", new SourceSpan(1, 0, 1, 3)));

		assertThrows(TokenSyncException.class, () -> new TokenLineIndex("# a\n", tokens));
	}

	@Test
	void rejectsTokenBeyondTheSource() {
		List<PyToken> tokens = List.of(new PyToken(PyTokenType.NAME, "x", "x", new SourceSpan(5, 0, 5, 1)));

		assertThrows(TokenSyncException.class, () -> new TokenLineIndex("x\n", tokens));
	}

	@Test
	void commentAfterClosingStringIsTrailing() {
		TokenLineIndex index = index("x = '''a\n# b'''  # c\ny = 2\n");

		assertNull(index.commentOn(2));
		assertNull(index.ignoredLine(2));
		assertEquals("'''a\n# b'''", index.pollString(2).text());
	}
}
