package py2coffee.ast;

/**
 * Source span of a token.
 *
 * Rows are 1-based physical lines, columns are 0-based character offsets into
 * their row. The end position is exclusive.
 */
public record SourceSpan(int startRow, int startCol, int endRow, int endCol) {
}
