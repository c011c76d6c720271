package py2coffee.print;

import py2coffee.sync.TokenSync;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Per-walk printer state: the synchronizer of the file being printed, the
 * indentation level and the names of the enclosing classes, innermost last.
 *
 * Instances are immutable. Entering a block or a class yields a new context,
 * so returning from the recursive call restores the previous state on every
 * exit path.
 */
public final class PrintContext {
	private static final int INDENT_WIDTH = 4;

	private final TokenSync sync;
	private final int level;
	private final List<String> enclosingTypes;

	private PrintContext(TokenSync sync, int level, List<String> enclosingTypes) {
		this.sync = sync;
		this.level = level;
		this.enclosingTypes = enclosingTypes;
	}

	public static PrintContext root(TokenSync sync) {
		return new PrintContext(sync, 0, List.of());
	}

	public TokenSync sync() {
		return sync;
	}

	public int level() {
		return level;
	}

	public List<String> enclosingTypes() {
		return enclosingTypes;
	}

	public boolean inType() {
		return !enclosingTypes.isEmpty();
	}

	/**
	 * Context for the statements of a nested block, one level deeper.
	 */
	public PrintContext nested() {
		return new PrintContext(sync, level + 1, enclosingTypes);
	}

	/**
	 * Context for the body of class {@code name}.
	 */
	public PrintContext enclosedBy(String name) {
		List<String> types = new ArrayList<>(enclosingTypes);
		types.add(name);
		return new PrintContext(sync, level, Collections.unmodifiableList(types));
	}

	/**
	 * Indents {@code text} to this level. Leading newlines are kept in front of
	 * the indentation, so blank-line counts survive.
	 */
	public String indent(String text) {
		int newlines = 0;
		while (newlines < text.length() && text.charAt(newlines) == '\n') {
			newlines++;
		}
		return "\n".repeat(newlines) + " ".repeat(INDENT_WIDTH * level) + text.substring(newlines);
	}
}
