package py2coffee.config;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.FileSystems;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.PathMatcher;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * Expands the {@code files} setting into existing files.
 */
public final class FileGlobs {
	private static final String GLOB_CHARS = "*?[{";

	private FileGlobs() {
	}

	/**
	 * Splits a comma or newline separated list, dropping blanks.
	 */
	public static List<String> split(String patterns) {
		return Arrays.stream(patterns.split("[,\\n\\r]+"))
				.map(String::strip)
				.filter(s -> !s.isEmpty())
				.collect(Collectors.toList());
	}

	/**
	 * Expands each pattern relative to {@code base}. Plain paths are kept when
	 * they exist; patterns match regular files below the longest wildcard-free
	 * directory prefix. Order follows the patterns, then the file names.
	 *
	 * @throws IOException when a directory below a pattern root cannot be read
	 */
	public static List<Path> expand(List<String> patterns, Path base) throws IOException {
		Set<Path> out = new LinkedHashSet<>();
		for (String pattern : patterns) {
			Path resolved = TranspilerConfig.resolve(pattern, base);
			if (!hasWildcard(pattern)) {
				if (Files.exists(resolved)) {
					out.add(resolved);
				}
				continue;
			}
			out.addAll(match(resolved.toString()));
		}
		return new ArrayList<>(out);
	}

	private static List<Path> match(String pattern) throws IOException {
		String separator = FileSystems.getDefault().getSeparator();
		int firstWild = firstWildcard(pattern);
		int rootEnd = pattern.lastIndexOf(separator, firstWild);
		Path root = Path.of(rootEnd <= 0 ? separator : pattern.substring(0, rootEnd));
		if (!Files.isDirectory(root)) {
			return List.of();
		}
		PathMatcher matcher = FileSystems.getDefault().getPathMatcher("glob:" + pattern.replace("\\", "\\\\"));
		try (Stream<Path> paths = Files.walk(root)) {
			return paths
					.filter(Files::isRegularFile)
					.filter(matcher::matches)
					.sorted()
					.collect(Collectors.toList());
		} catch (UncheckedIOException e) {
			// the walk reports unreadable entries while it is consumed
			throw e.getCause();
		}
	}

	private static boolean hasWildcard(String pattern) {
		return firstWildcard(pattern) < pattern.length();
	}

	private static int firstWildcard(String pattern) {
		for (int i = 0; i < pattern.length(); i++) {
			if (GLOB_CHARS.indexOf(pattern.charAt(i)) >= 0) {
				return i;
			}
		}
		return pattern.length();
	}
}
