package io.evitadb.fuzzypatch.diff;

import javax.annotation.Nonnull;
import javax.annotation.Nullable;
import java.util.Objects;

/**
 * Represents a single line in a unified diff hunk body.
 * Each line has a type (context, add, or remove) and its content without the marker character.
 *
 * @param type    the type of diff line
 * @param content the line content without the prefix character
 */
public record DiffLine(
	@Nonnull DiffLineType type,
	@Nonnull String content
) {

	private static final String NO_NEWLINE_MARKER_PREFIX = "\\";

	/**
	 * Creates a new DiffLine with validation.
	 *
	 * @param type    the type of diff line
	 * @param content the line content
	 */
	public DiffLine {
		Objects.requireNonNull(type, "type must not be null");
		Objects.requireNonNull(content, "content must not be null");
	}

	/**
	 * Parses one raw hunk body line.
	 *
	 * A line with no recognized marker is kept verbatim as an unmarked context line, and an empty
	 * line becomes an empty context line. The `\ No newline at end of file` marker carries no content
	 * and yields null.
	 *
	 * @param rawLine the raw line from the diff body
	 * @return the parsed line, or null when the line must be ignored
	 */
	@Nullable
	public static DiffLine parse(@Nonnull String rawLine) {
		Objects.requireNonNull(rawLine, "rawLine must not be null");
		if (rawLine.isEmpty()) {
			return context("");
		}
		if (rawLine.startsWith(NO_NEWLINE_MARKER_PREFIX)) {
			return null;
		}
		final String content = rawLine.substring(1);
		return switch (rawLine.charAt(0)) {
			case '+' -> add(content);
			case '-' -> remove(content);
			case ' ' -> context(content);
			default -> new DiffLine(DiffLineType.UNMARKED_CONTEXT, rawLine);
		};
	}

	/**
	 * Creates a context line.
	 *
	 * @param content the line content
	 * @return a new context DiffLine
	 */
	@Nonnull
	public static DiffLine context(@Nonnull String content) {
		return new DiffLine(DiffLineType.CONTEXT, content);
	}

	/**
	 * Creates an add line.
	 *
	 * @param content the line content
	 * @return a new add DiffLine
	 */
	@Nonnull
	public static DiffLine add(@Nonnull String content) {
		return new DiffLine(DiffLineType.ADD, content);
	}

	/**
	 * Creates a remove line.
	 *
	 * @param content the line content
	 * @return a new remove DiffLine
	 */
	@Nonnull
	public static DiffLine remove(@Nonnull String content) {
		return new DiffLine(DiffLineType.REMOVE, content);
	}

	/**
	 * Returns true if the line exists in the original file (context or removed).
	 *
	 * @return true if the line belongs to the match side
	 */
	public boolean isMatchSide() {
		return this.type.isContext() || this.type == DiffLineType.REMOVE;
	}

	/**
	 * Returns true if the line exists in the patched file (context or added).
	 *
	 * @return true if the line belongs to the replace side
	 */
	public boolean isReplaceSide() {
		return this.type.isContext() || this.type == DiffLineType.ADD;
	}
}
