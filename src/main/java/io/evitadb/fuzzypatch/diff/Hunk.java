package io.evitadb.fuzzypatch.diff;

import javax.annotation.Nonnull;
import javax.annotation.Nullable;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.OptionalInt;

/**
 * One parsed unified diff edit operation: where it is expected in the original file, which lines it
 * expects to find there and which lines should be there afterwards.
 *
 * The match side contains the context and removed lines in original order, the replace side contains
 * the context and added lines. Both are stored without their marker characters. Surrounding context is
 * capped at {@link #MAX_LEADING_CONTEXT} / {@link #MAX_TRAILING_CONTEXT} lines on each side of the edit.
 *
 * @param header   line-range information from the `@@` header
 * @param match    lines expected in the original file
 * @param replace  lines that replace the matched lines
 * @param filename relative path of the target file, null if no file marker preceded the hunk
 * @param newFile  true when the file markers denote creation of a new file
 */
public record Hunk(
	@Nonnull HunkHeader header,
	@Nonnull List<String> match,
	@Nonnull List<String> replace,
	@Nullable String filename,
	boolean newFile
) {

	public static final int MAX_LEADING_CONTEXT = 3;
	public static final int MAX_TRAILING_CONTEXT = 3;

	/**
	 * Creates a new Hunk with validation.
	 */
	public Hunk {
		Objects.requireNonNull(header, "header must not be null");
		Objects.requireNonNull(match, "match must not be null");
		Objects.requireNonNull(replace, "replace must not be null");
		match = List.copyOf(match);
		replace = List.copyOf(replace);
	}

	/**
	 * Builds a hunk from its raw header line and the raw body lines that follow it.
	 *
	 * @param headerLine the `@@` line
	 * @param bodyLines  raw body lines up to (not including) the next boundary
	 * @param filename   target file or null
	 * @param newFile    whether the target file is being created
	 * @return the parsed hunk
	 */
	@Nonnull
	public static Hunk parse(
		@Nonnull String headerLine,
		@Nonnull List<String> bodyLines,
		@Nullable String filename,
		boolean newFile
	) {
		Objects.requireNonNull(headerLine, "headerLine must not be null");
		Objects.requireNonNull(bodyLines, "bodyLines must not be null");

		// empty lines at the end of a body separate hunks, a lone space is still empty context
		int end = bodyLines.size();
		while (end > 0 && bodyLines.get(end - 1).isEmpty()) {
			end--;
		}

		final List<DiffLine> lines = new ArrayList<>(end);
		for (final String rawLine : bodyLines.subList(0, end)) {
			final DiffLine line = DiffLine.parse(rawLine);
			if (line != null) {
				lines.add(line);
			}
		}
		return of(HunkHeader.parse(headerLine), lines, filename, newFile);
	}

	/**
	 * Builds a hunk from already classified diff lines, trimming excess context.
	 *
	 * @param header   parsed header
	 * @param lines    body lines in diff order
	 * @param filename target file or null
	 * @param newFile  whether the target file is being created
	 * @return the hunk
	 */
	@Nonnull
	public static Hunk of(
		@Nonnull HunkHeader header,
		@Nonnull List<DiffLine> lines,
		@Nullable String filename,
		boolean newFile
	) {
		final List<String> match = new ArrayList<>(lines.size());
		final List<String> replace = new ArrayList<>(lines.size());
		for (final DiffLine line : lines) {
			if (line.isMatchSide()) {
				match.add(line.content());
			}
			if (line.isReplaceSide()) {
				replace.add(line.content());
			}
		}

		// pairs of identical -/+ lines count as context as well
		final int leading = countLeadingContext(match, replace);
		if (leading > MAX_LEADING_CONTEXT) {
			final int trim = leading - MAX_LEADING_CONTEXT;
			match.subList(0, trim).clear();
			replace.subList(0, trim).clear();
		}

		if (!match.isEmpty() && !replace.isEmpty()) {
			final int trailing = countTrailingContext(match, replace);
			if (trailing > MAX_TRAILING_CONTEXT) {
				final int trim = trailing - MAX_TRAILING_CONTEXT;
				match.subList(match.size() - trim, match.size()).clear();
				replace.subList(replace.size() - trim, replace.size()).clear();
			}
		}

		return new Hunk(header, match, replace, filename, newFile);
	}

	/**
	 * Returns the hunk that creates an empty file at the given path.
	 *
	 * @param filename the file to create
	 * @return hunk with no lines and zero counts
	 */
	@Nonnull
	public static Hunk emptyNewFile(@Nonnull String filename) {
		Objects.requireNonNull(filename, "filename must not be null");
		return new Hunk(new HunkHeader(0, 0, 0, 0), List.of(), List.of(), filename, true);
	}

	/**
	 * Returns the 1-based start line in the original file declared by the header.
	 *
	 * @return start line or null for placeholder headers
	 */
	@Nullable
	public Integer startOriginal() {
		return this.header.oldStart();
	}

	/**
	 * Returns the 1-based start line in the new file declared by the header.
	 *
	 * @return start line or null for placeholder headers
	 */
	@Nullable
	public Integer startNew() {
		return this.header.newStart();
	}

	public int matchCount() {
		return this.match.size();
	}

	public int replaceCount() {
		return this.replace.size();
	}

	/**
	 * Returns true if the hunk expects no lines in the original file, so it has no content anchor.
	 *
	 * @return true when the match side is empty
	 */
	public boolean empty() {
		return this.match.isEmpty();
	}

	/**
	 * Returns true if applying the hunk cannot change anything.
	 *
	 * @return true when both sides are empty
	 */
	public boolean isNoOp() {
		return this.match.isEmpty() && this.replace.isEmpty();
	}

	/**
	 * Returns true if the match lines align with the code starting at the given 0-based index.
	 *
	 * @param codeLines the buffer to test against
	 * @param index     0-based candidate position
	 * @param fuzziness comparison tolerance, see {@link LineComparator#forFuzziness(int)}
	 * @return true on match
	 */
	public boolean matchesCode(@Nonnull List<String> codeLines, int index, int fuzziness) {
		return FuzzyLocator.matchesCode(this, codeLines, index, LineComparator.forFuzziness(fuzziness));
	}

	/**
	 * Finds where this hunk applies in the given buffer.
	 *
	 * @param codeLines the buffer to search
	 * @param fuzziness maximal comparison tolerance
	 * @return 0-based index of the match, empty if the hunk matches nowhere
	 */
	@Nonnull
	public OptionalInt matchCode(@Nonnull List<String> codeLines, int fuzziness) {
		return FuzzyLocator.matchCode(this, codeLines, fuzziness);
	}

	private static int countLeadingContext(@Nonnull List<String> match, @Nonnull List<String> replace) {
		final int limit = Math.min(match.size(), replace.size());
		int count = 0;
		while (count < limit && match.get(count).equals(replace.get(count))) {
			count++;
		}
		return count;
	}

	private static int countTrailingContext(@Nonnull List<String> match, @Nonnull List<String> replace) {
		final int limit = Math.min(match.size(), replace.size());
		int count = 0;
		while (count < limit &&
			match.get(match.size() - 1 - count).equals(replace.get(replace.size() - 1 - count))) {
			count++;
		}
		return count;
	}

	@Override
	public String toString() {
		return "Hunk[" + this.header +
			", file=" + (this.filename == null ? "<none>" : this.filename) +
			(this.newFile ? " (new)" : "") +
			", match=" + this.match.size() +
			", replace=" + this.replace.size() + "]";
	}
}
