package io.evitadb.fuzzypatch.diff;

import javax.annotation.Nonnull;
import javax.annotation.Nullable;
import java.util.Objects;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Line-range information of a hunk header.
 *
 * The header format is: @@ -oldStart,oldCount +newStart,newCount @@
 *
 * Counts are optional in the header and default to 1 if omitted. Headers that carry no numbers at all
 * (`@@ ... @@`) produce a placeholder header whose fields are all null; such hunks can only be located
 * by their content.
 *
 * @param oldStart starting line number in the original file (1-based), null for placeholder headers
 * @param oldCount number of lines from the original file, null for placeholder headers
 * @param newStart starting line number in the new file (1-based), null for placeholder headers
 * @param newCount number of lines in the new file, null for placeholder headers
 */
public record HunkHeader(
	@Nullable Integer oldStart,
	@Nullable Integer oldCount,
	@Nullable Integer newStart,
	@Nullable Integer newCount
) {

	/**
	 * Pattern for parsing hunk headers with line numbers.
	 * Count is optional and defaults to 1 if omitted.
	 */
	static final Pattern HUNK_HEADER_PATTERN = Pattern.compile(
		"^@@\\s*-(\\d+)(?:,(\\d*))?\\s+\\+(\\d+)(?:,(\\d*))?\\s*@@"
	);

	/**
	 * Pattern for hunk headers the model emitted without computing line numbers.
	 */
	static final Pattern PLACEHOLDER_HEADER_PATTERN = Pattern.compile(
		"^@@\\s*(?:\\.\\.\\.|…)\\s*@@"
	);

	static final String HEADER_PREFIX = "@@";

	private static final HunkHeader PLACEHOLDER = new HunkHeader(null, null, null, null);

	/**
	 * Creates a new HunkHeader with validation.
	 */
	public HunkHeader {
		requireNonNegative(oldStart, "oldStart");
		requireNonNegative(oldCount, "oldCount");
		requireNonNegative(newStart, "newStart");
		requireNonNegative(newCount, "newCount");
	}

	/**
	 * Returns the header used when no line numbers are known.
	 *
	 * @return placeholder header
	 */
	@Nonnull
	public static HunkHeader placeholder() {
		return PLACEHOLDER;
	}

	/**
	 * Parses a header line. Any line starting with `@@` is accepted: lines that do not carry parsable
	 * line numbers yield the placeholder header.
	 *
	 * @param line the raw header line
	 * @return the parsed header
	 */
	@Nonnull
	public static HunkHeader parse(@Nonnull String line) {
		Objects.requireNonNull(line, "line must not be null");
		final Matcher matcher = HUNK_HEADER_PATTERN.matcher(line);
		if (!matcher.find()) {
			return PLACEHOLDER;
		}
		try {
			return new HunkHeader(
				Integer.parseInt(matcher.group(1)),
				parseCount(matcher.group(2)),
				Integer.parseInt(matcher.group(3)),
				parseCount(matcher.group(4))
			);
		} catch (NumberFormatException e) {
			// numbers beyond int range are as meaningless as missing ones
			return PLACEHOLDER;
		}
	}

	/**
	 * Returns true if the line opens a hunk.
	 *
	 * @param line the raw line
	 * @return true if the line starts with `@@`
	 */
	public static boolean isHeaderLine(@Nonnull String line) {
		return line.startsWith(HEADER_PREFIX);
	}

	/**
	 * Returns true if this header carries no line numbers.
	 *
	 * @return true for placeholder headers
	 */
	public boolean isPlaceholder() {
		return this.oldStart == null;
	}

	private static int parseCount(@Nullable String group) {
		return group == null || group.isEmpty() ? 1 : Integer.parseInt(group);
	}

	private static void requireNonNegative(@Nullable Integer value, @Nonnull String name) {
		if (value != null && value < 0) {
			throw new IllegalArgumentException(name + " must be non-negative: " + value);
		}
	}

	@Override
	public String toString() {
		if (isPlaceholder()) {
			return "@@ ... @@";
		}
		return "@@ -" + this.oldStart + "," + this.oldCount + " +" + this.newStart + "," + this.newCount + " @@";
	}
}
