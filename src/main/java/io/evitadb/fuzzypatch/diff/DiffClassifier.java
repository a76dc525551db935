package io.evitadb.fuzzypatch.diff;

import javax.annotation.Nonnull;
import java.util.List;
import java.util.Objects;

/**
 * Decides how text produced by the generator has to be interpreted.
 * Classification never fails: any input yields a boolean answer.
 */
public final class DiffClassifier {

	private DiffClassifier() {
	}

	/**
	 * Returns true if at least one line is a hunk header, with line numbers (`@@ -1,3 +1,4 @@`,
	 * abbreviated forms included) or of the placeholder form (`@@ ... @@`).
	 *
	 * @param lines the text lines
	 * @return true if the text is a unified diff
	 */
	public static boolean isUnifiedDiff(@Nonnull List<String> lines) {
		Objects.requireNonNull(lines, "lines must not be null");
		for (final String line : lines) {
			if (HunkHeader.HUNK_HEADER_PATTERN.matcher(line).find() ||
				HunkHeader.PLACEHOLDER_HEADER_PATTERN.matcher(line).find()) {
				return true;
			}
		}
		return false;
	}

	/**
	 * Text variant of {@link #isUnifiedDiff(List)}.
	 *
	 * @param text the text
	 * @return true if the text is a unified diff
	 */
	public static boolean isUnifiedDiff(@Nonnull String text) {
		Objects.requireNonNull(text, "text must not be null");
		return isUnifiedDiff(text.lines().toList());
	}

	/**
	 * Returns true if at least one line is a placeholder hunk header without line numbers. The declared
	 * offsets of such a diff are meaningless and its hunks can only be located by content.
	 *
	 * @param lines the text lines
	 * @return true if the text contains placeholder hunk headers
	 */
	public static boolean isUnifiedDiffNoCounts(@Nonnull List<String> lines) {
		Objects.requireNonNull(lines, "lines must not be null");
		for (final String line : lines) {
			if (HunkHeader.PLACEHOLDER_HEADER_PATTERN.matcher(line).find()) {
				return true;
			}
		}
		return false;
	}

	/**
	 * Text variant of {@link #isUnifiedDiffNoCounts(List)}.
	 *
	 * @param text the text
	 * @return true if the text contains placeholder hunk headers
	 */
	public static boolean isUnifiedDiffNoCounts(@Nonnull String text) {
		Objects.requireNonNull(text, "text must not be null");
		return isUnifiedDiffNoCounts(text.lines().toList());
	}
}
