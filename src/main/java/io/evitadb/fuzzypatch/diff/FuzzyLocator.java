package io.evitadb.fuzzypatch.diff;

import javax.annotation.Nonnull;
import javax.annotation.Nullable;
import java.util.List;
import java.util.Objects;
import java.util.OptionalInt;

/**
 * Locates hunks inside a line buffer.
 *
 * Line numbers declared by hunk headers are only a hint: earlier hunks shift the code, and models get
 * the numbers wrong even for the first hunk. The search therefore starts at the declared position and
 * moves outward until the match lines are found anywhere in the buffer. Tolerant comparators are only
 * tried after stricter ones failed over the whole buffer, so a loose match never wins over an exact
 * match further away.
 */
public final class FuzzyLocator {

	private FuzzyLocator() {
	}

	/**
	 * Returns true if the hunk's match lines align with the code at the given 0-based index.
	 *
	 * @param hunk       the hunk
	 * @param codeLines  the buffer
	 * @param index      0-based candidate position
	 * @param comparator line comparison strategy
	 * @return true on match
	 */
	public static boolean matchesCode(
		@Nonnull Hunk hunk,
		@Nonnull List<String> codeLines,
		int index,
		@Nonnull LineComparator comparator
	) {
		Objects.requireNonNull(hunk, "hunk must not be null");
		Objects.requireNonNull(codeLines, "codeLines must not be null");
		Objects.requireNonNull(comparator, "comparator must not be null");

		final List<String> match = hunk.match();
		if (index < 0 || index + match.size() > codeLines.size()) {
			return false;
		}
		for (int i = 0; i < match.size(); i++) {
			if (!comparator.equal(match.get(i), codeLines.get(index + i))) {
				return false;
			}
		}
		return true;
	}

	/**
	 * Finds the position of the hunk, escalating from exact comparison up to the given fuzziness.
	 *
	 * @param hunk      the hunk
	 * @param codeLines the buffer
	 * @param fuzziness maximal tolerance level
	 * @return 0-based index, empty if no position matches
	 */
	@Nonnull
	public static OptionalInt matchCode(@Nonnull Hunk hunk, @Nonnull List<String> codeLines, int fuzziness) {
		final LineComparator loosest = LineComparator.forFuzziness(fuzziness);
		for (final LineComparator comparator : LineComparator.values()) {
			final OptionalInt found = locate(hunk, codeLines, comparator);
			if (found.isPresent() || comparator == loosest) {
				return found;
			}
		}
		return OptionalInt.empty();
	}

	/**
	 * Finds the position of the hunk using a single comparator.
	 *
	 * @param hunk       the hunk
	 * @param codeLines  the buffer
	 * @param comparator line comparison strategy
	 * @return 0-based index, empty if no position matches
	 */
	@Nonnull
	public static OptionalInt locate(
		@Nonnull Hunk hunk,
		@Nonnull List<String> codeLines,
		@Nonnull LineComparator comparator
	) {
		Objects.requireNonNull(hunk, "hunk must not be null");
		Objects.requireNonNull(codeLines, "codeLines must not be null");

		if (hunk.empty()) {
			return anchorInsertion(hunk, codeLines);
		}

		final int maxIndex = codeLines.size() - hunk.matchCount();
		if (maxIndex < 0) {
			return OptionalInt.empty();
		}

		final int start = clamp(declaredIndex(hunk), 0, maxIndex);
		final int maxDistance = Math.max(start, maxIndex - start);
		for (int distance = 0; distance <= maxDistance; distance++) {
			final int forward = start + distance;
			if (forward <= maxIndex && matchesCode(hunk, codeLines, forward, comparator)) {
				return OptionalInt.of(forward);
			}
			final int backward = start - distance;
			if (distance > 0 && backward >= 0 && matchesCode(hunk, codeLines, backward, comparator)) {
				return OptionalInt.of(backward);
			}
		}
		return OptionalInt.empty();
	}

	/**
	 * Describes the closest miss of a hunk that could not be located: the position where the longest
	 * prefix of its match lines aligned, and the first pair of lines that differed there.
	 *
	 * @param hunk       the hunk
	 * @param codeLines  the buffer
	 * @param comparator line comparison strategy
	 * @return the closest miss
	 */
	@Nonnull
	public static MatchDiagnosis diagnose(
		@Nonnull Hunk hunk,
		@Nonnull List<String> codeLines,
		@Nonnull LineComparator comparator
	) {
		final List<String> match = hunk.match();
		if (match.isEmpty()) {
			return new MatchDiagnosis(-1, 0, null, null);
		}

		int bestIndex = -1;
		int bestLength = -1;
		for (int index = 0; index < codeLines.size(); index++) {
			int length = 0;
			while (length < match.size() && index + length < codeLines.size() &&
				comparator.equal(match.get(length), codeLines.get(index + length))) {
				length++;
			}
			if (length > bestLength) {
				bestIndex = index;
				bestLength = length;
			}
		}

		if (bestIndex < 0) {
			return new MatchDiagnosis(-1, 0, match.get(0), null);
		}
		final String expected = bestLength < match.size() ? match.get(bestLength) : null;
		final int actualIndex = bestIndex + bestLength;
		final String actual = expected != null && actualIndex < codeLines.size() ? codeLines.get(actualIndex) : null;
		return new MatchDiagnosis(bestIndex, bestLength, expected, actual);
	}

	/**
	 * Hunks without match lines have no content to anchor on; their declared position is all there is.
	 * A header with zero original lines means "insert after line N", otherwise the hunk starts at line N.
	 */
	@Nonnull
	private static OptionalInt anchorInsertion(@Nonnull Hunk hunk, @Nonnull List<String> codeLines) {
		final HunkHeader header = hunk.header();
		if (header.isPlaceholder()) {
			return codeLines.isEmpty() ? OptionalInt.of(0) : OptionalInt.empty();
		}
		final int oldStart = Objects.requireNonNull(header.oldStart());
		final Integer oldCount = header.oldCount();
		final int index = oldCount != null && oldCount == 0 ? oldStart : oldStart - 1;
		return OptionalInt.of(clamp(index, 0, codeLines.size()));
	}

	private static int declaredIndex(@Nonnull Hunk hunk) {
		final Integer startOriginal = hunk.startOriginal();
		return startOriginal == null ? 0 : startOriginal - 1;
	}

	private static int clamp(int value, int min, int max) {
		return Math.max(min, Math.min(max, value));
	}

	/**
	 * Closest miss of a hunk that could not be located.
	 *
	 * @param index        0-based position where the longest prefix matched, -1 if nothing matched
	 * @param matchedLines number of leading match lines that aligned at that position
	 * @param expected     first hunk line that did not align, null if not applicable
	 * @param actual       code line found in its place, null at end of buffer
	 */
	public record MatchDiagnosis(
		int index,
		int matchedLines,
		@Nullable String expected,
		@Nullable String actual
	) {
	}
}
