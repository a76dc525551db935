package io.evitadb.fuzzypatch.diff;

import javax.annotation.Nonnull;
import java.util.Objects;

/**
 * Thrown when a hunk matches nowhere in the buffer it is applied to. The closest miss found by
 * {@link FuzzyLocator#diagnose} is part of the message, so a retry prompt can quote it.
 */
public final class DiffApplicationException extends Exception {

	private static final int MAX_QUOTED_LENGTH = 80;

	@Nonnull
	private final Hunk failedHunk;
	private final int hunkIndex;
	@Nonnull
	private final FuzzyLocator.MatchDiagnosis diagnosis;

	/**
	 * Creates a new DiffApplicationException.
	 *
	 * @param failedHunk the hunk that could not be located
	 * @param hunkIndex  0-based position of the hunk in the diff
	 * @param diagnosis  closest miss of the hunk in the buffer
	 */
	public DiffApplicationException(
		@Nonnull Hunk failedHunk,
		int hunkIndex,
		@Nonnull FuzzyLocator.MatchDiagnosis diagnosis
	) {
		super(describe(failedHunk, hunkIndex, diagnosis));
		this.failedHunk = failedHunk;
		this.hunkIndex = hunkIndex;
		this.diagnosis = diagnosis;
	}

	@Nonnull
	private static String describe(
		@Nonnull Hunk hunk,
		int hunkIndex,
		@Nonnull FuzzyLocator.MatchDiagnosis diagnosis
	) {
		Objects.requireNonNull(hunk, "failedHunk must not be null");
		Objects.requireNonNull(diagnosis, "diagnosis must not be null");

		final StringBuilder sb = new StringBuilder("Cannot locate hunk ")
			.append(hunkIndex + 1).append(' ').append(hunk.header());
		if (diagnosis.index() < 0) {
			sb.append(": no line of the hunk matched");
		} else {
			sb.append(": best candidate at line ").append(diagnosis.index() + 1)
				.append(" matched ").append(diagnosis.matchedLines())
				.append('/').append(hunk.matchCount()).append(" lines");
		}
		if (diagnosis.expected() != null) {
			sb.append("\nExpected: ").append(quote(diagnosis.expected()));
			sb.append("\nActual:   ").append(diagnosis.actual() == null ? "<EOF>" : quote(diagnosis.actual()));
		}
		return sb.toString();
	}

	@Nonnull
	private static String quote(@Nonnull String line) {
		final String shown = line.length() <= MAX_QUOTED_LENGTH ?
			line : line.substring(0, MAX_QUOTED_LENGTH - 3) + "...";
		return "'" + shown + "'";
	}

	@Nonnull
	public Hunk getFailedHunk() {
		return this.failedHunk;
	}

	/**
	 * Returns the 0-based position of the failed hunk in the diff.
	 *
	 * @return hunk index
	 */
	public int getHunkIndex() {
		return this.hunkIndex;
	}

	@Nonnull
	public FuzzyLocator.MatchDiagnosis getDiagnosis() {
		return this.diagnosis;
	}
}
