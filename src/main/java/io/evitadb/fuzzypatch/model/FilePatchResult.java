package io.evitadb.fuzzypatch.model;

import javax.annotation.Nonnull;
import javax.annotation.Nullable;
import java.util.Objects;

/**
 * Outcome of patching one file of a project.
 *
 * @param filename     the file name as written in the diff
 * @param hunkCount    number of hunks addressed to the file
 * @param created      true if the file did not exist and was (or, in dry-run, would be) created
 * @param failureKind  reason of the failure, null on success
 * @param errorMessage human-readable failure description, null on success
 */
public record FilePatchResult(
	@Nonnull String filename,
	int hunkCount,
	boolean created,
	@Nullable PatchFailureKind failureKind,
	@Nullable String errorMessage
) {

	/**
	 * Creates a new FilePatchResult with validation.
	 */
	public FilePatchResult {
		Objects.requireNonNull(filename, "filename must not be null");
		if ((failureKind == null) != (errorMessage == null)) {
			throw new IllegalArgumentException("failureKind and errorMessage must be both set or both null");
		}
	}

	/**
	 * Creates a successful result.
	 *
	 * @param filename  the file name
	 * @param hunkCount number of applied hunks
	 * @param created   whether the file was created
	 * @return success result
	 */
	@Nonnull
	public static FilePatchResult success(@Nonnull String filename, int hunkCount, boolean created) {
		return new FilePatchResult(filename, hunkCount, created, null, null);
	}

	/**
	 * Creates a failed result.
	 *
	 * @param filename     the file name
	 * @param hunkCount    number of hunks addressed to the file
	 * @param failureKind  reason of the failure
	 * @param errorMessage description of the failure
	 * @return failure result
	 */
	@Nonnull
	public static FilePatchResult failure(
		@Nonnull String filename,
		int hunkCount,
		@Nonnull PatchFailureKind failureKind,
		@Nonnull String errorMessage
	) {
		Objects.requireNonNull(failureKind, "failureKind must not be null");
		Objects.requireNonNull(errorMessage, "errorMessage must not be null");
		return new FilePatchResult(filename, hunkCount, false, failureKind, errorMessage);
	}

	public boolean isSuccess() {
		return this.failureKind == null;
	}
}
