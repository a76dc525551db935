package io.evitadb.fuzzypatch.model;

import javax.annotation.Nonnull;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Immutable record describing the outcome of applying a multi-file diff to a project.
 * Files are patched independently, so some may succeed while others fail.
 *
 * @param files          per-file results in the order the files first appear in the diff
 * @param unassignedHunks number of hunks skipped because no file marker named their target
 */
public record ProjectPatchResult(
	@Nonnull List<FilePatchResult> files,
	int unassignedHunks
) {

	/**
	 * Creates a new ProjectPatchResult with validation.
	 */
	public ProjectPatchResult {
		Objects.requireNonNull(files, "files must not be null");
		files = List.copyOf(files);
		if (unassignedHunks < 0) {
			throw new IllegalArgumentException("unassignedHunks must be non-negative: " + unassignedHunks);
		}
	}

	/**
	 * Returns true if every file was patched. Unassigned hunks do not count as failures.
	 *
	 * @return true if no file failed
	 */
	public boolean isSuccess() {
		return this.files.stream().allMatch(FilePatchResult::isSuccess);
	}

	public int successCount() {
		return (int) this.files.stream().filter(FilePatchResult::isSuccess).count();
	}

	public int failedCount() {
		return this.files.size() - successCount();
	}

	/**
	 * Returns the failed file results.
	 *
	 * @return failures in diff order
	 */
	@Nonnull
	public List<FilePatchResult> failures() {
		return this.files.stream().filter(result -> !result.isSuccess()).toList();
	}

	/**
	 * Looks up the result for a file name as written in the diff.
	 *
	 * @param filename the file name
	 * @return the result if the diff addressed the file
	 */
	@Nonnull
	public Optional<FilePatchResult> find(@Nonnull String filename) {
		return this.files.stream().filter(result -> result.filename().equals(filename)).findFirst();
	}

	@Override
	public String toString() {
		return String.format(
			"ProjectPatchResult[success=%d, failed=%d, unassigned=%d]",
			successCount(), failedCount(), this.unassignedHunks
		);
	}
}
