package io.evitadb.fuzzypatch.model;

/**
 * Reason a file could not be patched. Every failed file is attributed to exactly one kind.
 */
public enum PatchFailureKind {

	/**
	 * A hunk's match lines were not found anywhere in the file.
	 * Expected and retryable: the model gets asked for a better patch.
	 */
	LOCATION_FAILURE,

	/**
	 * The target path resolves outside of the project root.
	 */
	SECURITY_VIOLATION,

	/**
	 * The file is missing, already exists when it should be created, or cannot be read or written.
	 */
	FILESYSTEM_FAILURE
}
