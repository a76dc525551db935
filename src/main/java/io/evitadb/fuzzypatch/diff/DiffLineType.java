package io.evitadb.fuzzypatch.diff;

/**
 * Enumeration of unified diff body line types.
 * Each line in a diff hunk is normally prefixed with a character indicating its type,
 * but LLM-produced diffs frequently omit the prefix of context lines.
 */
public enum DiffLineType {

	/**
	 * Context line - unchanged line shown for context.
	 * Prefixed with a space character in unified diff format.
	 */
	CONTEXT,

	/**
	 * Context line whose leading space marker is missing. The whole raw line is the content.
	 */
	UNMARKED_CONTEXT,

	/**
	 * Added line - new line that should be inserted.
	 * Prefixed with '+' character in unified diff format.
	 */
	ADD,

	/**
	 * Removed line - existing line that should be deleted.
	 * Prefixed with '-' character in unified diff format.
	 */
	REMOVE;

	/**
	 * Returns true for both marked and unmarked context lines.
	 *
	 * @return true if the line belongs to both sides of the hunk
	 */
	public boolean isContext() {
		return this == CONTEXT || this == UNMARKED_CONTEXT;
	}
}
