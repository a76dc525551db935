package io.evitadb.fuzzypatch.response;

import javax.annotation.Nonnull;
import java.util.List;
import java.util.Objects;

/**
 * A change proposed by the generator, ready to be handed to the patcher or written as a whole file.
 *
 * @param kind     how the lines have to be applied
 * @param lines    diff lines or full source lines
 * @param language language of the code block the change came from, `plaintext` for bare text
 * @param noCounts true for diffs with placeholder hunk headers that carry no line numbers
 */
public record GeneratedChange(
	@Nonnull Kind kind,
	@Nonnull List<String> lines,
	@Nonnull String language,
	boolean noCounts
) {

	/**
	 * Creates a new GeneratedChange with validation.
	 */
	public GeneratedChange {
		Objects.requireNonNull(kind, "kind must not be null");
		Objects.requireNonNull(lines, "lines must not be null");
		Objects.requireNonNull(language, "language must not be null");
		lines = List.copyOf(lines);
		if (noCounts && kind != Kind.UNIFIED_DIFF) {
			throw new IllegalArgumentException("noCounts applies to unified diffs only");
		}
	}

	public boolean isDiff() {
		return this.kind == Kind.UNIFIED_DIFF;
	}

	/**
	 * Kind of generated change.
	 */
	public enum Kind {
		/**
		 * Unified diff to be patched into existing files.
		 */
		UNIFIED_DIFF,
		/**
		 * Complete new content of a single file.
		 */
		FULL_SOURCE
	}
}
