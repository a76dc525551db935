package io.evitadb.fuzzypatch.response;

import javax.annotation.Nonnull;
import java.util.List;
import java.util.Objects;

/**
 * A fenced code block found in a Markdown response.
 *
 * @param language first word of the info string, `plaintext` if there was none
 * @param content  block content without the fences
 */
public record CodeBlock(
	@Nonnull String language,
	@Nonnull String content
) {

	/**
	 * Language used for blocks without an info string.
	 */
	public static final String PLAINTEXT = "plaintext";

	/**
	 * Creates a new CodeBlock with validation.
	 */
	public CodeBlock {
		Objects.requireNonNull(language, "language must not be null");
		Objects.requireNonNull(content, "content must not be null");
	}

	/**
	 * Returns the content split into lines.
	 *
	 * @return content lines without terminators
	 */
	@Nonnull
	public List<String> lines() {
		return this.content.lines().toList();
	}
}
