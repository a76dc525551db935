package io.evitadb.fuzzypatch.response;

import dev.langchain4j.data.message.AiMessage;
import dev.langchain4j.model.chat.response.ChatResponse;
import io.evitadb.fuzzypatch.diff.DiffClassifier;

import javax.annotation.Nonnull;
import javax.annotation.Nullable;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

/**
 * Turns a generator response into a {@link GeneratedChange}.
 *
 * Fenced blocks are inspected first: a block tagged as a diff, or whose content has hunk headers, is a
 * unified diff. Otherwise the first block in the preferred language is taken as full source. A response
 * without usable blocks is accepted only if its bare text is a unified diff.
 */
public final class ResponseInterpreter {

	private static final Set<String> DIFF_LANGUAGES = Set.of("diff", "patch", "udiff");

	@Nullable
	private final String preferredLanguage;

	/**
	 * Creates an interpreter accepting full source in any language.
	 */
	public ResponseInterpreter() {
		this(null);
	}

	/**
	 * Creates an interpreter.
	 *
	 * @param preferredLanguage language a full-source block must be tagged with, null for any
	 */
	public ResponseInterpreter(@Nullable String preferredLanguage) {
		this.preferredLanguage = preferredLanguage == null || preferredLanguage.isBlank() ?
			null : preferredLanguage.trim().toLowerCase(Locale.ROOT);
	}

	/**
	 * Interprets the text of a chat model response.
	 *
	 * @param response the response
	 * @return the proposed change, empty if the response contains none
	 */
	@Nonnull
	public Optional<GeneratedChange> interpret(@Nonnull ChatResponse response) {
		Objects.requireNonNull(response, "response must not be null");
		final AiMessage message = response.aiMessage();
		if (message == null || message.text() == null) {
			return Optional.empty();
		}
		return interpret(message.text());
	}

	/**
	 * Interprets a raw response text.
	 *
	 * @param text the response, Markdown or a bare diff
	 * @return the proposed change, empty if the response contains none
	 */
	@Nonnull
	public Optional<GeneratedChange> interpret(@Nonnull String text) {
		Objects.requireNonNull(text, "text must not be null");
		final List<CodeBlock> blocks = ResponseBlockExtractor.extract(text);

		for (final CodeBlock block : blocks) {
			final List<String> lines = block.lines();
			if (DIFF_LANGUAGES.contains(block.language()) || DiffClassifier.isUnifiedDiff(lines)) {
				return Optional.of(diff(lines, block.language()));
			}
		}

		for (final CodeBlock block : blocks) {
			if (this.preferredLanguage == null || this.preferredLanguage.equals(block.language())) {
				return Optional.of(
					new GeneratedChange(GeneratedChange.Kind.FULL_SOURCE, block.lines(), block.language(), false)
				);
			}
		}

		final List<String> bare = cleanCodeBlock(text.lines().toList());
		if (DiffClassifier.isUnifiedDiff(bare)) {
			return Optional.of(diff(bare, CodeBlock.PLAINTEXT));
		}
		return Optional.empty();
	}

	/**
	 * Removes an opening fence line and a closing fence line from raw text, together with blank lines
	 * surrounding the content.
	 *
	 * @param lines raw lines
	 * @return the lines between the fences
	 */
	@Nonnull
	public static List<String> cleanCodeBlock(@Nonnull List<String> lines) {
		Objects.requireNonNull(lines, "lines must not be null");
		final List<String> result = new ArrayList<>(lines);
		trimBlank(result);
		if (!result.isEmpty() && result.get(0).strip().startsWith("```")) {
			result.remove(0);
		}
		if (!result.isEmpty() && result.get(result.size() - 1).strip().equals("```")) {
			result.remove(result.size() - 1);
		}
		trimBlank(result);
		return result;
	}

	@Nullable
	public String getPreferredLanguage() {
		return this.preferredLanguage;
	}

	@Nonnull
	private static GeneratedChange diff(@Nonnull List<String> lines, @Nonnull String language) {
		return new GeneratedChange(
			GeneratedChange.Kind.UNIFIED_DIFF, lines, language, DiffClassifier.isUnifiedDiffNoCounts(lines)
		);
	}

	private static void trimBlank(@Nonnull List<String> lines) {
		while (!lines.isEmpty() && lines.get(0).isBlank()) {
			lines.remove(0);
		}
		while (!lines.isEmpty() && lines.get(lines.size() - 1).isBlank()) {
			lines.remove(lines.size() - 1);
		}
	}
}
