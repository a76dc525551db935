package io.evitadb.fuzzypatch.response;

import org.commonmark.node.AbstractVisitor;
import org.commonmark.node.FencedCodeBlock;
import org.commonmark.node.Node;
import org.commonmark.parser.Parser;

import javax.annotation.Nonnull;
import javax.annotation.Nullable;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;

/**
 * Collects fenced code blocks from a Markdown response using the CommonMark AST.
 * Both backtick and tilde fences are recognized; indented code blocks are ignored.
 */
public final class ResponseBlockExtractor extends AbstractVisitor {

	private static final Parser PARSER = Parser.builder().build();

	@Nonnull
	private final List<CodeBlock> blocks = new ArrayList<>();

	/**
	 * Extracts all fenced code blocks in document order.
	 *
	 * @param markdown the response text
	 * @return the code blocks
	 */
	@Nonnull
	public static List<CodeBlock> extract(@Nonnull String markdown) {
		Objects.requireNonNull(markdown, "markdown must not be null");
		final Node document = PARSER.parse(markdown);
		final ResponseBlockExtractor extractor = new ResponseBlockExtractor();
		document.accept(extractor);
		return List.copyOf(extractor.blocks);
	}

	/**
	 * Groups code blocks by language, keeping the order in which languages and blocks appear.
	 *
	 * @param markdown the response text
	 * @return block contents keyed by language
	 */
	@Nonnull
	public static Map<String, List<String>> byLanguage(@Nonnull String markdown) {
		final Map<String, List<String>> result = new LinkedHashMap<>();
		for (final CodeBlock block : extract(markdown)) {
			result.computeIfAbsent(block.language(), key -> new ArrayList<>()).add(block.content());
		}
		return result;
	}

	@Override
	public void visit(@Nonnull FencedCodeBlock fencedCodeBlock) {
		final String literal = fencedCodeBlock.getLiteral();
		this.blocks.add(new CodeBlock(language(fencedCodeBlock.getInfo()), literal == null ? "" : literal));
	}

	@Nonnull
	static String language(@Nullable String info) {
		if (info == null || info.isBlank()) {
			return CodeBlock.PLAINTEXT;
		}
		return info.trim().split("\\s+", 2)[0].toLowerCase(Locale.ROOT);
	}
}
