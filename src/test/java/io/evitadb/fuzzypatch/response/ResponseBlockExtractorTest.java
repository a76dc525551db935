package io.evitadb.fuzzypatch.response;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("ResponseBlockExtractor should collect fenced code blocks")
public class ResponseBlockExtractorTest {

	@Test
	@DisplayName("extracts blocks with their languages in order")
	void shouldExtractBlocks() {
		final String markdown = """
			Some explanation.

			```python
			print('a')
			```

			More text.

			~~~diff
			@@ -1 +1 @@
			-a
			+b
			~~~
			""";

		final List<CodeBlock> blocks = ResponseBlockExtractor.extract(markdown);

		assertEquals(2, blocks.size());
		assertEquals("python", blocks.get(0).language());
		assertEquals("print('a')\n", blocks.get(0).content());
		assertEquals("diff", blocks.get(1).language());
		assertEquals(List.of("@@ -1 +1 @@", "-a", "+b"), blocks.get(1).lines());
	}

	@Test
	@DisplayName("uses plaintext for blocks without language")
	void shouldDefaultToPlaintext() {
		final List<CodeBlock> blocks = ResponseBlockExtractor.extract("```\nx\n```\n");

		assertEquals(1, blocks.size());
		assertEquals(CodeBlock.PLAINTEXT, blocks.get(0).language());
	}

	@Test
	@DisplayName("takes first word of info string as language")
	void shouldNormalizeInfoString() {
		assertEquals("python", ResponseBlockExtractor.language("Python title=\"main.py\""));
		assertEquals(CodeBlock.PLAINTEXT, ResponseBlockExtractor.language(null));
		assertEquals(CodeBlock.PLAINTEXT, ResponseBlockExtractor.language("  "));
	}

	@Test
	@DisplayName("groups blocks by language")
	void shouldGroupByLanguage() {
		final String markdown = "```python\na\n```\n\n```java\nb\n```\n\n```python\nc\n```\n";

		final Map<String, List<String>> grouped = ResponseBlockExtractor.byLanguage(markdown);

		assertEquals(List.of("python", "java"), List.copyOf(grouped.keySet()));
		assertEquals(List.of("a\n", "c\n"), grouped.get("python"));
	}

	@Test
	@DisplayName("returns nothing for text without fences")
	void shouldReturnEmptyWithoutFences() {
		assertTrue(ResponseBlockExtractor.extract("just text").isEmpty());
	}
}
