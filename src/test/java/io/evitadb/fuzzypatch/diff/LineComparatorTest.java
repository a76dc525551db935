package io.evitadb.fuzzypatch.diff;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("LineComparator should compare lines with the requested tolerance")
public class LineComparatorTest {

	@Test
	@DisplayName("exact comparator requires identical lines")
	void shouldCompareExactly() {
		assertTrue(LineComparator.EXACT.equal("x = 1", "x = 1"));
		assertFalse(LineComparator.EXACT.equal("x = 1", "x = 1  # one"));
		assertFalse(LineComparator.EXACT.equal("x = 1", "x = 1 "));
	}

	@Test
	@DisplayName("tolerant comparator ignores trailing comments on either side")
	void shouldIgnoreTrailingComment() {
		assertTrue(LineComparator.IGNORE_TRAILING_COMMENT.equal("code_line", "code_line  # comment"));
		assertTrue(LineComparator.IGNORE_TRAILING_COMMENT.equal("code_line  # other", "code_line"));
		assertTrue(LineComparator.IGNORE_TRAILING_COMMENT.equal("x = 1", "x = 1   "));
	}

	@Test
	@DisplayName("tolerant comparator treats floor division as code")
	void shouldNotTrimFloorDivision() {
		assertEquals("half = total // 2", LineComparator.trimComment("half = total // 2"));
		assertFalse(LineComparator.IGNORE_TRAILING_COMMENT.equal("half = total // 2", "half = total // 3"));
		assertFalse(LineComparator.IGNORE_TRAILING_COMMENT.equal("half = total", "half = total // 3"));
	}

	@Test
	@DisplayName("tolerant comparator keeps comment markers inside string literals")
	void shouldKeepMarkersInsideStrings() {
		assertEquals("print('#')", LineComparator.trimComment("print('#')  # prints hash"));
		assertEquals("url = \"http://x\"", LineComparator.trimComment("url = \"http://x\""));
		assertFalse(LineComparator.IGNORE_TRAILING_COMMENT.equal("print('#')", "print('#!')"));
	}

	@Test
	@DisplayName("comment-only lines must match exactly")
	void shouldNotEquateDifferentCommentLines() {
		assertFalse(LineComparator.IGNORE_TRAILING_COMMENT.equal("# first", "# second"));
		assertFalse(LineComparator.IGNORE_TRAILING_COMMENT.equal("#include <a.h>", "#include <b.h>"));
		assertTrue(LineComparator.IGNORE_TRAILING_COMMENT.equal("# same", "# same"));
	}

	@Test
	@DisplayName("maps fuzziness levels to comparators")
	void shouldMapFuzziness() {
		assertEquals(LineComparator.EXACT, LineComparator.forFuzziness(0));
		assertEquals(LineComparator.IGNORE_TRAILING_COMMENT, LineComparator.forFuzziness(1));
		assertEquals(LineComparator.IGNORE_TRAILING_COMMENT, LineComparator.forFuzziness(5));
		assertEquals(1, LineComparator.IGNORE_TRAILING_COMMENT.fuzziness());
	}

	@Test
	@DisplayName("rejects negative fuzziness")
	void shouldRejectNegativeFuzziness() {
		assertThrows(IllegalArgumentException.class, () -> LineComparator.forFuzziness(-1));
	}
}
