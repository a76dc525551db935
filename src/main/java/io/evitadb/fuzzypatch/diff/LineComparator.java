package io.evitadb.fuzzypatch.diff;

import javax.annotation.Nonnull;

/**
 * Strategies for deciding whether a line expected by a hunk equals a line found in the code.
 * Strategies are ordered from the strictest to the most tolerant; the ordinal is the fuzziness level.
 */
public enum LineComparator {

	/**
	 * Lines must be equal character by character.
	 */
	EXACT {
		@Override
		public boolean equal(@Nonnull String expected, @Nonnull String actual) {
			return expected.equals(actual);
		}
	},

	/**
	 * Trailing whitespace and a trailing `#` comment outside of string literals are ignored on both
	 * sides. Models often reproduce a code line without its inline comment or invent one. `//` is not a
	 * comment marker here: in Python it is floor division, and `a // 2` must never equal `a // 3`.
	 * Lines that consist of nothing but a comment still have to be equal exactly.
	 */
	IGNORE_TRAILING_COMMENT {
		@Override
		public boolean equal(@Nonnull String expected, @Nonnull String actual) {
			if (expected.equals(actual)) {
				return true;
			}
			final String trimmedExpected = trimComment(expected);
			return !trimmedExpected.isBlank() && trimmedExpected.equals(trimComment(actual));
		}
	};

	/**
	 * Compares an expected line with an actual line.
	 *
	 * @param expected line from the hunk
	 * @param actual   line from the code
	 * @return true if the lines are considered equal
	 */
	public abstract boolean equal(@Nonnull String expected, @Nonnull String actual);

	/**
	 * Returns the fuzziness level of this comparator.
	 *
	 * @return 0 for exact, higher for more tolerant strategies
	 */
	public int fuzziness() {
		return ordinal();
	}

	/**
	 * Returns the comparator for the given fuzziness level. Levels above the most tolerant strategy
	 * map to the most tolerant strategy.
	 *
	 * @param fuzziness tolerance level, 0 for exact matching
	 * @return the comparator
	 * @throws IllegalArgumentException if fuzziness is negative
	 */
	@Nonnull
	public static LineComparator forFuzziness(int fuzziness) {
		if (fuzziness < 0) {
			throw new IllegalArgumentException("fuzziness must be non-negative: " + fuzziness);
		}
		final LineComparator[] values = values();
		return values[Math.min(fuzziness, values.length - 1)];
	}

	/**
	 * Strips trailing whitespace and a trailing line comment. Comment markers inside single or double
	 * quoted strings are not comments: `print('#')` is kept as is.
	 *
	 * @param line the line to trim
	 * @return the line without its trailing comment
	 */
	@Nonnull
	static String trimComment(@Nonnull String line) {
		char quote = 0;
		for (int i = 0; i < line.length(); i++) {
			final char c = line.charAt(i);
			if (quote != 0) {
				if (c == '\\') {
					i++;
				} else if (c == quote) {
					quote = 0;
				}
			} else if (c == '"' || c == '\'') {
				quote = c;
			} else if (c == '#') {
				return line.substring(0, i).stripTrailing();
			}
		}
		return line.stripTrailing();
	}
}
