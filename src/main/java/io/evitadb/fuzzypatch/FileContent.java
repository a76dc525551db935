package io.evitadb.fuzzypatch;

import javax.annotation.Nonnull;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Lines of a text file together with the formatting needed to write them back unchanged:
 * the line separator in use and whether the last line was terminated.
 *
 * @param lines           the lines without terminators
 * @param lineSeparator   `\n`, `\r\n` or `\r`
 * @param endsWithNewline whether the last line is terminated
 */
public record FileContent(
	@Nonnull List<String> lines,
	@Nonnull String lineSeparator,
	boolean endsWithNewline
) {

	private static final String LF = "\n";
	private static final String CRLF = "\r\n";
	private static final String CR = "\r";

	/**
	 * Creates a new FileContent with validation.
	 */
	public FileContent {
		Objects.requireNonNull(lines, "lines must not be null");
		Objects.requireNonNull(lineSeparator, "lineSeparator must not be null");
		lines = List.copyOf(lines);
	}

	/**
	 * Content of a file that is being created: `\n` separated, last line terminated.
	 *
	 * @param lines the lines
	 * @return new file content
	 */
	@Nonnull
	public static FileContent newFile(@Nonnull List<String> lines) {
		return new FileContent(lines, LF, true);
	}

	/**
	 * Splits text into lines, handling `\n`, `\r\n` and lone `\r` terminators. The separator used most
	 * often becomes the separator of the content, `\n` winning ties. A file mixing separators is
	 * therefore written back with a single one.
	 *
	 * @param content the text
	 * @return parsed content
	 */
	@Nonnull
	public static FileContent parse(@Nonnull String content) {
		Objects.requireNonNull(content, "content must not be null");
		if (content.isEmpty()) {
			return newFile(List.of());
		}

		final List<String> result = new ArrayList<>();
		int start = 0;
		int i = 0;
		int lf = 0;
		int crlf = 0;
		int cr = 0;

		while (i < content.length()) {
			final char c = content.charAt(i);
			if (c == '\n') {
				result.add(content.substring(start, i));
				start = i + 1;
				lf++;
			} else if (c == '\r') {
				result.add(content.substring(start, i));
				if (i + 1 < content.length() && content.charAt(i + 1) == '\n') {
					i++;
					crlf++;
				} else {
					cr++;
				}
				start = i + 1;
			}
			i++;
		}

		// Add remaining content (last line without newline)
		if (start < content.length()) {
			result.add(content.substring(start));
		}

		final String separator;
		if (crlf > lf && crlf >= cr) {
			separator = CRLF;
		} else if (cr > lf && cr > crlf) {
			separator = CR;
		} else {
			separator = LF;
		}
		final char last = content.charAt(content.length() - 1);
		return new FileContent(result, separator, last == '\n' || last == '\r');
	}

	/**
	 * Returns a copy with other lines and the same formatting.
	 *
	 * @param newLines the lines
	 * @return updated content
	 */
	@Nonnull
	public FileContent withLines(@Nonnull List<String> newLines) {
		return new FileContent(newLines, this.lineSeparator, this.endsWithNewline);
	}

	/**
	 * Joins the lines back into text.
	 *
	 * @return the text, empty for no lines
	 */
	@Nonnull
	public String render() {
		if (this.lines.isEmpty()) {
			return "";
		}
		final String joined = String.join(this.lineSeparator, this.lines);
		return this.endsWithNewline ? joined + this.lineSeparator : joined;
	}
}
