package io.evitadb.fuzzypatch.diff;

import javax.annotation.Nonnull;
import javax.annotation.Nullable;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Splits raw diff text into hunks.
 *
 * Input usually comes from a language model: file markers may be missing or repeated, line counts
 * wrong, and the diff wrapped in Markdown fences. Extraction is a small state machine:
 *
 * | state            | `--- path`        | `+++ path`           | `@@`              | break      | other          |
 * |------------------|-------------------|----------------------|-------------------|------------|----------------|
 * | SEEKING          | → IN_FILE_HEADER  | set file → SEEKING   | open → IN_HUNK    | SEEKING    | ignored        |
 * | IN_FILE_HEADER   | → IN_FILE_HEADER  | set file → SEEKING   | old file, IN_HUNK | SEEKING    | old file, SEEKING |
 * | IN_HUNK          | close → IN_FILE_HEADER | close, set file | close, open       | close → SEEKING | body line |
 *
 * A "break" is a `diff --git` line or a Markdown code fence. Bare `---`/`+++` lines without a path only
 * close the open hunk. Hunk bodies are never validated against the header line counts, which models
 * routinely get wrong.
 */
public final class HunkExtractor {

	private static final String OLD_FILE_PREFIX = "---";
	private static final String NEW_FILE_PREFIX = "+++";
	private static final String GIT_DIFF_PREFIX = "diff --git ";
	private static final String NULL_DEVICE = "/dev/null";

	/**
	 * Extracts all hunks in the order they appear.
	 *
	 * @param lines raw diff lines
	 * @return hunks; hunks not preceded by any file marker have a null filename
	 */
	@Nonnull
	public List<Hunk> extract(@Nonnull List<String> lines) {
		Objects.requireNonNull(lines, "lines must not be null");
		final Scan scan = new Scan();
		for (final String line : lines) {
			scan.accept(line);
		}
		scan.finish();
		return scan.hunks;
	}

	/**
	 * Text variant of {@link #extract(List)}.
	 *
	 * @param diffText raw diff text
	 * @return hunks in diff order
	 */
	@Nonnull
	public List<Hunk> extract(@Nonnull String diffText) {
		Objects.requireNonNull(diffText, "diffText must not be null");
		return extract(diffText.lines().toList());
	}

	/**
	 * Classifies a raw line for the state machine.
	 *
	 * @param line raw line
	 * @return its kind
	 */
	@Nonnull
	static LineKind classify(@Nonnull String line) {
		if (isMarker(line, OLD_FILE_PREFIX)) {
			return LineKind.OLD_FILE_MARKER;
		}
		if (isMarker(line, NEW_FILE_PREFIX)) {
			return LineKind.NEW_FILE_MARKER;
		}
		if (HunkHeader.isHeaderLine(line)) {
			return LineKind.HUNK_HEADER;
		}
		if (line.startsWith(GIT_DIFF_PREFIX) || line.startsWith("```") || line.startsWith("~~~")) {
			return LineKind.BREAK;
		}
		return LineKind.BODY;
	}

	/**
	 * Extracts the path from a `---`/`+++` marker line. Drops the conventional `a/`/`b/` prefixes,
	 * tab-separated timestamps and surrounding quotes.
	 *
	 * @param markerLine the marker line
	 * @return the path, empty if the marker carries none
	 */
	@Nonnull
	static String markerPath(@Nonnull String markerLine) {
		String path = markerLine.substring(3);
		final int tab = path.indexOf('\t');
		if (tab >= 0) {
			path = path.substring(0, tab);
		}
		path = path.strip();
		if (path.length() >= 2 && path.startsWith("\"") && path.endsWith("\"")) {
			path = path.substring(1, path.length() - 1);
		}
		if (path.startsWith("a/") || path.startsWith("b/")) {
			path = path.substring(2);
		}
		return path;
	}

	static boolean isNullDevice(@Nullable String path) {
		return NULL_DEVICE.equals(path);
	}

	private static boolean isMarker(@Nonnull String line, @Nonnull String prefix) {
		if (!line.startsWith(prefix)) {
			return false;
		}
		return line.length() == prefix.length() || Character.isWhitespace(line.charAt(prefix.length()));
	}

	/**
	 * Kinds of lines the extractor distinguishes.
	 */
	enum LineKind {
		OLD_FILE_MARKER,
		NEW_FILE_MARKER,
		HUNK_HEADER,
		BREAK,
		BODY
	}

	/**
	 * States of the extractor.
	 */
	enum State {
		/** Outside of any hunk, waiting for markers or a header. */
		SEEKING,
		/** A `--- path` marker was read, its `+++` counterpart may follow. */
		IN_FILE_HEADER,
		/** Collecting the body of an open hunk. */
		IN_HUNK
	}

	/**
	 * Mutable scan state for one extraction.
	 */
	private static final class Scan {
		private final List<Hunk> hunks = new ArrayList<>();
		private State state = State.SEEKING;
		@Nullable private String filename;
		private boolean newFile;
		@Nullable private String pendingOldPath;
		private int hunksForFile;
		@Nullable private String openHeader;
		private final List<String> body = new ArrayList<>();

		void accept(@Nonnull String line) {
			switch (classify(line)) {
				case OLD_FILE_MARKER -> onOldFileMarker(markerPath(line));
				case NEW_FILE_MARKER -> onNewFileMarker(markerPath(line));
				case HUNK_HEADER -> onHunkHeader(line);
				case BREAK -> {
					closeHunk();
					resolvePendingOldPath();
					this.state = State.SEEKING;
				}
				case BODY -> {
					if (this.state == State.IN_HUNK) {
						this.body.add(line);
					} else if (this.state == State.IN_FILE_HEADER) {
						resolvePendingOldPath();
						this.state = State.SEEKING;
					}
				}
			}
		}

		void finish() {
			closeHunk();
			resolvePendingOldPath();
			finishFile();
		}

		private void onOldFileMarker(@Nonnull String path) {
			closeHunk();
			if (path.isEmpty()) {
				resolvePendingOldPath();
				this.state = State.SEEKING;
				return;
			}
			resolvePendingOldPath();
			finishFile();
			this.pendingOldPath = path;
			this.state = State.IN_FILE_HEADER;
		}

		private void onNewFileMarker(@Nonnull String path) {
			closeHunk();
			if (path.isEmpty()) {
				resolvePendingOldPath();
				this.state = State.SEEKING;
				return;
			}
			final String oldPath = this.pendingOldPath;
			if (this.state != State.IN_FILE_HEADER) {
				finishFile();
			}
			this.pendingOldPath = null;
			this.newFile = isNullDevice(oldPath);
			if (isNullDevice(path)) {
				// deletion diff: the hunks still address the old file
				this.filename = oldPath == null || isNullDevice(oldPath) ? this.filename : oldPath;
			} else {
				this.filename = path;
			}
			this.hunksForFile = 0;
			this.state = State.SEEKING;
		}

		private void onHunkHeader(@Nonnull String line) {
			closeHunk();
			resolvePendingOldPath();
			this.openHeader = line;
			this.state = State.IN_HUNK;
		}

		/**
		 * A `--- path` marker that was not followed by `+++` names the file on its own.
		 */
		private void resolvePendingOldPath() {
			if (this.state != State.IN_FILE_HEADER || this.pendingOldPath == null) {
				return;
			}
			final String oldPath = this.pendingOldPath;
			this.pendingOldPath = null;
			this.newFile = isNullDevice(oldPath);
			this.filename = this.newFile ? null : oldPath;
			this.hunksForFile = 0;
		}

		private void closeHunk() {
			if (this.openHeader == null) {
				return;
			}
			this.hunks.add(Hunk.parse(this.openHeader, List.copyOf(this.body), this.filename, this.newFile));
			this.hunksForFile++;
			this.openHeader = null;
			this.body.clear();
		}

		/**
		 * A new-file marker pair that produced no hunk at all creates an empty file.
		 */
		private void finishFile() {
			if (this.newFile && this.filename != null && this.hunksForFile == 0) {
				this.hunks.add(Hunk.emptyNewFile(this.filename));
				this.hunksForFile++;
			}
		}
	}
}
