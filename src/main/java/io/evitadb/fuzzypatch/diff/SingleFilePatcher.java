package io.evitadb.fuzzypatch.diff;

import org.apache.maven.plugin.logging.Log;
import org.apache.maven.plugin.logging.SystemStreamLog;

import javax.annotation.Nonnull;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.OptionalInt;

/**
 * Applies hunks to a single in-memory file.
 *
 * Hunks are applied strictly in diff order, each one located by content in the buffer as modified by
 * the hunks before it. Application is transactional: all hunks are applied to a working copy and the
 * caller's buffer is only touched once every hunk succeeded.
 */
public final class SingleFilePatcher {

	@Nonnull
	private final HunkExtractor extractor;
	@Nonnull
	private final Log log;

	/**
	 * Creates a patcher logging to the standard streams.
	 */
	public SingleFilePatcher() {
		this(new SystemStreamLog());
	}

	/**
	 * Creates a patcher.
	 *
	 * @param log where to report hunk placement and failures
	 */
	public SingleFilePatcher(@Nonnull Log log) {
		this.extractor = new HunkExtractor();
		this.log = Objects.requireNonNull(log, "log must not be null");
	}

	/**
	 * Applies a diff to the given buffer in place. File markers in the diff are ignored: every hunk is
	 * applied to this buffer.
	 *
	 * @param codeLines  the buffer, modified only if every hunk applies
	 * @param patchLines raw diff lines
	 * @param fuzziness  maximal comparison tolerance
	 * @return true if all hunks were applied, false if any hunk could not be located
	 * @throws IllegalArgumentException if fuzziness is negative
	 */
	public boolean patchCode(@Nonnull List<String> codeLines, @Nonnull List<String> patchLines, int fuzziness) {
		Objects.requireNonNull(codeLines, "codeLines must not be null");
		Objects.requireNonNull(patchLines, "patchLines must not be null");
		LineComparator.forFuzziness(fuzziness);

		final List<Hunk> hunks = this.extractor.extract(patchLines);
		try {
			final List<String> patched = apply(codeLines, hunks, fuzziness);
			codeLines.clear();
			codeLines.addAll(patched);
			return true;
		} catch (DiffApplicationException e) {
			this.log.warn("[FAIL] " + e.getMessage());
			return false;
		}
	}

	/**
	 * Applies the hunks to a copy of the given lines.
	 *
	 * @param codeLines the original lines, never modified
	 * @param hunks     hunks in application order
	 * @param fuzziness maximal comparison tolerance
	 * @return the patched lines
	 * @throws DiffApplicationException if a hunk cannot be located
	 */
	@Nonnull
	public List<String> apply(
		@Nonnull List<String> codeLines,
		@Nonnull List<Hunk> hunks,
		int fuzziness
	) throws DiffApplicationException {
		Objects.requireNonNull(codeLines, "codeLines must not be null");
		Objects.requireNonNull(hunks, "hunks must not be null");

		final List<String> working = new ArrayList<>(codeLines);
		for (int i = 0; i < hunks.size(); i++) {
			final Hunk hunk = hunks.get(i);
			if (hunk.isNoOp()) {
				this.log.debug("[SKIP] Empty hunk " + (i + 1));
				continue;
			}

			final OptionalInt index = hunk.matchCode(working, fuzziness);
			if (index.isEmpty()) {
				throw new DiffApplicationException(
					hunk, i, FuzzyLocator.diagnose(hunk, working, LineComparator.forFuzziness(fuzziness))
				);
			}

			final int start = index.getAsInt();
			this.log.debug("[OK] Applying hunk " + (i + 1) + " " + hunk.header() + " at line " + (start + 1));
			final List<String> target = working.subList(start, start + hunk.matchCount());
			target.clear();
			target.addAll(hunk.replace());
		}
		return working;
	}
}
