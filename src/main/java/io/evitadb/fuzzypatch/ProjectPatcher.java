package io.evitadb.fuzzypatch;

import io.evitadb.fuzzypatch.diff.DiffApplicationException;
import io.evitadb.fuzzypatch.diff.Hunk;
import io.evitadb.fuzzypatch.diff.HunkExtractor;
import io.evitadb.fuzzypatch.diff.LineComparator;
import io.evitadb.fuzzypatch.diff.SingleFilePatcher;
import io.evitadb.fuzzypatch.model.FilePatchResult;
import io.evitadb.fuzzypatch.model.PatchFailureKind;
import io.evitadb.fuzzypatch.model.ProjectPatchResult;
import org.apache.maven.plugin.logging.Log;
import org.apache.maven.plugin.logging.SystemStreamLog;

import javax.annotation.Nonnull;
import javax.annotation.Nullable;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Applies a multi-file diff to a project directory.
 *
 * Hunks are grouped by target file and every file is handled on its own: a file is written only if all
 * of its hunks applied, and a failing file does not prevent other files of the same diff from being
 * written. No file outside the project root is ever read or written.
 */
public final class ProjectPatcher {

	@Nonnull
	private final HunkExtractor extractor;
	@Nonnull
	private final SingleFilePatcher filePatcher;
	@Nonnull
	private final Log log;
	private final boolean dryRun;

	/**
	 * Creates a patcher that writes files and logs to the standard streams.
	 */
	public ProjectPatcher() {
		this(new SystemStreamLog(), false);
	}

	/**
	 * Creates a patcher.
	 *
	 * @param log    where to report per-file outcomes
	 * @param dryRun when true, everything is checked but nothing is written
	 */
	public ProjectPatcher(@Nonnull Log log, boolean dryRun) {
		this.log = Objects.requireNonNull(log, "log must not be null");
		this.extractor = new HunkExtractor();
		this.filePatcher = new SingleFilePatcher(log);
		this.dryRun = dryRun;
	}

	/**
	 * Applies the diff to the project.
	 *
	 * @param projectRoot root directory all target files must be inside of
	 * @param patchLines  raw diff lines
	 * @param fuzziness   maximal comparison tolerance
	 * @return true if every addressed file was patched
	 */
	public boolean patchProject(@Nonnull Path projectRoot, @Nonnull List<String> patchLines, int fuzziness) {
		return apply(projectRoot, patchLines, fuzziness, null).isSuccess();
	}

	/**
	 * Applies the diff to the project and reports the outcome of every file.
	 *
	 * @param projectRoot     root directory all target files must be inside of
	 * @param patchLines      raw diff lines
	 * @param fuzziness       maximal comparison tolerance
	 * @param defaultFilename file receiving hunks that no file marker addressed, null to skip them
	 * @return per-file results
	 * @throws IllegalArgumentException if fuzziness is negative
	 */
	@Nonnull
	public ProjectPatchResult apply(
		@Nonnull Path projectRoot,
		@Nonnull List<String> patchLines,
		int fuzziness,
		@Nullable String defaultFilename
	) {
		Objects.requireNonNull(patchLines, "patchLines must not be null");
		return applyHunks(projectRoot, this.extractor.extract(patchLines), fuzziness, defaultFilename);
	}

	/**
	 * Applies already extracted hunks to the project.
	 *
	 * @param projectRoot     root directory all target files must be inside of
	 * @param hunks           hunks in diff order
	 * @param fuzziness       maximal comparison tolerance
	 * @param defaultFilename file receiving hunks without a file name, null to skip them
	 * @return per-file results
	 */
	@Nonnull
	public ProjectPatchResult applyHunks(
		@Nonnull Path projectRoot,
		@Nonnull List<Hunk> hunks,
		int fuzziness,
		@Nullable String defaultFilename
	) {
		Objects.requireNonNull(projectRoot, "projectRoot must not be null");
		Objects.requireNonNull(hunks, "hunks must not be null");
		LineComparator.forFuzziness(fuzziness);

		final Map<String, List<Hunk>> byFile = new LinkedHashMap<>();
		int unassigned = 0;
		for (final Hunk hunk : hunks) {
			final String filename = hunk.filename() != null ? hunk.filename() : defaultFilename;
			if (filename == null) {
				unassigned++;
				continue;
			}
			byFile.computeIfAbsent(filename, key -> new ArrayList<>()).add(hunk);
		}
		if (unassigned > 0) {
			this.log.warn("[SKIP] " + unassigned + " hunk(s) without a target file name");
		}

		final List<FilePatchResult> results = new ArrayList<>(byFile.size());
		for (final Map.Entry<String, List<Hunk>> entry : byFile.entrySet()) {
			final FilePatchResult result = patchFile(projectRoot, entry.getKey(), entry.getValue(), fuzziness);
			report(result);
			results.add(result);
		}
		return new ProjectPatchResult(results, unassigned);
	}

	/**
	 * Replaces a file of the project with full new content, creating it if needed.
	 *
	 * @param projectRoot root directory the file must be inside of
	 * @param filename    file name relative to the root
	 * @param lines       the new content
	 * @return the outcome
	 */
	@Nonnull
	public FilePatchResult replaceFile(@Nonnull Path projectRoot, @Nonnull String filename, @Nonnull List<String> lines) {
		Objects.requireNonNull(projectRoot, "projectRoot must not be null");
		Objects.requireNonNull(filename, "filename must not be null");
		Objects.requireNonNull(lines, "lines must not be null");

		final FilePatchResult result;
		try {
			final Path target = ProjectFiles.resolve(projectRoot, filename);
			final boolean exists = Files.exists(target);
			final FileContent content = exists ?
				ProjectFiles.read(target).withLines(lines) :
				FileContent.newFile(lines);
			if (!this.dryRun) {
				ProjectFiles.write(target, content);
			}
			result = FilePatchResult.success(filename, 0, !exists);
		} catch (UnsafePathException e) {
			return reported(FilePatchResult.failure(filename, 0, PatchFailureKind.SECURITY_VIOLATION, e.getMessage()));
		} catch (IOException e) {
			return reported(FilePatchResult.failure(filename, 0, PatchFailureKind.FILESYSTEM_FAILURE, describe(e)));
		}
		return reported(result);
	}

	@Nonnull
	private FilePatchResult patchFile(
		@Nonnull Path projectRoot,
		@Nonnull String filename,
		@Nonnull List<Hunk> hunks,
		int fuzziness
	) {
		final int hunkCount = hunks.size();

		final Path target;
		try {
			target = ProjectFiles.resolve(projectRoot, filename);
		} catch (UnsafePathException e) {
			return FilePatchResult.failure(filename, hunkCount, PatchFailureKind.SECURITY_VIOLATION, e.getMessage());
		} catch (IOException e) {
			return FilePatchResult.failure(filename, hunkCount, PatchFailureKind.FILESYSTEM_FAILURE, describe(e));
		}

		final boolean create = hunks.stream().allMatch(Hunk::newFile);
		final FileContent original;
		if (create) {
			if (Files.exists(target)) {
				return FilePatchResult.failure(
					filename, hunkCount, PatchFailureKind.FILESYSTEM_FAILURE,
					"File to be created already exists: " + target
				);
			}
			original = FileContent.newFile(List.of());
		} else {
			if (!Files.isRegularFile(target)) {
				return FilePatchResult.failure(
					filename, hunkCount, PatchFailureKind.FILESYSTEM_FAILURE,
					"File does not exist: " + target
				);
			}
			try {
				original = ProjectFiles.read(target);
			} catch (IOException e) {
				return FilePatchResult.failure(filename, hunkCount, PatchFailureKind.FILESYSTEM_FAILURE, describe(e));
			}
		}

		final List<String> patched;
		try {
			patched = this.filePatcher.apply(original.lines(), hunks, fuzziness);
		} catch (DiffApplicationException e) {
			return FilePatchResult.failure(filename, hunkCount, PatchFailureKind.LOCATION_FAILURE, e.getMessage());
		}

		if (!this.dryRun) {
			try {
				ProjectFiles.write(target, original.withLines(patched));
			} catch (IOException e) {
				return FilePatchResult.failure(filename, hunkCount, PatchFailureKind.FILESYSTEM_FAILURE, describe(e));
			}
		}
		return FilePatchResult.success(filename, hunkCount, create);
	}

	@Nonnull
	private FilePatchResult reported(@Nonnull FilePatchResult result) {
		report(result);
		return result;
	}

	private void report(@Nonnull FilePatchResult result) {
		final String prefix = this.dryRun ? "[DRY-RUN]" : "";
		if (result.isSuccess()) {
			this.log.info(prefix + (result.created() ? "[NEW] " : "[OK] ") + result.filename() +
				" (" + result.hunkCount() + " hunk(s))");
		} else {
			this.log.error(prefix + "[FAIL:" + result.failureKind() + "] " + result.filename() + ": " + result.errorMessage());
		}
	}

	@Nonnull
	private static String describe(@Nonnull IOException e) {
		return e.getClass().getSimpleName() + ": " + e.getMessage();
	}
}
