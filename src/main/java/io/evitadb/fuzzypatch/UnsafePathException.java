package io.evitadb.fuzzypatch;

import javax.annotation.Nonnull;
import java.nio.file.Path;
import java.util.Objects;

/**
 * Exception thrown when a file name taken from a diff would resolve outside of the project root.
 */
public final class UnsafePathException extends Exception {

	@Nonnull
	private final String filename;
	@Nonnull
	private final Path projectRoot;

	/**
	 * Creates a new UnsafePathException.
	 *
	 * @param filename    the offending file name as written in the diff
	 * @param projectRoot the root the file had to stay in
	 * @param reason      why the path was rejected
	 */
	public UnsafePathException(@Nonnull String filename, @Nonnull Path projectRoot, @Nonnull String reason) {
		super("Refusing path '" + filename + "': " + reason + " (project root " + projectRoot + ")");
		this.filename = Objects.requireNonNull(filename, "filename must not be null");
		this.projectRoot = Objects.requireNonNull(projectRoot, "projectRoot must not be null");
	}

	@Nonnull
	public String getFilename() {
		return this.filename;
	}

	@Nonnull
	public Path getProjectRoot() {
		return this.projectRoot;
	}
}
