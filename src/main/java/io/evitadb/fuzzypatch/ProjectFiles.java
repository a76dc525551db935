package io.evitadb.fuzzypatch;

import javax.annotation.Nonnull;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.InvalidPathException;
import java.nio.file.LinkOption;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.util.Objects;

/**
 * File access confined to a project root. File names come from model output and are untrusted:
 * every name is resolved against the root and rejected if the result lies outside of it, or if any of
 * its existing components is a symbolic link that is dangling or resolves outside of it.
 */
public final class ProjectFiles {

	private ProjectFiles() {
	}

	/**
	 * Resolves a file name from a diff against the project root.
	 *
	 * @param projectRoot the root directory
	 * @param filename    relative file name
	 * @return absolute, normalized path strictly inside the root
	 * @throws UnsafePathException if the name is absolute, malformed, escapes the root or passes a bad symbolic link
	 * @throws IOException         if the real path of the root or of a symbolic link cannot be determined
	 */
	@Nonnull
	public static Path resolve(@Nonnull Path projectRoot, @Nonnull String filename) throws UnsafePathException, IOException {
		Objects.requireNonNull(projectRoot, "projectRoot must not be null");
		Objects.requireNonNull(filename, "filename must not be null");

		final Path root = projectRoot.toAbsolutePath().normalize();
		if (filename.isBlank()) {
			throw new UnsafePathException(filename, root, "empty file name");
		}

		final Path candidate;
		try {
			final Path relative = Path.of(filename);
			if (relative.isAbsolute() || relative.getRoot() != null) {
				throw new UnsafePathException(filename, root, "absolute path");
			}
			candidate = root.resolve(relative).normalize();
		} catch (InvalidPathException e) {
			throw new UnsafePathException(filename, root, "invalid path: " + e.getReason());
		}

		if (!candidate.startsWith(root) || candidate.equals(root)) {
			throw new UnsafePathException(filename, root, "path escapes the project root");
		}

		// symbolic links inside the root may still point elsewhere, or nowhere yet
		final Path realRoot = root.toRealPath();
		Path current = root;
		for (final Path part : root.relativize(candidate)) {
			current = current.resolve(part);
			if (!Files.exists(current, LinkOption.NOFOLLOW_LINKS)) {
				break;
			}
			if (Files.isSymbolicLink(current)) {
				final Path target;
				try {
					target = current.toRealPath();
				} catch (NoSuchFileException e) {
					throw new UnsafePathException(filename, root, "path contains a dangling symbolic link");
				}
				if (!target.startsWith(realRoot)) {
					throw new UnsafePathException(filename, root, "path leaves the project root through a symbolic link");
				}
			}
		}
		return candidate;
	}

	/**
	 * Reads a UTF-8 text file. Files that are not valid UTF-8 are rejected rather than decoded lossily.
	 *
	 * @param file the file
	 * @return its lines and formatting
	 * @throws IOException if the file cannot be read or is not valid UTF-8
	 */
	@Nonnull
	public static FileContent read(@Nonnull Path file) throws IOException {
		Objects.requireNonNull(file, "file must not be null");
		return FileContent.parse(Files.readString(file, StandardCharsets.UTF_8));
	}

	/**
	 * Writes a UTF-8 text file, creating missing parent directories.
	 *
	 * @param file    the target file
	 * @param content what to write
	 * @throws IOException if directories or the file cannot be written
	 */
	public static void write(@Nonnull Path file, @Nonnull FileContent content) throws IOException {
		Objects.requireNonNull(file, "file must not be null");
		Objects.requireNonNull(content, "content must not be null");

		final Path absolute = file.toAbsolutePath().normalize();
		final Path parent = absolute.getParent();
		if (parent != null) {
			Files.createDirectories(parent);
		}

		final byte[] bytes = content.render().getBytes(StandardCharsets.UTF_8);
		Files.write(absolute, bytes);
	}
}
