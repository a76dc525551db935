package io.evitadb.fuzzypatch;

import io.evitadb.fuzzypatch.model.FilePatchResult;
import io.evitadb.fuzzypatch.model.ProjectPatchResult;
import io.evitadb.fuzzypatch.response.GeneratedChange;
import io.evitadb.fuzzypatch.response.ResponseInterpreter;
import org.apache.maven.plugin.AbstractMojo;
import org.apache.maven.plugin.MojoExecutionException;
import org.apache.maven.plugin.logging.Log;
import org.apache.maven.plugins.annotations.LifecyclePhase;
import org.apache.maven.plugins.annotations.Mojo;
import org.apache.maven.plugins.annotations.Parameter;

import javax.annotation.Nonnull;
import javax.annotation.Nullable;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Main Mojo for the fuzzy patch plugin providing actions:
 * - show-config: prints current configuration
 * - check: classifies the input and dry-runs the patch
 * - apply: patches the project, or writes full source to the target file
 */
@Mojo(name = "run", defaultPhase = LifecyclePhase.NONE, threadSafe = true)
public class FuzzyPatchMojo extends AbstractMojo {

	/** Which action to perform: "show-config", "check" or "apply". */
	@Parameter(property = "fuzzypatch.action", defaultValue = "show-config")
	private String action;

	/** Root directory every patched file must be inside of. */
	@Parameter(property = "fuzzypatch.projectRoot", defaultValue = "${project.basedir}")
	private String projectRoot;

	/** File with a raw unified diff or a Markdown response of the generator (no default). */
	@Parameter(property = "fuzzypatch.patchFile")
	private String patchFile;

	/** File, relative to the project root, for hunks without file markers and for full-source responses. */
	@Parameter(property = "fuzzypatch.targetFile")
	private String targetFile;

	/** Language a full-source code block must be tagged with; any language when not set. */
	@Parameter(property = "fuzzypatch.language")
	private String language;

	/** Comparison tolerance: 0 exact, 1 ignoring trailing comments and whitespace. */
	@Parameter(property = "fuzzypatch.fuzziness", defaultValue = "1")
	private int fuzziness = 1;

	@Override
	public void execute() throws MojoExecutionException {
		if (this.action == null || this.action.isBlank()) {
			this.action = "show-config";
		}
		switch (this.action) {
			case "show-config":
				showConfig(getLog());
				break;
			case "check":
				patch(getLog(), true);
				break;
			case "apply":
				patch(getLog(), false);
				break;
			default:
				throw new MojoExecutionException("Unknown action: " + this.action + ". Supported actions: show-config, check, apply");
		}
	}

	private void showConfig(@Nonnull final Log log) {
		log.info("Fuzzy Patch Plugin Configuration:");
		log.info(" - projectRoot: " + orNotSet(this.projectRoot));
		if (isBlank(this.projectRoot)) {
			log.warn("Project root is not set");
		}
		log.info(" - patchFile: " + orNotSet(this.patchFile));
		if (isBlank(this.patchFile)) {
			log.warn("Patch file is not set");
		}
		log.info(" - targetFile: " + orNotSet(this.targetFile));
		log.info(" - language: " + (isBlank(this.language) ? "<any>" : this.language));
		log.info(" - fuzziness: " + this.fuzziness);
		if (this.fuzziness < 0) {
			log.warn("Fuzziness must not be negative");
		}
	}

	private void patch(@Nonnull final Log log, final boolean dryRun) throws MojoExecutionException {
		if (isBlank(this.projectRoot)) {
			throw new MojoExecutionException("Project root not specified");
		}
		if (isBlank(this.patchFile)) {
			throw new MojoExecutionException("Patch file not specified");
		}
		if (this.fuzziness < 0) {
			throw new MojoExecutionException("Fuzziness must not be negative: " + this.fuzziness);
		}

		final Path root = Path.of(this.projectRoot).toAbsolutePath().normalize();
		if (!Files.isDirectory(root)) {
			throw new MojoExecutionException("Invalid project root: " + root);
		}

		final String text;
		try {
			text = Files.readString(Path.of(this.patchFile), StandardCharsets.UTF_8);
		} catch (IOException e) {
			throw new MojoExecutionException("Cannot read patch file " + this.patchFile + ": " + e.getMessage(), e);
		}

		final GeneratedChange change = new ResponseInterpreter(this.language).interpret(text)
			.orElseThrow(() -> new MojoExecutionException("No diff or code block found in " + this.patchFile));
		log.info("[INPUT] " + change.kind() + (change.noCounts() ? " without line numbers" : "") +
			" (" + change.language() + ", " + change.lines().size() + " lines)");

		final ProjectPatcher patcher = new ProjectPatcher(log, dryRun);
		if (change.isDiff()) {
			final ProjectPatchResult result = patcher.apply(
				root, change.lines(), this.fuzziness, isBlank(this.targetFile) ? null : this.targetFile
			);
			log.info("Patch summary: " + result.successCount() + " file(s) patched, " +
				result.failedCount() + " failed, " + result.unassignedHunks() + " hunk(s) unassigned");
			if (!result.isSuccess()) {
				throw new MojoExecutionException(
					"Patch failed for " + result.failedCount() + " file(s): " +
						String.join(", ", result.failures().stream().map(FilePatchResult::filename).toList())
				);
			}
		} else {
			if (isBlank(this.targetFile)) {
				throw new MojoExecutionException("Target file must be specified to write full source");
			}
			final FilePatchResult result = patcher.replaceFile(root, this.targetFile, change.lines());
			if (!result.isSuccess()) {
				throw new MojoExecutionException("Writing " + this.targetFile + " failed: " + result.errorMessage());
			}
		}
	}

	private static boolean isBlank(@Nullable final String value) {
		return value == null || value.isBlank();
	}

	@Nonnull
	private static String orNotSet(@Nullable final String value) {
		return isBlank(value) ? "<not set>" : value;
	}

	// Setters to aid testing without Maven parameter injection
	void setAction(@Nullable final String action) { this.action = action; }
	void setProjectRoot(@Nullable final String projectRoot) { this.projectRoot = projectRoot; }
	void setPatchFile(@Nullable final String patchFile) { this.patchFile = patchFile; }
	void setTargetFile(@Nullable final String targetFile) { this.targetFile = targetFile; }
	void setLanguage(@Nullable final String language) { this.language = language; }
	void setFuzziness(final int fuzziness) { this.fuzziness = fuzziness; }
}
