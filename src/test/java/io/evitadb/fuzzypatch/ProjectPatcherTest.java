package io.evitadb.fuzzypatch;

import io.evitadb.fuzzypatch.model.FilePatchResult;
import io.evitadb.fuzzypatch.model.PatchFailureKind;
import io.evitadb.fuzzypatch.model.ProjectPatchResult;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("ProjectPatcher should patch files of a project independently")
public class ProjectPatcherTest {

	@TempDir
	Path tempDir;

	private Path root;
	private CapturingLog log;
	private ProjectPatcher patcher;

	@BeforeEach
	void setUp() throws Exception {
		this.root = Files.createDirectory(this.tempDir.resolve("project"));
		this.log = new CapturingLog();
		this.patcher = new ProjectPatcher(this.log, false);
	}

	@Test
	@DisplayName("patches existing file")
	void shouldPatchExistingFile() throws Exception {
		Files.writeString(this.root.resolve("main.py"), "line1\nline2\nline3\n");
		final String diff = """
			--- a/main.py
			+++ b/main.py
			@@ -2,1 +2,1 @@
			-line2
			+line2_modified
			""";

		assertTrue(this.patcher.patchProject(this.root, diff.lines().toList(), 0));
		assertEquals("line1\nline2_modified\nline3\n", Files.readString(this.root.resolve("main.py")));
		assertTrue(this.log.toString().contains("[OK] main.py"));
	}

	@Test
	@DisplayName("persists successful file when another file fails")
	void shouldKeepFileOutcomesIndependent() throws Exception {
		Files.writeString(this.root.resolve("good.py"), "a = 1\n");
		Files.writeString(this.root.resolve("bad.py"), "b = 1\n");
		final String diff = """
			--- a/good.py
			+++ b/good.py
			@@ -1 +1 @@
			-a = 1
			+a = 2
			--- a/bad.py
			+++ b/bad.py
			@@ -1 +1 @@
			-does not exist
			+b = 2
			""";

		final ProjectPatchResult result = this.patcher.apply(this.root, diff.lines().toList(), 1, null);

		assertFalse(result.isSuccess());
		assertEquals(1, result.successCount());
		assertEquals(1, result.failedCount());
		assertEquals(PatchFailureKind.LOCATION_FAILURE, result.find("bad.py").orElseThrow().failureKind());
		assertEquals("a = 2\n", Files.readString(this.root.resolve("good.py")));
		assertEquals("b = 1\n", Files.readString(this.root.resolve("bad.py")));
		assertTrue(this.log.toString().contains("[FAIL:LOCATION_FAILURE] bad.py"));
	}

	@Test
	@DisplayName("rejects traversal without affecting other files")
	void shouldRejectTraversal() throws Exception {
		Files.writeString(this.root.resolve("ok.py"), "x\n");
		final String diff = """
			--- /dev/null
			+++ b/../escaped.py
			@@ -0,0 +1 @@
			+evil
			--- a/ok.py
			+++ b/ok.py
			@@ -1 +1 @@
			-x
			+y
			""";

		final ProjectPatchResult result = this.patcher.apply(this.root, diff.lines().toList(), 1, null);

		assertFalse(result.isSuccess());
		assertEquals(PatchFailureKind.SECURITY_VIOLATION, result.find("../escaped.py").orElseThrow().failureKind());
		assertFalse(Files.exists(this.tempDir.resolve("escaped.py")));
		assertEquals("y\n", Files.readString(this.root.resolve("ok.py")));
	}

	@Test
	@DisplayName("rejects absolute target paths")
	void shouldRejectAbsolutePath() {
		final Path outside = this.tempDir.resolve("abs.py");
		final List<String> diff = List.of(
			"--- /dev/null",
			"+++ " + outside.toAbsolutePath(),
			"@@ -0,0 +1 @@",
			"+evil"
		);

		assertFalse(this.patcher.patchProject(this.root, diff, 1));
		assertFalse(Files.exists(outside));
	}

	@Test
	@DisplayName("rejects targets behind a symbolic link leaving the root")
	void shouldRejectSymlinkEscape() throws Exception {
		final Path outside = Files.createDirectory(this.tempDir.resolve("outside"));
		Files.writeString(outside.resolve("secret.py"), "secret\n");
		Files.createSymbolicLink(this.root.resolve("link"), outside);
		final String diff = """
			--- a/link/secret.py
			+++ b/link/secret.py
			@@ -1 +1 @@
			-secret
			+leaked
			""";

		final ProjectPatchResult result = this.patcher.apply(this.root, diff.lines().toList(), 1, null);

		assertEquals(PatchFailureKind.SECURITY_VIOLATION, result.find("link/secret.py").orElseThrow().failureKind());
		assertEquals("secret\n", Files.readString(outside.resolve("secret.py")));
	}

	@Test
	@DisplayName("refuses to create a file through a dangling symbolic link leaving the root")
	void shouldRejectDanglingSymlinkEscape() throws Exception {
		final Path outside = Files.createDirectory(this.tempDir.resolve("outside"));
		Files.createSymbolicLink(this.root.resolve("link.py"), outside.resolve("escaped.py"));
		final String diff = """
			--- /dev/null
			+++ b/link.py
			@@ -0,0 +1 @@
			+pwned
			""";

		final ProjectPatchResult result = this.patcher.apply(this.root, diff.lines().toList(), 1, null);

		assertFalse(result.isSuccess());
		assertEquals(PatchFailureKind.SECURITY_VIOLATION, result.find("link.py").orElseThrow().failureKind());
		assertFalse(Files.exists(outside.resolve("escaped.py")));
	}

	@Test
	@DisplayName("fails without touching a file that is not valid UTF-8")
	void shouldRejectNonUtf8File() throws Exception {
		final byte[] latin1 = "name = 'caf\u00e9'\nx = 1\n".getBytes(StandardCharsets.ISO_8859_1);
		Files.write(this.root.resolve("legacy.py"), latin1);
		final String diff = """
			--- a/legacy.py
			+++ b/legacy.py
			@@ -2 +2 @@
			-x = 1
			+x = 2
			""";

		final ProjectPatchResult result = this.patcher.apply(this.root, diff.lines().toList(), 1, null);

		final FilePatchResult file = result.find("legacy.py").orElseThrow();
		assertEquals(PatchFailureKind.FILESYSTEM_FAILURE, file.failureKind());
		assertTrue(file.errorMessage().contains("MalformedInputException"));
		assertArrayEquals(latin1, Files.readAllBytes(this.root.resolve("legacy.py")));
	}

	@Test
	@DisplayName("creates new file with parent directories")
	void shouldCreateNewFile() throws Exception {
		final String diff = """
			--- /dev/null
			+++ b/pkg/sub/new.py
			@@ -0,0 +1,2 @@
			+def hello():
			+    return 'hi'
			""";

		final ProjectPatchResult result = this.patcher.apply(this.root, diff.lines().toList(), 1, null);

		assertTrue(result.isSuccess());
		assertTrue(result.find("pkg/sub/new.py").orElseThrow().created());
		assertEquals("def hello():\n    return 'hi'\n", Files.readString(this.root.resolve("pkg/sub/new.py")));
		assertTrue(this.log.toString().contains("[NEW] pkg/sub/new.py"));
	}

	@Test
	@DisplayName("creates empty file from markers without hunks")
	void shouldCreateEmptyFile() throws Exception {
		assertTrue(this.patcher.patchProject(this.root, List.of("--- /dev/null", "+++ b/empty.txt"), 1));

		final Path created = this.root.resolve("empty.txt");
		assertTrue(Files.isRegularFile(created));
		assertEquals(0, Files.size(created));
	}

	@Test
	@DisplayName("refuses to create a file that already exists")
	void shouldNotOverwriteOnCreate() throws Exception {
		Files.writeString(this.root.resolve("exists.py"), "keep\n");
		final List<String> diff = List.of("--- /dev/null", "+++ b/exists.py", "@@ -0,0 +1 @@", "+replaced");

		final ProjectPatchResult result = this.patcher.apply(this.root, diff, 1, null);

		assertEquals(PatchFailureKind.FILESYSTEM_FAILURE, result.find("exists.py").orElseThrow().failureKind());
		assertEquals("keep\n", Files.readString(this.root.resolve("exists.py")));
	}

	@Test
	@DisplayName("fails when file to patch does not exist")
	void shouldFailOnMissingFile() {
		final List<String> diff = List.of("--- a/missing.py", "+++ b/missing.py", "@@ -1 +1 @@", "-a", "+b");

		final ProjectPatchResult result = this.patcher.apply(this.root, diff, 1, null);

		final FilePatchResult file = result.find("missing.py").orElseThrow();
		assertEquals(PatchFailureKind.FILESYSTEM_FAILURE, file.failureKind());
		assertFalse(Files.exists(this.root.resolve("missing.py")));
	}

	@Test
	@DisplayName("skips hunks without file name without failing")
	void shouldSkipUnassignedHunks() {
		final ProjectPatchResult result = this.patcher.apply(
			this.root, List.of("@@ -1 +1 @@", "-a", "+b"), 1, null
		);

		assertTrue(result.isSuccess());
		assertEquals(1, result.unassignedHunks());
		assertTrue(result.files().isEmpty());
		assertTrue(this.log.toString().contains("[SKIP] 1 hunk(s)"));
	}

	@Test
	@DisplayName("sends hunks without file name to the default file")
	void shouldUseDefaultFilename() throws Exception {
		Files.writeString(this.root.resolve("main.py"), "a\n");

		final ProjectPatchResult result = this.patcher.apply(
			this.root, List.of("@@ -1 +1 @@", "-a", "+b"), 1, "main.py"
		);

		assertTrue(result.isSuccess());
		assertEquals(0, result.unassignedHunks());
		assertEquals("b\n", Files.readString(this.root.resolve("main.py")));
	}

	@Test
	@DisplayName("dry run checks without writing")
	void shouldNotWriteInDryRun() throws Exception {
		Files.writeString(this.root.resolve("main.py"), "a\n");
		final ProjectPatcher dryRun = new ProjectPatcher(this.log, true);
		final List<String> diff = List.of(
			"--- a/main.py", "+++ b/main.py", "@@ -1 +1 @@", "-a", "+b",
			"--- /dev/null", "+++ b/new.py", "@@ -0,0 +1 @@", "+x"
		);

		assertTrue(dryRun.patchProject(this.root, diff, 1));
		assertEquals("a\n", Files.readString(this.root.resolve("main.py")));
		assertFalse(Files.exists(this.root.resolve("new.py")));
		assertTrue(this.log.toString().contains("[DRY-RUN]"));
	}

	@Test
	@DisplayName("preserves CRLF line endings of patched file")
	void shouldPreserveLineEndings() throws Exception {
		Files.writeString(this.root.resolve("win.txt"), "a\r\nb\r\n");

		assertTrue(this.patcher.patchProject(
			this.root, List.of("--- a/win.txt", "+++ b/win.txt", "@@ -2 +2 @@", "-b", "+c"), 0
		));
		assertEquals("a\r\nc\r\n", Files.readString(this.root.resolve("win.txt")));
	}

	@Test
	@DisplayName("replaces whole file content")
	void shouldReplaceFile() throws Exception {
		final FilePatchResult created = this.patcher.replaceFile(this.root, "gen/out.py", List.of("print(1)"));
		final FilePatchResult replaced = this.patcher.replaceFile(this.root, "gen/out.py", List.of("print(2)"));
		final FilePatchResult rejected = this.patcher.replaceFile(this.root, "../out.py", List.of("x"));

		assertTrue(created.created());
		assertFalse(replaced.created());
		assertEquals("print(2)\n", Files.readString(this.root.resolve("gen/out.py")));
		assertEquals(PatchFailureKind.SECURITY_VIOLATION, rejected.failureKind());
	}

	@Test
	@DisplayName("rejects negative fuzziness")
	void shouldRejectNegativeFuzziness() {
		assertThrows(IllegalArgumentException.class, () -> this.patcher.patchProject(this.root, List.of(), -1));
	}
}
