/*
 * Copyright 2025 Aristo
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */
package ru.nts.tools.digest.fs;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import ru.nts.tools.digest.core.DigestErrorCode;
import ru.nts.tools.digest.core.DigestException;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class FileEnumeratorTest {

    @TempDir
    Path tempDir;

    @BeforeEach
    void setUp() throws IOException {
        touch("b/two.rs");
        touch("a/one.go");
        touch("a/nested/deep.go");
        touch("main.go");
        touch(".git/HEAD");
    }

    @Test
    void preOrderWithSortedSiblings() throws IOException {
        List<String> paths = relativePaths(new FileEnumerator(tempDir).enumerate());

        assertEquals(List.of("", "a", "a/nested", "a/nested/deep.go", "a/one.go", "b", "b/two.rs", "main.go"), paths);
    }

    @Test
    void depthAndKind() throws IOException {
        List<FileEntry> entries = new FileEnumerator(tempDir).enumerate();

        FileEntry root = entries.get(0);
        assertEquals(0, root.depth());
        assertTrue(root.isDirectory());
        assertEquals(".", root.name());

        FileEntry deep = entries.stream().filter(e -> e.name().equals("deep.go")).findFirst().orElseThrow();
        assertEquals(3, deep.depth());
        assertTrue(deep.isFile());
    }

    @Test
    void rootGitignoreIsHonoured() throws IOException {
        Files.writeString(tempDir.resolve(".gitignore"), "b/\n*.rs\n");

        List<String> paths = relativePaths(new FileEnumerator(tempDir).enumerate());

        assertFalse(paths.contains("b"));
        assertFalse(paths.contains("b/two.rs"));
        assertTrue(paths.contains(".gitignore"));
    }

    @Test
    void nestedGitignoreOverridesParent() throws IOException {
        Files.writeString(tempDir.resolve(".gitignore"), "*.go\n");
        Files.writeString(tempDir.resolve("a/.gitignore"), "!one.go\n");

        List<String> paths = relativePaths(new FileEnumerator(tempDir).enumerate());

        assertTrue(paths.contains("a/one.go"));
        assertFalse(paths.contains("main.go"));
        assertFalse(paths.contains("a/nested/deep.go"));
    }

    @Test
    void ignoreDirsByNameAndPath() throws IOException {
        List<String> byName = relativePaths(new FileEnumerator(tempDir, List.of(Path.of("nested")), -1).enumerate());
        assertFalse(byName.contains("a/nested"));
        assertTrue(byName.contains("a/one.go"));

        List<String> byPath = relativePaths(new FileEnumerator(tempDir, List.of(tempDir.resolve("b")), -1).enumerate());
        assertFalse(byPath.contains("b"));
        assertTrue(byPath.contains("a"));
    }

    @Test
    void maxDepthLimitsWalk() throws IOException {
        List<String> paths = relativePaths(new FileEnumerator(tempDir, List.of(), 1).enumerate());

        assertEquals(List.of("", "a", "b", "main.go"), paths);
    }

    @Test
    void missingRootFails() {
        FileEnumerator enumerator = new FileEnumerator(tempDir.resolve("missing"));

        DigestException e = assertThrows(DigestException.class, enumerator::enumerate);
        assertEquals(DigestErrorCode.DIRECTORY_NOT_FOUND, e.getCode());
    }

    private void touch(String relative) throws IOException {
        Path file = tempDir.resolve(relative);
        Files.createDirectories(file.getParent());
        Files.writeString(file, "");
    }

    private static List<String> relativePaths(List<FileEntry> entries) {
        return entries.stream().map(FileEntry::relativePath).toList();
    }
}
