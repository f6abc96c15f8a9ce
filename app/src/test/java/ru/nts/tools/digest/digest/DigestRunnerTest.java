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
package ru.nts.tools.digest.digest;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import ru.nts.tools.digest.config.DigestConfig;
import ru.nts.tools.digest.core.DigestErrorCode;
import ru.nts.tools.digest.core.treesitter.Language;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class DigestRunnerTest {

    @TempDir
    Path tempDir;

    @BeforeEach
    void setUp() throws IOException {
        write("b/lib.rs", "pub fn lib() -> u8 {\n    1\n}\n");
        write("a/main.go", "package main\n\nfunc main() {}\n");
        write("a/util.go", "package main\n\ntype Opts struct {\n\tDebug bool\n}\n");
        write("README.md", "# Title\n");
        write("tool.py", "def run():\n    pass\n");
        write("vendor/dep.go", "package dep\n\nfunc Dep() {}\n");
    }

    @Test
    void filesComeOutInEnumerationOrder() throws IOException {
        DigestConfig config = DigestConfig.builder(tempDir).threads(4).build();

        DigestResult result = new DigestRunner(config).run();

        List<String> names = result.files().stream().map(f -> Path.of(f.path()).getFileName().toString()).toList();
        assertEquals(List.of("main.go", "util.go", "lib.rs", "dep.go"), names);
        assertNull(result.tree());
        assertTrue(result.errors().isEmpty());
    }

    @Test
    void ignoreIncludeAndExtensions() throws IOException {
        DigestConfig config = DigestConfig.builder(tempDir)
                .ignore(Path.of("vendor"))
                .include("*.md")
                .extension("py", Language.PYTHON)
                .threads(1)
                .build();

        DigestResult result = new DigestRunner(config).run();

        List<String> names = result.files().stream().map(f -> Path.of(f.path()).getFileName().toString()).toList();
        assertEquals(List.of("README.md", "main.go", "util.go", "lib.rs", "tool.py"), names);
        assertTrue(result.files().get(0).verbatim());
        assertEquals(Language.PYTHON, result.files().get(4).language());
    }

    @Test
    void treeIsPrintedWhenRequested() throws IOException {
        DigestConfig config = DigestConfig.builder(tempDir).tree(true).maxDepth(1).build();

        DigestResult result = new DigestRunner(config).run();

        assertEquals("""
                .
                ├── README.md
                ├── a
                ├── b
                ├── tool.py
                └── vendor
                """, result.tree());
        assertTrue(result.files().isEmpty());
    }

    @Test
    void perFileErrorsDoNotStopTheRun() throws IOException {
        Files.write(tempDir.resolve("a/blob.go"), new byte[]{'x', 0, 0});
        DigestConfig config = DigestConfig.builder(tempDir).build();

        DigestResult result = new DigestRunner(config).run();

        assertEquals(1, result.errors().size());
        assertEquals(DigestErrorCode.FILE_IS_BINARY, result.errors().get(0).code());
        assertEquals(4, result.successful().size());
    }

    private void write(String relative, String content) throws IOException {
        Path file = tempDir.resolve(relative);
        Files.createDirectories(file.getParent());
        Files.writeString(file, content);
    }
}
