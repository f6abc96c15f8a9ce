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
package ru.nts.tools.digest;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import ru.nts.tools.digest.config.ConfigLoader;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class CodeDigestTest {

    @TempDir
    Path tempDir;

    private final ByteArrayOutputStream out = new ByteArrayOutputStream();
    private final ByteArrayOutputStream err = new ByteArrayOutputStream();

    @BeforeEach
    void setUp() throws IOException {
        Files.writeString(tempDir.resolve("main.go"), "package main\n\nimport \"os\"\n\nfunc main() {\n\tos.Exit(0)\n}\n");
        Files.writeString(tempDir.resolve("notes.md"), "notes\n");
    }

    @Test
    void printsMarkdownDigest() {
        int exitCode = execute(tempDir.toString());

        assertEquals(CodeDigest.EXIT_OK, exitCode);
        String root = tempDir.toString().replace('\\', '/');
        assertEquals("`" + root + "/main.go`\n```go\nimport \"os\"\n\nfunc main() {\n\t// ...\n}\n```\n", stdout());
    }

    @Test
    void treeAndIncludeOptions() {
        int exitCode = execute("-t", "-I", "*.md", tempDir.toString());

        assertEquals(CodeDigest.EXIT_OK, exitCode);
        String output = stdout();
        assertTrue(output.startsWith(".\n├── main.go\n└── notes.md\n\n"));
        assertTrue(output.contains("/notes.md`\n```\nnotes\n```"));
    }

    @Test
    void extensionMappingEnablesPython() throws IOException {
        Files.writeString(tempDir.resolve("app.py"), "import sys\n");

        int exitCode = execute("-e", "py=python", tempDir.toString());

        assertEquals(CodeDigest.EXIT_OK, exitCode);
        assertTrue(stdout().contains("```python\nimport sys\n```"));
    }

    @Test
    void jsonFormat() {
        int exitCode = execute("--format", "json", tempDir.toString());

        assertEquals(CodeDigest.EXIT_OK, exitCode);
        assertTrue(stdout().trim().startsWith("{"));
        assertTrue(stdout().contains("\"language\" : \"go\""));
    }

    @Test
    void configFileInRootIsApplied() throws IOException {
        Files.writeString(tempDir.resolve(ConfigLoader.DEFAULT_CONFIG_FILE), "{ \"tree\": true }");

        execute(tempDir.toString());

        assertTrue(stdout().startsWith(".\n"));
    }

    @Test
    void notADirectoryIsUsageError() {
        int exitCode = execute(tempDir.resolve("main.go").toString());

        assertEquals(CodeDigest.EXIT_USAGE_ERROR, exitCode);
        assertTrue(stderr().contains("Not a directory"));
        assertEquals("", stdout());
    }

    @Test
    void unknownOptionIsUsageError() {
        assertEquals(CodeDigest.EXIT_USAGE_ERROR, execute("--bogus", tempDir.toString()));
    }

    @Test
    void unknownLanguageIsUsageError() {
        int exitCode = execute("-e", "rb=ruby", tempDir.toString());

        assertEquals(CodeDigest.EXIT_USAGE_ERROR, exitCode);
        assertTrue(stderr().contains("LANGUAGE_NOT_SUPPORTED"));
    }

    @Test
    void invalidConfigIsUsageError() throws IOException {
        Path config = tempDir.resolve("bad.json");
        Files.writeString(config, "[1, 2]");

        int exitCode = execute("-c", config.toString(), tempDir.toString());

        assertEquals(CodeDigest.EXIT_USAGE_ERROR, exitCode);
        assertTrue(stderr().contains("CONFIG_INVALID"));
    }

    @Test
    void versionOption() {
        assertEquals(CodeDigest.EXIT_OK, execute("--version"));
        assertTrue(stdout().contains("code-digest"));
    }

    private int execute(String... args) {
        CodeDigest command = new CodeDigest(
                new PrintStream(out, true, StandardCharsets.UTF_8),
                new PrintStream(err, true, StandardCharsets.UTF_8),
                new ConfigLoader(Map.<String, String>of()::get));
        return CodeDigest.commandLine(command).execute(args);
    }

    private String stdout() {
        return out.toString(StandardCharsets.UTF_8);
    }

    private String stderr() {
        return err.toString(StandardCharsets.UTF_8);
    }
}
