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

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import ru.nts.tools.digest.core.DigestErrorCode;
import ru.nts.tools.digest.core.DigestException;
import ru.nts.tools.digest.core.extraction.SelectorRegistry;
import ru.nts.tools.digest.core.extraction.selectors.SelectorRegistries;
import ru.nts.tools.digest.core.treesitter.Language;
import ru.nts.tools.digest.core.treesitter.LanguageDetector;
import ru.nts.tools.digest.core.treesitter.SourceText;
import ru.nts.tools.digest.fs.FileEntry;
import ru.nts.tools.digest.fs.GlobPatternMatcher;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

class FileProcessorTest {

    @TempDir
    Path tempDir;

    @Test
    void extractsSupportedFile() throws IOException {
        FileEntry entry = write("cmd/main.go", "package main\n\nfunc main() {\n\tprintln()\n}\n");
        FileProcessor processor = new FileProcessor(Path.of("project"), GlobPatternMatcher.empty(), LanguageDetector.defaults());

        FileDigest digest = processor.process(entry).orElseThrow();

        assertEquals("project/cmd/main.go", digest.path());
        assertEquals(Language.GO, digest.language());
        assertFalse(digest.verbatim());
        assertEquals(1, digest.fragments().size());
        assertEquals("func main() {\n\t// ...\n}", digest.fragments().get(0).content());
    }

    @Test
    void unsupportedExtensionIsSkippedSilently() throws IOException {
        FileEntry entry = write("script.py", "print('hi')\n");
        FileProcessor processor = new FileProcessor(tempDir, GlobPatternMatcher.empty(), LanguageDetector.defaults());

        assertEquals(Optional.empty(), processor.process(entry));
    }

    @Test
    void includedFileIsVerbatimEvenIfSupported() throws IOException {
        FileEntry entry = write("gen.go", "package gen\n\nfunc X() { return }\n");
        FileProcessor processor = new FileProcessor(tempDir, new GlobPatternMatcher(List.of("gen.go")), LanguageDetector.defaults());

        FileDigest digest = processor.process(entry).orElseThrow();

        assertTrue(digest.verbatim());
        assertNull(digest.language());
        assertEquals("package gen\n\nfunc X() { return }\n", digest.content());
    }

    @Test
    void customRuleFailureAbortsOnlyThatFile() throws IOException {
        FileEntry failing = write("a.go", "package a\n\ntype T struct{}\n");
        FileEntry passing = write("b.go", "package b\n\nimport \"fmt\"\n");

        SelectorRegistry strict = SelectorRegistries.getInstance().forLanguage(Language.GO).toBuilder()
                .custom("type_declaration", (node, source, context) -> {
                    throw DigestException.customActionFailed(node.getType(), SourceText.lineOf(node), "unexpected shape");
                })
                .build();
        FileProcessor processor = new FileProcessor(tempDir, GlobPatternMatcher.empty(), LanguageDetector.defaults(),
                language -> strict);

        FileDigest failed = processor.process(failing).orElseThrow();
        FileDigest ok = processor.process(passing).orElseThrow();

        assertTrue(failed.isFailed());
        assertEquals(DigestErrorCode.CUSTOM_ACTION_FAILED, failed.error().code());
        assertTrue(failed.error().message().contains("line=3"));
        assertFalse(ok.isFailed());
        assertEquals("import \"fmt\"", ok.fragments().get(0).content());
    }

    @Test
    void binaryFileIsReportedNotThrown() throws IOException {
        Path file = tempDir.resolve("blob.rs");
        Files.write(file, new byte[]{'f', 'n', 0, 0});
        FileEntry entry = new FileEntry(Path.of("blob.rs"), file, FileEntry.Kind.FILE, 1);
        FileProcessor processor = new FileProcessor(tempDir, GlobPatternMatcher.empty(), LanguageDetector.defaults());

        FileDigest digest = processor.process(entry).orElseThrow();

        assertEquals(DigestErrorCode.FILE_IS_BINARY, digest.error().code());
    }

    @Test
    void grammarFailureIsFatal() throws IOException {
        FileEntry entry = write("x.go", "package x\n");
        FileProcessor processor = new FileProcessor(tempDir, GlobPatternMatcher.empty(), LanguageDetector.defaults(),
                language -> {
                    throw DigestException.grammarIncompatible(language.id(), null);
                });

        DigestException e = assertThrows(DigestException.class, () -> processor.process(entry));
        assertEquals(DigestErrorCode.GRAMMAR_INCOMPATIBLE, e.getCode());
    }

    private FileEntry write(String relative, String content) throws IOException {
        Path file = tempDir.resolve(relative);
        Files.createDirectories(file.getParent());
        Files.writeString(file, content);
        Path rel = Path.of(relative);
        return new FileEntry(rel, file, FileEntry.Kind.FILE, rel.getNameCount());
    }
}
