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

import ru.nts.tools.digest.config.DigestConfig;
import ru.nts.tools.digest.core.DigestErrorCode;
import ru.nts.tools.digest.core.DigestException;
import ru.nts.tools.digest.core.DigestLog;
import ru.nts.tools.digest.core.treesitter.Language;
import ru.nts.tools.digest.core.treesitter.LanguageDetector;
import ru.nts.tools.digest.core.treesitter.TreeSitterManager;
import ru.nts.tools.digest.fs.FileEntry;
import ru.nts.tools.digest.fs.FileEnumerator;
import ru.nts.tools.digest.fs.FileTreePrinter;
import ru.nts.tools.digest.fs.GlobPatternMatcher;

import java.io.IOException;
import java.util.ArrayList;
import java.util.EnumSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;

/**
 * Выполняет дайджест каталога по конфигурации.
 *
 * Грамматики всех подключенных языков проверяются до начала обхода, поэтому
 * несовместимая грамматика прерывает запуск до вывода первого файла.
 * Файлы обрабатываются пулом из {@code threads} потоков, результаты собираются в порядке обхода.
 */
public class DigestRunner {

    private final DigestConfig config;
    private final FileProcessor processor;

    public DigestRunner(DigestConfig config) {
        this(config, new FileProcessor(config.root(), new GlobPatternMatcher(config.include()), config.languageDetector()));
    }

    public DigestRunner(DigestConfig config, FileProcessor processor) {
        this.config = config;
        this.processor = processor;
    }

    /**
     * @throws DigestException GRAMMAR_INCOMPATIBLE (фатально) или DIRECTORY_NOT_FOUND
     */
    public DigestResult run() throws IOException {
        verifyGrammars(config.languageDetector());

        FileEnumerator enumerator = new FileEnumerator(config.root(), config.ignore(), config.maxDepth());
        List<FileEntry> entries = enumerator.enumerate();
        DigestLog.debug("Enumerated " + entries.size() + " entries under " + enumerator.getRoot());

        String tree = config.tree() ? new FileTreePrinter().print(entries) : null;

        List<FileEntry> files = entries.stream().filter(FileEntry::isFile).toList();
        List<FileDigest> digests = processAll(files);
        for (FileDigest digest : digests) {
            if (digest.isFailed()) {
                DigestLog.warn("Error processing file " + digest.path() + ": " + digest.error().message());
            }
        }
        return new DigestResult(config.root().toString().replace('\\', '/'), tree, digests);
    }

    private void verifyGrammars(LanguageDetector detector) {
        Set<Language> languages = EnumSet.noneOf(Language.class);
        languages.addAll(detector.getExtensionMap().values());
        for (Language language : languages) {
            TreeSitterManager.getInstance().verify(language);
        }
    }

    private List<FileDigest> processAll(List<FileEntry> files) {
        ExecutorService executor = Executors.newFixedThreadPool(config.threads());
        try {
            List<Future<Optional<FileDigest>>> futures = files.stream()
                    .map(file -> executor.submit(() -> processor.process(file)))
                    .toList();

            List<FileDigest> results = new ArrayList<>();
            for (Future<Optional<FileDigest>> future : futures) {
                future(future).ifPresent(results::add);
            }
            return results;
        } finally {
            executor.shutdownNow();
        }
    }

    private Optional<FileDigest> future(Future<Optional<FileDigest>> future) {
        try {
            return future.get();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new DigestException(DigestErrorCode.INTERNAL_ERROR, Map.of("reason", "interrupted"), e);
        } catch (ExecutionException e) {
            if (e.getCause() instanceof DigestException de) {
                throw de;
            }
            throw new DigestException(DigestErrorCode.INTERNAL_ERROR,
                    Map.of("reason", String.valueOf(e.getCause())), e.getCause());
        }
    }
}
