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

import ru.nts.tools.digest.core.DigestErrorCode;
import ru.nts.tools.digest.core.DigestException;
import ru.nts.tools.digest.core.DigestLog;
import ru.nts.tools.digest.core.EncodingUtils;
import ru.nts.tools.digest.core.extraction.Fragment;
import ru.nts.tools.digest.core.extraction.SelectorRegistry;
import ru.nts.tools.digest.core.extraction.TraversalEngine;
import ru.nts.tools.digest.core.extraction.selectors.SelectorRegistries;
import ru.nts.tools.digest.core.treesitter.Language;
import ru.nts.tools.digest.core.treesitter.LanguageDetector;
import ru.nts.tools.digest.fs.FileEntry;
import ru.nts.tools.digest.fs.GlobPatternMatcher;

import java.io.IOException;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.function.Function;

/**
 * Обработка одного файла дайджеста.
 *
 * 1. Файл, совпавший с include-паттерном, выводится целиком.
 * 2. Файл с неподключенным расширением молча пропускается.
 * 3. Остальные разбираются и проходят через движок извлечения.
 *
 * Ошибки файла (чтение, бинарный файл, сбой custom-правила) не прерывают обход:
 * они возвращаются в {@link FileDigest#error()}. Исключение - GRAMMAR_INCOMPATIBLE,
 * которое фатально для всего запуска.
 */
public class FileProcessor {

    private final Path displayRoot;
    private final GlobPatternMatcher includes;
    private final LanguageDetector detector;
    private final Function<Language, SelectorRegistry> registries;
    private final TraversalEngine engine = new TraversalEngine();

    public FileProcessor(Path displayRoot, GlobPatternMatcher includes, LanguageDetector detector) {
        this(displayRoot, includes, detector, SelectorRegistries.getInstance()::forLanguage);
    }

    /**
     * @param displayRoot корень в том виде, в каком его указал пользователь (для путей в выводе)
     * @param registries  реестр селекторов для языка
     */
    public FileProcessor(Path displayRoot, GlobPatternMatcher includes, LanguageDetector detector,
                         Function<Language, SelectorRegistry> registries) {
        this.displayRoot = displayRoot;
        this.includes = includes;
        this.detector = detector;
        this.registries = registries;
    }

    /**
     * @return результат или empty, если файл не относится к дайджесту
     * @throws DigestException GRAMMAR_INCOMPATIBLE
     */
    public Optional<FileDigest> process(FileEntry entry) {
        String path = displayPath(entry);
        try {
            if (includes.matches(entry.path())) {
                String content = EncodingUtils.readTextFile(entry.absolutePath()).content();
                return Optional.of(FileDigest.verbatim(path, content));
            }

            Optional<Language> language = detector.detect(entry.path());
            if (language.isEmpty()) {
                return Optional.empty();
            }

            String content = EncodingUtils.readTextFile(entry.absolutePath()).content();
            List<Fragment> fragments = engine.extract(content, language.get(), registries.apply(language.get()));
            DigestLog.debug("Extracted " + fragments.size() + " fragments from " + path);
            return Optional.of(FileDigest.extracted(path, language.get(), fragments));
        } catch (DigestException e) {
            if (e.getCode() == DigestErrorCode.GRAMMAR_INCOMPATIBLE) {
                throw e;
            }
            return Optional.of(FileDigest.failed(path, e));
        } catch (IOException e) {
            return Optional.of(FileDigest.failed(path, DigestException.notReadable(entry.absolutePath(), e)));
        } catch (RuntimeException e) {
            DigestLog.error("Unexpected failure on " + path, e);
            return Optional.of(FileDigest.failed(path, new DigestException(DigestErrorCode.INTERNAL_ERROR,
                    Map.of("path", path, "reason", String.valueOf(e.getMessage())), e)));
        }
    }

    /**
     * Путь для вывода: корень, как его указал пользователь, плюс относительный путь.
     */
    public String displayPath(FileEntry entry) {
        return displayRoot.resolve(entry.path()).toString().replace('\\', '/');
    }
}
