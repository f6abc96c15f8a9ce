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
package ru.nts.tools.digest.config;

import ru.nts.tools.digest.core.DigestErrorCode;
import ru.nts.tools.digest.core.DigestException;
import ru.nts.tools.digest.core.treesitter.Language;
import ru.nts.tools.digest.core.treesitter.LanguageDetector;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Итоговая конфигурация запуска.
 * Собирается из значений по умолчанию, JSON-файла конфигурации и опций командной строки
 * (в порядке возрастания приоритета).
 *
 * @param root       корневой каталог дайджеста
 * @param ignore     дополнительные каталоги для исключения
 * @param include    glob-паттерны файлов, выводимых целиком
 * @param tree       печатать ASCII-дерево перед дайджестом
 * @param maxDepth   максимальная глубина обхода (-1 без ограничения)
 * @param format     формат вывода
 * @param threads    размер пула обработки файлов
 * @param extensions дополнительные отображения расширений на языки
 */
public record DigestConfig(Path root,
                           List<Path> ignore,
                           List<String> include,
                           boolean tree,
                           int maxDepth,
                           OutputFormat format,
                           int threads,
                           Map<String, Language> extensions) {

    public DigestConfig {
        ignore = List.copyOf(ignore);
        include = List.copyOf(include);
        extensions = Collections.unmodifiableMap(new LinkedHashMap<>(extensions));
        if (threads < 1) {
            throw new DigestException(DigestErrorCode.PARAM_INVALID, "threads", threads);
        }
    }

    public static Builder builder(Path root) {
        return new Builder(root);
    }

    /**
     * Детектор языков с учетом дополнительных отображений.
     */
    public LanguageDetector languageDetector() {
        return LanguageDetector.withExtensions(extensions);
    }

    public static class Builder {
        private final Path root;
        private final List<Path> ignore = new ArrayList<>();
        private final List<String> include = new ArrayList<>();
        private boolean tree = false;
        private int maxDepth = -1;
        private OutputFormat format = OutputFormat.MARKDOWN;
        private int threads = Runtime.getRuntime().availableProcessors();
        private final Map<String, Language> extensions = new LinkedHashMap<>();

        private Builder(Path root) {
            this.root = root;
        }

        public Path root() {
            return root;
        }

        public Builder ignore(Path dir) {
            ignore.add(dir);
            return this;
        }

        public Builder include(String pattern) {
            include.add(pattern);
            return this;
        }

        public Builder tree(boolean tree) {
            this.tree = tree;
            return this;
        }

        public Builder maxDepth(int maxDepth) {
            this.maxDepth = maxDepth;
            return this;
        }

        public Builder format(OutputFormat format) {
            this.format = format;
            return this;
        }

        public Builder threads(int threads) {
            this.threads = threads;
            return this;
        }

        public Builder extension(String ext, Language language) {
            extensions.put(ext, language);
            return this;
        }

        public DigestConfig build() {
            return new DigestConfig(root, ignore, include, tree, maxDepth, format, threads, extensions);
        }
    }
}
