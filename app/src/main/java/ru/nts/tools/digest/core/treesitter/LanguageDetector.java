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
package ru.nts.tools.digest.core.treesitter;

import java.nio.file.Path;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;

/**
 * Определяет язык по расширению файла.
 * По умолчанию подключены ровно два расширения: go и rs.
 * Дополнительные отображения (например py=python) задаются через конфигурацию.
 * Файлы с неизвестным расширением молча пропускаются.
 */
public final class LanguageDetector {

    /**
     * Отображение расширений файлов на языки по умолчанию.
     */
    public static final Map<String, Language> DEFAULT_EXTENSIONS = Map.of(
            "go", Language.GO,
            "rs", Language.RUST
    );

    private final Map<String, Language> extensionMap;

    private LanguageDetector(Map<String, Language> extensionMap) {
        this.extensionMap = Collections.unmodifiableMap(new LinkedHashMap<>(extensionMap));
    }

    /**
     * Детектор только с отображениями по умолчанию.
     */
    public static LanguageDetector defaults() {
        return new LanguageDetector(DEFAULT_EXTENSIONS);
    }

    /**
     * Детектор с отображениями по умолчанию, дополненными (или переопределенными) указанными.
     *
     * @param extra расширение (без точки) -> язык
     */
    public static LanguageDetector withExtensions(Map<String, Language> extra) {
        Map<String, Language> merged = new LinkedHashMap<>(DEFAULT_EXTENSIONS);
        extra.forEach((ext, lang) -> merged.put(normalizeExtension(ext), lang));
        return new LanguageDetector(merged);
    }

    /**
     * Определяет язык по пути к файлу.
     *
     * @param path путь к файлу
     * @return язык или empty если расширение не подключено
     */
    public Optional<Language> detect(Path path) {
        return extensionOf(path).map(extensionMap::get);
    }

    /**
     * Возвращает подключенные отображения расширений.
     */
    public Map<String, Language> getExtensionMap() {
        return extensionMap;
    }

    /**
     * Извлекает расширение файла в нижнем регистре.
     *
     * @return расширение без точки или empty если его нет
     */
    public static Optional<String> extensionOf(Path path) {
        if (path == null || path.getFileName() == null) {
            return Optional.empty();
        }

        String fileName = path.getFileName().toString();
        int dotIndex = fileName.lastIndexOf('.');

        if (dotIndex < 0 || dotIndex == fileName.length() - 1) {
            return Optional.empty();
        }

        return Optional.of(fileName.substring(dotIndex + 1).toLowerCase(Locale.ROOT));
    }

    private static String normalizeExtension(String ext) {
        String e = ext.trim().toLowerCase(Locale.ROOT);
        return e.startsWith(".") ? e.substring(1) : e;
    }
}
