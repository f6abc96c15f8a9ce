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

import java.nio.file.Path;

/**
 * Элемент обхода дерева каталогов.
 *
 * @param path         путь относительно корня обхода (для корня пустой путь)
 * @param absolutePath абсолютный нормализованный путь
 * @param kind         файл или директория
 * @param depth        глубина: корень 0, его дети 1 и так далее
 */
public record FileEntry(Path path, Path absolutePath, Kind kind, int depth) {

    public enum Kind {
        FILE,
        DIRECTORY
    }

    public boolean isFile() {
        return kind == Kind.FILE;
    }

    public boolean isDirectory() {
        return kind == Kind.DIRECTORY;
    }

    /**
     * Имя элемента; для корня {@code "."}.
     */
    public String name() {
        Path fileName = path.getFileName();
        return depth == 0 || fileName == null || fileName.toString().isEmpty() ? "." : fileName.toString();
    }

    /**
     * Относительный путь с разделителями '/'.
     */
    public String relativePath() {
        return path.toString().replace('\\', '/');
    }
}
