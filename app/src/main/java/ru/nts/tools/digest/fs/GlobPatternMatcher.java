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

import java.nio.file.FileSystems;
import java.nio.file.Path;
import java.nio.file.PathMatcher;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Проверяет пути по списку glob-паттернов.
 * Паттерн сравнивается и с относительным путем, и с именем файла,
 * поэтому {@code *.md} совпадает с файлами в любом каталоге.
 */
public class GlobPatternMatcher {

    private final List<PathMatcher> matchers;

    public GlobPatternMatcher(List<String> patterns) {
        this.matchers = patterns.stream()
                .map(p -> FileSystems.getDefault().getPathMatcher("glob:" + p))
                .collect(Collectors.toList());
    }

    public static GlobPatternMatcher empty() {
        return new GlobPatternMatcher(List.of());
    }

    public boolean isEmpty() {
        return matchers.isEmpty();
    }

    /**
     * @param relative путь относительно корня обхода
     */
    public boolean matches(Path relative) {
        Path fileName = relative.getFileName();
        for (PathMatcher matcher : matchers) {
            if (matcher.matches(relative) || (fileName != null && matcher.matches(fileName))) {
                return true;
            }
        }
        return false;
    }
}
