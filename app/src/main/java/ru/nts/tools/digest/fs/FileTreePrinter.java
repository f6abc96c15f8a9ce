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

import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Печатает ASCII-дерево по уже упорядоченному списку элементов обхода.
 * Обход файловой системы здесь не выполняется: глубина и порядок берутся из {@link FileEntry}.
 *
 * <pre>
 * .
 * ├── a
 * │   ├── one.go
 * │   └── two.go
 * └── b
 *     └── three.rs
 * </pre>
 */
public class FileTreePrinter {

    private static final String ROOT = ".";
    private static final String PIPE = "│   ";
    private static final String BLANK = "    ";
    private static final String TEE = "├── ";
    private static final String ELBOW = "└── ";

    public String print(List<FileEntry> entries) {
        StringBuilder sb = new StringBuilder();
        // Для каждого уровня: является ли текущий предок последним среди соседей
        Map<Integer, Boolean> lastNodes = new HashMap<>();

        for (int i = 0; i < entries.size(); i++) {
            FileEntry entry = entries.get(i);
            int level = entry.depth();
            if (level == 0) {
                sb.append(ROOT).append("\n");
                continue;
            }

            boolean isLast = isLastSibling(entries, i);
            lastNodes.put(level, isLast);

            for (int l = 1; l < level; l++) {
                sb.append(lastNodes.getOrDefault(l, false) ? BLANK : PIPE);
            }
            sb.append(isLast ? ELBOW : TEE);
            sb.append(entry.name());
            sb.append("\n");
        }
        return sb.toString();
    }

    private boolean isLastSibling(List<FileEntry> entries, int index) {
        int level = entries.get(index).depth();
        for (int j = index + 1; j < entries.size(); j++) {
            int next = entries.get(j).depth();
            if (next < level) {
                return true;
            }
            if (next == level) {
                return false;
            }
        }
        return true;
    }
}
