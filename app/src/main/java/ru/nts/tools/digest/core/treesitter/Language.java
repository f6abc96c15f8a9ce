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

import java.util.Arrays;
import java.util.Locale;
import java.util.Optional;

/**
 * Языки, для которых сконфигурирована грамматика и набор селекторов.
 */
public enum Language {

    GO("go", "go"),
    RUST("rust", "rust"),
    PYTHON("python", "python");

    private final String id;
    private final String fenceTag;

    Language(String id, String fenceTag) {
        this.id = id;
        this.fenceTag = fenceTag;
    }

    /**
     * Идентификатор языка (используется в конфигурации и JSON-выводе).
     */
    public String id() {
        return id;
    }

    /**
     * Тег языка для markdown-блока кода.
     */
    public String fenceTag() {
        return fenceTag;
    }

    /**
     * Находит язык по идентификатору (без учета регистра).
     */
    public static Optional<Language> fromId(String id) {
        if (id == null) {
            return Optional.empty();
        }
        String normalized = id.trim().toLowerCase(Locale.ROOT);
        return Arrays.stream(values())
                .filter(l -> l.id.equals(normalized))
                .findFirst();
    }
}
