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
package ru.nts.tools.digest.core.extraction;

import java.util.stream.Collectors;

/**
 * Единица отступа языка: табуляция или N пробелов.
 *
 * @param tabs  true для табуляции
 * @param width количество пробелов (игнорируется для табуляции)
 */
public record Indentation(boolean tabs, int width) {

    public static final Indentation TAB = new Indentation(true, 1);

    public Indentation {
        if (!tabs && width < 1) {
            throw new IllegalArgumentException("Indentation width must be positive: " + width);
        }
    }

    public static Indentation spaces(int width) {
        return new Indentation(false, width);
    }

    /**
     * Одна единица отступа.
     */
    public String unit() {
        return tabs ? "\t" : " ".repeat(width);
    }

    /**
     * Сдвигает каждую непустую строку текста на одну единицу отступа.
     */
    public String indent(String text) {
        String unit = unit();
        return text.lines()
                .map(line -> line.isBlank() ? line : unit + line)
                .collect(Collectors.joining("\n"));
    }
}
