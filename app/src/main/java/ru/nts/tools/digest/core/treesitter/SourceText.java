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

import org.treesitter.TSNode;

import java.nio.charset.StandardCharsets;

/**
 * Исходный текст разбираемого файла вместе с его UTF-8 представлением.
 * КРИТИЧНО: tree-sitter возвращает байтовые смещения, а не символьные,
 * поэтому текст узла всегда вырезается из байтового массива.
 */
public final class SourceText {

    private final String content;
    private final byte[] bytes;

    public SourceText(String content) {
        this.content = content;
        this.bytes = content.getBytes(StandardCharsets.UTF_8);
    }

    public String content() {
        return content;
    }

    public int byteLength() {
        return bytes.length;
    }

    /**
     * Сырой текст узла без какой-либо нормализации.
     */
    public String text(TSNode node) {
        return slice(node.getStartByte(), node.getEndByte());
    }

    /**
     * Текст в диапазоне байтов [start, end). Некорректный диапазон дает пустую строку.
     */
    public String slice(int start, int end) {
        if (start >= 0 && end <= bytes.length && start < end) {
            return new String(bytes, start, end - start, StandardCharsets.UTF_8);
        }
        return "";
    }

    /**
     * Номер строки начала узла (1-based).
     */
    public static int lineOf(TSNode node) {
        return node.getStartPoint().getRow() + 1;
    }
}
