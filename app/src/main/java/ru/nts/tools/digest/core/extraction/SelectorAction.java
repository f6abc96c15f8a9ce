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

import java.util.Objects;

/**
 * Действие, которое движок обхода выполняет для узла определенного типа.
 *
 * @param type вид действия
 * @param rule пользовательское правило, задано только для {@link Type#CUSTOM}
 */
public record SelectorAction(Type type, CustomRule rule) {

    public enum Type {
        /**
         * Узел не выводится, обход спускается в дочерние узлы.
         */
        SELECT_ONLY,

        /**
         * Сырой текст узла (с обрезкой внешних пробелов) становится фрагментом.
         */
        CAPTURE_VERBATIM,

        /**
         * Текст узла с заменой тела (block) на заглушку.
         */
        CAPTURE_ELIDED,

        /**
         * Выполняется {@link CustomRule}.
         */
        CUSTOM
    }

    private static final SelectorAction SELECT_ONLY = new SelectorAction(Type.SELECT_ONLY, null);
    private static final SelectorAction CAPTURE_VERBATIM = new SelectorAction(Type.CAPTURE_VERBATIM, null);
    private static final SelectorAction CAPTURE_ELIDED = new SelectorAction(Type.CAPTURE_ELIDED, null);

    public SelectorAction {
        Objects.requireNonNull(type, "type");
        if ((type == Type.CUSTOM) != (rule != null)) {
            throw new IllegalArgumentException("Custom rule must be set for CUSTOM actions only, got " + type);
        }
    }

    public static SelectorAction selectOnly() {
        return SELECT_ONLY;
    }

    public static SelectorAction captureVerbatim() {
        return CAPTURE_VERBATIM;
    }

    public static SelectorAction captureElided() {
        return CAPTURE_ELIDED;
    }

    public static SelectorAction custom(CustomRule rule) {
        return new SelectorAction(Type.CUSTOM, Objects.requireNonNull(rule, "rule"));
    }
}
