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

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Таблица селекторов языка: тип узла -> действие, плюс параметры отрисовки заглушки.
 * Строится один раз через {@link Builder}, после чего неизменяема
 * и может разделяться между параллельными разборами.
 *
 * <p>Узлы, тип которых не зарегистрирован, отбрасываются вместе со всем поддеревом.
 */
public final class SelectorRegistry {

    private final Map<String, SelectorAction> actions;
    private final Indentation indentation;
    private final String commentMarker;

    private SelectorRegistry(Builder builder) {
        this.actions = Collections.unmodifiableMap(new LinkedHashMap<>(builder.actions));
        this.indentation = builder.indentation;
        this.commentMarker = builder.commentMarker;
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Возвращает действие для типа узла.
     */
    public Optional<SelectorAction> lookup(String kind) {
        return Optional.ofNullable(actions.get(kind));
    }

    public Indentation indentation() {
        return indentation;
    }

    /**
     * Маркер однострочного комментария, которым помечается заглушка тела ("//" или "#").
     */
    public String commentMarker() {
        return commentMarker;
    }

    /**
     * Зарегистрированные типы узлов в порядке регистрации.
     */
    public Map<String, SelectorAction> actions() {
        return actions;
    }

    /**
     * Создает builder с копией текущих настроек (для донастройки реестра по умолчанию).
     */
    public Builder toBuilder() {
        Builder builder = new Builder()
                .indentation(indentation)
                .commentMarker(commentMarker);
        builder.actions.putAll(actions);
        return builder;
    }

    public static final class Builder {

        private final Map<String, SelectorAction> actions = new LinkedHashMap<>();
        private Indentation indentation = Indentation.TAB;
        private String commentMarker = "//";

        private Builder() {}

        /**
         * Регистрирует действие для типа узла.
         * Повторная регистрация того же типа перезаписывает предыдущую (последняя побеждает).
         */
        public Builder register(String kind, SelectorAction action) {
            actions.put(Objects.requireNonNull(kind, "kind"), Objects.requireNonNull(action, "action"));
            return this;
        }

        public Builder selectOnly(String kind) {
            return register(kind, SelectorAction.selectOnly());
        }

        public Builder captureVerbatim(String kind) {
            return register(kind, SelectorAction.captureVerbatim());
        }

        public Builder captureElided(String kind) {
            return register(kind, SelectorAction.captureElided());
        }

        public Builder custom(String kind, CustomRule rule) {
            return register(kind, SelectorAction.custom(rule));
        }

        public Builder indentation(Indentation indentation) {
            this.indentation = Objects.requireNonNull(indentation, "indentation");
            return this;
        }

        public Builder commentMarker(String commentMarker) {
            this.commentMarker = Objects.requireNonNull(commentMarker, "commentMarker");
            return this;
        }

        public SelectorRegistry build() {
            return new SelectorRegistry(this);
        }
    }
}
