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

import org.treesitter.TSNode;
import ru.nts.tools.digest.core.treesitter.SourceText;

import java.util.Optional;

/**
 * Пользовательское правило извлечения для узлов определенного типа.
 * Правило само решает, что выводить, и может ставить дополнительную работу
 * в очередь обхода через {@link TraversalContext}.
 */
@FunctionalInterface
public interface CustomRule {

    /**
     * Применяет правило к узлу.
     *
     * @param node    текущий узел AST
     * @param source  исходный текст файла
     * @param context изменяемое состояние текущего обхода
     * @return текст для вывода (маршрутизируется как обычный захват) или empty если выводить нечего
     * @throws ru.nts.tools.digest.core.DigestException CUSTOM_ACTION_FAILED если дерево не имеет ожидаемой формы
     */
    Optional<String> apply(TSNode node, SourceText source, TraversalContext context);
}
