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

import java.util.ArrayList;
import java.util.List;

/**
 * Утилиты навигации по AST дереву tree-sitter.
 * Родительские связи не хранятся: все читается из API самого дерева.
 */
public final class NodeUtils {

    private NodeUtils() {}

    /**
     * Проверяет, что узел существует (tree-sitter возвращает "null node" вместо null).
     */
    public static boolean isPresent(TSNode node) {
        return node != null && !node.isNull();
    }

    /**
     * Возвращает все прямые дочерние узлы (включая анонимные токены) в исходном порядке.
     */
    public static List<TSNode> children(TSNode parent) {
        int childCount = parent.getChildCount();
        List<TSNode> result = new ArrayList<>(childCount);
        for (int i = 0; i < childCount; i++) {
            TSNode child = parent.getChild(i);
            if (isPresent(child)) {
                result.add(child);
            }
        }
        return result;
    }

    /**
     * Находит первый дочерний узел указанного типа.
     *
     * @return узел или null если не найден
     */
    public static TSNode findChildByType(TSNode parent, String type) {
        int childCount = parent.getChildCount();
        for (int i = 0; i < childCount; i++) {
            TSNode child = parent.getChild(i);
            if (isPresent(child) && child.getType().equals(type)) {
                return child;
            }
        }
        return null;
    }

    /**
     * Дочерний узел по имени поля грамматики.
     *
     * @return узел или null если поле отсутствует
     */
    public static TSNode childByField(TSNode parent, String fieldName) {
        TSNode child = parent.getChildByFieldName(fieldName);
        return isPresent(child) ? child : null;
    }
}
