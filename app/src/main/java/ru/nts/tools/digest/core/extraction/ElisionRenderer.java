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
import ru.nts.tools.digest.core.treesitter.NodeUtils;
import ru.nts.tools.digest.core.treesitter.SourceText;

import java.util.List;
import java.util.Set;

/**
 * Отрисовывает узел с заменой тела реализации на заглушку.
 *
 * <p>Текст собирается из прямых дочерних узлов: перед каждым вставляется
 * ровно один пробел, кроме узлов из {@link #NO_SPACE_BEFORE}, а дочерний
 * {@code block} заменяется на
 * <pre>
 *  {
 * &lt;отступ&gt;// ...
 * }
 * </pre>
 */
public final class ElisionRenderer {

    /**
     * Тип узла тела реализации.
     */
    public static final String BLOCK_KIND = "block";

    /**
     * Узлы, перед которыми пробел не вставляется: {@code name(args)}, а не {@code name (args)}.
     */
    public static final Set<String> NO_SPACE_BEFORE = Set.of(
            "parameter_list",
            "parameters",
            "type_parameters",
            "func",
            ":"
    );

    /**
     * Отрисовывает узел. Если у узла нет дочернего block, возвращается его текст без изменений.
     */
    public String render(TSNode node, SourceText source, SelectorRegistry registry) {
        List<TSNode> children = NodeUtils.children(node);
        if (children.stream().noneMatch(c -> BLOCK_KIND.equals(c.getType()))) {
            return source.text(node);
        }

        String placeholder = placeholder(registry);
        StringBuilder sb = new StringBuilder(node.getEndByte() - node.getStartByte());
        for (TSNode child : children) {
            String kind = child.getType();
            if (BLOCK_KIND.equals(kind)) {
                sb.append(placeholder);
                continue;
            }
            if (!NO_SPACE_BEFORE.contains(kind)) {
                sb.append(' ');
            }
            sb.append(source.text(child));
        }
        return sb.toString().trim();
    }

    /**
     * Заглушка тела с учетом отступа и маркера комментария языка.
     */
    public static String placeholder(SelectorRegistry registry) {
        return " {\n" + registry.indentation().unit() + registry.commentMarker() + " ...\n}";
    }
}
