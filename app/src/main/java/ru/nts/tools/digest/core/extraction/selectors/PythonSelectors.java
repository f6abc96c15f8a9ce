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
package ru.nts.tools.digest.core.extraction.selectors;

import org.treesitter.TSNode;
import ru.nts.tools.digest.core.DigestException;
import ru.nts.tools.digest.core.extraction.ElisionRenderer;
import ru.nts.tools.digest.core.extraction.Indentation;
import ru.nts.tools.digest.core.extraction.SelectorRegistry;
import ru.nts.tools.digest.core.extraction.TraversalContext;
import ru.nts.tools.digest.core.treesitter.Language;
import ru.nts.tools.digest.core.treesitter.NodeUtils;
import ru.nts.tools.digest.core.treesitter.SourceText;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

import static ru.nts.tools.digest.core.treesitter.NodeUtils.childByField;
import static ru.nts.tools.digest.core.treesitter.NodeUtils.findChildByType;

/**
 * Селекторы Python.
 * Класс сливается в один фрагмент: заголовок, поля и методы (с заглушкой вместо тела)
 * в исходном порядке.
 */
public class PythonSelectors implements LanguageSelectors {

    private static final ElisionRenderer RENDERER = new ElisionRenderer();

    @Override
    public Language language() {
        return Language.PYTHON;
    }

    @Override
    public SelectorRegistry createRegistry() {
        return SelectorRegistry.builder()
                .indentation(Indentation.spaces(4))
                .commentMarker("#")
                .selectOnly("module")
                .captureVerbatim("import_statement")
                .captureVerbatim("import_from_statement")
                .captureVerbatim("future_import_statement")
                .custom("expression_statement", PythonSelectors::classField)
                .captureElided("function_definition")
                .custom("class_definition", PythonSelectors::classDefinition)
                .custom("decorated_definition", PythonSelectors::decoratedDefinition)
                .build();
    }

    /**
     * Поля и docstring выводятся только внутри класса; на уровне модуля отбрасываются.
     */
    static Optional<String> classField(TSNode node, SourceText source, TraversalContext context) {
        if (!context.isAccumulating()) {
            return Optional.empty();
        }
        return Optional.of(source.text(node).trim());
    }

    static Optional<String> classDefinition(TSNode node, SourceText source, TraversalContext context) {
        beginClass(node, node, "", source, context);
        return Optional.empty();
    }

    /**
     * Декораторы выводятся построчно перед определением, в том же фрагменте.
     */
    static Optional<String> decoratedDefinition(TSNode node, SourceText source, TraversalContext context) {
        TSNode definition = childByField(node, "definition");
        if (definition == null) {
            throw DigestException.customActionFailed(node.getType(), SourceText.lineOf(node),
                    "decorated definition not found");
        }

        List<String> decorators = new ArrayList<>();
        for (TSNode child : NodeUtils.children(node)) {
            if (child.getType().equals("decorator")) {
                decorators.add(source.text(child).trim());
            }
        }
        String prefix = decorators.isEmpty() ? "" : String.join("\n", decorators) + "\n";

        return switch (definition.getType()) {
            case "function_definition" ->
                    Optional.of(prefix + RENDERER.render(definition, source, context.registry()));
            case "class_definition" -> {
                beginClass(node, definition, prefix, source, context);
                yield Optional.empty();
            }
            default -> Optional.of(source.text(node).trim());
        };
    }

    /**
     * Открывает накопление: заголовок класса до начала тела, затем члены тела.
     */
    private static void beginClass(TSNode origin, TSNode classNode, String prefix,
                                   SourceText source, TraversalContext context) {
        TSNode body = childByField(classNode, "body");
        if (body == null) {
            body = findChildByType(classNode, "block");
        }
        if (body == null) {
            throw DigestException.customActionFailed(classNode.getType(), SourceText.lineOf(classNode),
                    "class body not found");
        }

        String header = source.slice(classNode.getStartByte(), body.getStartByte()).trim();
        context.beginAccumulation(origin, prefix + header, NodeUtils.children(body));
    }
}
