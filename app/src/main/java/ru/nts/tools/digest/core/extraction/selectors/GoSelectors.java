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
import ru.nts.tools.digest.core.extraction.Indentation;
import ru.nts.tools.digest.core.extraction.SelectorRegistry;
import ru.nts.tools.digest.core.extraction.TraversalContext;
import ru.nts.tools.digest.core.treesitter.Language;
import ru.nts.tools.digest.core.treesitter.NodeUtils;
import ru.nts.tools.digest.core.treesitter.SourceText;

import java.util.Optional;

import static ru.nts.tools.digest.core.treesitter.NodeUtils.childByField;

public class GoSelectors implements LanguageSelectors {

    @Override
    public Language language() {
        return Language.GO;
    }

    @Override
    public SelectorRegistry createRegistry() {
        return SelectorRegistry.builder()
                .indentation(Indentation.TAB)
                .commentMarker("//")
                .selectOnly("source_file")
                .captureVerbatim("import_declaration")
                .captureElided("function_declaration")
                .captureElided("method_declaration")
                .custom("type_declaration", GoSelectors::typeDeclaration)
                .build();
    }

    /**
     * type_declaration -> type_spec -> type.
     * struct и interface выводятся целиком, остальные типы дают пустой фрагмент,
     * чтобы позиции фрагментов оставались стабильными.
     * Групповое объявление {@code type ( ... )} выводится целиком, если в нем есть
     * хотя бы один struct или interface.
     */
    static Optional<String> typeDeclaration(TSNode node, SourceText source, TraversalContext context) {
        boolean found = false;
        for (TSNode spec : NodeUtils.children(node)) {
            String specKind = spec.getType();
            if (!specKind.equals("type_spec") && !specKind.equals("type_alias")) {
                continue;
            }
            found = true;

            TSNode type = childByField(spec, "type");
            if (type == null) {
                throw DigestException.customActionFailed(node.getType(), SourceText.lineOf(spec),
                        specKind + " has no type");
            }
            String typeKind = type.getType();
            if (typeKind.equals("struct_type") || typeKind.equals("interface_type")) {
                return Optional.of(source.text(node));
            }
        }

        if (!found) {
            throw DigestException.customActionFailed(node.getType(), SourceText.lineOf(node),
                    "type_spec not found");
        }
        return Optional.of("");
    }
}
