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

import org.junit.jupiter.api.Test;
import org.treesitter.TSNode;
import org.treesitter.TSTree;
import ru.nts.tools.digest.core.extraction.selectors.SelectorRegistries;
import ru.nts.tools.digest.core.treesitter.Language;
import ru.nts.tools.digest.core.treesitter.NodeUtils;
import ru.nts.tools.digest.core.treesitter.SourceText;
import ru.nts.tools.digest.core.treesitter.TreeSitterManager;

import static org.junit.jupiter.api.Assertions.*;

class ElisionRendererTest {

    private final ElisionRenderer renderer = new ElisionRenderer();

    @Test
    void placeholderUsesRegistryIndentationAndMarker() {
        assertEquals(" {\n\t// ...\n}", ElisionRenderer.placeholder(SelectorRegistry.builder().build()));
        assertEquals(" {\n    # ...\n}", ElisionRenderer.placeholder(SelectorRegistry.builder()
                .indentation(Indentation.spaces(4))
                .commentMarker("#")
                .build()));
    }

    @Test
    void nodeWithoutBlockIsReturnedUnchanged() {
        String code = "trait Shape {\n    fn area(&self) -> f64;\n}\n";
        SourceText source = new SourceText(code);
        TSNode signature = firstOfType(parse(code, Language.RUST).getRootNode(), "function_signature_item");

        assertNotNull(signature);
        assertEquals("fn area(&self) -> f64;",
                renderer.render(signature, source, SelectorRegistries.getInstance().forLanguage(Language.RUST)));
    }

    @Test
    void bodyIsReplacedAndWhitespaceNormalized() {
        String code = "pub   fn  spaced<T: Clone>(value:   T)\n    -> T\n{\n    value.clone()\n}\n";
        SourceText source = new SourceText(code);
        TSNode function = firstOfType(parse(code, Language.RUST).getRootNode(), "function_item");

        String rendered = renderer.render(function, source, SelectorRegistries.getInstance().forLanguage(Language.RUST));

        assertEquals("pub fn spaced<T: Clone>(value:   T) -> T {\n    // ...\n}", rendered);
    }

    @Test
    void goMethodReceiverFollowsFuncKeyword() {
        String code = "package main\n\nfunc (s *Server) Stop() {\n\ts.done = true\n}\n";
        SourceText source = new SourceText(code);
        TSNode method = firstOfType(parse(code, Language.GO).getRootNode(), "method_declaration");

        String rendered = renderer.render(method, source, SelectorRegistries.getInstance().forLanguage(Language.GO));

        assertEquals("func(s *Server) Stop() {\n\t// ...\n}", rendered);
    }

    private static TSTree parse(String code, Language language) {
        return TreeSitterManager.getInstance().parse(code, language);
    }

    private static TSNode firstOfType(TSNode node, String type) {
        if (node.getType().equals(type)) {
            return node;
        }
        for (TSNode child : NodeUtils.children(node)) {
            TSNode found = firstOfType(child, type);
            if (found != null) {
                return found;
            }
        }
        return null;
    }
}
