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

import org.junit.jupiter.api.Test;
import org.treesitter.TSLanguage;
import org.treesitter.TSNode;
import org.treesitter.TSTree;

import java.nio.charset.StandardCharsets;

import static org.junit.jupiter.api.Assertions.*;

class TreeSitterManagerTest {

    private final TreeSitterManager manager = TreeSitterManager.getInstance();

    @Test
    void getInstance() {
        assertSame(TreeSitterManager.getInstance(), TreeSitterManager.getInstance(), "Should be singleton");
    }

    @Test
    void allConfiguredGrammarsVerify() {
        for (Language language : Language.values()) {
            assertDoesNotThrow(() -> manager.verify(language), language.id());
        }
    }

    @Test
    void languageIsCached() {
        TSLanguage first = manager.getLanguage(Language.GO);
        assertSame(first, manager.getLanguage(Language.GO));
    }

    @Test
    void parseGoContent() {
        TSTree tree = manager.parse("package main\n\nfunc main() {}\n", Language.GO);
        TSNode root = tree.getRootNode();

        assertEquals("source_file", root.getType());
        assertTrue(NodeUtils.children(root).stream().anyMatch(n -> n.getType().equals("function_declaration")));
    }

    @Test
    void parsePythonContent() {
        TSTree tree = manager.parse("import os\n", Language.PYTHON);
        assertEquals("module", tree.getRootNode().getType());
    }

    @Test
    void brokenSourceStillYieldsTree() {
        TSTree tree = manager.parse("fn broken( {", Language.RUST);
        assertEquals("source_file", tree.getRootNode().getType());
    }

    @Test
    void sourceTextSlicesByBytes() {
        String code = "// привет\nfn f() {}\n";
        SourceText source = new SourceText(code);
        TSNode function = NodeUtils.findChildByType(manager.parse(code, Language.RUST).getRootNode(), "function_item");

        assertNotNull(function);
        assertEquals("fn f() {}", source.text(function));
        assertEquals(2, SourceText.lineOf(function));
        assertEquals(code.getBytes(StandardCharsets.UTF_8).length, source.byteLength());
    }
}
