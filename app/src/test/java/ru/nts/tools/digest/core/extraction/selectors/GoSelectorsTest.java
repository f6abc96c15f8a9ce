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

import org.junit.jupiter.api.Test;
import ru.nts.tools.digest.core.extraction.Fragment;
import ru.nts.tools.digest.core.extraction.TraversalEngine;
import ru.nts.tools.digest.core.treesitter.Language;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class GoSelectorsTest {

    private final TraversalEngine engine = new TraversalEngine();

    @Test
    void importStructAndFunction() {
        String code = """
                package main

                import (
                \t"fmt"
                \t"os"
                )

                type Config struct {
                \tName string
                }

                func Run(c *Config) error {
                \tfmt.Println(c.Name)
                \treturn nil
                }
                """;

        List<Fragment> fragments = engine.extract(code, Language.GO);

        assertEquals(3, fragments.size());
        assertEquals("import (\n\t\"fmt\"\n\t\"os\"\n)", fragments.get(0).content());
        assertEquals("type Config struct {\n\tName string\n}", fragments.get(1).content());
        assertEquals("func Run(c *Config) error {\n\t// ...\n}", fragments.get(2).content());
    }

    @Test
    void multipleResultsKeepParameterListsAdjacent() {
        String code = """
                package fixture

                func Setup(t *testing.T, setupConfig *SetupConfig) (*SetupFixture, error) {
                \treturn nil, nil
                }
                """;

        List<Fragment> fragments = engine.extract(code, Language.GO);

        assertEquals(1, fragments.size());
        assertEquals("func Setup(t *testing.T, setupConfig *SetupConfig)(*SetupFixture, error) {\n\t// ...\n}",
                fragments.get(0).content());
    }

    @Test
    void interfaceIsCapturedVerbatim() {
        String code = """
                package main

                type Reader interface {
                \tRead(p []byte) (int, error)
                }
                """;

        List<Fragment> fragments = engine.extract(code, Language.GO);

        assertEquals(1, fragments.size());
        assertEquals("type Reader interface {\n\tRead(p []byte) (int, error)\n}", fragments.get(0).content());
        assertEquals("type_declaration", fragments.get(0).kind());
        assertEquals(3, fragments.get(0).line());
    }

    @Test
    void namedNonStructTypeYieldsEmptyFragment() {
        String code = """
                package main

                type ID int
                """;

        List<Fragment> fragments = engine.extract(code, Language.GO);

        assertEquals(1, fragments.size());
        assertEquals("", fragments.get(0).content());
    }

    @Test
    void groupedDeclarationWithStructIsCapturedVerbatim() {
        String code = """
                package main

                type (
                \tID int
                \tUser struct {
                \t\tName string
                \t}
                )
                """;

        List<Fragment> fragments = engine.extract(code, Language.GO);

        assertEquals(1, fragments.size());
        assertEquals("type (\n\tID int\n\tUser struct {\n\t\tName string\n\t}\n)", fragments.get(0).content());
    }

    @Test
    void groupedDeclarationWithoutStructYieldsEmptyFragment() {
        String code = """
                package main

                type (
                \tID int
                \tName string
                )
                """;

        List<Fragment> fragments = engine.extract(code, Language.GO);

        assertEquals(1, fragments.size());
        assertEquals("", fragments.get(0).content());
    }

    @Test
    void genericStructIsCapturedVerbatim() {
        String code = """
                package main

                type List[T any] struct {
                \titems []T
                }
                """;

        List<Fragment> fragments = engine.extract(code, Language.GO);

        assertEquals(1, fragments.size());
        assertTrue(fragments.get(0).content().startsWith("type List[T any] struct {"));
    }

    @Test
    void packageClauseIsPruned() {
        List<Fragment> fragments = engine.extract("package main\n", Language.GO);
        assertTrue(fragments.isEmpty());
    }
}
