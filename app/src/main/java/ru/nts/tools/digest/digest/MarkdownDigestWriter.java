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
package ru.nts.tools.digest.digest;

import ru.nts.tools.digest.core.extraction.Fragment;

import java.util.ArrayList;
import java.util.List;

/**
 * Markdown-представление:
 * <pre>
 * `src/main.go`
 * ```go
 * import "fmt"
 *
 * func main() {
 * 	// ...
 * }
 * ```
 * </pre>
 * Файлы разделяются пустой строкой. Verbatim-файлы выводятся в блоке без тега языка.
 * Пустые фрагменты (например, Go-псевдонимы типов) не печатаются.
 * Ошибочные файлы в вывод не попадают.
 */
public class MarkdownDigestWriter implements DigestWriter {

    private static final String FENCE = "```";

    @Override
    public String write(DigestResult result) {
        List<String> blocks = new ArrayList<>();
        if (result.tree() != null) {
            blocks.add(stripTrailingNewline(result.tree()));
        }
        for (FileDigest file : result.successful()) {
            blocks.add(writeFile(file));
        }
        return blocks.isEmpty() ? "" : String.join("\n\n", blocks) + "\n";
    }

    String writeFile(FileDigest file) {
        StringBuilder sb = new StringBuilder();
        sb.append('`').append(file.path()).append("`\n");

        if (file.verbatim()) {
            sb.append(FENCE).append('\n');
            appendBody(sb, stripTrailingNewline(file.content()));
        } else {
            sb.append(FENCE).append(file.language().fenceTag()).append('\n');
            List<String> parts = new ArrayList<>();
            for (Fragment fragment : file.fragments()) {
                // пустые фрагменты (не-struct типы Go) в Markdown не выводятся, в JSON остаются
                if (!fragment.content().isBlank()) {
                    parts.add(fragment.content());
                }
            }
            appendBody(sb, String.join("\n\n", parts));
        }

        sb.append(FENCE);
        return sb.toString();
    }

    private static void appendBody(StringBuilder sb, String body) {
        if (!body.isEmpty()) {
            sb.append(body).append('\n');
        }
    }

    private static String stripTrailingNewline(String text) {
        String result = text;
        while (result.endsWith("\n") || result.endsWith("\r")) {
            result = result.substring(0, result.length() - 1);
        }
        return result;
    }
}
