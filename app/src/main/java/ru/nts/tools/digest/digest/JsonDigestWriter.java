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

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import ru.nts.tools.digest.core.DigestErrorCode;
import ru.nts.tools.digest.core.DigestException;
import ru.nts.tools.digest.core.extraction.Fragment;

import java.util.Map;

/**
 * JSON-представление дайджеста: root, tree (если запрошено), files и errors.
 */
public class JsonDigestWriter implements DigestWriter {

    private final ObjectMapper mapper = new ObjectMapper();

    @Override
    public String write(DigestResult result) {
        ObjectNode root = mapper.createObjectNode();
        root.put("root", result.root());
        if (result.tree() != null) {
            root.put("tree", result.tree());
        }

        ArrayNode files = root.putArray("files");
        for (FileDigest file : result.successful()) {
            ObjectNode node = files.addObject();
            node.put("path", file.path());
            if (file.language() != null) {
                node.put("language", file.language().id());
            } else {
                node.putNull("language");
            }
            node.put("verbatim", file.verbatim());

            ArrayNode fragments = node.putArray("fragments");
            for (Fragment fragment : file.fragments()) {
                fragments.addObject()
                        .put("kind", fragment.kind())
                        .put("line", fragment.line())
                        .put("content", fragment.content());
            }
            if (file.verbatim()) {
                node.put("content", file.content());
            }
        }

        ArrayNode errors = root.putArray("errors");
        for (FileDigest.FileError error : result.errors()) {
            errors.addObject()
                    .put("path", error.path())
                    .put("code", error.code().name())
                    .put("message", error.message());
        }

        try {
            return mapper.writerWithDefaultPrettyPrinter().writeValueAsString(root) + "\n";
        } catch (JsonProcessingException e) {
            throw new DigestException(DigestErrorCode.INTERNAL_ERROR, Map.of("reason", String.valueOf(e.getOriginalMessage())), e);
        }
    }
}
