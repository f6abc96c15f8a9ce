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
package ru.nts.tools.digest.config;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import ru.nts.tools.digest.core.DigestErrorCode;
import ru.nts.tools.digest.core.DigestException;
import ru.nts.tools.digest.core.DigestLog;
import ru.nts.tools.digest.core.treesitter.Language;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;
import java.util.function.Function;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Загрузка JSON-файла конфигурации.
 *
 * <pre>
 * {
 *   "ignore": ["vendor", "~/cache"],
 *   "include": ["*.md"],
 *   "tree": true,
 *   "maxDepth": 4,
 *   "format": "markdown",
 *   "threads": 4,
 *   "extensions": { "py": "python" }
 * }
 * </pre>
 */
public class ConfigLoader {

    /**
     * Имя файла конфигурации, который подхватывается из корня дайджеста.
     */
    public static final String DEFAULT_CONFIG_FILE = ".code-digest.json";

    private static final Set<String> KNOWN_KEYS =
            Set.of("ignore", "include", "tree", "maxDepth", "format", "threads", "extensions");

    private static final Pattern VARIABLE = Pattern.compile("\\$(\\{(\\w+)}|(\\w+))");

    private final ObjectMapper mapper = new ObjectMapper();
    private final Function<String, String> env;

    public ConfigLoader() {
        this(System::getenv);
    }

    /**
     * @param env источник переменных окружения (для подстановки $VAR)
     */
    public ConfigLoader(Function<String, String> env) {
        this.env = env;
    }

    /**
     * Явно указанный файл, либо {@code .code-digest.json} в корне, либо ничего.
     */
    public Path resolveConfigFile(Path root, Path explicit) {
        if (explicit != null) {
            return explicit;
        }
        Path candidate = root.resolve(DEFAULT_CONFIG_FILE);
        return Files.isRegularFile(candidate) ? candidate : null;
    }

    /**
     * Применяет значения из файла к builder'у.
     *
     * @throws DigestException CONFIG_INVALID при ошибке чтения, синтаксиса или типов
     */
    public void apply(Path configFile, DigestConfig.Builder builder) {
        JsonNode json = read(configFile);
        if (!json.isObject()) {
            throw invalid(configFile, "top-level value must be an object");
        }

        Iterator<String> names = json.fieldNames();
        while (names.hasNext()) {
            String name = names.next();
            if (!KNOWN_KEYS.contains(name)) {
                DigestLog.warn("Unknown key '" + name + "' in " + configFile + " is ignored");
            }
        }

        if (json.has("ignore")) {
            for (JsonNode item : array(json, "ignore", configFile)) {
                builder.ignore(expandPath(text(item, "ignore", configFile)));
            }
        }
        if (json.has("include")) {
            for (JsonNode item : array(json, "include", configFile)) {
                builder.include(text(item, "include", configFile));
            }
        }
        if (json.has("tree")) {
            JsonNode tree = json.get("tree");
            if (!tree.isBoolean()) {
                throw invalid(configFile, "'tree' must be a boolean");
            }
            builder.tree(tree.asBoolean());
        }
        if (json.has("maxDepth")) {
            builder.maxDepth(integer(json, "maxDepth", configFile));
        }
        if (json.has("threads")) {
            builder.threads(integer(json, "threads", configFile));
        }
        if (json.has("format")) {
            String format = text(json.get("format"), "format", configFile);
            try {
                builder.format(OutputFormat.fromId(format));
            } catch (DigestException e) {
                throw invalid(configFile, "unknown format '" + format + "'");
            }
        }
        if (json.has("extensions")) {
            JsonNode extensions = json.get("extensions");
            if (!extensions.isObject()) {
                throw invalid(configFile, "'extensions' must be an object");
            }
            for (Map.Entry<String, JsonNode> entry : iterable(extensions.fields())) {
                String languageId = text(entry.getValue(), "extensions", configFile);
                Language language = Language.fromId(languageId)
                        .orElseThrow(() -> invalid(configFile, "unknown language '" + languageId + "'"));
                builder.extension(entry.getKey(), language);
            }
        }
    }

    /**
     * Разворачивает {@code ~} и {@code $VAR}/{@code ${VAR}} в пути.
     *
     * @throws DigestException PARAM_INVALID если переменная не определена
     */
    public Path expandPath(String raw) {
        String value = raw;
        if (value.equals("~") || value.startsWith("~/")) {
            value = System.getProperty("user.home") + value.substring(1);
        }

        Matcher matcher = VARIABLE.matcher(value);
        StringBuilder sb = new StringBuilder();
        while (matcher.find()) {
            String name = matcher.group(2) != null ? matcher.group(2) : matcher.group(3);
            String resolved = env.apply(name);
            if (resolved == null) {
                throw new DigestException(DigestErrorCode.PARAM_INVALID,
                        Map.of("path", raw, "variable", name));
            }
            matcher.appendReplacement(sb, Matcher.quoteReplacement(resolved));
        }
        matcher.appendTail(sb);
        return Path.of(sb.toString());
    }

    private JsonNode read(Path configFile) {
        try {
            return mapper.readTree(Files.readString(configFile));
        } catch (JsonProcessingException e) {
            throw new DigestException(DigestErrorCode.CONFIG_INVALID,
                    Map.of("path", configFile.toString(), "reason", String.valueOf(e.getOriginalMessage())), e);
        } catch (IOException e) {
            throw new DigestException(DigestErrorCode.CONFIG_INVALID,
                    Map.of("path", configFile.toString(), "reason", String.valueOf(e.getMessage())), e);
        }
    }

    private Iterable<JsonNode> array(JsonNode json, String key, Path configFile) {
        JsonNode node = json.get(key);
        if (!node.isArray()) {
            throw invalid(configFile, "'" + key + "' must be an array of strings");
        }
        return node;
    }

    private String text(JsonNode node, String key, Path configFile) {
        if (!node.isTextual()) {
            throw invalid(configFile, "'" + key + "' values must be strings");
        }
        return node.asText();
    }

    private int integer(JsonNode json, String key, Path configFile) {
        JsonNode node = json.get(key);
        if (!node.canConvertToInt() || !node.isIntegralNumber()) {
            throw invalid(configFile, "'" + key + "' must be an integer");
        }
        return node.asInt();
    }

    private static DigestException invalid(Path configFile, String reason) {
        Map<String, Object> ctx = new LinkedHashMap<>();
        ctx.put("path", configFile.toString());
        ctx.put("reason", reason);
        return new DigestException(DigestErrorCode.CONFIG_INVALID, ctx);
    }

    private static <T> Iterable<T> iterable(Iterator<T> iterator) {
        return () -> iterator;
    }
}
