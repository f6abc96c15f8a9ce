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
package ru.nts.tools.digest.core;

import java.nio.file.Path;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Base exception class for code-digest.
 * Provides structured error reporting with error codes and context.
 *
 * <p>Usage:
 * <pre>
 * throw new DigestException(DigestErrorCode.FILE_NOT_READABLE, "path", pathStr);
 * </pre>
 */
public class DigestException extends RuntimeException {

    private final DigestErrorCode code;
    private final Map<String, Object> context;

    public DigestException(DigestErrorCode code) {
        super(code.getMessage());
        this.code = code;
        this.context = Collections.emptyMap();
    }

    public DigestException(DigestErrorCode code, Map<String, Object> context) {
        super(code.getMessage());
        this.code = code;
        this.context = context != null ? new LinkedHashMap<>(context) : Collections.emptyMap();
    }

    public DigestException(DigestErrorCode code, String key, Object value) {
        super(code.getMessage());
        this.code = code;
        this.context = Map.of(key, value);
    }

    public DigestException(DigestErrorCode code, Map<String, Object> context, Throwable cause) {
        super(code.getMessage(), cause);
        this.code = code;
        this.context = context != null ? new LinkedHashMap<>(context) : Collections.emptyMap();
    }

    /**
     * Factory: структурное допущение custom-правила не выполнилось.
     */
    public static DigestException customActionFailed(String kind, int line, String reason) {
        Map<String, Object> ctx = new LinkedHashMap<>();
        ctx.put("kind", kind);
        ctx.put("line", line);
        ctx.put("reason", reason);
        return new DigestException(DigestErrorCode.CUSTOM_ACTION_FAILED, ctx);
    }

    /**
     * Factory: грамматика не совместима с рантаймом tree-sitter.
     */
    public static DigestException grammarIncompatible(String language, Throwable cause) {
        return new DigestException(DigestErrorCode.GRAMMAR_INCOMPATIBLE, Map.of("language", language), cause);
    }

    /**
     * Factory: файл не читается.
     */
    public static DigestException notReadable(Path path, Throwable cause) {
        return new DigestException(DigestErrorCode.FILE_NOT_READABLE, Map.of("path", path.toString()), cause);
    }

    public DigestErrorCode getCode() {
        return code;
    }

    public Map<String, Object> getContext() {
        return Collections.unmodifiableMap(context);
    }

    /**
     * Returns a formatted user-friendly error message.
     */
    public String toUserMessage() {
        return code.format(context);
    }

    @Override
    public String getMessage() {
        return toUserMessage();
    }

    /**
     * Returns a compact single-line error message for logs.
     */
    public String toLogMessage() {
        StringBuilder sb = new StringBuilder();
        sb.append("[").append(code.name()).append("] ").append(code.getMessage());
        if (!context.isEmpty()) {
            sb.append(" | ");
            boolean first = true;
            for (Map.Entry<String, Object> entry : context.entrySet()) {
                if (!first) sb.append(", ");
                sb.append(entry.getKey()).append("=").append(entry.getValue());
                first = false;
            }
        }
        return sb.toString();
    }
}
