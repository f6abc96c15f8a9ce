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

import java.util.Map;

/**
 * Structured error codes for code-digest.
 * Each error has a human-readable message and a solution hint.
 *
 * <p>Example output:
 * <pre>
 * [ERROR: CUSTOM_ACTION_FAILED]
 * Message: Custom selector action failed
 * Solution: The syntax tree does not have the shape expected for 'type_declaration'. ...
 * Context: kind=type_declaration, line=12
 * </pre>
 */
public enum DigestErrorCode {

    // ============ Grammar Errors ============

    GRAMMAR_INCOMPATIBLE("Incompatible tree-sitter grammar",
            "Grammar '%language%' cannot be loaded by the linked tree-sitter runtime. " +
            "Align tree-sitter and grammar artifact versions."),

    LANGUAGE_NOT_SUPPORTED("Language not supported",
            "Supported languages: go, rust, python. Check --extension mappings."),

    // ============ Extraction Errors ============

    CUSTOM_ACTION_FAILED("Custom selector action failed",
            "The syntax tree does not have the shape expected for '%kind%'. " +
            "The file is skipped; the rest of the digest is unaffected."),

    // ============ File Errors ============

    FILE_NOT_READABLE("File not readable",
            "Check file permissions. Ensure the file is not locked."),

    FILE_IS_BINARY("Binary file detected",
            "Binary files cannot be digested. Add the path to .gitignore or --ignore."),

    FILE_TOO_LARGE("File too large",
            "Files larger than %limit% bytes are not parsed."),

    // ============ Directory Errors ============

    DIRECTORY_NOT_FOUND("Directory not found",
            "Check directory path: '%path%'."),

    // ============ Parameter Errors ============

    PARAM_INVALID("Invalid parameter value",
            "Check parameter type and format. Run with --help for usage."),

    CONFIG_INVALID("Invalid configuration file",
            "Check JSON syntax and keys of '%path%'. " +
            "Known keys: ignore, include, tree, maxDepth, format, threads, extensions."),

    // ============ System Errors ============

    IO_ERROR("I/O error occurred",
            "Check disk space and permissions. Try again."),

    INTERNAL_ERROR("Internal error",
            "Unexpected error. Run with CODE_DIGEST_DEBUG=true for details.");

    private final String message;
    private final String solution;

    DigestErrorCode(String message, String solution) {
        this.message = message;
        this.solution = solution;
    }

    public String getMessage() {
        return message;
    }

    /**
     * Formats error message with optional context.
     *
     * @param context Optional context map (path, kind, etc.)
     * @return Formatted error string
     */
    public String format(Map<String, Object> context) {
        StringBuilder sb = new StringBuilder();
        sb.append(String.format("[ERROR: %s]\n", this.name()));
        sb.append(String.format("Message: %s\n", message));

        // Интерполяция %placeholder% в solution
        String resolvedSolution = solution;
        if (context != null) {
            for (Map.Entry<String, Object> entry : context.entrySet()) {
                resolvedSolution = resolvedSolution.replace(
                        "%" + entry.getKey() + "%", String.valueOf(entry.getValue()));
            }
        }
        resolvedSolution = resolvedSolution.replaceAll("%\\w+%", "...");
        sb.append(String.format("Solution: %s", resolvedSolution));

        if (context != null && !context.isEmpty()) {
            sb.append("\nContext: ");
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
