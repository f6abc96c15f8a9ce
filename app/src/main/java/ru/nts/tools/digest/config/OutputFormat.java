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

import ru.nts.tools.digest.core.DigestErrorCode;
import ru.nts.tools.digest.core.DigestException;

import java.util.Locale;

/**
 * Формат вывода дайджеста.
 */
public enum OutputFormat {
    MARKDOWN,
    JSON;

    public static OutputFormat fromId(String id) {
        try {
            return valueOf(id.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new DigestException(DigestErrorCode.PARAM_INVALID, "format", id);
        }
    }
}
