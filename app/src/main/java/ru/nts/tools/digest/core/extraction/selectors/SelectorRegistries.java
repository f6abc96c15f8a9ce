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

import ru.nts.tools.digest.core.DigestErrorCode;
import ru.nts.tools.digest.core.DigestException;
import ru.nts.tools.digest.core.extraction.SelectorRegistry;
import ru.nts.tools.digest.core.treesitter.Language;

import java.util.EnumMap;
import java.util.Map;

/**
 * Реестры селекторов по умолчанию для всех сконфигурированных языков.
 * Строятся один раз при загрузке класса и далее только читаются.
 */
public final class SelectorRegistries {

    private static final SelectorRegistries INSTANCE = new SelectorRegistries();

    private final Map<Language, SelectorRegistry> registries = new EnumMap<>(Language.class);

    private SelectorRegistries() {
        register(new GoSelectors());
        register(new RustSelectors());
        register(new PythonSelectors());
    }

    public static SelectorRegistries getInstance() {
        return INSTANCE;
    }

    private void register(LanguageSelectors selectors) {
        registries.put(selectors.language(), selectors.createRegistry());
    }

    /**
     * Реестр по умолчанию для языка.
     *
     * @throws DigestException LANGUAGE_NOT_SUPPORTED если для языка нет селекторов
     */
    public SelectorRegistry forLanguage(Language language) {
        SelectorRegistry registry = registries.get(language);
        if (registry == null) {
            throw new DigestException(DigestErrorCode.LANGUAGE_NOT_SUPPORTED, "language", language.id());
        }
        return registry;
    }
}
