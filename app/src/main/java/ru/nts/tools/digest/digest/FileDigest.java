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

import ru.nts.tools.digest.core.DigestErrorCode;
import ru.nts.tools.digest.core.DigestException;
import ru.nts.tools.digest.core.extraction.Fragment;
import ru.nts.tools.digest.core.treesitter.Language;

import java.util.List;

/**
 * Результат обработки одного файла.
 * Ровно один из вариантов: verbatim-содержимое, список фрагментов или ошибка.
 *
 * @param path      отображаемый путь файла
 * @param language  язык (null для verbatim-файлов и ошибок)
 * @param verbatim  файл выводится целиком (совпал с include-паттерном)
 * @param content   содержимое verbatim-файла
 * @param fragments извлеченные фрагменты
 * @param error     ошибка обработки файла
 */
public record FileDigest(String path,
                         Language language,
                         boolean verbatim,
                         String content,
                         List<Fragment> fragments,
                         FileError error) {

    public static FileDigest verbatim(String path, String content) {
        return new FileDigest(path, null, true, content, List.of(), null);
    }

    public static FileDigest extracted(String path, Language language, List<Fragment> fragments) {
        return new FileDigest(path, language, false, null, List.copyOf(fragments), null);
    }

    public static FileDigest failed(String path, DigestException e) {
        return new FileDigest(path, null, false, null, List.of(), new FileError(path, e.getCode(), e.toLogMessage()));
    }

    public boolean isFailed() {
        return error != null;
    }

    /**
     * Ошибка обработки файла, не прерывающая дайджест.
     */
    public record FileError(String path, DigestErrorCode code, String message) {
    }
}
