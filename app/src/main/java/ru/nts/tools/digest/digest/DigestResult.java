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

import java.util.List;
import java.util.stream.Collectors;

/**
 * Результат запуска: файлы в порядке обхода и (опционально) ASCII-дерево.
 *
 * @param root  корень в том виде, в каком его указал пользователь
 * @param tree  ASCII-дерево или null, если дерево не запрошено
 * @param files результаты по файлам, включая ошибочные
 */
public record DigestResult(String root, String tree, List<FileDigest> files) {

    public DigestResult {
        files = List.copyOf(files);
    }

    public List<FileDigest> successful() {
        return files.stream().filter(f -> !f.isFailed()).collect(Collectors.toList());
    }

    public List<FileDigest.FileError> errors() {
        return files.stream().filter(FileDigest::isFailed).map(FileDigest::error).collect(Collectors.toList());
    }
}
