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

import java.io.IOException;
import java.nio.file.AccessDeniedException;
import java.nio.file.FileSystemException;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.util.Map;
import java.util.concurrent.TimeUnit;

/**
 * Утилиты для чтения файлов.
 * Реализует Retry Pattern для обхода временных блокировок (Windows, сетевые ФС).
 */
public class FileUtils {

    private static final int MAX_RETRIES = 5;
    private static final long INITIAL_BACKOFF = 50; // ms

    /**
     * Максимальный размер файла для дайджеста (5MB).
     * Файлы большего размера не читаются для предотвращения OOM.
     */
    public static final long MAX_FILE_SIZE_BYTES = 5 * 1024 * 1024;

    /**
     * Выполняет IO-операцию с механизмом повторов.
     * Отсутствующий файл и отказ в доступе пробрасываются сразу.
     */
    public static <T> T executeWithRetry(IORunnable<T> action) throws IOException {
        IOException lastException = null;
        for (int i = 0; i < MAX_RETRIES; i++) {
            try {
                return action.run();
            } catch (NoSuchFileException | AccessDeniedException e) {
                // не временная ошибка, повтор не поможет
                throw e;
            } catch (FileSystemException e) {
                lastException = e;
                long backoff = INITIAL_BACKOFF * (long) Math.pow(2, i);
                try {
                    TimeUnit.MILLISECONDS.sleep(backoff);
                } catch (InterruptedException ie) {
                    Thread.currentThread().interrupt();
                    throw new IOException("Retry interrupted", ie);
                }
            }
        }
        throw lastException;
    }

    /**
     * Безопасное чтение всех байтов файла с проверкой размера.
     *
     * @throws DigestException FILE_TOO_LARGE если файл превышает {@link #MAX_FILE_SIZE_BYTES}
     */
    public static byte[] safeReadAllBytes(Path path) throws IOException {
        long size = Files.size(path);
        if (size > MAX_FILE_SIZE_BYTES) {
            throw new DigestException(DigestErrorCode.FILE_TOO_LARGE,
                    Map.of("path", path.toString(), "size", size, "limit", MAX_FILE_SIZE_BYTES));
        }
        return executeWithRetry(() -> Files.readAllBytes(path));
    }

    @FunctionalInterface
    public interface IORunnable<T> {
        T run() throws IOException;
    }
}
