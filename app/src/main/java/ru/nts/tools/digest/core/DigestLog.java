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

import java.io.FileWriter;
import java.io.IOException;
import java.io.PrintWriter;
import java.time.LocalDateTime;

/**
 * Журнал работы утилиты.
 * stdout зарезервирован под сам дайджест, поэтому все сообщения идут в stderr
 * или в файл.
 *
 * Отладочный вывод включается переменной окружения CODE_DIGEST_DEBUG=true,
 * файл журнала задается через CODE_DIGEST_LOG_FILE.
 */
public final class DigestLog {

    /**
     * Флаг включения отладочной информации в stderr.
     */
    private static final boolean DEBUG = "true".equalsIgnoreCase(System.getenv("CODE_DIGEST_DEBUG"));

    /**
     * Путь к файлу логов. Если установлен CODE_DIGEST_LOG_FILE, логи дублируются в файл.
     */
    private static final String LOG_FILE = System.getenv("CODE_DIGEST_LOG_FILE");
    private static PrintWriter logWriter = null;

    static {
        if (LOG_FILE != null && !LOG_FILE.isBlank()) {
            try {
                logWriter = new PrintWriter(new FileWriter(LOG_FILE, true), true);
            } catch (IOException e) {
                System.err.println("Cannot open log file " + LOG_FILE + ": " + e.getMessage());
            }
        }
    }

    private DigestLog() {}

    /**
     * Отладочное сообщение: в stderr только при CODE_DIGEST_DEBUG, в файл всегда.
     */
    public static void debug(String message) {
        toFile("DEBUG", message);
        if (DEBUG) {
            System.err.println(message);
        }
    }

    /**
     * Предупреждение: всегда выводится в stderr.
     */
    public static void warn(String message) {
        toFile("WARN", message);
        System.err.println(message);
    }

    /**
     * Ошибка с причиной. Стек печатается только в режиме отладки.
     */
    public static void error(String message, Throwable cause) {
        toFile("ERROR", message + ": " + cause);
        System.err.println(message);
        if (DEBUG && cause != null) {
            cause.printStackTrace();
        }
    }

    private static synchronized void toFile(String level, String message) {
        if (logWriter != null) {
            logWriter.println("[" + LocalDateTime.now() + "] [" + level + "] [" + Thread.currentThread().getName() + "] " + message);
        }
    }
}
