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
package ru.nts.tools.digest.core.treesitter;

import org.treesitter.TSLanguage;
import org.treesitter.TSParser;
import org.treesitter.TSTree;
import org.treesitter.TreeSitterGo;
import org.treesitter.TreeSitterPython;
import org.treesitter.TreeSitterRust;
import ru.nts.tools.digest.core.DigestException;
import ru.nts.tools.digest.core.DigestLog;

import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Менеджер tree-sitter парсеров (адаптер грамматик).
 * Превращает исходный текст в синтаксическое дерево для указанного языка.
 * Thread-safe через ThreadLocal парсеров.
 */
public final class TreeSitterManager {

    private static final TreeSitterManager INSTANCE = new TreeSitterManager();

    /**
     * Кэшированные TSLanguage объекты (потокобезопасные, можно переиспользовать).
     */
    private final Map<Language, TSLanguage> languages = new ConcurrentHashMap<>();

    /**
     * ThreadLocal парсеры для каждого языка (TSParser не thread-safe).
     */
    private final Map<Language, ThreadLocal<TSParser>> parsers = new ConcurrentHashMap<>();

    private TreeSitterManager() {}

    public static TreeSitterManager getInstance() {
        return INSTANCE;
    }

    /**
     * Получает TSLanguage объект для указанного языка.
     * Ленивая загрузка - нативная грамматика загружается только при первом обращении.
     *
     * @throws DigestException GRAMMAR_INCOMPATIBLE если нативная грамматика не загружается
     */
    public TSLanguage getLanguage(Language language) {
        return languages.computeIfAbsent(language, this::loadLanguage);
    }

    /**
     * Загружает TSLanguage из tree-sitter библиотеки.
     */
    private TSLanguage loadLanguage(Language language) {
        try {
            return switch (language) {
                case GO -> new TreeSitterGo();
                case RUST -> new TreeSitterRust();
                case PYTHON -> new TreeSitterPython();
            };
        } catch (LinkageError e) {
            throw DigestException.grammarIncompatible(language.id(), e);
        }
    }

    /**
     * Проверяет, что грамматика загружается и принимается рантаймом.
     * Вызывается один раз до начала параллельной обработки файлов.
     *
     * @throws DigestException GRAMMAR_INCOMPATIBLE при несовпадении ABI
     */
    public void verify(Language language) {
        newParser(language);
        DigestLog.debug("Grammar verified: " + language.id());
    }

    /**
     * Создает TSParser, настроенный на указанный язык.
     */
    private TSParser newParser(Language language) {
        TSLanguage tsLanguage = getLanguage(language);
        TSParser parser = new TSParser();
        boolean accepted;
        try {
            accepted = parser.setLanguage(tsLanguage);
        } catch (LinkageError e) {
            throw DigestException.grammarIncompatible(language.id(), e);
        }
        if (!accepted) {
            throw DigestException.grammarIncompatible(language.id(), null);
        }
        return parser;
    }

    /**
     * Получает или создает TSParser для текущего потока.
     */
    private TSParser getParser(Language language) {
        ThreadLocal<TSParser> parserHolder = parsers.computeIfAbsent(language,
                k -> ThreadLocal.withInitial(() -> newParser(k)));
        return parserHolder.get();
    }

    /**
     * Парсит строку содержимого и возвращает AST дерево.
     * Грамматики устойчивы к ошибкам: синтаксически некорректный код
     * все равно дает дерево (с ERROR узлами).
     *
     * @param content исходный код
     * @param language язык
     * @return AST дерево
     * @throws DigestException GRAMMAR_INCOMPATIBLE если грамматика не совместима с рантаймом
     */
    public TSTree parse(String content, Language language) {
        TSParser parser = getParser(language);
        TSTree tree = parser.parseString(null, content);
        if (tree == null) {
            throw new IllegalStateException("Failed to parse content for language: " + language.id());
        }
        return tree;
    }
}
