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
package ru.nts.tools.digest.core.extraction;

import org.treesitter.TSNode;
import org.treesitter.TSTree;
import ru.nts.tools.digest.core.extraction.TraversalContext.WorkItem;
import ru.nts.tools.digest.core.extraction.selectors.SelectorRegistries;
import ru.nts.tools.digest.core.treesitter.Language;
import ru.nts.tools.digest.core.treesitter.SourceText;
import ru.nts.tools.digest.core.treesitter.TreeSitterManager;

import java.util.List;
import java.util.Optional;

/**
 * Движок выборочного извлечения из синтаксического дерева.
 *
 * <p>Обходит дерево, начиная с корня, и для каждого узла выполняет действие
 * из {@link SelectorRegistry}:
 * <ul>
 *   <li>нет действия - узел отбрасывается вместе с поддеревом;</li>
 *   <li>SELECT_ONLY - потомки ставятся в конец очереди;</li>
 *   <li>CAPTURE_VERBATIM / CAPTURE_ELIDED - текст узла выводится;</li>
 *   <li>CUSTOM - выполняется правило, его ошибка прерывает разбор файла.</li>
 * </ul>
 * Порядок фрагментов - порядок извлечения.
 *
 * <p>Синхронный, без общего изменяемого состояния: один экземпляр можно
 * использовать из нескольких потоков.
 */
public final class TraversalEngine {

    private final ElisionRenderer renderer = new ElisionRenderer();

    /**
     * Разбирает исходный текст реестром по умолчанию для языка.
     *
     * @throws ru.nts.tools.digest.core.DigestException GRAMMAR_INCOMPATIBLE или CUSTOM_ACTION_FAILED
     */
    public List<Fragment> extract(String content, Language language) {
        return extract(content, language, SelectorRegistries.getInstance().forLanguage(language));
    }

    /**
     * Разбирает исходный текст и извлекает фрагменты указанным реестром.
     *
     * @throws ru.nts.tools.digest.core.DigestException GRAMMAR_INCOMPATIBLE или CUSTOM_ACTION_FAILED
     */
    public List<Fragment> extract(String content, Language language, SelectorRegistry registry) {
        TSTree tree = TreeSitterManager.getInstance().parse(content, language);
        return extract(tree, new SourceText(content), registry);
    }

    /**
     * Извлекает фрагменты из уже разобранного дерева.
     */
    public List<Fragment> extract(TSTree tree, SourceText source, SelectorRegistry registry) {
        TraversalContext context = new TraversalContext(registry);
        context.enqueue(tree.getRootNode());

        WorkItem item;
        while ((item = context.next()) != null) {
            if (item.sentinel()) {
                context.closeAccumulation(item);
                continue;
            }
            context.setAccumulating(item.accumulating());
            visit(item.node(), source, registry, context);
        }

        return context.fragments();
    }

    private void visit(TSNode node, SourceText source, SelectorRegistry registry, TraversalContext context) {
        Optional<SelectorAction> found = registry.lookup(node.getType());
        if (found.isEmpty()) {
            return;
        }

        SelectorAction action = found.get();
        switch (action.type()) {
            case SELECT_ONLY -> context.enqueueChildren(node);
            case CAPTURE_VERBATIM -> context.emit(source.text(node).trim(), node);
            case CAPTURE_ELIDED -> context.emit(renderer.render(node, source, registry), node);
            case CUSTOM -> action.rule().apply(node, source, context)
                    .ifPresent(text -> context.emit(text, node));
        }
    }
}
