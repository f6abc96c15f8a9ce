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
import ru.nts.tools.digest.core.treesitter.NodeUtils;
import ru.nts.tools.digest.core.treesitter.SourceText;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Deque;
import java.util.List;

/**
 * Изменяемое состояние одного обхода дерева.
 * Создается заново на каждый разбор и никогда не разделяется между потоками.
 *
 * <p>Две дисциплины очереди:
 * <ul>
 *   <li>siblings - добавление в конец, обход в ширину по обычным соседям;</li>
 *   <li>immediate - добавление в начало, немедленный спуск по запросу custom-правила.</li>
 * </ul>
 * {@link #next()} всегда сначала опустошает immediate.
 */
public final class TraversalContext {

    /**
     * Элемент очереди: узел или маркер закрытия накопления (sentinel).
     *
     * @param node         узел (null для sentinel)
     * @param accumulating для узла - выводить в накопитель; для sentinel - был ли накапливающим открывший узел
     * @param sentinel     true для маркера
     */
    record WorkItem(TSNode node, boolean accumulating, boolean sentinel) {

        static WorkItem node(TSNode node, boolean accumulating) {
            return new WorkItem(node, accumulating, false);
        }

        static WorkItem sentinel(boolean parentAccumulating) {
            return new WorkItem(null, parentAccumulating, true);
        }
    }

    /**
     * Открытое накопление: заголовок и члены, которые сольются в один фрагмент.
     */
    private static final class Accumulator {
        private final String kind;
        private final int line;
        private final List<String> parts = new ArrayList<>();

        Accumulator(String kind, int line, String header) {
            this.kind = kind;
            this.line = line;
            parts.add(header);
        }

        String render(Indentation indentation) {
            StringBuilder sb = new StringBuilder(parts.get(0));
            for (int i = 1; i < parts.size(); i++) {
                String member = parts.get(i);
                if (member.isEmpty()) continue;
                if (sb.length() > 0) sb.append('\n');
                sb.append(indentation.indent(member));
            }
            return sb.toString();
        }
    }

    private final SelectorRegistry registry;

    private final Deque<WorkItem> siblings = new ArrayDeque<>();
    private final Deque<WorkItem> immediate = new ArrayDeque<>();
    private final Deque<Accumulator> accumulators = new ArrayDeque<>();
    private final List<Fragment> fragments = new ArrayList<>();

    private boolean accumulating;

    TraversalContext(SelectorRegistry registry) {
        this.registry = registry;
    }

    public SelectorRegistry registry() {
        return registry;
    }

    /**
     * Выводится ли текущий узел в открытое накопление.
     */
    public boolean isAccumulating() {
        return accumulating;
    }

    void setAccumulating(boolean accumulating) {
        this.accumulating = accumulating;
    }

    /**
     * Ставит узел в конец очереди соседей (не накапливающий).
     */
    void enqueue(TSNode node) {
        siblings.addLast(WorkItem.node(node, false));
    }

    /**
     * Ставит всех прямых потомков узла в конец очереди соседей (не накапливающие).
     */
    public void enqueueChildren(TSNode node) {
        for (TSNode child : NodeUtils.children(node)) {
            enqueue(child);
        }
    }

    /**
     * Немедленный спуск: узлы будут обработаны до любых ранее поставленных соседей,
     * в переданном порядке. Накопление не открывается.
     */
    public void descendImmediately(List<TSNode> nodes) {
        for (int i = nodes.size() - 1; i >= 0; i--) {
            immediate.addFirst(WorkItem.node(nodes.get(i), false));
        }
    }

    /**
     * Открывает накопление: заголовок и результаты обработки {@code members}
     * сольются в один фрагмент, который закроет sentinel.
     *
     * <p>В начало очереди ставится sentinel, а перед ним - члены в исходном порядке
     * как накапливающие узлы. Если текущий узел сам накапливающий,
     * закрытый фрагмент уйдет в объемлющее накопление.
     *
     * @param origin  узел, открывший накопление
     * @param header  заголовок (например, текст класса до начала тела)
     * @param members узлы, результат которых дописывается в накопление
     */
    public void beginAccumulation(TSNode origin, String header, List<TSNode> members) {
        accumulators.push(new Accumulator(origin.getType(), SourceText.lineOf(origin), header));
        immediate.addFirst(WorkItem.sentinel(accumulating));
        for (int i = members.size() - 1; i >= 0; i--) {
            immediate.addFirst(WorkItem.node(members.get(i), true));
        }
    }

    /**
     * Маршрутизирует результат захвата: в открытое накопление или отдельным фрагментом.
     */
    public void emit(String text, TSNode origin) {
        if (accumulating && !accumulators.isEmpty()) {
            accumulators.peek().parts.add(text);
        } else {
            fragments.add(new Fragment(text, origin.getType(), SourceText.lineOf(origin)));
        }
    }

    /**
     * Следующий элемент работы или null если обе очереди пусты.
     */
    WorkItem next() {
        if (!immediate.isEmpty()) {
            return immediate.pollFirst();
        }
        return siblings.pollFirst();
    }

    /**
     * Закрывает текущее накопление ровно в один фрагмент (даже пустой).
     */
    void closeAccumulation(WorkItem sentinel) {
        Accumulator closed = accumulators.pop();
        String text = closed.render(registry.indentation());
        if (sentinel.accumulating() && !accumulators.isEmpty()) {
            accumulators.peek().parts.add(text);
        } else {
            fragments.add(new Fragment(text, closed.kind, closed.line));
        }
    }

    List<Fragment> fragments() {
        return Collections.unmodifiableList(fragments);
    }
}
