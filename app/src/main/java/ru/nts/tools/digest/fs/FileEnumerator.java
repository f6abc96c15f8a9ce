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
package ru.nts.tools.digest.fs;

import org.eclipse.jgit.ignore.IgnoreNode;
import ru.nts.tools.digest.core.DigestErrorCode;
import ru.nts.tools.digest.core.DigestException;
import ru.nts.tools.digest.core.DigestLog;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.AccessDeniedException;
import java.nio.file.Files;
import java.nio.file.LinkOption;
import java.nio.file.Path;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.Deque;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * Обход дерева каталогов в прямом порядке (pre-order), соседи отсортированы по имени.
 *
 * Исключаются:
 * 1. Каталог {@code .git}.
 * 2. Пути, проигнорированные файлами {@code .gitignore} (корневым и вложенными).
 *    Ближайший к пути .gitignore имеет приоритет, как в git.
 * 3. Пользовательские каталоги игнорирования: имя без разделителей совпадает с любым
 *    каталогом с таким именем, путь сравнивается после разрешения от текущего каталога и от корня.
 * 4. Символические ссылки на каталоги (без обхода).
 */
public class FileEnumerator {

    public static final String GITIGNORE = ".gitignore";
    private static final String GIT_DIR = ".git";

    private final Path root;
    private final Set<Path> ignoredPaths = new HashSet<>();
    private final Set<String> ignoredNames = new HashSet<>();
    private final int maxDepth;

    /**
     * @param root       корень обхода
     * @param ignoreDirs дополнительные каталоги для исключения
     * @param maxDepth   максимальная глубина (отрицательное значение - без ограничения)
     */
    public FileEnumerator(Path root, Collection<Path> ignoreDirs, int maxDepth) {
        this.root = root.toAbsolutePath().normalize();
        this.maxDepth = maxDepth;
        for (Path dir : ignoreDirs) {
            if (!dir.isAbsolute() && dir.getNameCount() == 1) {
                ignoredNames.add(dir.toString());
            }
            if (dir.isAbsolute()) {
                ignoredPaths.add(dir.normalize());
            } else {
                ignoredPaths.add(dir.toAbsolutePath().normalize());
                ignoredPaths.add(this.root.resolve(dir).normalize());
            }
        }
    }

    public FileEnumerator(Path root) {
        this(root, List.of(), -1);
    }

    public Path getRoot() {
        return root;
    }

    /**
     * Возвращает корень (глубина 0) и все не исключенные элементы под ним.
     *
     * @throws DigestException DIRECTORY_NOT_FOUND если корень не является каталогом
     */
    public List<FileEntry> enumerate() throws IOException {
        if (!Files.isDirectory(root)) {
            throw new DigestException(DigestErrorCode.DIRECTORY_NOT_FOUND, "path", root.toString());
        }

        List<FileEntry> result = new ArrayList<>();
        result.add(new FileEntry(Path.of(""), root, FileEntry.Kind.DIRECTORY, 0));
        walk(root, 1, new ArrayDeque<>(), result);
        return result;
    }

    private void walk(Path dir, int depth, Deque<IgnoreScope> scopes, List<FileEntry> result) throws IOException {
        if (maxDepth >= 0 && depth > maxDepth) {
            return;
        }

        IgnoreNode node = loadGitignore(dir);
        if (node != null) {
            scopes.push(new IgnoreScope(dir, node));
        }
        try {
            for (Path child : listSorted(dir)) {
                if (Files.isSymbolicLink(child) && Files.isDirectory(child)) {
                    DigestLog.debug("Skipping directory symlink: " + child);
                    continue;
                }
                boolean isDir = Files.isDirectory(child, LinkOption.NOFOLLOW_LINKS);
                if (isExcluded(child, isDir, scopes)) {
                    continue;
                }

                FileEntry.Kind kind = isDir ? FileEntry.Kind.DIRECTORY : FileEntry.Kind.FILE;
                result.add(new FileEntry(root.relativize(child), child, kind, depth));
                if (isDir) {
                    walk(child, depth + 1, scopes, result);
                }
            }
        } finally {
            if (node != null) {
                scopes.pop();
            }
        }
    }

    private List<Path> listSorted(Path dir) throws IOException {
        try (Stream<Path> stream = Files.list(dir)) {
            return stream
                    .sorted(Comparator.comparing(p -> p.getFileName().toString()))
                    .collect(Collectors.toList());
        } catch (AccessDeniedException e) {
            DigestLog.warn("Cannot read directory " + dir + ": access denied");
            return List.of();
        }
    }

    private boolean isExcluded(Path path, boolean isDir, Deque<IgnoreScope> scopes) {
        String name = path.getFileName().toString();
        if (isDir && (name.equals(GIT_DIR) || ignoredNames.contains(name) || ignoredPaths.contains(path))) {
            return true;
        }

        // Ближайший .gitignore первым
        for (IgnoreScope scope : scopes) {
            String relative = scope.dir().relativize(path).toString().replace('\\', '/');
            switch (scope.node().isIgnored(relative, isDir)) {
                case IGNORED:
                    return true;
                case NOT_IGNORED:
                    return false;
                default:
                    break;
            }
        }
        return false;
    }

    private IgnoreNode loadGitignore(Path dir) throws IOException {
        Path gitignore = dir.resolve(GITIGNORE);
        if (!Files.isRegularFile(gitignore)) {
            return null;
        }
        IgnoreNode node = new IgnoreNode();
        try (InputStream in = Files.newInputStream(gitignore)) {
            node.parse(in);
        }
        return node;
    }

    private record IgnoreScope(Path dir, IgnoreNode node) {
    }
}
