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
package ru.nts.tools.digest;

import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;
import ru.nts.tools.digest.config.ConfigLoader;
import ru.nts.tools.digest.config.DigestConfig;
import ru.nts.tools.digest.config.OutputFormat;
import ru.nts.tools.digest.core.DigestErrorCode;
import ru.nts.tools.digest.core.DigestException;
import ru.nts.tools.digest.core.DigestLog;
import ru.nts.tools.digest.core.treesitter.Language;
import ru.nts.tools.digest.digest.DigestResult;
import ru.nts.tools.digest.digest.DigestRunner;
import ru.nts.tools.digest.digest.DigestWriter;

import java.io.IOException;
import java.io.PrintStream;
import java.io.PrintWriter;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.Callable;

/**
 * Точка входа: печатает дайджест каталога в стандартный вывод.
 *
 * <pre>
 * code-digest [-t] [-i DIR]... [-I GLOB]... [-e EXT=LANG]... &lt;directory&gt;
 * </pre>
 *
 * Коды завершения: 0 успех (в том числе при ошибках отдельных файлов),
 * 1 ошибка параметров или конфигурации, 2 несовместимая грамматика.
 */
@Command(
        name = "code-digest",
        mixinStandardHelpOptions = true,
        version = "code-digest 1.0.0",
        exitCodeOnInvalidInput = CodeDigest.EXIT_USAGE_ERROR,
        description = "Prints a condensed digest of a source tree: declarations, signatures and imports with bodies elided.")
public class CodeDigest implements Callable<Integer> {

    public static final int EXIT_OK = 0;
    public static final int EXIT_USAGE_ERROR = 1;
    public static final int EXIT_FATAL = 2;

    @Parameters(index = "0", paramLabel = "<directory>", description = "The directory containing the source files.")
    Path directory;

    @Option(names = {"-i", "--ignore"}, paramLabel = "DIR", description = "Additional directories to ignore (repeatable; ~ and $VAR are expanded).")
    List<String> ignore = new ArrayList<>();

    @Option(names = {"-I", "--include"}, paramLabel = "GLOB", description = "Files matching the glob are emitted verbatim (repeatable).")
    List<String> include = new ArrayList<>();

    @Option(names = {"-t", "--tree"}, description = "Print the directory tree before the digest.")
    Boolean tree;

    @Option(names = {"-d", "--max-depth"}, paramLabel = "N", description = "Maximum directory depth.")
    Integer maxDepth;

    @Option(names = {"-f", "--format"}, paramLabel = "FORMAT", description = "Output format: markdown or json.")
    String format;

    @Option(names = {"-e", "--extension"}, paramLabel = "EXT=LANG", description = "Map a file extension to a language, e.g. py=python (repeatable).")
    Map<String, String> extensions = new LinkedHashMap<>();

    @Option(names = "--threads", paramLabel = "N", description = "Number of worker threads (default: available processors).")
    Integer threads;

    @Option(names = {"-c", "--config"}, paramLabel = "FILE", description = "JSON config file (default: <directory>/.code-digest.json if present).")
    Path configFile;

    private final PrintStream out;
    private final PrintStream err;
    private final ConfigLoader configLoader;

    public CodeDigest() {
        this(System.out, System.err, new ConfigLoader());
    }

    public CodeDigest(PrintStream out, PrintStream err, ConfigLoader configLoader) {
        this.out = out;
        this.err = err;
        this.configLoader = configLoader;
    }

    public static void main(String[] args) {
        // Windows-консоли по умолчанию не в UTF-8
        System.setOut(new PrintStream(System.out, true, StandardCharsets.UTF_8));
        System.setErr(new PrintStream(System.err, true, StandardCharsets.UTF_8));

        int exitCode = commandLine(new CodeDigest()).execute(args);
        System.exit(exitCode);
    }

    /**
     * CommandLine с выводом справки и ошибок разбора в потоки команды.
     */
    public static CommandLine commandLine(CodeDigest command) {
        CommandLine cmd = new CommandLine(command);
        cmd.setOut(new PrintWriter(command.out, true, StandardCharsets.UTF_8));
        cmd.setErr(new PrintWriter(command.err, true, StandardCharsets.UTF_8));
        return cmd;
    }

    @Override
    public Integer call() {
        if (!Files.isDirectory(directory)) {
            err.println("Not a directory: " + directory);
            return EXIT_USAGE_ERROR;
        }

        try {
            DigestConfig config = buildConfig();
            DigestLog.debug("Digest config: " + config);

            DigestResult result = new DigestRunner(config).run();
            out.print(DigestWriter.forFormat(config.format()).write(result));
            out.flush();
            return EXIT_OK;
        } catch (DigestException e) {
            err.println(e.toUserMessage());
            return e.getCode() == DigestErrorCode.GRAMMAR_INCOMPATIBLE ? EXIT_FATAL : EXIT_USAGE_ERROR;
        } catch (IOException e) {
            DigestException wrapped = new DigestException(DigestErrorCode.IO_ERROR,
                    Map.of("reason", String.valueOf(e.getMessage())), e);
            DigestLog.error(wrapped.toUserMessage(), e);
            return EXIT_USAGE_ERROR;
        }
    }

    /**
     * Значения по умолчанию, затем файл конфигурации, затем опции командной строки.
     */
    DigestConfig buildConfig() {
        DigestConfig.Builder builder = DigestConfig.builder(directory);

        Path config = configLoader.resolveConfigFile(directory, configFile);
        if (config != null) {
            DigestLog.debug("Using config file " + config);
            configLoader.apply(config, builder);
        }

        for (String dir : ignore) {
            builder.ignore(configLoader.expandPath(dir));
        }
        include.forEach(builder::include);
        if (tree != null) {
            builder.tree(tree);
        }
        if (maxDepth != null) {
            builder.maxDepth(maxDepth);
        }
        if (format != null) {
            builder.format(OutputFormat.fromId(format));
        }
        if (threads != null) {
            builder.threads(threads);
        }
        for (Map.Entry<String, String> entry : extensions.entrySet()) {
            Language language = Language.fromId(entry.getValue())
                    .orElseThrow(() -> new DigestException(DigestErrorCode.LANGUAGE_NOT_SUPPORTED,
                            "language", entry.getValue()));
            builder.extension(entry.getKey(), language);
        }
        return builder.build();
    }
}
