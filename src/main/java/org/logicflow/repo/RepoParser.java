package org.logicflow.repo;

import org.logicflow.FlowAnalyzer;
import org.logicflow.FlowConfig;
import org.logicflow.error.FlowException;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.logging.Level;
import java.util.logging.Logger;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * 递归遍历目录，按 .gitignore 规则过滤后分析其中的每个 Java 源文件
 */
public class RepoParser {

    private static final Logger LOGGER = Logger.getLogger(RepoParser.class.getName());

    private static final String GITIGNORE = ".gitignore";
    private static final String JAVA_SUFFIX = ".java";

    private final FlowAnalyzer analyzer;
    private final FlowConfig config;
    private final List<GitignoreFilter> filters = new ArrayList<>();

    public RepoParser(FlowAnalyzer analyzer, FlowConfig config) {
        this.analyzer = analyzer;
        this.config = config;
    }

    /**
     * 分析一个文件或目录
     *
     * @param path 入口路径
     * @return 文件返回 {@link FileNode}，目录返回 {@link DirectoryNode}
     * @throws FlowException 路径不存在、不是 Java 文件，或某个文件分析失败（未开启 keepGoing 时）
     */
    public TreeEntry parse(Path path) throws IOException {
        filters.clear();
        if (!Files.exists(path)) {
            throw new FlowException("Path '" + path.toAbsolutePath() + "' does not exist");
        }
        if (Files.isDirectory(path)) {
            return parseDirectory(path);
        }
        if (!isJavaFile(path)) {
            throw new FlowException("File '" + path.toAbsolutePath() + "' is not a " + JAVA_SUFFIX + " file");
        }
        return parseFile(path);
    }

    /**
     * 读取失败（例如不是合法的 UTF-8）和分析失败一样，包装为带文件路径的 FlowException
     */
    private FileNode parseFile(Path file) {
        try {
            return new FileNode(file, analyzer.analyzeFile(file));
        } catch (FlowException | IOException e) {
            throw new FlowException("Failed to parse code in file '" + file.toAbsolutePath() + "'. " + describe(e), e);
        }
    }

    private static String describe(Exception e) {
        return e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName();
    }

    private DirectoryNode parseDirectory(Path dir) throws IOException {
        DirectoryNode parent = new DirectoryNode(dir);

        List<Path> children;
        try (Stream<Path> listing = Files.list(dir)) {
            // 文件在前、目录在后，各自按名称排序
            children = listing
                    .sorted(Comparator.comparing((Path p) -> Files.isDirectory(p))
                            .thenComparing(p -> p.getFileName().toString()))
                    .collect(Collectors.toList());
        }

        // 先加载本目录的 .gitignore
        for (Path child : children) {
            if (Files.isRegularFile(child) && GITIGNORE.equals(child.getFileName().toString())) {
                filters.add(GitignoreFilter.load(child));
            }
        }

        for (Path child : children) {
            if (GITIGNORE.equals(child.getFileName().toString()) || isIgnored(child)) {
                continue;
            }
            if (Files.isDirectory(child)) {
                parent.addChild(parseDirectory(child));
            } else if (isJavaFile(child)) {
                try {
                    parent.addChild(parseFile(child));
                } catch (FlowException e) {
                    if (!config.keepGoing) {
                        throw e;
                    }
                    LOGGER.log(Level.WARNING, "Skipping " + child + ": " + e.getMessage());
                }
            }
        }
        return parent;
    }

    private boolean isIgnored(Path path) {
        for (GitignoreFilter filter : filters) {
            if (!filter.test(path)) {
                LOGGER.fine(() -> "Ignored " + path);
                return true;
            }
        }
        return false;
    }

    private static boolean isJavaFile(Path path) {
        return Files.isRegularFile(path) && path.getFileName().toString().endsWith(JAVA_SUFFIX);
    }
}
