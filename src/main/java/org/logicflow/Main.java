package org.logicflow;

import com.github.javaparser.ParserConfiguration.LanguageLevel;
import org.logicflow.export.DotWriter;
import org.logicflow.export.JsonExporter;
import org.logicflow.graph.FlowEdge;
import org.logicflow.graph.FlowGraph;
import org.logicflow.repo.DirectoryNode;
import org.logicflow.repo.FileNode;
import org.logicflow.repo.RepoParser;
import org.logicflow.repo.TreeEntry;
import org.logicflow.tree.TreePrinter;

import java.io.File;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.HashSet;
import java.util.Set;

/**
 * 读取一个 Java 文件或目录，对其中的每个方法：
 * - 构建逻辑流树
 * - 线性化为流图
 * - 打印 / 导出 JSON / 导出 DOT
 * <p>
 * 用法：{@code <path> [--print] [--graph] [--json <file>] [--dot <dir>] [--method <name>] [--keep-going] [--language <level>]}
 */
public class Main {

    public static void main(String[] args) {
        if (args.length == 0) {
            printUsage();
            System.exit(1);
        }

        Path input = null;
        boolean printTree = false;
        boolean printGraph = false;
        Path jsonOutput = null;
        Path dotDirectory = null;
        String methodFilter = null;
        boolean keepGoing = false;
        LanguageLevel languageLevel = FlowConfig.defaults().languageLevel;

        for (int i = 0; i < args.length; i++) {
            switch (args[i]) {
                case "--print" -> printTree = true;
                case "--graph" -> printGraph = true;
                case "--keep-going" -> keepGoing = true;
                case "--json" -> jsonOutput = Path.of(requireValue(args, ++i, "--json"));
                case "--dot" -> dotDirectory = Path.of(requireValue(args, ++i, "--dot"));
                case "--method" -> methodFilter = requireValue(args, ++i, "--method");
                case "--language" -> {
                    String level = requireValue(args, ++i, "--language");
                    try {
                        languageLevel = FlowConfig.parseLanguageLevel(level);
                    } catch (IllegalArgumentException e) {
                        System.err.println("Error: unknown language level " + level);
                        System.exit(1);
                    }
                }
                case "--help", "-h" -> {
                    printUsage();
                    System.exit(0);
                }
                default -> {
                    if (args[i].startsWith("--")) {
                        System.err.println("Unknown option: " + args[i]);
                        System.exit(1);
                    }
                    input = Path.of(args[i]);
                }
            }
        }

        if (input == null) {
            System.err.println("Error: no input path specified");
            printUsage();
            System.exit(1);
        }

        // 没有指定任何输出时默认打印逻辑流树
        if (!printGraph && jsonOutput == null && dotDirectory == null) {
            printTree = true;
        }

        FlowConfig config = new FlowConfig(printTree, printGraph, jsonOutput, dotDirectory,
                methodFilter, keepGoing, languageLevel);

        try {
            run(input, config);
        } catch (Exception e) {
            System.err.println("Error: " + e.getMessage());
            System.exit(1);
        }
    }

    static void run(Path input, FlowConfig config) throws IOException {
        RepoParser repoParser = new RepoParser(new FlowAnalyzer(config), config);
        TreeEntry root = repoParser.parse(input);

        if (config.dotDirectory != null) {
            Files.createDirectories(config.dotDirectory);
        }
        // DOT 文件名使用相对于输入根目录的路径，避免不同目录下的同名文件互相覆盖
        Path absolute = input.toAbsolutePath().normalize();
        Path baseDir = Files.isDirectory(absolute) ? absolute : absolute.getParent();
        report(root, config, baseDir, new HashSet<>());

        if (config.jsonOutput != null) {
            JsonExporter exporter = new JsonExporter();
            exporter.export(exporter.toJson(root), config.jsonOutput);
            System.out.println("JSON written to " + config.jsonOutput);
        }
    }

    private static void report(TreeEntry entry, FlowConfig config, Path baseDir, Set<String> dotNames)
            throws IOException {
        if (entry instanceof DirectoryNode dir) {
            for (TreeEntry child : dir.getChildren()) {
                report(child, config, baseDir, dotNames);
            }
            return;
        }
        FileNode file = (FileNode) entry;
        for (MethodFlow flow : file.getMethods()) {
            if (config.printTree || config.printGraph) {
                System.out.println("===== " + file.getPath() + " : " + flow.name() + " =====");
            }
            if (config.printTree) {
                System.out.print(TreePrinter.print(flow.program()));
            }
            if (config.printGraph) {
                printGraph(flow.graph());
            }
            if (config.dotDirectory != null) {
                Path relative = baseDir.relativize(file.getPath().toAbsolutePath().normalize());
                String name = uniqueName(dotFileName(relative, flow.name()), dotNames);
                Path dot = config.dotDirectory.resolve(name);
                Files.writeString(dot, DotWriter.write(flow.graph(), flow.name()), StandardCharsets.UTF_8);
            }
        }
    }

    private static void printGraph(FlowGraph graph) {
        for (FlowEdge edge : graph.edges()) {
            String label = graph.edgeLabel(edge.from(), edge.to());
            System.out.println("  " + graph.label(edge.from()) + " -> " + graph.label(edge.to())
                    + (label != null ? "  [" + label + "]" : ""));
        }
    }

    /**
     * @param file       相对于输入根目录的源文件路径
     * @param methodName 方法的限定名
     */
    static String dotFileName(Path file, String methodName) {
        String base = file.toString().replace(File.separatorChar, '/').replaceFirst("\\.java$", "");
        return (base + "_" + methodName).replaceAll("[^A-Za-z0-9._-]", "_") + ".dot";
    }

    /**
     * 同一文件里的匿名类方法可能得到相同的限定名，重名时追加序号
     */
    static String uniqueName(String fileName, Set<String> used) {
        String stem = fileName.substring(0, fileName.length() - ".dot".length());
        String candidate = fileName;
        for (int i = 2; !used.add(candidate); i++) {
            candidate = stem + "_" + i + ".dot";
        }
        return candidate;
    }

    private static String requireValue(String[] args, int index, String option) {
        if (index >= args.length) {
            System.err.println("Error: " + option + " requires an argument");
            System.exit(1);
        }
        return args[index];
    }

    private static void printUsage() {
        System.out.println("Logic Flow Graph");
        System.out.println();
        System.out.println("Usage: java -jar logic-flow-graph.jar <file.java|directory> [options]");
        System.out.println();
        System.out.println("Options:");
        System.out.println("  --print             Print the logical flow tree of every method (default)");
        System.out.println("  --graph             Print the flow graph edges of every method");
        System.out.println("  --json <file>       Export trees and graphs as JSON");
        System.out.println("  --dot <dir>         Write one Graphviz DOT file per method");
        System.out.println("  --method <name>     Analyze only methods with this name");
        System.out.println("  --keep-going        Skip files that fail to parse instead of aborting");
        System.out.println("  --language <level>  Java language level, e.g. 17 (default) or 21");
        System.out.println("  --help, -h          Show this help message");
    }
}
