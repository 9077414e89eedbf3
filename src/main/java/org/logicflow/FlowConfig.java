package org.logicflow;

import com.github.javaparser.ParserConfiguration;
import com.github.javaparser.ParserConfiguration.LanguageLevel;

import java.nio.file.Path;

/**
 * 命令行参数对应的分析配置，传递给所有组件
 */
public class FlowConfig {
    public final boolean printTree;
    public final boolean printGraph;
    public final Path jsonOutput;     // null 表示不导出 JSON
    public final Path dotDirectory;   // null 表示不导出 DOT
    public final String methodFilter; // null 表示分析所有方法
    public final boolean keepGoing;
    public final LanguageLevel languageLevel;

    public FlowConfig(boolean printTree, boolean printGraph, Path jsonOutput, Path dotDirectory,
                      String methodFilter, boolean keepGoing, LanguageLevel languageLevel) {
        this.printTree = printTree;
        this.printGraph = printGraph;
        this.jsonOutput = jsonOutput;
        this.dotDirectory = dotDirectory;
        this.methodFilter = methodFilter;
        this.keepGoing = keepGoing;
        this.languageLevel = languageLevel;
    }

    public static FlowConfig defaults() {
        return new FlowConfig(false, false, null, null, null, false, LanguageLevel.JAVA_17);
    }

    public boolean acceptsMethod(String methodName) {
        return methodFilter == null || methodFilter.equals(methodName);
    }

    /**
     * 生成 JavaParser 配置。注释不挂到节点上，这样语句文本里不会带注释。
     */
    public ParserConfiguration toParserConfiguration() {
        return new ParserConfiguration()
                .setLanguageLevel(languageLevel)
                .setAttributeComments(false);
    }

    /**
     * 解析 "17"、"JAVA_17" 这样的语言级别
     */
    public static LanguageLevel parseLanguageLevel(String value) {
        String normalized = value.trim().toUpperCase();
        if (!normalized.startsWith("JAVA_")) {
            normalized = "JAVA_" + normalized.replace('.', '_');
        }
        return LanguageLevel.valueOf(normalized);
    }
}
