package org.logicflow.repo;

import org.logicflow.MethodFlow;

import java.nio.file.Path;
import java.util.List;

/**
 * 一个已分析的 Java 源文件，持有其中每个方法的逻辑流树和流图
 */
public class FileNode extends TreeEntry {

    private final List<MethodFlow> methods;

    public FileNode(Path path, List<MethodFlow> methods) {
        super(path);
        this.methods = List.copyOf(methods);
    }

    public List<MethodFlow> getMethods() {
        return methods;
    }

    @Override
    public String toString() {
        return "FileNode(" + getPath() + ", " + methods.size() + " methods)";
    }
}
