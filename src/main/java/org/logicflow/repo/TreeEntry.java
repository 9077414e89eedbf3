package org.logicflow.repo;

import java.nio.file.Path;

/**
 * 仓库遍历结果树中的一项：目录或源文件
 */
public abstract class TreeEntry {

    private final Path path;

    protected TreeEntry(Path path) {
        this.path = path;
    }

    public Path getPath() {
        return path;
    }
}
