package org.logicflow.repo;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

public class DirectoryNode extends TreeEntry {

    private final List<TreeEntry> children = new ArrayList<>();

    public DirectoryNode(Path path) {
        super(path);
    }

    void addChild(TreeEntry child) {
        children.add(child);
    }

    public List<TreeEntry> getChildren() {
        return Collections.unmodifiableList(children);
    }

    @Override
    public String toString() {
        return "DirectoryNode(" + getPath() + ")";
    }
}
