package org.logicflow.export;

import com.google.gson.Gson;
import com.google.gson.GsonBuilder;
import com.google.gson.JsonArray;
import com.google.gson.JsonElement;
import com.google.gson.JsonObject;
import org.logicflow.MethodFlow;
import org.logicflow.error.UnsupportedNodeException;
import org.logicflow.graph.FlowGraph;
import org.logicflow.model.*;
import org.logicflow.repo.DirectoryNode;
import org.logicflow.repo.FileNode;
import org.logicflow.repo.TreeEntry;

import java.io.IOException;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

/**
 * 把逻辑流树、流图和仓库遍历结果导出为 JSON
 */
public class JsonExporter {

    private final Gson gson = new GsonBuilder()
            .setPrettyPrinting()
            .disableHtmlEscaping()
            .create();

    public JsonArray toJson(ProgramNode program) {
        return toJsonArray(program.getChildren());
    }

    public JsonObject toJson(LogicalNode node) {
        JsonObject json = node.accept(new LogicalNodeVisitor<JsonObject>() {
            @Override
            public JsonObject visitInstruction(InstructionNode n) {
                JsonObject o = typed("instruction");
                o.addProperty("value", n.getKey());
                return o;
            }

            @Override
            public JsonObject visitLoop(LoopNode n) {
                JsonObject o = typed("loop");
                o.add("value", keyed(n.getKey(), n.getChildren()));
                return o;
            }

            @Override
            public JsonObject visitBranch(BranchNode n) {
                JsonObject o = typed("branch");
                o.add("value", labeled(n.getBranches(), "condition"));
                return o;
            }

            @Override
            public JsonObject visitTry(TryNode n) {
                JsonObject value = new JsonObject();
                value.add("try", toJsonArray(n.getTryBody()));
                value.add("exceptions", labeled(n.getHandlers(), "exception"));
                value.add("else", toJsonArray(n.getElseBody()));
                value.add("finally", toJsonArray(n.getFinallyBody()));
                JsonObject o = typed("try-except");
                o.add("value", value);
                return o;
            }

            @Override
            public JsonObject visitWith(WithNode n) {
                JsonObject o = typed("with");
                o.add("value", keyed(n.getKey(), n.getChildren()));
                return o;
            }
        });
        json.addProperty("line", node.getLine());
        json.addProperty("column", node.getColumn());
        return json;
    }

    /**
     * 流图直接按字段反射序列化
     */
    public JsonElement toJson(FlowGraph graph) {
        return gson.toJsonTree(graph);
    }

    public JsonObject toJson(MethodFlow flow) {
        JsonObject o = new JsonObject();
        o.addProperty("name", flow.name());
        o.addProperty("line", flow.line());
        o.add("tree", toJson(flow.program()));
        o.add("graph", toJson(flow.graph()));
        return o;
    }

    /**
     * @throws UnsupportedNodeException 遇到未知的条目类型时抛出
     */
    public JsonObject toJson(TreeEntry entry) {
        JsonObject o = new JsonObject();
        o.addProperty("path", entry.getPath().toString());
        if (entry instanceof DirectoryNode dir) {
            o.addProperty("type", "directory");
            JsonArray children = new JsonArray();
            dir.getChildren().forEach(child -> children.add(toJson(child)));
            o.add("children", children);
        } else if (entry instanceof FileNode file) {
            o.addProperty("type", "file");
            JsonArray methods = new JsonArray();
            file.getMethods().forEach(flow -> methods.add(toJson(flow)));
            o.add("methods", methods);
        } else {
            throw new UnsupportedNodeException("Unsupported entry type '" + entry.getClass().getName() + "'");
        }
        return o;
    }

    public String write(JsonElement json) {
        return gson.toJson(json);
    }

    public void export(JsonElement json, Path path) throws IOException {
        try (Writer writer = Files.newBufferedWriter(path, StandardCharsets.UTF_8)) {
            gson.toJson(json, writer);
        }
    }

    private JsonArray toJsonArray(List<LogicalNode> nodes) {
        JsonArray array = new JsonArray();
        nodes.forEach(child -> array.add(toJson(child)));
        return array;
    }

    private JsonObject keyed(String key, List<LogicalNode> children) {
        JsonObject o = new JsonObject();
        o.add(key, toJsonArray(children));
        return o;
    }

    private JsonArray labeled(List<LabeledBody> bodies, String labelName) {
        JsonArray array = new JsonArray();
        for (LabeledBody body : bodies) {
            JsonObject o = new JsonObject();
            o.addProperty(labelName, body.label());
            o.add("body", toJsonArray(body.nodes()));
            array.add(o);
        }
        return array;
    }

    private static JsonObject typed(String type) {
        JsonObject o = new JsonObject();
        o.addProperty("type", type);
        return o;
    }
}
