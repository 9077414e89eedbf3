package org.logicflow.export;

import org.logicflow.graph.FlowEdge;
import org.logicflow.graph.FlowGraph;

/**
 * 把流图输出为 Graphviz DOT 文本，布局交给 dot 工具
 */
public class DotWriter {

    public static String write(FlowGraph graph) {
        return write(graph, "flow");
    }

    public static String write(FlowGraph graph, String name) {
        StringBuilder sb = new StringBuilder();
        sb.append("digraph \"").append(escape(name)).append("\" {\n");
        sb.append("  node [shape=box];\n");
        graph.vertices().forEach((id, label) ->
                sb.append("  n").append(id).append(" [label=\"").append(escape(label)).append("\"];\n"));
        for (FlowEdge edge : graph.edges()) {
            sb.append("  n").append(edge.from()).append(" -> n").append(edge.to());
            String label = graph.edgeLabel(edge.from(), edge.to());
            if (label != null) {
                sb.append(" [label=\"").append(escape(label)).append("\"]");
            }
            sb.append(";\n");
        }
        sb.append("}\n");
        return sb.toString();
    }

    static String escape(String text) {
        if (text == null) {
            return "";
        }
        return text.replace("\\", "\\\\")
                .replace("\"", "\\\"")
                .replace("\n", "\\n");
    }
}
