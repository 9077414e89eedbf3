package org.logicflow.graph;

import java.util.*;

/**
 * 由逻辑流树线性化得到的有向图
 * <p>
 * 顶点以节点 id 为键（而非语句文本），值为顶点标签；边表示"紧接着执行"。
 * 分支汇合边和异常处理器边在 edgeLabels 中记录其来源条件。
 */
public class FlowGraph {

    // 顶点：节点 id -> 标签
    private final Map<Integer, String> vertices = new LinkedHashMap<>();

    // 后继边：id -> 后继 id 列表
    private final Map<Integer, List<Integer>> succ = new LinkedHashMap<>();

    // 边标签：边 -> 标签，JSON 中的键为 "from->to"
    private final Map<FlowEdge, String> edgeLabels = new LinkedHashMap<>();

    void addVertex(int id, String label) {
        vertices.put(id, label);
        succ.computeIfAbsent(id, k -> new ArrayList<>());
    }

    void addEdge(int from, int to, String label) {
        List<Integer> targets = succ.computeIfAbsent(from, k -> new ArrayList<>());
        if (!targets.contains(to)) {
            targets.add(to);
        }
        if (label != null) {
            edgeLabels.put(new FlowEdge(from, to), label);
        }
    }

    public Map<Integer, String> vertices() {
        return Collections.unmodifiableMap(vertices);
    }

    public String label(int id) {
        return vertices.get(id);
    }

    public int vertexCount() {
        return vertices.size();
    }

    public List<Integer> successors(int id) {
        return Collections.unmodifiableList(succ.getOrDefault(id, List.of()));
    }

    public List<Integer> predecessors(int id) {
        List<Integer> result = new ArrayList<>();
        succ.forEach((from, tos) -> {
            if (tos.contains(id)) {
                result.add(from);
            }
        });
        return result;
    }

    /** 所有边，按插入顺序 */
    public List<FlowEdge> edges() {
        List<FlowEdge> result = new ArrayList<>();
        succ.forEach((from, tos) -> tos.forEach(to -> result.add(new FlowEdge(from, to))));
        return result;
    }

    public int edgeCount() {
        return succ.values().stream().mapToInt(List::size).sum();
    }

    public boolean hasEdge(int from, int to) {
        return succ.getOrDefault(from, List.of()).contains(to);
    }

    /**
     * 边标签，没有标签时返回 null
     */
    public String edgeLabel(int from, int to) {
        return edgeLabels.get(new FlowEdge(from, to));
    }
}
