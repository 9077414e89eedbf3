package org.logicflow;

import com.github.javaparser.JavaParser;
import com.github.javaparser.ast.CompilationUnit;
import com.github.javaparser.ast.Node;
import com.github.javaparser.ast.body.CallableDeclaration;
import com.github.javaparser.ast.body.ConstructorDeclaration;
import com.github.javaparser.ast.body.MethodDeclaration;
import com.github.javaparser.ast.body.TypeDeclaration;
import com.github.javaparser.ast.stmt.BlockStmt;
import org.logicflow.graph.FlowGraph;
import org.logicflow.graph.GraphBuilder;
import org.logicflow.model.ProgramNode;
import org.logicflow.source.JavaStatementReader;
import org.logicflow.source.SourceStmt;
import org.logicflow.tree.TreeBuilder;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.logging.Logger;

/**
 * 方法分析器
 * <p>
 * 解析 Java 源码，对其中每个带方法体的方法和构造器：
 * 把方法体降级为通用语句，构建逻辑流树，再线性化为流图。
 */
public class FlowAnalyzer {

    private static final Logger LOGGER = Logger.getLogger(FlowAnalyzer.class.getName());

    private final FlowConfig config;
    private final JavaParser parser;
    private final JavaStatementReader reader = new JavaStatementReader();

    public FlowAnalyzer(FlowConfig config) {
        this.config = config;
        this.parser = new JavaParser(config.toParserConfiguration());
    }

    public List<MethodFlow> analyzeFile(Path file) throws IOException {
        return analyzeSource(Files.readString(file, StandardCharsets.UTF_8), file.toString());
    }

    /**
     * @param source Java 源码
     * @param origin 来源描述，用于错误信息
     * @return 按源码顺序排列的各方法分析结果
     */
    public List<MethodFlow> analyzeSource(String source, String origin) {
        CompilationUnit cu = SyntaxValidator.requireValid(parser.parse(source), origin);
        return analyze(cu);
    }

    public List<MethodFlow> analyze(CompilationUnit cu) {
        List<MethodFlow> flows = new ArrayList<>();
        // 先序遍历，结果即源码顺序
        for (Node n : cu.findAll(Node.class, node -> node instanceof MethodDeclaration || node instanceof ConstructorDeclaration)) {
            if (n instanceof MethodDeclaration md) {
                if (md.getBody().isPresent() && config.acceptsMethod(md.getNameAsString())) {
                    flows.add(analyzeBody(md, md.getBody().get()));
                }
            } else if (n instanceof ConstructorDeclaration cd && config.acceptsMethod(cd.getNameAsString())) {
                flows.add(analyzeBody(cd, cd.getBody()));
            }
        }
        return flows;
    }

    private MethodFlow analyzeBody(CallableDeclaration<?> declaration, BlockStmt body) {
        String name = qualifiedName(declaration);
        LOGGER.fine(() -> "Analyzing " + name);

        List<SourceStmt> statements = reader.read(body);
        ProgramNode program = new TreeBuilder().build(statements);
        FlowGraph graph = GraphBuilder.build(program);

        int line = declaration.getBegin().map(p -> p.line).orElse(-1);
        return new MethodFlow(name, line, program, graph);
    }

    private static String qualifiedName(CallableDeclaration<?> declaration) {
        String owner = declaration.findAncestor(TypeDeclaration.class)
                .map(t -> ((TypeDeclaration<?>) t).getNameAsString())
                .orElse("");
        return owner + "#" + declaration.getSignature().asString();
    }
}
