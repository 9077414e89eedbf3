package org.logicflow.source;

import java.util.List;

/**
 * 语言前端产出的通用语句，是逻辑流树构建器的唯一输入
 * <p>
 * 复合语句的结构字段（body、test 等）在语法上必然存在；为 null 表示输入不完整，
 * 构建器会据此报错。orelse / handlers / finalBody 为 null 与为空等价。
 */
public final class SourceStmt {

    private final StmtKind kind;
    private final String text;
    private final int line;
    private final int column;
    private final String test;
    private final String target;
    private final String iterable;
    private final List<String> items;
    private final List<SourceStmt> body;
    private final List<SourceStmt> orelse;
    private final List<ExceptHandler> handlers;
    private final List<SourceStmt> finalBody;

    private SourceStmt(Builder b) {
        this.kind = b.kind;
        this.text = b.text;
        this.line = b.line;
        this.column = b.column;
        this.test = b.test;
        this.target = b.target;
        this.iterable = b.iterable;
        this.items = b.items;
        this.body = b.body;
        this.orelse = b.orelse;
        this.handlers = b.handlers;
        this.finalBody = b.finalBody;
    }

    public static Builder builder(StmtKind kind) {
        return new Builder(kind);
    }

    /** 简单语句 */
    public static SourceStmt simple(StmtKind kind, String text, int line, int column) {
        return builder(kind).text(text).at(line, column).build();
    }

    public static SourceStmt ifStmt(String test, List<SourceStmt> body, List<SourceStmt> orelse, int line, int column) {
        return builder(StmtKind.IF).text("if " + test).test(test).body(body).orelse(orelse).at(line, column).build();
    }

    public static SourceStmt forStmt(String target, String iterable, List<SourceStmt> body, int line, int column) {
        return builder(StmtKind.FOR).text("for " + target + " in " + iterable)
                .target(target).iterable(iterable).body(body).at(line, column).build();
    }

    public static SourceStmt whileStmt(String test, List<SourceStmt> body, int line, int column) {
        return builder(StmtKind.WHILE).text("while " + test).test(test).body(body).at(line, column).build();
    }

    public static SourceStmt tryStmt(List<SourceStmt> body, List<ExceptHandler> handlers,
                                     List<SourceStmt> orelse, List<SourceStmt> finalBody, int line, int column) {
        return builder(StmtKind.TRY).text("try").body(body).handlers(handlers)
                .orelse(orelse).finalBody(finalBody).at(line, column).build();
    }

    public static SourceStmt withStmt(List<String> items, List<SourceStmt> body, int line, int column) {
        return builder(StmtKind.WITH).text("with " + String.join(", ", items))
                .items(items).body(body).at(line, column).build();
    }

    public StmtKind getKind() {
        return kind;
    }

    /** 语句的源码文本 */
    public String getText() {
        return text;
    }

    public int getLine() {
        return line;
    }

    public int getColumn() {
        return column;
    }

    public String getTest() {
        return test;
    }

    public String getTarget() {
        return target;
    }

    public String getIterable() {
        return iterable;
    }

    public List<String> getItems() {
        return items;
    }

    public List<SourceStmt> getBody() {
        return body;
    }

    public List<SourceStmt> getOrelse() {
        return orelse;
    }

    public List<ExceptHandler> getHandlers() {
        return handlers;
    }

    public List<SourceStmt> getFinalBody() {
        return finalBody;
    }

    @Override
    public String toString() {
        return kind + "@" + line + ":" + column + "(" + text + ")";
    }

    public static final class Builder {
        private final StmtKind kind;
        private String text = "";
        private int line = 1;
        private int column = 1;
        private String test;
        private String target;
        private String iterable;
        private List<String> items;
        private List<SourceStmt> body;
        private List<SourceStmt> orelse;
        private List<ExceptHandler> handlers;
        private List<SourceStmt> finalBody;

        private Builder(StmtKind kind) {
            this.kind = kind;
        }

        public Builder text(String text) {
            this.text = text;
            return this;
        }

        public Builder at(int line, int column) {
            this.line = line;
            this.column = column;
            return this;
        }

        public Builder test(String test) {
            this.test = test;
            return this;
        }

        public Builder target(String target) {
            this.target = target;
            return this;
        }

        public Builder iterable(String iterable) {
            this.iterable = iterable;
            return this;
        }

        public Builder items(List<String> items) {
            this.items = items == null ? null : List.copyOf(items);
            return this;
        }

        public Builder body(List<SourceStmt> body) {
            this.body = body == null ? null : List.copyOf(body);
            return this;
        }

        public Builder orelse(List<SourceStmt> orelse) {
            this.orelse = orelse == null ? null : List.copyOf(orelse);
            return this;
        }

        public Builder handlers(List<ExceptHandler> handlers) {
            this.handlers = handlers == null ? null : List.copyOf(handlers);
            return this;
        }

        public Builder finalBody(List<SourceStmt> finalBody) {
            this.finalBody = finalBody == null ? null : List.copyOf(finalBody);
            return this;
        }

        public SourceStmt build() {
            return new SourceStmt(this);
        }
    }
}
