package org.logicflow.error;

/**
 * 带源码位置的构建错误。
 * <p>
 * 每个失败只包装一次：最内层出错语句的位置被保留，外层原样向上传播。
 */
public class FlowBuildException extends FlowException {

    private final int line;
    private final int column;

    public FlowBuildException(int line, int column, Throwable cause) {
        super(format(line, column, describe(cause)), cause);
        this.line = line;
        this.column = column;
    }

    public int getLine() {
        return line;
    }

    public int getColumn() {
        return column;
    }

    /**
     * 将异常包装为带位置的构建错误；已经带位置的异常原样返回
     */
    public static FlowBuildException wrap(RuntimeException e, int line, int column) {
        if (e instanceof FlowBuildException positioned) {
            return positioned;
        }
        return new FlowBuildException(line, column, e);
    }

    private static String describe(Throwable cause) {
        return cause.getMessage() != null ? cause.getMessage() : cause.getClass().getSimpleName();
    }

    private static String format(int line, int column, String message) {
        return "Error at line " + line + ", col " + column + ": " + message;
    }
}
