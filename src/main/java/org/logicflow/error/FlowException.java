package org.logicflow.error;

/**
 * 逻辑流分析过程中所有错误的基类。构建是确定性的，这些错误都不可重试。
 */
public class FlowException extends RuntimeException {

    public FlowException(String message) {
        super(message);
    }

    public FlowException(String message, Throwable cause) {
        super(message, cause);
    }
}
