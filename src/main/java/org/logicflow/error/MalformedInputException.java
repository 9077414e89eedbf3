package org.logicflow.error;

/**
 * 输入语句缺少语法上必然存在的结构字段（例如复合语句没有 body），无法表示为逻辑流树
 */
public class MalformedInputException extends FlowException {

    public MalformedInputException(String message) {
        super(message);
    }

    public static MalformedInputException missingField(String field) {
        return new MalformedInputException("field '" + field + "' not found");
    }
}
