package org.logicflow.source;

import java.util.List;

/**
 * 一个异常处理器
 *
 * @param type 异常类型表达式文本，为 null 表示捕获所有异常
 * @param name 绑定的变量名，可为 null
 * @param body 处理器语句，为 null 表示输入不完整
 */
public record ExceptHandler(String type, String name, List<SourceStmt> body) {
}
