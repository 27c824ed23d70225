package com.tailor.compiler.transform;

import com.tailor.compiler.ast.SourceLocation;

/**
 * 定义期改写错误的基类
 *
 * <p>在生成改写后的可调用对象时抛出，不会推迟到调用期。
 * 对同一函数定义不可恢复：必须修改函数源码。</p>
 */
public class TransformationError extends RuntimeException {
    private final String functionName;
    private final int line;
    private final int column;

    public TransformationError(String message, String functionName, int line, int column) {
        super(message);
        this.functionName = functionName;
        this.line = line;
        this.column = column;
    }

    public TransformationError(String message, String functionName, SourceLocation location) {
        this(message, functionName,
                location != null ? location.getLine() : 0,
                location != null ? location.getColumn() : 0);
    }

    public TransformationError(String message, String functionName, Throwable cause) {
        super(message, cause);
        this.functionName = functionName;
        this.line = 0;
        this.column = 0;
    }

    public String getFunctionName() {
        return functionName;
    }

    /** 出错行号，未知时为 0 */
    public int getLine() {
        return line;
    }

    /** 出错列号，未知时为 0 */
    public int getColumn() {
        return column;
    }

    /** 不含位置后缀的原始消息 */
    public String getRawMessage() {
        return super.getMessage();
    }

    @Override
    public String getMessage() {
        if (line <= 0) {
            return super.getMessage();
        }
        return super.getMessage() + " (line " + line + ", column " + column + ")";
    }
}
