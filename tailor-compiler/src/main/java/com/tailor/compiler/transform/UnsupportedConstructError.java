package com.tailor.compiler.transform;

import com.tailor.compiler.ast.SourceLocation;

/**
 * 尾位置是无法产生值的结构（循环、资源作用域、声明等）
 */
public class UnsupportedConstructError extends TransformationError {
    private final String construct;

    public UnsupportedConstructError(String construct, String functionName, SourceLocation location) {
        super("Unsupported construct at tail position in function '" + functionName + "': " + construct
                + " cannot produce a value", functionName, location);
        this.construct = construct;
    }

    /** 不支持的结构名称，如 "while loop" */
    public String getConstruct() {
        return construct;
    }
}
