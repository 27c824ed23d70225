package com.tailor.compiler.transform;

/**
 * 无法取回函数的原始定义源码（例如宿主注册的原生函数）
 */
public class SourceUnavailableError extends TransformationError {

    public SourceUnavailableError(String functionName) {
        super("Cannot retrieve source code for function '" + functionName + "'", functionName, 0, 0);
    }

    public SourceUnavailableError(String functionName, Throwable cause) {
        super("Cannot retrieve source code for function '" + functionName + "'", functionName, cause);
    }
}
