package com.tailor.compiler.transform;

import com.tailor.compiler.ast.SourceLocation;

/**
 * 尾位置的分支结构没有覆盖所有路径（缺少 else、空分支体等）
 */
public class MissingImplicitReturnError extends TransformationError {

    public MissingImplicitReturnError(String message, String functionName, SourceLocation location) {
        super(message, functionName, location);
    }
}
