package com.tailor.compiler.transform;

import com.tailor.compiler.ast.SourceLocation;

/**
 * 函数顶层函数体中出现了显式 return
 */
public class ExplicitReturnDisallowedError extends TransformationError {

    public ExplicitReturnDisallowedError(String functionName, SourceLocation location) {
        super("Explicit return statements are not allowed in implicit-return function '"
                + functionName + "'", functionName, location);
    }
}
