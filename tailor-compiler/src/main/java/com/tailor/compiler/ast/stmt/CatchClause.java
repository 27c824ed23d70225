package com.tailor.compiler.ast.stmt;

import com.tailor.compiler.ast.AstNode;
import com.tailor.compiler.ast.SourceLocation;
import com.tailor.compiler.ast.type.TypeRef;

/**
 * Catch 子句
 */
public class CatchClause extends AstNode {
    private final String paramName;
    private final TypeRef paramType;  // 可选，null 表示捕获任意错误
    private final Block body;

    public CatchClause(SourceLocation location, String paramName, TypeRef paramType, Block body) {
        super(location);
        this.paramName = paramName;
        this.paramType = paramType;
        this.body = body;
    }

    public String getParamName() {
        return paramName;
    }

    public TypeRef getParamType() {
        return paramType;
    }

    public Block getBody() {
        return body;
    }

    /** 返回替换 body 后的新子句 */
    public CatchClause withBody(Block newBody) {
        return new CatchClause(location, paramName, paramType, newBody);
    }
}
