package com.tailor.compiler.ast;

/**
 * AST 节点基类
 *
 * <p>节点不可变。变换阶段构造新树，而不是修改旧树。</p>
 */
public abstract class AstNode {
    protected final SourceLocation location;

    protected AstNode(SourceLocation location) {
        this.location = location != null ? location : SourceLocation.UNKNOWN;
    }

    public SourceLocation getLocation() {
        return location;
    }
}
