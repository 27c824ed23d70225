package com.tailor.compiler.ast.expr;

import com.tailor.compiler.ast.AstNode;
import com.tailor.compiler.ast.ExprVisitor;
import com.tailor.compiler.ast.SourceLocation;

/**
 * 表达式基类
 */
public abstract class Expression extends AstNode {

    protected Expression(SourceLocation location) {
        super(location);
    }

    public abstract <R, C> R accept(ExprVisitor<R, C> visitor, C context);
}
