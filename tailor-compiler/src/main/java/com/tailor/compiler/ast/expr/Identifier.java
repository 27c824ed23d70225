package com.tailor.compiler.ast.expr;

import com.tailor.compiler.ast.ExprVisitor;
import com.tailor.compiler.ast.SourceLocation;

/**
 * 标识符
 */
public class Identifier extends Expression {
    private final String name;

    public Identifier(SourceLocation location, String name) {
        super(location);
        this.name = name;
    }

    public String getName() {
        return name;
    }

    @Override
    public <R, C> R accept(ExprVisitor<R, C> visitor, C context) {
        return visitor.visitIdentifier(this, context);
    }
}
