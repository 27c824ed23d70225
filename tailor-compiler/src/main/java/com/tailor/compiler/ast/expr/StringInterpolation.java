package com.tailor.compiler.ast.expr;

import com.tailor.compiler.ast.ExprVisitor;
import com.tailor.compiler.ast.SourceLocation;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * 字符串插值："Hello, $name! ${a + b}"
 *
 * <p>parts 中的字符串片段是 STRING 字面量，其余为插入的表达式。</p>
 */
public class StringInterpolation extends Expression {
    private final List<Expression> parts;

    public StringInterpolation(SourceLocation location, List<Expression> parts) {
        super(location);
        this.parts = Collections.unmodifiableList(new ArrayList<>(parts));
    }

    public List<Expression> getParts() {
        return parts;
    }

    @Override
    public <R, C> R accept(ExprVisitor<R, C> visitor, C context) {
        return visitor.visitStringInterpolation(this, context);
    }
}
