package com.tailor.compiler.ast.expr;

import com.tailor.compiler.ast.ExprVisitor;
import com.tailor.compiler.ast.SourceLocation;
import com.tailor.compiler.ast.decl.Parameter;
import com.tailor.compiler.ast.stmt.Block;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * 匿名函数：fun(x) { return x * 2 }
 *
 * <p>与 lambda 不同，只有显式 return 才产生结果，否则返回 null。</p>
 */
public class FunExpr extends Expression {
    private final List<Parameter> params;
    private final Block body;

    public FunExpr(SourceLocation location, List<Parameter> params, Block body) {
        super(location);
        this.params = Collections.unmodifiableList(new ArrayList<>(params));
        this.body = body;
    }

    public List<Parameter> getParams() {
        return params;
    }

    public Block getBody() {
        return body;
    }

    @Override
    public <R, C> R accept(ExprVisitor<R, C> visitor, C context) {
        return visitor.visitFunExpr(this, context);
    }
}
