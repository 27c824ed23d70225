package com.tailor.compiler.ast.expr;

import com.tailor.compiler.ast.ExprVisitor;
import com.tailor.compiler.ast.SourceLocation;
import com.tailor.compiler.ast.decl.Parameter;
import com.tailor.compiler.ast.stmt.Block;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Lambda 表达式：{ a, b -> a + b }
 *
 * <p>结果是最后一个表达式语句的值，或显式 return 的值。</p>
 */
public class LambdaExpr extends Expression {
    private final List<Parameter> params;
    private final Block body;

    public LambdaExpr(SourceLocation location, List<Parameter> params, Block body) {
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
        return visitor.visitLambdaExpr(this, context);
    }
}
