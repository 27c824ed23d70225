package com.tailor.compiler.ast.expr;

import com.tailor.compiler.ast.ExprVisitor;
import com.tailor.compiler.ast.SourceLocation;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * 函数调用表达式
 */
public class CallExpr extends Expression {
    private final Expression callee;
    private final List<Argument> args;

    public CallExpr(SourceLocation location, Expression callee, List<Argument> args) {
        super(location);
        this.callee = callee;
        this.args = Collections.unmodifiableList(new ArrayList<>(args));
    }

    public Expression getCallee() {
        return callee;
    }

    public List<Argument> getArgs() {
        return args;
    }

    @Override
    public <R, C> R accept(ExprVisitor<R, C> visitor, C context) {
        return visitor.visitCallExpr(this, context);
    }

    /**
     * 调用参数
     */
    public static class Argument {
        private final String name;  // 命名参数，可选
        private final Expression value;

        public Argument(String name, Expression value) {
            this.name = name;
            this.value = value;
        }

        public String getName() {
            return name;
        }

        public Expression getValue() {
            return value;
        }

        public boolean isNamed() {
            return name != null;
        }
    }
}
