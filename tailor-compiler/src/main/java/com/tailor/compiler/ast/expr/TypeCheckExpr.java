package com.tailor.compiler.ast.expr;

import com.tailor.compiler.ast.ExprVisitor;
import com.tailor.compiler.ast.SourceLocation;
import com.tailor.compiler.ast.type.TypeRef;

/**
 * 类型检查表达式：x is Type / x !is Type
 */
public class TypeCheckExpr extends Expression {
    private final Expression operand;
    private final TypeRef targetType;
    private final boolean negated;

    public TypeCheckExpr(SourceLocation location, Expression operand, TypeRef targetType, boolean negated) {
        super(location);
        this.operand = operand;
        this.targetType = targetType;
        this.negated = negated;
    }

    public Expression getOperand() {
        return operand;
    }

    public TypeRef getTargetType() {
        return targetType;
    }

    public boolean isNegated() {
        return negated;
    }

    @Override
    public <R, C> R accept(ExprVisitor<R, C> visitor, C context) {
        return visitor.visitTypeCheckExpr(this, context);
    }
}
