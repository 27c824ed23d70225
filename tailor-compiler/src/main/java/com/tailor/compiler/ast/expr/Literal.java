package com.tailor.compiler.ast.expr;

import com.tailor.compiler.ast.ExprVisitor;
import com.tailor.compiler.ast.SourceLocation;

/**
 * 字面量表达式
 */
public class Literal extends Expression {
    private final Object value;
    private final LiteralKind kind;

    public Literal(SourceLocation location, Object value, LiteralKind kind) {
        super(location);
        this.value = value;
        this.kind = kind;
    }

    public Object getValue() {
        return value;
    }

    public LiteralKind getKind() {
        return kind;
    }

    @Override
    public <R, C> R accept(ExprVisitor<R, C> visitor, C context) {
        return visitor.visitLiteral(this, context);
    }

    /**
     * 字面量类型
     */
    public enum LiteralKind {
        INT,
        LONG,
        DOUBLE,
        STRING,
        BOOLEAN,
        NULL;

        /** 是否为数值字面量类型 */
        public boolean isNumeric() {
            return numericRank() >= 0;
        }

        /** 数值提升等级：INT(0) < LONG(1) < DOUBLE(2)，非数值返回 -1 */
        public int numericRank() {
            switch (this) {
                case INT:    return 0;
                case LONG:   return 1;
                case DOUBLE: return 2;
                default:     return -1;
            }
        }
    }
}
