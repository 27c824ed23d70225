package com.tailor.compiler.ast.stmt;

import com.tailor.compiler.ast.SourceLocation;
import com.tailor.compiler.ast.StmtVisitor;
import com.tailor.compiler.ast.expr.Expression;

/**
 * 赋值语句
 *
 * <p>目标是 Identifier、MemberExpr 或 IndexExpr。</p>
 */
public class AssignStmt extends Statement {
    private final Expression target;
    private final AssignOp operator;
    private final Expression value;

    public AssignStmt(SourceLocation location, Expression target, AssignOp operator, Expression value) {
        super(location);
        this.target = target;
        this.operator = operator;
        this.value = value;
    }

    public Expression getTarget() {
        return target;
    }

    public AssignOp getOperator() {
        return operator;
    }

    public Expression getValue() {
        return value;
    }

    @Override
    public <R, C> R accept(StmtVisitor<R, C> visitor, C context) {
        return visitor.visitAssignStmt(this, context);
    }

    /**
     * 赋值运算符
     */
    public enum AssignOp {
        ASSIGN("="),
        ADD_ASSIGN("+="),
        SUB_ASSIGN("-="),
        MUL_ASSIGN("*="),
        DIV_ASSIGN("/="),
        MOD_ASSIGN("%=");

        private final String source;

        AssignOp(String source) {
            this.source = source;
        }

        public String toSourceString() {
            return source;
        }

        public boolean isCompound() {
            return this != ASSIGN;
        }
    }
}
