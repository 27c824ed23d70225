package com.tailor.compiler.ast.stmt;

import com.tailor.compiler.ast.SourceLocation;
import com.tailor.compiler.ast.StmtVisitor;
import com.tailor.compiler.ast.expr.Expression;

/**
 * If 语句
 *
 * <p>{@code else if} 链表示为嵌套的 IfStmt：elseBranch 是 Block 或另一个 IfStmt。</p>
 */
public class IfStmt extends Statement {
    private final Expression condition;
    private final Block thenBranch;
    private final Statement elseBranch;  // 可选

    public IfStmt(SourceLocation location, Expression condition, Block thenBranch, Statement elseBranch) {
        super(location);
        if (elseBranch != null && !(elseBranch instanceof Block) && !(elseBranch instanceof IfStmt)) {
            throw new IllegalArgumentException("else branch must be a block or an if statement");
        }
        this.condition = condition;
        this.thenBranch = thenBranch;
        this.elseBranch = elseBranch;
    }

    public Expression getCondition() {
        return condition;
    }

    public Block getThenBranch() {
        return thenBranch;
    }

    public Statement getElseBranch() {
        return elseBranch;
    }

    public boolean hasElse() {
        return elseBranch != null;
    }

    @Override
    public <R, C> R accept(StmtVisitor<R, C> visitor, C context) {
        return visitor.visitIfStmt(this, context);
    }
}
