package com.tailor.compiler.ast.stmt;

import com.tailor.compiler.ast.SourceLocation;
import com.tailor.compiler.ast.StmtVisitor;
import com.tailor.compiler.ast.expr.Expression;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * When 语句（模式匹配）
 */
public class WhenStmt extends Statement {
    private final Expression subject;  // 可选
    private final List<WhenBranch> branches;

    public WhenStmt(SourceLocation location, Expression subject, List<WhenBranch> branches) {
        super(location);
        this.subject = subject;
        this.branches = Collections.unmodifiableList(new ArrayList<>(branches));
    }

    public Expression getSubject() {
        return subject;
    }

    public boolean hasSubject() {
        return subject != null;
    }

    public List<WhenBranch> getBranches() {
        return branches;
    }

    public boolean hasElse() {
        for (WhenBranch branch : branches) {
            if (branch.isElse()) return true;
        }
        return false;
    }

    @Override
    public <R, C> R accept(StmtVisitor<R, C> visitor, C context) {
        return visitor.visitWhenStmt(this, context);
    }
}
