package com.tailor.compiler.transform;

import com.tailor.compiler.ast.SourceLocation;
import com.tailor.compiler.ast.stmt.ExpressionStmt;

/**
 * 一个尾位置：某个分支体的最后一条表达式语句
 */
public final class TailPosition {
    private final ExpressionStmt statement;
    private final BranchKind kind;

    public TailPosition(ExpressionStmt statement, BranchKind kind) {
        this.statement = statement;
        this.kind = kind;
    }

    public ExpressionStmt getStatement() {
        return statement;
    }

    public BranchKind getKind() {
        return kind;
    }

    public SourceLocation getLocation() {
        return statement.getLocation();
    }

    @Override
    public String toString() {
        return kind + "@" + getLocation();
    }
}
