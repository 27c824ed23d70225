package com.tailor.compiler.ast.stmt;

import com.tailor.compiler.ast.SourceLocation;
import com.tailor.compiler.ast.StmtVisitor;

/**
 * Break 语句
 */
public class BreakStmt extends Statement {

    public BreakStmt(SourceLocation location) {
        super(location);
    }

    @Override
    public <R, C> R accept(StmtVisitor<R, C> visitor, C context) {
        return visitor.visitBreakStmt(this, context);
    }
}
