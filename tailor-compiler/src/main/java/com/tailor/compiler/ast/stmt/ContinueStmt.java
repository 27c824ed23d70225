package com.tailor.compiler.ast.stmt;

import com.tailor.compiler.ast.SourceLocation;
import com.tailor.compiler.ast.StmtVisitor;

/**
 * Continue 语句
 */
public class ContinueStmt extends Statement {

    public ContinueStmt(SourceLocation location) {
        super(location);
    }

    @Override
    public <R, C> R accept(StmtVisitor<R, C> visitor, C context) {
        return visitor.visitContinueStmt(this, context);
    }
}
