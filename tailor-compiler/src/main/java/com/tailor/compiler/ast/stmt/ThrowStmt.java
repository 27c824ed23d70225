package com.tailor.compiler.ast.stmt;

import com.tailor.compiler.ast.SourceLocation;
import com.tailor.compiler.ast.StmtVisitor;
import com.tailor.compiler.ast.expr.Expression;

/**
 * Throw 语句
 */
public class ThrowStmt extends Statement {
    private final Expression exception;

    public ThrowStmt(SourceLocation location, Expression exception) {
        super(location);
        this.exception = exception;
    }

    public Expression getException() {
        return exception;
    }

    @Override
    public <R, C> R accept(StmtVisitor<R, C> visitor, C context) {
        return visitor.visitThrowStmt(this, context);
    }
}
