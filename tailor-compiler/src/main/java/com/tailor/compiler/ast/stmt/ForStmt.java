package com.tailor.compiler.ast.stmt;

import com.tailor.compiler.ast.SourceLocation;
import com.tailor.compiler.ast.StmtVisitor;
import com.tailor.compiler.ast.expr.Expression;

/**
 * For 循环：for (x in iterable) { ... }
 */
public class ForStmt extends Statement {
    private final String variable;
    private final Expression iterable;
    private final Block body;

    public ForStmt(SourceLocation location, String variable, Expression iterable, Block body) {
        super(location);
        this.variable = variable;
        this.iterable = iterable;
        this.body = body;
    }

    public String getVariable() {
        return variable;
    }

    public Expression getIterable() {
        return iterable;
    }

    public Block getBody() {
        return body;
    }

    @Override
    public <R, C> R accept(StmtVisitor<R, C> visitor, C context) {
        return visitor.visitForStmt(this, context);
    }
}
