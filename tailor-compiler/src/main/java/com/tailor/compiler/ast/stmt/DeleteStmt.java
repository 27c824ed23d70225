package com.tailor.compiler.ast.stmt;

import com.tailor.compiler.ast.SourceLocation;
import com.tailor.compiler.ast.StmtVisitor;

/**
 * Delete 语句：从当前作用域移除局部绑定
 */
public class DeleteStmt extends Statement {
    private final String name;

    public DeleteStmt(SourceLocation location, String name) {
        super(location);
        this.name = name;
    }

    public String getName() {
        return name;
    }

    @Override
    public <R, C> R accept(StmtVisitor<R, C> visitor, C context) {
        return visitor.visitDeleteStmt(this, context);
    }
}
