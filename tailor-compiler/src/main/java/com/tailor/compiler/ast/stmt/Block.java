package com.tailor.compiler.ast.stmt;

import com.tailor.compiler.ast.SourceLocation;
import com.tailor.compiler.ast.StmtVisitor;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * 代码块
 */
public class Block extends Statement {
    private final List<Statement> statements;

    public Block(SourceLocation location, List<Statement> statements) {
        super(location);
        this.statements = Collections.unmodifiableList(new ArrayList<>(statements));
    }

    public List<Statement> getStatements() {
        return statements;
    }

    public boolean isEmpty() {
        return statements.isEmpty();
    }

    /** 最后一条语句，空块返回 null */
    public Statement getLast() {
        return statements.isEmpty() ? null : statements.get(statements.size() - 1);
    }

    @Override
    public <R, C> R accept(StmtVisitor<R, C> visitor, C context) {
        return visitor.visitBlock(this, context);
    }
}
