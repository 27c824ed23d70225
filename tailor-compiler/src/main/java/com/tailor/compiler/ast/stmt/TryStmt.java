package com.tailor.compiler.ast.stmt;

import com.tailor.compiler.ast.SourceLocation;
import com.tailor.compiler.ast.StmtVisitor;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Try 语句
 *
 * <p>else 块在 try 块正常完成（没有错误）时执行；finally 块总是执行，但从不提供结果值。</p>
 */
public class TryStmt extends Statement {
    private final Block tryBlock;
    private final List<CatchClause> catchClauses;
    private final Block elseBlock;     // 可选
    private final Block finallyBlock;  // 可选

    public TryStmt(SourceLocation location, Block tryBlock, List<CatchClause> catchClauses,
                   Block elseBlock, Block finallyBlock) {
        super(location);
        this.tryBlock = tryBlock;
        this.catchClauses = Collections.unmodifiableList(new ArrayList<>(catchClauses));
        this.elseBlock = elseBlock;
        this.finallyBlock = finallyBlock;
    }

    public Block getTryBlock() {
        return tryBlock;
    }

    public List<CatchClause> getCatchClauses() {
        return catchClauses;
    }

    public Block getElseBlock() {
        return elseBlock;
    }

    public boolean hasElse() {
        return elseBlock != null;
    }

    public Block getFinallyBlock() {
        return finallyBlock;
    }

    public boolean hasFinally() {
        return finallyBlock != null;
    }

    @Override
    public <R, C> R accept(StmtVisitor<R, C> visitor, C context) {
        return visitor.visitTryStmt(this, context);
    }
}
