package com.tailor.compiler.ast.stmt;

import com.tailor.compiler.ast.SourceLocation;
import com.tailor.compiler.ast.StmtVisitor;
import com.tailor.compiler.ast.decl.FunDecl;

/**
 * 函数声明语句（顶层或嵌套）
 */
public class FunDeclStmt extends Statement {
    private final FunDecl declaration;

    public FunDeclStmt(SourceLocation location, FunDecl declaration) {
        super(location);
        this.declaration = declaration;
    }

    public FunDecl getDeclaration() {
        return declaration;
    }

    @Override
    public <R, C> R accept(StmtVisitor<R, C> visitor, C context) {
        return visitor.visitFunDeclStmt(this, context);
    }
}
