package com.tailor.compiler.ast;

import com.tailor.compiler.ast.stmt.*;

/**
 * 语句访问者
 *
 * <p>所有方法都是抽象的：新增语句种类时，每个遍历器都必须显式处理它，
 * 由编译器保证穷尽性。</p>
 */
public interface StmtVisitor<R, C> {

    R visitBlock(Block node, C ctx);

    R visitExpressionStmt(ExpressionStmt node, C ctx);

    R visitIfStmt(IfStmt node, C ctx);

    R visitTryStmt(TryStmt node, C ctx);

    R visitWhenStmt(WhenStmt node, C ctx);

    R visitFunDeclStmt(FunDeclStmt node, C ctx);

    R visitPropertyStmt(PropertyStmt node, C ctx);

    R visitAssignStmt(AssignStmt node, C ctx);

    R visitWhileStmt(WhileStmt node, C ctx);

    R visitForStmt(ForStmt node, C ctx);

    R visitUseStmt(UseStmt node, C ctx);

    R visitBreakStmt(BreakStmt node, C ctx);

    R visitContinueStmt(ContinueStmt node, C ctx);

    R visitDeleteStmt(DeleteStmt node, C ctx);

    R visitImportStmt(ImportStmt node, C ctx);

    R visitGlobalStmt(GlobalStmt node, C ctx);

    R visitReturnStmt(ReturnStmt node, C ctx);

    R visitThrowStmt(ThrowStmt node, C ctx);
}
