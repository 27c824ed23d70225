package com.tailor.compiler.transform;

import com.tailor.compiler.ast.StmtVisitor;
import com.tailor.compiler.ast.stmt.*;

/**
 * 拒绝函数顶层函数体中的任何显式 return（不只是尾位置）。
 *
 * <p>递归进入代码块、条件、try/catch/else/finally、when 分支、循环和 use 块；
 * 不进入嵌套函数声明。lambda 与匿名函数是表达式，语句遍历不会到达其内部。</p>
 */
public class ExplicitReturnChecker implements StmtVisitor<Void, Void> {
    private final String functionName;

    public ExplicitReturnChecker(String functionName) {
        this.functionName = functionName;
    }

    /**
     * 检查函数体
     *
     * @throws ExplicitReturnDisallowedError 发现显式 return 时
     */
    public void check(Block body) {
        body.accept(this, null);
    }

    private void scan(Statement stmt) {
        if (stmt != null) stmt.accept(this, null);
    }

    @Override
    public Void visitBlock(Block node, Void ctx) {
        for (Statement stmt : node.getStatements()) {
            scan(stmt);
        }
        return null;
    }

    @Override
    public Void visitReturnStmt(ReturnStmt node, Void ctx) {
        throw new ExplicitReturnDisallowedError(functionName, node.getLocation());
    }

    @Override
    public Void visitIfStmt(IfStmt node, Void ctx) {
        scan(node.getThenBranch());
        scan(node.getElseBranch());
        return null;
    }

    @Override
    public Void visitTryStmt(TryStmt node, Void ctx) {
        scan(node.getTryBlock());
        for (CatchClause clause : node.getCatchClauses()) {
            scan(clause.getBody());
        }
        scan(node.getElseBlock());
        scan(node.getFinallyBlock());
        return null;
    }

    @Override
    public Void visitWhenStmt(WhenStmt node, Void ctx) {
        for (WhenBranch branch : node.getBranches()) {
            scan(branch.getBody());
        }
        return null;
    }

    @Override
    public Void visitWhileStmt(WhileStmt node, Void ctx) {
        scan(node.getBody());
        return null;
    }

    @Override
    public Void visitForStmt(ForStmt node, Void ctx) {
        scan(node.getBody());
        return null;
    }

    @Override
    public Void visitUseStmt(UseStmt node, Void ctx) {
        scan(node.getBody());
        return null;
    }

    @Override
    public Void visitFunDeclStmt(FunDeclStmt node, Void ctx) {
        // 嵌套函数保留普通的 return 语义
        return null;
    }

    @Override
    public Void visitExpressionStmt(ExpressionStmt node, Void ctx) {
        return null;
    }

    @Override
    public Void visitPropertyStmt(PropertyStmt node, Void ctx) {
        return null;
    }

    @Override
    public Void visitAssignStmt(AssignStmt node, Void ctx) {
        return null;
    }

    @Override
    public Void visitBreakStmt(BreakStmt node, Void ctx) {
        return null;
    }

    @Override
    public Void visitContinueStmt(ContinueStmt node, Void ctx) {
        return null;
    }

    @Override
    public Void visitDeleteStmt(DeleteStmt node, Void ctx) {
        return null;
    }

    @Override
    public Void visitImportStmt(ImportStmt node, Void ctx) {
        return null;
    }

    @Override
    public Void visitGlobalStmt(GlobalStmt node, Void ctx) {
        return null;
    }

    @Override
    public Void visitThrowStmt(ThrowStmt node, Void ctx) {
        return null;
    }
}
