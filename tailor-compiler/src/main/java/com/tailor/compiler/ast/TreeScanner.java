package com.tailor.compiler.ast;

import com.tailor.compiler.ast.decl.FunDecl;
import com.tailor.compiler.ast.decl.Parameter;
import com.tailor.compiler.ast.expr.*;
import com.tailor.compiler.ast.stmt.*;

/**
 * 完整遍历整棵树的基础访问者，包括嵌套函数、lambda 和匿名函数的内部。
 *
 * <p>子类只覆盖感兴趣的节点，并在需要继续遍历时调用 super。</p>
 */
public abstract class TreeScanner<C> implements StmtVisitor<Void, C>, ExprVisitor<Void, C> {

    public void scan(Statement stmt, C ctx) {
        if (stmt != null) stmt.accept(this, ctx);
    }

    public void scan(Expression expr, C ctx) {
        if (expr != null) expr.accept(this, ctx);
    }

    public void scanFunction(FunDecl decl, C ctx) {
        for (Parameter param : decl.getParams()) {
            scanParameter(param, ctx);
        }
        scan(decl.getBody(), ctx);
    }

    protected void scanParameter(Parameter param, C ctx) {
        scan(param.getDefaultValue(), ctx);
    }

    // ============ 语句 ============

    @Override
    public Void visitBlock(Block node, C ctx) {
        for (Statement stmt : node.getStatements()) {
            scan(stmt, ctx);
        }
        return null;
    }

    @Override
    public Void visitExpressionStmt(ExpressionStmt node, C ctx) {
        scan(node.getExpression(), ctx);
        return null;
    }

    @Override
    public Void visitIfStmt(IfStmt node, C ctx) {
        scan(node.getCondition(), ctx);
        scan(node.getThenBranch(), ctx);
        scan(node.getElseBranch(), ctx);
        return null;
    }

    @Override
    public Void visitTryStmt(TryStmt node, C ctx) {
        scan(node.getTryBlock(), ctx);
        for (CatchClause clause : node.getCatchClauses()) {
            scan(clause.getBody(), ctx);
        }
        scan(node.getElseBlock(), ctx);
        scan(node.getFinallyBlock(), ctx);
        return null;
    }

    @Override
    public Void visitWhenStmt(WhenStmt node, C ctx) {
        scan(node.getSubject(), ctx);
        for (WhenBranch branch : node.getBranches()) {
            for (WhenBranch.WhenCondition condition : branch.getConditions()) {
                scan(condition.getValue(), ctx);
            }
            scan(branch.getBody(), ctx);
        }
        return null;
    }

    @Override
    public Void visitFunDeclStmt(FunDeclStmt node, C ctx) {
        scanFunction(node.getDeclaration(), ctx);
        return null;
    }

    @Override
    public Void visitPropertyStmt(PropertyStmt node, C ctx) {
        scan(node.getInitializer(), ctx);
        return null;
    }

    @Override
    public Void visitAssignStmt(AssignStmt node, C ctx) {
        scan(node.getTarget(), ctx);
        scan(node.getValue(), ctx);
        return null;
    }

    @Override
    public Void visitWhileStmt(WhileStmt node, C ctx) {
        scan(node.getCondition(), ctx);
        scan(node.getBody(), ctx);
        return null;
    }

    @Override
    public Void visitForStmt(ForStmt node, C ctx) {
        scan(node.getIterable(), ctx);
        scan(node.getBody(), ctx);
        return null;
    }

    @Override
    public Void visitUseStmt(UseStmt node, C ctx) {
        for (UseStmt.UseBinding binding : node.getBindings()) {
            scan(binding.getInitializer(), ctx);
        }
        scan(node.getBody(), ctx);
        return null;
    }

    @Override
    public Void visitBreakStmt(BreakStmt node, C ctx) {
        return null;
    }

    @Override
    public Void visitContinueStmt(ContinueStmt node, C ctx) {
        return null;
    }

    @Override
    public Void visitDeleteStmt(DeleteStmt node, C ctx) {
        return null;
    }

    @Override
    public Void visitImportStmt(ImportStmt node, C ctx) {
        return null;
    }

    @Override
    public Void visitGlobalStmt(GlobalStmt node, C ctx) {
        return null;
    }

    @Override
    public Void visitReturnStmt(ReturnStmt node, C ctx) {
        scan(node.getValue(), ctx);
        return null;
    }

    @Override
    public Void visitThrowStmt(ThrowStmt node, C ctx) {
        scan(node.getException(), ctx);
        return null;
    }

    // ============ 表达式 ============

    @Override
    public Void visitLiteral(Literal node, C ctx) {
        return null;
    }

    @Override
    public Void visitIdentifier(Identifier node, C ctx) {
        return null;
    }

    @Override
    public Void visitUnaryExpr(UnaryExpr node, C ctx) {
        scan(node.getOperand(), ctx);
        return null;
    }

    @Override
    public Void visitBinaryExpr(BinaryExpr node, C ctx) {
        scan(node.getLeft(), ctx);
        scan(node.getRight(), ctx);
        return null;
    }

    @Override
    public Void visitTypeCheckExpr(TypeCheckExpr node, C ctx) {
        scan(node.getOperand(), ctx);
        return null;
    }

    @Override
    public Void visitCallExpr(CallExpr node, C ctx) {
        scan(node.getCallee(), ctx);
        for (CallExpr.Argument arg : node.getArgs()) {
            scan(arg.getValue(), ctx);
        }
        return null;
    }

    @Override
    public Void visitMemberExpr(MemberExpr node, C ctx) {
        scan(node.getTarget(), ctx);
        return null;
    }

    @Override
    public Void visitIndexExpr(IndexExpr node, C ctx) {
        scan(node.getTarget(), ctx);
        scan(node.getIndex(), ctx);
        return null;
    }

    @Override
    public Void visitListLiteral(ListLiteral node, C ctx) {
        for (Expression element : node.getElements()) {
            scan(element, ctx);
        }
        return null;
    }

    @Override
    public Void visitStringInterpolation(StringInterpolation node, C ctx) {
        for (Expression part : node.getParts()) {
            scan(part, ctx);
        }
        return null;
    }

    @Override
    public Void visitLambdaExpr(LambdaExpr node, C ctx) {
        for (Parameter param : node.getParams()) {
            scanParameter(param, ctx);
        }
        scan(node.getBody(), ctx);
        return null;
    }

    @Override
    public Void visitFunExpr(FunExpr node, C ctx) {
        for (Parameter param : node.getParams()) {
            scanParameter(param, ctx);
        }
        scan(node.getBody(), ctx);
        return null;
    }
}
