package com.tailor.compiler.transform;

import com.tailor.compiler.ast.StmtVisitor;
import com.tailor.compiler.ast.stmt.*;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * 尾位置解析器，同时完成完备性校验。
 *
 * <p>对一个语句列表取最后一条语句并按种类分派：表达式语句本身就是尾位置；
 * if / try / when 递归进入每个分支体；throw 终止路径，不需要值；
 * 其他语句无法产生值。纯结构遍历，不求值任何条件。
 * 发现第一个问题时立即抛出，不产生部分结果。</p>
 */
public class TailPositionResolver implements StmtVisitor<Void, BranchKind> {
    private final String functionName;
    private final List<TailPosition> positions = new ArrayList<>();

    public TailPositionResolver(String functionName) {
        this.functionName = functionName;
    }

    /**
     * 解析函数体的全部尾位置（深度优先，按源码顺序）
     *
     * @throws MissingImplicitReturnError 分支没有覆盖所有路径
     * @throws UnsupportedConstructError 尾位置无法产生值
     */
    public List<TailPosition> resolve(Block body) {
        positions.clear();
        resolveBody(body, BranchKind.FUNCTION_BODY, "function body");
        return Collections.unmodifiableList(new ArrayList<>(positions));
    }

    private void resolveBody(Block body, BranchKind kind, String description) {
        Statement last = body.getLast();
        if (last == null) {
            throw new MissingImplicitReturnError("Empty " + description + " in function '" + functionName
                    + "' has no value to return", functionName, body.getLocation());
        }
        last.accept(this, kind);
    }

    // ============ 产生值的结构 ============

    @Override
    public Void visitExpressionStmt(ExpressionStmt node, BranchKind kind) {
        positions.add(new TailPosition(node, kind));
        return null;
    }

    @Override
    public Void visitIfStmt(IfStmt node, BranchKind kind) {
        resolveBody(node.getThenBranch(), BranchKind.CONDITIONAL_BRANCH, "if branch");
        Statement elseBranch = node.getElseBranch();
        if (elseBranch == null) {
            throw new MissingImplicitReturnError("Missing else branch for if statement at tail position in function '"
                    + functionName + "'", functionName, node.getLocation());
        }
        if (elseBranch instanceof IfStmt) {
            elseBranch.accept(this, BranchKind.CONDITIONAL_BRANCH);
        } else {
            resolveBody((Block) elseBranch, BranchKind.CONDITIONAL_BRANCH, "else branch");
        }
        return null;
    }

    @Override
    public Void visitTryStmt(TryStmt node, BranchKind kind) {
        resolveBody(node.getTryBlock(), BranchKind.TRY_BODY, "try block");
        for (CatchClause clause : node.getCatchClauses()) {
            resolveBody(clause.getBody(), BranchKind.HANDLER_BODY, "catch block");
        }
        if (node.hasElse()) {
            resolveBody(node.getElseBlock(), BranchKind.HANDLER_ELSE, "try-else block");
        }
        // finally 块总是执行，但从不提供结果
        return null;
    }

    @Override
    public Void visitWhenStmt(WhenStmt node, BranchKind kind) {
        if (node.getBranches().isEmpty()) {
            throw new MissingImplicitReturnError("when statement at tail position in function '" + functionName
                    + "' has no branches", functionName, node.getLocation());
        }
        for (WhenBranch branch : node.getBranches()) {
            resolveBody(branch.getBody(), BranchKind.MATCH_ARM, "when branch");
        }
        return null;
    }

    @Override
    public Void visitBlock(Block node, BranchKind kind) {
        resolveBody(node, kind, "block");
        return null;
    }

    @Override
    public Void visitThrowStmt(ThrowStmt node, BranchKind kind) {
        // 该路径以错误结束，不会到达最终的 return
        return null;
    }

    // ============ 无法产生值的结构 ============

    private Void unsupported(String construct, Statement node) {
        throw new UnsupportedConstructError(construct, functionName, node.getLocation());
    }

    @Override
    public Void visitFunDeclStmt(FunDeclStmt node, BranchKind kind) {
        return unsupported("function definition", node);
    }

    @Override
    public Void visitPropertyStmt(PropertyStmt node, BranchKind kind) {
        return unsupported((node.isMutable() ? "var" : "val") + " declaration", node);
    }

    @Override
    public Void visitAssignStmt(AssignStmt node, BranchKind kind) {
        return unsupported("assignment", node);
    }

    @Override
    public Void visitWhileStmt(WhileStmt node, BranchKind kind) {
        return unsupported("while loop", node);
    }

    @Override
    public Void visitForStmt(ForStmt node, BranchKind kind) {
        return unsupported("for loop", node);
    }

    @Override
    public Void visitUseStmt(UseStmt node, BranchKind kind) {
        return unsupported("use block", node);
    }

    @Override
    public Void visitBreakStmt(BreakStmt node, BranchKind kind) {
        return unsupported("break statement", node);
    }

    @Override
    public Void visitContinueStmt(ContinueStmt node, BranchKind kind) {
        return unsupported("continue statement", node);
    }

    @Override
    public Void visitDeleteStmt(DeleteStmt node, BranchKind kind) {
        return unsupported("delete statement", node);
    }

    @Override
    public Void visitImportStmt(ImportStmt node, BranchKind kind) {
        return unsupported("import statement", node);
    }

    @Override
    public Void visitGlobalStmt(GlobalStmt node, BranchKind kind) {
        return unsupported("global declaration", node);
    }

    @Override
    public Void visitReturnStmt(ReturnStmt node, BranchKind kind) {
        // 正常情况下已被 ExplicitReturnChecker 拦截
        throw new ExplicitReturnDisallowedError(functionName, node.getLocation());
    }
}
