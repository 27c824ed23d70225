package com.tailor.compiler.transform;

import com.tailor.compiler.ast.SourceLocation;
import com.tailor.compiler.ast.StmtVisitor;
import com.tailor.compiler.ast.expr.Expression;
import com.tailor.compiler.ast.expr.Identifier;
import com.tailor.compiler.ast.expr.Literal;
import com.tailor.compiler.ast.stmt.*;

import java.util.ArrayList;
import java.util.Collections;
import java.util.IdentityHashMap;
import java.util.List;
import java.util.Set;

/**
 * 把每个尾位置的表达式语句替换为对结果绑定的赋值，保留所有分支结构，
 * 在函数体开头声明 {@code var <binding>}（不带初始值），
 * 并在最外层函数体末尾追加唯一的 {@code return <binding>}。
 *
 * <p>只重建通往尾位置的路径上的节点，其余子树按引用复用。
 * 改写结果格式化后仍是可以重新解析执行的源码。</p>
 */
public class TailRewriter implements StmtVisitor<Statement, Void> {
    private final String resultName;
    private final Set<ExpressionStmt> tails;

    public TailRewriter(String resultName, List<TailPosition> positions) {
        this.resultName = resultName;
        this.tails = Collections.newSetFromMap(new IdentityHashMap<>());
        for (TailPosition position : positions) {
            tails.add(position.getStatement());
        }
    }

    /**
     * 改写函数体：声明结果绑定、改写尾位置并追加最终的 return
     */
    public Block rewrite(Block body) {
        Block rewritten = rewriteBody(body);
        List<Statement> statements = new ArrayList<>(rewritten.getStatements());
        SourceLocation start = body.getLocation();
        // 文档字符串保持在第一句
        statements.add(startsWithDocString(body) ? 1 : 0,
                new PropertyStmt(start, true, resultName, null, null));
        SourceLocation end = body.getLast() != null ? body.getLast().getLocation() : start;
        statements.add(new ReturnStmt(end, new Identifier(end, resultName)));
        return new Block(start, statements);
    }

    private static boolean startsWithDocString(Block body) {
        List<Statement> statements = body.getStatements();
        if (statements.size() < 2 || !(statements.get(0) instanceof ExpressionStmt)) {
            return false;
        }
        Expression first = ((ExpressionStmt) statements.get(0)).getExpression();
        return first instanceof Literal && ((Literal) first).getKind() == Literal.LiteralKind.STRING;
    }

    private Block rewriteBody(Block body) {
        Statement last = body.getLast();
        if (last == null) {
            return body;
        }
        Statement replaced = last.accept(this, null);
        if (replaced == last) {
            return body;
        }
        List<Statement> statements = new ArrayList<>(body.getStatements());
        statements.set(statements.size() - 1, replaced);
        return new Block(body.getLocation(), statements);
    }

    @Override
    public Statement visitExpressionStmt(ExpressionStmt node, Void ctx) {
        if (!tails.contains(node)) {
            return node;
        }
        SourceLocation loc = node.getLocation();
        return new AssignStmt(loc, new Identifier(loc, resultName), AssignStmt.AssignOp.ASSIGN,
                node.getExpression());
    }

    @Override
    public Statement visitIfStmt(IfStmt node, Void ctx) {
        Block thenBranch = rewriteBody(node.getThenBranch());
        Statement elseBranch = node.getElseBranch();
        if (elseBranch instanceof IfStmt) {
            elseBranch = elseBranch.accept(this, null);
        } else if (elseBranch != null) {
            elseBranch = rewriteBody((Block) elseBranch);
        }
        return new IfStmt(node.getLocation(), node.getCondition(), thenBranch, elseBranch);
    }

    @Override
    public Statement visitTryStmt(TryStmt node, Void ctx) {
        Block tryBlock = rewriteBody(node.getTryBlock());
        List<CatchClause> clauses = new ArrayList<>();
        for (CatchClause clause : node.getCatchClauses()) {
            clauses.add(clause.withBody(rewriteBody(clause.getBody())));
        }
        Block elseBlock = node.hasElse() ? rewriteBody(node.getElseBlock()) : null;
        return new TryStmt(node.getLocation(), tryBlock, clauses, elseBlock, node.getFinallyBlock());
    }

    @Override
    public Statement visitWhenStmt(WhenStmt node, Void ctx) {
        List<WhenBranch> branches = new ArrayList<>();
        for (WhenBranch branch : node.getBranches()) {
            branches.add(branch.withBody(rewriteBody(branch.getBody())));
        }
        return new WhenStmt(node.getLocation(), node.getSubject(), branches);
    }

    @Override
    public Statement visitBlock(Block node, Void ctx) {
        return rewriteBody(node);
    }

    // 以下语句不在尾位置链上（或以 throw 结束路径），原样保留

    @Override
    public Statement visitThrowStmt(ThrowStmt node, Void ctx) {
        return node;
    }

    @Override
    public Statement visitFunDeclStmt(FunDeclStmt node, Void ctx) {
        return node;
    }

    @Override
    public Statement visitPropertyStmt(PropertyStmt node, Void ctx) {
        return node;
    }

    @Override
    public Statement visitAssignStmt(AssignStmt node, Void ctx) {
        return node;
    }

    @Override
    public Statement visitWhileStmt(WhileStmt node, Void ctx) {
        return node;
    }

    @Override
    public Statement visitForStmt(ForStmt node, Void ctx) {
        return node;
    }

    @Override
    public Statement visitUseStmt(UseStmt node, Void ctx) {
        return node;
    }

    @Override
    public Statement visitBreakStmt(BreakStmt node, Void ctx) {
        return node;
    }

    @Override
    public Statement visitContinueStmt(ContinueStmt node, Void ctx) {
        return node;
    }

    @Override
    public Statement visitDeleteStmt(DeleteStmt node, Void ctx) {
        return node;
    }

    @Override
    public Statement visitImportStmt(ImportStmt node, Void ctx) {
        return node;
    }

    @Override
    public Statement visitGlobalStmt(GlobalStmt node, Void ctx) {
        return node;
    }

    @Override
    public Statement visitReturnStmt(ReturnStmt node, Void ctx) {
        return node;
    }
}
