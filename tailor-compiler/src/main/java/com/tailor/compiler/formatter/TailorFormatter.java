package com.tailor.compiler.formatter;

import com.tailor.compiler.ast.ExprVisitor;
import com.tailor.compiler.ast.StmtVisitor;
import com.tailor.compiler.ast.decl.Annotation;
import com.tailor.compiler.ast.decl.FunDecl;
import com.tailor.compiler.ast.decl.Parameter;
import com.tailor.compiler.ast.decl.Program;
import com.tailor.compiler.ast.expr.*;
import com.tailor.compiler.ast.stmt.*;

import java.util.List;

/**
 * Tailor AST 代码格式化器
 *
 * <p>遍历 AST，按统一格式规则输出源码。改写后的函数通过它还原为可读的源码文本。</p>
 */
public class TailorFormatter implements StmtVisitor<Void, FormatterContext>, ExprVisitor<Void, FormatterContext> {

    /**
     * 格式化程序
     */
    public String format(Program program, FormatConfig config) {
        FormatterContext ctx = new FormatterContext(config);
        List<Statement> statements = program.getStatements();
        for (int i = 0; i < statements.size(); i++) {
            Statement stmt = statements.get(i);
            stmt.accept(this, ctx);
            ctx.newLine();
            // 顶层函数之间空一行
            if (i < statements.size() - 1 && (stmt instanceof FunDeclStmt
                    || statements.get(i + 1) instanceof FunDeclStmt)) {
                ctx.newLine();
            }
        }
        return ctx.getOutput();
    }

    public String format(Program program) {
        return format(program, FormatConfig.defaults());
    }

    /**
     * 格式化单个函数定义
     */
    public String format(FunDecl decl, FormatConfig config) {
        FormatterContext ctx = new FormatterContext(config);
        formatFunDecl(decl, ctx);
        ctx.newLine();
        return ctx.getOutput();
    }

    public String format(FunDecl decl) {
        return format(decl, FormatConfig.defaults());
    }

    /**
     * 格式化单个表达式
     */
    public String format(Expression expr) {
        FormatterContext ctx = new FormatterContext(FormatConfig.defaults());
        formatExpression(expr, ctx);
        return ctx.getOutput();
    }

    // ============ 声明 ============

    private void formatFunDecl(FunDecl node, FormatterContext ctx) {
        if (node.getDocComment() != null) {
            formatDocComment(node.getDocComment(), ctx);
        }
        for (Annotation annotation : node.getAnnotations()) {
            ctx.append("@");
            ctx.append(annotation.getName());
            if (!annotation.getArgs().isEmpty()) {
                formatArguments(annotation.getArgs(), ctx);
            }
            ctx.newLine();
        }
        ctx.append("fun ");
        ctx.append(node.getName());
        formatParams(node.getParams(), ctx);
        if (node.getReturnType() != null) {
            ctx.append(": ");
            ctx.append(node.getReturnType().toSourceString());
        }
        ctx.append(" ");
        formatBlock(node.getBody(), ctx);
    }

    private void formatDocComment(String doc, FormatterContext ctx) {
        ctx.append("/**");
        ctx.newLine();
        for (String line : doc.split("\n")) {
            ctx.append(line.isEmpty() ? " *" : " * " + line);
            ctx.newLine();
        }
        ctx.append(" */");
        ctx.newLine();
    }

    private void formatParams(List<Parameter> params, FormatterContext ctx) {
        ctx.append("(");
        for (int i = 0; i < params.size(); i++) {
            if (i > 0) ctx.append(", ");
            formatParameter(params.get(i), ctx);
        }
        ctx.append(")");
    }

    private void formatParameter(Parameter param, FormatterContext ctx) {
        ctx.append(param.getName());
        if (param.getType() != null) {
            ctx.append(": ");
            ctx.append(param.getType().toSourceString());
        }
        if (param.hasDefaultValue()) {
            ctx.append(" = ");
            formatExpression(param.getDefaultValue(), ctx);
        }
    }

    // ============ 语句 ============

    private void formatBlock(Block block, FormatterContext ctx) {
        ctx.append("{");
        if (block.isEmpty()) {
            ctx.append("}");
            return;
        }
        ctx.newLine();
        ctx.indent();
        for (Statement stmt : block.getStatements()) {
            stmt.accept(this, ctx);
            ctx.newLine();
        }
        ctx.dedent();
        ctx.append("}");
    }

    @Override
    public Void visitBlock(Block node, FormatterContext ctx) {
        formatBlock(node, ctx);
        return null;
    }

    @Override
    public Void visitExpressionStmt(ExpressionStmt node, FormatterContext ctx) {
        formatExpression(node.getExpression(), ctx);
        return null;
    }

    @Override
    public Void visitIfStmt(IfStmt node, FormatterContext ctx) {
        ctx.append("if (");
        formatExpression(node.getCondition(), ctx);
        ctx.append(") ");
        formatBlock(node.getThenBranch(), ctx);

        if (node.hasElse()) {
            ctx.append(" else ");
            if (node.getElseBranch() instanceof IfStmt) {
                visitIfStmt((IfStmt) node.getElseBranch(), ctx);
            } else {
                formatBlock((Block) node.getElseBranch(), ctx);
            }
        }
        return null;
    }

    @Override
    public Void visitTryStmt(TryStmt node, FormatterContext ctx) {
        ctx.append("try ");
        formatBlock(node.getTryBlock(), ctx);
        for (CatchClause clause : node.getCatchClauses()) {
            ctx.append(" catch (");
            ctx.append(clause.getParamName());
            if (clause.getParamType() != null) {
                ctx.append(": ");
                ctx.append(clause.getParamType().toSourceString());
            }
            ctx.append(") ");
            formatBlock(clause.getBody(), ctx);
        }
        if (node.hasElse()) {
            ctx.append(" else ");
            formatBlock(node.getElseBlock(), ctx);
        }
        if (node.hasFinally()) {
            ctx.append(" finally ");
            formatBlock(node.getFinallyBlock(), ctx);
        }
        return null;
    }

    @Override
    public Void visitWhenStmt(WhenStmt node, FormatterContext ctx) {
        ctx.append("when");
        if (node.getSubject() != null) {
            ctx.append(" (");
            formatExpression(node.getSubject(), ctx);
            ctx.append(")");
        }
        ctx.append(" {");
        ctx.newLine();
        ctx.indent();

        for (WhenBranch branch : node.getBranches()) {
            formatWhenBranch(branch, ctx);
            ctx.newLine();
        }

        ctx.dedent();
        ctx.append("}");
        return null;
    }

    private void formatWhenBranch(WhenBranch branch, FormatterContext ctx) {
        if (branch.isElse()) {
            ctx.append("else");
        } else {
            List<WhenBranch.WhenCondition> conditions = branch.getConditions();
            for (int i = 0; i < conditions.size(); i++) {
                if (i > 0) ctx.append(", ");
                WhenBranch.WhenCondition condition = conditions.get(i);
                if (condition.getKind() == WhenBranch.ConditionKind.TYPE) {
                    ctx.append(condition.isNegated() ? "!is " : "is ");
                    ctx.append(condition.getType().toSourceString());
                } else {
                    formatExpression(condition.getValue(), ctx);
                }
            }
        }
        ctx.append(" -> ");
        formatBlock(branch.getBody(), ctx);
    }

    @Override
    public Void visitFunDeclStmt(FunDeclStmt node, FormatterContext ctx) {
        formatFunDecl(node.getDeclaration(), ctx);
        return null;
    }

    @Override
    public Void visitPropertyStmt(PropertyStmt node, FormatterContext ctx) {
        ctx.append(node.isMutable() ? "var " : "val ");
        ctx.append(node.getName());
        if (node.getType() != null) {
            ctx.append(": ");
            ctx.append(node.getType().toSourceString());
        }
        if (node.getInitializer() != null) {
            ctx.append(" = ");
            formatExpression(node.getInitializer(), ctx);
        }
        return null;
    }

    @Override
    public Void visitAssignStmt(AssignStmt node, FormatterContext ctx) {
        formatExpression(node.getTarget(), ctx);
        ctx.append(" ");
        ctx.append(node.getOperator().toSourceString());
        ctx.append(" ");
        formatExpression(node.getValue(), ctx);
        return null;
    }

    @Override
    public Void visitWhileStmt(WhileStmt node, FormatterContext ctx) {
        ctx.append("while (");
        formatExpression(node.getCondition(), ctx);
        ctx.append(") ");
        formatBlock(node.getBody(), ctx);
        return null;
    }

    @Override
    public Void visitForStmt(ForStmt node, FormatterContext ctx) {
        ctx.append("for (");
        ctx.append(node.getVariable());
        ctx.append(" in ");
        formatExpression(node.getIterable(), ctx);
        ctx.append(") ");
        formatBlock(node.getBody(), ctx);
        return null;
    }

    @Override
    public Void visitUseStmt(UseStmt node, FormatterContext ctx) {
        ctx.append("use (");
        List<UseStmt.UseBinding> bindings = node.getBindings();
        for (int i = 0; i < bindings.size(); i++) {
            if (i > 0) ctx.append(", ");
            ctx.append("val ");
            ctx.append(bindings.get(i).getName());
            ctx.append(" = ");
            formatExpression(bindings.get(i).getInitializer(), ctx);
        }
        ctx.append(") ");
        formatBlock(node.getBody(), ctx);
        return null;
    }

    @Override
    public Void visitBreakStmt(BreakStmt node, FormatterContext ctx) {
        ctx.append("break");
        return null;
    }

    @Override
    public Void visitContinueStmt(ContinueStmt node, FormatterContext ctx) {
        ctx.append("continue");
        return null;
    }

    @Override
    public Void visitDeleteStmt(DeleteStmt node, FormatterContext ctx) {
        ctx.append("delete ");
        ctx.append(node.getName());
        return null;
    }

    @Override
    public Void visitImportStmt(ImportStmt node, FormatterContext ctx) {
        ctx.append("import ");
        ctx.append(node.getModuleName());
        if (node.getAlias() != null) {
            ctx.append(" as ");
            ctx.append(node.getAlias());
        }
        return null;
    }

    @Override
    public Void visitGlobalStmt(GlobalStmt node, FormatterContext ctx) {
        ctx.append("global ");
        ctx.append(String.join(", ", node.getNames()));
        return null;
    }

    @Override
    public Void visitReturnStmt(ReturnStmt node, FormatterContext ctx) {
        ctx.append("return");
        if (node.getValue() != null) {
            ctx.append(" ");
            formatExpression(node.getValue(), ctx);
        }
        return null;
    }

    @Override
    public Void visitThrowStmt(ThrowStmt node, FormatterContext ctx) {
        ctx.append("throw ");
        formatExpression(node.getException(), ctx);
        return null;
    }

    // ============ 表达式 ============

    private void formatExpression(Expression expr, FormatterContext ctx) {
        expr.accept(this, ctx);
    }

    /** 子表达式优先级低于要求时加括号 */
    private void formatOperand(Expression expr, int minPrecedence, FormatterContext ctx) {
        if (precedence(expr) < minPrecedence) {
            ctx.append("(");
            formatExpression(expr, ctx);
            ctx.append(")");
        } else {
            formatExpression(expr, ctx);
        }
    }

    private static int precedence(Expression expr) {
        if (expr instanceof BinaryExpr) {
            return precedence(((BinaryExpr) expr).getOperator());
        }
        if (expr instanceof TypeCheckExpr) return 5;
        if (expr instanceof UnaryExpr) return 8;
        return 10;
    }

    private static int precedence(BinaryExpr.BinaryOp op) {
        switch (op) {
            case OR: return 1;
            case AND: return 2;
            case EQ: case NE: return 3;
            case LT: case GT: case LE: case GE: return 4;
            case IN: return 5;
            case ADD: case SUB: return 6;
            case MUL: case DIV: case MOD: return 7;
            default: return 0;
        }
    }

    @Override
    public Void visitLiteral(Literal node, FormatterContext ctx) {
        switch (node.getKind()) {
            case STRING:
                ctx.append("\"" + escape((String) node.getValue()) + "\"");
                break;
            case LONG:
                ctx.append(node.getValue() + "L");
                break;
            case NULL:
                ctx.append("null");
                break;
            default:
                ctx.append(String.valueOf(node.getValue()));
                break;
        }
        return null;
    }

    @Override
    public Void visitIdentifier(Identifier node, FormatterContext ctx) {
        ctx.append(node.getName());
        return null;
    }

    @Override
    public Void visitUnaryExpr(UnaryExpr node, FormatterContext ctx) {
        ctx.append(node.getOperator().toSourceString());
        formatOperand(node.getOperand(), 8, ctx);
        return null;
    }

    @Override
    public Void visitBinaryExpr(BinaryExpr node, FormatterContext ctx) {
        int prec = precedence(node.getOperator());
        formatOperand(node.getLeft(), prec, ctx);
        ctx.append(" ");
        ctx.append(node.getOperator().toSourceString());
        ctx.append(" ");
        // 左结合：右操作数同级也要加括号
        formatOperand(node.getRight(), prec + 1, ctx);
        return null;
    }

    @Override
    public Void visitTypeCheckExpr(TypeCheckExpr node, FormatterContext ctx) {
        formatOperand(node.getOperand(), 6, ctx);
        ctx.append(node.isNegated() ? " !is " : " is ");
        ctx.append(node.getTargetType().toSourceString());
        return null;
    }

    @Override
    public Void visitCallExpr(CallExpr node, FormatterContext ctx) {
        formatOperand(node.getCallee(), 9, ctx);
        formatArguments(node.getArgs(), ctx);
        return null;
    }

    private void formatArguments(List<CallExpr.Argument> args, FormatterContext ctx) {
        ctx.append("(");
        for (int i = 0; i < args.size(); i++) {
            if (i > 0) ctx.append(", ");
            CallExpr.Argument arg = args.get(i);
            if (arg.isNamed()) {
                ctx.append(arg.getName());
                ctx.append(" = ");
            }
            formatExpression(arg.getValue(), ctx);
        }
        ctx.append(")");
    }

    @Override
    public Void visitMemberExpr(MemberExpr node, FormatterContext ctx) {
        formatOperand(node.getTarget(), 9, ctx);
        ctx.append(".");
        ctx.append(node.getMember());
        return null;
    }

    @Override
    public Void visitIndexExpr(IndexExpr node, FormatterContext ctx) {
        formatOperand(node.getTarget(), 9, ctx);
        ctx.append("[");
        formatExpression(node.getIndex(), ctx);
        ctx.append("]");
        return null;
    }

    @Override
    public Void visitListLiteral(ListLiteral node, FormatterContext ctx) {
        ctx.append("[");
        List<Expression> elements = node.getElements();
        for (int i = 0; i < elements.size(); i++) {
            if (i > 0) ctx.append(", ");
            formatExpression(elements.get(i), ctx);
        }
        ctx.append("]");
        return null;
    }

    @Override
    public Void visitStringInterpolation(StringInterpolation node, FormatterContext ctx) {
        StringBuilder sb = new StringBuilder("\"");
        for (Expression part : node.getParts()) {
            if (part instanceof Literal && ((Literal) part).getKind() == Literal.LiteralKind.STRING) {
                sb.append(escape((String) ((Literal) part).getValue()));
            } else {
                sb.append("${").append(format(part)).append("}");
            }
        }
        sb.append("\"");
        ctx.append(sb.toString());
        return null;
    }

    @Override
    public Void visitLambdaExpr(LambdaExpr node, FormatterContext ctx) {
        ctx.append("{");
        List<Parameter> params = node.getParams();
        if (!params.isEmpty()) {
            ctx.append(" ");
            for (int i = 0; i < params.size(); i++) {
                if (i > 0) ctx.append(", ");
                formatParameter(params.get(i), ctx);
            }
            ctx.append(" ->");
        }
        List<Statement> statements = node.getBody().getStatements();
        if (statements.size() == 1 && statements.get(0) instanceof ExpressionStmt) {
            ctx.append(" ");
            statements.get(0).accept(this, ctx);
            ctx.append(" }");
            return null;
        }
        ctx.newLine();
        ctx.indent();
        for (Statement stmt : statements) {
            stmt.accept(this, ctx);
            ctx.newLine();
        }
        ctx.dedent();
        ctx.append("}");
        return null;
    }

    @Override
    public Void visitFunExpr(FunExpr node, FormatterContext ctx) {
        ctx.append("fun");
        formatParams(node.getParams(), ctx);
        ctx.append(" ");
        formatBlock(node.getBody(), ctx);
        return null;
    }

    /** 转义字符串字面量中的特殊字符 */
    static String escape(String value) {
        StringBuilder sb = new StringBuilder();
        for (int i = 0; i < value.length(); i++) {
            char c = value.charAt(i);
            switch (c) {
                case '\n': sb.append("\\n"); break;
                case '\r': sb.append("\\r"); break;
                case '\t': sb.append("\\t"); break;
                case '\\': sb.append("\\\\"); break;
                case '"': sb.append("\\\""); break;
                case '$': sb.append("\\$"); break;
                default: sb.append(c); break;
            }
        }
        return sb.toString();
    }
}
