package com.tailor.compiler.parser;

import com.tailor.compiler.ast.SourceLocation;
import com.tailor.compiler.ast.decl.FunDecl;
import com.tailor.compiler.ast.expr.Expression;
import com.tailor.compiler.ast.expr.Identifier;
import com.tailor.compiler.ast.expr.IndexExpr;
import com.tailor.compiler.ast.expr.MemberExpr;
import com.tailor.compiler.ast.stmt.*;
import com.tailor.compiler.ast.type.TypeRef;
import com.tailor.compiler.lexer.Token;
import com.tailor.compiler.lexer.TokenType;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import static com.tailor.compiler.lexer.TokenType.*;

/**
 * 语句解析辅助类
 */
class StmtParser {

    final Parser parser;

    StmtParser(Parser parser) {
        this.parser = parser;
    }

    Statement parseStatement() {
        parser.skipNewlines();

        // 文档注释只在函数声明前有意义，其他位置忽略
        if (parser.check(DOC_COMMENT) && !startsFunDecl(1)) {
            parser.advance();
            parser.skipSeparators();
            return parseStatement();
        }
        if (parser.checkAny(DOC_COMMENT, AT) || (parser.check(KW_FUN) && parser.checkAhead(IDENTIFIER))) {
            SourceLocation loc = parser.location();
            FunDecl decl = parser.parseFunDecl();
            return new FunDeclStmt(loc, decl);
        }
        if (parser.check(KW_IF)) {
            return parseIfStmt();
        }
        if (parser.check(KW_WHEN)) {
            return parseWhenStmt();
        }
        if (parser.check(KW_FOR)) {
            return parseForStmt();
        }
        if (parser.check(KW_WHILE)) {
            return parseWhileStmt();
        }
        if (parser.check(KW_TRY)) {
            return parseTryStmt();
        }
        if (parser.check(KW_RETURN)) {
            return parseReturnStmt();
        }
        if (parser.check(KW_BREAK)) {
            return parseBreakStmt();
        }
        if (parser.check(KW_CONTINUE)) {
            return parseContinueStmt();
        }
        if (parser.check(KW_THROW)) {
            return parseThrowStmt();
        }
        if (parser.check(KW_USE)) {
            return parseUseStmt();
        }
        if (parser.checkAny(KW_VAL, KW_VAR)) {
            return parseLocalVariable();
        }
        if (parser.check(KW_IMPORT)) {
            return parseImportStmt();
        }
        if (parser.check(KW_GLOBAL)) {
            return parseGlobalStmt();
        }
        if (parser.check(KW_DELETE)) {
            return parseDeleteStmt();
        }

        // 表达式语句或赋值
        return parseExpressionOrAssignment();
    }

    /** 从当前位置偏移 n 处开始（跳过换行）是否为函数声明 */
    private boolean startsFunDecl(int n) {
        while (parser.peek(n).getType() == NEWLINE) n++;
        Token token = parser.peek(n);
        return token.getType() == AT
                || (token.getType() == KW_FUN && parser.peek(n + 1).getType() == IDENTIFIER);
    }

    Block parseBlock() {
        SourceLocation loc = parser.location();
        parser.expect(LBRACE, "Expected '{'");
        List<Statement> statements = parseStatementsUntilBrace();
        parser.expect(RBRACE, "Expected '}'");
        return new Block(loc, statements);
    }

    /**
     * 解析语句直到遇到 '}'（不消费）
     */
    List<Statement> parseStatementsUntilBrace() {
        List<Statement> statements = new ArrayList<>();
        parser.skipSeparators();
        while (!parser.check(RBRACE) && !parser.isAtEnd()) {
            statements.add(parseStatement());
            parser.skipSeparators();
        }
        return statements;
    }

    /**
     * 分支体：代码块，或单条语句（包装为只含一条语句的块）
     */
    private Block parseBranchBody() {
        parser.skipNewlines();
        if (parser.check(LBRACE)) {
            return parseBlock();
        }
        SourceLocation loc = parser.location();
        Statement stmt = parseStatement();
        return new Block(loc, Collections.singletonList(stmt));
    }

    Statement parseExpressionOrAssignment() {
        SourceLocation loc = parser.location();
        Expression expr = parser.parseExpression();

        if (parser.current.getType().isAssignmentOp()) {
            Token op = parser.advance();
            if (!(expr instanceof Identifier) && !(expr instanceof MemberExpr) && !(expr instanceof IndexExpr)) {
                throw new ParseException("Invalid assignment target", op);
            }
            AssignStmt.AssignOp assignOp;
            switch (op.getType()) {
                case ASSIGN: assignOp = AssignStmt.AssignOp.ASSIGN; break;
                case PLUS_ASSIGN: assignOp = AssignStmt.AssignOp.ADD_ASSIGN; break;
                case MINUS_ASSIGN: assignOp = AssignStmt.AssignOp.SUB_ASSIGN; break;
                case MUL_ASSIGN: assignOp = AssignStmt.AssignOp.MUL_ASSIGN; break;
                case DIV_ASSIGN: assignOp = AssignStmt.AssignOp.DIV_ASSIGN; break;
                case MOD_ASSIGN: assignOp = AssignStmt.AssignOp.MOD_ASSIGN; break;
                default: throw new ParseException("Unexpected assignment operator", op);
            }
            Expression value = parser.parseExpression();
            parser.expectStatementEnd();
            return new AssignStmt(loc, expr, assignOp, value);
        }

        parser.expectStatementEnd();
        return new ExpressionStmt(loc, expr);
    }

    Statement parseLocalVariable() {
        SourceLocation loc = parser.location();
        boolean isVal = parser.match(KW_VAL);
        if (!isVal) {
            parser.expect(KW_VAR, "Expected 'val' or 'var'");
        }
        String name = parser.expect(IDENTIFIER, "Expected variable name").getLexeme();

        TypeRef type = null;
        if (parser.match(COLON)) {
            type = parser.parseType();
        }

        Expression initializer = null;
        if (parser.match(ASSIGN)) {
            initializer = parser.parseExpression();
        } else if (isVal) {
            throw new ParseException("'val' declaration requires an initializer", parser.current, "=");
        }

        parser.expectStatementEnd();
        return new PropertyStmt(loc, !isVal, name, type, initializer);
    }

    private IfStmt parseIfStmt() {
        SourceLocation loc = parser.location();
        parser.expect(KW_IF, "Expected 'if'");
        parser.expect(LPAREN, "Expected '('");
        Expression condition = parser.parseExpression();
        parser.expect(RPAREN, "Expected ')'");

        Block thenBranch = parseBranchBody();

        Statement elseBranch = null;
        parser.mark();
        parser.skipNewlines();
        if (parser.match(KW_ELSE)) {
            parser.commitMark();
            parser.skipNewlines();
            if (parser.check(KW_IF)) {
                elseBranch = parseIfStmt();
            } else {
                elseBranch = parseBranchBody();
            }
        } else {
            parser.reset();
        }

        return new IfStmt(loc, condition, thenBranch, elseBranch);
    }

    private WhenStmt parseWhenStmt() {
        SourceLocation loc = parser.location();
        parser.expect(KW_WHEN, "Expected 'when'");

        Expression subject = null;
        if (parser.match(LPAREN)) {
            subject = parser.parseExpression();
            parser.expect(RPAREN, "Expected ')'");
        }

        parser.skipNewlines();
        parser.expect(LBRACE, "Expected '{'");
        parser.skipSeparators();

        List<WhenBranch> branches = new ArrayList<>();
        while (!parser.check(RBRACE) && !parser.isAtEnd()) {
            branches.add(parseWhenBranch(subject != null));
            parser.skipSeparators();
        }

        parser.expect(RBRACE, "Expected '}'");
        return new WhenStmt(loc, subject, branches);
    }

    WhenBranch parseWhenBranch(boolean hasSubject) {
        SourceLocation loc = parser.location();
        List<WhenBranch.WhenCondition> conditions = new ArrayList<>();

        if (!parser.match(KW_ELSE)) {
            do {
                conditions.add(parseWhenCondition(hasSubject));
            } while (parser.match(COMMA));
        }

        parser.expect(ARROW, "Expected '->'");
        Block body = parseBranchBody();
        return new WhenBranch(loc, conditions, body);
    }

    WhenBranch.WhenCondition parseWhenCondition(boolean hasSubject) {
        if (hasSubject && parser.match(KW_IS)) {
            return WhenBranch.WhenCondition.type(parser.parseType(), false);
        }
        if (hasSubject && parser.check(NOT) && parser.checkAhead(KW_IS)) {
            parser.advance();
            parser.advance();
            return WhenBranch.WhenCondition.type(parser.parseType(), true);
        }
        return WhenBranch.WhenCondition.value(parser.parseExpression());
    }

    private ForStmt parseForStmt() {
        SourceLocation loc = parser.location();
        parser.expect(KW_FOR, "Expected 'for'");
        parser.expect(LPAREN, "Expected '('");
        String variable = parser.expect(IDENTIFIER, "Expected variable name").getLexeme();
        parser.expect(KW_IN, "Expected 'in'");
        Expression iterable = parser.parseExpression();
        parser.expect(RPAREN, "Expected ')'");
        Block body = parseBranchBody();
        return new ForStmt(loc, variable, iterable, body);
    }

    private WhileStmt parseWhileStmt() {
        SourceLocation loc = parser.location();
        parser.expect(KW_WHILE, "Expected 'while'");
        parser.expect(LPAREN, "Expected '('");
        Expression condition = parser.parseExpression();
        parser.expect(RPAREN, "Expected ')'");
        Block body = parseBranchBody();
        return new WhileStmt(loc, condition, body);
    }

    private TryStmt parseTryStmt() {
        SourceLocation loc = parser.location();
        parser.expect(KW_TRY, "Expected 'try'");
        Block tryBlock = parseBlock();

        List<CatchClause> catchClauses = new ArrayList<>();
        while (peekPastNewlines(KW_CATCH)) {
            parser.skipNewlines();
            catchClauses.add(parseCatchClause());
        }

        Block elseBlock = null;
        if (!catchClauses.isEmpty() && peekPastNewlines(KW_ELSE)) {
            parser.skipNewlines();
            parser.expect(KW_ELSE, "Expected 'else'");
            elseBlock = parseBlock();
        }

        Block finallyBlock = null;
        if (peekPastNewlines(KW_FINALLY)) {
            parser.skipNewlines();
            parser.expect(KW_FINALLY, "Expected 'finally'");
            finallyBlock = parseBlock();
        }

        if (catchClauses.isEmpty() && finallyBlock == null) {
            throw new ParseException("'try' requires at least one 'catch' or a 'finally' block",
                    parser.current, "catch");
        }
        return new TryStmt(loc, tryBlock, catchClauses, elseBlock, finallyBlock);
    }

    /** 跳过换行后当前 token 是否为 type（不消费） */
    private boolean peekPastNewlines(TokenType type) {
        int n = 0;
        while (parser.peek(n).getType() == NEWLINE) n++;
        return parser.peek(n).getType() == type;
    }

    CatchClause parseCatchClause() {
        SourceLocation loc = parser.location();
        parser.expect(KW_CATCH, "Expected 'catch'");
        parser.expect(LPAREN, "Expected '('");
        String paramName = parser.expect(IDENTIFIER, "Expected parameter name").getLexeme();
        TypeRef paramType = null;
        if (parser.match(COLON)) {
            paramType = parser.parseType();
        }
        parser.expect(RPAREN, "Expected ')'");
        Block body = parseBlock();

        return new CatchClause(loc, paramName, paramType, body);
    }

    ReturnStmt parseReturnStmt() {
        SourceLocation loc = parser.location();
        parser.expect(KW_RETURN, "Expected 'return'");

        Expression value = null;
        if (!parser.checkAny(NEWLINE, SEMICOLON, RBRACE, EOF)) {
            value = parser.parseExpression();
        }

        parser.expectStatementEnd();
        return new ReturnStmt(loc, value);
    }

    BreakStmt parseBreakStmt() {
        SourceLocation loc = parser.location();
        parser.expect(KW_BREAK, "Expected 'break'");
        parser.expectStatementEnd();
        return new BreakStmt(loc);
    }

    ContinueStmt parseContinueStmt() {
        SourceLocation loc = parser.location();
        parser.expect(KW_CONTINUE, "Expected 'continue'");
        parser.expectStatementEnd();
        return new ContinueStmt(loc);
    }

    ThrowStmt parseThrowStmt() {
        SourceLocation loc = parser.location();
        parser.expect(KW_THROW, "Expected 'throw'");
        Expression exception = parser.parseExpression();
        parser.expectStatementEnd();
        return new ThrowStmt(loc, exception);
    }

    private UseStmt parseUseStmt() {
        SourceLocation loc = parser.location();
        parser.expect(KW_USE, "Expected 'use'");
        parser.expect(LPAREN, "Expected '('");

        List<UseStmt.UseBinding> bindings = new ArrayList<>();
        do {
            bindings.add(parseUseBinding());
        } while (parser.match(COMMA));

        parser.expect(RPAREN, "Expected ')'");
        Block body = parseBlock();

        return new UseStmt(loc, bindings, body);
    }

    private UseStmt.UseBinding parseUseBinding() {
        SourceLocation loc = parser.location();
        parser.expect(KW_VAL, "Expected 'val'");
        String name = parser.expect(IDENTIFIER, "Expected variable name").getLexeme();
        parser.expect(ASSIGN, "Expected '='");
        Expression initializer = parser.parseExpression();
        return new UseStmt.UseBinding(loc, name, initializer);
    }

    private ImportStmt parseImportStmt() {
        SourceLocation loc = parser.location();
        parser.expect(KW_IMPORT, "Expected 'import'");
        StringBuilder name = new StringBuilder(parser.expect(IDENTIFIER, "Expected module name").getLexeme());
        while (parser.match(DOT)) {
            name.append('.').append(parser.expect(IDENTIFIER, "Expected module name").getLexeme());
        }
        String alias = null;
        if (parser.match(KW_AS)) {
            alias = parser.expect(IDENTIFIER, "Expected alias").getLexeme();
        }
        parser.expectStatementEnd();
        return new ImportStmt(loc, name.toString(), alias);
    }

    private GlobalStmt parseGlobalStmt() {
        SourceLocation loc = parser.location();
        parser.expect(KW_GLOBAL, "Expected 'global'");
        List<String> names = new ArrayList<>();
        do {
            names.add(parser.expect(IDENTIFIER, "Expected variable name").getLexeme());
        } while (parser.match(COMMA));
        parser.expectStatementEnd();
        return new GlobalStmt(loc, names);
    }

    private DeleteStmt parseDeleteStmt() {
        SourceLocation loc = parser.location();
        parser.expect(KW_DELETE, "Expected 'delete'");
        String name = parser.expect(IDENTIFIER, "Expected variable name").getLexeme();
        parser.expectStatementEnd();
        return new DeleteStmt(loc, name);
    }
}
