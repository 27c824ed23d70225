package com.tailor.compiler.parser;

import com.tailor.compiler.ast.SourceLocation;
import com.tailor.compiler.ast.decl.FunDecl;
import com.tailor.compiler.ast.decl.Program;
import com.tailor.compiler.ast.expr.Expression;
import com.tailor.compiler.ast.stmt.Block;
import com.tailor.compiler.ast.stmt.Statement;
import com.tailor.compiler.ast.type.TypeRef;
import com.tailor.compiler.lexer.Lexer;
import com.tailor.compiler.lexer.Token;
import com.tailor.compiler.lexer.TokenType;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;

import static com.tailor.compiler.lexer.TokenType.*;

/**
 * Tailor 语法分析器（递归下降）
 *
 * <p>Token 流在构造时一次性扫描完成，mark/reset 只需记录下标。</p>
 */
@SuppressWarnings("this-escape")
public class Parser {

    final String fileName;
    private final List<Token> tokens;
    private int position;
    Token current;
    Token previous;

    // mark/reset 回溯支持
    private final Deque<Integer> marks = new ArrayDeque<>();

    // === Helper 实例 ===
    final LiteralHelper literalHelper = new LiteralHelper(this);
    final DeclParser declParser = new DeclParser(this);
    final StmtParser stmtParser = new StmtParser(this);
    final ExprParser exprParser = new ExprParser(this);

    public Parser(Lexer lexer, String fileName) {
        this.fileName = fileName;
        this.tokens = lexer.scanTokens();
        this.position = 0;
        this.current = tokens.get(0);
        checkError(current);
    }

    // ============ 基础方法 ============

    /**
     * 前进到下一个 token
     */
    Token advance() {
        previous = current;
        if (position < tokens.size() - 1) {
            position++;
        }
        current = tokens.get(position);
        checkError(current);
        return previous;
    }

    private void checkError(Token token) {
        if (token.getType() == ERROR) {
            throw new ParseException(String.valueOf(token.getLiteral()), token);
        }
    }

    /**
     * 查看当前 token 之后第 n 个 token（不消费）
     */
    Token peek(int n) {
        int index = Math.min(position + n, tokens.size() - 1);
        return tokens.get(index);
    }

    /**
     * 标记当前位置，用于回溯
     */
    void mark() {
        marks.push(position);
    }

    /**
     * 回溯到最近标记的位置
     */
    void reset() {
        position = marks.pop();
        current = tokens.get(position);
        previous = position > 0 ? tokens.get(position - 1) : null;
    }

    /**
     * 提交标记（放弃回溯能力）
     */
    void commitMark() {
        marks.pop();
    }

    /**
     * 检查当前 token 类型
     */
    boolean check(TokenType type) {
        return current.getType() == type;
    }

    /**
     * 检查当前 token 是否为给定类型之一
     */
    boolean checkAny(TokenType... types) {
        for (TokenType type : types) {
            if (check(type)) return true;
        }
        return false;
    }

    /**
     * 检查下一个 token 类型
     */
    boolean checkAhead(TokenType type) {
        return peek(1).getType() == type;
    }

    /**
     * 如果当前 token 匹配，则前进
     */
    boolean match(TokenType type) {
        if (check(type)) {
            advance();
            return true;
        }
        return false;
    }

    /**
     * 如果当前 token 匹配任一类型，则前进
     */
    boolean matchAny(TokenType... types) {
        for (TokenType type : types) {
            if (match(type)) return true;
        }
        return false;
    }

    /**
     * 期望特定 token，否则报错
     */
    Token expect(TokenType type, String message) {
        if (check(type)) {
            return advance();
        }
        throw new ParseException(message, current, type.name());
    }

    /**
     * 解析成员名：标识符或关键字（.后允许关键字作为成员名）
     */
    String expectMemberName() {
        if (check(IDENTIFIER) || current.getType().isKeyword()) {
            return advance().getLexeme();
        }
        throw new ParseException("Expected member name", current, "IDENTIFIER");
    }

    /**
     * 创建源码位置
     */
    SourceLocation location() {
        return new SourceLocation(fileName, current.getLine(), current.getColumn(),
                current.getOffset(), current.getLexeme().length());
    }

    /**
     * 从之前的 token 创建位置
     */
    SourceLocation previousLocation() {
        return new SourceLocation(fileName, previous.getLine(), previous.getColumn(),
                previous.getOffset(), previous.getLexeme().length());
    }

    /**
     * 是否到达文件末尾
     */
    boolean isAtEnd() {
        return check(EOF);
    }

    /**
     * 跳过换行
     */
    void skipNewlines() {
        while (match(NEWLINE)) {
            // 跳过
        }
    }

    void skipSeparators() {
        while (matchAny(NEWLINE, SEMICOLON)) {
            // 跳过换行符和分号
        }
    }

    /**
     * 简单语句结束：换行、分号、右花括号、文件末尾，或单行 if 中的 else
     */
    void expectStatementEnd() {
        if (matchAny(NEWLINE, SEMICOLON)) return;
        if (checkAny(RBRACE, EOF, KW_ELSE)) return;
        throw new ParseException("Expected end of statement", current);
    }

    // ============ 程序解析 ============

    /**
     * 解析整个模块
     */
    public Program parse() {
        SourceLocation loc = location();
        List<Statement> statements = new ArrayList<>();
        skipSeparators();
        while (!isAtEnd()) {
            statements.add(parseStatement());
            skipSeparators();
        }
        return new Program(loc, fileName, statements);
    }

    /**
     * 解析恰好一个函数定义（可带文档注释和注解），之后只允许空白。
     */
    public FunDecl parseFunctionDefinition() {
        skipSeparators();
        if (!checkAny(DOC_COMMENT, AT, KW_FUN)) {
            throw new ParseException("Expected function definition", current, "fun");
        }
        FunDecl decl = declParser.parseFunDecl();
        skipSeparators();
        if (!isAtEnd()) {
            throw new ParseException("Unexpected content after function definition", current);
        }
        return decl;
    }

    /**
     * 解析单个表达式（用于字符串插值和交互输入）
     */
    public Expression parseStandaloneExpression() {
        skipNewlines();
        Expression expr = parseExpression();
        skipSeparators();
        if (!isAtEnd()) {
            throw new ParseException("Unexpected content after expression", current);
        }
        return expr;
    }

    // ============ 委托 ============

    FunDecl parseFunDecl() { return declParser.parseFunDecl(); }
    TypeRef parseType() { return declParser.parseType(); }

    Statement parseStatement() { return stmtParser.parseStatement(); }
    Block parseBlock() { return stmtParser.parseBlock(); }

    Expression parseExpression() { return exprParser.parseExpression(); }
    List<Expression> parseExpressionList() { return exprParser.parseExpressionList(); }
}
