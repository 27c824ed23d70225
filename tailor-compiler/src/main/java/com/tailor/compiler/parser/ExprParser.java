package com.tailor.compiler.parser;

import com.tailor.compiler.ast.SourceLocation;
import com.tailor.compiler.ast.decl.Parameter;
import com.tailor.compiler.ast.expr.*;
import com.tailor.compiler.ast.stmt.Block;
import com.tailor.compiler.ast.stmt.Statement;
import com.tailor.compiler.ast.type.TypeRef;
import com.tailor.compiler.lexer.Token;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import static com.tailor.compiler.lexer.TokenType.*;

/**
 * 表达式解析辅助类
 *
 * <p>赋值在 Tailor 中是语句，因此表达式的最低优先级是逻辑或。</p>
 */
class ExprParser {

    final Parser parser;

    ExprParser(Parser parser) {
        this.parser = parser;
    }

    Expression parseExpression() {
        return parseDisjunctionExpr();
    }

    List<Expression> parseExpressionList() {
        List<Expression> list = new ArrayList<>();
        do {
            if (parser.checkAny(RBRACKET, RPAREN)) break;  // 尾随逗号
            list.add(parseExpression());
        } while (parser.match(COMMA));
        return list;
    }

    // 逻辑或 ||
    private Expression parseDisjunctionExpr() {
        Expression left = parseConjunctionExpr();

        while (parser.match(OR)) {
            SourceLocation loc = parser.previousLocation();
            Expression right = parseConjunctionExpr();
            left = new BinaryExpr(loc, left, BinaryExpr.BinaryOp.OR, right);
        }

        return left;
    }

    // 逻辑与 &&
    private Expression parseConjunctionExpr() {
        Expression left = parseEqualityExpr();

        while (parser.match(AND)) {
            SourceLocation loc = parser.previousLocation();
            Expression right = parseEqualityExpr();
            left = new BinaryExpr(loc, left, BinaryExpr.BinaryOp.AND, right);
        }

        return left;
    }

    // 相等性 == !=
    private Expression parseEqualityExpr() {
        Expression left = parseComparisonExpr();

        while (parser.checkAny(EQ, NE)) {
            Token op = parser.advance();
            SourceLocation loc = parser.previousLocation();
            Expression right = parseComparisonExpr();
            BinaryExpr.BinaryOp binOp = op.getType() == EQ ?
                    BinaryExpr.BinaryOp.EQ : BinaryExpr.BinaryOp.NE;
            left = new BinaryExpr(loc, left, binOp, right);
        }

        return left;
    }

    // 比较 < > <= >=
    private Expression parseComparisonExpr() {
        Expression left = parseTypeCheckExpr();

        while (parser.checkAny(LT, GT, LE, GE)) {
            Token op = parser.advance();
            SourceLocation loc = parser.previousLocation();
            Expression right = parseTypeCheckExpr();
            BinaryExpr.BinaryOp binOp;
            switch (op.getType()) {
                case LT: binOp = BinaryExpr.BinaryOp.LT; break;
                case GT: binOp = BinaryExpr.BinaryOp.GT; break;
                case LE: binOp = BinaryExpr.BinaryOp.LE; break;
                case GE: binOp = BinaryExpr.BinaryOp.GE; break;
                default: throw new ParseException("Unexpected operator", op);
            }
            left = new BinaryExpr(loc, left, binOp, right);
        }

        return left;
    }

    // 类型检查与包含 is / !is / in
    private Expression parseTypeCheckExpr() {
        Expression left = parseAdditiveExpr();

        while (true) {
            if (parser.match(KW_IS)) {
                SourceLocation loc = parser.previousLocation();
                TypeRef type = parser.parseType();
                left = new TypeCheckExpr(loc, left, type, false);
            } else if (parser.check(NOT) && parser.checkAhead(KW_IS)) {
                parser.advance();
                parser.advance();
                SourceLocation loc = parser.previousLocation();
                TypeRef type = parser.parseType();
                left = new TypeCheckExpr(loc, left, type, true);
            } else if (parser.match(KW_IN)) {
                SourceLocation loc = parser.previousLocation();
                Expression right = parseAdditiveExpr();
                left = new BinaryExpr(loc, left, BinaryExpr.BinaryOp.IN, right);
            } else {
                break;
            }
        }

        return left;
    }

    // 加减 + -
    private Expression parseAdditiveExpr() {
        Expression left = parseMultiplicativeExpr();

        while (parser.checkAny(PLUS, MINUS)) {
            Token op = parser.advance();
            SourceLocation loc = parser.previousLocation();
            Expression right = parseMultiplicativeExpr();
            BinaryExpr.BinaryOp binOp = op.getType() == PLUS ?
                    BinaryExpr.BinaryOp.ADD : BinaryExpr.BinaryOp.SUB;
            left = new BinaryExpr(loc, left, binOp, right);
        }

        return left;
    }

    // 乘除余 * / %
    private Expression parseMultiplicativeExpr() {
        Expression left = parsePrefixExpr();

        while (parser.checkAny(MUL, DIV, MOD)) {
            Token op = parser.advance();
            SourceLocation loc = parser.previousLocation();
            Expression right = parsePrefixExpr();
            BinaryExpr.BinaryOp binOp;
            switch (op.getType()) {
                case MUL: binOp = BinaryExpr.BinaryOp.MUL; break;
                case DIV: binOp = BinaryExpr.BinaryOp.DIV; break;
                case MOD: binOp = BinaryExpr.BinaryOp.MOD; break;
                default: throw new ParseException("Unexpected operator", op);
            }
            left = new BinaryExpr(loc, left, binOp, right);
        }

        return left;
    }

    // 前缀 - + !
    private Expression parsePrefixExpr() {
        if (parser.checkAny(MINUS, PLUS, NOT)) {
            Token op = parser.advance();
            SourceLocation loc = parser.previousLocation();
            Expression operand = parsePrefixExpr();  // 右结合
            UnaryExpr.UnaryOp unaryOp;
            switch (op.getType()) {
                case MINUS: unaryOp = UnaryExpr.UnaryOp.NEG; break;
                case PLUS: unaryOp = UnaryExpr.UnaryOp.POS; break;
                case NOT: unaryOp = UnaryExpr.UnaryOp.NOT; break;
                default: throw new ParseException("Unexpected operator", op);
            }
            return new UnaryExpr(loc, unaryOp, operand);
        }

        return parsePostfixExpr();
    }

    // 后缀 . () []
    private Expression parsePostfixExpr() {
        Expression expr = parsePrimaryExpr();

        while (true) {
            // 前瞻：换行后紧跟 . ，视为表达式延续（方法链换行）
            if (parser.check(NEWLINE)) {
                parser.mark();
                parser.skipNewlines();
                if (parser.check(DOT)) {
                    parser.commitMark();
                } else {
                    parser.reset();
                }
            }

            SourceLocation loc = parser.location();

            if (parser.match(DOT)) {
                String member = parser.expectMemberName();
                expr = new MemberExpr(loc, expr, member);
            } else if (parser.check(LPAREN)) {
                List<CallExpr.Argument> args = parseCallArgs();
                expr = new CallExpr(loc, expr, args);
            } else if (parser.match(LBRACKET)) {
                Expression index = parseExpression();
                parser.expect(RBRACKET, "Expected ']' after index");
                expr = new IndexExpr(loc, expr, index);
            } else {
                break;
            }
        }

        return expr;
    }

    List<CallExpr.Argument> parseCallArgs() {
        parser.expect(LPAREN, "Expected '('");
        List<CallExpr.Argument> args = new ArrayList<>();

        if (!parser.check(RPAREN)) {
            do {
                if (parser.check(RPAREN)) break;  // 尾随逗号
                args.add(parseCallArg());
            } while (parser.match(COMMA));
        }

        parser.expect(RPAREN, "Expected ')'");
        return args;
    }

    private CallExpr.Argument parseCallArg() {
        String name = null;
        // 检查是否是命名参数
        if (parser.check(IDENTIFIER) && parser.checkAhead(ASSIGN)) {
            name = parser.advance().getLexeme();
            parser.advance();  // consume '='
        }

        Expression value = parseExpression();
        return new CallExpr.Argument(name, value);
    }

    private Expression parsePrimaryExpr() {
        SourceLocation loc = parser.location();

        // 数字字面量
        if (parser.checkAny(INT_LITERAL, LONG_LITERAL, DOUBLE_LITERAL)) {
            return parseNumericLiteral();
        }

        // 字符串字面量
        if (parser.check(STRING_LITERAL)) {
            return parseStringLiteral();
        }

        if (parser.match(KW_TRUE)) {
            return new Literal(parser.previousLocation(), true, Literal.LiteralKind.BOOLEAN);
        }
        if (parser.match(KW_FALSE)) {
            return new Literal(parser.previousLocation(), false, Literal.LiteralKind.BOOLEAN);
        }
        if (parser.match(KW_NULL)) {
            return new Literal(parser.previousLocation(), null, Literal.LiteralKind.NULL);
        }

        // 标识符
        if (parser.check(IDENTIFIER)) {
            String name = parser.advance().getLexeme();
            return new Identifier(parser.previousLocation(), name);
        }

        // 括号表达式
        if (parser.match(LPAREN)) {
            Expression expr = parseExpression();
            parser.expect(RPAREN, "Expected ')'");
            return expr;
        }

        // 列表字面量 [...]
        if (parser.check(LBRACKET)) {
            return parseListLiteral();
        }

        // Lambda {...}
        if (parser.check(LBRACE)) {
            return parseLambda();
        }

        // 匿名函数 fun(x) { ... }
        if (parser.check(KW_FUN) && parser.checkAhead(LPAREN)) {
            parser.advance();
            List<Parameter> params = parser.declParser.parseParams();
            Block body = parser.parseBlock();
            return new FunExpr(loc, params, body);
        }

        throw new ParseException("Expected expression", parser.current);
    }

    // 数字字面量: INT, LONG, DOUBLE
    private Expression parseNumericLiteral() {
        Token tok = parser.advance();
        SourceLocation loc = parser.previousLocation();
        switch (tok.getType()) {
            case INT_LITERAL:
                return new Literal(loc, tok.getLiteral(), Literal.LiteralKind.INT);
            case LONG_LITERAL:
                return new Literal(loc, tok.getLiteral(), Literal.LiteralKind.LONG);
            case DOUBLE_LITERAL:
                return new Literal(loc, tok.getLiteral(), Literal.LiteralKind.DOUBLE);
            default:
                throw new ParseException("Unexpected numeric literal", tok);
        }
    }

    // 字符串字面量（可能含插值）
    private Expression parseStringLiteral() {
        Token tok = parser.advance();
        SourceLocation loc = parser.previousLocation();
        String content = (String) tok.getLiteral();

        if (parser.literalHelper.hasInterpolation(content)) {
            return parser.literalHelper.buildStringInterpolation(loc, tok, content);
        }
        return new Literal(loc, parser.literalHelper.parseStringValue(content), Literal.LiteralKind.STRING);
    }

    private Expression parseListLiteral() {
        SourceLocation loc = parser.location();
        parser.expect(LBRACKET, "Expected '['");

        List<Expression> elements = Collections.emptyList();
        if (!parser.check(RBRACKET)) {
            elements = parseExpressionList();
        }

        parser.expect(RBRACKET, "Expected ']'");
        return new ListLiteral(loc, elements);
    }

    private Expression parseLambda() {
        SourceLocation loc = parser.location();
        parser.expect(LBRACE, "Expected '{'");
        parser.skipNewlines();

        // Lambda 参数列表判断：{ a, b -> ... }
        List<Parameter> params = Collections.emptyList();
        if (parser.check(IDENTIFIER) && (parser.checkAhead(ARROW) || parser.checkAhead(COMMA)
                || parser.checkAhead(COLON))) {
            parser.mark();
            List<Parameter> candidate = tryParseLambdaParams();
            if (candidate != null) {
                parser.commitMark();
                params = candidate;
            } else {
                parser.reset();
            }
        }

        List<Statement> statements = parser.stmtParser.parseStatementsUntilBrace();
        parser.expect(RBRACE, "Expected '}'");
        return new LambdaExpr(loc, params, new Block(loc, statements));
    }

    /** 尝试解析 "a, b: Type ->"，不匹配时返回 null */
    private List<Parameter> tryParseLambdaParams() {
        List<Parameter> params = new ArrayList<>();
        do {
            if (!parser.check(IDENTIFIER)) return null;
            SourceLocation paramLoc = parser.location();
            String name = parser.advance().getLexeme();
            TypeRef type = null;
            if (parser.match(COLON)) {
                if (!parser.check(IDENTIFIER)) return null;
                type = parser.parseType();
            }
            params.add(new Parameter(paramLoc, name, type, null));
        } while (parser.match(COMMA));
        return parser.match(ARROW) ? params : null;
    }
}
