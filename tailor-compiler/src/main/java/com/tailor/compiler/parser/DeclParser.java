package com.tailor.compiler.parser;

import com.tailor.compiler.ast.SourceLocation;
import com.tailor.compiler.ast.decl.Annotation;
import com.tailor.compiler.ast.decl.FunDecl;
import com.tailor.compiler.ast.decl.Parameter;
import com.tailor.compiler.ast.expr.CallExpr;
import com.tailor.compiler.ast.expr.Expression;
import com.tailor.compiler.ast.stmt.Block;
import com.tailor.compiler.ast.type.TypeRef;
import com.tailor.compiler.lexer.Token;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

import static com.tailor.compiler.lexer.TokenType.*;

/**
 * 声明解析辅助类：函数、参数、注解、类型
 */
class DeclParser {

    final Parser parser;

    DeclParser(Parser parser) {
        this.parser = parser;
    }

    /**
     * 解析函数声明：[文档注释] [注解...] fun name(params) [: Type] { body }
     */
    FunDecl parseFunDecl() {
        int sourceStart = parser.current.getOffset();
        String docComment = null;
        List<Annotation> annotations = new ArrayList<>();

        while (parser.checkAny(DOC_COMMENT, AT)) {
            if (parser.check(DOC_COMMENT)) {
                docComment = (String) parser.advance().getLiteral();
            } else {
                annotations.add(parseAnnotation());
            }
            parser.skipNewlines();
        }

        SourceLocation loc = parser.location();
        parser.expect(KW_FUN, "Expected 'fun'");
        String name = parser.expect(IDENTIFIER, "Expected function name").getLexeme();
        List<Parameter> params = parseParams();

        TypeRef returnType = null;
        if (parser.match(COLON)) {
            returnType = parseType();
        }

        Block body = parser.parseBlock();
        int sourceEnd = parser.previous.getEndOffset();
        return new FunDecl(loc, annotations, docComment, name, params, returnType, body,
                sourceStart, sourceEnd);
    }

    /**
     * 解析参数列表 (a, b: Int, c = 1)
     */
    List<Parameter> parseParams() {
        parser.expect(LPAREN, "Expected '('");
        List<Parameter> params = new ArrayList<>();
        Set<String> seen = new HashSet<>();

        if (!parser.check(RPAREN)) {
            do {
                if (parser.check(RPAREN)) break;  // 尾随逗号
                Parameter param = parseParameter();
                if (!seen.add(param.getName())) {
                    throw new ParseException("Duplicate parameter name '" + param.getName() + "'",
                            parser.previous);
                }
                params.add(param);
            } while (parser.match(COMMA));
        }

        parser.expect(RPAREN, "Expected ')'");
        return params;
    }

    private Parameter parseParameter() {
        SourceLocation loc = parser.location();
        String name = parser.expect(IDENTIFIER, "Expected parameter name").getLexeme();

        TypeRef type = null;
        if (parser.match(COLON)) {
            type = parseType();
        }

        Expression defaultValue = null;
        if (parser.match(ASSIGN)) {
            defaultValue = parser.parseExpression();
        }

        return new Parameter(loc, name, type, defaultValue);
    }

    /**
     * 解析注解：@name 或 @name(args)
     */
    Annotation parseAnnotation() {
        SourceLocation loc = parser.location();
        parser.expect(AT, "Expected '@'");
        String name = parser.expect(IDENTIFIER, "Expected annotation name").getLexeme();

        List<CallExpr.Argument> args = Collections.emptyList();
        if (parser.check(LPAREN)) {
            args = parser.exprParser.parseCallArgs();
        }
        return new Annotation(loc, name, args);
    }

    /**
     * 解析类型引用：Name、a.b.Name、Name?
     */
    TypeRef parseType() {
        SourceLocation loc = parser.location();
        Token first = parser.expect(IDENTIFIER, "Expected type name");
        StringBuilder name = new StringBuilder(first.getLexeme());
        while (parser.check(DOT) && parser.peek(1).getType() == IDENTIFIER) {
            parser.advance();
            name.append('.').append(parser.advance().getLexeme());
        }
        boolean nullable = parser.match(QUESTION);
        return new TypeRef(loc, name.toString(), nullable);
    }
}
