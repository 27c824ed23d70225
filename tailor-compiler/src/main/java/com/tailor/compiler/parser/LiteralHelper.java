package com.tailor.compiler.parser;

import com.tailor.compiler.ast.SourceLocation;
import com.tailor.compiler.ast.expr.*;
import com.tailor.compiler.lexer.Lexer;
import com.tailor.compiler.lexer.Token;

import java.util.ArrayList;
import java.util.List;

/**
 * 字面量解析辅助类：字符串转义与插值
 */
class LiteralHelper {

    final Parser parser;

    LiteralHelper(Parser parser) {
        this.parser = parser;
    }

    /**
     * 检查字符串内容是否包含未转义的 $ 插值
     */
    boolean hasInterpolation(String content) {
        for (int i = 0; i < content.length(); i++) {
            char c = content.charAt(i);
            if (c == '\\') { i++; continue; }
            if (c == '$' && i + 1 < content.length()) {
                char next = content.charAt(i + 1);
                if (next == '{' || Character.isLetter(next) || next == '_') {
                    return true;
                }
            }
        }
        return false;
    }

    /**
     * 将含有 $ 插值的字符串解析为 StringInterpolation 节点
     */
    Expression buildStringInterpolation(SourceLocation loc, Token token, String content) {
        List<Expression> parts = new ArrayList<>();
        StringBuilder literal = new StringBuilder();
        int i = 0;

        while (i < content.length()) {
            char c = content.charAt(i);

            if (c == '\\' && i + 1 < content.length()) {
                appendEscape(literal, content.charAt(i + 1));
                i += 2;
            } else if (c == '$' && i + 1 < content.length()) {
                char next = content.charAt(i + 1);

                if (next == '{') {
                    // ${expression}
                    flushLiteral(loc, literal, parts);
                    i += 2; // skip ${
                    int braceDepth = 1;
                    StringBuilder exprStr = new StringBuilder();
                    while (i < content.length() && braceDepth > 0) {
                        char ch = content.charAt(i);
                        if (ch == '{') braceDepth++;
                        else if (ch == '}') braceDepth--;
                        if (braceDepth > 0) exprStr.append(ch);
                        i++;
                    }
                    if (braceDepth > 0) {
                        throw new ParseException("Unterminated '${' in string template", token);
                    }
                    parts.add(parseEmbedded(token, exprStr.toString()));
                } else if (Character.isLetter(next) || next == '_') {
                    // $identifier
                    flushLiteral(loc, literal, parts);
                    i++; // skip $
                    StringBuilder ident = new StringBuilder();
                    while (i < content.length() &&
                           (Character.isLetterOrDigit(content.charAt(i)) || content.charAt(i) == '_')) {
                        ident.append(content.charAt(i));
                        i++;
                    }
                    parts.add(new Identifier(loc, ident.toString()));
                } else {
                    literal.append(c);
                    i++;
                }
            } else {
                literal.append(c);
                i++;
            }
        }

        flushLiteral(loc, literal, parts);
        return new StringInterpolation(loc, parts);
    }

    private void flushLiteral(SourceLocation loc, StringBuilder literal, List<Expression> parts) {
        if (literal.length() > 0) {
            parts.add(new Literal(loc, literal.toString(), Literal.LiteralKind.STRING));
            literal.setLength(0);
        }
    }

    private Expression parseEmbedded(Token token, String source) {
        // 用子 Lexer + 子 Parser 解析表达式
        Lexer subLexer = new Lexer(source, parser.fileName, token.getLine());
        try {
            Parser subParser = new Parser(subLexer, parser.fileName);
            return subParser.parseStandaloneExpression();
        } catch (ParseException e) {
            throw new ParseException("Invalid expression in string template: ${" + source + "}", token);
        }
    }

    /**
     * 处理转义字符，返回字符串值
     */
    String parseStringValue(String content) {
        StringBuilder sb = new StringBuilder();
        for (int i = 0; i < content.length(); i++) {
            char c = content.charAt(i);
            if (c == '\\' && i + 1 < content.length()) {
                appendEscape(sb, content.charAt(i + 1));
                i++;
            } else {
                sb.append(c);
            }
        }
        return sb.toString();
    }

    private static void appendEscape(StringBuilder sb, char next) {
        switch (next) {
            case 'n': sb.append('\n'); break;
            case 'r': sb.append('\r'); break;
            case 't': sb.append('\t'); break;
            case '\\': sb.append('\\'); break;
            case '"': sb.append('"'); break;
            case '$': sb.append('$'); break;
            default: sb.append('\\').append(next); break;
        }
    }
}
