package com.tailor.compiler.parser;

import com.tailor.compiler.lexer.Token;
import com.tailor.compiler.lexer.TokenType;

/**
 * 语法错误，带出错 token 的位置
 */
public class ParseException extends RuntimeException {
    private final int line;
    private final int column;
    private final String near;
    private final String expected;

    public ParseException(String message, Token token) {
        this(message, token, null);
    }

    public ParseException(String message, Token token, String expected) {
        super(message);
        this.line = token != null ? token.getLine() : 0;
        this.column = token != null ? token.getColumn() : 0;
        this.near = token == null ? null
                : token.getType() == TokenType.EOF ? "end of input" : "'" + token.getLexeme() + "'";
        this.expected = expected;
    }

    /** 行号，未知时为 0 */
    public int getLine() {
        return line;
    }

    /** 列号，未知时为 0 */
    public int getColumn() {
        return column;
    }

    public String getRawMessage() {
        return super.getMessage();
    }

    @Override
    public String getMessage() {
        String message = super.getMessage();
        if (near != null) {
            message += " near " + near + " (" + line + ":" + column + ")";
        }
        return expected != null ? message + ", expected " + expected : message;
    }
}
