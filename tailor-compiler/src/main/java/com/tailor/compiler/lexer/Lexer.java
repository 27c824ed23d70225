package com.tailor.compiler.lexer;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Deque;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Tailor 词法分析器
 *
 * <p>换行是语句分隔符，但在 {@code ( )} 和 {@code [ ]} 内部会被忽略，
 * 因此参数列表和列表字面量可以跨行书写。{@code { }} 内部恢复换行敏感。</p>
 *
 * <p>字符串字面量的 literal 保留引号内的原始文本（未处理转义和模板），
 * 由 parser 统一解析转义序列与 {@code $name} / {@code ${expr}} 插值。</p>
 */
public class Lexer {
    private final String source;
    private final String fileName;
    private final List<Token> tokens = new ArrayList<>();
    private final Deque<Character> brackets = new ArrayDeque<>();

    private int start = 0;
    private int current = 0;
    private int line;
    private int column = 1;

    // 关键词映射表
    private static final Map<String, TokenType> KEYWORDS;

    static {
        Map<String, TokenType> map = new HashMap<>();

        // 声明
        map.put("val", TokenType.KW_VAL);
        map.put("var", TokenType.KW_VAR);
        map.put("fun", TokenType.KW_FUN);
        map.put("import", TokenType.KW_IMPORT);
        map.put("global", TokenType.KW_GLOBAL);
        map.put("delete", TokenType.KW_DELETE);

        // 控制流
        map.put("if", TokenType.KW_IF);
        map.put("else", TokenType.KW_ELSE);
        map.put("when", TokenType.KW_WHEN);
        map.put("for", TokenType.KW_FOR);
        map.put("while", TokenType.KW_WHILE);
        map.put("return", TokenType.KW_RETURN);
        map.put("break", TokenType.KW_BREAK);
        map.put("continue", TokenType.KW_CONTINUE);
        map.put("throw", TokenType.KW_THROW);
        map.put("try", TokenType.KW_TRY);
        map.put("catch", TokenType.KW_CATCH);
        map.put("finally", TokenType.KW_FINALLY);
        map.put("use", TokenType.KW_USE);

        // 类型操作
        map.put("is", TokenType.KW_IS);
        map.put("as", TokenType.KW_AS);
        map.put("in", TokenType.KW_IN);
        map.put("true", TokenType.KW_TRUE);
        map.put("false", TokenType.KW_FALSE);
        map.put("null", TokenType.KW_NULL);

        KEYWORDS = Collections.unmodifiableMap(map);
    }

    /** 获取所有关键词集合 */
    public static Set<String> getKeywords() {
        return KEYWORDS.keySet();
    }

    public Lexer(String source, String fileName) {
        this(source, fileName, 1);
    }

    /**
     * @param firstLine 源码第一行对应的行号（源码是某个更大文件的片段时使用）
     */
    public Lexer(String source, String fileName, int firstLine) {
        this.source = source;
        this.fileName = fileName;
        this.line = firstLine;
    }

    public Lexer(String source) {
        this(source, "<input>");
    }

    public String getFileName() {
        return fileName;
    }

    /**
     * 执行词法分析，返回 Token 列表（以 EOF 结尾）
     */
    public List<Token> scanTokens() {
        while (!isAtEnd()) {
            start = current;
            scanToken();
        }

        tokens.add(new Token(TokenType.EOF, "", null, line, column, current));
        return tokens;
    }

    private void scanToken() {
        char c = advance();
        switch (c) {
            // 单字符 Token
            case '(': openBracket('('); addToken(TokenType.LPAREN); break;
            case ')': closeBracket(); addToken(TokenType.RPAREN); break;
            case '{': openBracket('{'); addToken(TokenType.LBRACE); break;
            case '}': closeBracket(); addToken(TokenType.RBRACE); break;
            case '[': openBracket('['); addToken(TokenType.LBRACKET); break;
            case ']': closeBracket(); addToken(TokenType.RBRACKET); break;
            case ',': addToken(TokenType.COMMA); break;
            case ';': addToken(TokenType.SEMICOLON); break;
            case '@': addToken(TokenType.AT); break;
            case '.': addToken(TokenType.DOT); break;
            case ':': addToken(TokenType.COLON); break;
            case '?': addToken(TokenType.QUESTION); break;

            case '+':
                addToken(match('=') ? TokenType.PLUS_ASSIGN : TokenType.PLUS);
                break;

            case '-':
                if (match('=')) addToken(TokenType.MINUS_ASSIGN);
                else if (match('>')) addToken(TokenType.ARROW);
                else addToken(TokenType.MINUS);
                break;

            case '*':
                addToken(match('=') ? TokenType.MUL_ASSIGN : TokenType.MUL);
                break;

            case '/':
                if (match('/')) {
                    // 单行注释
                    while (peek() != '\n' && !isAtEnd()) advance();
                } else if (match('*')) {
                    blockComment();
                } else if (match('=')) {
                    addToken(TokenType.DIV_ASSIGN);
                } else {
                    addToken(TokenType.DIV);
                }
                break;

            case '%':
                addToken(match('=') ? TokenType.MOD_ASSIGN : TokenType.MOD);
                break;

            case '=':
                addToken(match('=') ? TokenType.EQ : TokenType.ASSIGN);
                break;

            case '!':
                addToken(match('=') ? TokenType.NE : TokenType.NOT);
                break;

            case '<':
                addToken(match('=') ? TokenType.LE : TokenType.LT);
                break;

            case '>':
                addToken(match('=') ? TokenType.GE : TokenType.GT);
                break;

            case '&':
                if (match('&')) {
                    addToken(TokenType.AND);
                } else {
                    error("Unexpected character '&'. Did you mean '&&'?");
                }
                break;

            case '|':
                if (match('|')) {
                    addToken(TokenType.OR);
                } else {
                    error("Unexpected character '|'. Did you mean '||'?");
                }
                break;

            // 空白字符
            case ' ':
            case '\r':
            case '\t':
                break;

            case '\n':
                // ( ) 和 [ ] 内部的换行不是语句分隔符
                if (brackets.isEmpty() || brackets.peek() == '{') {
                    addToken(TokenType.NEWLINE);
                }
                newLine();
                break;

            case '"':
                string();
                break;

            default:
                if (isDigit(c)) {
                    number();
                } else if (isAlpha(c)) {
                    identifier();
                } else {
                    error("Unexpected character: " + c);
                }
                break;
        }
    }

    private void openBracket(char kind) {
        brackets.push(kind);
    }

    private void closeBracket() {
        if (!brackets.isEmpty()) {
            brackets.pop();
        }
    }

    // === 辅助方法 ===

    private boolean isAtEnd() {
        return current >= source.length();
    }

    private char advance() {
        char c = source.charAt(current++);
        column++;
        return c;
    }

    private boolean match(char expected) {
        if (isAtEnd()) return false;
        if (source.charAt(current) != expected) return false;
        current++;
        column++;
        return true;
    }

    private char peek() {
        if (isAtEnd()) return '\0';
        return source.charAt(current);
    }

    private char peekNext() {
        if (current + 1 >= source.length()) return '\0';
        return source.charAt(current + 1);
    }

    private void newLine() {
        line++;
        column = 1;
    }

    private boolean isDigit(char c) {
        return c >= '0' && c <= '9';
    }

    private boolean isAlpha(char c) {
        return (c >= 'a' && c <= 'z') ||
               (c >= 'A' && c <= 'Z') ||
               c == '_' ||
               Character.isLetter(c);
    }

    private boolean isAlphaNumeric(char c) {
        return isAlpha(c) || isDigit(c);
    }

    // === Token 构建 ===

    private void addToken(TokenType type) {
        addToken(type, null);
    }

    private void addToken(TokenType type, Object literal) {
        addToken(type, literal, line, column - (current - start));
    }

    private void addToken(TokenType type, Object literal, int tokenLine, int tokenColumn) {
        String lexeme = source.substring(start, current);
        tokens.add(new Token(type, lexeme, literal, tokenLine, tokenColumn, start));
    }

    // === 复杂 Token 扫描 ===

    private void string() {
        int tokenColumn = column - 1;
        int braceDepth = 0; // 跟踪 ${...} 花括号深度

        while (!isAtEnd()) {
            char c = peek();
            if (c == '"' && braceDepth == 0) {
                break;
            }
            if (c == '\n') {
                error("Unterminated string");
                return;
            }
            if (c == '\\') {
                advance();
                if (!isAtEnd()) advance();
                continue;
            }
            advance();
            if (c == '$' && peek() == '{') {
                advance();
                braceDepth++;
            } else if (c == '{' && braceDepth > 0) {
                braceDepth++;
            } else if (c == '}' && braceDepth > 0) {
                braceDepth--;
            }
        }

        if (isAtEnd()) {
            error("Unterminated string");
            return;
        }

        advance(); // 闭合的 "
        String raw = source.substring(start + 1, current - 1);
        addToken(TokenType.STRING_LITERAL, raw, line, tokenColumn);
    }

    /** 移除数字中的下划线分隔符 */
    private static String stripUnderscores(String text) {
        return text.indexOf('_') >= 0 ? text.replace("_", "") : text;
    }

    private void advanceDigits() {
        while (isDigit(peek()) || peek() == '_') advance();
    }

    private void number() {
        advanceDigits();

        boolean isDouble = false;
        // 小数部分
        if (peek() == '.' && isDigit(peekNext())) {
            isDouble = true;
            advance();
            advanceDigits();
        }
        // 指数部分
        if (peek() == 'e' || peek() == 'E') {
            isDouble = true;
            advance();
            if (peek() == '+' || peek() == '-') advance();
            advanceDigits();
        }

        if (isDouble) {
            String text = stripUnderscores(source.substring(start, current));
            try {
                addToken(TokenType.DOUBLE_LITERAL, Double.parseDouble(text));
            } catch (NumberFormatException e) {
                error("Invalid double literal: " + text);
            }
            return;
        }

        if (peek() == 'L' || peek() == 'l') {
            advance();
            String text = stripUnderscores(source.substring(start, current - 1));
            try {
                addToken(TokenType.LONG_LITERAL, Long.parseLong(text));
            } catch (NumberFormatException e) {
                error("Invalid long literal: " + text);
            }
            return;
        }

        String text = stripUnderscores(source.substring(start, current));
        try {
            addToken(TokenType.INT_LITERAL, Integer.parseInt(text));
        } catch (NumberFormatException e) {
            error("Invalid integer literal: " + text);
        }
    }

    private void identifier() {
        while (isAlphaNumeric(peek())) advance();

        String text = source.substring(start, current);
        TokenType type = KEYWORDS.get(text);
        if (type == null) type = TokenType.IDENTIFIER;
        addToken(type);
    }

    private void blockComment() {
        int startLine = line;
        int startColumn = column - 2;
        // /** 开头（且不是 /**/）视为文档注释
        boolean isDoc = peek() == '*' && peekNext() != '/';
        int depth = 1;
        while (depth > 0 && !isAtEnd()) {
            if (peek() == '/' && peekNext() == '*') {
                advance();
                advance();
                depth++;
            } else if (peek() == '*' && peekNext() == '/') {
                advance();
                advance();
                depth--;
            } else {
                if (peek() == '\n') {
                    advance();
                    newLine();
                } else {
                    advance();
                }
            }
        }
        if (depth > 0) {
            error("Unterminated block comment");
            return;
        }
        if (isDoc) {
            addToken(TokenType.DOC_COMMENT, docText(source.substring(start + 3, current - 2)),
                    startLine, startColumn);
        }
    }

    /** 去掉文档注释每行开头的 '*' 与多余空白 */
    static String docText(String body) {
        StringBuilder sb = new StringBuilder();
        for (String raw : body.split("\n")) {
            String text = raw.trim();
            if (text.startsWith("*")) {
                text = text.substring(1).trim();
            }
            if (text.isEmpty() && sb.length() == 0) {
                continue;
            }
            if (sb.length() > 0) sb.append('\n');
            sb.append(text);
        }
        return sb.toString().trim();
    }

    private void error(String message) {
        addToken(TokenType.ERROR, String.format("[%s:%d:%d] Lexer error: %s",
                fileName, line, column, message));
    }
}
