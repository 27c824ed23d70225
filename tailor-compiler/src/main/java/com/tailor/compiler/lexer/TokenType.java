package com.tailor.compiler.lexer;

/**
 * Tailor 词法单元类型
 */
public enum TokenType {
    // === 字面量 ===
    INT_LITERAL,
    LONG_LITERAL,
    DOUBLE_LITERAL,
    STRING_LITERAL,

    // === 标识符 ===
    IDENTIFIER,

    // === 关键词 - 声明 ===
    KW_VAL, KW_VAR, KW_FUN, KW_IMPORT, KW_GLOBAL, KW_DELETE,

    // === 关键词 - 控制流 ===
    KW_IF, KW_ELSE, KW_WHEN, KW_FOR, KW_WHILE,
    KW_RETURN, KW_BREAK, KW_CONTINUE, KW_THROW,
    KW_TRY, KW_CATCH, KW_FINALLY, KW_USE,

    // === 关键词 - 类型 ===
    KW_IS, KW_AS, KW_IN,
    KW_TRUE, KW_FALSE, KW_NULL,

    // === 操作符 - 算术 ===
    PLUS,           // +
    MINUS,          // -
    MUL,            // *
    DIV,            // /
    MOD,            // %

    // === 操作符 - 比较 ===
    EQ,             // ==
    NE,             // !=
    LT,             // <
    GT,             // >
    LE,             // <=
    GE,             // >=

    // === 操作符 - 逻辑 ===
    AND,            // &&
    OR,             // ||
    NOT,            // !

    // === 操作符 - 赋值 ===
    ASSIGN,         // =
    PLUS_ASSIGN,    // +=
    MINUS_ASSIGN,   // -=
    MUL_ASSIGN,     // *=
    DIV_ASSIGN,     // /=
    MOD_ASSIGN,     // %=

    // === 操作符 - 特殊 ===
    QUESTION,       // ?
    ARROW,          // ->
    AT,             // @

    // === 分隔符 ===
    LPAREN,         // (
    RPAREN,         // )
    LBRACE,         // {
    RBRACE,         // }
    LBRACKET,       // [
    RBRACKET,       // ]
    COMMA,          // ,
    DOT,            // .
    COLON,          // :
    SEMICOLON,      // ;

    // === 特殊 ===
    DOC_COMMENT,    // /** ... */
    NEWLINE,
    EOF,
    ERROR;

    /**
     * 是否为关键词
     */
    public boolean isKeyword() {
        return name().startsWith("KW_");
    }

    /**
     * 是否为赋值操作符
     */
    public boolean isAssignmentOp() {
        switch (this) {
            case ASSIGN:
            case PLUS_ASSIGN:
            case MINUS_ASSIGN:
            case MUL_ASSIGN:
            case DIV_ASSIGN:
            case MOD_ASSIGN:
                return true;
            default:
                return false;
        }
    }
}
