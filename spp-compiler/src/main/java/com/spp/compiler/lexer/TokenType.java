package com.spp.compiler.lexer;

/**
 * Python 表达式词法单元类型
 */
public enum TokenType {
    // === 字面量 ===
    INT_LITERAL,
    FLOAT_LITERAL,
    IMAGINARY_LITERAL,      // 1j, 2.5J
    STRING_LITERAL,         // 任意前缀和引号，literal 为 StringLiteral

    // === 标识符 ===
    IDENTIFIER,

    // === 关键词 ===
    KW_AND, KW_OR, KW_NOT, KW_IN, KW_IS,
    KW_IF, KW_ELSE, KW_FOR, KW_ASYNC, KW_AWAIT,
    KW_LAMBDA, KW_YIELD, KW_FROM,
    KW_TRUE, KW_FALSE, KW_NONE,
    KW_RESERVED,            // 语句关键词，表达式中不可出现

    // === 操作符 - 算术 ===
    PLUS,           // +
    MINUS,          // -
    STAR,           // *
    DOUBLE_STAR,    // **
    SLASH,          // /
    DOUBLE_SLASH,   // //
    PERCENT,        // %
    AT,             // @

    // === 操作符 - 位运算 ===
    LSHIFT,         // <<
    RSHIFT,         // >>
    AMPERSAND,      // &
    PIPE,           // |
    CARET,          // ^
    TILDE,          // ~

    // === 操作符 - 比较 ===
    LT,             // <
    GT,             // >
    LE,             // <=
    GE,             // >=
    EQ,             // ==
    NE,             // !=

    // === 赋值 ===
    WALRUS,         // :=
    ASSIGN,         // =

    // === 分隔符 ===
    DOT,            // .
    ELLIPSIS,       // ...
    COMMA,          // ,
    COLON,          // :
    LPAREN,         // (
    RPAREN,         // )
    LBRACKET,       // [
    RBRACKET,       // ]
    LBRACE,         // {
    RBRACE,         // }

    // === 特殊 ===
    ERROR,
    EOF;

    public boolean isKeyword() {
        return name().startsWith("KW_");
    }
}
