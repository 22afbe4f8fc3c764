package com.moonshift.compiler.lexer;

/**
 * Lua 词法单元类型
 */
public enum TokenType {
    // === 字面量 ===
    NUMBER_LITERAL,
    STRING_LITERAL,

    // === 标识符 ===
    IDENTIFIER,             // continue 为上下文关键词，按标识符扫描

    // === 关键词 ===
    KW_AND, KW_BREAK, KW_DO, KW_ELSE, KW_ELSEIF, KW_END,
    KW_FALSE, KW_FOR, KW_FUNCTION, KW_IF, KW_IN, KW_LOCAL,
    KW_NIL, KW_NOT, KW_OR, KW_REPEAT, KW_RETURN, KW_THEN,
    KW_TRUE, KW_UNTIL, KW_WHILE,

    // === 算术运算符 ===
    PLUS,                   // +
    MINUS,                  // -
    MUL,                    // *
    DIV,                    // /
    FLOOR_DIV,              // //
    MOD,                    // %
    CARET,                  // ^
    HASH,                   // #
    CONCAT,                 // ..

    // === 比较运算符 ===
    EQ,                     // ==
    NE,                     // ~=
    LT,                     // <
    GT,                     // >
    LE,                     // <=
    GE,                     // >=

    // === 赋值 ===
    ASSIGN,                 // =
    PLUS_ASSIGN,            // +=
    MINUS_ASSIGN,           // -=
    MUL_ASSIGN,             // *=
    DIV_ASSIGN,             // /=
    FLOOR_DIV_ASSIGN,       // //=
    MOD_ASSIGN,             // %=
    CARET_ASSIGN,           // ^=
    CONCAT_ASSIGN,          // ..=

    // === 分隔符 ===
    LPAREN, RPAREN,         // ( )
    LBRACE, RBRACE,         // { }
    LBRACKET, RBRACKET,     // [ ]
    COMMA,                  // ,
    SEMICOLON,              // ;
    COLON,                  // :
    DOT,                    // .
    ELLIPSIS,               // ...
    QUESTION,               // ? (可选类型注解)

    // === 特殊 ===
    EOF,
    ERROR;

    /**
     * 是否为关键词
     */
    public boolean isKeyword() {
        return name().startsWith("KW_");
    }
}
