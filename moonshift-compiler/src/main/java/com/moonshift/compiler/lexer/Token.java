package com.moonshift.compiler.lexer;

/**
 * 词法单元，带 1 起始的行列号
 */
public final class Token {
    private final TokenType type;
    private final String lexeme;
    private final Object literal;
    private final int line;
    private final int column;

    public Token(TokenType type, String lexeme, Object literal, int line, int column) {
        this.type = type;
        this.lexeme = lexeme;
        this.literal = literal;
        this.line = line;
        this.column = column;
    }

    public TokenType getType() {
        return type;
    }

    public String getLexeme() {
        return lexeme;
    }

    /** 数字为 Double，字符串为解码后的值，错误 token 为错误描述 */
    public Object getLiteral() {
        return literal;
    }

    public int getLine() {
        return line;
    }

    public int getColumn() {
        return column;
    }

    /**
     * 出错提示中的 token 描述
     */
    public String describe() {
        return type == TokenType.EOF ? "end of file" : "'" + lexeme + "'";
    }

    @Override
    public String toString() {
        return type + " " + describe() + " at " + line + ":" + column;
    }
}
