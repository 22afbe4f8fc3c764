package com.moonshift.compiler.parser;

import com.moonshift.compiler.lexer.Token;
import com.moonshift.compiler.lexer.TokenType;

/**
 * 解析异常，消息中附带出错位置
 */
public class ParseException extends RuntimeException {
    private final String fileName;
    private final Token token;
    private final String expected;

    public ParseException(String fileName, String message, Token token) {
        this(fileName, message, token, null);
    }

    public ParseException(String fileName, String message, Token token, String expected) {
        super(message);
        this.fileName = fileName;
        this.token = token;
        this.expected = expected;
    }

    public String getFileName() {
        return fileName;
    }

    public Token getToken() {
        return token;
    }

    public String getExpected() {
        return expected;
    }

    @Override
    public String getMessage() {
        // 词法错误 token 自带完整定位信息
        if (token != null && token.getType() == TokenType.ERROR) {
            return String.valueOf(token.getLiteral());
        }
        StringBuilder sb = new StringBuilder();
        if (token != null) {
            sb.append('[').append(fileName).append(':').append(token.getLine())
                    .append(':').append(token.getColumn()).append("] ");
        }
        sb.append(super.getMessage());
        if (token != null) {
            sb.append(" (found ").append(token.describe()).append(')');
        }
        if (expected != null) {
            sb.append(", expected: ").append(expected);
        }
        return sb.toString();
    }
}
