package com.moonshift.compiler.lexer;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Lua 词法分析器
 *
 * <p>支持 Luau 扩展：复合赋值运算符、数字下划线与 {@code 0b} 前缀。
 * 词法错误以 {@link TokenType#ERROR} token 交给语法分析器报告。</p>
 */
public class Lexer {
    private final String source;
    private final String fileName;
    private final List<Token> tokens = new ArrayList<>();

    private int start = 0;
    private int current = 0;
    private int line = 1;
    private int column = 1;

    // 关键词映射表
    private static final Map<String, TokenType> KEYWORDS;

    static {
        Map<String, TokenType> map = new HashMap<>();
        map.put("and", TokenType.KW_AND);
        map.put("break", TokenType.KW_BREAK);
        map.put("do", TokenType.KW_DO);
        map.put("else", TokenType.KW_ELSE);
        map.put("elseif", TokenType.KW_ELSEIF);
        map.put("end", TokenType.KW_END);
        map.put("false", TokenType.KW_FALSE);
        map.put("for", TokenType.KW_FOR);
        map.put("function", TokenType.KW_FUNCTION);
        map.put("if", TokenType.KW_IF);
        map.put("in", TokenType.KW_IN);
        map.put("local", TokenType.KW_LOCAL);
        map.put("nil", TokenType.KW_NIL);
        map.put("not", TokenType.KW_NOT);
        map.put("or", TokenType.KW_OR);
        map.put("repeat", TokenType.KW_REPEAT);
        map.put("return", TokenType.KW_RETURN);
        map.put("then", TokenType.KW_THEN);
        map.put("true", TokenType.KW_TRUE);
        map.put("until", TokenType.KW_UNTIL);
        map.put("while", TokenType.KW_WHILE);
        // "continue" 是上下文关键词，由语法分析器识别
        KEYWORDS = Collections.unmodifiableMap(map);
    }

    /** 获取所有关键词集合 */
    public static Set<String> getKeywords() {
        return KEYWORDS.keySet();
    }

    public Lexer(String source, String fileName) {
        this.source = source;
        this.fileName = fileName;
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

        tokens.add(new Token(TokenType.EOF, "", null, line, column));
        return tokens;
    }

    private void scanToken() {
        char c = advance();
        switch (c) {
            // 单字符 Token
            case '(': addToken(TokenType.LPAREN); break;
            case ')': addToken(TokenType.RPAREN); break;
            case '{': addToken(TokenType.LBRACE); break;
            case '}': addToken(TokenType.RBRACE); break;
            case ']': addToken(TokenType.RBRACKET); break;
            case ',': addToken(TokenType.COMMA); break;
            case ';': addToken(TokenType.SEMICOLON); break;
            case ':': addToken(TokenType.COLON); break;
            case '#': addToken(TokenType.HASH); break;
            case '?': addToken(TokenType.QUESTION); break;

            case '[': {
                int level = longBracketLevel();
                if (level >= 0) {
                    String value = longBracket(level, "string");
                    if (value != null) addToken(TokenType.STRING_LITERAL, value);
                } else {
                    addToken(TokenType.LBRACKET);
                }
                break;
            }

            case '.':
                if (match('.')) {
                    if (match('.')) addToken(TokenType.ELLIPSIS);
                    else if (match('=')) addToken(TokenType.CONCAT_ASSIGN);
                    else addToken(TokenType.CONCAT);
                } else if (isDigit(peek())) {
                    number();
                } else {
                    addToken(TokenType.DOT);
                }
                break;

            case '+':
                addToken(match('=') ? TokenType.PLUS_ASSIGN : TokenType.PLUS);
                break;

            case '-':
                if (match('-')) {
                    comment();
                } else if (match('=')) {
                    addToken(TokenType.MINUS_ASSIGN);
                } else {
                    addToken(TokenType.MINUS);
                }
                break;

            case '*':
                addToken(match('=') ? TokenType.MUL_ASSIGN : TokenType.MUL);
                break;

            case '/':
                if (match('/')) {
                    addToken(match('=') ? TokenType.FLOOR_DIV_ASSIGN : TokenType.FLOOR_DIV);
                } else {
                    addToken(match('=') ? TokenType.DIV_ASSIGN : TokenType.DIV);
                }
                break;

            case '%':
                addToken(match('=') ? TokenType.MOD_ASSIGN : TokenType.MOD);
                break;

            case '^':
                addToken(match('=') ? TokenType.CARET_ASSIGN : TokenType.CARET);
                break;

            case '=':
                addToken(match('=') ? TokenType.EQ : TokenType.ASSIGN);
                break;

            case '~':
                if (match('=')) {
                    addToken(TokenType.NE);
                } else {
                    error("Unexpected character '~'. Did you mean '~='?");
                }
                break;

            case '<':
                addToken(match('=') ? TokenType.LE : TokenType.LT);
                break;

            case '>':
                addToken(match('=') ? TokenType.GE : TokenType.GT);
                break;

            // 空白字符
            case ' ':
            case '\r':
            case '\t':
            case '\f':
                break;

            case '\n':
                newLine();
                break;

            // 字符串
            case '"':
            case '\'':
                string(c);
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

    private boolean isHexDigit(char c) {
        return isDigit(c) || (c >= 'a' && c <= 'f') || (c >= 'A' && c <= 'F');
    }

    private boolean isAlpha(char c) {
        return (c >= 'a' && c <= 'z') ||
               (c >= 'A' && c <= 'Z') ||
               c == '_';
    }

    private boolean isAlphaNumeric(char c) {
        return isAlpha(c) || isDigit(c);
    }

    // === Token 构建 ===

    private void addToken(TokenType type) {
        addToken(type, null);
    }

    private void addToken(TokenType type, Object literal) {
        String lexeme = source.substring(start, current);
        int tokenColumn = column - (current - start);
        tokens.add(new Token(type, lexeme, literal, line, Math.max(tokenColumn, 1)));
    }

    // === 复杂 Token 扫描 ===

    private void identifier() {
        while (isAlphaNumeric(peek())) advance();

        String text = source.substring(start, current);
        TokenType type = KEYWORDS.get(text);
        if (type == null) type = TokenType.IDENTIFIER;
        addToken(type);
    }

    private void number() {
        String text;
        if (source.charAt(start) == '0' && (peek() == 'x' || peek() == 'X')) {
            advance();
            while (isHexDigit(peek()) || peek() == '_') advance();
            text = stripUnderscores(source.substring(start + 2, current));
            parseAndAddRadix(text, 16);
            return;
        }
        if (source.charAt(start) == '0' && (peek() == 'b' || peek() == 'B')) {
            advance();
            while (peek() == '0' || peek() == '1' || peek() == '_') advance();
            text = stripUnderscores(source.substring(start + 2, current));
            parseAndAddRadix(text, 2);
            return;
        }

        while (isDigit(peek()) || peek() == '_') advance();
        if (peek() == '.' && peekNext() != '.') {
            advance();
            while (isDigit(peek()) || peek() == '_') advance();
        }
        if (peek() == 'e' || peek() == 'E') {
            advance();
            if (peek() == '+' || peek() == '-') advance();
            if (!isDigit(peek())) {
                error("Malformed number: " + source.substring(start, current));
                return;
            }
            while (isDigit(peek())) advance();
        }
        if (isAlpha(peek())) {
            error("Malformed number: " + source.substring(start, current + 1));
            return;
        }

        text = stripUnderscores(source.substring(start, current));
        try {
            addToken(TokenType.NUMBER_LITERAL, Double.parseDouble(text));
        } catch (NumberFormatException e) {
            error("Invalid number literal: " + source.substring(start, current));
        }
    }

    private void parseAndAddRadix(String digits, int radix) {
        if (digits.isEmpty()) {
            error("Malformed number: " + source.substring(start, current));
            return;
        }
        double value = 0;
        for (int i = 0; i < digits.length(); i++) {
            value = value * radix + Character.digit(digits.charAt(i), radix);
        }
        addToken(TokenType.NUMBER_LITERAL, value);
    }

    private static String stripUnderscores(String text) {
        return text.indexOf('_') >= 0 ? text.replace("_", "") : text;
    }

    private void string(char quote) {
        StringBuilder value = new StringBuilder();

        while (!isAtEnd() && peek() != quote) {
            if (peek() == '\n') {
                error("Unterminated string");
                return;
            }
            if (peek() == '\\') {
                advance();
                if (!escape(value)) return;
            } else {
                value.append(advance());
            }
        }

        if (isAtEnd()) {
            error("Unterminated string");
            return;
        }

        advance(); // 闭合引号
        addToken(TokenType.STRING_LITERAL, value.toString());
    }

    /**
     * 解码反斜杠之后的转义序列。{@code \ddd} 与 {@code \xXX} 按单字节解码为同值字符。
     */
    private boolean escape(StringBuilder value) {
        if (isAtEnd()) {
            error("Unterminated string");
            return false;
        }
        char c = advance();
        switch (c) {
            case 'n': value.append('\n'); return true;
            case 't': value.append('\t'); return true;
            case 'r': value.append('\r'); return true;
            case 'a': value.append('\u0007'); return true;
            case 'b': value.append('\b'); return true;
            case 'f': value.append('\f'); return true;
            case 'v': value.append('\u000B'); return true;
            case '\\': value.append('\\'); return true;
            case '"': value.append('"'); return true;
            case '\'': value.append('\''); return true;
            case '\n':
                newLine();
                value.append('\n');
                return true;
            case 'z':
                while (!isAtEnd() && Character.isWhitespace(peek())) {
                    if (advance() == '\n') newLine();
                }
                return true;
            case 'x': {
                if (!isHexDigit(peek()) || !isHexDigit(peekNext())) {
                    error("Invalid hexadecimal escape");
                    return false;
                }
                int code = Character.digit(advance(), 16) * 16 + Character.digit(advance(), 16);
                value.append((char) code);
                return true;
            }
            case 'u': {
                if (!match('{')) {
                    error("Missing '{' in \\u{xxxx}");
                    return false;
                }
                int code = 0;
                int digits = 0;
                while (isHexDigit(peek())) {
                    code = code * 16 + Character.digit(advance(), 16);
                    digits++;
                    if (code > Character.MAX_CODE_POINT) {
                        error("UTF-8 value too large");
                        return false;
                    }
                }
                if (digits == 0 || !match('}')) {
                    error("Invalid unicode escape");
                    return false;
                }
                value.appendCodePoint(code);
                return true;
            }
            default:
                if (isDigit(c)) {
                    int code = c - '0';
                    for (int i = 0; i < 2 && isDigit(peek()); i++) {
                        code = code * 10 + (advance() - '0');
                    }
                    if (code > 255) {
                        error("Decimal escape too large: \\" + code);
                        return false;
                    }
                    value.append((char) code);
                    return true;
                }
                error("Invalid escape character: \\" + c);
                return false;
        }
    }

    /**
     * 已消费 "[" 时检测长括号开头 {@code [==[}，返回等号数，不是长括号返回 -1（不消费字符）
     */
    private int longBracketLevel() {
        int level = 0;
        int probe = current;
        while (probe < source.length() && source.charAt(probe) == '=') {
            probe++;
            level++;
        }
        if (probe < source.length() && source.charAt(probe) == '[') {
            column += probe + 1 - current;
            current = probe + 1;
            return level;
        }
        return -1;
    }

    /**
     * 读取长括号内容直到匹配的闭括号，首个紧随的换行被丢弃
     */
    private String longBracket(int level, String what) {
        if (peek() == '\r') advance();
        if (peek() == '\n') {
            advance();
            newLine();
        }
        int contentStart = current;
        String close = "]" + "=".repeat(level) + "]";
        while (!isAtEnd()) {
            if (source.startsWith(close, current)) {
                String value = source.substring(contentStart, current);
                for (int i = 0; i < close.length(); i++) advance();
                return value;
            }
            if (advance() == '\n') newLine();
        }
        error("Unterminated long " + what);
        return null;
    }

    private void comment() {
        if (peek() == '[') {
            advance();
            int level = longBracketLevel();
            if (level >= 0) {
                longBracket(level, "comment");
                return;
            }
        }
        while (peek() != '\n' && !isAtEnd()) advance();
    }

    private void error(String message) {
        String errorMsg = String.format("[%s:%d:%d] Lexer error: %s",
                fileName, line, column, message);
        addToken(TokenType.ERROR, errorMsg);
    }
}
