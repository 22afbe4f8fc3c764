package com.moonshift.compiler.lexer;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Lexer 单元测试
 */
class LexerTest {

    /** 扫描源码，返回所有 token（含 EOF） */
    private List<Token> scan(String source) {
        return new Lexer(source, "<test>").scanTokens();
    }

    /** 扫描源码，返回非 EOF 的 token 列表 */
    private List<Token> tokens(String source) {
        return scan(source).stream()
                .filter(t -> t.getType() != TokenType.EOF)
                .collect(Collectors.toList());
    }

    private List<TokenType> types(String source) {
        return tokens(source).stream().map(Token::getType).collect(Collectors.toList());
    }

    /** 断言单个 token 的类型和字面量 */
    private void assertSingleToken(String source, TokenType expectedType, Object expectedLiteral) {
        List<Token> toks = tokens(source);
        assertEquals(1, toks.size(), "Expected single token from: " + source);
        assertEquals(expectedType, toks.get(0).getType());
        assertEquals(expectedLiteral, toks.get(0).getLiteral());
    }

    @Nested
    @DisplayName("关键词与标识符")
    class KeywordTests {

        @Test
        @DisplayName("关键词识别")
        void testKeywords() {
            assertEquals(List.of(TokenType.KW_LOCAL, TokenType.IDENTIFIER, TokenType.ASSIGN, TokenType.KW_NIL),
                    types("local x = nil"));
            assertEquals(List.of(TokenType.KW_REPEAT, TokenType.KW_UNTIL, TokenType.KW_TRUE),
                    types("repeat until true"));
        }

        @Test
        @DisplayName("continue 按标识符扫描")
        void testContinueIsIdentifier() {
            assertEquals(List.of(TokenType.IDENTIFIER), types("continue"));
            assertFalse(Lexer.getKeywords().contains("continue"));
        }

        @Test
        @DisplayName("关键词集合包含全部 21 个 Lua 关键词")
        void testKeywordSet() {
            assertEquals(21, Lexer.getKeywords().size());
            assertTrue(Lexer.getKeywords().contains("elseif"));
        }
    }

    @Nested
    @DisplayName("运算符")
    class OperatorTests {

        @Test
        @DisplayName("点号系列")
        void testDots() {
            assertEquals(List.of(TokenType.DOT), types("."));
            assertEquals(List.of(TokenType.CONCAT), types(".."));
            assertEquals(List.of(TokenType.ELLIPSIS), types("..."));
            assertEquals(List.of(TokenType.CONCAT_ASSIGN), types("..="));
        }

        @Test
        @DisplayName("复合赋值")
        void testCompoundAssign() {
            assertEquals(List.of(TokenType.PLUS_ASSIGN, TokenType.MINUS_ASSIGN, TokenType.MUL_ASSIGN,
                    TokenType.DIV_ASSIGN, TokenType.FLOOR_DIV_ASSIGN, TokenType.MOD_ASSIGN, TokenType.CARET_ASSIGN),
                    types("+= -= *= /= //= %= ^="));
        }

        @Test
        @DisplayName("比较运算符")
        void testComparison() {
            assertEquals(List.of(TokenType.EQ, TokenType.NE, TokenType.LE, TokenType.GE, TokenType.LT, TokenType.GT),
                    types("== ~= <= >= < >"));
        }

        @Test
        @DisplayName("单独的 ~ 是词法错误")
        void testLoneTilde() {
            assertEquals(TokenType.ERROR, tokens("~").get(0).getType());
        }
    }

    @Nested
    @DisplayName("数字")
    class NumberTests {

        @Test
        @DisplayName("十进制与科学计数法")
        void testDecimal() {
            assertSingleToken("42", TokenType.NUMBER_LITERAL, 42.0);
            assertSingleToken("3.25", TokenType.NUMBER_LITERAL, 3.25);
            assertSingleToken("1.5e2", TokenType.NUMBER_LITERAL, 150.0);
            assertSingleToken(".5", TokenType.NUMBER_LITERAL, 0.5);
        }

        @Test
        @DisplayName("十六进制、二进制与下划线")
        void testRadix() {
            assertSingleToken("0x1F", TokenType.NUMBER_LITERAL, 31.0);
            assertSingleToken("0b101", TokenType.NUMBER_LITERAL, 5.0);
            assertSingleToken("1_000", TokenType.NUMBER_LITERAL, 1000.0);
        }

        @Test
        @DisplayName("数字后紧跟字母是错误")
        void testMalformed() {
            assertEquals(TokenType.ERROR, tokens("12abc").get(0).getType());
        }

        @Test
        @DisplayName("数字与 .. 相邻")
        void testNumberBeforeConcat() {
            assertEquals(List.of(TokenType.NUMBER_LITERAL, TokenType.CONCAT, TokenType.IDENTIFIER), types("1..x"));
        }
    }

    @Nested
    @DisplayName("字符串")
    class StringTests {

        @Test
        @DisplayName("基本转义")
        void testEscapes() {
            assertSingleToken("'a\\nb'", TokenType.STRING_LITERAL, "a\nb");
            assertSingleToken("\"q\\\"\"", TokenType.STRING_LITERAL, "q\"");
            assertSingleToken("'\\\\'", TokenType.STRING_LITERAL, "\\");
        }

        @Test
        @DisplayName("数值转义")
        void testNumericEscapes() {
            assertSingleToken("'\\65'", TokenType.STRING_LITERAL, "A");
            assertSingleToken("'\\x41'", TokenType.STRING_LITERAL, "A");
            assertSingleToken("'\\u{48}i'", TokenType.STRING_LITERAL, "Hi");
            assertSingleToken("'\\0'", TokenType.STRING_LITERAL, "\0");
        }

        @Test
        @DisplayName("\\z 跳过后续空白")
        void testSkipWhitespace() {
            assertSingleToken("'a\\z   \n  b'", TokenType.STRING_LITERAL, "ab");
        }

        @Test
        @DisplayName("长括号字符串")
        void testLongString() {
            assertSingleToken("[[abc]]", TokenType.STRING_LITERAL, "abc");
            assertSingleToken("[==[\nx]]y]==]", TokenType.STRING_LITERAL, "x]]y");
        }

        @Test
        @DisplayName("未闭合字符串")
        void testUnterminated() {
            Token error = tokens("'abc").get(0);
            assertEquals(TokenType.ERROR, error.getType());
            assertTrue(((String) error.getLiteral()).contains("Unterminated string"));
            assertTrue(((String) error.getLiteral()).startsWith("[<test>:1:"));
        }

        @Test
        @DisplayName("十进制转义超过 255")
        void testEscapeTooLarge() {
            assertEquals(TokenType.ERROR, tokens("'\\300'").get(0).getType());
        }
    }

    @Nested
    @DisplayName("注释与位置")
    class CommentTests {

        @Test
        @DisplayName("行注释与块注释")
        void testComments() {
            assertEquals(List.of(TokenType.IDENTIFIER), types("-- comment\nx"));
            assertEquals(List.of(TokenType.IDENTIFIER), types("--[[ multi\nline ]] x"));
            assertEquals(List.of(TokenType.IDENTIFIER), types("--[==[ ]] ]==] x"));
        }

        @Test
        @DisplayName("行号与列号")
        void testPositions() {
            List<Token> toks = tokens("a\n  b");
            assertEquals(1, toks.get(0).getLine());
            assertEquals(1, toks.get(0).getColumn());
            assertEquals(2, toks.get(1).getLine());
            assertEquals(3, toks.get(1).getColumn());
        }

        @Test
        @DisplayName("出错提示中的 token 描述")
        void testDescribe() {
            List<Token> all = scan("local");
            assertEquals("'local'", all.get(0).describe());
            assertEquals("end of file", all.get(1).describe());
        }

        @Test
        @DisplayName("以 EOF 结尾")
        void testEof() {
            List<Token> all = scan("");
            assertEquals(1, all.size());
            assertEquals(TokenType.EOF, all.get(0).getType());
        }
    }
}
