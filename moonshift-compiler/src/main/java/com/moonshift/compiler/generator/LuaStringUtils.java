package com.moonshift.compiler.generator;

import java.nio.charset.StandardCharsets;

/**
 * Lua 字符串/数字字面量序列化工具
 */
public final class LuaStringUtils {

    /** 不少于该字节数且无需转义的字符串使用长括号形式 */
    private static final int FORCE_QUOTED_STRING_THRESHOLD = 40;

    private LuaStringUtils() {}

    /**
     * 将字符串值写成 Lua 字面量。
     * <ul>
     *   <li>空串写作 {@code ''}</li>
     *   <li>短串或含控制字符的串写作带转义的引号字符串</li>
     *   <li>较长的多行文本写作最小层级的长括号 {@code [==[...]==]}</li>
     * </ul>
     */
    public static String writeString(String value) {
        if (value.isEmpty()) {
            return "''";
        }

        if (value.codePointCount(0, value.length()) == 1) {
            int character = value.codePointAt(0);
            switch (character) {
                case '\'': return "\"'\"";
                case '"':  return "'\"'";
                default:
                    if (needsEscaping(character)) {
                        return "'" + escape(character, false) + "'";
                    }
                    return "'" + value + "'";
            }
        }

        if (value.getBytes(StandardCharsets.UTF_8).length < FORCE_QUOTED_STRING_THRESHOLD
                || containsQuoteForcing(value)) {
            return writeQuoted(value);
        }
        return writeLongBracket(value);
    }

    /**
     * 将数字写成 Lua 字面量。整数值不带小数部分，非有限值写成等价的除法表达式。
     */
    public static String writeNumber(double value) {
        if (Double.isNaN(value)) {
            return "0/0";
        }
        if (Double.isInfinite(value)) {
            return value > 0 ? "1/0" : "-1/0";
        }
        if (value == 0.0 && 1.0 / value < 0) {
            return "-0";
        }
        if (value == Math.rint(value) && Math.abs(value) < 1e16) {
            return Long.toString((long) value);
        }
        return Double.toString(value);
    }

    private static String writeLongBracket(String value) {
        int level = value.endsWith("]") ? 1 : 0;
        String equals = "=".repeat(level);
        while (value.contains("]" + equals + "]")) {
            level++;
            equals = "=".repeat(level);
        }
        // 长括号会吞掉紧跟的第一个换行
        String extraNewLine = value.startsWith("\n") ? "\n" : "";
        return "[" + equals + "[" + extraNewLine + value + "]" + equals + "]";
    }

    private static String writeQuoted(String value) {
        char quote = getQuoteSymbol(value);
        StringBuilder quoted = new StringBuilder(value.length() + 2);
        quoted.append(quote);

        int i = 0;
        while (i < value.length()) {
            int character = value.codePointAt(i);
            i += Character.charCount(character);
            if (character == quote) {
                quoted.append('\\').append(quote);
            } else if (needsEscaping(character)) {
                boolean digitFollows = i < value.length() && Character.isDigit(value.charAt(i));
                quoted.append(escape(character, digitFollows));
            } else {
                quoted.appendCodePoint(character);
            }
        }

        quoted.append(quote);
        return quoted.toString();
    }

    private static char getQuoteSymbol(String value) {
        if (value.indexOf('"') >= 0) {
            return '\'';
        } else if (value.indexOf('\'') >= 0) {
            return '"';
        }
        return '\'';
    }

    private static boolean isAsciiGraphic(int c) {
        return c >= 0x21 && c <= 0x7E;
    }

    private static boolean needsEscaping(int c) {
        return !(isAsciiGraphic(c) || c == ' ') || c == '\\';
    }

    private static boolean containsQuoteForcing(String value) {
        return value.codePoints().anyMatch(c -> !(isAsciiGraphic(c) || c == ' ' || c == '\n'));
    }

    /** digitFollows 为 true 时十进制转义补足三位，避免与后续数字粘连 */
    private static String escape(int c, boolean digitFollows) {
        switch (c) {
            case '\n': return "\\n";
            case '\t': return "\\t";
            case '\\': return "\\\\";
            case '\r': return "\\r";
            case 0x07: return "\\a";
            case 0x08: return "\\b";
            case 0x0B: return "\\v";
            case 0x0C: return "\\f";
            default:
                if (c < 0x80) {
                    return digitFollows ? String.format("\\%03d", c) : "\\" + c;
                }
                return "\\u{" + Integer.toHexString(c) + "}";
        }
    }
}
