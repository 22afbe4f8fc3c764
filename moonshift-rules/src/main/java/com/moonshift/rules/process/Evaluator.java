package com.moonshift.rules.process;

import com.moonshift.compiler.ast.expr.*;
import com.moonshift.compiler.ast.expr.BinaryExpr.BinaryOp;

import java.nio.charset.StandardCharsets;

/**
 * 常量求值器（保守）。
 *
 * <p>只折叠能证明结果的表达式：字面量、括号、{@code not}、数字取负、字符串长度、
 * 左操作数已知的 {@code and}/{@code or}、两个数字间的算术与比较、
 * 字符串/整数的拼接、已知值间的相等比较。调用、名字、索引、变参、
 * 字符串隐式转数字等一律为 {@link LuaValue#UNKNOWN}。</p>
 */
public class Evaluator {

    /** 拼接时按整数文本输出的数字上限，%.14g 在此以内不会改用指数形式 */
    private static final double MAX_EXACT_INTEGER = 1e14;

    public LuaValue evaluate(Expression expression) {
        if (expression instanceof Literal) {
            return evaluateLiteral((Literal) expression);
        }
        if (expression instanceof ParenExpr) {
            return evaluate(((ParenExpr) expression).getInner());
        }
        if (expression instanceof UnaryExpr) {
            return evaluateUnary((UnaryExpr) expression);
        }
        if (expression instanceof BinaryExpr) {
            return evaluateBinary((BinaryExpr) expression);
        }
        return LuaValue.UNKNOWN;
    }

    /**
     * 表达式能否在不产生可观察效果的前提下被移动或丢弃：
     * 已知常量、函数字面量、所有条目都惰性的表构造器
     */
    public boolean isInert(Expression expression) {
        if (evaluate(expression).isKnown()) {
            return true;
        }
        if (expression instanceof ParenExpr) {
            return isInert(((ParenExpr) expression).getInner());
        }
        if (expression instanceof FunctionExpr) {
            return true;
        }
        if (expression instanceof TableExpr) {
            for (TableEntry entry : ((TableExpr) expression).getEntries()) {
                if (entry instanceof IndexEntry && !isInert(((IndexEntry) entry).getKey())) {
                    return false;
                }
                if (!isInert(entry.getValue())) {
                    return false;
                }
            }
            return true;
        }
        return false;
    }

    // ==================== 字面量与一元 ====================

    private LuaValue evaluateLiteral(Literal literal) {
        switch (literal.getKind()) {
            case NIL: return LuaValue.NIL;
            case BOOLEAN: return LuaValue.of(Boolean.TRUE.equals(literal.getValue()));
            case NUMBER: return LuaValue.number(literal.getNumber());
            case STRING: return LuaValue.string((String) literal.getValue());
            default: return LuaValue.UNKNOWN;
        }
    }

    private LuaValue evaluateUnary(UnaryExpr expr) {
        LuaValue operand = evaluate(expr.getOperand());
        if (!operand.isKnown()) {
            return LuaValue.UNKNOWN;
        }
        switch (expr.getOperator()) {
            case NOT:
                return LuaValue.of(!operand.isTruthy());
            case NEG:
                return operand.isNumber() ? LuaValue.number(-operand.asNumber()) : LuaValue.UNKNOWN;
            case LENGTH:
                return operand.isString() ? stringLength(operand.asString()) : LuaValue.UNKNOWN;
            default:
                return LuaValue.UNKNOWN;
        }
    }

    /** 非 ASCII 文本的字节长度依赖源码编码，不折叠 */
    private static LuaValue stringLength(String value) {
        for (int i = 0; i < value.length(); i++) {
            if (value.charAt(i) >= 0x80) {
                return LuaValue.UNKNOWN;
            }
        }
        return LuaValue.number(value.getBytes(StandardCharsets.US_ASCII).length);
    }

    // ==================== 二元 ====================

    private LuaValue evaluateBinary(BinaryExpr expr) {
        BinaryOp op = expr.getOperator();
        LuaValue left = evaluate(expr.getLeft());

        // 短路：只要左侧已知即可决定
        if (op == BinaryOp.AND || op == BinaryOp.OR) {
            if (!left.isKnown()) {
                return LuaValue.UNKNOWN;
            }
            boolean takeLeft = (op == BinaryOp.AND) != left.isTruthy();
            return takeLeft ? left : evaluate(expr.getRight());
        }

        LuaValue right = evaluate(expr.getRight());
        if (!left.isKnown() || !right.isKnown()) {
            return LuaValue.UNKNOWN;
        }

        switch (op) {
            case EQ:
                return LuaValue.of(left.rawEquals(right));
            case NE:
                return LuaValue.of(!left.rawEquals(right));
            case CONCAT:
                return concat(left, right);
            default:
                break;
        }

        if (!left.isNumber() || !right.isNumber()) {
            return LuaValue.UNKNOWN;
        }
        double a = left.asNumber();
        double b = right.asNumber();
        switch (op) {
            case ADD: return LuaValue.number(a + b);
            case SUB: return LuaValue.number(a - b);
            case MUL: return LuaValue.number(a * b);
            case DIV: return LuaValue.number(a / b);
            case FLOOR_DIV: return LuaValue.number(Math.floor(a / b));
            case MOD: return LuaValue.number(a - Math.floor(a / b) * b);
            case POW: return LuaValue.number(Math.pow(a, b));
            case LT: return LuaValue.of(a < b);
            case LE: return LuaValue.of(a <= b);
            case GT: return LuaValue.of(a > b);
            case GE: return LuaValue.of(a >= b);
            default: return LuaValue.UNKNOWN;
        }
    }

    private static LuaValue concat(LuaValue left, LuaValue right) {
        String l = toConcatText(left);
        String r = toConcatText(right);
        if (l == null || r == null) {
            return LuaValue.UNKNOWN;
        }
        return LuaValue.string(l + r);
    }

    /**
     * 拼接用文本；只有字符串与可精确书写的整数有确定文本
     */
    private static String toConcatText(LuaValue value) {
        if (value.isString()) {
            return value.asString();
        }
        if (value.isNumber()) {
            double number = value.asNumber();
            boolean negativeZero = number == 0.0 && 1.0 / number < 0;
            if (number == Math.rint(number) && Math.abs(number) < MAX_EXACT_INTEGER && !negativeZero) {
                return Long.toString((long) number);
            }
        }
        return null;
    }
}
