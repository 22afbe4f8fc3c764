package com.moonshift.compiler.ast.expr;

import com.moonshift.compiler.ast.AstVisitor;

/**
 * 字面量表达式：nil / true / false / 数字 / 字符串
 */
public class Literal extends Expression {
    private final Object value;
    private final LiteralKind kind;

    public Literal(Object value, LiteralKind kind) {
        this.value = value;
        this.kind = kind;
    }

    public static Literal nil() {
        return new Literal(null, LiteralKind.NIL);
    }

    public static Literal of(boolean value) {
        return new Literal(value, LiteralKind.BOOLEAN);
    }

    public static Literal number(double value) {
        return new Literal(value, LiteralKind.NUMBER);
    }

    public static Literal string(String value) {
        return new Literal(value, LiteralKind.STRING);
    }

    public Object getValue() {
        return value;
    }

    public LiteralKind getKind() {
        return kind;
    }

    public boolean isNil() {
        return kind == LiteralKind.NIL;
    }

    /** 数字字面量的值；非数字抛出 IllegalStateException */
    public double getNumber() {
        if (kind != LiteralKind.NUMBER) {
            throw new IllegalStateException("not a number literal: " + kind);
        }
        return ((Number) value).doubleValue();
    }

    @Override
    public <R, C> R accept(AstVisitor<R, C> visitor, C context) {
        return visitor.visitLiteral(this, context);
    }

    /**
     * 字面量类型
     */
    public enum LiteralKind {
        NIL,
        BOOLEAN,
        NUMBER,
        STRING
    }
}
