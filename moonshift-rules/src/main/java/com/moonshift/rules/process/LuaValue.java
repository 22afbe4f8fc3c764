package com.moonshift.rules.process;

import com.moonshift.compiler.ast.expr.Expression;
import com.moonshift.compiler.ast.expr.Literal;

import java.util.Objects;

/**
 * 常量求值结果：确定的 number / string / boolean / nil，或 unknown
 */
public final class LuaValue {

    public static final LuaValue NIL = new LuaValue(Kind.NIL, null);
    public static final LuaValue TRUE = new LuaValue(Kind.BOOLEAN, Boolean.TRUE);
    public static final LuaValue FALSE = new LuaValue(Kind.BOOLEAN, Boolean.FALSE);
    public static final LuaValue UNKNOWN = new LuaValue(Kind.UNKNOWN, null);

    private final Kind kind;
    private final Object value;

    private LuaValue(Kind kind, Object value) {
        this.kind = kind;
        this.value = value;
    }

    public static LuaValue number(double value) {
        return new LuaValue(Kind.NUMBER, value);
    }

    public static LuaValue string(String value) {
        return new LuaValue(Kind.STRING, Objects.requireNonNull(value));
    }

    public static LuaValue of(boolean value) {
        return value ? TRUE : FALSE;
    }

    public Kind getKind() {
        return kind;
    }

    public boolean isKnown() {
        return kind != Kind.UNKNOWN;
    }

    public boolean isNumber() {
        return kind == Kind.NUMBER;
    }

    public boolean isString() {
        return kind == Kind.STRING;
    }

    public double asNumber() {
        if (kind != Kind.NUMBER) {
            throw new IllegalStateException("not a number: " + this);
        }
        return (Double) value;
    }

    public String asString() {
        if (kind != Kind.STRING) {
            throw new IllegalStateException("not a string: " + this);
        }
        return (String) value;
    }

    public boolean asBoolean() {
        if (kind != Kind.BOOLEAN) {
            throw new IllegalStateException("not a boolean: " + this);
        }
        return (Boolean) value;
    }

    /**
     * Lua 真值：只有 nil 与 false 为假
     *
     * @throws IllegalStateException 值未知时
     */
    public boolean isTruthy() {
        if (kind == Kind.UNKNOWN) {
            throw new IllegalStateException("truthiness of an unknown value");
        }
        return !(kind == Kind.NIL || FALSE.equals(this));
    }

    /**
     * 转回字面量表达式；未知值返回 null
     */
    public Expression toExpression() {
        switch (kind) {
            case NUMBER: return Literal.number(asNumber());
            case STRING: return Literal.string(asString());
            case BOOLEAN: return Literal.of(asBoolean());
            case NIL: return Literal.nil();
            default: return null;
        }
    }

    /**
     * Lua 原始相等：类型不同则不等；NaN 不等于自身
     */
    public boolean rawEquals(LuaValue other) {
        if (!isKnown() || !other.isKnown()) {
            throw new IllegalStateException("comparison with an unknown value");
        }
        if (kind != other.kind) return false;
        if (kind == Kind.NUMBER) return asNumber() == other.asNumber();
        return Objects.equals(value, other.value);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof LuaValue)) return false;
        LuaValue that = (LuaValue) o;
        return kind == that.kind && Objects.equals(value, that.value);
    }

    @Override
    public int hashCode() {
        return Objects.hash(kind, value);
    }

    @Override
    public String toString() {
        switch (kind) {
            case NUMBER: return "number(" + value + ")";
            case STRING: return "string(\"" + value + "\")";
            case BOOLEAN: return "boolean(" + value + ")";
            case NIL: return "nil";
            default: return "unknown";
        }
    }

    /**
     * 值种类
     */
    public enum Kind {
        NUMBER,
        STRING,
        BOOLEAN,
        NIL,
        UNKNOWN
    }
}
