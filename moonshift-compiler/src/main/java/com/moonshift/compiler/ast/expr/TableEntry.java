package com.moonshift.compiler.ast.expr;

/**
 * 表构造器条目：位置值 {@code v}、显式键 {@code [k] = v}、命名字段 {@code name = v}
 */
public abstract class TableEntry {
    private Expression value;

    protected TableEntry(Expression value) {
        this.value = value;
    }

    public Expression getValue() {
        return value;
    }

    public void setValue(Expression value) {
        this.value = value;
    }
}
