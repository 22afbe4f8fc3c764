package com.moonshift.compiler.ast.expr;

/**
 * 显式键条目 {@code [key] = value}
 */
public class IndexEntry extends TableEntry {
    private Expression key;

    public IndexEntry(Expression key, Expression value) {
        super(value);
        this.key = key;
    }

    public Expression getKey() {
        return key;
    }

    public void setKey(Expression key) {
        this.key = key;
    }
}
