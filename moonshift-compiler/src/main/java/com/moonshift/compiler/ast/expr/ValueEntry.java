package com.moonshift.compiler.ast.expr;

/**
 * 位置条目 {@code v}
 */
public class ValueEntry extends TableEntry {

    public ValueEntry(Expression value) {
        super(value);
    }
}
