package com.moonshift.compiler.ast.expr;

/**
 * 命名字段条目 {@code name = value}
 */
public class FieldEntry extends TableEntry {
    private final String name;

    public FieldEntry(String name, Expression value) {
        super(value);
        this.name = name;
    }

    public String getName() {
        return name;
    }
}
