package com.moonshift.compiler.ast.expr;

import com.moonshift.compiler.ast.AstVisitor;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * 表构造器 {@code { ... }}
 */
public class TableExpr extends Expression {
    private final List<TableEntry> entries;

    public TableExpr() {
        this(Collections.emptyList());
    }

    public TableExpr(List<TableEntry> entries) {
        this.entries = new ArrayList<>(entries);
    }

    public List<TableEntry> getEntries() {
        return entries;
    }

    @Override
    public <R, C> R accept(AstVisitor<R, C> visitor, C context) {
        return visitor.visitTableExpr(this, context);
    }
}
