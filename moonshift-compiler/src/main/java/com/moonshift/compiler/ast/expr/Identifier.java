package com.moonshift.compiler.ast.expr;

import com.moonshift.compiler.ast.AstVisitor;

/**
 * 标识符表达式
 */
public class Identifier extends Expression {
    private final String name;

    public Identifier(String name) {
        this.name = name;
    }

    public String getName() {
        return name;
    }

    @Override
    public <R, C> R accept(AstVisitor<R, C> visitor, C context) {
        return visitor.visitIdentifier(this, context);
    }
}
