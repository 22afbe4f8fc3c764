package com.moonshift.compiler.ast.expr;

import com.moonshift.compiler.ast.AstVisitor;

/**
 * 括号表达式。括号会把多返回值截断为一个值。
 */
public class ParenExpr extends Expression {
    private Expression inner;

    public ParenExpr(Expression inner) {
        this.inner = inner;
    }

    public Expression getInner() {
        return inner;
    }

    public void setInner(Expression inner) {
        this.inner = inner;
    }

    @Override
    public <R, C> R accept(AstVisitor<R, C> visitor, C context) {
        return visitor.visitParenExpr(this, context);
    }
}
