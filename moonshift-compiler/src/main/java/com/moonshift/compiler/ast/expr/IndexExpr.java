package com.moonshift.compiler.ast.expr;

import com.moonshift.compiler.ast.AstVisitor;

/**
 * 索引访问 {@code target[index]}
 */
public class IndexExpr extends Expression {
    private Expression target;
    private Expression index;

    public IndexExpr(Expression target, Expression index) {
        this.target = target;
        this.index = index;
    }

    public Expression getTarget() {
        return target;
    }

    public void setTarget(Expression target) {
        this.target = target;
    }

    public Expression getIndex() {
        return index;
    }

    public void setIndex(Expression index) {
        this.index = index;
    }

    @Override
    public <R, C> R accept(AstVisitor<R, C> visitor, C context) {
        return visitor.visitIndexExpr(this, context);
    }
}
