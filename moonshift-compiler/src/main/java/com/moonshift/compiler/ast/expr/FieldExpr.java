package com.moonshift.compiler.ast.expr;

import com.moonshift.compiler.ast.AstVisitor;

/**
 * 字段访问 {@code target.field}
 */
public class FieldExpr extends Expression {
    private Expression target;
    private final String field;

    public FieldExpr(Expression target, String field) {
        this.target = target;
        this.field = field;
    }

    public Expression getTarget() {
        return target;
    }

    public void setTarget(Expression target) {
        this.target = target;
    }

    public String getField() {
        return field;
    }

    @Override
    public <R, C> R accept(AstVisitor<R, C> visitor, C context) {
        return visitor.visitFieldExpr(this, context);
    }
}
