package com.moonshift.compiler.ast.expr;

import com.moonshift.compiler.ast.AstVisitor;

/**
 * 可变参数表达式 {@code ...}
 */
public class VarargExpr extends Expression {

    @Override
    public <R, C> R accept(AstVisitor<R, C> visitor, C context) {
        return visitor.visitVarargExpr(this, context);
    }
}
