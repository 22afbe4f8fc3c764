package com.moonshift.compiler.ast.stmt;

import com.moonshift.compiler.ast.AstVisitor;

/**
 * Break 语句
 */
public class BreakStmt extends LastStatement {

    @Override
    public <R, C> R accept(AstVisitor<R, C> visitor, C context) {
        return visitor.visitBreakStmt(this, context);
    }
}
