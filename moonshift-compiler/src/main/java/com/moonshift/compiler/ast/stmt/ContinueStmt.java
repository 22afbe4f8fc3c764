package com.moonshift.compiler.ast.stmt;

import com.moonshift.compiler.ast.AstVisitor;

/**
 * Continue 语句（Luau 扩展）
 */
public class ContinueStmt extends LastStatement {

    @Override
    public <R, C> R accept(AstVisitor<R, C> visitor, C context) {
        return visitor.visitContinueStmt(this, context);
    }
}
