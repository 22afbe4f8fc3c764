package com.moonshift.compiler.ast.stmt;

import com.moonshift.compiler.ast.AstVisitor;

/**
 * Do 块：{@code do ... end}
 */
public class DoStmt extends Statement {
    private Block body;

    public DoStmt(Block body) {
        this.body = body;
    }

    public Block getBody() {
        return body;
    }

    public void setBody(Block body) {
        this.body = body;
    }

    @Override
    public <R, C> R accept(AstVisitor<R, C> visitor, C context) {
        return visitor.visitDoStmt(this, context);
    }
}
