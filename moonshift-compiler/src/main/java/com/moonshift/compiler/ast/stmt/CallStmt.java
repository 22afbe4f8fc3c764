package com.moonshift.compiler.ast.stmt;

import com.moonshift.compiler.ast.AstVisitor;
import com.moonshift.compiler.ast.expr.CallExpr;

/**
 * 函数调用语句
 */
public class CallStmt extends Statement {
    private CallExpr call;

    public CallStmt(CallExpr call) {
        this.call = call;
    }

    public CallExpr getCall() {
        return call;
    }

    public void setCall(CallExpr call) {
        this.call = call;
    }

    @Override
    public <R, C> R accept(AstVisitor<R, C> visitor, C context) {
        return visitor.visitCallStmt(this, context);
    }
}
