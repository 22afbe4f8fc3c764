package com.moonshift.compiler.ast.stmt;

import com.moonshift.compiler.ast.AstVisitor;
import com.moonshift.compiler.ast.expr.FunctionExpr;

/**
 * 函数声明语句：{@code function a.b:c(...) ... end}
 */
public class FunctionStmt extends Statement {
    private final FunctionName name;
    private final FunctionExpr function;

    public FunctionStmt(FunctionName name, FunctionExpr function) {
        this.name = name;
        this.function = function;
    }

    public FunctionName getName() {
        return name;
    }

    public FunctionExpr getFunction() {
        return function;
    }

    @Override
    public <R, C> R accept(AstVisitor<R, C> visitor, C context) {
        return visitor.visitFunctionStmt(this, context);
    }
}
