package com.moonshift.compiler.ast.stmt;

import com.moonshift.compiler.ast.AstVisitor;
import com.moonshift.compiler.ast.expr.FunctionExpr;

/**
 * 局部函数声明：{@code local function name(...) ... end}
 */
public class LocalFunctionStmt extends Statement {
    private final String name;
    private final FunctionExpr function;

    public LocalFunctionStmt(String name, FunctionExpr function) {
        this.name = name;
        this.function = function;
    }

    public String getName() {
        return name;
    }

    public FunctionExpr getFunction() {
        return function;
    }

    @Override
    public <R, C> R accept(AstVisitor<R, C> visitor, C context) {
        return visitor.visitLocalFunctionStmt(this, context);
    }
}
