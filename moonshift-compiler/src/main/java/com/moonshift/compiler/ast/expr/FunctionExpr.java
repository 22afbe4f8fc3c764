package com.moonshift.compiler.ast.expr;

import com.moonshift.compiler.ast.AstVisitor;
import com.moonshift.compiler.ast.TypedIdentifier;
import com.moonshift.compiler.ast.stmt.Block;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * 函数字面量 {@code function(params) body end}。
 * 也作为 local function / function 语句的函数体。
 */
public class FunctionExpr extends Expression {
    private final List<TypedIdentifier> parameters;
    private final boolean variadic;
    private Block body;

    public FunctionExpr(Block body) {
        this(Collections.emptyList(), false, body);
    }

    public FunctionExpr(List<TypedIdentifier> parameters, boolean variadic, Block body) {
        this.parameters = new ArrayList<>(parameters);
        this.variadic = variadic;
        this.body = body;
    }

    public List<TypedIdentifier> getParameters() {
        return parameters;
    }

    public boolean isVariadic() {
        return variadic;
    }

    public Block getBody() {
        return body;
    }

    public void setBody(Block body) {
        this.body = body;
    }

    @Override
    public <R, C> R accept(AstVisitor<R, C> visitor, C context) {
        return visitor.visitFunctionExpr(this, context);
    }
}
