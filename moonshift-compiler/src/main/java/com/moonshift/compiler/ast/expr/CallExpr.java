package com.moonshift.compiler.ast.expr;

import com.moonshift.compiler.ast.AstVisitor;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

/**
 * 函数调用 {@code f(args)}，或方法调用 {@code obj:method(args)}
 */
public class CallExpr extends Expression {
    private Expression callee;
    private final String method;  // 可选，a:m() 形式
    private final List<Expression> arguments;

    public CallExpr(Expression callee, List<Expression> arguments) {
        this(callee, null, arguments);
    }

    public CallExpr(Expression callee, String method, List<Expression> arguments) {
        this.callee = callee;
        this.method = method;
        this.arguments = new ArrayList<>(arguments);
    }

    /** 调用全局函数的便捷构造 */
    public static CallExpr of(String function, Expression... arguments) {
        return new CallExpr(new Identifier(function), Arrays.asList(arguments));
    }

    public Expression getCallee() {
        return callee;
    }

    public void setCallee(Expression callee) {
        this.callee = callee;
    }

    public String getMethod() {
        return method;
    }

    public boolean isMethodCall() {
        return method != null;
    }

    public List<Expression> getArguments() {
        return arguments;
    }

    @Override
    public <R, C> R accept(AstVisitor<R, C> visitor, C context) {
        return visitor.visitCallExpr(this, context);
    }
}
