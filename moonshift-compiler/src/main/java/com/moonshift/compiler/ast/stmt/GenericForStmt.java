package com.moonshift.compiler.ast.stmt;

import com.moonshift.compiler.ast.AstVisitor;
import com.moonshift.compiler.ast.TypedIdentifier;
import com.moonshift.compiler.ast.expr.Expression;

import java.util.ArrayList;
import java.util.List;

/**
 * 泛型 for 循环：{@code for k, v in explist do ... end}
 */
public class GenericForStmt extends Statement {
    private final List<TypedIdentifier> variables;
    private final List<Expression> expressions;
    private Block body;

    public GenericForStmt(List<TypedIdentifier> variables, List<Expression> expressions, Block body) {
        this.variables = new ArrayList<>(variables);
        this.expressions = new ArrayList<>(expressions);
        this.body = body;
    }

    public List<TypedIdentifier> getVariables() {
        return variables;
    }

    public List<Expression> getExpressions() {
        return expressions;
    }

    public Block getBody() {
        return body;
    }

    public void setBody(Block body) {
        this.body = body;
    }

    @Override
    public <R, C> R accept(AstVisitor<R, C> visitor, C context) {
        return visitor.visitGenericForStmt(this, context);
    }
}
