package com.moonshift.compiler.ast.stmt;

import com.moonshift.compiler.ast.AstVisitor;
import com.moonshift.compiler.ast.TypedIdentifier;
import com.moonshift.compiler.ast.expr.Expression;

/**
 * 数值 for 循环：{@code for i = start, end, step do ... end}
 */
public class NumericForStmt extends Statement {
    private final TypedIdentifier variable;
    private Expression start;
    private Expression end;
    private Expression step;  // 可选
    private Block body;

    public NumericForStmt(TypedIdentifier variable, Expression start, Expression end,
                          Expression step, Block body) {
        this.variable = variable;
        this.start = start;
        this.end = end;
        this.step = step;
        this.body = body;
    }

    public TypedIdentifier getVariable() {
        return variable;
    }

    public Expression getStart() {
        return start;
    }

    public void setStart(Expression start) {
        this.start = start;
    }

    public Expression getEnd() {
        return end;
    }

    public void setEnd(Expression end) {
        this.end = end;
    }

    public Expression getStep() {
        return step;
    }

    public void setStep(Expression step) {
        this.step = step;
    }

    public boolean hasStep() {
        return step != null;
    }

    public Block getBody() {
        return body;
    }

    public void setBody(Block body) {
        this.body = body;
    }

    @Override
    public <R, C> R accept(AstVisitor<R, C> visitor, C context) {
        return visitor.visitNumericForStmt(this, context);
    }
}
