package com.moonshift.compiler.ast.stmt;

import com.moonshift.compiler.ast.AstVisitor;
import com.moonshift.compiler.ast.expr.Expression;

/**
 * Repeat-until 循环。条件可以读取循环体顶层声明的局部变量。
 */
public class RepeatStmt extends Statement {
    private Block body;
    private Expression condition;

    public RepeatStmt(Block body, Expression condition) {
        this.body = body;
        this.condition = condition;
    }

    public Block getBody() {
        return body;
    }

    public void setBody(Block body) {
        this.body = body;
    }

    public Expression getCondition() {
        return condition;
    }

    public void setCondition(Expression condition) {
        this.condition = condition;
    }

    @Override
    public <R, C> R accept(AstVisitor<R, C> visitor, C context) {
        return visitor.visitRepeatStmt(this, context);
    }
}
