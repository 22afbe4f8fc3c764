package com.moonshift.compiler.ast.stmt;

import com.moonshift.compiler.ast.AstVisitor;
import com.moonshift.compiler.ast.expr.Expression;

/**
 * 复合赋值语句：{@code a += 1}
 */
public class CompoundAssignStmt extends Statement {
    private Expression target;
    private final CompoundOp operator;
    private Expression value;

    public CompoundAssignStmt(Expression target, CompoundOp operator, Expression value) {
        this.target = target;
        this.operator = operator;
        this.value = value;
    }

    public Expression getTarget() {
        return target;
    }

    public void setTarget(Expression target) {
        this.target = target;
    }

    public CompoundOp getOperator() {
        return operator;
    }

    public Expression getValue() {
        return value;
    }

    public void setValue(Expression value) {
        this.value = value;
    }

    @Override
    public <R, C> R accept(AstVisitor<R, C> visitor, C context) {
        return visitor.visitCompoundAssignStmt(this, context);
    }

    /**
     * 复合赋值运算符
     */
    public enum CompoundOp {
        ADD("+="),
        SUB("-="),
        MUL("*="),
        DIV("/="),
        FLOOR_DIV("//="),
        MOD("%="),
        POW("^="),
        CONCAT("..=");

        private final String source;

        CompoundOp(String source) {
            this.source = source;
        }

        /** 返回源码中对应的运算符 */
        public String toSourceString() {
            return source;
        }
    }
}
