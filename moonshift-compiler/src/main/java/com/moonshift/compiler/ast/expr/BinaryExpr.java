package com.moonshift.compiler.ast.expr;

import com.moonshift.compiler.ast.AstVisitor;

/**
 * 二元表达式
 */
public class BinaryExpr extends Expression {
    private Expression left;
    private final BinaryOp operator;
    private Expression right;

    public BinaryExpr(Expression left, BinaryOp operator, Expression right) {
        this.left = left;
        this.operator = operator;
        this.right = right;
    }

    public Expression getLeft() {
        return left;
    }

    public void setLeft(Expression left) {
        this.left = left;
    }

    public BinaryOp getOperator() {
        return operator;
    }

    public Expression getRight() {
        return right;
    }

    public void setRight(Expression right) {
        this.right = right;
    }

    @Override
    public <R, C> R accept(AstVisitor<R, C> visitor, C context) {
        return visitor.visitBinaryExpr(this, context);
    }

    /**
     * 二元运算符（优先级按 Lua 参考手册，数值越大结合越紧）
     */
    public enum BinaryOp {
        // 逻辑
        OR("or", 1),
        AND("and", 2),

        // 比较
        LT("<", 3),
        GT(">", 3),
        LE("<=", 3),
        GE(">=", 3),
        NE("~=", 3),
        EQ("==", 3),

        // 拼接（右结合）
        CONCAT("..", 4),

        // 算术
        ADD("+", 5),
        SUB("-", 5),
        MUL("*", 6),
        DIV("/", 6),
        FLOOR_DIV("//", 6),
        MOD("%", 6),
        POW("^", 8);

        private final String source;
        private final int precedence;

        BinaryOp(String source, int precedence) {
            this.source = source;
            this.precedence = precedence;
        }

        /** 返回源码中对应的运算符 */
        public String toSourceString() {
            return source;
        }

        public int getPrecedence() {
            return precedence;
        }

        /** 右结合运算符：.. 与 ^ */
        public boolean isRightAssociative() {
            return this == CONCAT || this == POW;
        }
    }
}
