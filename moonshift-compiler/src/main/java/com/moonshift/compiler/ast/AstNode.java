package com.moonshift.compiler.ast;

/**
 * AST 节点基类
 */
public abstract class AstNode {

    protected AstNode() {
    }

    public abstract <R, C> R accept(AstVisitor<R, C> visitor, C context);
}
