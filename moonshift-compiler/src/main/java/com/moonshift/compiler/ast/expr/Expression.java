package com.moonshift.compiler.ast.expr;

import com.moonshift.compiler.ast.AstNode;

/**
 * 表达式基类
 */
public abstract class Expression extends AstNode {

    protected Expression() {
    }
}
