package com.moonshift.compiler.ast.stmt;

import com.moonshift.compiler.ast.AstNode;

/**
 * 语句基类
 */
public abstract class Statement extends AstNode {

    protected Statement() {
    }
}
