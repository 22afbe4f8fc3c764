package com.moonshift.compiler.ast.stmt;

import com.moonshift.compiler.ast.AstNode;

/**
 * 代码块终结语句基类（return / break / continue）
 */
public abstract class LastStatement extends AstNode {

    protected LastStatement() {
    }
}
