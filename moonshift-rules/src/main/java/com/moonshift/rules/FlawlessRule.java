package com.moonshift.rules;

import com.moonshift.compiler.ast.stmt.Block;

/**
 * 对结构良好的语法树必定成功的规则。
 * 内部不变量被破坏属于程序缺陷，以非受检异常抛出。
 */
public abstract class FlawlessRule implements Rule {

    @Override
    public final void process(Block block, RuleContext context) {
        flawlessProcess(block, context);
    }

    protected abstract void flawlessProcess(Block block, RuleContext context);
}
