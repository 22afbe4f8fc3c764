package com.moonshift.compiler.ast.stmt;

import com.moonshift.compiler.ast.expr.Expression;

/**
 * if / elseif 分支
 */
public class IfBranch {
    private Expression condition;
    private Block block;

    public IfBranch(Expression condition, Block block) {
        this.condition = condition;
        this.block = block;
    }

    public Expression getCondition() {
        return condition;
    }

    public void setCondition(Expression condition) {
        this.condition = condition;
    }

    public Block getBlock() {
        return block;
    }

    public void setBlock(Block block) {
        this.block = block;
    }
}
