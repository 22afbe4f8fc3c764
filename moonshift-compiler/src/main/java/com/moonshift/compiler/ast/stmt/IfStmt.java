package com.moonshift.compiler.ast.stmt;

import com.moonshift.compiler.ast.AstVisitor;
import com.moonshift.compiler.ast.expr.Expression;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * If 语句：一个或多个分支（if / elseif）+ 可选 else 块
 */
public class IfStmt extends Statement {
    private final List<IfBranch> branches;
    private Block elseBlock;  // 可选

    public IfStmt(List<IfBranch> branches, Block elseBlock) {
        this.branches = new ArrayList<>(branches);
        this.elseBlock = elseBlock;
    }

    /** 单分支 if */
    public static IfStmt of(Expression condition, Block block) {
        return new IfStmt(Collections.singletonList(new IfBranch(condition, block)), null);
    }

    public List<IfBranch> getBranches() {
        return branches;
    }

    public Block getElseBlock() {
        return elseBlock;
    }

    public void setElseBlock(Block elseBlock) {
        this.elseBlock = elseBlock;
    }

    public boolean hasElse() {
        return elseBlock != null;
    }

    @Override
    public <R, C> R accept(AstVisitor<R, C> visitor, C context) {
        return visitor.visitIfStmt(this, context);
    }
}
