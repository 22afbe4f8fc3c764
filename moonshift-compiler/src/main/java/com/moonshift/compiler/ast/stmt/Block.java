package com.moonshift.compiler.ast.stmt;

import com.moonshift.compiler.ast.AstNode;
import com.moonshift.compiler.ast.AstVisitor;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * 代码块：有序语句序列 + 可选的终结语句（return / break / continue）。
 *
 * <p>终结语句单独保存，因此它只能出现一次且总在最后。语句列表为可变的
 * {@link ArrayList}，遍历时按下标访问，允许在游标前插入。</p>
 */
public class Block extends AstNode {
    private final List<Statement> statements;
    private LastStatement lastStatement;  // 可选

    public Block() {
        this(Collections.emptyList(), null);
    }

    public Block(List<Statement> statements) {
        this(statements, null);
    }

    public Block(List<Statement> statements, LastStatement lastStatement) {
        this.statements = new ArrayList<>(statements);
        this.lastStatement = lastStatement;
    }

    public List<Statement> getStatements() {
        return statements;
    }

    public void addStatement(Statement statement) {
        statements.add(statement);
    }

    public void insertStatement(int index, Statement statement) {
        statements.add(index, statement);
    }

    public LastStatement getLastStatement() {
        return lastStatement;
    }

    public boolean hasLastStatement() {
        return lastStatement != null;
    }

    public void setLastStatement(LastStatement lastStatement) {
        this.lastStatement = lastStatement;
    }

    /** 清空语句与终结语句，用于整体重建 */
    public void clear() {
        statements.clear();
        lastStatement = null;
    }

    public boolean isEmpty() {
        return statements.isEmpty() && lastStatement == null;
    }

    @Override
    public <R, C> R accept(AstVisitor<R, C> visitor, C context) {
        return visitor.visitBlock(this, context);
    }
}
