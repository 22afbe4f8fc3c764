package com.moonshift.rules.process;

import com.moonshift.compiler.ast.AstNode;
import com.moonshift.compiler.ast.AstVisitor;
import com.moonshift.compiler.ast.expr.*;
import com.moonshift.compiler.ast.stmt.*;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.List;

/**
 * 可变 AST 遍历基类（原地修改）。
 *
 * <p>递归遍历所有节点，把钩子返回的节点写回父节点。子类覆盖
 * {@code transformXxx} 钩子或具体的 {@code visitXxx} 方法实现改写：</p>
 * <ul>
 *   <li>钩子返回其他节点即替换当前节点</li>
 *   <li>{@link #transformStmt} 返回 {@code null} 即删除当前语句</li>
 *   <li>{@link #insertBefore} 在当前语句之前插入兄弟语句</li>
 * </ul>
 *
 * <p>遍历顺序：语句按文本顺序；条件/迭代表达式先于嵌套块（repeat 的条件也先于循环体）；
 * 赋值目标先于赋值值；函数体同样会被遍历。</p>
 *
 * <p>下标策略：每个正在遍历的块持有一个游标。在游标前插入 n 条语句时游标前进 n，
 * 因此当前语句只被访问一次，新插入的语句不会被访问。</p>
 */
public class LuaTransformer implements AstVisitor<AstNode, Void> {

    private final Deque<BlockCursor> cursors = new ArrayDeque<>();

    /**
     * 变换入口
     */
    public Block transform(Block block) {
        return transformBlock(block);
    }

    // ==================== 钩子 ====================

    protected Block transformBlock(Block block) {
        if (block == null) return null;
        return (Block) block.accept(this, null);
    }

    protected Statement transformStmt(Statement stmt) {
        return (Statement) stmt.accept(this, null);
    }

    protected LastStatement transformLastStmt(LastStatement stmt) {
        return (LastStatement) stmt.accept(this, null);
    }

    protected Expression transformExpr(Expression expr) {
        if (expr == null) return null;
        return (Expression) expr.accept(this, null);
    }

    // ==================== 结构修改 ====================

    /**
     * 在当前正在遍历的语句之前插入语句。插入的语句不会被本次遍历访问。
     *
     * @throws IllegalStateException 不在任何块的遍历过程中调用时
     */
    protected void insertBefore(Statement... statements) {
        BlockCursor cursor = cursors.peek();
        if (cursor == null) {
            throw new IllegalStateException("insertBefore called outside of block traversal");
        }
        for (Statement statement : statements) {
            cursor.block.insertStatement(cursor.index, statement);
            cursor.index++;
        }
    }

    /**
     * 当前正在遍历的最内层块
     */
    protected Block currentBlock() {
        BlockCursor cursor = cursors.peek();
        return cursor != null ? cursor.block : null;
    }

    private void transformExprList(List<Expression> expressions) {
        for (int i = 0; i < expressions.size(); i++) {
            expressions.set(i, transformExpr(expressions.get(i)));
        }
    }

    // ==================== 块 ====================

    @Override
    public AstNode visitBlock(Block node, Void ctx) {
        BlockCursor cursor = new BlockCursor(node);
        cursors.push(cursor);
        try {
            List<Statement> statements = node.getStatements();
            for (cursor.index = 0; cursor.index < statements.size(); cursor.index++) {
                Statement original = statements.get(cursor.index);
                Statement result = transformStmt(original);
                if (result == null) {
                    statements.remove(cursor.index);
                    cursor.index--;
                } else if (result != original) {
                    statements.set(cursor.index, result);
                }
            }
            if (node.hasLastStatement()) {
                cursor.index = statements.size();
                node.setLastStatement(transformLastStmt(node.getLastStatement()));
            }
        } finally {
            cursors.pop();
        }
        return node;
    }

    // ==================== 语句 ====================

    @Override
    public AstNode visitAssignStmt(AssignStmt node, Void ctx) {
        transformExprList(node.getTargets());
        transformExprList(node.getValues());
        return node;
    }

    @Override
    public AstNode visitCompoundAssignStmt(CompoundAssignStmt node, Void ctx) {
        node.setTarget(transformExpr(node.getTarget()));
        node.setValue(transformExpr(node.getValue()));
        return node;
    }

    @Override
    public AstNode visitLocalAssignStmt(LocalAssignStmt node, Void ctx) {
        transformExprList(node.getValues());
        return node;
    }

    @Override
    public AstNode visitLocalFunctionStmt(LocalFunctionStmt node, Void ctx) {
        node.getFunction().accept(this, null);
        return node;
    }

    @Override
    public AstNode visitFunctionStmt(FunctionStmt node, Void ctx) {
        node.getFunction().accept(this, null);
        return node;
    }

    @Override
    public AstNode visitCallStmt(CallStmt node, Void ctx) {
        Expression call = transformExpr(node.getCall());
        if (!(call instanceof CallExpr)) {
            throw new IllegalStateException("call statement rewritten into a non-call expression");
        }
        node.setCall((CallExpr) call);
        return node;
    }

    @Override
    public AstNode visitIfStmt(IfStmt node, Void ctx) {
        for (IfBranch branch : node.getBranches()) {
            branch.setCondition(transformExpr(branch.getCondition()));
            branch.setBlock(transformBlock(branch.getBlock()));
        }
        if (node.hasElse()) {
            node.setElseBlock(transformBlock(node.getElseBlock()));
        }
        return node;
    }

    @Override
    public AstNode visitWhileStmt(WhileStmt node, Void ctx) {
        node.setCondition(transformExpr(node.getCondition()));
        node.setBody(transformBlock(node.getBody()));
        return node;
    }

    @Override
    public AstNode visitRepeatStmt(RepeatStmt node, Void ctx) {
        node.setCondition(transformExpr(node.getCondition()));
        node.setBody(transformBlock(node.getBody()));
        return node;
    }

    @Override
    public AstNode visitNumericForStmt(NumericForStmt node, Void ctx) {
        node.setStart(transformExpr(node.getStart()));
        node.setEnd(transformExpr(node.getEnd()));
        node.setStep(transformExpr(node.getStep()));
        node.setBody(transformBlock(node.getBody()));
        return node;
    }

    @Override
    public AstNode visitGenericForStmt(GenericForStmt node, Void ctx) {
        transformExprList(node.getExpressions());
        node.setBody(transformBlock(node.getBody()));
        return node;
    }

    @Override
    public AstNode visitDoStmt(DoStmt node, Void ctx) {
        node.setBody(transformBlock(node.getBody()));
        return node;
    }

    @Override
    public AstNode visitReturnStmt(ReturnStmt node, Void ctx) {
        transformExprList(node.getValues());
        return node;
    }

    @Override
    public AstNode visitBreakStmt(BreakStmt node, Void ctx) {
        return node;
    }

    @Override
    public AstNode visitContinueStmt(ContinueStmt node, Void ctx) {
        return node;
    }

    // ==================== 表达式 ====================

    @Override
    public AstNode visitLiteral(Literal node, Void ctx) {
        return node;
    }

    @Override
    public AstNode visitVarargExpr(VarargExpr node, Void ctx) {
        return node;
    }

    @Override
    public AstNode visitIdentifier(Identifier node, Void ctx) {
        return node;
    }

    @Override
    public AstNode visitUnaryExpr(UnaryExpr node, Void ctx) {
        node.setOperand(transformExpr(node.getOperand()));
        return node;
    }

    @Override
    public AstNode visitBinaryExpr(BinaryExpr node, Void ctx) {
        node.setLeft(transformExpr(node.getLeft()));
        node.setRight(transformExpr(node.getRight()));
        return node;
    }

    @Override
    public AstNode visitParenExpr(ParenExpr node, Void ctx) {
        node.setInner(transformExpr(node.getInner()));
        return node;
    }

    @Override
    public AstNode visitTableExpr(TableExpr node, Void ctx) {
        for (TableEntry entry : node.getEntries()) {
            if (entry instanceof IndexEntry) {
                IndexEntry indexEntry = (IndexEntry) entry;
                indexEntry.setKey(transformExpr(indexEntry.getKey()));
            }
            entry.setValue(transformExpr(entry.getValue()));
        }
        return node;
    }

    @Override
    public AstNode visitFunctionExpr(FunctionExpr node, Void ctx) {
        node.setBody(transformBlock(node.getBody()));
        return node;
    }

    @Override
    public AstNode visitCallExpr(CallExpr node, Void ctx) {
        node.setCallee(transformExpr(node.getCallee()));
        transformExprList(node.getArguments());
        return node;
    }

    @Override
    public AstNode visitFieldExpr(FieldExpr node, Void ctx) {
        node.setTarget(transformExpr(node.getTarget()));
        return node;
    }

    @Override
    public AstNode visitIndexExpr(IndexExpr node, Void ctx) {
        node.setTarget(transformExpr(node.getTarget()));
        node.setIndex(transformExpr(node.getIndex()));
        return node;
    }

    /**
     * 块遍历游标
     */
    private static final class BlockCursor {
        final Block block;
        int index;

        BlockCursor(Block block) {
            this.block = block;
        }
    }
}
