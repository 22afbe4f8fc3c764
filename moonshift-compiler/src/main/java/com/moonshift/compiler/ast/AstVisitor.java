package com.moonshift.compiler.ast;

import com.moonshift.compiler.ast.expr.*;
import com.moonshift.compiler.ast.stmt.*;

/**
 * AST 访问者接口
 *
 * <p>所有方法提供默认实现（返回 null），实现类只需覆盖感兴趣的节点类型。</p>
 */
public interface AstVisitor<R, C> {

    // ============ 语句 ============

    default R visitBlock(Block node, C ctx) { return null; }

    default R visitAssignStmt(AssignStmt node, C ctx) { return null; }

    default R visitCompoundAssignStmt(CompoundAssignStmt node, C ctx) { return null; }

    default R visitLocalAssignStmt(LocalAssignStmt node, C ctx) { return null; }

    default R visitLocalFunctionStmt(LocalFunctionStmt node, C ctx) { return null; }

    default R visitFunctionStmt(FunctionStmt node, C ctx) { return null; }

    default R visitCallStmt(CallStmt node, C ctx) { return null; }

    default R visitIfStmt(IfStmt node, C ctx) { return null; }

    default R visitWhileStmt(WhileStmt node, C ctx) { return null; }

    default R visitRepeatStmt(RepeatStmt node, C ctx) { return null; }

    default R visitNumericForStmt(NumericForStmt node, C ctx) { return null; }

    default R visitGenericForStmt(GenericForStmt node, C ctx) { return null; }

    default R visitDoStmt(DoStmt node, C ctx) { return null; }

    // ============ 终结语句 ============

    default R visitReturnStmt(ReturnStmt node, C ctx) { return null; }

    default R visitBreakStmt(BreakStmt node, C ctx) { return null; }

    default R visitContinueStmt(ContinueStmt node, C ctx) { return null; }

    // ============ 表达式 ============

    default R visitLiteral(Literal node, C ctx) { return null; }

    default R visitVarargExpr(VarargExpr node, C ctx) { return null; }

    default R visitIdentifier(Identifier node, C ctx) { return null; }

    default R visitUnaryExpr(UnaryExpr node, C ctx) { return null; }

    default R visitBinaryExpr(BinaryExpr node, C ctx) { return null; }

    default R visitParenExpr(ParenExpr node, C ctx) { return null; }

    default R visitTableExpr(TableExpr node, C ctx) { return null; }

    default R visitFunctionExpr(FunctionExpr node, C ctx) { return null; }

    default R visitCallExpr(CallExpr node, C ctx) { return null; }

    default R visitFieldExpr(FieldExpr node, C ctx) { return null; }

    default R visitIndexExpr(IndexExpr node, C ctx) { return null; }
}
