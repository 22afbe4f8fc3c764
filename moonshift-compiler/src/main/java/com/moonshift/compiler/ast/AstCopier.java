package com.moonshift.compiler.ast;

import com.moonshift.compiler.ast.expr.*;
import com.moonshift.compiler.ast.stmt.*;

import java.util.ArrayList;
import java.util.List;

/**
 * AST 深拷贝。
 *
 * <p>树中每个节点只归属一个父节点；需要在多处放置同一段代码时先拷贝。</p>
 */
public final class AstCopier implements AstVisitor<AstNode, Void> {

    private static final AstCopier INSTANCE = new AstCopier();

    private AstCopier() {
    }

    public static Block copy(Block block) {
        return block == null ? null : (Block) block.accept(INSTANCE, null);
    }

    public static Statement copy(Statement stmt) {
        return stmt == null ? null : (Statement) stmt.accept(INSTANCE, null);
    }

    public static LastStatement copy(LastStatement stmt) {
        return stmt == null ? null : (LastStatement) stmt.accept(INSTANCE, null);
    }

    public static Expression copy(Expression expr) {
        return expr == null ? null : (Expression) expr.accept(INSTANCE, null);
    }

    private static List<Expression> copyExprs(List<Expression> exprs) {
        List<Expression> result = new ArrayList<>(exprs.size());
        for (Expression expr : exprs) {
            result.add(copy(expr));
        }
        return result;
    }

    private static List<TypedIdentifier> copyIdentifiers(List<TypedIdentifier> identifiers) {
        List<TypedIdentifier> result = new ArrayList<>(identifiers.size());
        for (TypedIdentifier id : identifiers) {
            result.add(new TypedIdentifier(id.getName(), id.getTypeAnnotation()));
        }
        return result;
    }

    // ============ 语句 ============

    @Override
    public AstNode visitBlock(Block node, Void ctx) {
        List<Statement> statements = new ArrayList<>(node.getStatements().size());
        for (Statement stmt : node.getStatements()) {
            statements.add(copy(stmt));
        }
        return new Block(statements, copy(node.getLastStatement()));
    }

    @Override
    public AstNode visitAssignStmt(AssignStmt node, Void ctx) {
        return new AssignStmt(copyExprs(node.getTargets()), copyExprs(node.getValues()));
    }

    @Override
    public AstNode visitCompoundAssignStmt(CompoundAssignStmt node, Void ctx) {
        return new CompoundAssignStmt(copy(node.getTarget()), node.getOperator(), copy(node.getValue()));
    }

    @Override
    public AstNode visitLocalAssignStmt(LocalAssignStmt node, Void ctx) {
        return new LocalAssignStmt(copyIdentifiers(node.getVariables()), copyExprs(node.getValues()));
    }

    @Override
    public AstNode visitLocalFunctionStmt(LocalFunctionStmt node, Void ctx) {
        return new LocalFunctionStmt(node.getName(), (FunctionExpr) copy(node.getFunction()));
    }

    @Override
    public AstNode visitFunctionStmt(FunctionStmt node, Void ctx) {
        FunctionName name = node.getName();
        return new FunctionStmt(new FunctionName(name.getRoot(), name.getFields(), name.getMethod()),
                (FunctionExpr) copy(node.getFunction()));
    }

    @Override
    public AstNode visitCallStmt(CallStmt node, Void ctx) {
        return new CallStmt((CallExpr) copy(node.getCall()));
    }

    @Override
    public AstNode visitIfStmt(IfStmt node, Void ctx) {
        List<IfBranch> branches = new ArrayList<>(node.getBranches().size());
        for (IfBranch branch : node.getBranches()) {
            branches.add(new IfBranch(copy(branch.getCondition()), copy(branch.getBlock())));
        }
        return new IfStmt(branches, copy(node.getElseBlock()));
    }

    @Override
    public AstNode visitWhileStmt(WhileStmt node, Void ctx) {
        return new WhileStmt(copy(node.getCondition()), copy(node.getBody()));
    }

    @Override
    public AstNode visitRepeatStmt(RepeatStmt node, Void ctx) {
        return new RepeatStmt(copy(node.getBody()), copy(node.getCondition()));
    }

    @Override
    public AstNode visitNumericForStmt(NumericForStmt node, Void ctx) {
        TypedIdentifier var = node.getVariable();
        return new NumericForStmt(new TypedIdentifier(var.getName(), var.getTypeAnnotation()),
                copy(node.getStart()), copy(node.getEnd()), copy(node.getStep()), copy(node.getBody()));
    }

    @Override
    public AstNode visitGenericForStmt(GenericForStmt node, Void ctx) {
        return new GenericForStmt(copyIdentifiers(node.getVariables()),
                copyExprs(node.getExpressions()), copy(node.getBody()));
    }

    @Override
    public AstNode visitDoStmt(DoStmt node, Void ctx) {
        return new DoStmt(copy(node.getBody()));
    }

    @Override
    public AstNode visitReturnStmt(ReturnStmt node, Void ctx) {
        return new ReturnStmt(copyExprs(node.getValues()));
    }

    @Override
    public AstNode visitBreakStmt(BreakStmt node, Void ctx) {
        return new BreakStmt();
    }

    @Override
    public AstNode visitContinueStmt(ContinueStmt node, Void ctx) {
        return new ContinueStmt();
    }

    // ============ 表达式 ============

    @Override
    public AstNode visitLiteral(Literal node, Void ctx) {
        return new Literal(node.getValue(), node.getKind());
    }

    @Override
    public AstNode visitVarargExpr(VarargExpr node, Void ctx) {
        return new VarargExpr();
    }

    @Override
    public AstNode visitIdentifier(Identifier node, Void ctx) {
        return new Identifier(node.getName());
    }

    @Override
    public AstNode visitUnaryExpr(UnaryExpr node, Void ctx) {
        return new UnaryExpr(node.getOperator(), copy(node.getOperand()));
    }

    @Override
    public AstNode visitBinaryExpr(BinaryExpr node, Void ctx) {
        return new BinaryExpr(copy(node.getLeft()), node.getOperator(), copy(node.getRight()));
    }

    @Override
    public AstNode visitParenExpr(ParenExpr node, Void ctx) {
        return new ParenExpr(copy(node.getInner()));
    }

    @Override
    public AstNode visitTableExpr(TableExpr node, Void ctx) {
        List<TableEntry> entries = new ArrayList<>(node.getEntries().size());
        for (TableEntry entry : node.getEntries()) {
            if (entry instanceof IndexEntry) {
                entries.add(new IndexEntry(copy(((IndexEntry) entry).getKey()), copy(entry.getValue())));
            } else if (entry instanceof FieldEntry) {
                entries.add(new FieldEntry(((FieldEntry) entry).getName(), copy(entry.getValue())));
            } else {
                entries.add(new ValueEntry(copy(entry.getValue())));
            }
        }
        return new TableExpr(entries);
    }

    @Override
    public AstNode visitFunctionExpr(FunctionExpr node, Void ctx) {
        return new FunctionExpr(copyIdentifiers(node.getParameters()), node.isVariadic(), copy(node.getBody()));
    }

    @Override
    public AstNode visitCallExpr(CallExpr node, Void ctx) {
        return new CallExpr(copy(node.getCallee()), node.getMethod(), copyExprs(node.getArguments()));
    }

    @Override
    public AstNode visitFieldExpr(FieldExpr node, Void ctx) {
        return new FieldExpr(copy(node.getTarget()), node.getField());
    }

    @Override
    public AstNode visitIndexExpr(IndexExpr node, Void ctx) {
        return new IndexExpr(copy(node.getTarget()), copy(node.getIndex()));
    }
}
