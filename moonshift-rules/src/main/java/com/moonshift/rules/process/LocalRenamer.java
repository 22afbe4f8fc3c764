package com.moonshift.rules.process;

import com.moonshift.compiler.ast.AstNode;
import com.moonshift.compiler.ast.TypedIdentifier;
import com.moonshift.compiler.ast.expr.FunctionExpr;
import com.moonshift.compiler.ast.expr.Identifier;
import com.moonshift.compiler.ast.stmt.*;

import java.util.List;

/**
 * 局部变量改名。
 *
 * <p>把块中某条语句声明的局部变量及其作用域内的所有引用改为新名字。
 * 作用域内再次声明的同名变量一并改名，新名字未在文件中出现过时语义不变。</p>
 */
public class LocalRenamer extends LuaTransformer {

    private final String from;
    private final String to;

    private LocalRenamer(String from, String to) {
        this.from = from;
        this.to = to;
    }

    /**
     * 改名第 index 条语句声明的局部变量 from，直到块末尾。
     * 声明语句的初值表达式仍引用外层变量，保持不变。
     */
    public static void renameFrom(Block block, int index, String from, String to) {
        LocalRenamer renamer = new LocalRenamer(from, to);
        List<Statement> statements = block.getStatements();
        Statement declaration = statements.get(index);
        if (declaration instanceof LocalAssignStmt) {
            renamer.renameAll(((LocalAssignStmt) declaration).getVariables());
        } else {
            statements.set(index, renamer.transformStmt(declaration));
        }
        for (int i = index + 1; i < statements.size(); i++) {
            statements.set(i, renamer.transformStmt(statements.get(i)));
        }
        if (block.hasLastStatement()) {
            block.setLastStatement(renamer.transformLastStmt(block.getLastStatement()));
        }
    }

    private void renameAll(List<TypedIdentifier> identifiers) {
        for (TypedIdentifier identifier : identifiers) {
            if (from.equals(identifier.getName())) {
                identifier.setName(to);
            }
        }
    }

    @Override
    public AstNode visitIdentifier(Identifier node, Void ctx) {
        return from.equals(node.getName()) ? new Identifier(to) : node;
    }

    @Override
    public AstNode visitLocalAssignStmt(LocalAssignStmt node, Void ctx) {
        super.visitLocalAssignStmt(node, ctx);
        renameAll(node.getVariables());
        return node;
    }

    @Override
    public AstNode visitLocalFunctionStmt(LocalFunctionStmt node, Void ctx) {
        super.visitLocalFunctionStmt(node, ctx);
        return from.equals(node.getName()) ? new LocalFunctionStmt(to, node.getFunction()) : node;
    }

    @Override
    public AstNode visitFunctionStmt(FunctionStmt node, Void ctx) {
        super.visitFunctionStmt(node, ctx);
        FunctionName name = node.getName();
        if (!from.equals(name.getRoot())) {
            return node;
        }
        return new FunctionStmt(new FunctionName(to, name.getFields(), name.getMethod()), node.getFunction());
    }

    @Override
    public AstNode visitFunctionExpr(FunctionExpr node, Void ctx) {
        renameAll(node.getParameters());
        return super.visitFunctionExpr(node, ctx);
    }

    @Override
    public AstNode visitNumericForStmt(NumericForStmt node, Void ctx) {
        super.visitNumericForStmt(node, ctx);
        TypedIdentifier variable = node.getVariable();
        if (from.equals(variable.getName())) {
            variable.setName(to);
        }
        return node;
    }

    @Override
    public AstNode visitGenericForStmt(GenericForStmt node, Void ctx) {
        super.visitGenericForStmt(node, ctx);
        renameAll(node.getVariables());
        return node;
    }
}
