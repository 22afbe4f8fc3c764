package com.moonshift.rules.process;

import com.moonshift.compiler.ast.AstNode;
import com.moonshift.compiler.ast.TypedIdentifier;
import com.moonshift.compiler.ast.expr.Expression;
import com.moonshift.compiler.ast.expr.FunctionExpr;
import com.moonshift.compiler.ast.expr.Identifier;
import com.moonshift.compiler.ast.stmt.*;

import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * 收集树中出现的所有标识符名（引用与声明），并单独记录局部声明的名字。
 * 用于生成辅助变量名时的冲突检测。
 */
public class IdentifierCollector extends LuaTransformer {

    private final Set<String> names = new LinkedHashSet<>();
    private final Set<String> localNames = new LinkedHashSet<>();

    public static IdentifierCollector collect(Block block) {
        IdentifierCollector collector = new IdentifierCollector();
        collector.transform(block);
        return collector;
    }

    public static IdentifierCollector collect(Expression expression) {
        IdentifierCollector collector = new IdentifierCollector();
        collector.transformExpr(expression);
        return collector;
    }

    /** 所有出现过的名字 */
    public Set<String> getNames() {
        return Collections.unmodifiableSet(names);
    }

    /** 以 local / 参数 / 循环变量方式声明的名字 */
    public Set<String> getLocalNames() {
        return Collections.unmodifiableSet(localNames);
    }

    private void declare(String name) {
        names.add(name);
        localNames.add(name);
    }

    private void declareAll(List<TypedIdentifier> identifiers) {
        for (TypedIdentifier identifier : identifiers) {
            declare(identifier.getName());
        }
    }

    @Override
    public AstNode visitIdentifier(Identifier node, Void ctx) {
        names.add(node.getName());
        return node;
    }

    @Override
    public AstNode visitLocalAssignStmt(LocalAssignStmt node, Void ctx) {
        declareAll(node.getVariables());
        return super.visitLocalAssignStmt(node, ctx);
    }

    @Override
    public AstNode visitLocalFunctionStmt(LocalFunctionStmt node, Void ctx) {
        declare(node.getName());
        return super.visitLocalFunctionStmt(node, ctx);
    }

    @Override
    public AstNode visitFunctionStmt(FunctionStmt node, Void ctx) {
        names.add(node.getName().getRoot());
        return super.visitFunctionStmt(node, ctx);
    }

    @Override
    public AstNode visitFunctionExpr(FunctionExpr node, Void ctx) {
        declareAll(node.getParameters());
        return super.visitFunctionExpr(node, ctx);
    }

    @Override
    public AstNode visitNumericForStmt(NumericForStmt node, Void ctx) {
        declare(node.getVariable().getName());
        return super.visitNumericForStmt(node, ctx);
    }

    @Override
    public AstNode visitGenericForStmt(GenericForStmt node, Void ctx) {
        declareAll(node.getVariables());
        return super.visitGenericForStmt(node, ctx);
    }
}
