package com.moonshift.compiler.ast.stmt;

import com.moonshift.compiler.ast.AstVisitor;
import com.moonshift.compiler.ast.TypedIdentifier;
import com.moonshift.compiler.ast.expr.Expression;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * 局部变量声明：{@code local a, b = x, y}
 */
public class LocalAssignStmt extends Statement {
    private final List<TypedIdentifier> variables;
    private final List<Expression> values;

    public LocalAssignStmt(List<TypedIdentifier> variables, List<Expression> values) {
        this.variables = new ArrayList<>(variables);
        this.values = new ArrayList<>(values);
    }

    public static LocalAssignStmt of(String name, Expression value) {
        return new LocalAssignStmt(Collections.singletonList(new TypedIdentifier(name)),
                Collections.singletonList(value));
    }

    public List<TypedIdentifier> getVariables() {
        return variables;
    }

    public List<Expression> getValues() {
        return values;
    }

    @Override
    public <R, C> R accept(AstVisitor<R, C> visitor, C context) {
        return visitor.visitLocalAssignStmt(this, context);
    }
}
