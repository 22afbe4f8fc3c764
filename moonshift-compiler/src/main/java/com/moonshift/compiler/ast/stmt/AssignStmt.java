package com.moonshift.compiler.ast.stmt;

import com.moonshift.compiler.ast.AstVisitor;
import com.moonshift.compiler.ast.expr.Expression;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * 赋值语句：{@code a, b.c, d[e] = x, y, z}
 *
 * <p>目标只能是 Identifier / FieldExpr / IndexExpr。</p>
 */
public class AssignStmt extends Statement {
    private final List<Expression> targets;
    private final List<Expression> values;

    public AssignStmt(List<Expression> targets, List<Expression> values) {
        this.targets = new ArrayList<>(targets);
        this.values = new ArrayList<>(values);
    }

    public static AssignStmt of(Expression target, Expression value) {
        return new AssignStmt(Collections.singletonList(target), Collections.singletonList(value));
    }

    public List<Expression> getTargets() {
        return targets;
    }

    public List<Expression> getValues() {
        return values;
    }

    @Override
    public <R, C> R accept(AstVisitor<R, C> visitor, C context) {
        return visitor.visitAssignStmt(this, context);
    }
}
