package com.moonshift.compiler.ast.stmt;

import com.moonshift.compiler.ast.AstVisitor;
import com.moonshift.compiler.ast.expr.Expression;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Return 语句
 */
public class ReturnStmt extends LastStatement {
    private final List<Expression> values;

    public ReturnStmt() {
        this(Collections.emptyList());
    }

    public ReturnStmt(List<Expression> values) {
        this.values = new ArrayList<>(values);
    }

    public static ReturnStmt of(Expression value) {
        return new ReturnStmt(Collections.singletonList(value));
    }

    public List<Expression> getValues() {
        return values;
    }

    @Override
    public <R, C> R accept(AstVisitor<R, C> visitor, C context) {
        return visitor.visitReturnStmt(this, context);
    }
}
