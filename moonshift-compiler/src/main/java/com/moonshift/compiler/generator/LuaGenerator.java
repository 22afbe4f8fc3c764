package com.moonshift.compiler.generator;

import com.moonshift.compiler.ast.AstVisitor;
import com.moonshift.compiler.ast.TypedIdentifier;
import com.moonshift.compiler.ast.expr.*;
import com.moonshift.compiler.ast.stmt.*;

import java.util.List;

/**
 * Lua 源码生成器
 *
 * <p>遍历 AST 输出源码。不做运算符优先级推导：括号由树中的
 * {@link ParenExpr} 显式给出。相邻语句可能被误读为一次调用时
 * （上一句以前缀表达式结尾、下一句以 {@code (} 开头）自动插入 {@code ;}。</p>
 */
public class LuaGenerator implements AstVisitor<Void, GeneratorContext> {

    /**
     * 生成代码块
     */
    public String generate(Block block, GeneratorConfig config) {
        GeneratorContext ctx = new GeneratorContext(config);
        visitBlock(block, ctx);
        return ctx.getOutput();
    }

    /**
     * 使用默认（可读）配置生成
     */
    public String generate(Block block) {
        return generate(block, new GeneratorConfig());
    }

    /**
     * 以紧凑模式生成单个表达式
     */
    public String generate(Expression expression) {
        GeneratorContext ctx = new GeneratorContext(GeneratorConfig.dense());
        expression.accept(this, ctx);
        return ctx.getOutput();
    }

    // ============ 代码块 ============

    @Override
    public Void visitBlock(Block node, GeneratorContext ctx) {
        List<Statement> statements = node.getStatements();
        Statement previous = null;
        for (Statement statement : statements) {
            if (previous != null) {
                if (endsWithPrefix(previous) && startsWithParenthesis(statement)) {
                    ctx.append(";");
                }
                ctx.lineBreak();
            }
            statement.accept(this, ctx);
            previous = statement;
        }
        if (node.hasLastStatement()) {
            if (previous != null) {
                ctx.lineBreak();
            }
            node.getLastStatement().accept(this, ctx);
        }
        return null;
    }

    /**
     * 输出嵌套块体：前后各一次语句分隔，块体缩进一层
     */
    private void formatBody(Block body, GeneratorContext ctx) {
        ctx.indent();
        if (!body.isEmpty()) {
            ctx.lineBreak();
            visitBlock(body, ctx);
        }
        ctx.dedent();
        ctx.lineBreak();
    }

    // ============ 语句 ============

    @Override
    public Void visitAssignStmt(AssignStmt node, GeneratorContext ctx) {
        formatExpressionList(node.getTargets(), ctx);
        ctx.append(" = ");
        formatExpressionList(node.getValues(), ctx);
        return null;
    }

    @Override
    public Void visitCompoundAssignStmt(CompoundAssignStmt node, GeneratorContext ctx) {
        node.getTarget().accept(this, ctx);
        ctx.append(" ");
        ctx.append(node.getOperator().toSourceString());
        ctx.append(" ");
        node.getValue().accept(this, ctx);
        return null;
    }

    @Override
    public Void visitLocalAssignStmt(LocalAssignStmt node, GeneratorContext ctx) {
        ctx.append("local ");
        formatIdentifierList(node.getVariables(), ctx);
        if (!node.getValues().isEmpty()) {
            ctx.append(" = ");
            formatExpressionList(node.getValues(), ctx);
        }
        return null;
    }

    @Override
    public Void visitLocalFunctionStmt(LocalFunctionStmt node, GeneratorContext ctx) {
        ctx.append("local function ");
        ctx.append(node.getName());
        formatFunctionBody(node.getFunction(), ctx);
        return null;
    }

    @Override
    public Void visitFunctionStmt(FunctionStmt node, GeneratorContext ctx) {
        ctx.append("function ");
        ctx.append(node.getName().toString());
        formatFunctionBody(node.getFunction(), ctx);
        return null;
    }

    @Override
    public Void visitCallStmt(CallStmt node, GeneratorContext ctx) {
        node.getCall().accept(this, ctx);
        return null;
    }

    @Override
    public Void visitIfStmt(IfStmt node, GeneratorContext ctx) {
        List<IfBranch> branches = node.getBranches();
        for (int i = 0; i < branches.size(); i++) {
            IfBranch branch = branches.get(i);
            ctx.append(i == 0 ? "if " : "elseif ");
            branch.getCondition().accept(this, ctx);
            ctx.append(" then");
            formatBody(branch.getBlock(), ctx);
        }
        if (node.hasElse()) {
            ctx.append("else");
            formatBody(node.getElseBlock(), ctx);
        }
        ctx.append("end");
        return null;
    }

    @Override
    public Void visitWhileStmt(WhileStmt node, GeneratorContext ctx) {
        ctx.append("while ");
        node.getCondition().accept(this, ctx);
        ctx.append(" do");
        formatBody(node.getBody(), ctx);
        ctx.append("end");
        return null;
    }

    @Override
    public Void visitRepeatStmt(RepeatStmt node, GeneratorContext ctx) {
        ctx.append("repeat");
        formatBody(node.getBody(), ctx);
        ctx.append("until ");
        node.getCondition().accept(this, ctx);
        return null;
    }

    @Override
    public Void visitNumericForStmt(NumericForStmt node, GeneratorContext ctx) {
        ctx.append("for ");
        formatIdentifier(node.getVariable(), ctx);
        ctx.append(" = ");
        node.getStart().accept(this, ctx);
        ctx.append(", ");
        node.getEnd().accept(this, ctx);
        if (node.hasStep()) {
            ctx.append(", ");
            node.getStep().accept(this, ctx);
        }
        ctx.append(" do");
        formatBody(node.getBody(), ctx);
        ctx.append("end");
        return null;
    }

    @Override
    public Void visitGenericForStmt(GenericForStmt node, GeneratorContext ctx) {
        ctx.append("for ");
        formatIdentifierList(node.getVariables(), ctx);
        ctx.append(" in ");
        formatExpressionList(node.getExpressions(), ctx);
        ctx.append(" do");
        formatBody(node.getBody(), ctx);
        ctx.append("end");
        return null;
    }

    @Override
    public Void visitDoStmt(DoStmt node, GeneratorContext ctx) {
        ctx.append("do");
        formatBody(node.getBody(), ctx);
        ctx.append("end");
        return null;
    }

    @Override
    public Void visitReturnStmt(ReturnStmt node, GeneratorContext ctx) {
        ctx.append("return");
        if (!node.getValues().isEmpty()) {
            ctx.append(" ");
            formatExpressionList(node.getValues(), ctx);
        }
        return null;
    }

    @Override
    public Void visitBreakStmt(BreakStmt node, GeneratorContext ctx) {
        ctx.append("break");
        return null;
    }

    @Override
    public Void visitContinueStmt(ContinueStmt node, GeneratorContext ctx) {
        ctx.append("continue");
        return null;
    }

    // ============ 表达式 ============

    @Override
    public Void visitLiteral(Literal node, GeneratorContext ctx) {
        switch (node.getKind()) {
            case NIL:
                ctx.append("nil");
                break;
            case BOOLEAN:
                ctx.append(Boolean.TRUE.equals(node.getValue()) ? "true" : "false");
                break;
            case NUMBER:
                ctx.append(LuaStringUtils.writeNumber(node.getNumber()));
                break;
            case STRING:
                ctx.append(LuaStringUtils.writeString((String) node.getValue()));
                break;
        }
        return null;
    }

    @Override
    public Void visitVarargExpr(VarargExpr node, GeneratorContext ctx) {
        ctx.append("...");
        return null;
    }

    @Override
    public Void visitIdentifier(Identifier node, GeneratorContext ctx) {
        ctx.append(node.getName());
        return null;
    }

    @Override
    public Void visitUnaryExpr(UnaryExpr node, GeneratorContext ctx) {
        ctx.append(node.getOperator().toSourceString());
        if (node.getOperator() == UnaryExpr.UnaryOp.NOT || startsWithMinus(node.getOperand())) {
            // "not" 需要空格；"- -x" 不能写成注释 "--x"
            ctx.append(" ");
        }
        node.getOperand().accept(this, ctx);
        return null;
    }

    @Override
    public Void visitBinaryExpr(BinaryExpr node, GeneratorContext ctx) {
        node.getLeft().accept(this, ctx);
        ctx.append(" ");
        ctx.append(node.getOperator().toSourceString());
        ctx.append(" ");
        node.getRight().accept(this, ctx);
        return null;
    }

    @Override
    public Void visitParenExpr(ParenExpr node, GeneratorContext ctx) {
        ctx.append("(");
        node.getInner().accept(this, ctx);
        ctx.append(")");
        return null;
    }

    @Override
    public Void visitTableExpr(TableExpr node, GeneratorContext ctx) {
        ctx.append("{");
        List<TableEntry> entries = node.getEntries();
        for (int i = 0; i < entries.size(); i++) {
            if (i > 0) ctx.append(", ");
            TableEntry entry = entries.get(i);
            if (entry instanceof FieldEntry) {
                ctx.append(((FieldEntry) entry).getName());
                ctx.append(" = ");
            } else if (entry instanceof IndexEntry) {
                formatBracketed(((IndexEntry) entry).getKey(), ctx);
                ctx.append(" = ");
            }
            entry.getValue().accept(this, ctx);
        }
        ctx.append("}");
        return null;
    }

    @Override
    public Void visitFunctionExpr(FunctionExpr node, GeneratorContext ctx) {
        ctx.append("function");
        formatFunctionBody(node, ctx);
        return null;
    }

    @Override
    public Void visitCallExpr(CallExpr node, GeneratorContext ctx) {
        formatPrefix(node.getCallee(), ctx);
        if (node.isMethodCall()) {
            ctx.append(":");
            ctx.append(node.getMethod());
        }
        ctx.append("(");
        formatExpressionList(node.getArguments(), ctx);
        ctx.append(")");
        return null;
    }

    @Override
    public Void visitFieldExpr(FieldExpr node, GeneratorContext ctx) {
        formatPrefix(node.getTarget(), ctx);
        ctx.append(".");
        ctx.append(node.getField());
        return null;
    }

    @Override
    public Void visitIndexExpr(IndexExpr node, GeneratorContext ctx) {
        formatPrefix(node.getTarget(), ctx);
        formatBracketed(node.getIndex(), ctx);
        return null;
    }

    // ============ 辅助方法 ============

    private void formatFunctionBody(FunctionExpr function, GeneratorContext ctx) {
        ctx.append("(");
        formatIdentifierList(function.getParameters(), ctx);
        if (function.isVariadic()) {
            if (!function.getParameters().isEmpty()) ctx.append(", ");
            ctx.append("...");
        }
        ctx.append(")");
        formatBody(function.getBody(), ctx);
        ctx.append("end");
    }

    private void formatExpressionList(List<Expression> expressions, GeneratorContext ctx) {
        for (int i = 0; i < expressions.size(); i++) {
            if (i > 0) ctx.append(", ");
            expressions.get(i).accept(this, ctx);
        }
    }

    private void formatIdentifierList(List<TypedIdentifier> identifiers, GeneratorContext ctx) {
        for (int i = 0; i < identifiers.size(); i++) {
            if (i > 0) ctx.append(", ");
            formatIdentifier(identifiers.get(i), ctx);
        }
    }

    private void formatIdentifier(TypedIdentifier identifier, GeneratorContext ctx) {
        ctx.append(identifier.getName());
        if (identifier.hasTypeAnnotation()) {
            ctx.append(": ");
            ctx.append(identifier.getTypeAnnotation());
        }
    }

    /** 调用/索引的目标必须是前缀表达式，否则补括号 */
    private void formatPrefix(Expression target, GeneratorContext ctx) {
        if (isPrefix(target)) {
            target.accept(this, ctx);
        } else {
            ctx.append("(");
            target.accept(this, ctx);
            ctx.append(")");
        }
    }

    /** 方括号内以长括号字符串开头时加空格，避免 "[[" 被读成长字符串 */
    private void formatBracketed(Expression key, GeneratorContext ctx) {
        boolean pad = key instanceof Literal
                && ((Literal) key).getKind() == Literal.LiteralKind.STRING
                && LuaStringUtils.writeString((String) ((Literal) key).getValue()).startsWith("[");
        ctx.append(pad ? "[ " : "[");
        key.accept(this, ctx);
        ctx.append(pad ? " ]" : "]");
    }

    private static boolean isPrefix(Expression expression) {
        return expression instanceof Identifier
                || expression instanceof FieldExpr
                || expression instanceof IndexExpr
                || expression instanceof CallExpr
                || expression instanceof ParenExpr;
    }

    private static boolean startsWithMinus(Expression expression) {
        if (expression instanceof UnaryExpr) {
            return ((UnaryExpr) expression).getOperator() == UnaryExpr.UnaryOp.NEG;
        }
        if (expression instanceof Literal && ((Literal) expression).getKind() == Literal.LiteralKind.NUMBER) {
            return LuaStringUtils.writeNumber(((Literal) expression).getNumber()).startsWith("-");
        }
        if (expression instanceof BinaryExpr) {
            return startsWithMinus(((BinaryExpr) expression).getLeft());
        }
        return false;
    }

    // ============ 语句边界 ============

    /**
     * 语句是否以前缀表达式结尾（其后紧跟 "(" 会被解析为调用）
     */
    static boolean endsWithPrefix(Statement statement) {
        if (statement instanceof AssignStmt) {
            List<Expression> values = ((AssignStmt) statement).getValues();
            return !values.isEmpty() && expressionEndsWithPrefix(values.get(values.size() - 1));
        } else if (statement instanceof CompoundAssignStmt) {
            return expressionEndsWithPrefix(((CompoundAssignStmt) statement).getValue());
        } else if (statement instanceof CallStmt) {
            return true;
        } else if (statement instanceof RepeatStmt) {
            return expressionEndsWithPrefix(((RepeatStmt) statement).getCondition());
        } else if (statement instanceof LocalAssignStmt) {
            List<Expression> values = ((LocalAssignStmt) statement).getValues();
            return !values.isEmpty() && expressionEndsWithPrefix(values.get(values.size() - 1));
        }
        return false;
    }

    /**
     * 语句是否以 "(" 开头
     */
    static boolean startsWithParenthesis(Statement statement) {
        if (statement instanceof AssignStmt) {
            List<Expression> targets = ((AssignStmt) statement).getTargets();
            return !targets.isEmpty() && expressionStartsWithParenthesis(targets.get(0));
        } else if (statement instanceof CompoundAssignStmt) {
            return expressionStartsWithParenthesis(((CompoundAssignStmt) statement).getTarget());
        } else if (statement instanceof CallStmt) {
            return expressionStartsWithParenthesis(((CallStmt) statement).getCall());
        }
        return false;
    }

    private static boolean expressionEndsWithPrefix(Expression expression) {
        if (expression instanceof BinaryExpr) {
            return expressionEndsWithPrefix(((BinaryExpr) expression).getRight());
        } else if (expression instanceof UnaryExpr) {
            return expressionEndsWithPrefix(((UnaryExpr) expression).getOperand());
        }
        return isPrefix(expression);
    }

    private static boolean expressionStartsWithParenthesis(Expression expression) {
        if (expression instanceof ParenExpr) {
            return true;
        } else if (expression instanceof CallExpr) {
            return prefixStartsWithParenthesis(((CallExpr) expression).getCallee());
        } else if (expression instanceof FieldExpr) {
            return prefixStartsWithParenthesis(((FieldExpr) expression).getTarget());
        } else if (expression instanceof IndexExpr) {
            return prefixStartsWithParenthesis(((IndexExpr) expression).getTarget());
        }
        return false;
    }

    /** 非前缀目标会被 {@link #formatPrefix} 补括号 */
    private static boolean prefixStartsWithParenthesis(Expression target) {
        return !isPrefix(target) || expressionStartsWithParenthesis(target);
    }
}
