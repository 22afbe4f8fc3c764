package com.moonshift.compiler.parser;

import com.moonshift.compiler.ast.TypedIdentifier;
import com.moonshift.compiler.ast.expr.*;
import com.moonshift.compiler.ast.stmt.*;
import com.moonshift.compiler.lexer.Lexer;
import com.moonshift.compiler.lexer.Token;
import com.moonshift.compiler.lexer.TokenType;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import static com.moonshift.compiler.lexer.TokenType.*;

/**
 * Lua 语法分析器（递归下降）
 *
 * <p>覆盖 Lua 5.1 语句与表达式，以及 Luau 的 {@code continue}、复合赋值和
 * 简单类型注解（{@code name: Type} / {@code Type?}）。</p>
 */
public class Parser {

    /** 一元运算符的右优先级 */
    private static final int UNARY_PRIORITY = 12;

    private final List<Token> tokens;
    private final String fileName;
    private int position = 0;
    private Token current;
    private Token previous;

    public Parser(Lexer lexer) {
        this.tokens = lexer.scanTokens();
        this.fileName = lexer.getFileName();
        this.current = tokens.get(0);
        checkLexerError();
    }

    /**
     * 解析源码为代码块
     */
    public static Block parse(String source) {
        return new Parser(new Lexer(source)).parseChunk();
    }

    /**
     * 解析源码为代码块，错误信息中使用给定文件名
     */
    public static Block parse(String source, String fileName) {
        return new Parser(new Lexer(source, fileName)).parseChunk();
    }

    /**
     * 解析整个 chunk
     */
    public Block parseChunk() {
        Block block = parseBlock();
        if (!isAtEnd()) {
            throw error("Unexpected token after end of chunk", "<eof>");
        }
        return block;
    }

    // ============ 基础方法 ============

    private Token advance() {
        previous = current;
        if (position < tokens.size() - 1) {
            position++;
            current = tokens.get(position);
            checkLexerError();
        }
        return previous;
    }

    private Token peek() {
        return tokens.get(Math.min(position + 1, tokens.size() - 1));
    }

    private void checkLexerError() {
        if (current.getType() == ERROR) {
            throw new ParseException(fileName, "Lexer error", current);
        }
    }

    private boolean check(TokenType type) {
        return current.getType() == type;
    }

    private boolean match(TokenType type) {
        if (check(type)) {
            advance();
            return true;
        }
        return false;
    }

    private Token expect(TokenType type, String message) {
        if (check(type)) {
            return advance();
        }
        throw error(message, type.name());
    }

    private boolean isAtEnd() {
        return check(EOF);
    }

    private ParseException error(String message, String expected) {
        return new ParseException(fileName, message, current, expected);
    }

    // ============ 代码块 ============

    private boolean isBlockEnd(TokenType type) {
        return type == EOF || type == KW_END || type == KW_ELSE
                || type == KW_ELSEIF || type == KW_UNTIL;
    }

    /**
     * "continue" 仅在其后紧跟块结束符或分号时视为语句
     */
    private boolean isContinue() {
        if (!check(IDENTIFIER) || !"continue".equals(current.getLexeme())) {
            return false;
        }
        TokenType next = peek().getType();
        return isBlockEnd(next) || next == SEMICOLON;
    }

    private Block parseBlock() {
        List<Statement> statements = new ArrayList<>();
        LastStatement last = null;
        while (!isBlockEnd(current.getType())) {
            if (match(SEMICOLON)) {
                continue;
            }
            if (check(KW_RETURN)) {
                last = parseReturn();
                break;
            }
            if (match(KW_BREAK)) {
                last = new BreakStmt();
                match(SEMICOLON);
                break;
            }
            if (isContinue()) {
                advance();
                last = new ContinueStmt();
                match(SEMICOLON);
                break;
            }
            statements.add(parseStatement());
        }
        return new Block(statements, last);
    }

    private ReturnStmt parseReturn() {
        expect(KW_RETURN, "Expected 'return'");
        if (isBlockEnd(current.getType()) || check(SEMICOLON)) {
            match(SEMICOLON);
            return new ReturnStmt();
        }
        List<Expression> values = parseExpressionList();
        match(SEMICOLON);
        return new ReturnStmt(values);
    }

    // ============ 语句 ============

    private Statement parseStatement() {
        switch (current.getType()) {
            case KW_IF:
                return parseIf();
            case KW_WHILE: {
                advance();
                Expression condition = parseExpression();
                expect(KW_DO, "Expected 'do' after while condition");
                Block body = parseBlock();
                expect(KW_END, "Expected 'end' to close while");
                return new WhileStmt(condition, body);
            }
            case KW_DO: {
                advance();
                Block body = parseBlock();
                expect(KW_END, "Expected 'end' to close do");
                return new DoStmt(body);
            }
            case KW_FOR:
                return parseFor();
            case KW_REPEAT: {
                advance();
                Block body = parseBlock();
                expect(KW_UNTIL, "Expected 'until' to close repeat");
                return new RepeatStmt(body, parseExpression());
            }
            case KW_FUNCTION:
                return parseFunctionStmt();
            case KW_LOCAL:
                return parseLocal();
            default:
                return parseExpressionStatement();
        }
    }

    private IfStmt parseIf() {
        expect(KW_IF, "Expected 'if'");
        List<IfBranch> branches = new ArrayList<>();
        Expression condition = parseExpression();
        expect(KW_THEN, "Expected 'then' after if condition");
        branches.add(new IfBranch(condition, parseBlock()));

        while (match(KW_ELSEIF)) {
            Expression elseifCondition = parseExpression();
            expect(KW_THEN, "Expected 'then' after elseif condition");
            branches.add(new IfBranch(elseifCondition, parseBlock()));
        }

        Block elseBlock = null;
        if (match(KW_ELSE)) {
            elseBlock = parseBlock();
        }
        expect(KW_END, "Expected 'end' to close if");
        return new IfStmt(branches, elseBlock);
    }

    private Statement parseFor() {
        expect(KW_FOR, "Expected 'for'");
        TypedIdentifier first = parseTypedIdentifier();

        if (match(ASSIGN)) {
            Expression start = parseExpression();
            expect(COMMA, "Expected ',' after numeric for start");
            Expression end = parseExpression();
            Expression step = null;
            if (match(COMMA)) {
                step = parseExpression();
            }
            expect(KW_DO, "Expected 'do' after numeric for");
            Block body = parseBlock();
            expect(KW_END, "Expected 'end' to close for");
            return new NumericForStmt(first, start, end, step, body);
        }

        List<TypedIdentifier> variables = new ArrayList<>();
        variables.add(first);
        while (match(COMMA)) {
            variables.add(parseTypedIdentifier());
        }
        expect(KW_IN, "Expected '=' or 'in' in for statement");
        List<Expression> expressions = parseExpressionList();
        expect(KW_DO, "Expected 'do' after generic for");
        Block body = parseBlock();
        expect(KW_END, "Expected 'end' to close for");
        return new GenericForStmt(variables, expressions, body);
    }

    private FunctionStmt parseFunctionStmt() {
        expect(KW_FUNCTION, "Expected 'function'");
        String root = expect(IDENTIFIER, "Expected function name").getLexeme();
        List<String> fields = new ArrayList<>();
        while (match(DOT)) {
            fields.add(expect(IDENTIFIER, "Expected field name").getLexeme());
        }
        String method = null;
        if (match(COLON)) {
            method = expect(IDENTIFIER, "Expected method name").getLexeme();
        }
        return new FunctionStmt(new FunctionName(root, fields, method), parseFunctionBody());
    }

    private Statement parseLocal() {
        expect(KW_LOCAL, "Expected 'local'");
        if (match(KW_FUNCTION)) {
            String name = expect(IDENTIFIER, "Expected function name").getLexeme();
            return new LocalFunctionStmt(name, parseFunctionBody());
        }

        List<TypedIdentifier> variables = new ArrayList<>();
        do {
            variables.add(parseTypedIdentifier());
        } while (match(COMMA));

        List<Expression> values = Collections.emptyList();
        if (match(ASSIGN)) {
            values = parseExpressionList();
        }
        return new LocalAssignStmt(variables, values);
    }

    private Statement parseExpressionStatement() {
        Token startToken = current;
        Expression expression = parseSuffixedExpression();

        if (check(ASSIGN) || check(COMMA)) {
            List<Expression> targets = new ArrayList<>();
            targets.add(checkAssignable(expression, startToken));
            while (match(COMMA)) {
                Token targetToken = current;
                targets.add(checkAssignable(parseSuffixedExpression(), targetToken));
            }
            expect(ASSIGN, "Expected '=' in assignment");
            return new AssignStmt(targets, parseExpressionList());
        }

        CompoundAssignStmt.CompoundOp compound = compoundOp(current.getType());
        if (compound != null) {
            advance();
            checkAssignable(expression, startToken);
            return new CompoundAssignStmt(expression, compound, parseExpression());
        }

        if (expression instanceof CallExpr) {
            return new CallStmt((CallExpr) expression);
        }
        throw new ParseException(fileName, "Syntax error: expression is not a statement", startToken);
    }

    private Expression checkAssignable(Expression target, Token token) {
        if (target instanceof Identifier || target instanceof FieldExpr || target instanceof IndexExpr) {
            return target;
        }
        throw new ParseException(fileName, "Cannot assign to this expression", token);
    }

    private static CompoundAssignStmt.CompoundOp compoundOp(TokenType type) {
        switch (type) {
            case PLUS_ASSIGN: return CompoundAssignStmt.CompoundOp.ADD;
            case MINUS_ASSIGN: return CompoundAssignStmt.CompoundOp.SUB;
            case MUL_ASSIGN: return CompoundAssignStmt.CompoundOp.MUL;
            case DIV_ASSIGN: return CompoundAssignStmt.CompoundOp.DIV;
            case FLOOR_DIV_ASSIGN: return CompoundAssignStmt.CompoundOp.FLOOR_DIV;
            case MOD_ASSIGN: return CompoundAssignStmt.CompoundOp.MOD;
            case CARET_ASSIGN: return CompoundAssignStmt.CompoundOp.POW;
            case CONCAT_ASSIGN: return CompoundAssignStmt.CompoundOp.CONCAT;
            default: return null;
        }
    }

    // ============ 函数 ============

    /**
     * 解析 {@code (params) block end}
     */
    private FunctionExpr parseFunctionBody() {
        expect(LPAREN, "Expected '(' before parameters");
        List<TypedIdentifier> parameters = new ArrayList<>();
        boolean variadic = false;
        if (!check(RPAREN)) {
            do {
                if (match(ELLIPSIS)) {
                    variadic = true;
                    if (match(COLON)) {
                        parseType();
                    }
                    break;
                }
                parameters.add(parseTypedIdentifier());
            } while (match(COMMA));
        }
        expect(RPAREN, "Expected ')' after parameters");
        Block body = parseBlock();
        expect(KW_END, "Expected 'end' to close function");
        return new FunctionExpr(parameters, variadic, body);
    }

    private TypedIdentifier parseTypedIdentifier() {
        String name = expect(IDENTIFIER, "Expected identifier").getLexeme();
        if (match(COLON)) {
            return new TypedIdentifier(name, parseType());
        }
        return new TypedIdentifier(name);
    }

    /**
     * 类型注解：{@code Name(.Name)*} 或 {@code nil}，可带 {@code ?}
     */
    private String parseType() {
        StringBuilder type = new StringBuilder();
        if (match(KW_NIL)) {
            type.append("nil");
        } else {
            type.append(expect(IDENTIFIER, "Expected type name").getLexeme());
            while (match(DOT)) {
                type.append('.').append(expect(IDENTIFIER, "Expected type name").getLexeme());
            }
        }
        if (match(QUESTION)) {
            type.append('?');
        }
        return type.toString();
    }

    // ============ 表达式 ============

    private List<Expression> parseExpressionList() {
        List<Expression> expressions = new ArrayList<>();
        do {
            expressions.add(parseExpression());
        } while (match(COMMA));
        return expressions;
    }

    Expression parseExpression() {
        return parseSubExpression(0);
    }

    /**
     * 优先级爬升：只吸收左优先级高于 limit 的二元运算符
     */
    private Expression parseSubExpression(int limit) {
        Expression left;
        UnaryExpr.UnaryOp unary = unaryOp(current.getType());
        if (unary != null) {
            advance();
            left = new UnaryExpr(unary, parseSubExpression(UNARY_PRIORITY));
        } else {
            left = parseSimpleExpression();
        }

        BinaryExpr.BinaryOp op = binaryOp(current.getType());
        while (op != null && leftPriority(op) > limit) {
            advance();
            Expression right = parseSubExpression(rightPriority(op));
            left = new BinaryExpr(left, op, right);
            op = binaryOp(current.getType());
        }
        return left;
    }

    private Expression parseSimpleExpression() {
        switch (current.getType()) {
            case NUMBER_LITERAL:
                return Literal.number((Double) advance().getLiteral());
            case STRING_LITERAL:
                return Literal.string((String) advance().getLiteral());
            case KW_NIL:
                advance();
                return Literal.nil();
            case KW_TRUE:
                advance();
                return Literal.of(true);
            case KW_FALSE:
                advance();
                return Literal.of(false);
            case ELLIPSIS:
                advance();
                return new VarargExpr();
            case LBRACE:
                return parseTable();
            case KW_FUNCTION:
                advance();
                return parseFunctionBody();
            default:
                return parseSuffixedExpression();
        }
    }

    private Expression parsePrimaryExpression() {
        if (check(IDENTIFIER)) {
            return new Identifier(advance().getLexeme());
        }
        if (match(LPAREN)) {
            Expression inner = parseExpression();
            expect(RPAREN, "Expected ')' to close parenthesized expression");
            return new ParenExpr(inner);
        }
        throw error("Unexpected symbol", "expression");
    }

    private Expression parseSuffixedExpression() {
        Expression expression = parsePrimaryExpression();
        while (true) {
            switch (current.getType()) {
                case DOT:
                    advance();
                    expression = new FieldExpr(expression,
                            expect(IDENTIFIER, "Expected field name after '.'").getLexeme());
                    break;
                case LBRACKET: {
                    advance();
                    Expression index = parseExpression();
                    expect(RBRACKET, "Expected ']' to close index");
                    expression = new IndexExpr(expression, index);
                    break;
                }
                case COLON: {
                    advance();
                    String method = expect(IDENTIFIER, "Expected method name after ':'").getLexeme();
                    expression = new CallExpr(expression, method, parseCallArguments());
                    break;
                }
                case LPAREN:
                case STRING_LITERAL:
                case LBRACE:
                    expression = new CallExpr(expression, parseCallArguments());
                    break;
                default:
                    return expression;
            }
        }
    }

    private List<Expression> parseCallArguments() {
        if (check(STRING_LITERAL)) {
            return Collections.singletonList(Literal.string((String) advance().getLiteral()));
        }
        if (check(LBRACE)) {
            return Collections.singletonList(parseTable());
        }
        expect(LPAREN, "Expected function arguments");
        if (match(RPAREN)) {
            return Collections.emptyList();
        }
        List<Expression> arguments = parseExpressionList();
        expect(RPAREN, "Expected ')' to close arguments");
        return arguments;
    }

    private TableExpr parseTable() {
        expect(LBRACE, "Expected '{'");
        List<TableEntry> entries = new ArrayList<>();
        while (!check(RBRACE)) {
            if (match(LBRACKET)) {
                Expression key = parseExpression();
                expect(RBRACKET, "Expected ']' after table key");
                expect(ASSIGN, "Expected '=' after table key");
                entries.add(new IndexEntry(key, parseExpression()));
            } else if (check(IDENTIFIER) && peek().getType() == ASSIGN) {
                String name = advance().getLexeme();
                advance();
                entries.add(new FieldEntry(name, parseExpression()));
            } else {
                entries.add(new ValueEntry(parseExpression()));
            }
            if (!match(COMMA) && !match(SEMICOLON)) {
                break;
            }
        }
        expect(RBRACE, "Expected '}' to close table");
        return new TableExpr(entries);
    }

    // ============ 运算符 ============

    private static UnaryExpr.UnaryOp unaryOp(TokenType type) {
        switch (type) {
            case KW_NOT: return UnaryExpr.UnaryOp.NOT;
            case MINUS: return UnaryExpr.UnaryOp.NEG;
            case HASH: return UnaryExpr.UnaryOp.LENGTH;
            default: return null;
        }
    }

    private static BinaryExpr.BinaryOp binaryOp(TokenType type) {
        switch (type) {
            case KW_OR: return BinaryExpr.BinaryOp.OR;
            case KW_AND: return BinaryExpr.BinaryOp.AND;
            case LT: return BinaryExpr.BinaryOp.LT;
            case GT: return BinaryExpr.BinaryOp.GT;
            case LE: return BinaryExpr.BinaryOp.LE;
            case GE: return BinaryExpr.BinaryOp.GE;
            case NE: return BinaryExpr.BinaryOp.NE;
            case EQ: return BinaryExpr.BinaryOp.EQ;
            case CONCAT: return BinaryExpr.BinaryOp.CONCAT;
            case PLUS: return BinaryExpr.BinaryOp.ADD;
            case MINUS: return BinaryExpr.BinaryOp.SUB;
            case MUL: return BinaryExpr.BinaryOp.MUL;
            case DIV: return BinaryExpr.BinaryOp.DIV;
            case FLOOR_DIV: return BinaryExpr.BinaryOp.FLOOR_DIV;
            case MOD: return BinaryExpr.BinaryOp.MOD;
            case CARET: return BinaryExpr.BinaryOp.POW;
            default: return null;
        }
    }

    /** 左结合时左右优先级相同；.. 与 ^ 右优先级低一级 */
    private static int leftPriority(BinaryExpr.BinaryOp op) {
        switch (op) {
            case CONCAT: return 9;
            case ADD:
            case SUB: return 10;
            case MUL:
            case DIV:
            case FLOOR_DIV:
            case MOD: return 11;
            case POW: return 14;
            default: return op.getPrecedence();
        }
    }

    private static int rightPriority(BinaryExpr.BinaryOp op) {
        return op.isRightAssociative() ? leftPriority(op) - 1 : leftPriority(op);
    }
}
