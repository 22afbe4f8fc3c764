package com.moonshift.rules.rewrite;

import com.moonshift.compiler.ast.AstCopier;
import com.moonshift.compiler.ast.AstNode;
import com.moonshift.compiler.ast.TypedIdentifier;
import com.moonshift.compiler.ast.expr.Expression;
import com.moonshift.compiler.ast.expr.Identifier;
import com.moonshift.compiler.ast.expr.Literal;
import com.moonshift.compiler.ast.expr.UnaryExpr;
import com.moonshift.compiler.ast.stmt.*;
import com.moonshift.rules.FlawlessRule;
import com.moonshift.rules.RuleConfigurationException;
import com.moonshift.rules.RuleContext;
import com.moonshift.rules.RuleProperties;
import com.moonshift.rules.RulePropertyValue;
import com.moonshift.rules.RuntimeVariableBuilder;
import com.moonshift.rules.process.IdentifierCollector;
import com.moonshift.rules.process.LocalRenamer;
import com.moonshift.rules.process.LuaTransformer;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.logging.Logger;

/**
 * 消除 continue：把含 continue 的循环体包进只执行一次的 {@code repeat ... until true}，
 * continue 改写为跳出该包装的 break。
 *
 * <p>循环体同时含有真正的 break 时引入一个布尔哨兵：continue 较少时哨兵标记
 * "本轮正常结束或 continue"，否则标记"真正的 break"；包装之后根据哨兵再次 break。</p>
 *
 * <p>repeat 循环的 until 条件读取循环体顶层局部变量时，条件在每个 continue 点和
 * 循环体末尾求值并存入包装外声明的局部变量，循环改为 {@code until <该变量>}。
 * 通往 continue 点的嵌套块中遮蔽这些名字的局部变量先改名。</p>
 *
 * <p>从内层循环到外层循环依次处理，因此规则对自身输出是幂等的。</p>
 */
public class RemoveContinue extends FlawlessRule {

    private static final Logger LOG = Logger.getLogger(RemoveContinue.class.getName());

    public static final String NAME = "remove_continue";
    public static final String RUNTIME_VARIABLE_FORMAT = "runtime_variable_format";
    public static final String DEFAULT_RUNTIME_VARIABLE_FORMAT = "__MOONSHIFT_REMOVE_CONTINUE_{name}{hash}";

    private String runtimeVariableFormat = DEFAULT_RUNTIME_VARIABLE_FORMAT;

    public RemoveContinue() {
    }

    public RemoveContinue(String runtimeVariableFormat) {
        this.runtimeVariableFormat = runtimeVariableFormat;
    }

    @Override
    public String getName() {
        return NAME;
    }

    public String getRuntimeVariableFormat() {
        return runtimeVariableFormat;
    }

    @Override
    public void configure(RuleProperties properties) throws RuleConfigurationException {
        String format = DEFAULT_RUNTIME_VARIABLE_FORMAT;
        for (String key : properties.keySet()) {
            if (RUNTIME_VARIABLE_FORMAT.equals(key)) {
                format = properties.expectString(key);
                RuntimeVariableBuilder.validateFormat(key, format);
            } else {
                throw RuleConfigurationException.unexpectedProperty(key);
            }
        }
        this.runtimeVariableFormat = format;
    }

    @Override
    public RuleProperties serializeToProperties() {
        RuleProperties properties = new RuleProperties();
        if (!DEFAULT_RUNTIME_VARIABLE_FORMAT.equals(runtimeVariableFormat)) {
            properties.put(RUNTIME_VARIABLE_FORMAT, RulePropertyValue.string(runtimeVariableFormat));
        }
        return properties;
    }

    @Override
    protected void flawlessProcess(Block block, RuleContext context) {
        RuntimeVariableBuilder variables = RuntimeVariableBuilder.create(
                runtimeVariableFormat, NAME, block, context, Collections.emptySet());
        Processor processor = new Processor(variables);
        processor.transform(block);
        LOG.fine(() -> NAME + ": rewrote " + processor.rewrittenLoops + " loop(s) in " + context.getPath());
    }

    // ==================== 终结语句统计 ====================

    /**
     * 经由 if / do 嵌套可达的 continue 与 break 数量（不进入内层循环和函数）
     */
    private static final class Terminators {
        int continues;
        int breaks;

        static Terminators count(Block block) {
            Terminators terminators = new Terminators();
            terminators.add(block);
            return terminators;
        }

        static Terminators count(Statement statement) {
            Terminators terminators = new Terminators();
            terminators.addNested(statement);
            return terminators;
        }

        private void add(Block block) {
            for (Statement statement : block.getStatements()) {
                addNested(statement);
            }
            LastStatement last = block.getLastStatement();
            if (last instanceof ContinueStmt) {
                continues++;
            } else if (last instanceof BreakStmt) {
                breaks++;
            }
        }

        private void addNested(Statement statement) {
            if (statement instanceof IfStmt) {
                IfStmt ifStmt = (IfStmt) statement;
                for (IfBranch branch : ifStmt.getBranches()) {
                    add(branch.getBlock());
                }
                if (ifStmt.hasElse()) {
                    add(ifStmt.getElseBlock());
                }
            } else if (statement instanceof DoStmt) {
                add(((DoStmt) statement).getBody());
            }
        }
    }

    /**
     * 哨兵方向
     */
    private enum SentinelMode {
        /** 只有 continue，不需要哨兵 */
        NONE,
        /** 哨兵为 true 表示本轮没有真正 break */
        CONTINUE,
        /** 哨兵为 true 表示发生了真正的 break */
        BREAK
    }

    // ==================== 改写 ====================

    private static final class Processor extends LuaTransformer {
        private final RuntimeVariableBuilder variables;
        private String continueSentinel;
        private String breakSentinel;
        private String untilSentinel;
        int rewrittenLoops;

        Processor(RuntimeVariableBuilder variables) {
            this.variables = variables;
        }

        private String continueSentinel() {
            if (continueSentinel == null) continueSentinel = variables.build("continue");
            return continueSentinel;
        }

        private String breakSentinel() {
            if (breakSentinel == null) breakSentinel = variables.build("break");
            return breakSentinel;
        }

        private String untilSentinel() {
            if (untilSentinel == null) untilSentinel = variables.build("until");
            return untilSentinel;
        }

        @Override
        public AstNode visitWhileStmt(WhileStmt node, Void ctx) {
            super.visitWhileStmt(node, ctx);
            node.setBody(rewriteBody(node.getBody(), null));
            return node;
        }

        @Override
        public AstNode visitNumericForStmt(NumericForStmt node, Void ctx) {
            super.visitNumericForStmt(node, ctx);
            node.setBody(rewriteBody(node.getBody(), null));
            return node;
        }

        @Override
        public AstNode visitGenericForStmt(GenericForStmt node, Void ctx) {
            super.visitGenericForStmt(node, ctx);
            node.setBody(rewriteBody(node.getBody(), null));
            return node;
        }

        @Override
        public AstNode visitRepeatStmt(RepeatStmt node, Void ctx) {
            super.visitRepeatStmt(node, ctx);
            Block body = node.getBody();
            Set<String> conditionNames = new HashSet<>(IdentifierCollector.collect(node.getCondition()).getNames());
            conditionNames.retainAll(topLevelLocals(body));

            if (conditionNames.isEmpty()) {
                node.setBody(rewriteBody(body, null));
                return node;
            }
            if (Terminators.count(body).continues == 0) {
                return node;
            }
            if (declaredAfterContinue(body, conditionNames)) {
                LOG.warning(NAME + ": repeat loop left untouched, a continue skips the declaration of "
                        + conditionNames + " read by its until condition");
                return node;
            }
            renameShadows(body, conditionNames, false);
            node.setBody(rewriteBody(body, node.getCondition()));
            node.setCondition(new Identifier(untilSentinel()));
            return node;
        }

        /**
         * 改写循环体；不含 continue 时原样返回。
         *
         * @param untilCondition 非 null 时在每个 continue 点与循环体末尾求值该条件
         */
        private Block rewriteBody(Block body, Expression untilCondition) {
            Terminators terminators = Terminators.count(body);
            if (terminators.continues == 0) {
                return body;
            }
            rewrittenLoops++;

            SentinelMode mode;
            String sentinel = null;
            if (terminators.breaks == 0) {
                mode = SentinelMode.NONE;
            } else if (terminators.continues < terminators.breaks) {
                mode = SentinelMode.CONTINUE;
                sentinel = continueSentinel();
            } else {
                mode = SentinelMode.BREAK;
                sentinel = breakSentinel();
            }
            String until = untilCondition != null ? untilSentinel() : null;

            replaceTerminators(body, mode, sentinel, untilCondition, until);
            if (!body.hasLastStatement()) {
                // 正常走到循环体末尾
                if (until != null) {
                    body.addStatement(AssignStmt.of(new Identifier(until), AstCopier.copy(untilCondition)));
                }
                if (mode == SentinelMode.CONTINUE) {
                    body.addStatement(AssignStmt.of(new Identifier(sentinel), Literal.of(true)));
                }
            }

            List<Statement> statements = new ArrayList<>();
            if (until != null) {
                statements.add(new LocalAssignStmt(
                        Collections.singletonList(new TypedIdentifier(until)), Collections.emptyList()));
            }
            if (sentinel != null) {
                statements.add(LocalAssignStmt.of(sentinel, Literal.of(false)));
            }
            statements.add(new RepeatStmt(body, Literal.of(true)));
            if (mode == SentinelMode.CONTINUE) {
                statements.add(IfStmt.of(
                        new UnaryExpr(UnaryExpr.UnaryOp.NOT, new Identifier(sentinel)), breakBlock()));
            } else if (mode == SentinelMode.BREAK) {
                statements.add(IfStmt.of(new Identifier(sentinel), breakBlock()));
            }
            return new Block(statements);
        }

        private void replaceTerminators(Block block, SentinelMode mode, String sentinel,
                                        Expression untilCondition, String until) {
            for (Statement statement : block.getStatements()) {
                if (statement instanceof IfStmt) {
                    IfStmt ifStmt = (IfStmt) statement;
                    for (IfBranch branch : ifStmt.getBranches()) {
                        replaceTerminators(branch.getBlock(), mode, sentinel, untilCondition, until);
                    }
                    if (ifStmt.hasElse()) {
                        replaceTerminators(ifStmt.getElseBlock(), mode, sentinel, untilCondition, until);
                    }
                } else if (statement instanceof DoStmt) {
                    replaceTerminators(((DoStmt) statement).getBody(), mode, sentinel, untilCondition, until);
                }
            }

            LastStatement last = block.getLastStatement();
            if (last instanceof ContinueStmt) {
                if (until != null) {
                    block.addStatement(AssignStmt.of(new Identifier(until), AstCopier.copy(untilCondition)));
                }
                if (mode == SentinelMode.CONTINUE) {
                    block.addStatement(AssignStmt.of(new Identifier(sentinel), Literal.of(true)));
                }
                block.setLastStatement(new BreakStmt());
            } else if (last instanceof BreakStmt && mode == SentinelMode.BREAK) {
                block.addStatement(AssignStmt.of(new Identifier(sentinel), Literal.of(true)));
            }
        }

        /**
         * 含 continue 点的 if / do 嵌套块中，遮蔽条件变量的局部声明改用新名字
         */
        private void renameShadows(Block block, Set<String> names, boolean nested) {
            List<Statement> statements = block.getStatements();
            if (nested && Terminators.count(block).continues > 0) {
                for (int i = 0; i < statements.size(); i++) {
                    for (String name : declaredNames(statements.get(i))) {
                        if (names.contains(name)) {
                            LocalRenamer.renameFrom(block, i, name, variables.build(name));
                        }
                    }
                }
            }
            for (Statement statement : statements) {
                if (statement instanceof IfStmt) {
                    IfStmt ifStmt = (IfStmt) statement;
                    for (IfBranch branch : ifStmt.getBranches()) {
                        renameShadows(branch.getBlock(), names, true);
                    }
                    if (ifStmt.hasElse()) {
                        renameShadows(ifStmt.getElseBlock(), names, true);
                    }
                } else if (statement instanceof DoStmt) {
                    renameShadows(((DoStmt) statement).getBody(), names, true);
                }
            }
        }

        private static Block breakBlock() {
            return new Block(Collections.emptyList(), new BreakStmt());
        }
    }

    // ==================== repeat 条件作用域 ====================

    private static Set<String> topLevelLocals(Block body) {
        Set<String> names = new HashSet<>();
        for (Statement statement : body.getStatements()) {
            names.addAll(declaredNames(statement));
        }
        return names;
    }

    private static List<String> declaredNames(Statement statement) {
        List<String> names = new ArrayList<>();
        if (statement instanceof LocalAssignStmt) {
            for (TypedIdentifier variable : ((LocalAssignStmt) statement).getVariables()) {
                names.add(variable.getName());
            }
        } else if (statement instanceof LocalFunctionStmt) {
            names.add(((LocalFunctionStmt) statement).getName());
        }
        return names;
    }

    /**
     * 条件读取的某个顶层局部变量是否声明在某个 continue 点之后
     */
    private static boolean declaredAfterContinue(Block body, Set<String> names) {
        Set<String> declared = new HashSet<>();
        for (Statement statement : body.getStatements()) {
            if (Terminators.count(statement).continues > 0 && !declared.containsAll(names)) {
                return true;
            }
            declared.addAll(declaredNames(statement));
        }
        return body.getLastStatement() instanceof ContinueStmt && !declared.containsAll(names);
    }
}
