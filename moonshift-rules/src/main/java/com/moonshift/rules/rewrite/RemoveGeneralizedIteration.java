package com.moonshift.rules.rewrite;

import com.moonshift.compiler.ast.AstNode;
import com.moonshift.compiler.ast.TypedIdentifier;
import com.moonshift.compiler.ast.expr.*;
import com.moonshift.compiler.ast.stmt.*;
import com.moonshift.rules.FlawlessRule;
import com.moonshift.rules.RuleConfigurationException;
import com.moonshift.rules.RuleContext;
import com.moonshift.rules.RuleProperties;
import com.moonshift.rules.RulePropertyValue;
import com.moonshift.rules.RuntimeVariableBuilder;
import com.moonshift.rules.process.LuaTransformer;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.logging.Logger;

/**
 * 消除广义迭代：单表达式的 {@code for ... in x do} 改写为显式的三元组协议。
 *
 * <p>{@code type}、{@code getmetatable}、{@code pairs} 在文件开头存入辅助局部变量，
 * 改写后的代码只通过这些变量调用它们。</p>
 *
 * <pre>
 * local type', getmetatable', pairs' = type, getmetatable, pairs
 * ...
 * do
 *     local iter, invar, control = x
 *     if type(iter) == 'table' then
 *         local _m = getmetatable(iter)
 *         if type(_m) == 'table' and type(_m.__iter) == 'function' then
 *             iter, invar, control = _m.__iter(iter)
 *         else
 *             iter, invar, control = pairs(iter)
 *         end
 *     end
 *     for ... in iter, invar, control do ... end
 * end
 * </pre>
 */
public class RemoveGeneralizedIteration extends FlawlessRule {

    private static final Logger LOG = Logger.getLogger(RemoveGeneralizedIteration.class.getName());

    public static final String NAME = "remove_generalized_iteration";
    public static final String RUNTIME_VARIABLE_FORMAT = "runtime_variable_format";
    public static final String DEFAULT_RUNTIME_VARIABLE_FORMAT = "__MOONSHIFT_REMOVE_GENERALIZED_ITERATION_{name}{hash}";

    static final String METATABLE_VARIABLE = "_m";
    private static final List<String> CAPTURED_GLOBALS = Arrays.asList("type", "getmetatable", "pairs");

    private String runtimeVariableFormat = DEFAULT_RUNTIME_VARIABLE_FORMAT;

    public RemoveGeneralizedIteration() {
    }

    public RemoveGeneralizedIteration(String runtimeVariableFormat) {
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
            if (!RUNTIME_VARIABLE_FORMAT.equals(key)) {
                throw RuleConfigurationException.unexpectedProperty(key);
            }
            format = properties.expectString(key);
            RuntimeVariableBuilder.validateFormat(key, format);
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
        RuntimeVariableBuilder variables = RuntimeVariableBuilder.create(runtimeVariableFormat, NAME, block,
                context, Collections.singleton(METATABLE_VARIABLE));
        Processor processor = new Processor(variables);
        processor.transform(block);
        if (processor.rewrittenLoops > 0) {
            block.insertStatement(0, processor.captureGlobals());
        }
        LOG.fine(() -> NAME + ": rewrote " + processor.rewrittenLoops + " loop(s) in " + context.getPath());
    }

    private static final class Processor extends LuaTransformer {
        private final RuntimeVariableBuilder variables;
        private String iterator;
        private String invariant;
        private String control;
        private final Map<String, String> globals = new LinkedHashMap<>();
        int rewrittenLoops;

        Processor(RuntimeVariableBuilder variables) {
            this.variables = variables;
        }

        private void ensureNames() {
            if (iterator == null) {
                iterator = variables.build("iter");
                invariant = variables.build("invar");
                control = variables.build("control");
                for (String global : CAPTURED_GLOBALS) {
                    globals.put(global, variables.build(global));
                }
            }
        }

        @Override
        public AstNode visitGenericForStmt(GenericForStmt node, Void ctx) {
            super.visitGenericForStmt(node, ctx);
            if (node.getExpressions().size() != 1) {
                return node;
            }
            ensureNames();
            rewrittenLoops++;

            Expression iterated = node.getExpressions().get(0);
            List<Statement> statements = new ArrayList<>();
            statements.add(new LocalAssignStmt(
                    Arrays.asList(new TypedIdentifier(iterator), new TypedIdentifier(invariant),
                            new TypedIdentifier(control)),
                    Collections.singletonList(iterated)));
            statements.add(IfStmt.of(typeEquals(new Identifier(iterator), "table"), resolveTriple()));
            statements.add(new GenericForStmt(node.getVariables(), triple(), node.getBody()));
            return new DoStmt(new Block(statements));
        }

        /**
         * 文件开头把用到的全局函数存入局部变量，此处不会被任何用户局部变量遮蔽
         */
        LocalAssignStmt captureGlobals() {
            List<TypedIdentifier> names = new ArrayList<>();
            List<Expression> values = new ArrayList<>();
            for (Map.Entry<String, String> entry : globals.entrySet()) {
                names.add(new TypedIdentifier(entry.getValue()));
                values.add(new Identifier(entry.getKey()));
            }
            return new LocalAssignStmt(names, values);
        }

        /**
         * 表分支：优先 __iter，否则 pairs
         */
        private Block resolveTriple() {
            Identifier metatable = new Identifier(METATABLE_VARIABLE);
            Expression hasIter = new BinaryExpr(
                    typeEquals(new Identifier(METATABLE_VARIABLE), "table"),
                    BinaryExpr.BinaryOp.AND,
                    typeEquals(new FieldExpr(new Identifier(METATABLE_VARIABLE), "__iter"), "function"));

            Block customIter = new Block(Collections.singletonList(assignTriple(
                    new CallExpr(new FieldExpr(metatable, "__iter"),
                            Collections.singletonList(new Identifier(iterator))))));
            Block classic = new Block(Collections.singletonList(assignTriple(
                    CallExpr.of(globals.get("pairs"), new Identifier(iterator)))));

            List<Statement> statements = new ArrayList<>();
            statements.add(LocalAssignStmt.of(METATABLE_VARIABLE,
                    CallExpr.of(globals.get("getmetatable"), new Identifier(iterator))));
            statements.add(new IfStmt(Collections.singletonList(new IfBranch(hasIter, customIter)), classic));
            return new Block(statements);
        }

        private AssignStmt assignTriple(Expression value) {
            return new AssignStmt(triple(), Collections.singletonList(value));
        }

        private List<Expression> triple() {
            return Arrays.asList(new Identifier(iterator), new Identifier(invariant), new Identifier(control));
        }

        private Expression typeEquals(Expression value, String typeName) {
            return new BinaryExpr(CallExpr.of(globals.get("type"), value),
                    BinaryExpr.BinaryOp.EQ, Literal.string(typeName));
        }
    }
}
