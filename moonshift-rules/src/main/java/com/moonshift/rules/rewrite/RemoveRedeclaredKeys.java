package com.moonshift.rules.rewrite;

import com.moonshift.compiler.ast.AstNode;
import com.moonshift.compiler.ast.expr.*;
import com.moonshift.compiler.ast.stmt.*;
import com.moonshift.rules.FlawlessRule;
import com.moonshift.rules.RuleConfigurationException;
import com.moonshift.rules.RuleContext;
import com.moonshift.rules.RuleProperties;
import com.moonshift.rules.RuntimeVariableBuilder;
import com.moonshift.rules.process.Evaluator;
import com.moonshift.rules.process.LuaTransformer;
import com.moonshift.rules.process.LuaValue;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.logging.Logger;

/**
 * 消除表构造器中重复声明的键（后声明者生效）。
 *
 * <ul>
 *   <li>所有键都能静态求值且重建安全：被覆盖的条目直接删除，从 1 开始的连续整数键
 *       改写为位置值，其余条目保持原有写法与相对顺序</li>
 *   <li>存在无法求值的键，或重建会改变副作用顺序：改写为立即调用的函数，
 *       安全前缀保留为表字面量，其余条目按原顺序逐条赋值</li>
 * </ul>
 *
 * <p>重建安全指：被删除的条目没有副作用，且有副作用的条目相对顺序不变。
 * 末尾多值条目（调用或 {@code ...}）的展开槽位若可能被其它条目占用则放弃改写；
 * 构造器直接含有 {@code ...} 时不使用函数形式（函数会重新绑定 {@code ...}）。</p>
 */
public class RemoveRedeclaredKeys extends FlawlessRule {

    private static final Logger LOG = Logger.getLogger(RemoveRedeclaredKeys.class.getName());

    public static final String NAME = "remove_redeclared_keys";
    public static final String DEFAULT_RUNTIME_VARIABLE_FORMAT = "__MOONSHIFT_REMOVE_REDECLARED_KEYS_{name}{hash}";
    private static final String TABLE_VARIABLE = "tbl";

    private final String runtimeVariableFormat;

    public RemoveRedeclaredKeys() {
        this(DEFAULT_RUNTIME_VARIABLE_FORMAT);
    }

    /**
     * 指定辅助变量名格式（该规则不从配置读取格式）
     */
    public RemoveRedeclaredKeys(String runtimeVariableFormat) {
        this.runtimeVariableFormat = runtimeVariableFormat;
    }

    @Override
    public String getName() {
        return NAME;
    }

    @Override
    public void configure(RuleProperties properties) throws RuleConfigurationException {
        properties.verifyNoRuleProperties();
    }

    @Override
    public RuleProperties serializeToProperties() {
        return RuleProperties.empty();
    }

    @Override
    protected void flawlessProcess(Block block, RuleContext context) {
        RuntimeVariableBuilder variables = RuntimeVariableBuilder.create(
                runtimeVariableFormat, NAME, block, context, Collections.emptySet());
        Processor processor = new Processor(variables);
        processor.transform(block);
        LOG.fine(() -> NAME + ": rebuilt " + processor.rebuilt + " table(s), wrapped "
                + processor.wrapped + " in functions, skipped " + processor.skipped + " in " + context.getPath());
    }

    // ==================== 键分析 ====================

    /**
     * 单个条目的分析结果
     */
    private static final class EntryKey {
        final TableEntry entry;
        final int index;
        /** 规范化后的键；无法确定时为 null */
        final LuaValue key;
        /** 位置值条目的槽位，其他条目为 0 */
        final int slot;

        EntryKey(TableEntry entry, int index, LuaValue key, int slot) {
            this.entry = entry;
            this.index = index;
            this.key = key;
            this.slot = slot;
        }

        boolean isPositional() {
            return entry instanceof ValueEntry;
        }
    }

    private static LuaValue normalizeKey(LuaValue value) {
        switch (value.getKind()) {
            case NUMBER: {
                double number = value.asNumber();
                if (Double.isNaN(number)) return null;
                // -0 与 0 是同一个键
                return number == 0.0 ? LuaValue.number(0.0) : value;
            }
            case STRING:
            case BOOLEAN:
                return value;
            default:
                return null;
        }
    }

    private static boolean isMultiValue(Expression expression) {
        return expression instanceof CallExpr || expression instanceof VarargExpr;
    }

    private static Integer asSlot(LuaValue key) {
        if (key == null || !key.isNumber()) return null;
        double number = key.asNumber();
        if (number >= 1 && number == Math.rint(number) && number <= Integer.MAX_VALUE) {
            return (int) number;
        }
        return null;
    }

    // ==================== 改写 ====================

    private static final class Processor extends LuaTransformer {
        private final RuntimeVariableBuilder variables;
        private final Evaluator evaluator = new Evaluator();
        private String tableVariable;
        int rebuilt;
        int wrapped;
        int skipped;

        Processor(RuntimeVariableBuilder variables) {
            this.variables = variables;
        }

        private String tableVariable() {
            if (tableVariable == null) tableVariable = variables.build(TABLE_VARIABLE);
            return tableVariable;
        }

        @Override
        protected Expression transformExpr(Expression expr) {
            Expression result = super.transformExpr(expr);
            if (result instanceof TableExpr) {
                return processTable((TableExpr) result);
            }
            return result;
        }

        private Expression processTable(TableExpr table) {
            List<TableEntry> entries = table.getEntries();
            if (entries.isEmpty()) {
                return table;
            }

            List<EntryKey> keys = new ArrayList<>(entries.size());
            int positional = 0;
            boolean hasUnknown = false;
            for (int i = 0; i < entries.size(); i++) {
                TableEntry entry = entries.get(i);
                LuaValue key;
                int slot = 0;
                if (entry instanceof ValueEntry) {
                    slot = ++positional;
                    key = LuaValue.number(slot);
                } else if (entry instanceof FieldEntry) {
                    key = LuaValue.string(((FieldEntry) entry).getName());
                } else {
                    key = normalizeKey(evaluator.evaluate(((IndexEntry) entry).getKey()));
                }
                hasUnknown |= key == null;
                keys.add(new EntryKey(entry, i, key, slot));
            }

            // 末尾多值条目占据 tailSlot 及之后的槽位
            EntryKey last = keys.get(keys.size() - 1);
            boolean hasTail = last.isPositional() && isMultiValue(last.entry.getValue());
            if (hasTail && hasExplicitSlotFrom(keys, last.slot)) {
                skipped++;
                return table;
            }

            Map<LuaValue, Integer> winners = new HashMap<>();
            int firstCollision = -1;
            for (EntryKey key : keys) {
                if (key.key == null) continue;
                Integer previous = winners.put(key.key, key.index);
                if (previous != null && firstCollision < 0) {
                    firstCollision = key.index;
                }
            }
            boolean hasCollision = firstCollision >= 0;

            if (!hasUnknown) {
                List<TableEntry> rebuiltEntries = rebuild(keys, winners, hasTail);
                if (rebuiltEntries != null) {
                    if (!sameEntries(entries, rebuiltEntries)) {
                        rebuilt++;
                    }
                    return new TableExpr(rebuiltEntries);
                }
                if (!hasCollision) {
                    return table;
                }
            }

            int split = firstCollision;
            for (EntryKey key : keys) {
                if (key.key == null) {
                    split = split < 0 ? key.index : Math.min(split, key.index);
                    break;
                }
            }
            if (hasTail || containsVararg(table)) {
                skipped++;
                return table;
            }
            wrapped++;
            return wrapInFunction(keys, split);
        }

        private static boolean hasExplicitSlotFrom(List<EntryKey> keys, int tailSlot) {
            for (EntryKey key : keys) {
                if (key.isPositional()) continue;
                Integer slot = asSlot(key.key);
                if (slot != null && slot >= tailSlot) {
                    return true;
                }
            }
            return false;
        }

        /**
         * 静态重建；不安全时返回 null
         */
        private List<TableEntry> rebuild(List<EntryKey> keys, Map<LuaValue, Integer> winners, boolean hasTail) {
            // 被覆盖的条目必须无副作用
            for (EntryKey key : keys) {
                if (winners.get(key.key) != key.index && !evaluator.isInert(key.entry.getValue())) {
                    return null;
                }
            }

            Map<Integer, EntryKey> slots = new HashMap<>();
            for (EntryKey key : keys) {
                if (winners.get(key.key) != key.index) continue;
                Integer slot = asSlot(key.key);
                if (slot != null) slots.put(slot, key);
            }
            int run = 0;
            while (slots.containsKey(run + 1)) {
                run++;
            }

            EntryKey tail = hasTail ? keys.get(keys.size() - 1) : null;
            List<EntryKey> order = new ArrayList<>();
            for (int slot = 1; slot <= run; slot++) {
                EntryKey key = slots.get(slot);
                if (key != tail) order.add(key);
            }
            for (EntryKey key : keys) {
                if (winners.get(key.key) != key.index || key == tail) continue;
                Integer slot = asSlot(key.key);
                if (slot == null || slot > run) order.add(key);
            }
            if (tail != null) {
                order.add(tail);
            }

            // 有副作用的条目保持相对顺序
            int lastEffect = -1;
            for (EntryKey key : order) {
                if (isEffectful(key)) {
                    if (key.index < lastEffect) return null;
                    lastEffect = key.index;
                }
            }

            List<TableEntry> result = new ArrayList<>(order.size());
            for (EntryKey key : order) {
                Integer slot = asSlot(key.key);
                if (slot != null && slot <= run && !key.isPositional()) {
                    result.add(new ValueEntry(key.entry.getValue()));
                } else {
                    result.add(key.entry);
                }
            }
            truncateLastValue(result, tail != null ? tail.entry : null);
            return result;
        }

        private boolean isEffectful(EntryKey key) {
            if (key.entry instanceof IndexEntry && !evaluator.isInert(((IndexEntry) key.entry).getKey())) {
                return true;
            }
            return !evaluator.isInert(key.entry.getValue());
        }

        /**
         * 原本不在末尾的调用/变参若成为最后一个位置值，加括号保持单值
         */
        private static void truncateLastValue(List<TableEntry> entries, TableEntry originalTail) {
            if (entries.isEmpty()) return;
            TableEntry lastEntry = entries.get(entries.size() - 1);
            if (lastEntry instanceof ValueEntry && lastEntry != originalTail
                    && isMultiValue(lastEntry.getValue())) {
                entries.set(entries.size() - 1, new ValueEntry(new ParenExpr(lastEntry.getValue())));
            }
        }

        private static boolean sameEntries(List<TableEntry> before, List<TableEntry> after) {
            if (before.size() != after.size()) return false;
            for (int i = 0; i < before.size(); i++) {
                if (before.get(i) != after.get(i)) return false;
            }
            return true;
        }

        /**
         * {@code (function() local tbl = {prefix} tbl[k] = v ... return tbl end)()}
         */
        private Expression wrapInFunction(List<EntryKey> keys, int split) {
            String variable = tableVariable();
            List<TableEntry> prefix = new ArrayList<>();
            int positional = 0;
            for (int i = 0; i < split; i++) {
                TableEntry entry = keys.get(i).entry;
                prefix.add(entry);
                if (entry instanceof ValueEntry) positional++;
            }
            truncateLastValue(prefix, null);

            List<Statement> statements = new ArrayList<>();
            statements.add(LocalAssignStmt.of(variable, new TableExpr(prefix)));
            for (int i = split; i < keys.size(); i++) {
                TableEntry entry = keys.get(i).entry;
                Expression target;
                if (entry instanceof ValueEntry) {
                    target = new IndexExpr(new Identifier(variable), Literal.number(++positional));
                } else if (entry instanceof FieldEntry) {
                    target = new FieldExpr(new Identifier(variable), ((FieldEntry) entry).getName());
                } else {
                    target = new IndexExpr(new Identifier(variable), ((IndexEntry) entry).getKey());
                }
                statements.add(AssignStmt.of(target, entry.getValue()));
            }

            Block body = new Block(statements, ReturnStmt.of(new Identifier(variable)));
            FunctionExpr function = new FunctionExpr(body);
            return new CallExpr(new ParenExpr(function), Collections.emptyList());
        }

        /**
         * 构造器中（不含嵌套函数）是否直接使用了 {@code ...}
         */
        private static boolean containsVararg(TableExpr table) {
            return VarargFinder.find(table);
        }
    }

    private static final class VarargFinder extends LuaTransformer {
        private boolean found;

        static boolean find(Expression expression) {
            VarargFinder finder = new VarargFinder();
            finder.transformExpr(expression);
            return finder.found;
        }

        @Override
        public AstNode visitVarargExpr(VarargExpr node, Void ctx) {
            found = true;
            return node;
        }

        @Override
        public AstNode visitFunctionExpr(FunctionExpr node, Void ctx) {
            return node;
        }
    }
}
