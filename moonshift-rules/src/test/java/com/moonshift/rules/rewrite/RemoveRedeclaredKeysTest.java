package com.moonshift.rules.rewrite;

import com.moonshift.compiler.ast.stmt.Block;
import com.moonshift.compiler.generator.GeneratorConfig;
import com.moonshift.compiler.generator.LuaGenerator;
import com.moonshift.compiler.parser.Parser;
import com.moonshift.rules.RuleConfigurationException;
import com.moonshift.rules.RuleContext;
import com.moonshift.rules.RuleProperties;
import com.moonshift.rules.RulePropertyValue;
import com.moonshift.rules.testkit.LuaInterpreter;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;
import org.junit.jupiter.params.provider.ValueSource;

import java.util.Random;

import static org.junit.jupiter.api.Assertions.*;

/**
 * RemoveRedeclaredKeys 测试
 */
class RemoveRedeclaredKeysTest {

    private static String apply(String source) {
        Block block = Parser.parse(source);
        new RemoveRedeclaredKeys("{name}").process(block, RuleContext.forSource(source));
        return new LuaGenerator().generate(block, GeneratorConfig.dense());
    }

    @Nested
    @DisplayName("静态重建")
    class RebuildTests {

        @ParameterizedTest(name = "{0}")
        @CsvSource(delimiter = '|', quoteCharacter = '"', value = {
                "local a = {1,[1]='A'}                                  | local a = {'A'}",
                "local a = {x=1,['x']=2}                                | local a = {['x'] = 2}",
                "local a = {['x']=1,['x']=2}                            | local a = {['x'] = 2}",
                "local a = {[1]='A',[1]='B'}                            | local a = {'B'}",
                "local a = {1,2,3,[3]='A',[4]='B',[6]='C',[7]='D'}      | local a = {1, 2, 'A', 'B', [6] = 'C', [7] = 'D'}",
                "local a = {[0]='a',[-0]='b'}                           | local a = {[-0] = 'b'}",
                "local a = {['k'..1]=1,k1=2}                            | local a = {k1 = 2}",
                "local a = {[2]='b',[1]='a',[2]='c'}                    | local a = {'a', 'c'}",
        })
        @DisplayName("后声明的条目生效")
        void testLaterWins(String source, String expected) {
            assertEquals(expected, apply(source));
        }

        @Test
        @DisplayName("嵌套表先于外层处理")
        void testNestedTables() {
            assertEquals("local a = {3}", apply("local a = {{1, [1] = 2}, [1] = 3}"));
        }

        @Test
        @DisplayName("原本不在末尾的调用重排到末尾时保持单值")
        void testTruncatedCall() {
            assertEquals("local a = {'x', (f())}", apply("local a = {1, f(), [1] = 'x'}"));
        }

        @ParameterizedTest
        @ValueSource(strings = {
                "local a = {1, 2, x = 3}",
                "local a = {1, [0] = 'z', [1.5] = 'h', [-1] = 'n'}",
                "local a = {}",
                "local a = {f(), g()}"
        })
        @DisplayName("没有冲突时不修改")
        void testUnchanged(String source) {
            assertEquals(source, apply(source));
        }
    }

    @Nested
    @DisplayName("函数形式")
    class FunctionFormTests {

        @Test
        @DisplayName("键无法静态求值")
        void testUnknownKey() {
            assertEquals("local a = (function() local tbl = {1} tbl[f()] = 'A' return tbl end)()",
                    apply("local a = {1,[f()]='A'}"));
        }

        @Test
        @DisplayName("被覆盖的条目有副作用")
        void testEvictedSideEffect() {
            assertEquals("local a = (function() local tbl = {(f())} tbl[1] = 'x' return tbl end)()",
                    apply("local a = {f(), [1] = 'x'}"));
        }

        @Test
        @DisplayName("位置值在函数中按槽位赋值")
        void testPositionalAfterSplit() {
            assertEquals("local a = (function() local tbl = {'a'} tbl[k] = 1 tbl[2] = 'b' tbl.x = 2 return tbl end)()",
                    apply("local a = {'a', [k] = 1, 'b', x = 2}"));
        }

        @Test
        @DisplayName("辅助变量名避开已有名字")
        void testTableNameCollision() {
            assertEquals("local tbl = 1 local a = (function() local tbl_1 = {} tbl_1[tbl] = 2 return tbl_1 end)()",
                    apply("local tbl = 1 local a = {[tbl] = 2}"));
        }
    }

    @Nested
    @DisplayName("放弃改写")
    class SkipTests {

        @Test
        @DisplayName("末尾多值条目的槽位可能被占用")
        void testTailSlotClaimed() {
            String source = "local a = {1, [2] = 'x', f()}";
            assertEquals(source, apply(source));
        }

        @Test
        @DisplayName("构造器中直接使用了 ...")
        void testVararg() {
            String source = "local function g(...) return {..., [1] = 1} end";
            assertEquals(source, apply(source));
        }

        @Test
        @DisplayName("末尾多值条目与无法求值的键")
        void testTailWithUnknownKey() {
            String source = "local a = {[k] = 1, f()}";
            assertEquals(source, apply(source));
        }
    }

    @Nested
    @DisplayName("配置")
    class ConfigurationTests {

        @Test
        @DisplayName("不接受任何配置项")
        void testNoProperties() throws RuleConfigurationException {
            RemoveRedeclaredKeys rule = new RemoveRedeclaredKeys();
            rule.configure(RuleProperties.empty());
            assertTrue(rule.serializeToProperties().isEmpty());

            RuleConfigurationException e = assertThrows(RuleConfigurationException.class,
                    () -> rule.configure(new RuleProperties()
                            .put("runtime_variable_format", RulePropertyValue.string("{name}"))));
            assertEquals(RuleConfigurationException.Kind.UNEXPECTED_PROPERTY, e.getKind());
        }
    }

    @Nested
    @DisplayName("执行结果等价")
    class EquivalenceTests {

        private void assertEquivalent(String source) {
            Block block = Parser.parse(source);
            new RemoveRedeclaredKeys().process(block, RuleContext.forSource(source));
            String rewritten = new LuaGenerator().generate(block);
            assertEquals(LuaInterpreter.run(source), LuaInterpreter.run(rewritten),
                    () -> source + "\n--- rewritten ---\n" + rewritten);
        }

        @Test
        @DisplayName("求值顺序与次数不变")
        void testEvaluationOrder() {
            assertEquivalent("local function f(x) log('f', x) return x end\n"
                    + "local t = {f(1), [f(2)] = f('two'), f(3), [1] = f('one')}\n"
                    + "for k, v in pairs(t) do log(k, v) end");
        }

        @Test
        @DisplayName("静态重建后的表内容")
        void testRebuiltContent() {
            assertEquivalent("local t = {1, 2, 3, [3] = 'A', [4] = 'B', [6] = 'C', x = 1, ['x'] = 2}\n"
                    + "for k, v in pairs(t) do log(k, v) end\n"
                    + "log(#t)");
        }

        @Test
        @DisplayName("被覆盖的调用仍然执行")
        void testEvictedCallStillRuns() {
            assertEquivalent("local n = 0\n"
                    + "local function bump() n = n + 1 return n end\n"
                    + "local t = {bump(), bump(), [1] = 'first', [2] = bump()}\n"
                    + "log(n, t[1], t[2], t[3])");
        }

        @Test
        @DisplayName("随机生成的表构造器")
        void testRandomLiterals() {
            Random random = new Random(20241019L);
            for (int i = 0; i < 300; i++) {
                assertEquivalent(new TableLiteralGenerator(random).generate());
            }
        }
    }

    /**
     * 随机生成表构造器并逐键输出结果；键在少量候选中选取以制造冲突
     */
    private static final class TableLiteralGenerator {
        private static final String[] INDEX_KEYS = {
                "1", "2", "3", "4", "0", "-1", "2.5", "'a'", "'b'", "1 + 1", "'a' .. 1", "f(2)", "f('b')"
        };
        private static final String[] FIELD_NAMES = {"a", "b", "a1"};

        private final Random random;
        private int values;

        TableLiteralGenerator(Random random) {
            this.random = random;
        }

        String generate() {
            StringBuilder out = new StringBuilder();
            out.append("local function f(x) log('f', x) return x end\n");
            out.append("local function g() log('g') return 'g1', 'g2' end\n");
            out.append("local t = {");
            int count = 1 + random.nextInt(8);
            for (int i = 0; i < count; i++) {
                if (i > 0) {
                    out.append(", ");
                }
                switch (random.nextInt(3)) {
                    case 0:
                        out.append(value());
                        break;
                    case 1:
                        out.append('[').append(INDEX_KEYS[random.nextInt(INDEX_KEYS.length)]).append("] = ")
                                .append(value());
                        break;
                    default:
                        out.append(FIELD_NAMES[random.nextInt(FIELD_NAMES.length)]).append(" = ").append(value());
                        break;
                }
            }
            if (random.nextInt(5) == 0) {
                out.append(", g()");
            }
            out.append("}\n");
            out.append("for k, v in pairs(t) do log(k, v) end\n");
            out.append("log('#', #t)\n");
            return out.toString();
        }

        private String value() {
            int id = values++;
            switch (random.nextInt(3)) {
                case 0:
                    return String.valueOf(id);
                case 1:
                    return "'v" + id + "'";
                default:
                    return "f('v" + id + "')";
            }
        }
    }
}
