package com.moonshift.rules.rewrite;

import com.moonshift.compiler.ast.AstNode;
import com.moonshift.compiler.ast.stmt.Block;
import com.moonshift.compiler.ast.stmt.ContinueStmt;
import com.moonshift.compiler.generator.GeneratorConfig;
import com.moonshift.compiler.generator.LuaGenerator;
import com.moonshift.compiler.parser.Parser;
import com.moonshift.rules.RuleConfigurationException;
import com.moonshift.rules.RuleContext;
import com.moonshift.rules.RuleProperties;
import com.moonshift.rules.RulePropertyValue;
import com.moonshift.rules.process.LuaTransformer;
import com.moonshift.rules.testkit.LuaInterpreter;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import java.util.List;
import java.util.Random;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.*;

/**
 * RemoveContinue 测试
 */
class RemoveContinueTest {

    private static String apply(RemoveContinue rule, String source) {
        Block block = Parser.parse(source);
        rule.process(block, RuleContext.forSource(source));
        return new LuaGenerator().generate(block, GeneratorConfig.dense());
    }

    private static String apply(String source) {
        return apply(new RemoveContinue("__{name}"), source);
    }

    private static boolean containsContinue(Block block) {
        boolean[] found = {false};
        new LuaTransformer() {
            @Override
            public AstNode visitContinueStmt(ContinueStmt node, Void ctx) {
                found[0] = true;
                return node;
            }
        }.transform(block);
        return found[0];
    }

    @Nested
    @DisplayName("改写结果")
    class RewriteTests {

        @Test
        @DisplayName("只有 continue：包装为 repeat ... until true")
        void testContinueOnly() {
            assertEquals("while c do repeat if x then break end f() until true end",
                    apply("while c do if x then continue end f() end"));
        }

        @Test
        @DisplayName("continue 不少于 break：哨兵标记真正的 break")
        void testBreakSentinel() {
            assertEquals("while c do local __break = false repeat if x then break end "
                            + "if y then __break = true break end f() until true if __break then break end end",
                    apply("while c do if x then continue end if y then break end f() end"));
        }

        @Test
        @DisplayName("continue 少于 break：哨兵标记正常结束")
        void testContinueSentinel() {
            assertEquals("for i = 1, 3 do local __continue = false repeat if a then break end "
                            + "if b then break end if c then __continue = true break end __continue = true "
                            + "until true if not __continue then break end end",
                    apply("for i = 1, 3 do if a then break end if b then break end if c then continue end end"));
        }

        @Test
        @DisplayName("循环体以 continue 结尾")
        void testTrailingContinue() {
            assertEquals("for _, v in xs do repeat if v then log(v) end break until true end",
                    apply("for _, v in xs do if v then log(v) end continue end"));
        }

        @Test
        @DisplayName("do 块中的 continue")
        void testContinueInDo() {
            assertEquals("while a do repeat do break end until true end", apply("while a do do continue end end"));
        }

        @Test
        @DisplayName("内外层循环分别改写")
        void testNestedLoops() {
            assertEquals("while a do repeat for i = 1, 2 do repeat if b then break end until true end "
                            + "if c then break end until true end",
                    apply("while a do for i = 1, 2 do if b then continue end end if c then continue end end"));
        }

        @Test
        @DisplayName("until 条件不读取循环体局部变量")
        void testRepeatPlainCondition() {
            assertEquals("repeat repeat if a then break end until true until b",
                    apply("repeat if a then continue end until b"));
        }

        @Test
        @DisplayName("until 条件读取循环体局部变量")
        void testRepeatLocalCondition() {
            assertEquals("repeat local __until repeat local x = f() if x then __until = x break end g() "
                            + "__until = x until true until __until",
                    apply("repeat local x = f() if x then continue end g() until x"));
        }

        @Test
        @DisplayName("continue 所在块遮蔽条件变量时改名")
        void testRepeatShadowedCondition() {
            assertEquals("repeat local __until repeat local x = 1 if a then local __x = 2 __until = x break end "
                            + "__until = x until true until __until",
                    apply("repeat local x = 1 if a then local x = 2 continue end until x"));
        }

        @Test
        @DisplayName("不含 continue 的块中的遮蔽不影响改写")
        void testRepeatShadowOffPath() {
            assertEquals("repeat local __until repeat local x = g() if a then local x = 2 print(x) end "
                            + "if b then __until = x break end print(1) __until = x until true until __until",
                    apply("repeat local x = g() if a then local x = 2 print(x) end "
                            + "if b then continue end print(1) until x"));
        }

        @Test
        @DisplayName("条件变量声明在 continue 之后时放弃改写")
        void testRepeatConditionDeclaredLate() {
            String source = "repeat if a then continue end local done = f() until done";
            assertEquals(source, apply(source));
        }

        @Test
        @DisplayName("没有 continue 时不修改")
        void testNoContinue() {
            String source = "while a do if b then break end f() end";
            assertEquals(source, apply(source));
        }

        @Test
        @DisplayName("函数中的 continue 属于函数内的循环")
        void testContinueInsideFunction() {
            assertEquals("while a do local f = function() for i = 1, 2 do repeat break until true end end f() end",
                    apply("while a do local f = function() for i = 1, 2 do continue end end f() end"));
        }

        @Test
        @DisplayName("已有同名变量时追加后缀")
        void testNameCollision() {
            assertEquals("while c do local __break_1 = false repeat if __break then break end "
                            + "if y then __break_1 = true break end until true if __break_1 then break end end",
                    apply("while c do if __break then continue end if y then break end end"));
        }

        @ParameterizedTest
        @ValueSource(strings = {
                "while c do if x then continue end if y then break end f() end",
                "repeat local x = f() if x then continue end g() until x",
                "for i = 1, 3 do if a then break end if b then break end if c then continue end end"
        })
        @DisplayName("幂等")
        void testIdempotent(String source) {
            String once = apply(source);
            assertEquals(once, apply(once));
        }
    }

    @Nested
    @DisplayName("辅助变量名")
    class NamingTests {

        @Test
        @DisplayName("默认格式：名字包含源码哈希且可重复")
        void testDeterministicNames() {
            String source = "while c do if x then continue end if y then break end end";
            String first = apply(new RemoveContinue(), source);
            String second = apply(new RemoveContinue(), source);

            assertEquals(first, second);
            assertThat(first).containsPattern("__MOONSHIFT_REMOVE_CONTINUE_break[0-9a-f]{16} = false");
        }

        @Test
        @DisplayName("不同源码得到不同名字")
        void testDifferentSources() {
            String a = apply(new RemoveContinue(), "while c do if x then continue end if y then break end end");
            String b = apply(new RemoveContinue(), "while d do if x then continue end if y then break end end");
            assertNotEquals(a.substring(a.indexOf("__MOONSHIFT")), b.substring(b.indexOf("__MOONSHIFT")));
        }
    }

    @Nested
    @DisplayName("配置")
    class ConfigurationTests {

        @Test
        @DisplayName("读取格式模板")
        void testConfigure() throws RuleConfigurationException {
            RemoveContinue rule = new RemoveContinue();
            rule.configure(new RuleProperties()
                    .put(RemoveContinue.RUNTIME_VARIABLE_FORMAT, RulePropertyValue.string("cont_{name}")));
            assertEquals("cont_{name}", rule.getRuntimeVariableFormat());
            assertEquals("cont_{name}", rule.serializeToProperties()
                    .expectString(RemoveContinue.RUNTIME_VARIABLE_FORMAT));
        }

        @Test
        @DisplayName("默认配置不导出任何项")
        void testSerializeDefault() {
            assertTrue(new RemoveContinue().serializeToProperties().isEmpty());
        }

        @Test
        @DisplayName("任一配置项非法时保持原配置")
        void testAtomicConfigure() {
            RemoveContinue rule = new RemoveContinue("keep_{name}");

            RuleConfigurationException invalid = assertThrows(RuleConfigurationException.class,
                    () -> rule.configure(new RuleProperties()
                            .put(RemoveContinue.RUNTIME_VARIABLE_FORMAT, RulePropertyValue.string("no_placeholder"))));
            assertEquals(RuleConfigurationException.Kind.INVALID_VALUE, invalid.getKind());

            RuleConfigurationException unexpected = assertThrows(RuleConfigurationException.class,
                    () -> rule.configure(new RuleProperties()
                            .put(RemoveContinue.RUNTIME_VARIABLE_FORMAT, RulePropertyValue.string("x_{name}"))
                            .put("prop", RulePropertyValue.bool(true))));
            assertEquals(RuleConfigurationException.Kind.UNEXPECTED_PROPERTY, unexpected.getKind());

            RuleConfigurationException wrongType = assertThrows(RuleConfigurationException.class,
                    () -> rule.configure(new RuleProperties()
                            .put(RemoveContinue.RUNTIME_VARIABLE_FORMAT, RulePropertyValue.bool(true))));
            assertEquals(RuleConfigurationException.Kind.UNEXPECTED_VALUE_TYPE, wrongType.getKind());

            assertEquals("keep_{name}", rule.getRuntimeVariableFormat());
        }
    }

    @Nested
    @DisplayName("执行结果等价")
    class EquivalenceTests {

        private void assertEquivalent(String source) {
            List<String> expected = LuaInterpreter.run(source);
            Block block = Parser.parse(source);
            new RemoveContinue().process(block, RuleContext.forSource(source));
            assertFalse(containsContinue(block), source);

            String rewritten = new LuaGenerator().generate(block);
            assertEquals(expected, LuaInterpreter.run(rewritten), () -> source + "\n--- rewritten ---\n" + rewritten);
        }

        @Test
        @DisplayName("数值 for 中的 continue 与 break")
        void testNumericFor() {
            assertEquivalent("for i = 1, 10 do\n"
                    + "    if i % 2 == 0 then continue end\n"
                    + "    if i > 7 then break end\n"
                    + "    log(i)\n"
                    + "end\n"
                    + "log('done')");
        }

        @Test
        @DisplayName("repeat 条件读取循环体局部变量")
        void testRepeatLocalCondition() {
            assertEquivalent("local n = 0\n"
                    + "repeat\n"
                    + "    n = n + 1\n"
                    + "    local done = n >= 5\n"
                    + "    if n % 2 == 0 then continue end\n"
                    + "    log(n)\n"
                    + "until done\n"
                    + "log('n', n)");
        }

        @Test
        @DisplayName("repeat 条件变量在嵌套块中被遮蔽")
        void testRepeatShadowedCondition() {
            assertEquivalent("local n = 0\n"
                    + "local function g() n = n + 1 return n >= 4 end\n"
                    + "repeat\n"
                    + "    local x = g()\n"
                    + "    if n == 1 then local x = 'inner' log(x) end\n"
                    + "    if n == 2 then\n"
                    + "        local x = false\n"
                    + "        local function show() return x end\n"
                    + "        log('skip', show())\n"
                    + "        continue\n"
                    + "    end\n"
                    + "    do local x = n if x == 3 then continue end end\n"
                    + "    log(n, x)\n"
                    + "until x\n"
                    + "log('n', n)");
        }

        @Test
        @DisplayName("continue 少于 break")
        void testFewerContinues() {
            assertEquivalent("local t = {5, 3, 8, 1, 9, 2}\n"
                    + "for i, v in ipairs(t) do\n"
                    + "    if v > 8 then break end\n"
                    + "    if v == 1 then break end\n"
                    + "    if v < 4 then continue end\n"
                    + "    log(i, v)\n"
                    + "end");
        }

        @Test
        @DisplayName("闭包捕获循环体局部变量")
        void testClosures() {
            assertEquivalent("local fs = {}\n"
                    + "for i = 1, 4 do\n"
                    + "    local j = i * 10\n"
                    + "    if i == 2 then continue end\n"
                    + "    fs[#fs + 1] = function() return j end\n"
                    + "end\n"
                    + "for _, f in ipairs(fs) do log(f()) end");
        }

        @Test
        @DisplayName("随机生成的循环程序")
        void testRandomPrograms() {
            Random random = new Random(20241018L);
            for (int i = 0; i < 300; i++) {
                assertEquivalent(new LoopProgramGenerator(random).generate());
            }
        }
    }

    /**
     * 随机生成只含有界循环的程序；每次执行语句都会递增并输出计数器 n
     */
    private static final class LoopProgramGenerator {
        private static final int MAX_DEPTH = 3;

        private final Random random;
        private final StringBuilder out = new StringBuilder();
        private int loops;

        LoopProgramGenerator(Random random) {
            this.random = random;
        }

        String generate() {
            out.append("local n = 0\n");
            block(0, false);
            out.append("log('end', n)\n");
            return out.toString();
        }

        private void block(int depth, boolean inLoop) {
            int count = 1 + random.nextInt(3);
            for (int i = 0; i < count; i++) {
                statement(depth, inLoop);
            }
        }

        private void statement(int depth, boolean inLoop) {
            int choice = random.nextInt(depth >= MAX_DEPTH ? 2 : 7);
            switch (choice) {
                case 0:
                    out.append("n = n + 1 log(n)\n");
                    break;
                case 1:
                    if (inLoop) {
                        terminator();
                    } else {
                        out.append("log('s', n)\n");
                    }
                    break;
                case 2: {
                    int id = loops++;
                    out.append("for i").append(id).append(" = 1, ").append(1 + random.nextInt(3)).append(" do\n");
                    block(depth + 1, true);
                    out.append("end\n");
                    break;
                }
                case 3: {
                    String counter = "w" + loops++;
                    out.append("local ").append(counter).append(" = 0\n");
                    out.append("while ").append(counter).append(" < ").append(1 + random.nextInt(3)).append(" do\n");
                    out.append(counter).append(" = ").append(counter).append(" + 1\n");
                    block(depth + 1, true);
                    out.append("end\n");
                    break;
                }
                case 4: {
                    int id = loops++;
                    String counter = "r" + id;
                    int limit = 1 + random.nextInt(3);
                    out.append("local ").append(counter).append(" = 0\n");
                    out.append("repeat\n");
                    out.append(counter).append(" = ").append(counter).append(" + 1\n");
                    if (random.nextBoolean()) {
                        out.append("local stop").append(id).append(" = ").append(counter)
                                .append(" >= ").append(limit).append("\n");
                        block(depth + 1, true);
                        out.append("until stop").append(id).append("\n");
                    } else {
                        block(depth + 1, true);
                        out.append("until ").append(counter).append(" >= ").append(limit).append("\n");
                    }
                    break;
                }
                case 5:
                    out.append("if n % 2 == ").append(random.nextInt(2)).append(" then\n");
                    block(depth + 1, inLoop);
                    if (random.nextBoolean()) {
                        out.append("else\n");
                        block(depth + 1, inLoop);
                    }
                    out.append("end\n");
                    break;
                default:
                    out.append("do\n");
                    block(depth + 1, inLoop);
                    out.append("end\n");
                    break;
            }
        }

        private void terminator() {
            out.append("if n % ").append(2 + random.nextInt(3)).append(" == ").append(random.nextInt(2))
                    .append(" then ");
            if (random.nextBoolean()) {
                out.append("n = n + 1 ");
            }
            out.append(random.nextInt(3) == 0 ? "break" : "continue").append(" end\n");
        }
    }
}
