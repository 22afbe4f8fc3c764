package com.moonshift.rules;

import com.moonshift.compiler.ast.stmt.Block;
import com.moonshift.compiler.generator.GeneratorConfig;
import com.moonshift.compiler.parser.ParseException;
import com.moonshift.compiler.parser.Parser;
import com.moonshift.rules.rewrite.RemoveContinue;
import com.moonshift.rules.rewrite.RemoveGeneralizedIteration;
import com.moonshift.rules.rewrite.RemoveRedeclaredKeys;
import com.moonshift.rules.testkit.LuaInterpreter;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.junit.jupiter.api.Assertions.*;

/**
 * RulePipeline 测试
 */
class RulePipelineTest {

    private static RuleConfigurationException configError(String json) {
        return assertThrows(RuleConfigurationException.class, () -> RulePipeline.fromJson(json));
    }

    @Nested
    @DisplayName("创建")
    class CreationTests {

        @Test
        @DisplayName("默认管线")
        void testDefault() {
            List<Rule> rules = RulePipeline.createDefault().getRules();
            assertEquals(3, rules.size());
            assertInstanceOf(RemoveContinue.class, rules.get(0));
            assertInstanceOf(RemoveRedeclaredKeys.class, rules.get(1));
            assertInstanceOf(RemoveGeneralizedIteration.class, rules.get(2));
        }

        @Test
        @DisplayName("从 JSON 读取，保持顺序")
        void testFromJson() throws RuleConfigurationException {
            RulePipeline pipeline = RulePipeline.fromJson("{\"rules\": [\"remove_generalized_iteration\", "
                    + "{\"rule\": \"remove_continue\", \"runtime_variable_format\": \"c_{name}\"}]}");

            List<Rule> rules = pipeline.getRules();
            assertEquals(2, rules.size());
            assertEquals(RemoveGeneralizedIteration.NAME, rules.get(0).getName());
            assertEquals("c_{name}", ((RemoveContinue) rules.get(1)).getRuntimeVariableFormat());
        }

        @Test
        @DisplayName("序列化后可重新读取")
        void testRoundTrip() throws RuleConfigurationException {
            RulePipeline pipeline = new RulePipeline()
                    .addRule(new RemoveContinue("c_{name}"))
                    .addRule(new RemoveRedeclaredKeys());
            String json = pipeline.toJson().toString();
            assertEquals("{\"rules\":[{\"rule\":\"remove_continue\",\"runtime_variable_format\":\"c_{name}\"},"
                    + "\"remove_redeclared_keys\"]}", json);
            assertEquals(json, RulePipeline.fromJson(json).toJson().toString());
        }

        @Test
        @DisplayName("规则列表不可修改")
        void testRulesUnmodifiable() {
            assertThrows(UnsupportedOperationException.class,
                    () -> RulePipeline.createDefault().getRules().add(new RemoveContinue()));
        }
    }

    @Nested
    @DisplayName("配置错误")
    class ConfigurationErrorTests {

        @Test
        @DisplayName("顶层结构")
        void testTopLevel() {
            assertEquals(RuleConfigurationException.Kind.INVALID_VALUE, configError("[]").getKind());
            assertEquals(RuleConfigurationException.Kind.MISSING_PROPERTY, configError("{}").getKind());
            assertEquals(RuleConfigurationException.Kind.UNEXPECTED_VALUE_TYPE,
                    configError("{\"rules\": \"remove_continue\"}").getKind());

            RuleConfigurationException unexpected = configError("{\"rules\": [], \"bundle\": {}}");
            assertEquals(RuleConfigurationException.Kind.UNEXPECTED_PROPERTY, unexpected.getKind());
            assertEquals("bundle", unexpected.getKey());
        }

        @Test
        @DisplayName("任一规则非法时整体失败")
        void testInvalidRule() {
            assertEquals(RuleConfigurationException.Kind.INVALID_RULE_NAME,
                    configError("{\"rules\": [\"remove_continue\", \"unknown_rule\"]}").getKind());
            assertEquals(RuleConfigurationException.Kind.UNEXPECTED_PROPERTY,
                    configError("{\"rules\": [{\"rule\": \"remove_redeclared_keys\", \"prop\": true}]}").getKind());
        }
    }

    @Nested
    @DisplayName("执行")
    class ProcessTests {

        @Test
        @DisplayName("规则按顺序执行，后一条看到前一条的输出")
        void testSequential() throws RuleProcessException {
            List<String> seen = new ArrayList<>();
            Rule first = new RecordingRule("first", seen) {
                @Override
                protected void flawlessProcess(Block block, RuleContext context) {
                    super.flawlessProcess(block, context);
                    block.clear();
                }
            };
            Rule second = new RecordingRule("second", seen);

            Block block = Parser.parse("f() g()");
            new RulePipeline().addRule(first).addRule(second).process(block, RuleContext.empty());
            assertEquals(List.of("first:2", "second:0"), seen);
        }

        @Test
        @DisplayName("规则内部异常带上规则名")
        void testUnexpectedFailure() {
            Rule failing = new FlawlessRule() {
                @Override
                public String getName() {
                    return "failing";
                }

                @Override
                public void configure(RuleProperties properties) {
                }

                @Override
                public RuleProperties serializeToProperties() {
                    return RuleProperties.empty();
                }

                @Override
                protected void flawlessProcess(Block block, RuleContext context) {
                    throw new IllegalStateException("broken invariant");
                }
            };

            RuleProcessException e = assertThrows(RuleProcessException.class,
                    () -> new RulePipeline().addRule(failing).process(new Block(), RuleContext.empty()));
            assertEquals("failing", e.getRuleName());
            assertThat(e.getMessage()).isEqualTo("[failing] unexpected failure: broken invariant");
            assertInstanceOf(IllegalStateException.class, e.getCause());
        }

        @Test
        @DisplayName("处理源码：三条规则组合")
        void testProcessSource() throws RuleProcessException {
            String source = "local t = {1, 2, [2] = 'two'}\n"
                    + "for k, v in t do\n"
                    + "    if k == 1 then continue end\n"
                    + "    log(k, v)\n"
                    + "end\n";
            String output = RulePipeline.createDefault()
                    .process(source, RuleContext.forSource(source), new GeneratorConfig());

            assertThat(output)
                    .doesNotContain("continue")
                    .contains("local t = {1, 'two'}")
                    .contains("getmetatable");
            assertEquals(List.of("2 two"), LuaInterpreter.run(output));
            assertEquals(LuaInterpreter.run(source), LuaInterpreter.run(output));
        }

        @Test
        @DisplayName("语法错误直接抛出")
        void testParseError() {
            assertThatThrownBy(() -> RulePipeline.createDefault()
                    .process("local = 1", RuleContext.empty(), GeneratorConfig.dense()))
                    .isInstanceOf(ParseException.class);
        }
    }

    /** 记录执行时代码块语句数的规则 */
    private static class RecordingRule extends FlawlessRule {
        private final String name;
        private final List<String> seen;

        RecordingRule(String name, List<String> seen) {
            this.name = name;
            this.seen = seen;
        }

        @Override
        public String getName() {
            return name;
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
            seen.add(name + ":" + block.getStatements().size());
        }
    }
}
