package com.moonshift.rules;

import com.google.gson.JsonElement;
import com.moonshift.rules.rewrite.RemoveContinue;
import com.moonshift.rules.rewrite.RemoveGeneralizedIteration;
import com.moonshift.rules.rewrite.RemoveRedeclaredKeys;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.*;

/**
 * Rules 注册表与 JSON 读写测试
 */
class RulesTest {

    private static RuleConfigurationException configError(String json) {
        return assertThrows(RuleConfigurationException.class, () -> Rules.fromJson(json));
    }

    @Test
    @DisplayName("按注册顺序列出规则名")
    void testRuleNames() {
        assertThat(Rules.getRuleNames()).containsExactly(
                RemoveContinue.NAME, RemoveRedeclaredKeys.NAME, RemoveGeneralizedIteration.NAME);
    }

    @Test
    @DisplayName("规则名字符串")
    void testFromName() throws RuleConfigurationException {
        Rule rule = Rules.fromJson("\"remove_continue\"");
        assertInstanceOf(RemoveContinue.class, rule);
        assertEquals(RemoveContinue.DEFAULT_RUNTIME_VARIABLE_FORMAT,
                ((RemoveContinue) rule).getRuntimeVariableFormat());
    }

    @Test
    @DisplayName("带配置项的对象")
    void testFromObject() throws RuleConfigurationException {
        Rule rule = Rules.fromJson("{\"rule\": \"remove_continue\", \"runtime_variable_format\": \"_{name}\"}");
        assertEquals("_{name}", ((RemoveContinue) rule).getRuntimeVariableFormat());

        Rule iteration = Rules.fromJson(
                "{\"rule\": \"remove_generalized_iteration\", \"runtime_variable_format\": \"it_{name}_{hash}\"}");
        assertEquals("it_{name}_{hash}", ((RemoveGeneralizedIteration) iteration).getRuntimeVariableFormat());
    }

    @Test
    @DisplayName("未知字段")
    void testUnexpectedField() {
        RuleConfigurationException e = configError("{\"rule\": \"remove_redeclared_keys\", \"prop\": \"x\"}");
        assertEquals(RuleConfigurationException.Kind.UNEXPECTED_PROPERTY, e.getKind());
        assertEquals("unexpected field 'prop'", e.getMessage());
    }

    @Test
    @DisplayName("未知规则名")
    void testInvalidRuleName() {
        RuleConfigurationException e = configError("\"remove_everything\"");
        assertEquals(RuleConfigurationException.Kind.INVALID_RULE_NAME, e.getKind());
        assertThat(e.getMessage()).contains("remove_everything");
    }

    @Test
    @DisplayName("缺少或错误的 rule 字段")
    void testRuleField() {
        assertEquals(RuleConfigurationException.Kind.MISSING_PROPERTY,
                configError("{\"runtime_variable_format\": \"{name}\"}").getKind());
        assertEquals(RuleConfigurationException.Kind.UNEXPECTED_VALUE_TYPE,
                configError("{\"rule\": true}").getKind());
        assertEquals(RuleConfigurationException.Kind.INVALID_VALUE, configError("42").getKind());
        assertEquals(RuleConfigurationException.Kind.INVALID_VALUE, configError("{\"rule\": ").getKind());
    }

    @Test
    @DisplayName("非法格式模板")
    void testInvalidFormat() {
        RuleConfigurationException e = configError(
                "{\"rule\": \"remove_continue\", \"runtime_variable_format\": \"{hash}\"}");
        assertEquals(RuleConfigurationException.Kind.INVALID_VALUE, e.getKind());
        assertEquals(RemoveContinue.RUNTIME_VARIABLE_FORMAT, e.getKey());
    }

    @Test
    @DisplayName("序列化：默认配置输出规则名，否则输出对象")
    void testToJson() throws RuleConfigurationException {
        assertEquals("\"remove_redeclared_keys\"", Rules.toJson(new RemoveRedeclaredKeys()).toString());
        assertEquals("\"remove_continue\"", Rules.toJson(new RemoveContinue()).toString());

        JsonElement json = Rules.toJson(new RemoveContinue("v_{name}"));
        assertEquals("{\"rule\":\"remove_continue\",\"runtime_variable_format\":\"v_{name}\"}", json.toString());

        Rule reloaded = Rules.fromJson(json);
        assertEquals(json, Rules.toJson(reloaded));
    }
}
