package com.moonshift.rules;

import com.google.gson.JsonArray;
import com.google.gson.JsonElement;
import com.google.gson.JsonObject;
import com.moonshift.compiler.ast.stmt.Block;
import com.moonshift.compiler.generator.GeneratorConfig;
import com.moonshift.compiler.generator.LuaGenerator;
import com.moonshift.compiler.parser.Parser;
import com.moonshift.rules.rewrite.RemoveContinue;
import com.moonshift.rules.rewrite.RemoveGeneralizedIteration;
import com.moonshift.rules.rewrite.RemoveRedeclaredKeys;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.logging.Logger;

/**
 * 规则管线。
 * 按顺序对同一棵树执行每条已配置的规则，一条规则完整结束后下一条才开始。
 */
public class RulePipeline {

    private static final Logger LOG = Logger.getLogger(RulePipeline.class.getName());

    public static final String RULES_FIELD = "rules";

    private final List<Rule> rules = new ArrayList<>();

    public RulePipeline() {
    }

    /**
     * 默认管线：continue 消除 → 重复键消除 → 广义迭代消除
     */
    public static RulePipeline createDefault() {
        RulePipeline pipeline = new RulePipeline();
        pipeline.addRule(new RemoveContinue());
        pipeline.addRule(new RemoveRedeclaredKeys());
        pipeline.addRule(new RemoveGeneralizedIteration());
        return pipeline;
    }

    /**
     * 从 {@code { "rules": [...] }} 文档创建管线。任一规则配置失败则整体失败。
     */
    public static RulePipeline fromJson(String json) throws RuleConfigurationException {
        JsonElement element = Rules.parseJson(json);
        if (element == null || !element.isJsonObject()) {
            throw RuleConfigurationException.invalidValue(RULES_FIELD, "expected an object");
        }
        JsonObject object = element.getAsJsonObject();
        for (Map.Entry<String, JsonElement> entry : object.entrySet()) {
            if (!RULES_FIELD.equals(entry.getKey())) {
                throw RuleConfigurationException.unexpectedProperty(entry.getKey());
            }
        }
        JsonElement rulesElement = object.get(RULES_FIELD);
        if (rulesElement == null) {
            throw RuleConfigurationException.missingProperty(RULES_FIELD);
        }
        if (!rulesElement.isJsonArray()) {
            throw RuleConfigurationException.unexpectedValueType(RULES_FIELD, RulePropertyValue.Kind.LIST);
        }

        RulePipeline pipeline = new RulePipeline();
        for (JsonElement ruleElement : rulesElement.getAsJsonArray()) {
            pipeline.addRule(Rules.fromJson(ruleElement));
        }
        return pipeline;
    }

    public RulePipeline addRule(Rule rule) {
        rules.add(rule);
        return this;
    }

    public List<Rule> getRules() {
        return Collections.unmodifiableList(rules);
    }

    /**
     * 依次执行所有规则，原地改写代码块
     *
     * @throws RuleProcessException 某条规则失败时，消息带有规则名
     */
    public void process(Block block, RuleContext context) throws RuleProcessException {
        for (Rule rule : rules) {
            LOG.fine(() -> "applying rule " + rule.getName() + " to " + context.getPath());
            try {
                rule.process(block, context);
            } catch (RuntimeException e) {
                throw new RuleProcessException(rule.getName(), "unexpected failure: " + e.getMessage(), e);
            }
        }
    }

    /**
     * 解析源码、执行管线并生成代码
     */
    public String process(String source, RuleContext context, GeneratorConfig config) throws RuleProcessException {
        Block block = Parser.parse(source, context.getPath().toString());
        process(block, context);
        return new LuaGenerator().generate(block, config);
    }

    public JsonObject toJson() {
        JsonArray array = new JsonArray();
        for (Rule rule : rules) {
            array.add(Rules.toJson(rule));
        }
        JsonObject object = new JsonObject();
        object.add(RULES_FIELD, array);
        return object;
    }
}
