package com.moonshift.rules;

import com.google.gson.Gson;
import com.google.gson.JsonElement;
import com.google.gson.JsonObject;
import com.google.gson.JsonParseException;
import com.google.gson.JsonPrimitive;
import com.moonshift.rules.rewrite.RemoveContinue;
import com.moonshift.rules.rewrite.RemoveGeneralizedIteration;
import com.moonshift.rules.rewrite.RemoveRedeclaredKeys;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;
import java.util.function.Supplier;

/**
 * 规则注册表：规则名到工厂的映射，以及规则的 JSON 读写。
 *
 * <p>JSON 中一条规则可以是规则名字符串，也可以是带配置项的对象：</p>
 * <pre>
 * "remove_continue"
 * { "rule": "remove_continue", "runtime_variable_format": "{name}_{hash}" }
 * </pre>
 */
public final class Rules {

    public static final String RULE_FIELD = "rule";

    private static final Gson GSON = new Gson();
    private static final Map<String, Supplier<Rule>> FACTORIES = new LinkedHashMap<>();

    static {
        FACTORIES.put(RemoveContinue.NAME, RemoveContinue::new);
        FACTORIES.put(RemoveRedeclaredKeys.NAME, RemoveRedeclaredKeys::new);
        FACTORIES.put(RemoveGeneralizedIteration.NAME, RemoveGeneralizedIteration::new);
    }

    private Rules() {
    }

    /**
     * 所有已注册的规则名（注册顺序）
     */
    public static Set<String> getRuleNames() {
        return Collections.unmodifiableSet(FACTORIES.keySet());
    }

    /**
     * 以默认配置创建规则
     */
    public static Rule create(String name) throws RuleConfigurationException {
        Supplier<Rule> factory = FACTORIES.get(name);
        if (factory == null) {
            throw RuleConfigurationException.invalidRuleName(name);
        }
        return factory.get();
    }

    public static Rule fromJson(String json) throws RuleConfigurationException {
        return fromJson(parseJson(json));
    }

    /**
     * 从 JSON 创建并配置规则；配置失败时不会返回半配置的规则
     */
    public static Rule fromJson(JsonElement element) throws RuleConfigurationException {
        if (element == null || element.isJsonNull()) {
            throw RuleConfigurationException.missingProperty(RULE_FIELD);
        }
        if (element.isJsonPrimitive() && element.getAsJsonPrimitive().isString()) {
            return create(element.getAsString());
        }
        if (!element.isJsonObject()) {
            throw RuleConfigurationException.invalidValue(RULE_FIELD, "expected a rule name or an object");
        }

        JsonObject object = element.getAsJsonObject();
        JsonElement nameElement = object.get(RULE_FIELD);
        if (nameElement == null) {
            throw RuleConfigurationException.missingProperty(RULE_FIELD);
        }
        if (!nameElement.isJsonPrimitive() || !nameElement.getAsJsonPrimitive().isString()) {
            throw RuleConfigurationException.unexpectedValueType(RULE_FIELD, RulePropertyValue.Kind.STRING);
        }
        Rule rule = create(nameElement.getAsString());
        rule.configure(RuleProperties.fromJson(object, RULE_FIELD));
        return rule;
    }

    /**
     * 序列化规则：没有非默认配置时输出规则名字符串，否则输出对象
     */
    public static JsonElement toJson(Rule rule) {
        RuleProperties properties = rule.serializeToProperties();
        if (properties.isEmpty()) {
            return new JsonPrimitive(rule.getName());
        }
        JsonObject object = new JsonObject();
        object.addProperty(RULE_FIELD, rule.getName());
        properties.writeTo(object);
        return object;
    }

    static JsonElement parseJson(String json) throws RuleConfigurationException {
        try {
            return GSON.fromJson(json, JsonElement.class);
        } catch (JsonParseException e) {
            throw RuleConfigurationException.invalidValue(RULE_FIELD, "malformed JSON: " + e.getMessage());
        }
    }
}
