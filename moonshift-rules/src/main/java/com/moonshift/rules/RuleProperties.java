package com.moonshift.rules;

import com.google.gson.JsonArray;
import com.google.gson.JsonElement;
import com.google.gson.JsonObject;
import com.google.gson.JsonPrimitive;

import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

/**
 * 规则配置项集合（保持插入顺序）
 */
public class RuleProperties {

    private final Map<String, RulePropertyValue> values = new LinkedHashMap<>();

    public RuleProperties() {
    }

    public static RuleProperties empty() {
        return new RuleProperties();
    }

    public RuleProperties put(String key, RulePropertyValue value) {
        values.put(key, value);
        return this;
    }

    public RulePropertyValue get(String key) {
        return values.get(key);
    }

    public boolean contains(String key) {
        return values.containsKey(key);
    }

    public Set<String> keySet() {
        return Collections.unmodifiableSet(values.keySet());
    }

    public boolean isEmpty() {
        return values.isEmpty();
    }

    public int size() {
        return values.size();
    }

    // ==================== 类型化读取 ====================

    private RulePropertyValue require(String key) throws RuleConfigurationException {
        RulePropertyValue value = values.get(key);
        if (value == null) {
            throw RuleConfigurationException.missingProperty(key);
        }
        return value;
    }

    public String expectString(String key) throws RuleConfigurationException {
        RulePropertyValue value = require(key);
        if (value.getKind() != RulePropertyValue.Kind.STRING) {
            throw RuleConfigurationException.unexpectedValueType(key, RulePropertyValue.Kind.STRING);
        }
        return (String) value.getValue();
    }

    public boolean expectBoolean(String key) throws RuleConfigurationException {
        RulePropertyValue value = require(key);
        if (value.getKind() != RulePropertyValue.Kind.BOOLEAN) {
            throw RuleConfigurationException.unexpectedValueType(key, RulePropertyValue.Kind.BOOLEAN);
        }
        return (Boolean) value.getValue();
    }

    /**
     * 读取路径；字符串值按路径解释
     */
    public Path expectPath(String key) throws RuleConfigurationException {
        RulePropertyValue value = require(key);
        switch (value.getKind()) {
            case PATH:
                return (Path) value.getValue();
            case STRING:
                return Paths.get((String) value.getValue());
            default:
                throw RuleConfigurationException.unexpectedValueType(key, RulePropertyValue.Kind.PATH);
        }
    }

    /**
     * 读取枚举；按 snake_case 名字匹配（{@code foo_bar} 对应常量 {@code FOO_BAR}）
     */
    public <E extends Enum<E>> E expectEnum(String key, Class<E> enumType) throws RuleConfigurationException {
        RulePropertyValue value = require(key);
        if (value.getKind() != RulePropertyValue.Kind.ENUM && value.getKind() != RulePropertyValue.Kind.STRING) {
            throw RuleConfigurationException.unexpectedValueType(key, RulePropertyValue.Kind.ENUM);
        }
        String name = (String) value.getValue();
        for (E constant : enumType.getEnumConstants()) {
            if (constant.name().toLowerCase(Locale.ROOT).equals(name)) {
                return constant;
            }
        }
        throw RuleConfigurationException.invalidValue(key, "unknown variant '" + name + "'");
    }

    @SuppressWarnings("unchecked")
    public List<String> expectStringList(String key) throws RuleConfigurationException {
        RulePropertyValue value = require(key);
        if (value.getKind() != RulePropertyValue.Kind.LIST) {
            throw RuleConfigurationException.unexpectedValueType(key, RulePropertyValue.Kind.LIST);
        }
        return (List<String>) value.getValue();
    }

    // ==================== 校验辅助 ====================

    /**
     * 不接受任何配置项的规则使用
     */
    public void verifyNoRuleProperties() throws RuleConfigurationException {
        if (!values.isEmpty()) {
            throw RuleConfigurationException.unexpectedProperty(values.keySet().iterator().next());
        }
    }

    /**
     * 检查必填项是否都存在
     */
    public void verifyRequiredProperties(String... keys) throws RuleConfigurationException {
        for (String key : keys) {
            if (!values.containsKey(key)) {
                throw RuleConfigurationException.missingProperty(key);
            }
        }
    }

    // ==================== JSON ====================

    /**
     * 从 JSON 对象读取配置项，忽略 skippedKey（通常是 "rule"）
     */
    public static RuleProperties fromJson(JsonObject object, String skippedKey) throws RuleConfigurationException {
        RuleProperties properties = new RuleProperties();
        for (Map.Entry<String, JsonElement> entry : object.entrySet()) {
            String key = entry.getKey();
            if (key.equals(skippedKey)) continue;
            properties.put(key, toPropertyValue(key, entry.getValue()));
        }
        return properties;
    }

    private static RulePropertyValue toPropertyValue(String key, JsonElement element) throws RuleConfigurationException {
        if (element.isJsonPrimitive()) {
            JsonPrimitive primitive = element.getAsJsonPrimitive();
            if (primitive.isString()) {
                return RulePropertyValue.string(primitive.getAsString());
            }
            if (primitive.isBoolean()) {
                return RulePropertyValue.bool(primitive.getAsBoolean());
            }
            throw RuleConfigurationException.invalidValue(key, "numbers are not supported");
        }
        if (element.isJsonArray()) {
            List<String> items = new ArrayList<>();
            for (JsonElement item : element.getAsJsonArray()) {
                if (!item.isJsonPrimitive() || !item.getAsJsonPrimitive().isString()) {
                    throw RuleConfigurationException.unexpectedValueType(key, RulePropertyValue.Kind.LIST);
                }
                items.add(item.getAsString());
            }
            return RulePropertyValue.list(items);
        }
        throw RuleConfigurationException.invalidValue(key, "unsupported value " + element);
    }

    /**
     * 写入 JSON 对象
     */
    @SuppressWarnings("unchecked")
    public void writeTo(JsonObject object) {
        for (Map.Entry<String, RulePropertyValue> entry : values.entrySet()) {
            RulePropertyValue value = entry.getValue();
            switch (value.getKind()) {
                case BOOLEAN:
                    object.addProperty(entry.getKey(), (Boolean) value.getValue());
                    break;
                case LIST: {
                    JsonArray array = new JsonArray();
                    for (String item : (List<String>) value.getValue()) {
                        array.add(item);
                    }
                    object.add(entry.getKey(), array);
                    break;
                }
                default:
                    object.addProperty(entry.getKey(), value.getValue().toString());
                    break;
            }
        }
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof RuleProperties)) return false;
        return values.equals(((RuleProperties) o).values);
    }

    @Override
    public int hashCode() {
        return values.hashCode();
    }

    @Override
    public String toString() {
        return values.toString();
    }
}
