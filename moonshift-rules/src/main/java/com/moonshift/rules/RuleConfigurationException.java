package com.moonshift.rules;

/**
 * 规则配置错误，消息中指明出错的配置键
 */
public class RuleConfigurationException extends Exception {
    private final Kind kind;
    private final String key;

    private RuleConfigurationException(Kind kind, String key, String message) {
        super(message);
        this.kind = kind;
        this.key = key;
    }

    public static RuleConfigurationException unexpectedProperty(String key) {
        return new RuleConfigurationException(Kind.UNEXPECTED_PROPERTY, key,
                "unexpected field '" + key + "'");
    }

    public static RuleConfigurationException missingProperty(String key) {
        return new RuleConfigurationException(Kind.MISSING_PROPERTY, key,
                "missing required field '" + key + "'");
    }

    public static RuleConfigurationException unexpectedValueType(String key, RulePropertyValue.Kind expected) {
        return new RuleConfigurationException(Kind.UNEXPECTED_VALUE_TYPE, key,
                "unexpected type for field '" + key + "' (expected " + expected.getDisplayName() + ")");
    }

    public static RuleConfigurationException invalidValue(String key, String reason) {
        return new RuleConfigurationException(Kind.INVALID_VALUE, key,
                "invalid value for field '" + key + "': " + reason);
    }

    public static RuleConfigurationException invalidRuleName(String name) {
        return new RuleConfigurationException(Kind.INVALID_RULE_NAME, "rule",
                "invalid rule name: " + name);
    }

    public Kind getKind() {
        return kind;
    }

    /** 出错的配置键 */
    public String getKey() {
        return key;
    }

    /**
     * 错误种类
     */
    public enum Kind {
        UNEXPECTED_PROPERTY,
        MISSING_PROPERTY,
        UNEXPECTED_VALUE_TYPE,
        INVALID_VALUE,
        INVALID_RULE_NAME
    }
}
