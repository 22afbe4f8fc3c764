package com.moonshift.rules;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * 规则配置值：字符串 / 布尔 / 路径 / 枚举名 / 字符串列表
 */
public final class RulePropertyValue {
    private final Kind kind;
    private final Object value;

    private RulePropertyValue(Kind kind, Object value) {
        this.kind = kind;
        this.value = Objects.requireNonNull(value);
    }

    public static RulePropertyValue string(String value) {
        return new RulePropertyValue(Kind.STRING, value);
    }

    public static RulePropertyValue bool(boolean value) {
        return new RulePropertyValue(Kind.BOOLEAN, value);
    }

    public static RulePropertyValue path(Path value) {
        return new RulePropertyValue(Kind.PATH, value);
    }

    public static RulePropertyValue enumValue(String value) {
        return new RulePropertyValue(Kind.ENUM, value);
    }

    public static RulePropertyValue list(List<String> values) {
        return new RulePropertyValue(Kind.LIST, Collections.unmodifiableList(new ArrayList<>(values)));
    }

    public Kind getKind() {
        return kind;
    }

    public Object getValue() {
        return value;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof RulePropertyValue)) return false;
        RulePropertyValue that = (RulePropertyValue) o;
        return kind == that.kind && value.equals(that.value);
    }

    @Override
    public int hashCode() {
        return Objects.hash(kind, value);
    }

    @Override
    public String toString() {
        return kind.getDisplayName() + "(" + value + ")";
    }

    /**
     * 值种类
     */
    public enum Kind {
        STRING("string"),
        BOOLEAN("boolean"),
        PATH("path"),
        ENUM("enum"),
        LIST("list");

        private final String displayName;

        Kind(String displayName) {
            this.displayName = displayName;
        }

        public String getDisplayName() {
            return displayName;
        }
    }
}
