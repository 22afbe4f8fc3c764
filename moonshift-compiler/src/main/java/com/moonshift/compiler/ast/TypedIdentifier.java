package com.moonshift.compiler.ast;

/**
 * 带可选类型注解的标识符（local 声明、函数参数、for 变量）。
 *
 * <p>类型注解只保留原文，不参与语义。</p>
 */
public class TypedIdentifier {
    private String name;
    private final String typeAnnotation;  // 可选

    public TypedIdentifier(String name) {
        this(name, null);
    }

    public TypedIdentifier(String name, String typeAnnotation) {
        this.name = name;
        this.typeAnnotation = typeAnnotation;
    }

    public String getName() {
        return name;
    }

    public void setName(String name) {
        this.name = name;
    }

    public String getTypeAnnotation() {
        return typeAnnotation;
    }

    public boolean hasTypeAnnotation() {
        return typeAnnotation != null;
    }

    @Override
    public String toString() {
        return typeAnnotation != null ? name + ": " + typeAnnotation : name;
    }
}
