package com.moonshift.compiler.generator;

/**
 * 代码生成配置
 */
public class GeneratorConfig {
    private boolean dense = false;
    private int indentSize = 4;
    private boolean useSpaces = true;

    public GeneratorConfig() {
    }

    /** 紧凑模式：所有语句输出在同一行，以单个空格分隔 */
    public static GeneratorConfig dense() {
        GeneratorConfig config = new GeneratorConfig();
        config.setDense(true);
        return config;
    }

    public boolean isDense() {
        return dense;
    }

    public void setDense(boolean dense) {
        this.dense = dense;
    }

    public int getIndentSize() {
        return indentSize;
    }

    public void setIndentSize(int indentSize) {
        this.indentSize = indentSize;
    }

    public boolean isUseSpaces() {
        return useSpaces;
    }

    public void setUseSpaces(boolean useSpaces) {
        this.useSpaces = useSpaces;
    }

    /**
     * 获取单层缩进字符串
     */
    public String getIndentString() {
        if (useSpaces) {
            StringBuilder sb = new StringBuilder();
            for (int i = 0; i < indentSize; i++) {
                sb.append(' ');
            }
            return sb.toString();
        } else {
            return "\t";
        }
    }
}
