package com.moonshift.compiler.generator;

/**
 * 代码生成上下文，跟踪输出缓冲区和缩进层级
 */
public class GeneratorContext {
    private final StringBuilder output = new StringBuilder();
    private final GeneratorConfig config;
    private int indentLevel = 0;
    private boolean atLineStart = true;

    public GeneratorContext(GeneratorConfig config) {
        this.config = config;
    }

    public GeneratorConfig getConfig() {
        return config;
    }

    public void indent() {
        indentLevel++;
    }

    public void dedent() {
        if (indentLevel > 0) {
            indentLevel--;
        }
    }

    /**
     * 追加文本（自动处理行首缩进）
     */
    public void append(String text) {
        if (text == null || text.isEmpty()) return;
        if (atLineStart) {
            if (!config.isDense()) {
                output.append(indentString());
            }
            atLineStart = false;
        }
        output.append(text);
    }

    /**
     * 语句分隔：紧凑模式为一个空格，否则换行
     */
    public void lineBreak() {
        if (config.isDense()) {
            output.append(' ');
            atLineStart = false;
        } else {
            output.append('\n');
            atLineStart = true;
        }
    }

    /**
     * 追加空格
     */
    public void space() {
        append(" ");
    }

    /**
     * 获取当前输出
     */
    public String getOutput() {
        return output.toString();
    }

    private String indentString() {
        String unit = config.getIndentString();
        StringBuilder sb = new StringBuilder();
        for (int i = 0; i < indentLevel; i++) {
            sb.append(unit);
        }
        return sb.toString();
    }
}
