package com.moonshift.rules;

import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.nio.file.Paths;

/**
 * 规则执行上下文：文件的项目相对路径、项目根目录和原始源码。
 * 原始源码只用于派生确定性的辅助变量名，不影响改写语义。
 */
public class RuleContext {
    private final Path path;
    private final Path projectRoot;
    private final String originalSource;  // 可选

    public RuleContext(Path path, Path projectRoot, String originalSource) {
        this.path = path;
        this.projectRoot = projectRoot;
        this.originalSource = originalSource;
    }

    /** 单独一段源码（无项目）时使用 */
    public static RuleContext forSource(String originalSource) {
        return new RuleContext(Paths.get("<input>"), Paths.get(""), originalSource);
    }

    /** 没有原始源码时，辅助变量名由树的序列化结果派生 */
    public static RuleContext empty() {
        return new RuleContext(Paths.get("<input>"), Paths.get(""), null);
    }

    public Path getPath() {
        return path;
    }

    public Path getProjectRoot() {
        return projectRoot;
    }

    public String getOriginalSource() {
        return originalSource;
    }

    public boolean hasOriginalSource() {
        return originalSource != null;
    }

    public byte[] getOriginalSourceBytes() {
        return originalSource == null ? null : originalSource.getBytes(StandardCharsets.UTF_8);
    }
}
