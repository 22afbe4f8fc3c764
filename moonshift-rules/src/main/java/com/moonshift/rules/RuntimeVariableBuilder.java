package com.moonshift.rules;

import com.moonshift.compiler.ast.stmt.Block;
import com.moonshift.compiler.generator.GeneratorConfig;
import com.moonshift.compiler.generator.LuaGenerator;
import com.moonshift.compiler.lexer.Lexer;
import com.moonshift.rules.process.IdentifierCollector;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.Collection;
import java.util.HashSet;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * 确定性辅助变量名生成器。
 *
 * <p>名字由格式模板得到：{@code {name}} 替换为逻辑名，{@code {hash}} 替换为
 * 规则种子与源码内容的 SHA-256 前 8 字节（十六进制）。与树中已有名字或保留名
 * 冲突时追加 {@code _1}、{@code _2} 等后缀。同一输入总是得到相同的名字。</p>
 */
public class RuntimeVariableBuilder {

    public static final String NAME_PLACEHOLDER = "{name}";
    public static final String HASH_PLACEHOLDER = "{hash}";

    private static final Pattern IDENTIFIER = Pattern.compile("[A-Za-z_][A-Za-z0-9_]*");
    private static final int HASH_BYTES = 8;

    private final String format;
    private final String hash;
    private final Set<String> usedNames;

    public RuntimeVariableBuilder(String format, String hash, Collection<String> usedNames) {
        this.format = format;
        this.hash = hash;
        this.usedNames = new HashSet<>(usedNames);
    }

    /**
     * 为一个文件创建生成器：哈希取自原始源码（缺省时取树的紧凑序列化），
     * 已用名字取自树中出现的所有标识符加上保留名
     */
    public static RuntimeVariableBuilder create(String format, String seed, Block block,
                                                RuleContext context, Collection<String> reservedNames) {
        byte[] content = context.hasOriginalSource()
                ? context.getOriginalSourceBytes()
                : new LuaGenerator().generate(block, GeneratorConfig.dense()).getBytes(StandardCharsets.UTF_8);
        Set<String> used = new HashSet<>(IdentifierCollector.collect(block).getNames());
        used.addAll(reservedNames);
        return new RuntimeVariableBuilder(format, computeHash(seed, content), used);
    }

    /**
     * 生成名字并登记为已用；与已用名字或关键词相同时追加后缀
     */
    public String build(String name) {
        String base = format.replace(NAME_PLACEHOLDER, name).replace(HASH_PLACEHOLDER, hash);
        String candidate = base;
        int suffix = 1;
        while (usedNames.contains(candidate) || Lexer.getKeywords().contains(candidate)) {
            candidate = base + "_" + suffix++;
        }
        usedNames.add(candidate);
        return candidate;
    }

    public String getHash() {
        return hash;
    }

    /**
     * 种子与内容的 SHA-256 前 8 字节，小写十六进制
     */
    public static String computeHash(String seed, byte[] content) {
        try {
            MessageDigest digest = MessageDigest.getInstance("SHA-256");
            digest.update(seed.getBytes(StandardCharsets.UTF_8));
            digest.update((byte) 0);
            digest.update(content);
            byte[] bytes = digest.digest();
            StringBuilder hex = new StringBuilder(HASH_BYTES * 2);
            for (int i = 0; i < HASH_BYTES; i++) {
                hex.append(String.format("%02x", bytes[i] & 0xff));
            }
            return hex.toString();
        } catch (NoSuchAlgorithmException e) {
            // 每个 JRE 都必须提供 SHA-256
            throw new IllegalStateException("SHA-256 not available", e);
        }
    }

    /**
     * 校验格式模板：必须包含 {@code {name}}，且替换后是合法的非关键词标识符
     */
    public static void validateFormat(String key, String format) throws RuleConfigurationException {
        if (!format.contains(NAME_PLACEHOLDER)) {
            throw RuleConfigurationException.invalidValue(key,
                    "format must contain the " + NAME_PLACEHOLDER + " placeholder");
        }
        String sample = format.replace(NAME_PLACEHOLDER, "name").replace(HASH_PLACEHOLDER, "0123456789abcdef");
        if (!IDENTIFIER.matcher(sample).matches() || Lexer.getKeywords().contains(sample)) {
            throw RuleConfigurationException.invalidValue(key,
                    "format '" + format + "' does not produce a valid identifier");
        }
    }
}
