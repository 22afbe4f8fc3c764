package com.moonshift.rules;

import com.moonshift.compiler.ast.stmt.Block;

/**
 * 改写规则接口。
 *
 * <p>规则先经 {@link #configure} 完整校验配置，之后才会被允许处理语法树；
 * 同一管线中的规则严格顺序执行，每条规则只看到前一条规则的输出。</p>
 */
public interface Rule {

    /**
     * 规则名（配置文件中使用的稳定名称）
     */
    String getName();

    /**
     * 应用配置。任何键非法时整体失败，规则保持原配置不变。
     */
    void configure(RuleProperties properties) throws RuleConfigurationException;

    /**
     * 导出与默认值不同的配置项
     */
    RuleProperties serializeToProperties();

    /**
     * 原地改写代码块
     */
    void process(Block block, RuleContext context) throws RuleProcessException;
}
