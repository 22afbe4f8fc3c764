package com.moonshift.rules;

/**
 * 规则处理失败
 */
public class RuleProcessException extends Exception {
    private final String ruleName;

    public RuleProcessException(String ruleName, String message) {
        super(message);
        this.ruleName = ruleName;
    }

    public RuleProcessException(String ruleName, String message, Throwable cause) {
        super(message, cause);
        this.ruleName = ruleName;
    }

    public String getRuleName() {
        return ruleName;
    }

    @Override
    public String getMessage() {
        return "[" + ruleName + "] " + super.getMessage();
    }
}
