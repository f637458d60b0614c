package com.snooker.analysis.exception;

import java.util.Collections;
import java.util.List;

/**
 * 启动参数非法，会话创建前直接抛出
 */
public class ConfigurationException extends SnookerAnalysisException {

    private static final long serialVersionUID = 1L;

    private final List<String> violations;

    public ConfigurationException(String message) {
        this(Collections.singletonList(message));
    }

    public ConfigurationException(List<String> violations) {
        super("configuration", NO_FRAME, "Invalid configuration: " + String.join("; ", violations));
        this.violations = List.copyOf(violations);
    }

    public List<String> getViolations() {
        return violations;
    }
}
