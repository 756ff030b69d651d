package com.platform.failover.error;

import java.util.List;

/**
 * Fleet configuration is inconsistent. Raised at load time, before any probing starts.
 */
public class ConfigurationException extends FailoverControllerException {
    
    private final List<String> problems;
    
    public ConfigurationException(String message) {
        this(List.of(message));
    }
    
    public ConfigurationException(List<String> problems) {
        super(ErrorCode.CONFIGURATION_ERROR,
            "Invalid fleet configuration: " + String.join("; ", problems));
        this.problems = List.copyOf(problems);
    }
    
    public List<String> getProblems() {
        return problems;
    }
}
