package com.platform.failover.config;

import com.platform.failover.error.UnauthorizedOverrideException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.util.Map;

/**
 * Checks that an override signal comes from a configured operator holding the
 * matching token.
 */
@Slf4j
@Component
public class OverrideAuthorizer {
    
    private final Map<String, String> operatorTokens;
    
    public OverrideAuthorizer(FleetProperties properties) {
        this(properties.getOverrides().getOperatorTokens());
    }
    
    OverrideAuthorizer(Map<String, String> operatorTokens) {
        this.operatorTokens = Map.copyOf(operatorTokens);
        if (this.operatorTokens.isEmpty()) {
            log.warn("No override operators configured; all manual overrides will be rejected");
        }
    }
    
    /**
     * @throws UnauthorizedOverrideException if the operator is unknown or the token does not match
     */
    public void authorize(String operator, String token) {
        if (operator == null || token == null) {
            throw new UnauthorizedOverrideException(String.valueOf(operator));
        }
        String expected = operatorTokens.get(operator);
        if (expected == null || !MessageDigest.isEqual(
                expected.getBytes(StandardCharsets.UTF_8), token.getBytes(StandardCharsets.UTF_8))) {
            throw new UnauthorizedOverrideException(operator);
        }
    }
    
    public boolean isAuthorized(String operator, String token) {
        try {
            authorize(operator, token);
            return true;
        } catch (UnauthorizedOverrideException e) {
            return false;
        }
    }
}
