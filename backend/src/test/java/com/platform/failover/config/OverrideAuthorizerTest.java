package com.platform.failover.config;

import com.platform.failover.error.UnauthorizedOverrideException;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatCode;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Unit tests for {@link OverrideAuthorizer}.
 */
class OverrideAuthorizerTest {

    private final OverrideAuthorizer authorizer = new OverrideAuthorizer(Map.of("alice", "s3cret"));

    @Test
    @DisplayName("accepts a configured operator with the matching token")
    void acceptsMatchingToken() {
        assertThatCode(() -> authorizer.authorize("alice", "s3cret")).doesNotThrowAnyException();
        assertThat(authorizer.isAuthorized("alice", "s3cret")).isTrue();
    }

    @Test
    @DisplayName("rejects a wrong token")
    void rejectsWrongToken() {
        assertThatThrownBy(() -> authorizer.authorize("alice", "guess"))
            .isInstanceOf(UnauthorizedOverrideException.class);
    }

    @Test
    @DisplayName("rejects unknown operators and missing credentials")
    void rejectsUnknownOperator() {
        assertThat(authorizer.isAuthorized("mallory", "s3cret")).isFalse();
        assertThat(authorizer.isAuthorized(null, "s3cret")).isFalse();
        assertThat(authorizer.isAuthorized("alice", null)).isFalse();
    }

    @Test
    @DisplayName("binds operators from fleet properties")
    void bindsFromProperties() {
        FleetProperties properties = new FleetProperties();
        properties.getOverrides().getOperatorTokens().put("bob", "t0k3n");

        assertThat(new OverrideAuthorizer(properties).isAuthorized("bob", "t0k3n")).isTrue();
    }
}
