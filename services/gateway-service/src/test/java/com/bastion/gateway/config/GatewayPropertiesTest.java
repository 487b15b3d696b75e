package com.bastion.gateway.config;

import static org.assertj.core.api.Assertions.assertThat;

import com.bastion.gateway.domain.policy.PolicyRules;
import com.bastion.gateway.domain.policy.Target;
import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.Set;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

@DisplayName("GatewayProperties")
class GatewayPropertiesTest {

    private static final GatewayProperties.Identity IDENTITY =
            new GatewayProperties.Identity("us-east-1_Pool", "client", null, null);

    @Test
    @DisplayName("applies defaults for device header, region, identity timeout and backends")
    void defaults() {
        var props = new GatewayProperties(null, IDENTITY, null, null);

        assertThat(props.deviceIdHeader()).isEqualTo("x-device-id");
        assertThat(props.identity().region()).isEqualTo("us-east-1");
        assertThat(props.identity().timeout()).isEqualTo(Duration.ofSeconds(5));
        assertThat(props.backends().get(Target.PROTECTED).timeout()).isEqualTo(Duration.ofSeconds(5));
        assertThat(props.backends().get(Target.DEFAULT).timeout()).isEqualTo(Duration.ofSeconds(15));
        assertThat(props.backends().get(Target.PROTECTED).baseUrl()).isNull();
    }

    @Test
    @DisplayName("keeps configured backends and fills in a missing timeout")
    void configuredBackends() {
        var props = new GatewayProperties(null, IDENTITY, Map.of(
                Target.PROTECTED, new GatewayProperties.Backend("https://api.internal", null),
                Target.DEFAULT, new GatewayProperties.Backend("https://httpbin.org", Duration.ofSeconds(3))),
                null);

        assertThat(props.backends().get(Target.PROTECTED).baseUrl()).isEqualTo("https://api.internal");
        assertThat(props.backends().get(Target.PROTECTED).timeout()).isEqualTo(Duration.ofSeconds(5));
        assertThat(props.backends().get(Target.DEFAULT).timeout()).isEqualTo(Duration.ofSeconds(3));
    }

    @Test
    @DisplayName("falls back to the built-in rule table when none is configured")
    void defaultRules() {
        var props = new GatewayProperties(null, IDENTITY, null, List.of());

        assertThat(props.policyRules()).isEqualTo(PolicyRules.defaults());
    }

    @Test
    @DisplayName("converts configured rules in order")
    void configuredRules() {
        var props = new GatewayProperties(null, IDENTITY, null, List.of(
                new GatewayProperties.Rule("/finance", Set.of("finance"), null, Target.PROTECTED),
                new GatewayProperties.Rule("", null, null, Target.DEFAULT)));

        var rules = props.policyRules();

        assertThat(rules).hasSize(2);
        assertThat(rules.get(0).pathPrefix()).isEqualTo("/finance");
        assertThat(rules.get(0).requiredGroups()).containsExactly("finance");
        assertThat(rules.get(1).isCatchAll()).isTrue();
    }

    @Test
    @DisplayName("service environment defaults to development")
    void serviceEnvironment() {
        assertThat(new ServiceProperties("bastion-gateway", null).environment()).isEqualTo("development");
        assertThat(new ServiceProperties("bastion-gateway", "production").environment()).isEqualTo("production");
    }
}
