package com.bastion.gateway.config;

import com.bastion.gateway.domain.policy.PolicyRule;
import com.bastion.gateway.domain.policy.PolicyRules;
import com.bastion.gateway.domain.policy.Target;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import java.time.Duration;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

/**
 * Gateway configuration, bound from {@code bastion.gateway.*}.
 *
 * <pre>
 * bastion:
 *   gateway:
 *     device-id-header: x-device-id
 *     identity:
 *       user-pool-id: ${COGNITO_USER_POOL_ID}
 *       client-id: ${COGNITO_CLIENT_ID}
 *       region: us-east-1
 *       timeout: 5s
 *     backends:
 *       protected:
 *         base-url: ${PROTECTED_API_BASE_URL:}
 *         timeout: 5s
 *       default:
 *         base-url: https://httpbin.org
 *         timeout: 15s
 *     rules:
 *       - path-prefix: /protectedPath
 *         required-groups: [admin]
 *         target: protected
 *       - path-prefix: ""
 *         target: default
 * </pre>
 *
 * <p>A missing backend base URL is not a startup error: requests routed to that target fail
 * with 500 instead. When {@code rules} is empty the built-in table from {@link PolicyRules} is
 * used.
 *
 * @param deviceIdHeader header carrying the device attribute (default {@code x-device-id})
 * @param identity       identity-provider settings
 * @param backends       base URL and timeout per target
 * @param rules          ordered rule table; the last rule must have an empty prefix
 */
@ConfigurationProperties(prefix = "bastion.gateway")
@Validated
public record GatewayProperties(
        String deviceIdHeader,
        @NotNull @Valid Identity identity,
        Map<Target, Backend> backends,
        List<Rule> rules) {

    static final Duration DEFAULT_PROTECTED_TIMEOUT = Duration.ofSeconds(5);
    static final Duration DEFAULT_BACKEND_TIMEOUT = Duration.ofSeconds(15);

    public GatewayProperties {
        if (deviceIdHeader == null || deviceIdHeader.isBlank()) {
            deviceIdHeader = "x-device-id";
        }
        Map<Target, Backend> resolved = new EnumMap<>(Target.class);
        resolved.put(Target.PROTECTED, new Backend(null, DEFAULT_PROTECTED_TIMEOUT));
        resolved.put(Target.DEFAULT, new Backend(null, DEFAULT_BACKEND_TIMEOUT));
        if (backends != null) {
            backends.forEach((target, backend) -> resolved.put(target, backend.withDefaultTimeout(
                    target == Target.PROTECTED ? DEFAULT_PROTECTED_TIMEOUT : DEFAULT_BACKEND_TIMEOUT)));
        }
        backends = Map.copyOf(resolved);
        rules = rules == null ? List.of() : List.copyOf(rules);
    }

    /**
     * The configured rule table, or the built-in one when none is configured.
     */
    public List<PolicyRule> policyRules() {
        if (rules.isEmpty()) {
            return PolicyRules.defaults();
        }
        return rules.stream().map(Rule::toPolicyRule).toList();
    }

    /**
     * @param userPoolId Cognito user pool the tokens are issued by. Required.
     * @param clientId   app client the gateway acts for (reported at startup)
     * @param region     AWS region of the user pool (default {@code us-east-1})
     * @param timeout    bound on each identity-provider call (default 5s)
     */
    public record Identity(@NotBlank String userPoolId, String clientId, String region, Duration timeout) {

        public Identity {
            if (region == null || region.isBlank()) {
                region = "us-east-1";
            }
            if (timeout == null || timeout.isZero() || timeout.isNegative()) {
                timeout = Duration.ofSeconds(5);
            }
        }
    }

    /**
     * @param baseUrl backend base URL; blank means not configured
     * @param timeout bound on connect and response for this backend
     */
    public record Backend(String baseUrl, Duration timeout) {

        Backend withDefaultTimeout(Duration fallback) {
            if (timeout == null || timeout.isZero() || timeout.isNegative()) {
                return new Backend(baseUrl, fallback);
            }
            return this;
        }
    }

    /**
     * Configuration form of a {@link PolicyRule}.
     */
    public record Rule(String pathPrefix, Set<String> requiredGroups, String requiredDeviceId, Target target) {

        PolicyRule toPolicyRule() {
            return new PolicyRule(pathPrefix, requiredGroups, requiredDeviceId, target);
        }
    }
}
