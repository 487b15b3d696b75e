package com.bastion.security.cognito;

import com.bastion.security.IdentityProvider;
import com.bastion.security.IdentityProviderException;
import com.bastion.security.TokenRejectedException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import software.amazon.awssdk.core.exception.SdkException;
import software.amazon.awssdk.services.cognitoidentityprovider.CognitoIdentityProviderClient;
import software.amazon.awssdk.services.cognitoidentityprovider.model.AdminListGroupsForUserRequest;
import software.amazon.awssdk.services.cognitoidentityprovider.model.AdminListGroupsForUserResponse;
import software.amazon.awssdk.services.cognitoidentityprovider.model.GetUserRequest;
import software.amazon.awssdk.services.cognitoidentityprovider.model.NotAuthorizedException;

import java.util.LinkedHashSet;
import java.util.Set;

/**
 * {@link IdentityProvider} backed by an Amazon Cognito user pool.
 * <p>
 * Introspection is {@code GetUser} with the access token: Cognito answers with the username
 * or {@link NotAuthorizedException} for an expired, revoked or foreign token. Group membership
 * is {@code AdminListGroupsForUser} against the configured pool, following {@code NextToken}
 * until the last page.
 * <p>
 * The client is injected and owned by the caller; timeouts and the (disabled) retry policy
 * are configured on it.
 */
public class CognitoIdentityProvider implements IdentityProvider {

    private static final Logger log = LoggerFactory.getLogger(CognitoIdentityProvider.class);

    private final CognitoIdentityProviderClient client;
    private final String userPoolId;

    public CognitoIdentityProvider(CognitoIdentityProviderClient client, String userPoolId) {
        if (client == null) {
            throw new IllegalArgumentException("client must not be null");
        }
        if (userPoolId == null || userPoolId.isBlank()) {
            throw new IllegalArgumentException("userPoolId must not be null or blank");
        }
        this.client = client;
        this.userPoolId = userPoolId;
    }

    @Override
    public String introspect(String accessToken) {
        try {
            return client.getUser(GetUserRequest.builder().accessToken(accessToken).build())
                    .username();
        } catch (NotAuthorizedException e) {
            throw new TokenRejectedException(errorText(e), e);
        } catch (SdkException e) {
            log.warn("Cognito GetUser failed: {}", e.getMessage());
            throw new IdentityProviderException(errorText(e), e);
        }
    }

    @Override
    public Set<String> listGroups(String principalName) {
        var request = AdminListGroupsForUserRequest.builder()
                .userPoolId(userPoolId)
                .username(principalName)
                .build();
        Set<String> groups = new LinkedHashSet<>();
        String nextToken = null;
        try {
            do {
                AdminListGroupsForUserResponse page =
                        client.adminListGroupsForUser(request.toBuilder().nextToken(nextToken).build());
                page.groups().forEach(group -> groups.add(group.groupName()));
                nextToken = page.nextToken();
            } while (nextToken != null && !nextToken.isEmpty());
        } catch (SdkException e) {
            log.warn("Cognito AdminListGroupsForUser failed for {}: {}", principalName, e.getMessage());
            throw new IdentityProviderException(errorText(e), e);
        }
        return groups;
    }

    private static String errorText(SdkException e) {
        return e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName();
    }
}
