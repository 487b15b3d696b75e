package com.bastion.security.cognito;

import com.bastion.security.IdentityProviderException;
import com.bastion.security.TokenRejectedException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import software.amazon.awssdk.core.exception.ApiCallTimeoutException;
import software.amazon.awssdk.services.cognitoidentityprovider.CognitoIdentityProviderClient;
import software.amazon.awssdk.services.cognitoidentityprovider.model.AdminListGroupsForUserRequest;
import software.amazon.awssdk.services.cognitoidentityprovider.model.AdminListGroupsForUserResponse;
import software.amazon.awssdk.services.cognitoidentityprovider.model.GetUserRequest;
import software.amazon.awssdk.services.cognitoidentityprovider.model.GetUserResponse;
import software.amazon.awssdk.services.cognitoidentityprovider.model.GroupType;
import software.amazon.awssdk.services.cognitoidentityprovider.model.NotAuthorizedException;
import software.amazon.awssdk.services.cognitoidentityprovider.model.UserNotFoundException;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

/**
 * Tests for {@link CognitoIdentityProvider} against a mocked Cognito client.
 */
@ExtendWith(MockitoExtension.class)
@DisplayName("CognitoIdentityProvider")
class CognitoIdentityProviderTest {

    private static final String POOL_ID = "us-east-1_AbCdEf123";

    @Mock
    private CognitoIdentityProviderClient client;

    private CognitoIdentityProvider provider;

    @BeforeEach
    void setUp() {
        provider = new CognitoIdentityProvider(client, POOL_ID);
    }

    @Nested
    @DisplayName("introspect()")
    class Introspect {

        @Test
        @DisplayName("returns the username for an accepted access token")
        void returnsUsername() {
            when(client.getUser(any(GetUserRequest.class)))
                    .thenReturn(GetUserResponse.builder().username("alice").build());

            assertThat(provider.introspect("token-1")).isEqualTo("alice");

            var captor = ArgumentCaptor.forClass(GetUserRequest.class);
            verify(client).getUser(captor.capture());
            assertThat(captor.getValue().accessToken()).isEqualTo("token-1");
        }

        @Test
        @DisplayName("maps NotAuthorizedException to TokenRejectedException")
        void mapsNotAuthorized() {
            when(client.getUser(any(GetUserRequest.class)))
                    .thenThrow(NotAuthorizedException.builder().message("Access Token has expired").build());

            assertThatThrownBy(() -> provider.introspect("expired"))
                    .isInstanceOf(TokenRejectedException.class)
                    .hasMessageContaining("Access Token has expired");
        }

        @Test
        @DisplayName("maps other service errors to IdentityProviderException")
        void mapsOtherServiceErrors() {
            when(client.getUser(any(GetUserRequest.class)))
                    .thenThrow(UserNotFoundException.builder().message("User does not exist.").build());

            assertThatThrownBy(() -> provider.introspect("t"))
                    .isExactlyInstanceOf(IdentityProviderException.class)
                    .hasMessageContaining("User does not exist.");
        }

        @Test
        @DisplayName("maps client-side timeouts to IdentityProviderException")
        void mapsTimeouts() {
            when(client.getUser(any(GetUserRequest.class)))
                    .thenThrow(ApiCallTimeoutException.create(5000));

            assertThatThrownBy(() -> provider.introspect("t"))
                    .isExactlyInstanceOf(IdentityProviderException.class)
                    .hasMessageContaining("5000");
        }
    }

    @Nested
    @DisplayName("listGroups()")
    class ListGroups {

        @Test
        @DisplayName("collects group names across pages")
        void followsPagination() {
            when(client.adminListGroupsForUser(any(AdminListGroupsForUserRequest.class)))
                    .thenReturn(
                            AdminListGroupsForUserResponse.builder()
                                    .groups(group("admin"), group("staff"))
                                    .nextToken("page-2")
                                    .build(),
                            AdminListGroupsForUserResponse.builder()
                                    .groups(group("auditors"))
                                    .build());

            assertThat(provider.listGroups("alice")).containsExactly("admin", "staff", "auditors");

            var captor = ArgumentCaptor.forClass(AdminListGroupsForUserRequest.class);
            verify(client, times(2)).adminListGroupsForUser(captor.capture());
            assertThat(captor.getAllValues()).allSatisfy(request -> {
                assertThat(request.userPoolId()).isEqualTo(POOL_ID);
                assertThat(request.username()).isEqualTo("alice");
            });
            assertThat(captor.getAllValues().get(0).nextToken()).isNull();
            assertThat(captor.getAllValues().get(1).nextToken()).isEqualTo("page-2");
        }

        @Test
        @DisplayName("returns an empty set for a principal without groups")
        void noGroups() {
            when(client.adminListGroupsForUser(any(AdminListGroupsForUserRequest.class)))
                    .thenReturn(AdminListGroupsForUserResponse.builder().build());

            assertThat(provider.listGroups("bob")).isEmpty();
        }

        @Test
        @DisplayName("maps failures to IdentityProviderException")
        void mapsFailures() {
            when(client.adminListGroupsForUser(any(AdminListGroupsForUserRequest.class)))
                    .thenThrow(NotAuthorizedException.builder().message("not allowed to list groups").build());

            assertThatThrownBy(() -> provider.listGroups("alice"))
                    .isInstanceOf(IdentityProviderException.class)
                    .isNotInstanceOf(TokenRejectedException.class)
                    .hasMessageContaining("not allowed to list groups");
        }
    }

    @Test
    @DisplayName("rejects a blank user pool ID")
    void rejectsBlankPoolId() {
        assertThatThrownBy(() -> new CognitoIdentityProvider(client, ""))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("userPoolId");
    }

    private static GroupType group(String name) {
        return GroupType.builder().groupName(name).userPoolId(POOL_ID).build();
    }
}
