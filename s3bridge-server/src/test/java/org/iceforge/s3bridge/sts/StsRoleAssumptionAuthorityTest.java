package org.iceforge.s3bridge.sts;

import org.iceforge.s3bridge.issuer.AssumedRole;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.MockitoAnnotations;
import software.amazon.awssdk.services.sts.StsClient;
import software.amazon.awssdk.services.sts.model.AssumeRoleRequest;
import software.amazon.awssdk.services.sts.model.AssumeRoleResponse;
import software.amazon.awssdk.services.sts.model.Credentials;
import software.amazon.awssdk.services.sts.model.StsException;

import java.time.Duration;
import java.time.Instant;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

class StsRoleAssumptionAuthorityTest {

    @Mock private StsClient sts;

    private StsRoleAssumptionAuthority authority;

    @BeforeEach
    void setUp() {
        MockitoAnnotations.openMocks(this);
        authority = new StsRoleAssumptionAuthority(sts);
    }

    @Test
    void assume_mapsRequestAndCredentials() {
        Instant exp = Instant.parse("2024-05-01T13:00:00Z");
        when(sts.assumeRole(any(AssumeRoleRequest.class))).thenReturn(AssumeRoleResponse.builder()
                .credentials(Credentials.builder()
                        .accessKeyId("ASIA1")
                        .secretAccessKey("secret")
                        .sessionToken("token")
                        .expiration(exp)
                        .build())
                .build());

        AssumedRole r = authority.assume("arn:aws:iam::1:role/a", "analytics-session-1714564800", Duration.ofMinutes(30));

        assertEquals("ASIA1", r.accessKey());
        assertEquals("secret", r.secretKey());
        assertEquals("token", r.sessionToken());
        assertEquals(exp, r.expiration());

        ArgumentCaptor<AssumeRoleRequest> cap = ArgumentCaptor.forClass(AssumeRoleRequest.class);
        verify(sts).assumeRole(cap.capture());
        assertEquals("arn:aws:iam::1:role/a", cap.getValue().roleArn());
        assertEquals("analytics-session-1714564800", cap.getValue().roleSessionName());
        assertEquals(1800, cap.getValue().durationSeconds());
    }

    @Test
    void assume_wrapsStsException() {
        when(sts.assumeRole(any(AssumeRoleRequest.class)))
                .thenThrow(StsException.builder().message("AccessDenied").statusCode(403).build());

        RoleAssumptionException ex = assertThrows(RoleAssumptionException.class,
                () -> authority.assume("arn:aws:iam::1:role/a", "s", Duration.ofMinutes(15)));
        assertTrue(ex.getMessage().contains("STS AssumeRole failed"));
    }

    @Test
    void assume_missingCredentialsIsAnError() {
        when(sts.assumeRole(any(AssumeRoleRequest.class))).thenReturn(AssumeRoleResponse.builder().build());

        assertThrows(RoleAssumptionException.class,
                () -> authority.assume("arn:aws:iam::1:role/a", "s", Duration.ofMinutes(15)));
    }

    @Test
    void sessionNameIsSanitizedAndBounded() {
        assertEquals("my-app-session-1", StsRoleAssumptionAuthority.sanitizeSessionName("my app-session-1"));
        String longName = "x".repeat(80) + "-session-1714564800";
        String s = StsRoleAssumptionAuthority.sanitizeSessionName(longName);
        assertEquals(StsRoleAssumptionAuthority.MAX_SESSION_NAME, s.length());
        assertTrue(s.endsWith("-session-1714564800"));
    }
}
