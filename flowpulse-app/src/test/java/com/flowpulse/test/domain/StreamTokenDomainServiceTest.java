package com.flowpulse.test.domain;

import com.flowpulse.domain.stream.model.valobj.StreamTokenClaims;
import com.flowpulse.domain.stream.service.StreamTokenDomainService;
import com.flowpulse.types.enums.ResponseCode;
import com.flowpulse.types.exception.AppException;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

public class StreamTokenDomainServiceTest {

    private static final String SECRET = "stream-secret";
    private static final long NOW = 1_790_000_000_000L;

    private final StreamTokenDomainService service = new StreamTokenDomainService();

    @Test
    public void shouldVerifyIssuedToken() {
        String token = service.issue(new StreamTokenClaims("client-a", NOW + 60_000L), SECRET);

        StreamTokenClaims claims = service.verify(token, "client-a", SECRET, NOW);

        Assertions.assertNotNull(claims);
        Assertions.assertEquals("client-a", claims.clientId());
        Assertions.assertEquals(NOW + 60_000L, claims.expiresAtMillis());
    }

    @Test
    public void shouldRejectTokenBoundToAnotherClient() {
        String token = service.issue(new StreamTokenClaims("client-a", NOW + 60_000L), SECRET);

        Assertions.assertNull(service.verify(token, "client-b", SECRET, NOW));
    }

    @Test
    public void shouldRejectExpiredToken() {
        String token = service.issue(new StreamTokenClaims("client-a", NOW), SECRET);

        Assertions.assertNull(service.verify(token, "client-a", SECRET, NOW));
    }

    @Test
    public void shouldRejectTamperedOrMalformedToken() {
        String token = service.issue(new StreamTokenClaims("client-a", NOW + 60_000L), SECRET);

        Assertions.assertNull(service.verify(token, "client-a", "other-secret", NOW));
        Assertions.assertNull(service.verify(token.substring(0, token.length() - 2) + "xx", "client-a", SECRET, NOW));
        Assertions.assertNull(service.verify("no-separator", "client-a", SECRET, NOW));
        Assertions.assertNull(service.verify("%%%.%%%", "client-a", SECRET, NOW));
    }

    @Test
    public void shouldFailWhenSecretMissing() {
        AppException ex = Assertions.assertThrows(AppException.class,
                () -> service.issue(new StreamTokenClaims("client-a", NOW), " "));

        Assertions.assertEquals(ResponseCode.CONFIG_ERROR.getCode(), ex.getCode());
    }
}
