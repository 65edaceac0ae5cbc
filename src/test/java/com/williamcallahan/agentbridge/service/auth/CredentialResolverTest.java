package com.williamcallahan.agentbridge.service.auth;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import com.williamcallahan.agentbridge.config.AppProperties;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class CredentialResolverTest {

    private AppProperties appProperties;
    private CredentialResolver resolver;

    @BeforeEach
    void setUp() {
        appProperties = new AppProperties();
        appProperties.getSecurity().setAdminKey("admin-secret");
        resolver = new CredentialResolver(appProperties);
    }

    @Test
    void cookieValuesArePassedThroughWithSeparatorsRestored() {
        ResolvedCredential credential = resolver.resolve("Bearer __client=abc.....__session=xyz");

        assertEquals("__client=abc; __session=xyz", credential.credential());
        assertFalse(credential.pooled());
    }

    @Test
    void adminKeyUsesTheConfiguredCredential() {
        appProperties.getUpstream().setCredential("__client=pooled");

        ResolvedCredential credential = resolver.resolve("Bearer admin-secret");

        assertEquals("__client=pooled", credential.credential());
        assertTrue(credential.pooled());
    }

    @Test
    void adminKeyWithoutConfiguredCredentialIsUnavailable() {
        assertThrows(CredentialUnavailableException.class, () -> resolver.resolve("Bearer admin-secret"));
    }

    @Test
    void unknownKeysAndMissingHeadersAreRejected() {
        assertThrows(AuthenticationFailedException.class, () -> resolver.resolve("Bearer guess"));
        assertThrows(AuthenticationFailedException.class, () -> resolver.resolve("Basic abc"));
        assertThrows(AuthenticationFailedException.class, () -> resolver.resolve(null));
    }
}
