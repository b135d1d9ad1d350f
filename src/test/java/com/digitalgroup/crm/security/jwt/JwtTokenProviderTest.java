package com.digitalgroup.crm.security.jwt;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.test.util.ReflectionTestUtils;

import static org.junit.jupiter.api.Assertions.*;

class JwtTokenProviderTest {

    private static final String SECRET = "test-secret-key-that-is-at-least-32-characters-long-for-hs256";

    private JwtTokenProvider jwtTokenProvider;

    @BeforeEach
    void setUp() {
        jwtTokenProvider = newProvider(SECRET, 3600000L);
    }

    @Test
    void generateToken_ValidInput_ReturnsToken() {
        String token = jwtTokenProvider.generateToken(123L, "rep@example.com", "SALES_REP");

        assertNotNull(token);
        assertFalse(token.isEmpty());
        assertTrue(jwtTokenProvider.validateToken(token));
    }

    @Test
    void token_CarriesUserIdEmailAndRole() {
        String token = jwtTokenProvider.generateToken(123L, "rep@example.com", "SALES_REP");

        assertEquals(123L, jwtTokenProvider.getUserIdFromToken(token));
        assertEquals("rep@example.com", jwtTokenProvider.getUsernameFromToken(token));
        assertEquals("SALES_REP", jwtTokenProvider.getRoleFromToken(token));
    }

    @Test
    void validateToken_Garbage_ReturnsFalse() {
        assertFalse(jwtTokenProvider.validateToken("invalid.token.here"));
        assertFalse(jwtTokenProvider.validateToken(""));
    }

    @Test
    void validateToken_Expired_ReturnsFalse() {
        JwtTokenProvider expiring = newProvider(SECRET, -1000L);
        String token = expiring.generateToken(123L, "rep@example.com", "SALES_REP");

        assertFalse(jwtTokenProvider.validateToken(token));
    }

    @Test
    void validateToken_SignedWithOtherSecret_ReturnsFalse() {
        JwtTokenProvider other = newProvider("another-secret-key-that-is-also-long-enough-for-hs256", 3600000L);
        String token = other.generateToken(123L, "rep@example.com", "SALES_REP");

        assertFalse(jwtTokenProvider.validateToken(token));
    }

    private static JwtTokenProvider newProvider(String secret, long expiration) {
        JwtTokenProvider provider = new JwtTokenProvider();
        ReflectionTestUtils.setField(provider, "jwtSecret", secret);
        ReflectionTestUtils.setField(provider, "jwtExpiration", expiration);
        provider.init();
        return provider;
    }
}
