package warden.core.service.auth;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static warden.core.service.auth.TestTokens.OTHER_SECRET;
import static warden.core.service.auth.TestTokens.SECRET;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.Arrays;

import org.jose4j.jwa.AlgorithmConstraints;
import org.jose4j.jws.AlgorithmIdentifiers;
import org.jose4j.jws.JsonWebSignature;
import org.jose4j.jwt.JwtClaims;
import org.jose4j.jwt.NumericDate;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import warden.core.model.auth.AuthFailure;
import warden.core.model.auth.AuthResult;
import warden.core.model.auth.ClaimSelector;

@DisplayName("ClaimValidator")
class ClaimValidatorTest {

    private static final Instant NOW = Instant.parse("2026-01-15T12:00:00Z");
    private static final long NOW_SECONDS = NOW.getEpochSecond();

    private ClaimValidator validator;

    @BeforeEach
    void setUp() {
        validator = new ClaimValidator(Clock.fixed(NOW, ZoneOffset.UTC));
    }

    private static AuthFailure failure(AuthResult result) {
        return assertInstanceOf(AuthResult.Rejected.class, result).failure();
    }

    private static JwtClaims expiredClaims() {
        var claims = TestTokens.claims();
        claims.setExpirationTime(NumericDate.fromSeconds(NOW_SECONDS - 60));
        return claims;
    }

    @Nested
    @DisplayName("signature-only (disableAll)")
    class SignatureOnlyTests {

        @Test
        @DisplayName("should accept a correctly signed token")
        void shouldAcceptCorrectlySignedToken() {
            var token = TestTokens.sign(SECRET, TestTokens.claims());

            assertTrue(validator.validate(SECRET, token, ClaimSelector.disableAll()).isAuthorized());
        }

        @Test
        @DisplayName("should accept an expired token when expiry is not selected")
        void shouldIgnoreExpiryWhenNotSelected() {
            var token = TestTokens.sign(SECRET, expiredClaims());

            assertTrue(validator.validate(SECRET, token, ClaimSelector.disableAll()).isAuthorized());
        }

        @Test
        @DisplayName("should accept HS512 tokens")
        void shouldAcceptHs512Tokens() {
            byte[] longSecret = new byte[64];
            Arrays.fill(longSecret, (byte) 7);
            var token = TestTokens.sign(longSecret, TestTokens.claims(), AlgorithmIdentifiers.HMAC_SHA512);

            assertTrue(validator.validate(longSecret, token, ClaimSelector.disableAll()).isAuthorized());
        }

        @Test
        @DisplayName("should reject a token signed with another secret")
        void shouldRejectTokenSignedWithAnotherSecret() {
            var token = TestTokens.sign(OTHER_SECRET, TestTokens.claims());

            assertEquals(
                    new AuthFailure.InvalidSignature(),
                    failure(validator.validate(SECRET, token, ClaimSelector.disableAll())));
        }

        @Test
        @DisplayName("should reject an unsigned token")
        void shouldRejectUnsignedToken() throws Exception {
            var jws = new JsonWebSignature();
            jws.setPayload(TestTokens.claims().toJson());
            jws.setAlgorithmHeaderValue(AlgorithmIdentifiers.NONE);
            jws.setAlgorithmConstraints(AlgorithmConstraints.NO_CONSTRAINTS);
            var token = jws.getCompactSerialization();

            assertEquals(
                    new AuthFailure.InvalidSignature(),
                    failure(validator.validate(SECRET, token, ClaimSelector.disableAll())));
        }

        @Test
        @DisplayName("should reject garbage as malformed")
        void shouldRejectGarbage() {
            assertInstanceOf(
                    AuthFailure.Malformed.class,
                    failure(validator.validate(SECRET, "not-a-token", ClaimSelector.disableAll())));
        }
    }

    @Nested
    @DisplayName("time claims")
    class TimeClaimTests {

        @Test
        @DisplayName("should reject an expired token when expiry is selected")
        void shouldRejectExpiredToken() {
            var token = TestTokens.sign(SECRET, expiredClaims());
            var selector = ClaimSelector.builder().expiration().build();

            assertEquals(new AuthFailure.Expired(), failure(validator.validate(SECRET, token, selector)));
        }

        @Test
        @DisplayName("should accept an expired token within clock skew")
        void shouldAcceptWithinClockSkew() {
            var token = TestTokens.sign(SECRET, expiredClaims());
            var selector = ClaimSelector.builder()
                    .expiration()
                    .clockSkew(Duration.ofMinutes(2))
                    .build();

            assertTrue(validator.validate(SECRET, token, selector).isAuthorized());
        }

        @Test
        @DisplayName("should accept a far-future expiry with clock skew")
        void shouldAcceptFarFutureExpiryWithSkew() {
            var claims = TestTokens.claims();
            claims.setExpirationTime(NumericDate.fromSeconds(Long.MAX_VALUE - 5));
            var token = TestTokens.sign(SECRET, claims);
            var selector = ClaimSelector.builder()
                    .expiration()
                    .clockSkew(Duration.ofSeconds(30))
                    .build();

            assertTrue(validator.validate(SECRET, token, selector).isAuthorized());
        }

        @Test
        @DisplayName("should accept an unexpired token")
        void shouldAcceptUnexpiredToken() {
            var claims = TestTokens.claims();
            claims.setExpirationTime(NumericDate.fromSeconds(NOW_SECONDS + 300));
            var token = TestTokens.sign(SECRET, claims);

            assertTrue(validator.validate(SECRET, token, ClaimSelector.builder().expiration().build())
                    .isAuthorized());
        }

        @Test
        @DisplayName("should require exp when expiry is selected")
        void shouldRequireExpiration() {
            var token = TestTokens.sign(SECRET, TestTokens.claims());
            var selector = ClaimSelector.builder().expiration().build();

            assertEquals(new AuthFailure.ClaimMismatch("exp"), failure(validator.validate(SECRET, token, selector)));
        }

        @Test
        @DisplayName("should reject a token used before nbf")
        void shouldRejectBeforeNotBefore() {
            var claims = TestTokens.claims();
            claims.setNotBefore(NumericDate.fromSeconds(NOW_SECONDS + 600));
            var token = TestTokens.sign(SECRET, claims);

            assertEquals(
                    new AuthFailure.NotYetValid(),
                    failure(validator.validate(SECRET, token, ClaimSelector.builder().notBefore().build())));
            assertTrue(validator.validate(SECRET, token, ClaimSelector.disableAll()).isAuthorized());
        }

        @Test
        @DisplayName("should reject a token issued in the future")
        void shouldRejectFutureIssuedAt() {
            var claims = TestTokens.claims();
            claims.setIssuedAt(NumericDate.fromSeconds(NOW_SECONDS + 600));
            var token = TestTokens.sign(SECRET, claims);

            assertEquals(
                    new AuthFailure.NotYetValid(),
                    failure(validator.validate(SECRET, token, ClaimSelector.builder().issuedAt().build())));
        }
    }

    @Nested
    @DisplayName("identity claims")
    class IdentityClaimTests {

        @Test
        @DisplayName("should accept the expected issuer")
        void shouldAcceptExpectedIssuer() {
            var token = TestTokens.sign(SECRET, TestTokens.claims());
            var selector = ClaimSelector.builder().issuer("https://issuer.example.com").build();

            assertTrue(validator.validate(SECRET, token, selector).isAuthorized());
        }

        @Test
        @DisplayName("should reject an unexpected issuer")
        void shouldRejectUnexpectedIssuer() {
            var token = TestTokens.sign(SECRET, TestTokens.claims());
            var selector = ClaimSelector.builder().issuer("https://other.example.com").build();

            assertEquals(new AuthFailure.ClaimMismatch("iss"), failure(validator.validate(SECRET, token, selector)));
        }

        @Test
        @DisplayName("should accept a token sharing one audience")
        void shouldAcceptMatchingAudience() {
            var claims = TestTokens.claims();
            claims.setAudience("orders", "billing");
            var token = TestTokens.sign(SECRET, claims);
            var selector = ClaimSelector.builder().audience("billing").build();

            assertTrue(validator.validate(SECRET, token, selector).isAuthorized());
        }

        @Test
        @DisplayName("should reject a token without the expected audience")
        void shouldRejectMissingAudience() {
            var token = TestTokens.sign(SECRET, TestTokens.claims());
            var selector = ClaimSelector.builder().audience("billing").build();

            assertEquals(new AuthFailure.ClaimMismatch("aud"), failure(validator.validate(SECRET, token, selector)));
        }

        @Test
        @DisplayName("should require a subject when selected")
        void shouldRequireSubject() {
            var claims = new JwtClaims();
            claims.setIssuer("https://issuer.example.com");
            var token = TestTokens.sign(SECRET, claims);

            assertEquals(
                    new AuthFailure.ClaimMismatch("sub"),
                    failure(validator.validate(SECRET, token, ClaimSelector.builder().subject().build())));
        }
    }
}
