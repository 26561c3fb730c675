package warden.core.model.auth;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.time.Duration;
import java.util.List;
import java.util.Optional;
import java.util.Set;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

@DisplayName("ClaimSelector")
class ClaimSelectorTest {

    @Test
    @DisplayName("disableAll should select no claims")
    void disableAllShouldSelectNoClaims() {
        var selector = ClaimSelector.disableAll();

        for (Claim claim : Claim.values()) {
            assertFalse(selector.isEnabled(claim));
        }
        assertEquals(Duration.ZERO, selector.clockSkew());
    }

    @Test
    @DisplayName("builder should enable claims individually")
    void builderShouldEnableClaimsIndividually() {
        var selector = ClaimSelector.builder()
                .expiration()
                .issuer("https://issuer.example.com")
                .clockSkew(Duration.ofSeconds(30))
                .build();

        assertTrue(selector.isEnabled(Claim.EXPIRATION));
        assertTrue(selector.isEnabled(Claim.ISSUER));
        assertFalse(selector.isEnabled(Claim.NOT_BEFORE));
        assertEquals(Optional.of("https://issuer.example.com"), selector.expectedIssuer());
        assertEquals(Duration.ofSeconds(30), selector.clockSkew());
    }

    @Test
    @DisplayName("expected values alone should not enable checks")
    void expectedValuesShouldNotEnableChecks() {
        var selector = ClaimSelector.builder()
                .expectedIssuer("issuer")
                .expectedAudiences(List.of("api"))
                .build();

        assertFalse(selector.isEnabled(Claim.ISSUER));
        assertFalse(selector.isEnabled(Claim.AUDIENCE));
    }

    @Test
    @DisplayName("should require an expected issuer when issuer is selected")
    void shouldRequireExpectedIssuer() {
        assertThrows(
                AuthConfigurationException.class,
                () -> ClaimSelector.builder().claims(Set.of(Claim.ISSUER)).build());
    }

    @Test
    @DisplayName("should require an expected audience when audience is selected")
    void shouldRequireExpectedAudience() {
        assertThrows(
                AuthConfigurationException.class,
                () -> ClaimSelector.builder().claims(Set.of(Claim.AUDIENCE)).build());
    }

    @Test
    @DisplayName("should reject negative clock skew")
    void shouldRejectNegativeClockSkew() {
        assertThrows(
                AuthConfigurationException.class,
                () -> ClaimSelector.builder().clockSkew(Duration.ofSeconds(-1)).build());
    }

    @Test
    @DisplayName("should reject fractional clock skew")
    void shouldRejectFractionalClockSkew() {
        assertThrows(
                AuthConfigurationException.class,
                () -> ClaimSelector.builder().clockSkew(Duration.ofMillis(500)).build());
    }

    @Test
    @DisplayName("should collapse repeated audiences")
    void shouldCollapseRepeatedAudiences() {
        var selector = ClaimSelector.builder().audience("api", "api", "web").build();

        assertEquals(Set.of("api", "web"), selector.expectedAudiences());
    }

    @Test
    @DisplayName("should reject a null audience")
    void shouldRejectNullAudience() {
        assertThrows(AuthConfigurationException.class, () -> ClaimSelector.builder().audience("api", null));
    }
}
