package warden.core.model.auth;

import java.time.Duration;
import java.util.Arrays;
import java.util.Collection;
import java.util.EnumSet;
import java.util.LinkedHashSet;
import java.util.Optional;
import java.util.Set;

/**
 * Which JWT claims are enforced on top of the signature check, and what they are checked against.
 *
 * <p>The default ({@link #disableAll()}) performs signature-only verification. Claims that are not
 * selected are never inspected, even when present and invalid.
 *
 * @param claims            claims to enforce
 * @param expectedIssuer    required {@code iss} value when {@link Claim#ISSUER} is selected
 * @param expectedAudiences accepted {@code aud} values when {@link Claim#AUDIENCE} is selected
 * @param clockSkew         tolerance applied to {@code exp}, {@code nbf} and {@code iat}, in whole seconds
 */
public record ClaimSelector(
        Set<Claim> claims, Optional<String> expectedIssuer, Set<String> expectedAudiences, Duration clockSkew) {

    private static final ClaimSelector DISABLE_ALL =
            new ClaimSelector(Set.of(), Optional.empty(), Set.of(), Duration.ZERO);

    public ClaimSelector {
        claims = claims == null || claims.isEmpty() ? Set.of() : Set.copyOf(EnumSet.copyOf(claims));
        expectedIssuer = expectedIssuer == null ? Optional.empty() : expectedIssuer.filter(iss -> !iss.isBlank());
        expectedAudiences = expectedAudiences == null ? Set.of() : Set.copyOf(expectedAudiences);
        if (clockSkew == null) {
            clockSkew = Duration.ZERO;
        }
        if (clockSkew.isNegative()) {
            throw new AuthConfigurationException("Clock skew cannot be negative");
        }
        if (clockSkew.getNano() != 0) {
            throw new AuthConfigurationException("Clock skew must be a whole number of seconds");
        }
        if (claims.contains(Claim.ISSUER) && expectedIssuer.isEmpty()) {
            throw new AuthConfigurationException("Issuer validation requires an expected issuer");
        }
        if (claims.contains(Claim.AUDIENCE) && expectedAudiences.isEmpty()) {
            throw new AuthConfigurationException("Audience validation requires at least one expected audience");
        }
    }

    /**
     * Signature-only verification.
     */
    public static ClaimSelector disableAll() {
        return DISABLE_ALL;
    }

    public static Builder builder() {
        return new Builder();
    }

    public boolean isEnabled(Claim claim) {
        return claims.contains(claim);
    }

    public static final class Builder {
        private final Set<Claim> claims = EnumSet.noneOf(Claim.class);
        private String expectedIssuer;
        private final Set<String> expectedAudiences = new LinkedHashSet<>();
        private Duration clockSkew = Duration.ZERO;

        private Builder() {}

        public Builder expiration() {
            claims.add(Claim.EXPIRATION);
            return this;
        }

        public Builder notBefore() {
            claims.add(Claim.NOT_BEFORE);
            return this;
        }

        public Builder issuedAt() {
            claims.add(Claim.ISSUED_AT);
            return this;
        }

        public Builder subject() {
            claims.add(Claim.SUBJECT);
            return this;
        }

        public Builder issuer(String issuer) {
            claims.add(Claim.ISSUER);
            this.expectedIssuer = issuer;
            return this;
        }

        public Builder audience(String... audiences) {
            claims.add(Claim.AUDIENCE);
            if (audiences == null || Arrays.asList(audiences).contains(null)) {
                throw new AuthConfigurationException("Expected audiences cannot be null");
            }
            expectedAudiences.addAll(Arrays.asList(audiences));
            return this;
        }

        /**
         * Set the expected issuer without enabling the check; use with {@link #claims(Collection)}.
         */
        public Builder expectedIssuer(String issuer) {
            this.expectedIssuer = issuer;
            return this;
        }

        /**
         * Add accepted audiences without enabling the check; use with {@link #claims(Collection)}.
         */
        public Builder expectedAudiences(Collection<String> audiences) {
            expectedAudiences.addAll(audiences);
            return this;
        }

        public Builder claims(Collection<Claim> selected) {
            claims.addAll(selected);
            return this;
        }

        public Builder clockSkew(Duration clockSkew) {
            this.clockSkew = clockSkew;
            return this;
        }

        public ClaimSelector build() {
            return new ClaimSelector(claims, Optional.ofNullable(expectedIssuer), expectedAudiences, clockSkew);
        }
    }
}
