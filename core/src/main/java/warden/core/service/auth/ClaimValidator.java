package warden.core.service.auth;

import java.time.Clock;
import java.util.List;

import org.jboss.logging.Logger;
import org.jose4j.jwa.AlgorithmConstraints;
import org.jose4j.jws.AlgorithmIdentifiers;
import org.jose4j.jwt.JwtClaims;
import org.jose4j.jwt.MalformedClaimException;
import org.jose4j.jwt.NumericDate;
import org.jose4j.jwt.consumer.ErrorCodes;
import org.jose4j.jwt.consumer.InvalidJwtException;
import org.jose4j.jwt.consumer.JwtConsumer;
import org.jose4j.jwt.consumer.JwtConsumerBuilder;
import org.jose4j.keys.HmacKey;
import org.jose4j.lang.InvalidAlgorithmException;

import warden.core.model.auth.AuthFailure;
import warden.core.model.auth.AuthResult;
import warden.core.model.auth.Claim;
import warden.core.model.auth.ClaimSelector;

/**
 * Verifies HMAC-signed JWTs against a shared secret.
 *
 * <p>The signature is always checked; only {@code HS256}, {@code HS384} and {@code HS512} are accepted.
 * The jose4j default claim validators are switched off and claims are enforced according to the
 * {@link ClaimSelector}, so that each rejection maps to a precise {@link AuthFailure}.
 */
public class ClaimValidator {

    private static final Logger LOG = Logger.getLogger(ClaimValidator.class);

    private static final AlgorithmConstraints HMAC_ONLY = new AlgorithmConstraints(
            AlgorithmConstraints.ConstraintType.PERMIT,
            AlgorithmIdentifiers.HMAC_SHA256,
            AlgorithmIdentifiers.HMAC_SHA384,
            AlgorithmIdentifiers.HMAC_SHA512);

    private final Clock clock;

    public ClaimValidator() {
        this(Clock.systemUTC());
    }

    public ClaimValidator(Clock clock) {
        this.clock = clock;
    }

    public AuthResult validate(byte[] secret, String token, ClaimSelector selector) {
        JwtClaims claims;
        try {
            claims = verifySignature(secret, token);
        } catch (InvalidJwtException e) {
            LOG.debugv("JWT verification failed: {0}", e.getMessage());
            return AuthResult.rejected(summarize(e));
        }

        try {
            return checkClaims(claims, selector);
        } catch (MalformedClaimException e) {
            return AuthResult.rejected(new AuthFailure.Malformed("Malformed claims: " + e.getMessage()));
        }
    }

    private JwtClaims verifySignature(byte[] secret, String token) throws InvalidJwtException {
        JwtConsumer consumer = new JwtConsumerBuilder()
                .setVerificationKey(new HmacKey(secret))
                .setRelaxVerificationKeyValidation()
                .setJwsAlgorithmConstraints(HMAC_ONLY)
                .setSkipAllValidators()
                .build();
        return consumer.processToClaims(token);
    }

    private AuthResult checkClaims(JwtClaims claims, ClaimSelector selector) throws MalformedClaimException {
        NumericDate now = NumericDate.fromMilliseconds(clock.millis());
        long skew = selector.clockSkew().toSeconds();

        if (selector.isEnabled(Claim.EXPIRATION)) {
            NumericDate expiration = claims.getExpirationTime();
            if (expiration == null) {
                return mismatch(Claim.EXPIRATION);
            }
            if (now.getValue() >= plusSkew(expiration.getValue(), skew)) {
                return AuthResult.rejected(new AuthFailure.Expired());
            }
        }

        if (selector.isEnabled(Claim.NOT_BEFORE)) {
            NumericDate notBefore = claims.getNotBefore();
            if (notBefore != null && plusSkew(now.getValue(), skew) < notBefore.getValue()) {
                return AuthResult.rejected(new AuthFailure.NotYetValid());
            }
        }

        if (selector.isEnabled(Claim.ISSUED_AT)) {
            NumericDate issuedAt = claims.getIssuedAt();
            if (issuedAt == null) {
                return mismatch(Claim.ISSUED_AT);
            }
            if (plusSkew(now.getValue(), skew) < issuedAt.getValue()) {
                return AuthResult.rejected(new AuthFailure.NotYetValid());
            }
        }

        if (selector.isEnabled(Claim.ISSUER)) {
            String issuer = claims.getIssuer();
            if (!selector.expectedIssuer().orElseThrow().equals(issuer)) {
                return mismatch(Claim.ISSUER);
            }
        }

        if (selector.isEnabled(Claim.AUDIENCE)) {
            List<String> audiences = claims.getAudience();
            if (audiences == null || audiences.stream().noneMatch(selector.expectedAudiences()::contains)) {
                return mismatch(Claim.AUDIENCE);
            }
        }

        if (selector.isEnabled(Claim.SUBJECT)) {
            String subject = claims.getSubject();
            if (subject == null || subject.isBlank()) {
                return mismatch(Claim.SUBJECT);
            }
        }

        return AuthResult.authorized();
    }

    // Saturates at Long.MAX_VALUE; skew is never negative.
    private static long plusSkew(long seconds, long skew) {
        return seconds > Long.MAX_VALUE - skew ? Long.MAX_VALUE : seconds + skew;
    }

    private static AuthResult mismatch(Claim claim) {
        return AuthResult.rejected(new AuthFailure.ClaimMismatch(claim.claimName()));
    }

    private static AuthFailure summarize(InvalidJwtException e) {
        if (e.hasErrorCode(ErrorCodes.SIGNATURE_INVALID) || e.hasErrorCode(ErrorCodes.SIGNATURE_MISSING)) {
            return new AuthFailure.InvalidSignature();
        }
        if (e.getCause() instanceof InvalidAlgorithmException) {
            return new AuthFailure.InvalidSignature();
        }
        return new AuthFailure.Malformed("Token could not be parsed");
    }
}
