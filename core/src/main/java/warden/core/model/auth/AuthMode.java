package warden.core.model.auth;

import java.util.Arrays;

import warden.core.port.out.NonceStore;

/**
 * Authentication scheme applied to inbound requests.
 *
 * <p>Instances are immutable and may be shared by any number of concurrent validations.
 */
public sealed interface AuthMode {

    /**
     * Short name used in logs ({@code jwt}, {@code api-key}, {@code none}).
     */
    String name();

    /**
     * Whether this mode can validate requests of the given shape.
     */
    boolean accepts(Class<? extends AuthRequest> requestShape);

    /**
     * Bearer-token validation against an HMAC-signed claim set.
     *
     * @param location      where the token lives
     * @param signingSecret shared HMAC secret
     * @param claimSelector claims enforced on top of the signature
     */
    record Jwt(AuthLocation location, byte[] signingSecret, ClaimSelector claimSelector) implements AuthMode {
        public Jwt {
            if (location == null) {
                throw new AuthConfigurationException("JWT location cannot be null");
            }
            signingSecret = copySecret(signingSecret);
            if (claimSelector == null) {
                claimSelector = ClaimSelector.disableAll();
            }
        }

        @Override
        public byte[] signingSecret() {
            return signingSecret.clone();
        }

        @Override
        public String name() {
            return "jwt";
        }

        @Override
        public boolean accepts(Class<? extends AuthRequest> requestShape) {
            return location.requestShape().equals(requestShape);
        }

        @Override
        public boolean equals(Object other) {
            return other instanceof Jwt that
                    && location.equals(that.location)
                    && Arrays.equals(signingSecret, that.signingSecret)
                    && claimSelector.equals(that.claimSelector);
        }

        @Override
        public int hashCode() {
            return 31 * (31 * location.hashCode() + Arrays.hashCode(signingSecret)) + claimSelector.hashCode();
        }

        @Override
        public String toString() {
            return "Jwt[location=" + location + ", claimSelector=" + claimSelector + "]";
        }
    }

    /**
     * Signed API-key requests over structured frames.
     *
     * @param fields        frame field names; must include the signature and payload fields
     * @param signingSecret shared MAC secret
     * @param resourcePath  resource path included in the signed message
     * @param nonceStore    nonce lookup capability, owned by the caller
     * @param macAlgorithm  MAC used for the signature
     */
    record ApiKey(
            AuthField fields,
            byte[] signingSecret,
            String resourcePath,
            NonceStore nonceStore,
            MacAlgorithm macAlgorithm)
            implements AuthMode {
        public ApiKey {
            if (fields == null || !fields.isApiKeyComplete()) {
                throw new AuthConfigurationException("API-key mode requires key, signature and payload fields");
            }
            signingSecret = copySecret(signingSecret);
            if (resourcePath == null) {
                throw new AuthConfigurationException("Resource path cannot be null");
            }
            if (nonceStore == null) {
                throw new AuthConfigurationException("API-key mode requires a nonce store");
            }
            if (macAlgorithm == null) {
                macAlgorithm = MacAlgorithm.HMAC_SHA256;
            }
        }

        public ApiKey(AuthField fields, byte[] signingSecret, String resourcePath, NonceStore nonceStore) {
            this(fields, signingSecret, resourcePath, nonceStore, MacAlgorithm.HMAC_SHA256);
        }

        @Override
        public byte[] signingSecret() {
            return signingSecret.clone();
        }

        @Override
        public String name() {
            return "api-key";
        }

        @Override
        public boolean accepts(Class<? extends AuthRequest> requestShape) {
            return AuthRequest.StructuredFrame.class.equals(requestShape);
        }

        @Override
        public boolean equals(Object other) {
            return other instanceof ApiKey that
                    && fields.equals(that.fields)
                    && Arrays.equals(signingSecret, that.signingSecret)
                    && resourcePath.equals(that.resourcePath)
                    && nonceStore.equals(that.nonceStore)
                    && macAlgorithm == that.macAlgorithm;
        }

        @Override
        public int hashCode() {
            int result = fields.hashCode();
            result = 31 * result + Arrays.hashCode(signingSecret);
            result = 31 * result + resourcePath.hashCode();
            result = 31 * result + nonceStore.hashCode();
            return 31 * result + macAlgorithm.hashCode();
        }

        @Override
        public String toString() {
            return "ApiKey[fields=" + fields + ", resourcePath=" + resourcePath + ", macAlgorithm=" + macAlgorithm
                    + "]";
        }
    }

    /**
     * Pass-through: every request is authorized.
     */
    record None() implements AuthMode {
        private static final None INSTANCE = new None();

        public static None instance() {
            return INSTANCE;
        }

        @Override
        public String name() {
            return "none";
        }

        @Override
        public boolean accepts(Class<? extends AuthRequest> requestShape) {
            return true;
        }
    }

    static AuthMode none() {
        return None.instance();
    }

    /**
     * JWT mode reading {@code Authorization: Bearer <token>} with signature-only verification.
     */
    static Jwt defaultJwt(byte[] signingSecret) {
        return new Jwt(
                AuthLocation.header("Authorization", "Bearer {token}"), signingSecret, ClaimSelector.disableAll());
    }

    private static byte[] copySecret(byte[] secret) {
        if (secret == null || secret.length == 0) {
            throw new AuthConfigurationException("Signing secret cannot be null or empty");
        }
        return secret.clone();
    }
}
