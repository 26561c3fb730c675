package warden.core.config;

import java.time.Duration;
import java.util.Optional;
import java.util.Set;

import io.smallrye.config.ConfigMapping;
import io.smallrye.config.WithDefault;

import warden.core.model.auth.Claim;
import warden.core.model.auth.MacAlgorithm;

/**
 * Configuration mapping for request authentication.
 *
 * <p>Configuration prefix: {@code warden.auth}
 *
 * <h2>Example</h2>
 * <pre>
 * warden.auth.mode=JWT
 * warden.auth.signing-secret=change-me-to-a-32-byte-secret-value
 * warden.auth.jwt.header=Authorization
 * warden.auth.jwt.template=Bearer {token}
 * warden.auth.jwt.claims=EXPIRATION,ISSUER
 * warden.auth.jwt.issuer=https://issuer.example.com
 * </pre>
 */
@ConfigMapping(prefix = "warden.auth")
public interface ValidatorConfig {

    /**
     * Authentication scheme.
     *
     * @return the mode (default: NONE)
     */
    @WithDefault("NONE")
    Mode mode();

    /**
     * Shared secret (UTF-8) used for JWT signatures and API-key MACs. Required unless the mode is NONE.
     */
    Optional<String> signingSecret();

    JwtSettings jwt();

    ApiKeySettings apiKey();

    enum Mode {
        NONE,
        JWT,
        API_KEY
    }

    interface JwtSettings {

        /**
         * Header carrying the token.
         */
        @WithDefault("Authorization")
        String header();

        /**
         * Boundary template around the token; must contain {@code {token}} exactly once.
         */
        @WithDefault("Bearer {token}")
        String template();

        /**
         * Frame field carrying the token. When set, JWT validation reads structured frames instead of headers.
         */
        Optional<String> frameField();

        /**
         * Claims enforced on top of the signature. Signature-only when absent.
         */
        Optional<Set<Claim>> claims();

        Optional<String> issuer();

        Optional<Set<String>> audience();

        @WithDefault("PT0S")
        Duration clockSkew();
    }

    interface ApiKeySettings {

        @WithDefault("apikey")
        String keyField();

        @WithDefault("sig")
        String signatureField();

        @WithDefault("data")
        String payloadField();

        /**
         * Resource path included in every signed message.
         */
        @WithDefault("/")
        String resourcePath();

        @WithDefault("HMAC_SHA256")
        MacAlgorithm algorithm();
    }
}
