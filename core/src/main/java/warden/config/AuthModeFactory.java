package warden.config;

import java.nio.charset.StandardCharsets;
import java.util.Set;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;

import org.jboss.logging.Logger;

import warden.core.config.ValidatorConfig;
import warden.core.model.auth.AuthConfigurationException;
import warden.core.model.auth.AuthField;
import warden.core.model.auth.AuthLocation;
import warden.core.model.auth.AuthMode;
import warden.core.model.auth.ClaimSelector;
import warden.core.port.out.NonceStore;

/**
 * Builds the {@link AuthMode} described by {@link ValidatorConfig}.
 *
 * <p>All configuration problems are reported here, at startup, as {@link AuthConfigurationException}.
 */
@ApplicationScoped
public class AuthModeFactory {

    private static final Logger LOG = Logger.getLogger(AuthModeFactory.class);

    private final ValidatorConfig config;

    @Inject
    public AuthModeFactory(ValidatorConfig config) {
        this.config = config;
    }

    /**
     * Build a mode that needs no nonce store (NONE or JWT).
     */
    public AuthMode create() {
        return create(null);
    }

    /**
     * Build the configured mode.
     *
     * @param nonceStore nonce lookup for API-key mode; ignored by the other modes
     */
    public AuthMode create(NonceStore nonceStore) {
        try {
            AuthMode mode = build(nonceStore);
            LOG.infov("Configured {0} authentication", mode.name());
            return mode;
        } catch (AuthConfigurationException e) {
            LOG.errorv("Invalid authentication configuration: {0}", e.getMessage());
            throw e;
        }
    }

    private AuthMode build(NonceStore nonceStore) {
        if (config.mode() == ValidatorConfig.Mode.NONE) {
            LOG.warn("Authentication is DISABLED (warden.auth.mode=NONE); all requests will be allowed");
            return AuthMode.none();
        }

        byte[] secret = signingSecret();
        if (config.mode() == ValidatorConfig.Mode.JWT) {
            return new AuthMode.Jwt(jwtLocation(), secret, claimSelector());
        }

        if (nonceStore == null) {
            throw new AuthConfigurationException("API-key mode requires a nonce store");
        }
        var apiKey = config.apiKey();
        return new AuthMode.ApiKey(
                AuthField.apiKey(apiKey.keyField(), apiKey.signatureField(), apiKey.payloadField()),
                secret,
                apiKey.resourcePath(),
                nonceStore,
                apiKey.algorithm());
    }

    private byte[] signingSecret() {
        return config.signingSecret()
                .filter(secret -> !secret.isEmpty())
                .map(secret -> secret.getBytes(StandardCharsets.UTF_8))
                .orElseThrow(() -> new AuthConfigurationException(
                        "warden.auth.signing-secret is required for " + config.mode() + " mode"));
    }

    private AuthLocation jwtLocation() {
        var jwt = config.jwt();
        if (jwt.frameField().isPresent()) {
            return AuthLocation.frameField(jwt.frameField().get());
        }
        return AuthLocation.header(jwt.header(), jwt.template());
    }

    private ClaimSelector claimSelector() {
        var jwt = config.jwt();
        var builder = ClaimSelector.builder()
                .claims(jwt.claims().orElse(Set.of()))
                .clockSkew(jwt.clockSkew());
        jwt.issuer().ifPresent(builder::expectedIssuer);
        jwt.audience().ifPresent(builder::expectedAudiences);
        return builder.build();
    }
}
