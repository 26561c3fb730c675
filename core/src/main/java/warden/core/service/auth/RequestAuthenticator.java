package warden.core.service.auth;

import java.util.OptionalLong;

import com.fasterxml.jackson.databind.JsonNode;
import org.jboss.logging.Logger;

import warden.core.model.auth.ApiKeyCandidate;
import warden.core.model.auth.AuthConfigurationException;
import warden.core.model.auth.AuthFailure;
import warden.core.model.auth.AuthField;
import warden.core.model.auth.AuthHeader;
import warden.core.model.auth.AuthLocation;
import warden.core.model.auth.AuthMode;
import warden.core.model.auth.AuthRequest;
import warden.core.model.auth.AuthResult;
import warden.core.model.auth.AuthenticationException;
import warden.core.port.out.NonceStore;

/**
 * Validates requests against one {@link AuthMode}.
 *
 * <p>Each call is a single stateless step: the mode selects the pipeline, the request shape selects the
 * extraction, and the outcome is an {@link AuthResult}. A mode wired to a request shape it cannot read is a
 * programmer error and raises {@link AuthConfigurationException}; use {@link #forHeaders(AuthMode)} or
 * {@link #forFrames(AuthMode)} to have that detected when the authenticator is built rather than per request.
 *
 * <p>Instances are immutable and safe to share between threads.
 *
 * @param <R> the request shape this authenticator accepts
 */
public final class RequestAuthenticator<R extends AuthRequest> {

    private static final Logger LOG = Logger.getLogger(RequestAuthenticator.class);

    private final AuthMode mode;
    private final CredentialExtractor extractor;
    private final ClaimValidator claimValidator;
    private final ApiKeySignatureValidator signatureValidator;

    RequestAuthenticator(
            AuthMode mode,
            CredentialExtractor extractor,
            ClaimValidator claimValidator,
            ApiKeySignatureValidator signatureValidator) {
        if (mode == null) {
            throw new AuthConfigurationException("Auth mode cannot be null");
        }
        this.mode = mode;
        this.extractor = extractor;
        this.claimValidator = claimValidator;
        this.signatureValidator = signatureValidator;
    }

    /**
     * Authenticator accepting either request shape; shape mismatches surface on {@link #validate}.
     */
    public static RequestAuthenticator<AuthRequest> forMode(AuthMode mode) {
        return forMode(mode, new ClaimValidator());
    }

    public static RequestAuthenticator<AuthRequest> forMode(AuthMode mode, ClaimValidator claimValidator) {
        return new RequestAuthenticator<>(
                mode, new CredentialExtractor(), claimValidator, new ApiKeySignatureValidator());
    }

    /**
     * Authenticator for header-bearing requests.
     *
     * @throws AuthConfigurationException if the mode cannot read credentials from headers
     */
    public static RequestAuthenticator<AuthRequest.HttpHeader> forHeaders(AuthMode mode) {
        return forHeaders(mode, new ClaimValidator());
    }

    public static RequestAuthenticator<AuthRequest.HttpHeader> forHeaders(
            AuthMode mode, ClaimValidator claimValidator) {
        requireShape(mode, AuthRequest.HttpHeader.class);
        return new RequestAuthenticator<>(
                mode, new CredentialExtractor(), claimValidator, new ApiKeySignatureValidator());
    }

    /**
     * Authenticator for structured-frame requests.
     *
     * @throws AuthConfigurationException if the mode cannot read credentials from frames
     */
    public static RequestAuthenticator<AuthRequest.StructuredFrame> forFrames(AuthMode mode) {
        return forFrames(mode, new ClaimValidator());
    }

    public static RequestAuthenticator<AuthRequest.StructuredFrame> forFrames(
            AuthMode mode, ClaimValidator claimValidator) {
        requireShape(mode, AuthRequest.StructuredFrame.class);
        return new RequestAuthenticator<>(
                mode, new CredentialExtractor(), claimValidator, new ApiKeySignatureValidator());
    }

    public AuthMode mode() {
        return mode;
    }

    /**
     * Decide whether the request carries valid credentials.
     *
     * @param request the inbound request
     * @return authorized, or rejected with the precise failure
     * @throws AuthConfigurationException if the mode cannot read this request shape
     */
    public AuthResult validate(R request) {
        if (request == null) {
            throw new IllegalArgumentException("Request cannot be null");
        }

        AuthResult result;
        try {
            result = dispatch(request);
        } catch (AuthenticationException e) {
            result = AuthResult.rejected(e.failure());
        }

        if (result instanceof AuthResult.Rejected rejected) {
            LOG.debugv("Rejected {0} request: {1}", mode.name(), rejected.reason());
        }
        return result;
    }

    private AuthResult dispatch(AuthRequest request) {
        if (mode instanceof AuthMode.Jwt jwt) {
            return validateJwt(jwt, request);
        }
        if (mode instanceof AuthMode.ApiKey apiKey) {
            return validateApiKey(apiKey, request);
        }
        return AuthResult.authorized();
    }

    private AuthResult validateJwt(AuthMode.Jwt jwt, AuthRequest request) {
        AuthLocation location = jwt.location();
        String token;
        if (location instanceof AuthHeader header && request instanceof AuthRequest.HttpHeader http) {
            token = extractor.fromHeader(header, http.headers());
        } else if (location instanceof AuthLocation.FrameField field
                && request instanceof AuthRequest.StructuredFrame frame) {
            token = extractor.fromFrame(field.fieldName(), frame.frame());
        } else {
            throw shapeMismatch(request);
        }
        return claimValidator.validate(jwt.signingSecret(), token, jwt.claimSelector());
    }

    private AuthResult validateApiKey(AuthMode.ApiKey apiKey, AuthRequest request) {
        if (!(request instanceof AuthRequest.StructuredFrame structured)) {
            throw shapeMismatch(request);
        }

        AuthField fields = apiKey.fields();
        JsonNode frame = structured.frame();
        String key = extractor.fromFrame(fields.keyOrToken(), frame);
        String signature = extractor.fromFrame(fields.sign().orElseThrow(), frame);
        long nonce = expectedNonce(apiKey.nonceStore(), key, fields.keyOrToken());
        JsonNode payload = extractor.payloadFromFrame(fields.payload().orElseThrow(), frame);

        var candidate = new ApiKeyCandidate(apiKey.resourcePath(), nonce, payload);
        AuthResult result =
                signatureValidator.validate(apiKey.signingSecret(), apiKey.macAlgorithm(), candidate, signature);
        if (result.isAuthorized()) {
            reportAccepted(apiKey.nonceStore(), key, nonce, fields.keyOrToken());
        }
        return result;
    }

    private static long expectedNonce(NonceStore store, String key, String keyField) {
        OptionalLong nonce;
        try {
            nonce = store.expectedNonce(key);
        } catch (RuntimeException e) {
            LOG.warnv(e, "Nonce lookup failed for \"{0}\"", keyField);
            throw new AuthenticationException(new AuthFailure.InvalidCredential(keyField));
        }
        if (nonce == null || nonce.isEmpty()) {
            throw new AuthenticationException(new AuthFailure.InvalidCredential(keyField));
        }
        return nonce.getAsLong();
    }

    private static void reportAccepted(NonceStore store, String key, long nonce, String keyField) {
        boolean recorded;
        try {
            recorded = store.accepted(key, nonce);
        } catch (RuntimeException e) {
            LOG.warnv(e, "Nonce store failed to record use for \"{0}\"", keyField);
            throw new AuthenticationException(new AuthFailure.InvalidCredential(keyField));
        }
        if (!recorded) {
            // Nonce consumed by a concurrent request
            throw new AuthenticationException(new AuthFailure.InvalidCredential(keyField));
        }
    }

    private AuthConfigurationException shapeMismatch(AuthRequest request) {
        String message = "Auth mode '" + mode.name() + "' cannot validate a "
                + request.getClass().getSimpleName() + " request; check the handler wiring for this mode";
        LOG.error(message);
        return new AuthConfigurationException(message);
    }

    private static void requireShape(AuthMode mode, Class<? extends AuthRequest> shape) {
        if (mode == null) {
            throw new AuthConfigurationException("Auth mode cannot be null");
        }
        if (!mode.accepts(shape)) {
            throw new AuthConfigurationException(
                    "Auth mode '" + mode.name() + "' cannot validate " + shape.getSimpleName() + " requests");
        }
    }
}
