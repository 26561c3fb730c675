package warden.core.port.out;

import java.util.OptionalLong;

/**
 * Externally owned source of truth for API-key nonces.
 *
 * <p>{@link #expectedNonce(String)} returns the nonce a request for the given key must be signed with
 * right now. The validator only reads it; after a request is accepted it reports the use through
 * {@link #accepted(String, long)} and the store decides how to advance.
 *
 * <p>Implementations are called concurrently from many validations and must be thread-safe.
 */
@FunctionalInterface
public interface NonceStore {

    /**
     * Look up the nonce currently expected for an API key.
     *
     * @param apiKey the API key presented by the client
     * @return the expected nonce (unsigned 64-bit), or empty if the key is unknown
     */
    OptionalLong expectedNonce(String apiKey);

    /**
     * Called once a request signed with {@code nonce} has passed signature validation for {@code apiKey}.
     *
     * <p>Returning {@code false} tells the validator the nonce was consumed concurrently by another request;
     * the request is then rejected.
     *
     * @param apiKey the API key
     * @param nonce  the nonce the request was signed with
     * @return whether the use was recorded
     */
    default boolean accepted(String apiKey, long nonce) {
        return true;
    }
}
