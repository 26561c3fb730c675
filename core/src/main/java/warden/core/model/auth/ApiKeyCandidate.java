package warden.core.model.auth;

import com.fasterxml.jackson.databind.JsonNode;

/**
 * Data an API-key signature is computed over. Assembled per request, never stored.
 *
 * @param resourcePath the protected resource path
 * @param nonce        the nonce the store currently expects, an unsigned 64-bit value
 * @param payload      the signed frame payload
 */
public record ApiKeyCandidate(String resourcePath, long nonce, JsonNode payload) {

    public ApiKeyCandidate {
        if (resourcePath == null) {
            throw new IllegalArgumentException("Resource path cannot be null");
        }
        if (payload == null) {
            throw new IllegalArgumentException("Payload cannot be null");
        }
    }

    /**
     * @return the nonce in its canonical unsigned decimal form
     */
    public String nonceText() {
        return Long.toUnsignedString(nonce);
    }
}
