package warden.core.model.auth;

import java.util.Optional;

/**
 * Frame field names used by the API-key scheme.
 *
 * @param keyOrToken field holding the API key (or the token, for JWT frame validation)
 * @param sign       field holding the hex request signature
 * @param payload    field holding the signed payload
 */
public record AuthField(String keyOrToken, Optional<String> sign, Optional<String> payload) {

    public AuthField {
        if (keyOrToken == null || keyOrToken.isBlank()) {
            throw new AuthConfigurationException("Key field name cannot be null or blank");
        }
        sign = sign == null ? Optional.empty() : sign.filter(name -> !name.isBlank());
        payload = payload == null ? Optional.empty() : payload.filter(name -> !name.isBlank());
    }

    public static AuthField apiKey(String keyField, String signatureField, String payloadField) {
        return new AuthField(keyField, Optional.ofNullable(signatureField), Optional.ofNullable(payloadField));
    }

    public static AuthField token(String field) {
        return new AuthField(field, Optional.empty(), Optional.empty());
    }

    public boolean isApiKeyComplete() {
        return sign.isPresent() && payload.isPresent();
    }
}
