package warden.core.model.auth;

/**
 * Thrown when the authentication setup itself is wrong: a malformed location template, an API-key mode
 * without signature or payload fields, or a mode wired to a request shape it cannot validate.
 *
 * <p>This is a programmer error and is never translated into an {@link AuthResult}.
 */
public class AuthConfigurationException extends RuntimeException {

    public AuthConfigurationException(String message) {
        super(message);
    }

    public AuthConfigurationException(String message, Throwable cause) {
        super(message, cause);
    }
}
