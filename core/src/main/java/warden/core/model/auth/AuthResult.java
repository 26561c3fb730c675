package warden.core.model.auth;

/**
 * Outcome of validating one request against an {@link AuthMode}.
 */
public sealed interface AuthResult {

    int UNAUTHORIZED = 401;

    /**
     * The request carried valid credentials (or the mode does not require any).
     */
    record Authorized() implements AuthResult {
        private static final Authorized INSTANCE = new Authorized();

        public static Authorized instance() {
            return INSTANCE;
        }
    }

    /**
     * The request was rejected.
     *
     * @param failure why the request was rejected
     */
    record Rejected(AuthFailure failure) implements AuthResult {
        public Rejected {
            if (failure == null) {
                throw new IllegalArgumentException("Failure cannot be null");
            }
        }

        public String reason() {
            return failure.detail();
        }

        public int statusCode() {
            return UNAUTHORIZED;
        }
    }

    default boolean isAuthorized() {
        return this instanceof Authorized;
    }

    default boolean isRejected() {
        return this instanceof Rejected;
    }

    static AuthResult authorized() {
        return Authorized.instance();
    }

    static AuthResult rejected(AuthFailure failure) {
        return new Rejected(failure);
    }
}
