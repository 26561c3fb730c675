package warden.core.model.auth;

/**
 * Carries an {@link AuthFailure} out of the extraction steps up to the dispatcher, which turns it into
 * an {@link AuthResult.Rejected}.
 */
public class AuthenticationException extends RuntimeException {

    private final transient AuthFailure failure;

    public AuthenticationException(AuthFailure failure) {
        super(failure.detail());
        this.failure = failure;
    }

    public AuthFailure failure() {
        return failure;
    }
}
