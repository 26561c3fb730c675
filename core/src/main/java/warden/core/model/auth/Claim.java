package warden.core.model.auth;

/**
 * Registered JWT claims whose enforcement can be switched on individually.
 */
public enum Claim {
    EXPIRATION("exp"),
    NOT_BEFORE("nbf"),
    ISSUED_AT("iat"),
    ISSUER("iss"),
    AUDIENCE("aud"),
    SUBJECT("sub");

    private final String claimName;

    Claim(String claimName) {
        this.claimName = claimName;
    }

    /**
     * @return the claim name as it appears in the token
     */
    public String claimName() {
        return claimName;
    }
}
