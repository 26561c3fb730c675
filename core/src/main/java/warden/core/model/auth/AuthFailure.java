package warden.core.model.auth;

/**
 * Reason a request was rejected.
 *
 * <p>Every failure carries a human-readable {@link #detail()} suitable for embedding in a
 * transport-level "unauthorized" response. None of them are fatal; configuration faults are
 * reported through {@link AuthConfigurationException} instead.
 */
public sealed interface AuthFailure {

    String detail();

    /**
     * Expected header or frame field is absent.
     *
     * @param name the configured field name
     */
    record MissingField(String name) implements AuthFailure {
        @Override
        public String detail() {
            return "Missing field '" + name + "'";
        }
    }

    /**
     * Field is present but cannot be decoded as required (not visible ASCII text, wrong JSON type, bad hex).
     *
     * @param detail what was wrong with the field
     */
    record Malformed(String detail) implements AuthFailure {
        public Malformed {
            if (detail == null || detail.isBlank()) {
                detail = "Malformed credential";
            }
        }
    }

    /**
     * Structured request was not a JSON object.
     */
    record InvalidRequestShape() implements AuthFailure {
        @Override
        public String detail() {
            return "Request must be a JSON object";
        }
    }

    /**
     * JWT signature or API-key MAC did not verify.
     */
    record InvalidSignature() implements AuthFailure {
        @Override
        public String detail() {
            return "Invalid signature";
        }
    }

    record Expired() implements AuthFailure {
        @Override
        public String detail() {
            return "Token has expired";
        }
    }

    record NotYetValid() implements AuthFailure {
        @Override
        public String detail() {
            return "Token is not yet valid";
        }
    }

    /**
     * A selected claim is missing or does not match the configured expectation.
     *
     * @param claim the registered claim name (e.g. {@code iss}, {@code aud})
     */
    record ClaimMismatch(String claim) implements AuthFailure {
        @Override
        public String detail() {
            return "Invalid token claim '" + claim + "'";
        }
    }

    /**
     * API key is not known to the nonce store.
     *
     * @param field the frame field the key was read from
     */
    record InvalidCredential(String field) implements AuthFailure {
        @Override
        public String detail() {
            return "Invalid \"" + field + "\"";
        }
    }
}
