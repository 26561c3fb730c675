package warden.core.model.auth;

/**
 * Where the primary credential lives in a request.
 */
public sealed interface AuthLocation permits AuthHeader, AuthLocation.FrameField {

    /**
     * The request shape this location can be read from.
     */
    Class<? extends AuthRequest> requestShape();

    /**
     * A named field of a structured frame.
     *
     * @param fieldName the frame field holding the token
     */
    record FrameField(String fieldName) implements AuthLocation {
        public FrameField {
            if (fieldName == null || fieldName.isBlank()) {
                throw new AuthConfigurationException("Frame field name cannot be null or blank");
            }
        }

        @Override
        public Class<? extends AuthRequest> requestShape() {
            return AuthRequest.StructuredFrame.class;
        }
    }

    /**
     * Builds a header location from a boundary template, failing if the template is malformed.
     *
     * @param fieldName header name, e.g. {@code Authorization}
     * @param template  boundary template containing {@value AuthHeader#TOKEN_MARKER} exactly once
     * @throws AuthConfigurationException if the marker is missing or repeated
     */
    static AuthHeader header(String fieldName, String template) {
        return AuthHeader.fromTemplate(fieldName, template)
                .orElseThrow(() -> new AuthConfigurationException("Header template for '" + fieldName
                        + "' must contain " + AuthHeader.TOKEN_MARKER + " exactly once: " + template));
    }

    static FrameField frameField(String fieldName) {
        return new FrameField(fieldName);
    }
}
