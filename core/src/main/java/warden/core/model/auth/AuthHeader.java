package warden.core.model.auth;

import java.util.Optional;

/**
 * Header location of a credential: the header name plus the literal text surrounding the token.
 *
 * <p>Built from a template such as {@code "Bearer {token}"}, where {@value #TOKEN_MARKER} marks the token.
 * Text before the marker becomes the prefix boundary, text after it the suffix boundary.
 *
 * @param fieldName      header name
 * @param prefixBoundary literal text preceding the token, if any
 * @param suffixBoundary literal text following the token, if any
 */
public record AuthHeader(String fieldName, Optional<String> prefixBoundary, Optional<String> suffixBoundary)
        implements AuthLocation {

    public static final String TOKEN_MARKER = "{token}";

    public AuthHeader {
        if (fieldName == null || fieldName.isBlank()) {
            throw new AuthConfigurationException("Header field name cannot be null or blank");
        }
        prefixBoundary = nonEmpty(prefixBoundary);
        suffixBoundary = nonEmpty(suffixBoundary);
    }

    /**
     * Splits a boundary template around its token marker.
     *
     * @param fieldName header name
     * @param template  template text
     * @return the header location, or empty if the marker is absent or appears more than once
     */
    public static Optional<AuthHeader> fromTemplate(String fieldName, String template) {
        if (template == null) {
            return Optional.empty();
        }
        int start = template.indexOf(TOKEN_MARKER);
        if (start < 0 || template.indexOf(TOKEN_MARKER, start + 1) >= 0) {
            return Optional.empty();
        }
        String prefix = template.substring(0, start);
        String suffix = template.substring(start + TOKEN_MARKER.length());
        return Optional.of(new AuthHeader(fieldName, Optional.of(prefix), Optional.of(suffix)));
    }

    @Override
    public Class<? extends AuthRequest> requestShape() {
        return AuthRequest.HttpHeader.class;
    }

    private static Optional<String> nonEmpty(Optional<String> boundary) {
        if (boundary == null) {
            return Optional.empty();
        }
        return boundary.filter(text -> !text.isEmpty());
    }
}
