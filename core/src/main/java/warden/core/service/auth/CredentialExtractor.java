package warden.core.service.auth;

import java.util.List;
import java.util.Map;

import jakarta.ws.rs.core.MultivaluedMap;

import com.fasterxml.jackson.databind.JsonNode;

import warden.core.model.auth.AuthFailure;
import warden.core.model.auth.AuthHeader;
import warden.core.model.auth.AuthenticationException;

/**
 * Pulls raw credential strings out of requests. Pure; no cryptography.
 *
 * <p>Every failure is raised as an {@link AuthenticationException} carrying the matching {@link AuthFailure}.
 */
public class CredentialExtractor {

    /**
     * Read the token from a header, stripping the configured boundary text.
     *
     * <p>Boundary stripping is tolerant: a boundary that is not present leaves the value untouched, so a
     * malformed-but-plausible header is passed on to signature validation rather than rejected here.
     *
     * @param template header location
     * @param headers  request headers
     * @return the token text
     */
    public String fromHeader(AuthHeader template, MultivaluedMap<String, String> headers) {
        String value = headerValue(headers, template.fieldName());
        if (value == null) {
            throw new AuthenticationException(new AuthFailure.MissingField(template.fieldName()));
        }
        if (!isVisibleAscii(value)) {
            throw new AuthenticationException(new AuthFailure.Malformed(
                    "Header '" + template.fieldName() + "' contains characters outside visible ASCII"));
        }

        String token = value;
        if (template.prefixBoundary().isPresent()) {
            token = trimLeading(token, template.prefixBoundary().get());
        }
        if (template.suffixBoundary().isPresent()) {
            token = trimTrailing(token, template.suffixBoundary().get());
        }
        return token;
    }

    /**
     * Read a string field from a structured frame.
     *
     * @param fieldName frame field name
     * @param frame     the frame
     * @return the field text
     */
    public String fromFrame(String fieldName, JsonNode frame) {
        JsonNode value = field(fieldName, frame);
        if (!value.isTextual()) {
            throw new AuthenticationException(
                    new AuthFailure.Malformed("Field '" + fieldName + "' must be a string"));
        }
        return value.textValue();
    }

    /**
     * Read a field of any JSON type from a structured frame.
     *
     * @param fieldName frame field name
     * @param frame     the frame
     * @return the field value
     */
    public JsonNode payloadFromFrame(String fieldName, JsonNode frame) {
        return field(fieldName, frame);
    }

    private JsonNode field(String fieldName, JsonNode frame) {
        if (frame == null || !frame.isObject()) {
            throw new AuthenticationException(new AuthFailure.InvalidRequestShape());
        }
        JsonNode value = frame.get(fieldName);
        if (value == null) {
            throw new AuthenticationException(new AuthFailure.MissingField(fieldName));
        }
        return value;
    }

    private static String headerValue(MultivaluedMap<String, String> headers, String name) {
        List<String> values = headers.get(name);
        if (values == null) {
            // Header names are case-insensitive
            for (Map.Entry<String, List<String>> entry : headers.entrySet()) {
                if (name.equalsIgnoreCase(entry.getKey())) {
                    values = entry.getValue();
                    break;
                }
            }
        }
        if (values == null || values.isEmpty()) {
            return null;
        }
        return values.get(0);
    }

    private static boolean isVisibleAscii(String value) {
        for (int i = 0; i < value.length(); i++) {
            char c = value.charAt(i);
            if (c != '\t' && (c < 0x20 || c > 0x7E)) {
                return false;
            }
        }
        return true;
    }

    private static String trimLeading(String text, String boundary) {
        String result = text;
        while (result.startsWith(boundary)) {
            result = result.substring(boundary.length());
        }
        return result;
    }

    private static String trimTrailing(String text, String boundary) {
        String result = text;
        while (result.endsWith(boundary)) {
            result = result.substring(0, result.length() - boundary.length());
        }
        return result;
    }
}
