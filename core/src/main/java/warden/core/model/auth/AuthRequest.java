package warden.core.model.auth;

import jakarta.ws.rs.core.MultivaluedMap;

import com.fasterxml.jackson.databind.JsonNode;

/**
 * The two inbound request shapes a credential can be read from. Built per validation call and never stored.
 */
public sealed interface AuthRequest {

    /**
     * An HTTP-style request, represented by its headers.
     *
     * @param headers header name to values
     */
    record HttpHeader(MultivaluedMap<String, String> headers) implements AuthRequest {
        public HttpHeader {
            if (headers == null) {
                throw new IllegalArgumentException("Headers cannot be null");
            }
        }
    }

    /**
     * A structured message frame such as a websocket payload.
     *
     * @param frame the parsed frame; any JSON value, only objects carry credentials
     */
    record StructuredFrame(JsonNode frame) implements AuthRequest {
        public StructuredFrame {
            if (frame == null) {
                throw new IllegalArgumentException("Frame cannot be null");
            }
        }
    }

    static HttpHeader from(MultivaluedMap<String, String> headers) {
        return new HttpHeader(headers);
    }

    static StructuredFrame from(JsonNode frame) {
        return new StructuredFrame(frame);
    }
}
