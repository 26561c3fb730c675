package warden.adapter.in.websocket;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.ObjectReader;
import org.jboss.logging.Logger;

import warden.core.model.auth.AuthFailure;
import warden.core.model.auth.AuthMode;
import warden.core.model.auth.AuthRequest;
import warden.core.model.auth.AuthResult;
import warden.core.service.auth.RequestAuthenticator;

/**
 * Authenticates websocket text frames.
 *
 * <p>Each frame is parsed as a single JSON document and validated as a structured-frame request. A frame
 * that is blank or is not exactly one JSON document is rejected as malformed. Construction fails if the mode
 * cannot validate frames.
 */
public class WebSocketFrameAuthenticator {

    private static final Logger LOG = Logger.getLogger(WebSocketFrameAuthenticator.class);

    private final RequestAuthenticator<AuthRequest.StructuredFrame> authenticator;
    private final ObjectReader frameReader;

    public WebSocketFrameAuthenticator(AuthMode mode) {
        this(RequestAuthenticator.forFrames(mode), new ObjectMapper());
    }

    public WebSocketFrameAuthenticator(
            RequestAuthenticator<AuthRequest.StructuredFrame> authenticator, ObjectMapper objectMapper) {
        this.authenticator = authenticator;
        this.frameReader = objectMapper.reader().with(DeserializationFeature.FAIL_ON_TRAILING_TOKENS);
    }

    /**
     * Authenticate a raw text frame.
     *
     * @param textFrame frame text as received
     * @return the authentication result
     */
    public AuthResult authenticate(String textFrame) {
        if (textFrame == null || textFrame.isBlank()) {
            return AuthResult.rejected(new AuthFailure.Malformed("Frame is empty"));
        }
        JsonNode frame;
        try {
            frame = frameReader.readTree(textFrame);
        } catch (JsonProcessingException e) {
            LOG.debugv("Frame is not valid JSON: {0}", e.getOriginalMessage());
            return AuthResult.rejected(new AuthFailure.Malformed("Frame is not valid JSON"));
        }
        return authenticate(frame);
    }

    public AuthResult authenticate(JsonNode frame) {
        return authenticator.validate(AuthRequest.from(frame));
    }
}
