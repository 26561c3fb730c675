package warden.core.service.auth;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;

/**
 * Serializes a JSON payload deterministically for signing.
 *
 * <p>Object members are ordered by name (UTF-16 code unit order) at every depth and the output is compact
 * JSON with no insignificant whitespace, so {@code {"b":1,"a":[{"d":2,"c":3}]}} always becomes
 * {@code {"a":[{"c":3,"d":2}],"b":1}}.
 */
public class PayloadCanonicalizer {

    private final ObjectMapper objectMapper;

    public PayloadCanonicalizer() {
        this(new ObjectMapper());
    }

    public PayloadCanonicalizer(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    public String canonicalize(JsonNode payload) {
        try {
            return objectMapper.writeValueAsString(sorted(payload));
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to serialize payload: " + e.getOriginalMessage(), e);
        }
    }

    private JsonNode sorted(JsonNode node) {
        if (node.isObject()) {
            List<String> names = new ArrayList<>();
            node.fieldNames().forEachRemaining(names::add);
            Collections.sort(names);

            ObjectNode copy = objectMapper.createObjectNode();
            for (String name : names) {
                copy.set(name, sorted(node.get(name)));
            }
            return copy;
        }
        if (node.isArray()) {
            ArrayNode copy = objectMapper.createArrayNode();
            for (JsonNode element : node) {
                copy.add(sorted(element));
            }
            return copy;
        }
        return node;
    }
}
