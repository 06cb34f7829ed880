package rc.core.normalize;

import com.fasterxml.jackson.databind.JsonNode;

/**
 * Parsed JSON: object, array, string, number, boolean or null, nested to any depth.
 */
public record JsonBody(JsonNode value) implements CanonicalBody {

    public JsonBody {
        if (value == null) throw new IllegalArgumentException("value cannot be null");
    }

    @Override
    public Kind kind() {
        return Kind.JSON;
    }
}
