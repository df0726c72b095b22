package io.statsheets.season;

import com.fasterxml.jackson.annotation.JsonAnyGetter;
import com.fasterxml.jackson.annotation.JsonAnySetter;
import com.fasterxml.jackson.databind.JsonNode;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;

/**
 * A record with a fixed set of typed fields plus every other key the service sent, kept in arrival order.
 * Typed fields serialize first, then the extra keys. An extra key that collides with a typed field name is dropped,
 * so the typed value always wins.
 */
public abstract class PassthroughRecord {
    private final Map<String, JsonNode> extra = new LinkedHashMap<>();

    /** Wire names of the typed fields. */
    protected abstract Set<String> declaredFields();

    @JsonAnySetter
    public void putExtra(String name, JsonNode value) {
        if (declaredFields().contains(name)) return;
        extra.put(name, value);
    }

    @JsonAnyGetter
    public Map<String, JsonNode> extra() {
        return Collections.unmodifiableMap(extra);
    }

    protected static String required(String value, String field) {
        if (value == null) throw new IllegalArgumentException("missing required field '" + field + "'");
        return value;
    }
}
