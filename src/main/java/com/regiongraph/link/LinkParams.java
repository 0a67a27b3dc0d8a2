package com.regiongraph.link;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.StreamReadFeature;
import com.fasterxml.jackson.core.json.JsonReadFeature;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.json.JsonMapper;
import com.regiongraph.api.LinkConfigurationException;
import com.regiongraph.api.LinkConfigurationException.Reason;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Parsed parameter string of a built-in link policy.
 *
 * The string is a JSON object. Single quotes and unquoted field names are
 * accepted, so both {@code {"mapping": "in", "rfSize": [2]}} and
 * {@code {mapping: 'in', rfSize: [2]}} parse. An empty or blank string means
 * "no parameters".
 *
 * The whole string must be one object: trailing content and repeated keys
 * are errors. Every failure (bad syntax, non-object, unknown key, wrong value
 * shape) is reported as {@link LinkConfigurationException} with reason INVALID_PARAMS.
 */
public final class LinkParams {
    private static final ObjectMapper MAPPER = JsonMapper.builder()
            .enable(JsonReadFeature.ALLOW_SINGLE_QUOTES)
            .enable(JsonReadFeature.ALLOW_UNQUOTED_FIELD_NAMES)
            .enable(StreamReadFeature.STRICT_DUPLICATE_DETECTION)
            .enable(DeserializationFeature.FAIL_ON_TRAILING_TOKENS)
            .build();
    private static final TypeReference<Map<String, Object>> MAP_TYPE = new TypeReference<>() {
    };

    private final String linkType;
    private final Map<String, Object> values;

    private LinkParams(String linkType, Map<String, Object> values) {
        this.linkType = linkType;
        this.values = values;
    }

    /**
     * Parses {@code raw} for the policy {@code linkType}, rejecting any key not
     * in {@code allowedKeys}.
     */
    public static LinkParams parse(String linkType, String raw, Set<String> allowedKeys) {
        if (raw == null || raw.isBlank())
            return new LinkParams(linkType, Collections.emptyMap());

        Map<String, Object> parsed;
        try {
            parsed = MAPPER.readValue(raw, MAP_TYPE);
        } catch (JsonProcessingException e) {
            throw new LinkConfigurationException(Reason.INVALID_PARAMS,
                    "Cannot parse parameters for link type " + linkType + ": '" + raw + "'", e);
        }
        if (parsed == null)
            throw invalid(linkType, "parameters must be a JSON object, got '" + raw + "'");
        for (String key : parsed.keySet()) {
            if (!allowedKeys.contains(key))
                throw invalid(linkType, "unknown parameter '" + key + "' (allowed: " + allowedKeys + ")");
        }
        return new LinkParams(linkType, parsed);
    }

    public boolean isEmpty() {
        return values.isEmpty();
    }

    public String getString(String key, String def) {
        Object v = values.get(key);
        if (v == null)
            return def;
        if (!(v instanceof String s))
            throw invalid(linkType, "parameter '" + key + "' must be a string, got " + v);
        return s;
    }

    public boolean getBoolean(String key, boolean def) {
        Object v = values.get(key);
        if (v == null)
            return def;
        if (!(v instanceof Boolean b))
            throw invalid(linkType, "parameter '" + key + "' must be a boolean, got " + v);
        return b;
    }

    /**
     * Reads a list of positive integers. A bare integer is accepted as a list
     * of one.
     */
    public int[] getPositiveInts(String key, int[] def) {
        Object v = values.get(key);
        if (v == null)
            return def.clone();
        List<?> raw = v instanceof List<?> list ? list : List.of(v);
        if (raw.isEmpty())
            throw invalid(linkType, "parameter '" + key + "' must not be empty");
        List<Integer> out = new ArrayList<>(raw.size());
        for (Object o : raw) {
            if (!(o instanceof Integer i) || i <= 0)
                throw invalid(linkType, "parameter '" + key + "' must hold positive integers, got " + v);
            out.add(i);
        }
        return out.stream().mapToInt(Integer::intValue).toArray();
    }

    static LinkConfigurationException invalid(String linkType, String detail) {
        return new LinkConfigurationException(Reason.INVALID_PARAMS,
                "Invalid parameters for link type " + linkType + ": " + detail);
    }
}
