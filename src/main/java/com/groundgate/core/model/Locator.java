package com.groundgate.core.model;

import java.io.Serializable;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;

/**
 * Structured view of a locator string.
 * <p>
 * Locators are written as {@code key:value} segments separated by {@code ;}, for example
 * {@code section:Results;page:5} or {@code url:https://example.org/a}. Only the first colon
 * of a segment separates key from value. Segments without a colon are ignored.
 */
public record Locator(String raw, Map<String, String> fields) implements Serializable {

    public Locator {
        fields = fields == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(fields));
    }

    public static Locator parse(String raw) {
        if (raw == null || raw.isBlank()) {
            return new Locator(raw == null ? "" : raw, Map.of());
        }
        var fields = new LinkedHashMap<String, String>();
        for (String segment : raw.split(";")) {
            int colon = segment.indexOf(':');
            if (colon <= 0) continue;
            String key = segment.substring(0, colon).trim().toLowerCase(Locale.ROOT);
            String value = segment.substring(colon + 1).trim();
            if (!key.isEmpty() && !value.isEmpty()) {
                fields.putIfAbsent(key, value);
            }
        }
        return new Locator(raw, fields);
    }

    public boolean has(String key) {
        return key != null && fields.containsKey(key.toLowerCase(Locale.ROOT));
    }

    public String section() {
        return fields.get("section");
    }

    public String page() {
        return fields.get("page");
    }
}
