/*
 * Copyright Ferryman Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */

package io.ferryman.session;

import java.nio.charset.Charset;
import java.nio.charset.StandardCharsets;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Negotiated client capabilities. The well known keys are exposed as accessors; anything else
 * a protocol negotiates is carried along untouched.
 */
public final class Capabilities {

    public static final String ENCODING = "encoding";
    public static final String ANSI = "ansi";
    public static final String SCREEN_WIDTH = "screenWidth";

    public static final int DEFAULT_SCREEN_WIDTH = 78;

    private final Map<String, String> values;

    private Capabilities(Map<String, String> values) {
        this.values = Map.copyOf(values);
    }

    public static Capabilities of(Map<String, String> values) {
        return new Capabilities(Objects.requireNonNull(values, "values"));
    }

    public static Capabilities of(Charset encoding, boolean ansi, int screenWidth) {
        Map<String, String> values = new LinkedHashMap<>();
        values.put(ENCODING, encoding.name());
        values.put(ANSI, Boolean.toString(ansi));
        values.put(SCREEN_WIDTH, Integer.toString(screenWidth));
        return new Capabilities(values);
    }

    public Charset encoding() {
        String name = values.get(ENCODING);
        if (name == null) {
            return StandardCharsets.UTF_8;
        }
        try {
            return Charset.forName(name);
        }
        catch (IllegalArgumentException e) {
            return StandardCharsets.UTF_8;
        }
    }

    public boolean ansi() {
        return Boolean.parseBoolean(values.get(ANSI));
    }

    public int screenWidth() {
        String width = values.get(SCREEN_WIDTH);
        if (width == null) {
            return DEFAULT_SCREEN_WIDTH;
        }
        try {
            return Integer.parseInt(width);
        }
        catch (NumberFormatException e) {
            return DEFAULT_SCREEN_WIDTH;
        }
    }

    /**
     * @param updates entries to add or replace
     * @return a copy with {@code updates} applied
     */
    public Capabilities merge(Map<String, String> updates) {
        if (updates.isEmpty()) {
            return this;
        }
        Map<String, String> merged = new LinkedHashMap<>(values);
        merged.putAll(updates);
        return new Capabilities(merged);
    }

    public Map<String, String> asMap() {
        return values;
    }

    @Override
    public boolean equals(Object o) {
        return o instanceof Capabilities other && values.equals(other.values);
    }

    @Override
    public int hashCode() {
        return values.hashCode();
    }

    @Override
    public String toString() {
        return "Capabilities" + values;
    }
}
