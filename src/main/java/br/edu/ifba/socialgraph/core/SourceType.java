package br.edu.ifba.socialgraph.core;

import java.util.Locale;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * External networks the crawler knows how to walk.
 */
public enum SourceType {
    GITHUB("github"),
    REDDIT("reddit"),
    WIKIPEDIA("wikipedia");

    private final String value;

    SourceType(String value) {
        this.value = value;
    }

    @JsonValue
    public String getValue() {
        return value;
    }

    @JsonCreator
    public static SourceType fromValue(String value) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException("Source must not be blank");
        }
        String normalized = value.trim().toLowerCase(Locale.ROOT);
        for (SourceType source : values()) {
            if (source.value.equals(normalized)) {
                return source;
            }
        }
        throw new IllegalArgumentException("Unsupported source: " + value);
    }
}
