package br.edu.ifba.socialgraph.core;

import java.util.Locale;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Kinds of nodes stored in the graph.
 *
 * <p>{@link #CATEGORY} only comes from the encyclopedic source and is never expanded.</p>
 */
public enum EntityType {
    USER("user"),
    REPO("repo"),
    COMMUNITY("community"),
    PAGE("page"),
    CATEGORY("category");

    private final String value;

    EntityType(String value) {
        this.value = value;
    }

    @JsonValue
    public String getValue() {
        return value;
    }

    @JsonCreator
    public static EntityType fromValue(String value) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException("Entity type must not be blank");
        }
        String normalized = value.trim().toLowerCase(Locale.ROOT);
        for (EntityType type : values()) {
            if (type.value.equals(normalized)) {
                return type;
            }
        }
        throw new IllegalArgumentException("Unsupported entity type: " + value);
    }
}
