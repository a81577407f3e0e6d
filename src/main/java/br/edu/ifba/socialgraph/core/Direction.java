package br.edu.ifba.socialgraph.core;

import java.util.Locale;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Edge direction relative to a node. Accepts the short forms {@code in}/{@code out} too.
 */
public enum Direction {
    OUTGOING("outgoing"),
    INCOMING("incoming"),
    BOTH("both");

    private final String value;

    Direction(String value) {
        this.value = value;
    }

    @JsonValue
    public String getValue() {
        return value;
    }

    public boolean includesOutgoing() {
        return this != INCOMING;
    }

    public boolean includesIncoming() {
        return this != OUTGOING;
    }

    @JsonCreator
    public static Direction fromValue(String value) {
        if (value == null || value.isBlank()) {
            return BOTH;
        }
        switch (value.trim().toLowerCase(Locale.ROOT)) {
            case "out":
            case "outgoing":
                return OUTGOING;
            case "in":
            case "incoming":
                return INCOMING;
            case "both":
                return BOTH;
            default:
                throw new IllegalArgumentException("Direction must be one of outgoing, incoming, both: " + value);
        }
    }
}
