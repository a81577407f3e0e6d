package br.edu.ifba.socialgraph.core;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/**
 * Lifecycle of a crawl job.
 *
 * <pre>
 * PENDING -&gt; RUNNING -&gt; COMPLETED | FAILED | CANCELLED
 * </pre>
 */
public enum CrawlStatus {
    PENDING("pending"),
    RUNNING("running"),
    COMPLETED("completed"),
    FAILED("failed"),
    CANCELLED("cancelled");

    private final String value;

    CrawlStatus(String value) {
        this.value = value;
    }

    @JsonValue
    public String getValue() {
        return value;
    }

    public boolean isTerminal() {
        return this == COMPLETED || this == FAILED || this == CANCELLED;
    }

    @JsonCreator
    public static CrawlStatus fromValue(String value) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException("Status must not be blank");
        }
        String normalized = value.trim().toLowerCase(Locale.ROOT);
        for (CrawlStatus status : values()) {
            if (status.value.equals(normalized)) {
                return status;
            }
        }
        throw new IllegalArgumentException("Unknown crawl status: " + value);
    }
}
