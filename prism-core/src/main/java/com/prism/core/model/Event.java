package com.prism.core.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Immutable behavioural event as stored for a tenant.
 *
 * <p>{@code (tenantId, eventId)} identifies an event; re-ingesting the same pair is absorbed by the store.
 * The property bag holds scalar values (string, number, boolean) or {@code null}.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public final class Event {

    private final String tenantId;
    private final String eventId;
    private final String eventName;
    private final Instant timestamp;
    private final String userId;
    private final String sessionId;
    private final Map<String, Object> properties;

    private Event(Builder b) {
        this.tenantId = Objects.requireNonNull(b.tenantId, "tenantId");
        this.eventId = Objects.requireNonNull(b.eventId, "eventId");
        this.eventName = Objects.requireNonNull(b.eventName, "eventName");
        this.timestamp = Objects.requireNonNull(b.timestamp, "timestamp");
        this.userId = b.userId;
        this.sessionId = b.sessionId;
        this.properties = b.properties == null
                ? Map.of()
                : Collections.unmodifiableMap(new LinkedHashMap<>(b.properties));
    }

    public static Builder builder() {
        return new Builder();
    }

    public String tenantId() {
        return tenantId;
    }

    public String eventId() {
        return eventId;
    }

    public String eventName() {
        return eventName;
    }

    public Instant timestamp() {
        return timestamp;
    }

    public String userId() {
        return userId;
    }

    public String sessionId() {
        return sessionId;
    }

    public Map<String, Object> properties() {
        return properties;
    }

    /** Raw property value, {@code null} when absent or explicitly null. */
    public Object property(String name) {
        return name == null ? null : properties.get(name);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Event other)) return false;
        return tenantId.equals(other.tenantId) && eventId.equals(other.eventId);
    }

    @Override
    public int hashCode() {
        return Objects.hash(tenantId, eventId);
    }

    @Override
    public String toString() {
        return "Event{" + tenantId + "/" + eventId + " " + eventName + " @" + timestamp + "}";
    }

    public static final class Builder {
        private String tenantId;
        private String eventId;
        private String eventName;
        private Instant timestamp;
        private String userId;
        private String sessionId;
        private Map<String, Object> properties;

        private Builder() {}

        public Builder tenantId(String tenantId) {
            this.tenantId = tenantId;
            return this;
        }

        public Builder eventId(String eventId) {
            this.eventId = eventId;
            return this;
        }

        public Builder eventName(String eventName) {
            this.eventName = eventName;
            return this;
        }

        public Builder timestamp(Instant timestamp) {
            this.timestamp = timestamp;
            return this;
        }

        public Builder userId(String userId) {
            this.userId = userId;
            return this;
        }

        public Builder sessionId(String sessionId) {
            this.sessionId = sessionId;
            return this;
        }

        public Builder properties(Map<String, Object> properties) {
            this.properties = properties;
            return this;
        }

        public Builder property(String name, Object value) {
            if (this.properties == null) {
                this.properties = new LinkedHashMap<>();
            }
            this.properties.put(name, value);
            return this;
        }

        public Event build() {
            return new Event(this);
        }
    }
}
