package com.dynop.fairway.validation;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;

public final class ConnectionCheck {

    private final String name;
    private final ValidationStatus status;
    private final String details;

    @JsonCreator
    public ConnectionCheck(
            @JsonProperty("name") String name,
            @JsonProperty("status") ValidationStatus status,
            @JsonProperty("details") String details) {
        this.name = name;
        this.status = status;
        this.details = details;
    }

    @JsonProperty("name")
    public String getName() {
        return name;
    }

    @JsonProperty("status")
    public ValidationStatus getStatus() {
        return status;
    }

    @JsonProperty("details")
    public String getDetails() {
        return details;
    }

    @Override
    public String toString() {
        return String.format("ConnectionCheck{name='%s', status=%s, details='%s'}", name, status, details);
    }
}
