package dev.pagegraph.domain.enums;

import com.fasterxml.jackson.annotation.JsonValue;

public enum IngestStatus {
    QUEUED("Queued"), THROTTLED("Throttled"), REJECTED("Rejected");

    private final String wireName;

    IngestStatus(String wireName) {
        this.wireName = wireName;
    }

    @JsonValue
    public String wireName() {
        return wireName;
    }
}
