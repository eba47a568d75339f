package com.tournamenttables.allocation;

import java.util.Objects;

public record CompetitorSnapshot(
        String id,
        String name,
        int score
) {
    public CompetitorSnapshot {
        Objects.requireNonNull(id, "id");
        Objects.requireNonNull(name, "name");
    }

    /**
     * Label used in reason strings and conflict messages.
     */
    public String label() {
        return name + " (" + id + ")";
    }
}
