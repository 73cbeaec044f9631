package com.astrova.location.domain.model;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Origin of a location candidate. The rank decides which candidate survives
 * when two sources report the same place.
 */
public enum LocationSource {
    LOCAL("local", 1),
    EXTERNAL("external", 2);

    private final String label;
    private final int rank;

    LocationSource(String label, int rank) {
        this.label = label;
        this.rank = rank;
    }

    @JsonValue
    public String getLabel() {
        return label;
    }

    public int getRank() {
        return rank;
    }

    public boolean outranks(LocationSource other) {
        return rank > other.rank;
    }
}
