package com.sportsarchive.scraper;

import com.fasterxml.jackson.annotation.JsonValue;

public enum IssueType {
    WARNING("warning"),
    ERROR("error");

    private final String label;

    IssueType(String label) {
        this.label = label;
    }

    @JsonValue
    public String label() {
        return label;
    }
}
