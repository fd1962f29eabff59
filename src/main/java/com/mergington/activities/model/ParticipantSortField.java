package com.mergington.activities.model;

import com.mergington.activities.exception.InvalidSortFieldException;

import java.util.Arrays;

public enum ParticipantSortField {
    NAME("name"),
    SCORE("score");

    private final String value;

    ParticipantSortField(String value) {
        this.value = value;
    }

    public static ParticipantSortField fromValue(String value) {
        return Arrays.stream(values())
                .filter(field -> field.value.equals(value))
                .findFirst()
                .orElseThrow(() -> new InvalidSortFieldException(value, "name", "score"));
    }
}
