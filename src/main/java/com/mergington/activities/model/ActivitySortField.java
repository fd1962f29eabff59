package com.mergington.activities.model;

import com.mergington.activities.exception.InvalidSortFieldException;

import java.util.Arrays;

public enum ActivitySortField {
    NAME("name"),
    PARTICIPANTS("participants"),
    SCORE("score");

    private final String value;

    ActivitySortField(String value) {
        this.value = value;
    }

    public static ActivitySortField fromValue(String value) {
        return Arrays.stream(values())
                .filter(field -> field.value.equals(value))
                .findFirst()
                .orElseThrow(() -> new InvalidSortFieldException(value, "name", "participants", "score"));
    }
}
