package com.mergington.activities.exception;

import java.util.List;

public class InvalidSortFieldException extends RuntimeException {

    private final String value;
    private final List<String> permitted;

    public InvalidSortFieldException(String value, String... permitted) {
        super("Invalid sort_by '" + value + "'");
        this.value = value;
        this.permitted = List.of(permitted);
    }

    public String getValue() {
        return value;
    }

    public List<String> getPermitted() {
        return permitted;
    }
}
