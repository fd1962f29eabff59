package com.mergington.activities.model;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.Objects;

/**
 * Metadata of an uploaded achievement document. The file contents are never kept.
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class Document {

    private String email;
    private String filename;

    @JsonProperty("content_type")
    private String contentType;

    private int score;

    private boolean verified;

    public boolean matches(String email, String filename) {
        return Objects.equals(this.email, email) && Objects.equals(this.filename, filename);
    }

    public Document copy() {
        return toBuilder().build();
    }
}
