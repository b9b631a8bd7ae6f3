package com.sommerph.zkinbox.model.submission;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

public enum SubmissionStatus {

    PENDING,
    REVIEWED,
    ARCHIVED;

    @JsonValue
    public String value() {
        return name().toLowerCase(Locale.ROOT);
    }

    /**
     * @throws IllegalArgumentException for anything but pending, reviewed or archived
     */
    @JsonCreator
    public static SubmissionStatus fromValue(String value) {
        if (value == null) {
            throw new IllegalArgumentException("Invalid status: null");
        }
        for (SubmissionStatus status : values()) {
            if (status.name().equalsIgnoreCase(value.trim())) {
                return status;
            }
        }
        throw new IllegalArgumentException("Invalid status: " + value);
    }

}
