package io.github.jakubt4.hawkeye.service.command;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/** Why a command failed. */
public enum CommandError {
    VALIDATION,
    PRECONDITION;

    @JsonValue
    public String wireName() {
        return name().toLowerCase(Locale.ROOT);
    }
}
