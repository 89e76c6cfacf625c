package com.texflow.core.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/**
 * One diagnostic extracted from a compiler transcript.
 * A {@code line} of 0 means the line could not be determined.
 */
public record ParsedLogEntry(Type type, String file, int line, String message) {

    public enum Type {
        ERROR, WARNING, INFO;

        @JsonValue
        public String wireName() {
            return name().toLowerCase(Locale.ROOT);
        }

        @JsonCreator
        static Type fromJson(String value) {
            return valueOf(value.toUpperCase(Locale.ROOT));
        }
    }

    public static ParsedLogEntry error(String file, int line, String message) {
        return new ParsedLogEntry(Type.ERROR, file, line, message);
    }

    public static ParsedLogEntry warning(String file, int line, String message) {
        return new ParsedLogEntry(Type.WARNING, file, line, message);
    }

    public static ParsedLogEntry info(String file, int line, String message) {
        return new ParsedLogEntry(Type.INFO, file, line, message);
    }

    public boolean isError() {
        return type == Type.ERROR;
    }
}
