package com.texflow.core.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Arrays;
import java.util.Locale;
import java.util.Optional;

/**
 * LaTeX engine requested for, or used by, a compile job.
 * {@link #AUTO} is only valid as a request; it is resolved before invocation.
 */
public enum Engine {
    AUTO("auto", null),
    PDFLATEX("pdflatex", "-pdf"),
    XELATEX("xelatex", "-xelatex"),
    LUALATEX("lualatex", "-lualatex"),
    LATEX("latex", "-pdfdvi");

    private final String wireName;
    private final String latexmkFlag;

    Engine(String wireName, String latexmkFlag) {
        this.wireName = wireName;
        this.latexmkFlag = latexmkFlag;
    }

    @JsonValue
    public String wireName() {
        return wireName;
    }

    /** latexmk switch selecting this engine; null for {@link #AUTO}. */
    public String latexmkFlag() {
        return latexmkFlag;
    }

    public static Optional<Engine> fromName(String name) {
        if (name == null) {
            return Optional.empty();
        }
        String normalized = name.trim().toLowerCase(Locale.ROOT);
        return Arrays.stream(values())
                .filter(e -> e.wireName.equals(normalized))
                .findFirst();
    }

    @JsonCreator
    static Engine fromJson(String name) {
        return fromName(name).orElseThrow(() ->
                new IllegalArgumentException("Unknown engine: " + name));
    }
}
