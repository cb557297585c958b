package com.planwatch.core.model;

import java.util.Locale;

/**
 * Finding severity with its fixed display color. Anything the engine sends that is
 * not one of the five known labels maps to {@link #UNKNOWN}.
 */
public enum Severity {
    CRITICAL("red"),
    HIGH("orange"),
    MEDIUM("yellow"),
    LOW("blue"),
    INFO("cyan"),
    UNKNOWN("white");

    private final String color;

    Severity(String color) {
        this.color = color;
    }

    public String color() {
        return color;
    }

    public static Severity fromLabel(String label) {
        if (label == null || label.isBlank()) {
            return UNKNOWN;
        }
        try {
            return valueOf(label.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            return UNKNOWN;
        }
    }
}
