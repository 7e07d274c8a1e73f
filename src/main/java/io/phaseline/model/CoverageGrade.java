package io.phaseline.model;

import java.util.Locale;

public enum CoverageGrade {
    NONE,
    LOW,
    MED,
    HIGH;

    public static CoverageGrade parse(String raw) {
        if (raw == null || raw.isBlank()) {
            throw new IllegalArgumentException("Coverage grade is required");
        }
        try {
            return valueOf(raw.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("Unknown coverage grade: " + raw + " (expected NONE|LOW|MED|HIGH)");
        }
    }
}
