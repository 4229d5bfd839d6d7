package com.example.roster.catalog;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Locale;

/**
 * 雇用区分。週あたりの上限時間はこの区分で決まる。
 */
public enum EmploymentClass {
    FULL_TIME("Full-Time"),
    PART_TIME("Part-Time"),
    CASUAL("Casual");

    private static final Logger logger = LoggerFactory.getLogger(EmploymentClass.class);

    private final String label;

    EmploymentClass(String label) {
        this.label = label;
    }

    public String getLabel() {
        return label;
    }

    /**
     * Accepts the loose spellings found in uploaded staff lists ("Part time", "parttime", "CASUAL").
     * Anything unrecognised is treated as full-time.
     */
    public static EmploymentClass fromText(String text) {
        if (text == null || text.isBlank()) {
            return FULL_TIME;
        }
        String normalized = text.trim().toLowerCase(Locale.ROOT).replace("-", "").replace("_", "").replace(" ", "");
        if (normalized.contains("parttime")) {
            return PART_TIME;
        }
        if (normalized.contains("casual")) {
            return CASUAL;
        }
        if (!normalized.contains("fulltime")) {
            logger.warn("Unknown employment class '{}', falling back to {}", text, FULL_TIME.label);
        }
        return FULL_TIME;
    }
}
