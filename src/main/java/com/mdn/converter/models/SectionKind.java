package com.mdn.converter.models;

/**
 * Section kinds in the order they must appear in a document.
 * UNKNOWN sections are carried through verbatim and are not order-checked.
 */
public enum SectionKind {
    HEADER("YAML", true),
    SHEET("CSV", true),
    FORMULAS("JSON", true),
    FORMAT("JSON", false),
    AI_PROMPT(null, false),
    UNKNOWN(null, false);

    private final String defaultFormat;
    private final boolean required;

    SectionKind(String defaultFormat, boolean required) {
        this.defaultFormat = defaultFormat;
        this.required = required;
    }

    public String getDefaultFormat() {
        return defaultFormat;
    }

    public boolean isRequired() {
        return required;
    }

    /**
     * Only SHEET may repeat.
     */
    public boolean isRepeatable() {
        return this == SHEET || this == UNKNOWN;
    }

    public static SectionKind fromToken(String token) {
        for (SectionKind kind : values()) {
            if (kind != UNKNOWN && kind.name().equals(token)) {
                return kind;
            }
        }
        return UNKNOWN;
    }
}
