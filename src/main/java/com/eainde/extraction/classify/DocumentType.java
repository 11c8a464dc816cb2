package com.eainde.extraction.classify;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Procurement portal a tender was published on. Selects the prompt variant and
 * the completeness rules used downstream.
 */
public enum DocumentType {

    GEM("GeM"),
    CPPP("CPPP"),
    GENERIC("Generic");

    private final String label;

    DocumentType(String label) {
        this.label = label;
    }

    @JsonValue
    public String label() {
        return label;
    }

    /**
     * Resolves a portal label such as {@code "GeM"}; unknown or blank labels map to {@link #GENERIC}.
     */
    public static DocumentType fromLabel(String label) {
        if (label == null) return GENERIC;
        for (DocumentType type : values()) {
            if (type.label.equalsIgnoreCase(label.strip()) || type.name().equalsIgnoreCase(label.strip())) {
                return type;
            }
        }
        return GENERIC;
    }
}
