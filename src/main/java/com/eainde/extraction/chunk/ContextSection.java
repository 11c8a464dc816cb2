package com.eainde.extraction.chunk;

/**
 * Document sections sampled into a condensed context, with the share of the
 * remaining token budget each one receives. Weights sum to 1.0.
 */
public enum ContextSection {

    ELIGIBILITY("eligibility", "ELIGIBILITY CRITERIA", 0.30),
    FINANCIAL("financial", "FINANCIAL REQUIREMENTS", 0.25),
    TIMELINE("timeline", "KEY DATES & TIMELINE", 0.15),
    SCOPE_OF_WORK("scope_of_work", "SCOPE OF WORK", 0.15),
    TERMS_CONDITIONS("terms_conditions", "TERMS & CONDITIONS", 0.15);

    private final String key;
    private final String title;
    private final double weight;

    ContextSection(String key, String title, double weight) {
        this.key = key;
        this.title = title;
        this.weight = weight;
    }

    public String key() {
        return key;
    }

    public String title() {
        return title;
    }

    public double weight() {
        return weight;
    }
}
