package com.example.payanalyzer.domain.model;

import java.util.Locale;

/**
 * Service an invoice line was paid for.
 */
public enum ServiceType {
    STANDARD("Standard"),
    MULTIDROP("Multidrop"),
    SMALL_VAN("Small Van"),
    LWB_TRANSIT("LWB Transit"),
    PICKUP("Pickup Service"),
    EXTRA_DROP("Extra Drop");

    private final String label;

    ServiceType(String label) {
        this.label = label;
    }

    public String getLabel() {
        return label;
    }

    /**
     * Derives the service from free text, first keyword wins.
     *
     * @param description invoice line description, may be {@code null}
     * @return matching service or {@link #STANDARD}
     */
    public static ServiceType fromDescription(String description) {
        if (description == null) {
            return STANDARD;
        }
        String lower = description.toLowerCase(Locale.ROOT);
        if (lower.contains("multidrop")) {
            return MULTIDROP;
        }
        if (lower.contains("small van")) {
            return SMALL_VAN;
        }
        if (lower.contains("lwb transit")) {
            return LWB_TRANSIT;
        }
        if (lower.contains("pickup")) {
            return PICKUP;
        }
        if (lower.contains("extra drop")) {
            return EXTRA_DROP;
        }
        return STANDARD;
    }
}
