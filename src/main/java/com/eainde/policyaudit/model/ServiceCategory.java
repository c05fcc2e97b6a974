package com.eainde.policyaudit.model;

import java.util.Locale;
import java.util.Optional;

/**
 * Coarse clinical category of a service. Used as the prefix of every service key,
 * so services of different categories are never compared.
 */
public enum ServiceCategory {

    DIALYSIS,
    MATERNITY,
    ONCOLOGY,
    IMAGING,
    SURGERY,
    MENTAL_HEALTH,
    REHABILITATION,
    EMERGENCY,
    OUTPATIENT,
    FACILITY,
    OTHER;

    public String prefix() {
        return name().toLowerCase(Locale.ROOT);
    }

    /** Lenient lookup for hints coming from upstream extractors ("mental health", "Dialysis"). */
    public static Optional<ServiceCategory> fromHint(String hint) {
        if (hint == null || hint.isBlank()) {
            return Optional.empty();
        }
        String normalized = hint.strip().toUpperCase(Locale.ROOT).replaceAll("[\\s-]+", "_");
        for (ServiceCategory category : values()) {
            if (category.name().equals(normalized)) {
                return Optional.of(category);
            }
        }
        return Optional.empty();
    }
}
