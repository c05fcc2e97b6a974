package com.eainde.policyaudit.model;

import java.util.Arrays;
import java.util.Comparator;
import java.util.Objects;

/**
 * Three-level confidence used both for extracted rule fields and for scored findings.
 *
 * <p>Ordered from weakest to strongest so that {@link #weakest(ConfidenceTier...)}
 * can floor a combination of signals.</p>
 */
public enum ConfidenceTier {

    LOW(0.5),
    MEDIUM(0.75),
    HIGH(0.9);

    private final double value;

    ConfidenceTier(double value) {
        this.value = value;
    }

    /** Numeric weight used when averaging two sides of a contradiction. */
    public double value() {
        return value;
    }

    public static ConfidenceTier weakest(ConfidenceTier... tiers) {
        return Arrays.stream(tiers)
                .filter(Objects::nonNull)
                .min(Comparator.naturalOrder())
                .orElse(LOW);
    }
}
