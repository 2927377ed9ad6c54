package com.finopsguard.domain.model;

import java.util.Collection;

/**
 * Qualitative trust level of a price quote, derived from its source.
 *
 * Declared worst first so that ordinal comparison gives low < medium < high.
 */
public enum PricingConfidence {
    LOW("low"),
    MEDIUM("medium"),
    HIGH("high");

    private final String value;

    PricingConfidence(String value) {
        this.value = value;
    }

    public String getValue() {
        return value;
    }

    public PricingConfidence worst(PricingConfidence other) {
        return other != null && other.ordinal() < ordinal() ? other : this;
    }

    /**
     * Worst confidence of a collection. An empty collection has nothing that
     * lowers trust, so it reports HIGH.
     */
    public static PricingConfidence worstOf(Collection<PricingConfidence> confidences) {
        PricingConfidence result = HIGH;
        for (PricingConfidence confidence : confidences) {
            result = result.worst(confidence);
        }
        return result;
    }
}
