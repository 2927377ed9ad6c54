package com.finopsguard.pricing;

import com.finopsguard.domain.model.PricingConfidence;

/**
 * Where a price quote came from. Each source implies a confidence level.
 */
public enum PriceSourceType {
    LIVE("live", PricingConfidence.HIGH),
    STATIC("static", PricingConfidence.MEDIUM),
    DEFAULT("default", PricingConfidence.LOW);

    private final String value;
    private final PricingConfidence confidence;

    PriceSourceType(String value, PricingConfidence confidence) {
        this.value = value;
        this.confidence = confidence;
    }

    public String getValue() {
        return value;
    }

    public PricingConfidence getConfidence() {
        return confidence;
    }
}
