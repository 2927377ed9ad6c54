package com.finopsguard.domain.model;

import java.util.Locale;

/**
 * Supported cloud providers.
 *
 * Each provider has its own IaC type prefixes, region naming and pricing APIs.
 * The fallback region is used when neither the resource nor the provider
 * declaration names one.
 */
public enum CloudProvider {
    AWS("aws", "Amazon Web Services", "us-east-1"),
    GCP("gcp", "Google Cloud Platform", "us-central1"),
    AZURE("azure", "Microsoft Azure", "eastus");

    private final String code;
    private final String displayName;
    private final String fallbackRegion;

    CloudProvider(String code, String displayName, String fallbackRegion) {
        this.code = code;
        this.displayName = displayName;
        this.fallbackRegion = fallbackRegion;
    }

    public String getCode() {
        return code;
    }

    public String getDisplayName() {
        return displayName;
    }

    public String getFallbackRegion() {
        return fallbackRegion;
    }

    /**
     * Resolve a provider from its short code. "google" and "azurerm" are accepted
     * as aliases because that is how Terraform names the providers.
     */
    public static CloudProvider fromCode(String code) {
        if (code == null) {
            throw new IllegalArgumentException("Cloud provider must not be null");
        }
        return switch (code.trim().toLowerCase(Locale.ROOT)) {
            case "aws" -> AWS;
            case "gcp", "google" -> GCP;
            case "azure", "azurerm" -> AZURE;
            default -> throw new IllegalArgumentException("Unknown cloud provider: " + code);
        };
    }
}
