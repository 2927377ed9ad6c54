package com.finopsguard.domain.model;

import java.util.Locale;

/**
 * Infrastructure-as-Code formats understood by the parser dispatch.
 */
public enum IacFormat {
    TERRAFORM("terraform"),
    ANSIBLE("ansible");

    private final String value;

    IacFormat(String value) {
        this.value = value;
    }

    public String getValue() {
        return value;
    }

    public static IacFormat fromValue(String value) {
        if (value == null) {
            throw new IllegalArgumentException("IaC format must not be null");
        }
        return switch (value.trim().toLowerCase(Locale.ROOT)) {
            case "terraform", "tf", "hcl" -> TERRAFORM;
            case "ansible", "yaml", "yml" -> ANSIBLE;
            default -> throw new IllegalArgumentException("Unsupported IaC format: " + value);
        };
    }
}
