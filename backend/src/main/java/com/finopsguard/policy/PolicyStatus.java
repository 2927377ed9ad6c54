package com.finopsguard.policy;

public enum PolicyStatus {
    PASS("pass"),
    FAIL("fail");

    private final String value;

    PolicyStatus(String value) {
        this.value = value;
    }

    public String getValue() {
        return value;
    }
}
