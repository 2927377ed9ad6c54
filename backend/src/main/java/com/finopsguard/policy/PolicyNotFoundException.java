package com.finopsguard.policy;

public class PolicyNotFoundException extends RuntimeException {

    private final String policyId;

    public PolicyNotFoundException(String policyId) {
        super("Policy not found: " + policyId);
        this.policyId = policyId;
    }

    public String getPolicyId() {
        return policyId;
    }
}
