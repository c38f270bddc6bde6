package com.guardianplatform.common.exception;

public class PolicyNotFoundException extends GuardianException {
    private final String policyName;

    public PolicyNotFoundException(String policyName) {
        super("PolicyRegistry", "Policy '" + policyName + "' not found");
        this.policyName = policyName;
    }

    public String getPolicyName() {
        return policyName;
    }
}
