package com.guardianplatform.common.exception;

public class RuleNotFoundException extends GuardianException {

    public RuleNotFoundException(String policyName, String ruleName) {
        super("PolicyRegistry", "Rule '" + ruleName + "' not found in policy '" + policyName + "'");
    }
}
