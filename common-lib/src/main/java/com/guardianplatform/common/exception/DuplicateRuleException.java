package com.guardianplatform.common.exception;

public class DuplicateRuleException extends GuardianException {

    public DuplicateRuleException(String policyName, String ruleName) {
        super("PolicyRegistry", "Rule '" + ruleName + "' already exists in policy '" + policyName + "'");
    }
}
