package com.guardianplatform.common.policy;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertEquals;

class ViolationKindTest {

    @Test
    @DisplayName("budget and cost keywords → BUDGET_EXCEEDED")
    void budget() {
        assertEquals(ViolationKind.BUDGET_EXCEEDED, ViolationKind.infer("Monthly budget exhausted"));
        assertEquals(ViolationKind.BUDGET_EXCEEDED, ViolationKind.infer("COST too high"));
    }

    @Test
    @DisplayName("threshold and limit keywords → THRESHOLD_EXCEEDED")
    void threshold() {
        assertEquals(ViolationKind.THRESHOLD_EXCEEDED,
            ViolationKind.infer("Senior users limited to $50,000 transfers"));
        assertEquals(ViolationKind.THRESHOLD_EXCEEDED, ViolationKind.infer("Threshold crossed"));
    }

    @Test
    @DisplayName("budget wins over limit, limit wins over approval")
    void precedence() {
        assertEquals(ViolationKind.BUDGET_EXCEEDED, ViolationKind.infer("budget limit reached"));
        assertEquals(ViolationKind.THRESHOLD_EXCEEDED,
            ViolationKind.infer("Clear domain auto-approval limit is $100,000"));
    }

    @Test
    @DisplayName("approval and authorization keywords → APPROVAL_REQUIRED")
    void approval() {
        assertEquals(ViolationKind.APPROVAL_REQUIRED,
            ViolationKind.infer("High-risk actions require human approval"));
        assertEquals(ViolationKind.APPROVAL_REQUIRED, ViolationKind.infer("Missing authorization"));
    }

    @Test
    @DisplayName("no keyword, blank or null → UNCLASSIFIED")
    void unclassified() {
        assertEquals(ViolationKind.UNCLASSIFIED,
            ViolationKind.infer("Junior users cannot transfer more than $1,000"));
        assertEquals(ViolationKind.UNCLASSIFIED, ViolationKind.infer(" "));
        assertEquals(ViolationKind.UNCLASSIFIED, ViolationKind.infer(null));
    }
}
