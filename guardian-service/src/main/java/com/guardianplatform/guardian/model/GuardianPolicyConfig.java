package com.guardianplatform.guardian.model;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.guardianplatform.common.exception.PolicyConfigurationException;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Contextual policy settings applied by the guardian check on top of the rule engine.
 *
 * <p>Thresholds and limits are looked up by Cynefin domain, case-insensitively. The
 * {@code user*} overrides win over the per-domain tables, which win over the defaults.
 * Fields omitted from a deserialized body take their default.
 *
 * @param confidenceThresholds  per-domain minimum domain confidence
 * @param financialLimits       per-domain auto-approval amount limit
 * @param confidenceThreshold   threshold for domains missing from the table
 * @param autoApprovalLimit     limit for domains missing from the table
 * @param currency              currency the limits are expressed in
 * @param userConfidenceThreshold operator override, {@code null} when unset
 * @param userFinancialLimit    operator override, {@code null} when unset
 * @param maxReflectionAttempts repair rounds before escalation
 * @param alwaysEscalate        action types that always need a human
 * @param riskWeights           weights reported to clients for decomposed risk scoring
 * @param strictMode            promotes high-severity violations to critical (rejection)
 * @param policiesEnabled       when false no contextual checks run
 */
public record GuardianPolicyConfig(
    @JsonProperty("confidenceThresholds")    Map<String, Double> confidenceThresholds,
    @JsonProperty("financialLimits")         Map<String, Double> financialLimits,
    @JsonProperty("confidenceThreshold")     Double              confidenceThreshold,
    @JsonProperty("autoApprovalLimit")       Double              autoApprovalLimit,
    @JsonProperty("currency")                String              currency,
    @JsonProperty("userConfidenceThreshold") Double              userConfidenceThreshold,
    @JsonProperty("userFinancialLimit")      Double              userFinancialLimit,
    @JsonProperty("maxReflectionAttempts")   Integer             maxReflectionAttempts,
    @JsonProperty("alwaysEscalate")          List<String>        alwaysEscalate,
    @JsonProperty("riskWeights")             Map<String, Double> riskWeights,
    @JsonProperty("strictMode")              Boolean             strictMode,
    @JsonProperty("policiesEnabled")         Boolean             policiesEnabled
) {
    public static final List<String> DEFAULT_ALWAYS_ESCALATE =
        List.of("delete_data", "modify_policy", "production_deployment");
    public static final double DEFAULT_CONFIDENCE_THRESHOLD = 0.85;
    public static final double DEFAULT_AUTO_APPROVAL_LIMIT = 100_000.0;
    public static final int DEFAULT_MAX_REFLECTION_ATTEMPTS = 2;

    public GuardianPolicyConfig {
        confidenceThreshold = confidenceThreshold == null ? DEFAULT_CONFIDENCE_THRESHOLD : confidenceThreshold;
        autoApprovalLimit = autoApprovalLimit == null ? DEFAULT_AUTO_APPROVAL_LIMIT : autoApprovalLimit;
        maxReflectionAttempts = maxReflectionAttempts == null ? DEFAULT_MAX_REFLECTION_ATTEMPTS : maxReflectionAttempts;
        strictMode = strictMode != null && strictMode;
        policiesEnabled = policiesEnabled == null || policiesEnabled;
        confidenceThresholds = normalized(confidenceThresholds);
        financialLimits = normalized(financialLimits);
        currency = currency == null || currency.isBlank() ? "USD" : currency.trim().toUpperCase(Locale.ROOT);
        alwaysEscalate = alwaysEscalate == null ? DEFAULT_ALWAYS_ESCALATE : List.copyOf(alwaysEscalate);
        riskWeights = riskWeights == null ? Map.of() : Map.copyOf(riskWeights);

        requireProbability("confidenceThreshold", confidenceThreshold);
        if (userConfidenceThreshold != null) {
            requireProbability("userConfidenceThreshold", userConfidenceThreshold);
        }
        confidenceThresholds.forEach((domain, value) -> requireProbability("confidenceThresholds." + domain, value));
        requireNonNegative("autoApprovalLimit", autoApprovalLimit);
        if (userFinancialLimit != null) {
            requireNonNegative("userFinancialLimit", userFinancialLimit);
        }
        financialLimits.forEach((domain, value) -> requireNonNegative("financialLimits." + domain, value));
        if (maxReflectionAttempts < 0) {
            throw new PolicyConfigurationException("maxReflectionAttempts must be >= 0 but was " + maxReflectionAttempts);
        }
    }

    public static GuardianPolicyConfig defaults(int maxReflectionAttempts) {
        Map<String, Double> thresholds = new LinkedHashMap<>();
        thresholds.put("clear", 0.90);
        thresholds.put("complicated", 0.75);
        thresholds.put("complex", 0.60);
        thresholds.put("chaotic", 0.50);
        Map<String, Double> limits = new LinkedHashMap<>();
        limits.put("clear", 100_000.0);
        limits.put("complicated", 50_000.0);
        limits.put("complex", 25_000.0);
        limits.put("chaotic", 10_000.0);
        Map<String, Double> weights = new LinkedHashMap<>();
        weights.put("confidence", 0.30);
        weights.put("data_quality", 0.20);
        weights.put("refutation", 0.25);
        weights.put("policy", 0.25);
        return new GuardianPolicyConfig(thresholds, limits, DEFAULT_CONFIDENCE_THRESHOLD,
            DEFAULT_AUTO_APPROVAL_LIMIT, "USD", null, null,
            maxReflectionAttempts, DEFAULT_ALWAYS_ESCALATE, weights, false, true);
    }

    public double confidenceThresholdFor(String domain) {
        if (userConfidenceThreshold != null) {
            return userConfidenceThreshold;
        }
        return confidenceThresholds.getOrDefault(key(domain), confidenceThreshold);
    }

    public double financialLimitFor(String domain) {
        if (userFinancialLimit != null) {
            return userFinancialLimit;
        }
        return financialLimits.getOrDefault(key(domain), autoApprovalLimit);
    }

    /** Copy with the non-null fields of the patch applied. */
    public GuardianPolicyConfig withOverrides(Double financialLimit, Double confidence, Boolean strict) {
        return new GuardianPolicyConfig(confidenceThresholds, financialLimits, confidenceThreshold,
            autoApprovalLimit, currency,
            confidence != null ? confidence : userConfidenceThreshold,
            financialLimit != null ? financialLimit : userFinancialLimit,
            maxReflectionAttempts, alwaysEscalate, riskWeights,
            strict != null ? strict : strictMode,
            policiesEnabled);
    }

    private static String key(String domain) {
        return domain == null ? "" : domain.trim().toLowerCase(Locale.ROOT);
    }

    private static Map<String, Double> normalized(Map<String, Double> source) {
        if (source == null) {
            return Map.of();
        }
        Map<String, Double> out = new LinkedHashMap<>();
        source.forEach((domain, value) -> {
            if (value == null) {
                throw new PolicyConfigurationException("No value configured for domain '" + domain + "'");
            }
            out.put(key(domain), value);
        });
        return Collections.unmodifiableMap(out);
    }

    private static void requireProbability(String field, double value) {
        if (value < 0.0 || value > 1.0) {
            throw new PolicyConfigurationException(field + " must be within [0, 1] but was " + value);
        }
    }

    private static void requireNonNegative(String field, double value) {
        if (value < 0.0) {
            throw new PolicyConfigurationException(field + " must be >= 0 but was " + value);
        }
    }
}
