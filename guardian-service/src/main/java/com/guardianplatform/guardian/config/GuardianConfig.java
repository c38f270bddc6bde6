package com.guardianplatform.guardian.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import com.guardianplatform.common.context.DecisionStateContextMapper;
import com.guardianplatform.common.guard.GuardMode;
import com.guardianplatform.common.guard.ToolGuard;
import com.guardianplatform.common.policy.BuiltInPolicies;
import com.guardianplatform.common.policy.EngineSettings;
import com.guardianplatform.common.policy.PolicyEvaluationEngine;
import com.guardianplatform.common.policy.PolicyRegistryHolder;
import com.guardianplatform.guardian.ai.AnthropicLanguageModelClient;
import com.guardianplatform.guardian.ai.LanguageModelClient;
import com.guardianplatform.guardian.service.PolicyEvaluationService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.reactive.function.client.WebClient;

import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Set;

@Configuration
public class GuardianConfig {

    private static final Logger log = LoggerFactory.getLogger(GuardianConfig.class);

    @Value("${guardian.policy.enabled:true}")
    private boolean policyEnabled;

    @Value("${guardian.policy.fail-closed:true}")
    private boolean failClosed;

    @Value("${guardian.policy.audit-enabled:true}")
    private boolean auditEnabled;

    @Value("${guardian.guard.mode:enforce}")
    private String guardMode;

    @Value("${guardian.guard.policies:}")
    private String guardPolicies;

    @Value("${guardian.guard.max-audit:1000}")
    private int guardMaxAudit;

    @Value("${anthropic.base-url:https://api.anthropic.com}")
    private String anthropicBaseUrl;

    @Value("${anthropic.api-key:}")
    private String anthropicApiKey;

    @Value("${anthropic.model:claude-3-5-haiku-20241022}")
    private String anthropicModel;

    @Value("${anthropic.max-tokens:1024}")
    private int anthropicMaxTokens;

    @Bean
    public ObjectMapper objectMapper() {
        ObjectMapper mapper = new ObjectMapper();
        mapper.registerModule(new JavaTimeModule());
        mapper.disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
        return mapper;
    }

    /** Built-in set compiled once at start; a malformed definition fails startup. */
    @Bean
    public PolicyRegistryHolder policyRegistryHolder() {
        PolicyRegistryHolder holder = new PolicyRegistryHolder(BuiltInPolicies.load());
        log.info("[PolicyConfig] Loaded {} policies with {} rules",
            holder.current().policyCount(), holder.current().ruleCount());
        return holder;
    }

    @Bean
    public PolicyEvaluationEngine policyEvaluationEngine(PolicyRegistryHolder registry) {
        EngineSettings settings = new EngineSettings(policyEnabled, failClosed, auditEnabled);
        log.info("[PolicyConfig] Engine settings enabled={} failClosed={} auditEnabled={}",
            settings.enabled(), settings.failClosed(), settings.auditEnabled());
        return new PolicyEvaluationEngine(registry, settings);
    }

    @Bean
    public DecisionStateContextMapper decisionStateContextMapper() {
        return new DecisionStateContextMapper();
    }

    @Bean
    public ToolGuard<Map<String, Object>> actionToolGuard(PolicyEvaluationService evaluationService) {
        Set<String> policies = new LinkedHashSet<>();
        for (String name : guardPolicies.split(",")) {
            if (!name.isBlank()) {
                policies.add(name.trim());
            }
        }
        GuardMode mode = GuardMode.fromValue(guardMode);
        log.info("[ToolGuard] Configured mode={} policies={} maxAudit={}",
            mode.value(), policies.isEmpty() ? "all" : policies, guardMaxAudit);
        return new ToolGuard<>(mode, policies, guardMaxAudit, evaluationService::evaluateState);
    }

    @Bean
    public WebClient anthropicClient(WebClient.Builder builder) {
        return builder.baseUrl(anthropicBaseUrl).build();
    }

    @Bean
    public LanguageModelClient languageModelClient(WebClient anthropicClient, ObjectMapper objectMapper) {
        return new AnthropicLanguageModelClient(anthropicClient, objectMapper,
            anthropicApiKey, anthropicModel, anthropicMaxTokens);
    }
}
