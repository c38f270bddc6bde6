package com.guardianplatform.guardian.controller;

import com.guardianplatform.common.model.Evaluation;
import com.guardianplatform.common.policy.RuleDefinition;
import com.guardianplatform.guardian.dto.EvaluateRequest;
import com.guardianplatform.guardian.dto.MutationResponse;
import com.guardianplatform.guardian.dto.PolicyView;
import com.guardianplatform.guardian.dto.RuleUpdateRequest;
import com.guardianplatform.guardian.dto.RuleView;
import com.guardianplatform.guardian.service.PolicyAdminService;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

import java.util.List;
import java.util.Map;

/**
 * Policy administration. Error statuses (404 unknown policy or rule, 409 duplicate rule,
 * 400 malformed definition) are mapped by {@link GuardianExceptionHandler}.
 */
@RestController
@RequestMapping("/api/v1/policies")
public class PolicyController {

    private final PolicyAdminService adminService;

    public PolicyController(PolicyAdminService adminService) {
        this.adminService = adminService;
    }

    @GetMapping
    public Mono<ResponseEntity<List<PolicyView>>> listPolicies() {
        return Mono.fromCallable(() -> adminService.listPolicies().stream().map(PolicyView::from).toList())
            .map(ResponseEntity::ok);
    }

    @GetMapping("/{name}")
    public Mono<ResponseEntity<PolicyView>> getPolicy(@PathVariable String name) {
        return Mono.fromCallable(() -> PolicyView.from(adminService.getPolicy(name)))
            .map(ResponseEntity::ok);
    }

    @PostMapping("/{name}/rules")
    public Mono<ResponseEntity<MutationResponse>> addRule(@PathVariable String name,
                                                          @RequestBody RuleDefinition definition) {
        return Mono.fromCallable(() -> RuleView.from(adminService.addRule(name, definition)))
            .subscribeOn(Schedulers.boundedElastic())
            .map(rule -> ResponseEntity.status(HttpStatus.CREATED)
                .body(new MutationResponse("created", "Rule " + rule.name() + " added to " + name, rule)));
    }

    @PutMapping("/{name}/rules/{ruleName}")
    public Mono<ResponseEntity<MutationResponse>> updateRule(@PathVariable String name,
                                                             @PathVariable String ruleName,
                                                             @RequestBody RuleUpdateRequest request) {
        return Mono.fromCallable(() -> RuleView.from(
                adminService.updateRule(name, ruleName, request.constraint(), request.message())))
            .subscribeOn(Schedulers.boundedElastic())
            .map(rule -> ResponseEntity.ok(new MutationResponse("updated", "Rule " + ruleName + " updated", rule)));
    }

    @DeleteMapping("/{name}/rules/{ruleName}")
    public Mono<ResponseEntity<MutationResponse>> deleteRule(@PathVariable String name,
                                                             @PathVariable String ruleName) {
        return Mono.fromRunnable(() -> adminService.deleteRule(name, ruleName))
            .subscribeOn(Schedulers.boundedElastic())
            .then(Mono.fromSupplier(() -> ResponseEntity.ok(
                new MutationResponse("deleted", "Rule " + ruleName + " deleted from " + name, null))));
    }

    @PostMapping("/reload")
    public Mono<ResponseEntity<Map<String, Object>>> reload() {
        return Mono.fromCallable(adminService::reload)
            .subscribeOn(Schedulers.boundedElastic())
            .map(registry -> ResponseEntity.ok(Map.<String, Object>of(
                "status", "reloaded",
                "policies", registry.policyCount(),
                "rules", registry.ruleCount())));
    }

    @PostMapping("/evaluate")
    public Mono<ResponseEntity<Evaluation>> evaluate(@RequestBody EvaluateRequest request) {
        Map<String, Object> context = request.context() != null ? request.context() : Map.of();
        return Mono.fromCallable(() -> adminService.testEvaluate(request.policyName(), context))
            .subscribeOn(Schedulers.boundedElastic())
            .map(ResponseEntity::ok);
    }
}
