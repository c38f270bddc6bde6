package com.guardianplatform.guardian.controller;

import com.guardianplatform.common.exception.DuplicateRuleException;
import com.guardianplatform.common.exception.PolicyConfigurationException;
import com.guardianplatform.common.exception.PolicyNotFoundException;
import com.guardianplatform.common.exception.PolicyViolationException;
import com.guardianplatform.common.exception.RuleNotFoundException;
import com.guardianplatform.common.model.RuleResult;
import com.guardianplatform.guardian.dto.ErrorResponse;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.bind.annotation.RestControllerAdvice;

import java.util.List;

/** Maps guardian exceptions raised by the REST layer to HTTP statuses and JSON bodies. */
@RestControllerAdvice(annotations = RestController.class)
public class GuardianExceptionHandler {

    private static final Logger log = LoggerFactory.getLogger(GuardianExceptionHandler.class);

    @ExceptionHandler({PolicyNotFoundException.class, RuleNotFoundException.class})
    public ResponseEntity<ErrorResponse> handleNotFound(RuntimeException ex) {
        return ResponseEntity.status(HttpStatus.NOT_FOUND).body(ErrorResponse.of("not_found", ex.getMessage()));
    }

    @ExceptionHandler(DuplicateRuleException.class)
    public ResponseEntity<ErrorResponse> handleDuplicate(DuplicateRuleException ex) {
        return ResponseEntity.status(HttpStatus.CONFLICT).body(ErrorResponse.of("conflict", ex.getMessage()));
    }

    @ExceptionHandler(PolicyConfigurationException.class)
    public ResponseEntity<ErrorResponse> handleInvalidDefinition(PolicyConfigurationException ex) {
        return ResponseEntity.badRequest().body(ErrorResponse.of("invalid_definition", ex.getMessage()));
    }

    @ExceptionHandler(PolicyViolationException.class)
    public ResponseEntity<ErrorResponse> handleViolation(PolicyViolationException ex) {
        List<String> violations = ex.getEvaluation() == null
            ? List.of()
            : ex.getEvaluation().violations().stream().map(RuleResult::message).toList();
        log.info("[GuardianApi] Dispatch blocked. violations={}", violations);
        return ResponseEntity.status(HttpStatus.FORBIDDEN)
            .body(new ErrorResponse("policy_violation", ex.getMessage(), violations));
    }
}
