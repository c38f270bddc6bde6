package com.guardianplatform.guardian.executor;

import com.guardianplatform.guardian.model.ActionReceipt;

import java.util.Map;

/**
 * Downstream side effect performed for an approved decision. Implementations are
 * synchronous; the dispatch service adapts them onto a worker scheduler.
 */
@FunctionalInterface
public interface ActionExecutor {

    ActionReceipt execute(Map<String, Object> state);
}
