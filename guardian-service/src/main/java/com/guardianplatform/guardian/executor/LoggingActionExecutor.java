package com.guardianplatform.guardian.executor;

import com.guardianplatform.common.context.DecisionStateContextMapper;
import com.guardianplatform.guardian.model.ActionReceipt;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.util.Map;
import java.util.UUID;

/**
 * Default executor: records the dispatch in the log and acknowledges it. Deployments
 * with a real downstream system provide their own {@link ActionExecutor} bean.
 */
@Component
public class LoggingActionExecutor implements ActionExecutor {

    private static final Logger log = LoggerFactory.getLogger(LoggingActionExecutor.class);

    static final String DISPATCHED = "DISPATCHED";

    @Override
    public ActionReceipt execute(Map<String, Object> state) {
        Object action = state.get(DecisionStateContextMapper.PROPOSED_ACTION);
        String actionType = action instanceof Map<?, ?> m && m.get("actionType") != null
            ? String.valueOf(m.get("actionType"))
            : "unknown";
        ActionReceipt receipt = new ActionReceipt(UUID.randomUUID().toString(), actionType,
            DISPATCHED, Instant.now());
        log.info("[ActionDispatch] Action dispatched. actionId={} actionType={}", receipt.actionId(), actionType);
        return receipt;
    }
}
