package com.guardianplatform.common.context;

import com.guardianplatform.common.exception.ContextMappingException;

import java.util.Map;

/**
 * Flattens an upstream decision state into the evaluation namespace
 * ({@code domain, action, user, risk, approval, prediction, data, session}).
 *
 * <p>The engine depends only on the shape of the returned map, never on the state
 * object itself. Implementations must be pure.
 *
 * @param <S> upstream state type
 */
@FunctionalInterface
public interface StateContextMapper<S> {

    /**
     * @throws ContextMappingException when the state cannot be mapped
     */
    Map<String, Object> toContext(S state);
}
