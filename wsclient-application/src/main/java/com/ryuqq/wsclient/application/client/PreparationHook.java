package com.ryuqq.wsclient.application.client;

import com.ryuqq.wsclient.core.model.PreparedRequest;

/**
 * Hook invoked right after a request has been built during preparation.
 *
 * <p>The hook may mutate the request (body, headers, endpoint) before it is sent.
 * It runs exactly once, synchronously, on the preparing thread.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
@FunctionalInterface
public interface PreparationHook {

    /**
     * Pass number handed to the hook during preparation.
     */
    int INITIAL_PASS = 0;

    /**
     * Called with the freshly built request.
     *
     * @param pass always {@link #INITIAL_PASS}
     * @param request the prepared request
     */
    void afterBuild(int pass, PreparedRequest request);
}
