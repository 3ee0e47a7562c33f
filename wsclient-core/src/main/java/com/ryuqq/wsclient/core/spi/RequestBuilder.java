package com.ryuqq.wsclient.core.spi;

import com.ryuqq.wsclient.core.model.Locals;
import com.ryuqq.wsclient.core.model.Operation;
import com.ryuqq.wsclient.core.model.PreparedRequest;
import com.ryuqq.wsclient.core.model.TransportState;

/**
 * Turns an operation and its call parameters into a transport-ready request.
 *
 * <p><strong>Implementation Requirements:</strong></p>
 * <ul>
 *   <li>Stateless: called concurrently from many threads</li>
 *   <li>The given {@link TransportState} is already an isolated copy; the returned request owns it</li>
 *   <li>Operation existence is validated here, not when the {@link Operation} is created</li>
 * </ul>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public interface RequestBuilder {

    /**
     * Builds the request.
     *
     * @param operation the operation to invoke
     * @param locals per-call options
     * @param transportState isolated transport state for this request
     * @return a prepared, not yet sent, request
     * @throws com.ryuqq.wsclient.core.exception.UnknownOperationException if the contract has a document
     *         that does not declare the operation
     */
    PreparedRequest build(Operation operation, Locals locals, TransportState transportState);
}
