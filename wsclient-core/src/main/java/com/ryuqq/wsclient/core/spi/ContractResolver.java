package com.ryuqq.wsclient.core.spi;

import com.ryuqq.wsclient.core.config.ClientOptions;
import com.ryuqq.wsclient.core.model.Contract;

/**
 * Service contract resolution SPI.
 *
 * <p>Called exactly once per client, synchronously, while the client is being constructed.</p>
 *
 * <p><strong>Implementation Requirements:</strong></p>
 * <ul>
 *   <li>Apply each option (contract location, endpoint, namespace, adapter) only when it is present</li>
 *   <li>Explicit endpoint / namespace options take precedence over the values found in the document</li>
 *   <li>Without a contract location, return {@link Contract#withoutDocument}</li>
 *   <li>Failures propagate to the caller; the client is not created</li>
 * </ul>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public interface ContractResolver {

    /**
     * Resolves the service contract described by the options.
     *
     * @param options validated client options
     * @return the resolved contract (never null)
     * @throws com.ryuqq.wsclient.core.exception.ContractLoadException if the document cannot be loaded or parsed
     */
    Contract resolve(ClientOptions options);
}
