package com.ryuqq.wsclient.core.spi;

import com.ryuqq.wsclient.core.model.PreparedRequest;
import com.ryuqq.wsclient.core.model.RawResponse;

/**
 * HTTP execution SPI.
 *
 * <p>Blocks the calling thread until the exchange completes. Timeouts and cancellation are
 * properties of the implementation; the client does not retry.</p>
 *
 * <p><strong>Implementation Requirements:</strong></p>
 * <ul>
 *   <li>Thread-safe: the same transport serves every request of a client</li>
 *   <li>Send the request as prepared: endpoint, {@link PreparedRequest#resolveHeaders()} and body,
 *       resolved at send time</li>
 *   <li>Non-2xx statuses are returned, not thrown</li>
 *   <li>{@link #close()} releases resources the transport owns and is idempotent</li>
 * </ul>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public interface Transport extends AutoCloseable {

    /**
     * Sends the request and returns the raw response.
     *
     * @param request the prepared request
     * @return the raw response
     * @throws com.ryuqq.wsclient.core.exception.TransportException if no response could be obtained
     */
    RawResponse send(PreparedRequest request);

    /**
     * Releases owned resources (connection pools). No-op by default.
     */
    @Override
    default void close() {
    }
}
