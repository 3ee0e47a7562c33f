package com.ryuqq.wsclient.testkit.contract;

import com.ryuqq.wsclient.core.model.PreparedRequest;
import com.ryuqq.wsclient.core.model.RawResponse;
import com.ryuqq.wsclient.core.spi.Transport;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentLinkedQueue;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * In-memory implementation of Transport for testing purposes.
 *
 * <p>Responses are served from a FIFO queue. When the queue is empty the default
 * response is returned. Every request is recorded as an immutable snapshot taken
 * at send time, so later mutations of the {@link PreparedRequest} are not visible.</p>
 *
 * <p><strong>Features:</strong></p>
 * <ul>
 *   <li>Queued responses (enqueue)</li>
 *   <li>Request recording (sentRequests, lastRequest)</li>
 *   <li>Failure injection (failWith)</li>
 *   <li>Close tracking (closeCount)</li>
 * </ul>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public class StubTransport implements Transport {

    private final ConcurrentLinkedQueue<RawResponse> responses;
    private final List<SentRequest> sent;
    private volatile RawResponse defaultResponse;
    private volatile RuntimeException failure;
    private final AtomicInteger closeCount = new AtomicInteger();

    /**
     * Creates a new StubTransport answering with the given default response.
     *
     * @param defaultResponse response used when the queue is empty
     */
    public StubTransport(RawResponse defaultResponse) {
        if (defaultResponse == null) {
            throw new IllegalArgumentException("defaultResponse cannot be null");
        }
        this.responses = new ConcurrentLinkedQueue<>();
        this.sent = new CopyOnWriteArrayList<>();
        this.defaultResponse = defaultResponse;
    }

    /**
     * {@inheritDoc}
     */
    @Override
    public RawResponse send(PreparedRequest request) {
        if (request == null) {
            throw new IllegalArgumentException("request cannot be null");
        }
        sent.add(SentRequest.of(request));
        RuntimeException error = failure;
        if (error != null) {
            throw error;
        }
        RawResponse next = responses.poll();
        return next != null ? next : defaultResponse;
    }

    /**
     * Queues a response for the next send.
     *
     * @param response the response to return
     */
    public void enqueue(RawResponse response) {
        if (response == null) {
            throw new IllegalArgumentException("response cannot be null");
        }
        responses.add(response);
    }

    public void setDefaultResponse(RawResponse defaultResponse) {
        if (defaultResponse == null) {
            throw new IllegalArgumentException("defaultResponse cannot be null");
        }
        this.defaultResponse = defaultResponse;
    }

    /**
     * Makes every subsequent send throw the given exception.
     *
     * @param failure the exception to throw, or null to stop failing
     */
    public void failWith(RuntimeException failure) {
        this.failure = failure;
    }

    public List<SentRequest> sentRequests() {
        return new ArrayList<>(sent);
    }

    public int sendCount() {
        return sent.size();
    }

    /**
     * Returns the most recent request.
     *
     * @return the last sent request
     * @throws IllegalStateException if nothing was sent
     */
    public SentRequest lastRequest() {
        if (sent.isEmpty()) {
            throw new IllegalStateException("No request was sent");
        }
        return sent.get(sent.size() - 1);
    }

    /**
     * Records the close. The stub keeps answering afterwards so callers can assert
     * that the client itself refuses further work.
     */
    @Override
    public void close() {
        closeCount.incrementAndGet();
    }

    public int closeCount() {
        return closeCount.get();
    }

    /**
     * Clears queued responses, recorded requests and failure injection.
     */
    public void clear() {
        responses.clear();
        sent.clear();
        failure = null;
    }

    /**
     * Snapshot of a request at the time it was handed to the transport.
     *
     * @param operationName operation name
     * @param endpoint target address
     * @param headers HTTP headers
     * @param body HTTP body
     */
    public record SentRequest(String operationName, String endpoint, Map<String, String> headers, String body) {

        static SentRequest of(PreparedRequest request) {
            return new SentRequest(
                request.getOperation().getName(),
                request.getEndpoint().toString(),
                Map.copyOf(request.resolveHeaders()),
                request.getBody()
            );
        }

        public String headerOrNull(String name) {
            for (Map.Entry<String, String> entry : headers.entrySet()) {
                if (entry.getKey().equalsIgnoreCase(name)) {
                    return entry.getValue();
                }
            }
            return null;
        }
    }
}
