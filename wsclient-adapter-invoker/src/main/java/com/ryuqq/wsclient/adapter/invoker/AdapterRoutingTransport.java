package com.ryuqq.wsclient.adapter.invoker;

import com.ryuqq.wsclient.core.model.PreparedRequest;
import com.ryuqq.wsclient.core.model.RawResponse;
import com.ryuqq.wsclient.core.spi.Transport;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * {@code adapter} 옵션에 따라 Transport를 선택.
 *
 * <p>옵션이 없으면 {@value #DEFAULT_ADAPTER}를 사용합니다. close는 등록된 Transport 전체에 전달됩니다.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public final class AdapterRoutingTransport implements Transport {

    public static final String DEFAULT_ADAPTER = "httpclient5";

    private final Map<String, Transport> transports;

    public AdapterRoutingTransport(Map<String, Transport> transports) {
        if (transports == null || transports.isEmpty()) {
            throw new IllegalArgumentException("transports cannot be null or empty");
        }
        this.transports = new LinkedHashMap<>(transports);
    }

    @Override
    public RawResponse send(PreparedRequest request) {
        if (request == null) {
            throw new IllegalArgumentException("request cannot be null");
        }
        String adapter = request.options().adapter().orElse(DEFAULT_ADAPTER);
        Transport transport = transports.get(adapter);
        if (transport == null) {
            throw new IllegalArgumentException(
                "Unknown HTTP adapter: " + adapter + " (available: " + transports.keySet() + ")");
        }
        return transport.send(request);
    }

    /**
     * 등록된 모든 Transport 종료.
     */
    @Override
    public void close() {
        RuntimeException failure = null;
        for (Transport transport : transports.values()) {
            try {
                transport.close();
            } catch (RuntimeException e) {
                if (failure == null) {
                    failure = e;
                } else {
                    failure.addSuppressed(e);
                }
            }
        }
        if (failure != null) {
            throw failure;
        }
    }
}
