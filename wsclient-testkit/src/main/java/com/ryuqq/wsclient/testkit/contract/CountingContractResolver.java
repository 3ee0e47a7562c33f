package com.ryuqq.wsclient.testkit.contract;

import com.ryuqq.wsclient.core.config.ClientOptions;
import com.ryuqq.wsclient.core.model.Contract;
import com.ryuqq.wsclient.core.spi.ContractResolver;

import java.util.concurrent.atomic.AtomicInteger;

/**
 * ContractResolver decorator that counts resolutions.
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public class CountingContractResolver implements ContractResolver {

    private final ContractResolver delegate;
    private final AtomicInteger resolutions = new AtomicInteger();

    public CountingContractResolver(ContractResolver delegate) {
        if (delegate == null) {
            throw new IllegalArgumentException("delegate cannot be null");
        }
        this.delegate = delegate;
    }

    /**
     * {@inheritDoc}
     */
    @Override
    public Contract resolve(ClientOptions options) {
        resolutions.incrementAndGet();
        return delegate.resolve(options);
    }

    public int resolutionCount() {
        return resolutions.get();
    }
}
