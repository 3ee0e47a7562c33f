package com.ryuqq.wsclient.adapter.wsdl;

import com.ryuqq.wsclient.core.config.HttpSettings;
import com.ryuqq.wsclient.core.spi.DocumentLoader;

import java.util.Locale;

/**
 * 위치 형식에 따라 로더를 선택.
 *
 * <p>{@code http://}, {@code https://} 위치는 원격 로더로, 나머지는 로컬 로더로 위임합니다.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public final class RoutingDocumentLoader implements DocumentLoader {

    private final DocumentLoader local;
    private final DocumentLoader remote;

    public RoutingDocumentLoader(DocumentLoader local, DocumentLoader remote) {
        if (local == null) {
            throw new IllegalArgumentException("local cannot be null");
        }
        if (remote == null) {
            throw new IllegalArgumentException("remote cannot be null");
        }
        this.local = local;
        this.remote = remote;
    }

    @Override
    public String load(String location, HttpSettings http) {
        if (location == null) {
            throw new IllegalArgumentException("location cannot be null");
        }
        String lower = location.trim().toLowerCase(Locale.ROOT);
        if (lower.startsWith("http://") || lower.startsWith("https://")) {
            return remote.load(location.trim(), http);
        }
        return local.load(location, http);
    }
}
