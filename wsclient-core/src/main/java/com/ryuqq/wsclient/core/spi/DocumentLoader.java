package com.ryuqq.wsclient.core.spi;

import com.ryuqq.wsclient.core.config.HttpSettings;

/**
 * Loads a service description document from a location.
 *
 * <p>Locations may be local (file path, {@code file:} or {@code classpath:} URI, inline XML)
 * or remote (http/https). Remote loaders honor the timeouts and credentials of the given settings.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public interface DocumentLoader {

    /**
     * Loads the raw document.
     *
     * @param location document location
     * @param http HTTP settings for remote locations
     * @return the document text
     * @throws com.ryuqq.wsclient.core.exception.ContractLoadException if the document cannot be read
     */
    String load(String location, HttpSettings http);
}
